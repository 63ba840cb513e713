// ******************************************************************************
//
// Title:       Multislice X.
// Description: Multislice X - Software for Electron Scattering Simulation.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Multislice X.
//
// Multislice X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Multislice X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Multislice X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package msx.array.ensemble;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.ArrayObject;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.Chunks;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.lazy.LazyArray;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Everything needed to describe the output of a transform before it is computed: its kind, extra
 * ensemble axes, base shape and axes, element type and scalar metadata.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class OutputSpecification {

  private final ArrayObjectType type;
  private final int[] extraShape;
  private final List<AxisMetadata> extraAxes;
  private final int[] baseShape;
  private final List<AxisMetadata> baseAxes;
  private final DataType dataType;
  private final Map<String, Object> metadata;

  /**
   * Constructor for OutputSpecification.
   *
   * @param type       the kind of the output.
   * @param extraShape shape of the extra ensemble axes.
   * @param extraAxes  metadata of the extra ensemble axes.
   * @param baseShape  the base shape.
   * @param baseAxes   metadata of the base axes.
   * @param dataType   the element type.
   * @param metadata   scalar metadata.
   */
  public OutputSpecification(ArrayObjectType type, int[] extraShape,
      List<AxisMetadata> extraAxes, int[] baseShape, List<AxisMetadata> baseAxes,
      DataType dataType, Map<String, Object> metadata) {
    if (extraShape.length != extraAxes.size()) {
      throw new IllegalArgumentException(" One metadata entry is required per extra axis.");
    }
    if (baseShape.length != baseAxes.size() || baseShape.length != type.getBaseDims()) {
      throw new IllegalArgumentException(format(" Base shape %s does not fit a %s.",
          Arrays.toString(baseShape), type.getTag()));
    }
    this.type = type;
    this.extraShape = extraShape.clone();
    this.extraAxes = Collections.unmodifiableList(new ArrayList<>(extraAxes));
    this.baseShape = baseShape.clone();
    this.baseAxes = Collections.unmodifiableList(new ArrayList<>(baseAxes));
    this.dataType = dataType;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * An output without extra axes.
   *
   * @param type      the kind of the output.
   * @param baseShape the base shape.
   * @param baseAxes  metadata of the base axes.
   * @param dataType  the element type.
   * @param metadata  scalar metadata.
   */
  public OutputSpecification(ArrayObjectType type, int[] baseShape, List<AxisMetadata> baseAxes,
      DataType dataType, Map<String, Object> metadata) {
    this(type, new int[0], Collections.emptyList(), baseShape, baseAxes, dataType, metadata);
  }

  public ArrayObjectType getType() {
    return type;
  }

  public int[] getExtraShape() {
    return extraShape.clone();
  }

  public List<AxisMetadata> getExtraAxes() {
    return extraAxes;
  }

  public int[] getBaseShape() {
    return baseShape.clone();
  }

  public List<AxisMetadata> getBaseAxes() {
    return baseAxes;
  }

  public DataType getDataType() {
    return dataType;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /**
   * Wrap computed (or lazy) storage as an output object.
   *
   * @param array          the storage.
   * @param transformAxes  ensemble axes of the transform.
   * @param extraPosition  position of the extra axes among the transform axes.
   * @param inputAxes      ensemble axes of the input.
   * @param device         the device.
   * @return the output object.
   */
  public ArrayObject pack(BackingArray array, List<AxisMetadata> transformAxes, int extraPosition,
      List<AxisMetadata> inputAxes, Device device) {
    List<AxisMetadata> axes = new ArrayList<>(transformAxes.subList(0, extraPosition));
    axes.addAll(extraAxes);
    axes.addAll(transformAxes.subList(extraPosition, transformAxes.size()));
    axes.addAll(inputAxes);
    axes.addAll(baseAxes);
    return type.create(array, axes, metadata, device);
  }

  /**
   * An uncomputable stand-in with the shape and metadata of the output of a transform applied to
   * an input. Used to describe chained transforms.
   *
   * @param input     the input (or its template).
   * @param transform the transform.
   * @return the template object.
   */
  public ArrayObject template(ArrayObject input, ArrayObjectTransform transform) {
    int[] t = transform.getEnsembleShape();
    int p = transform.getExtraAxesPosition();
    int[] shape = ArrayUtils.addAll(Arrays.copyOfRange(t, 0, p), extraShape);
    shape = ArrayUtils.addAll(shape, Arrays.copyOfRange(t, p, t.length));
    shape = ArrayUtils.addAll(shape, input.getEnsembleShape());
    shape = ArrayUtils.addAll(shape, baseShape);
    return pack(BackingArray.of(placeholder(shape)), transform.getEnsembleAxesMetadata(), p,
        input.getEnsembleAxesMetadata(), input.getDevice());
  }

  /**
   * An uncomputable stand-in without ensemble axes.
   *
   * @param device the device.
   * @return the template object.
   */
  public ArrayObject template(Device device) {
    return pack(BackingArray.of(placeholder(baseShape)), Collections.emptyList(), 0,
        Collections.emptyList(), device);
  }

  private LazyArray placeholder(int[] shape) {
    return LazyArray.fromBlocks(Chunks.single(shape), dataType, (index, start, blockShape) -> {
      throw new IllegalStateException(" A template array cannot be computed.");
    });
  }
}
