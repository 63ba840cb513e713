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
package msx.waves;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.ensemble.ArrayObjectTransform;
import msx.array.ensemble.OutputSpecification;
import msx.array.ensemble.PartitionedArgs;
import org.apache.commons.lang3.ArrayUtils;

/**
 * A series of beam tilts. Every combination of a tilt along x and a tilt along y adds one item to
 * the ensemble; the tilts are recorded as ordinal axes and applied during propagation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BeamTilt implements ArrayObjectTransform {

  /** Label of the axis of tilts along x. */
  public static final String TILT_X_LABEL = "tilt_x";
  /** Label of the axis of tilts along y. */
  public static final String TILT_Y_LABEL = "tilt_y";

  private final List<Double> tiltX;
  private final List<Double> tiltY;

  /**
   * Constructor for BeamTilt.
   *
   * @param tiltX the tilts along x [mrad].
   * @param tiltY the tilts along y [mrad].
   */
  public BeamTilt(List<Double> tiltX, List<Double> tiltY) {
    this.tiltX = Collections.unmodifiableList(new ArrayList<>(tiltX));
    this.tiltY = Collections.unmodifiableList(new ArrayList<>(tiltY));
  }

  /**
   * Tilts along x only.
   *
   * @param tiltX the tilts along x [mrad].
   * @return the BeamTilt.
   */
  public static BeamTilt alongX(double... tiltX) {
    return new BeamTilt(Arrays.asList(ArrayUtils.toObject(tiltX)), Collections.singletonList(0.0));
  }

  public List<Double> getTiltX() {
    return tiltX;
  }

  public List<Double> getTiltY() {
    return tiltY;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    List<AxisMetadata> axes = new ArrayList<>(2);
    axes.add(new OrdinalAxis(TILT_X_LABEL, "mrad", tiltX, false, false));
    axes.add(new OrdinalAxis(TILT_Y_LABEL, "mrad", tiltY, false, false));
    return axes;
  }

  @Override
  public int[] getEnsembleShape() {
    return new int[] {tiltX.size(), tiltY.size()};
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return PartitionedArgs.of(tiltX, chunks[0]).concat(PartitionedArgs.of(tiltY, chunks[1]));
  }

  @Override
  @SuppressWarnings("unchecked")
  public BeamTilt fromPartitionedArgs(Object... args) {
    return new BeamTilt((List<Double>) args[0], (List<Double>) args[1]);
  }

  @Override
  public OutputSpecification getOutputSpecification(ArrayObject template, int output) {
    return new OutputSpecification(template.getType(), template.getBaseShape(),
        template.getBaseAxesMetadata(), template.getDataType(), template.getMetadata());
  }

  @Override
  public List<ArrayData> calculateNewArrays(ArrayObject input) {
    ArrayData array = input.getArray();
    int copies = tiltX.size() * tiltY.size();
    double[] source = array.getData();
    double[] data = new double[copies * source.length];
    for (int i = 0; i < copies; i++) {
      System.arraycopy(source, 0, data, i * source.length, source.length);
    }
    int[] shape = ArrayUtils.addAll(getEnsembleShape(), array.getShape());
    return Collections.singletonList(ArrayData.wrap(array.getDataType(), data, shape));
  }
}
