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
import java.util.List;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.axes.AxisMetadata;
import org.apache.commons.lang3.ArrayUtils;

/**
 * A chain of transforms applied as one. Members are listed outermost first and applied last to
 * first, like function composition. The ensemble axes of the chain are the ensemble axes of the
 * members in list order.
 *
 * <p>Only the outermost member may have several outputs or add extra axes; every other member must
 * map one object to one object of the same ensemble layout plus its own ensemble axes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CompositeTransform implements ArrayObjectTransform {

  private final List<ArrayObjectTransform> transforms;

  /**
   * Constructor for CompositeTransform.
   *
   * @param transforms the members, outermost first.
   */
  public CompositeTransform(List<? extends ArrayObjectTransform> transforms) {
    if (transforms.isEmpty()) {
      throw new IllegalArgumentException(" A composite transform requires at least one member.");
    }
    for (int i = 1; i < transforms.size(); i++) {
      if (transforms.get(i).getNumOutputs() != 1) {
        throw new IllegalArgumentException(
            format(" Member %d of a composite transform has %d outputs.", i,
                transforms.get(i).getNumOutputs()));
      }
    }
    this.transforms = Collections.unmodifiableList(new ArrayList<>(transforms));
  }

  /**
   * Constructor for CompositeTransform.
   *
   * @param transforms the members, outermost first.
   */
  public CompositeTransform(ArrayObjectTransform... transforms) {
    this(Arrays.asList(transforms));
  }

  public List<ArrayObjectTransform> getTransforms() {
    return transforms;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    List<AxisMetadata> axes = new ArrayList<>();
    for (ArrayObjectTransform t : transforms) {
      axes.addAll(t.getEnsembleAxesMetadata());
    }
    return axes;
  }

  @Override
  public int[] getEnsembleShape() {
    int[] shape = new int[0];
    for (ArrayObjectTransform t : transforms) {
      shape = ArrayUtils.addAll(shape, t.getEnsembleShape());
    }
    return shape;
  }

  @Override
  public int[] getDefaultEnsembleChunks() {
    int[] chunks = new int[0];
    for (ArrayObjectTransform t : transforms) {
      chunks = ArrayUtils.addAll(chunks, t.getDefaultEnsembleChunks());
    }
    return chunks;
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    PartitionedArgs args = PartitionedArgs.empty();
    int offset = 0;
    for (ArrayObjectTransform t : transforms) {
      int n = t.getEnsembleShape().length;
      args = args.concat(t.partitionArgs(Arrays.copyOfRange(chunks, offset, offset + n)));
      offset += n;
    }
    return args;
  }

  @Override
  public ArrayObjectTransform fromPartitionedArgs(Object... args) {
    List<ArrayObjectTransform> blocks = new ArrayList<>(transforms.size());
    int offset = 0;
    for (ArrayObjectTransform t : transforms) {
      int n = t.getEnsembleShape().length;
      blocks.add(t.fromPartitionedArgs(Arrays.copyOfRange(args, offset, offset + n)));
      offset += n;
    }
    return new CompositeTransform(blocks);
  }

  @Override
  public int getNumOutputs() {
    return transforms.get(0).getNumOutputs();
  }

  @Override
  public int getExtraAxesPosition() {
    return transforms.get(0).getExtraAxesPosition();
  }

  @Override
  public OutputSpecification getOutputSpecification(ArrayObject template, int output) {
    return transforms.get(0).getOutputSpecification(applyInner(template), output);
  }

  private ArrayObject applyInner(ArrayObject template) {
    ArrayObject current = template;
    for (int i = transforms.size() - 1; i >= 1; i--) {
      ArrayObjectTransform t = transforms.get(i);
      OutputSpecification spec = t.getOutputSpecification(current, 0);
      if (spec.getExtraShape().length > 0) {
        throw new IllegalArgumentException(
            format(" Member %d of a composite transform adds extra axes.", i));
      }
      current = spec.template(current, t);
    }
    return current;
  }

  @Override
  public List<ArrayData> calculateNewArrays(ArrayObject input) {
    ArrayObject current = input;
    for (int i = transforms.size() - 1; i >= 1; i--) {
      current = transforms.get(i).apply(current).get(0);
    }
    return transforms.get(0).calculateNewArrays(current);
  }
}
