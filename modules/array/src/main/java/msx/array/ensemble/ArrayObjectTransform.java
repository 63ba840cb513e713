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

import java.util.ArrayList;
import java.util.List;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.BackingArray;

/**
 * An ensemble of operations that maps an ArrayObject to one or more new ArrayObjects.
 *
 * <p>For an input with ensemble shape I and a transform with ensemble shape T, output i has the
 * ensemble shape T[0..p) ++ X_i ++ T[p..) ++ I, where X_i are extra axes added by the transform
 * (for example the exit-plane thickness axis) and p is {@link #getExtraAxesPosition()}. The base
 * shape of each output is given by its {@link OutputSpecification}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ArrayObjectTransform extends Ensemble {

  /**
   * The number of outputs.
   *
   * @return 1 by default.
   */
  default int getNumOutputs() {
    return 1;
  }

  /**
   * Position of the extra output axes among the transform's ensemble axes.
   *
   * @return the number of transform ensemble axes that precede the extra axes.
   */
  default int getExtraAxesPosition() {
    return getEnsembleShape().length;
  }

  /**
   * Describe an output without computing it.
   *
   * @param template an object with the shape and metadata of the input.
   * @param output   the output index.
   * @return the output specification.
   */
  OutputSpecification getOutputSpecification(ArrayObject template, int output);

  /**
   * The transform restricted to one block of its ensemble.
   *
   * @param args the block arguments, one per ensemble axis.
   * @return the restricted transform.
   */
  ArrayObjectTransform fromPartitionedArgs(Object... args);

  /**
   * Compute the output arrays for an eager input. Must not modify the input.
   *
   * @param input the input object.
   * @return one array per output.
   */
  List<ArrayData> calculateNewArrays(ArrayObject input);

  /**
   * Apply the transform to an eager input.
   *
   * @param input the input object.
   * @return one object per output.
   */
  default List<ArrayObject> apply(ArrayObject input) {
    List<ArrayData> arrays = calculateNewArrays(input);
    List<ArrayObject> outputs = new ArrayList<>(arrays.size());
    for (int i = 0; i < arrays.size(); i++) {
      OutputSpecification spec = getOutputSpecification(input, i);
      outputs.add(spec.pack(BackingArray.of(arrays.get(i)), getEnsembleAxesMetadata(),
          getExtraAxesPosition(), input.getEnsembleAxesMetadata(), input.getDevice()));
    }
    return outputs;
  }
}
