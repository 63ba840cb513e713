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
package msx.array.lazy;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import msx.array.ArrayData;

/**
 * Stacks lazy arrays along a new axis or concatenates them along an existing one. Inputs are
 * rechunked to the layout of the first input along every other axis.
 */
final class JoinedArray extends LazyArray {

  private final List<LazyArray> inputs;
  private final int axis;
  private final boolean stack;
  private final int[] inputOfBlock;
  private final int[] localBlock;

  static JoinedArray create(List<LazyArray> arrays, int axis, boolean stack) {
    int a = normalize(arrays, axis, stack);
    return new JoinedArray(align(arrays, a, stack), a, stack);
  }

  private JoinedArray(List<LazyArray> inputs, int axis, boolean stack) {
    super(outputChunks(inputs, axis, stack), inputs.get(0).getDataType());
    this.inputs = inputs;
    this.axis = axis;
    this.stack = stack;
    List<Integer> input = new ArrayList<>();
    List<Integer> local = new ArrayList<>();
    for (int k = 0; k < inputs.size(); k++) {
      if (stack) {
        input.add(k);
        local.add(0);
      } else {
        int[] c = inputs.get(k).chunksOf(axis);
        for (int j = 0; j < c.length; j++) {
          if (c[j] > 0) {
            input.add(k);
            local.add(j);
          }
        }
      }
    }
    this.inputOfBlock = input.stream().mapToInt(Integer::intValue).toArray();
    this.localBlock = local.stream().mapToInt(Integer::intValue).toArray();
  }

  private static int normalize(List<LazyArray> arrays, int axis, boolean stack) {
    if (arrays.isEmpty()) {
      throw new IllegalArgumentException(" Cannot join an empty list of arrays.");
    }
    int rank = arrays.get(0).getRank() + (stack ? 1 : 0);
    int a = axis < 0 ? axis + rank : axis;
    if (a < 0 || a >= rank) {
      throw new IllegalArgumentException(format(" Invalid axis %d for rank %d.", axis, rank));
    }
    return a;
  }

  private static List<LazyArray> align(List<LazyArray> arrays, int axis, boolean stack) {
    LazyArray first = arrays.get(0);
    int[] shape = first.getShape();
    List<LazyArray> aligned = new ArrayList<>(arrays.size());
    for (LazyArray array : arrays) {
      int[] s = array.getShape();
      if (array.getDataType() != first.getDataType() || s.length != shape.length) {
        throw new IllegalArgumentException(" Cannot join arrays of different rank or type.");
      }
      int[][] chunks = array.getChunks();
      for (int i = 0; i < shape.length; i++) {
        if (stack || i != axis) {
          if (s[i] != shape[i]) {
            throw new IllegalArgumentException(format(" Cannot join shapes %s and %s.",
                Arrays.toString(shape), Arrays.toString(s)));
          }
          chunks[i] = first.chunksOf(i).clone();
        }
      }
      aligned.add(array.rechunk(chunks));
    }
    return aligned;
  }

  private static int[][] outputChunks(List<LazyArray> inputs, int axis, boolean stack) {
    LazyArray first = inputs.get(0);
    int rank = first.getRank() + (stack ? 1 : 0);
    int[][] chunks = new int[rank][];
    int j = 0;
    for (int i = 0; i < rank; i++) {
      if (i == axis) {
        if (stack) {
          chunks[i] = new int[inputs.size()];
          Arrays.fill(chunks[i], 1);
          continue;
        }
        List<Integer> sizes = new ArrayList<>();
        for (LazyArray input : inputs) {
          for (int c : input.chunksOf(axis)) {
            if (c > 0) {
              sizes.add(c);
            }
          }
        }
        if (sizes.isEmpty()) {
          sizes.add(0);
        }
        chunks[i] = sizes.stream().mapToInt(Integer::intValue).toArray();
        j++;
      } else {
        chunks[i] = first.chunksOf(j++).clone();
      }
    }
    return chunks;
  }

  @Override
  protected ArrayData computeBlock(ComputeContext context, int[] blockIndex) {
    LazyArray input = inputs.get(inputOfBlock[blockIndex[axis]]);
    ArrayData block = input.getBlock(context, inputIndex(blockIndex));
    return stack ? block.expandDims(axis) : block;
  }

  @Override
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    visitor.visit(inputs.get(inputOfBlock[blockIndex[axis]]), inputIndex(blockIndex));
  }

  private int[] inputIndex(int[] blockIndex) {
    if (stack) {
      int[] index = new int[blockIndex.length - 1];
      for (int i = 0, j = 0; i < blockIndex.length; i++) {
        if (i != axis) {
          index[j++] = blockIndex[i];
        }
      }
      return index;
    }
    int[] index = blockIndex.clone();
    index[axis] = localBlock[blockIndex[axis]];
    return index;
  }
}
