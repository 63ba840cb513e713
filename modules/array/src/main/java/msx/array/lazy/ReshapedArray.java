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

import msx.array.ArrayData;
import msx.array.Chunks;

/**
 * Inserts or removes axes of length one. Each output axis either maps to a source axis or is new;
 * source axes without an output axis must have length one.
 */
final class ReshapedArray extends LazyArray {

  private final LazyArray source;
  private final int[] sourceAxis;

  ReshapedArray(LazyArray source, int[] sourceAxis) {
    super(outputChunks(source, sourceAxis), source.getDataType());
    this.source = source;
    this.sourceAxis = sourceAxis.clone();
  }

  private static int[][] outputChunks(LazyArray source, int[] sourceAxis) {
    int[] shape = source.getShape();
    boolean[] used = new boolean[shape.length];
    int[][] chunks = new int[sourceAxis.length][];
    for (int i = 0; i < sourceAxis.length; i++) {
      if (sourceAxis[i] < 0) {
        chunks[i] = new int[] {1};
      } else {
        chunks[i] = source.chunksOf(sourceAxis[i]).clone();
        used[sourceAxis[i]] = true;
      }
    }
    for (int i = 0; i < shape.length; i++) {
      if (!used[i] && shape[i] != 1) {
        throw new IllegalArgumentException(
            format(" Cannot remove axis %d of length %d.", i, shape[i]));
      }
    }
    return chunks;
  }

  @Override
  protected ArrayData computeBlock(ComputeContext context, int[] blockIndex) {
    return source.getBlock(context, sourceIndex(blockIndex))
        .reshape(Chunks.blockShape(getChunks(), blockIndex));
  }

  @Override
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    visitor.visit(source, sourceIndex(blockIndex));
  }

  private int[] sourceIndex(int[] blockIndex) {
    int[] index = new int[source.getRank()];
    for (int i = 0; i < sourceAxis.length; i++) {
      if (sourceAxis[i] >= 0) {
        index[sourceAxis[i]] = blockIndex[i];
      }
    }
    return index;
  }
}
