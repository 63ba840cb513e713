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
import java.util.List;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.Index;

/**
 * Leading-axis indexing. Single positions remove their axis; ranges keep the source chunk
 * boundaries that fall inside them.
 */
final class IndexedArray extends LazyArray {

  private final LazyArray source;
  private final int[] start;
  private final int[] stop;
  private final boolean[] single;

  IndexedArray(LazyArray source, Index[] items) {
    super(outputChunks(source, items), source.getDataType());
    int[] shape = source.getShape();
    this.source = source;
    this.start = new int[shape.length];
    this.stop = shape.clone();
    this.single = new boolean[shape.length];
    for (int i = 0; i < items.length; i++) {
      start[i] = items[i].getStart(shape[i]);
      stop[i] = items[i].getStop(shape[i]);
      single[i] = items[i].isSingle();
    }
  }

  private static int[][] outputChunks(LazyArray source, Index[] items) {
    int[] shape = source.getShape();
    if (items.length > shape.length) {
      throw new IllegalArgumentException(
          format(" Too many indices (%d) for an array of rank %d.", items.length, shape.length));
    }
    List<int[]> chunks = new ArrayList<>();
    for (int i = 0; i < shape.length; i++) {
      int[] axisChunks = source.chunksOf(i);
      if (i >= items.length) {
        chunks.add(axisChunks.clone());
        continue;
      }
      Index item = items[i];
      if (item.isSingle()) {
        item.getStart(shape[i]);
        continue;
      }
      int s = item.getStart(shape[i]);
      int e = item.getStop(shape[i]);
      int[] bounds = Chunks.boundaries(axisChunks);
      List<Integer> sizes = new ArrayList<>();
      for (int j = 0; j < axisChunks.length; j++) {
        int lo = Math.max(s, bounds[j]);
        int hi = Math.min(e, bounds[j + 1]);
        if (hi > lo) {
          sizes.add(hi - lo);
        }
      }
      if (sizes.isEmpty()) {
        sizes.add(0);
      }
      chunks.add(sizes.stream().mapToInt(Integer::intValue).toArray());
    }
    return chunks.toArray(new int[0][]);
  }

  @Override
  protected ArrayData computeBlock(ComputeContext context, int[] blockIndex) {
    int[][] region = region(blockIndex);
    return source.getRegion(context, region[0], region[1])
        .reshape(Chunks.blockShape(getChunks(), blockIndex));
  }

  @Override
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    int[][] region = region(blockIndex);
    source.visitRegion(region[0], region[1], visitor);
  }

  private int[][] region(int[] blockIndex) {
    int[][] chunks = getChunks();
    int[] outStart = Chunks.blockStart(chunks, blockIndex);
    int[] outShape = Chunks.blockShape(chunks, blockIndex);
    int rank = start.length;
    int[] lo = new int[rank];
    int[] hi = new int[rank];
    int j = 0;
    for (int i = 0; i < rank; i++) {
      if (single[i]) {
        lo[i] = start[i];
        hi[i] = start[i] + 1;
      } else {
        lo[i] = start[i] + outStart[j];
        hi[i] = lo[i] + outShape[j];
        j++;
      }
    }
    return new int[][] {lo, hi};
  }
}
