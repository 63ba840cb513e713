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
import static java.util.Collections.singletonList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Index;

/**
 * A deferred, chunked array. The array is a grid of blocks described by its chunk layout; each
 * block is produced on demand by {@link #computeBlock(ComputeContext, int[])}. Nothing is evaluated
 * until {@link #compute(ComputeSettings)} (or {@link LazyEvaluator}) runs a compute pass.
 *
 * <p>Blocks handed out by {@link #getBlock(ComputeContext, int[])} are shared within a compute pass
 * and must be treated as read-only.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class LazyArray {

  private final int[][] chunks;
  private final int[] shape;
  private final DataType dtype;

  /**
   * Constructor for LazyArray.
   *
   * @param chunks the chunk layout (the shape follows from it).
   * @param dtype  the element type.
   */
  protected LazyArray(int[][] chunks, DataType dtype) {
    this.chunks = Chunks.copy(chunks);
    this.shape = Chunks.shape(chunks);
    this.dtype = dtype;
  }

  /**
   * Wrap an eager array.
   *
   * @param data   the array.
   * @param chunks the chunk layout.
   * @return a LazyArray.
   */
  public static LazyArray fromArray(ArrayData data, int[][] chunks) {
    return new ArraySource(data, chunks);
  }

  /**
   * A lazy array whose blocks are produced by a function.
   *
   * @param chunks   the chunk layout.
   * @param dtype    the element type.
   * @param function produces each block.
   * @return a LazyArray.
   */
  public static LazyArray fromBlocks(int[][] chunks, DataType dtype, BlockFunction function) {
    return new FunctionArray(chunks, dtype, function);
  }

  /**
   * Stack lazy arrays of equal shape along a new axis.
   *
   * @param arrays the arrays.
   * @param axis   the new axis position.
   * @return a LazyArray.
   */
  public static LazyArray stack(List<LazyArray> arrays, int axis) {
    return JoinedArray.create(arrays, axis, true);
  }

  /**
   * Concatenate lazy arrays along an existing axis.
   *
   * @param arrays the arrays.
   * @param axis   the axis.
   * @return a LazyArray.
   */
  public static LazyArray concatenate(List<LazyArray> arrays, int axis) {
    return JoinedArray.create(arrays, axis, false);
  }

  /**
   * Compute one block.
   *
   * @param context    the compute pass.
   * @param blockIndex the block index.
   * @return the block.
   */
  protected abstract ArrayData computeBlock(ComputeContext context, int[] blockIndex);

  /**
   * One block, evaluated at most once per compute pass.
   *
   * @param context    the compute pass.
   * @param blockIndex the block index.
   * @return the block.
   */
  public final ArrayData getBlock(ComputeContext context, int[] blockIndex) {
    int[] index = blockIndex.clone();
    return context.evaluate(this, index, () -> {
      ArrayData block = computeBlock(context, index);
      int[] expected = Chunks.blockShape(chunks, index);
      if (!Arrays.equals(expected, block.getShape())) {
        throw new IllegalStateException(format(" Block %s has shape %s instead of %s.",
            Arrays.toString(index), Arrays.toString(block.getShape()),
            Arrays.toString(expected)));
      }
      return block;
    });
  }

  /**
   * Visit the blocks of other nodes that {@link #computeBlock(ComputeContext, int[])} reads for a
   * block. Nodes that read no other lazy blocks keep the default.
   *
   * @param blockIndex the block index.
   * @param visitor    receives each input block.
   */
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
  }

  /**
   * Assemble the hyper-rectangle [start, stop) from the blocks that intersect it.
   *
   * @param context the compute pass.
   * @param start   the first index along each axis.
   * @param stop    the end index (exclusive) along each axis.
   * @return the region.
   */
  public ArrayData getRegion(ComputeContext context, int[] start, int[] stop) {
    int rank = shape.length;
    List<int[]> blocks = regionBlocks(start, stop);
    int[] count = new int[rank];
    for (int i = 0; i < rank; i++) {
      count[i] = stop[i] - start[i];
    }
    ArrayData out = ArrayData.zeros(dtype, count);
    for (int[] blockIndex : blocks) {
      int[] blockStart = Chunks.blockStart(chunks, blockIndex);
      int[] blockShape = Chunks.blockShape(chunks, blockIndex);
      int[] lo = new int[rank];
      int[] hi = new int[rank];
      int[] dst = new int[rank];
      for (int i = 0; i < rank; i++) {
        int b0 = blockStart[i];
        int b1 = b0 + blockShape[i];
        lo[i] = Math.max(start[i], b0) - b0;
        hi[i] = Math.min(stop[i], b1) - b0;
        dst[i] = Math.max(start[i], b0) - start[i];
      }
      ArrayData block = getBlock(context, blockIndex);
      out.setRegion(dst, block.region(lo, hi));
    }
    return out;
  }

  /**
   * Visit the blocks read by {@link #getRegion(ComputeContext, int[], int[])}.
   *
   * @param start   the first index along each axis.
   * @param stop    the end index (exclusive) along each axis.
   * @param visitor receives each block.
   */
  public void visitRegion(int[] start, int[] stop, BlockVisitor visitor) {
    for (int[] blockIndex : regionBlocks(start, stop)) {
      visitor.visit(this, blockIndex);
    }
  }

  private List<int[]> regionBlocks(int[] start, int[] stop) {
    int rank = shape.length;
    int[][] blockRange = new int[rank][2];
    boolean empty = false;
    for (int i = 0; i < rank; i++) {
      int count = stop[i] - start[i];
      if (start[i] < 0 || stop[i] > shape[i] || count < 0) {
        throw new IndexOutOfBoundsException(format(" Region %s:%s is outside of shape %s.",
            Arrays.toString(start), Arrays.toString(stop), Arrays.toString(shape)));
      }
      empty |= count == 0;
      int[] bounds = Chunks.boundaries(chunks[i]);
      int first = 0;
      while (first < chunks[i].length - 1 && bounds[first + 1] <= start[i]) {
        first++;
      }
      int last = first;
      while (last < chunks[i].length - 1 && bounds[last + 1] < stop[i]) {
        last++;
      }
      blockRange[i][0] = first;
      blockRange[i][1] = last;
    }
    List<int[]> blocks = new ArrayList<>();
    if (empty) {
      return blocks;
    }
    int[][] sub = new int[rank][];
    for (int i = 0; i < rank; i++) {
      sub[i] = new int[blockRange[i][1] - blockRange[i][0] + 1];
      Arrays.fill(sub[i], 1);
    }
    for (int[] offset : Chunks.blockIndices(sub)) {
      int[] blockIndex = new int[rank];
      for (int i = 0; i < rank; i++) {
        blockIndex[i] = blockRange[i][0] + offset[i];
      }
      blocks.add(blockIndex);
    }
    return blocks;
  }

  /**
   * Compute the whole array in a single pass.
   *
   * @param settings the compute settings.
   * @return the computed array.
   */
  public ArrayData compute(ComputeSettings settings) {
    return LazyEvaluator.compute(singletonList(this), settings).get(0);
  }

  /**
   * Index the leading axes.
   *
   * @param items the indices.
   * @return a LazyArray.
   */
  public LazyArray getItems(Index... items) {
    return new IndexedArray(this, items);
  }

  /**
   * Insert axes of length one.
   *
   * @param axes the new axis positions (in the output).
   * @return a LazyArray.
   */
  public LazyArray expandDims(int... axes) {
    int rank = shape.length + axes.length;
    boolean[] isNew = new boolean[rank];
    for (int a : axes) {
      isNew[a < 0 ? a + rank : a] = true;
    }
    int[] sourceAxis = new int[rank];
    int j = 0;
    for (int i = 0; i < rank; i++) {
      sourceAxis[i] = isNew[i] ? -1 : j++;
    }
    return new ReshapedArray(this, sourceAxis);
  }

  /**
   * Remove axes of length one.
   *
   * @param axes the axes to remove.
   * @return a LazyArray.
   */
  public LazyArray squeeze(int... axes) {
    int[] newShape = ArrayData.squeezeShape(shape, axes);
    boolean[] removed = new boolean[shape.length];
    for (int a : axes) {
      removed[a < 0 ? a + shape.length : a] = true;
    }
    int[] sourceAxis = new int[newShape.length];
    int j = 0;
    for (int i = 0; i < shape.length; i++) {
      if (!removed[i]) {
        sourceAxis[j++] = i;
      }
    }
    return new ReshapedArray(this, sourceAxis);
  }

  /**
   * Change the chunk layout.
   *
   * @param newChunks the new layout (same shape).
   * @return a LazyArray.
   */
  public LazyArray rechunk(int[][] newChunks) {
    if (Arrays.deepEquals(newChunks, chunks)) {
      return this;
    }
    return new RechunkedArray(this, newChunks);
  }

  /**
   * Apply a function to every block. The leading keepAxes axes keep their chunks; the remaining
   * axes are gathered into single chunks and replaced by trailing axes of the given shape.
   *
   * @param keepAxes      the number of leading axes that keep their chunks.
   * @param trailingShape the shape of the new trailing axes.
   * @param outType       the element type of the result.
   * @param function      maps a block to a block; must not modify its argument.
   * @return a LazyArray.
   */
  public LazyArray map(int keepAxes, int[] trailingShape, DataType outType,
      UnaryOperator<ArrayData> function) {
    return new MappedArray(this, keepAxes, trailingShape, outType, function);
  }

  /**
   * The mean over one axis.
   *
   * @param axis the axis to remove.
   * @return a LazyArray.
   */
  public LazyArray mean(int axis) {
    return new ReducedArray(this, axis < 0 ? axis + getRank() : axis);
  }

  public int[] getShape() {
    return shape.clone();
  }

  public int[][] getChunks() {
    return Chunks.copy(chunks);
  }

  public DataType getDataType() {
    return dtype;
  }

  public int getRank() {
    return shape.length;
  }

  /**
   * Number of blocks along each axis.
   *
   * @return the block grid shape.
   */
  public int[] getNumBlocks() {
    return Chunks.numBlocks(chunks);
  }

  /**
   * Chunk sizes along one axis.
   *
   * @param axis the axis.
   * @return the chunk sizes.
   */
  protected int[] chunksOf(int axis) {
    return chunks[axis];
  }

  @Override
  public String toString() {
    return format("%s(%s, %s, chunks=%s)", getClass().getSimpleName(), dtype,
        Arrays.toString(shape), Arrays.deepToString(chunks));
  }
}
