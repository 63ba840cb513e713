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

import java.util.function.UnaryOperator;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.DataType;

/** A function applied block by block. */
final class MappedArray extends LazyArray {

  private final LazyArray source;
  private final int keepAxes;
  private final UnaryOperator<ArrayData> function;

  MappedArray(LazyArray source, int keepAxes, int[] trailingShape, DataType dtype,
      UnaryOperator<ArrayData> function) {
    super(outputChunks(source, keepAxes, trailingShape), dtype);
    this.source = gather(source, keepAxes);
    this.keepAxes = keepAxes;
    this.function = function;
  }

  private static int[][] outputChunks(LazyArray source, int keepAxes, int[] trailingShape) {
    if (keepAxes < 0 || keepAxes > source.getRank()) {
      throw new IllegalArgumentException(" Invalid number of kept axes.");
    }
    int[][] chunks = new int[keepAxes + trailingShape.length][];
    for (int i = 0; i < keepAxes; i++) {
      chunks[i] = source.chunksOf(i).clone();
    }
    for (int i = 0; i < trailingShape.length; i++) {
      chunks[keepAxes + i] = new int[] {trailingShape[i]};
    }
    return chunks;
  }

  private static LazyArray gather(LazyArray source, int keepAxes) {
    int[][] chunks = source.getChunks();
    int[] shape = source.getShape();
    for (int i = keepAxes; i < shape.length; i++) {
      chunks[i] = new int[] {shape[i]};
    }
    return source.rechunk(chunks);
  }

  @Override
  protected ArrayData computeBlock(ComputeContext context, int[] blockIndex) {
    ArrayData block = source.getBlock(context, sourceIndex(blockIndex));
    ArrayData result = function.apply(block);
    int[] expected = Chunks.blockShape(getChunks(), blockIndex);
    if (result.getRank() != expected.length) {
      result = result.reshape(expected);
    }
    return result;
  }

  @Override
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    visitor.visit(source, sourceIndex(blockIndex));
  }

  private int[] sourceIndex(int[] blockIndex) {
    int[] index = new int[source.getRank()];
    System.arraycopy(blockIndex, 0, index, 0, keepAxes);
    return index;
  }
}
