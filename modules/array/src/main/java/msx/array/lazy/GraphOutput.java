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

import msx.array.ArrayData;
import msx.array.DataType;

/** One output of a {@link BlockGraph}. */
final class GraphOutput extends LazyArray {

  private final BlockGraph graph;
  private final int output;
  private final int extraPosition;
  private final int numExtra;
  private final int graphRank;

  GraphOutput(BlockGraph graph, int output, int extraPosition, int[] extraShape, int[] baseShape,
      DataType dtype) {
    super(outputChunks(graph.getChunks(), extraPosition, extraShape, baseShape), dtype);
    this.graph = graph;
    this.output = output;
    this.extraPosition = extraPosition;
    this.numExtra = extraShape.length;
    this.graphRank = graph.getChunks().length;
  }

  private static int[][] outputChunks(int[][] graphChunks, int extraPosition, int[] extraShape,
      int[] baseShape) {
    int rank = graphChunks.length + extraShape.length + baseShape.length;
    int[][] chunks = new int[rank][];
    int k = 0;
    for (int i = 0; i < extraPosition; i++) {
      chunks[k++] = graphChunks[i].clone();
    }
    for (int n : extraShape) {
      chunks[k++] = new int[] {n};
    }
    for (int i = extraPosition; i < graphChunks.length; i++) {
      chunks[k++] = graphChunks[i].clone();
    }
    for (int n : baseShape) {
      chunks[k++] = new int[] {n};
    }
    return chunks;
  }

  @Override
  protected ArrayData computeBlock(ComputeContext context, int[] blockIndex) {
    return graph.getBlocks(context, graphIndex(blockIndex)).get(output);
  }

  @Override
  protected void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    visitor.visit(graph, graphIndex(blockIndex));
  }

  private int[] graphIndex(int[] blockIndex) {
    int[] index = new int[graphRank];
    for (int i = 0; i < graphRank; i++) {
      index[i] = i < extraPosition ? blockIndex[i] : blockIndex[i + numExtra];
    }
    return index;
  }
}
