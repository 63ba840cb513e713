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

import java.util.List;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.DataType;

/**
 * A blocked computation with several outputs. Each block of the graph is evaluated once per compute
 * pass and yields one array per output; the outputs are exposed as lazy arrays through {@link
 * #output(int, int, int[], int[], DataType)}.
 *
 * <p>Output i has the axes of the graph, with extra single-chunk axes inserted at a fixed position,
 * followed by single-chunk trailing (base) axes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BlockGraph {

  /** Computes all outputs of one graph block. */
  @FunctionalInterface
  public interface BlockTask {

    /**
     * Compute the outputs of one block.
     *
     * @param context    the compute pass.
     * @param blockIndex the block index in the graph grid.
     * @return one array per output.
     */
    List<ArrayData> compute(ComputeContext context, int[] blockIndex);
  }

  /** Declares the lazy blocks a graph block reads through its task. */
  @FunctionalInterface
  public interface BlockInputs {

    /**
     * Visit the inputs of one block.
     *
     * @param blockIndex the block index in the graph grid.
     * @param visitor    receives each input block.
     */
    void visit(int[] blockIndex, BlockVisitor visitor);
  }

  private final int[][] chunks;
  private final int numOutputs;
  private final BlockTask task;
  private final BlockInputs inputs;

  /**
   * Constructor for a BlockGraph whose task reads no lazy blocks.
   *
   * @param chunks     the chunk layout of the graph grid.
   * @param numOutputs the number of outputs.
   * @param task       computes a block.
   */
  public BlockGraph(int[][] chunks, int numOutputs, BlockTask task) {
    this(chunks, numOutputs, task, (blockIndex, visitor) -> {
    });
  }

  /**
   * Constructor for BlockGraph.
   *
   * @param chunks     the chunk layout of the graph grid.
   * @param numOutputs the number of outputs.
   * @param task       computes a block.
   * @param inputs     the lazy blocks read by the task, so that shared inputs are evaluated once.
   */
  public BlockGraph(int[][] chunks, int numOutputs, BlockTask task, BlockInputs inputs) {
    this.chunks = Chunks.copy(chunks);
    this.numOutputs = numOutputs;
    this.task = task;
    this.inputs = inputs;
  }

  /**
   * The outputs of one block, evaluated once per compute pass.
   *
   * @param context    the compute pass.
   * @param blockIndex the block index.
   * @return the output blocks.
   */
  public List<ArrayData> getBlocks(ComputeContext context, int[] blockIndex) {
    int[] index = blockIndex.clone();
    List<ArrayData> blocks = context.evaluate(this, index,
        () -> task.compute(context, index));
    if (blocks.size() != numOutputs) {
      throw new IllegalStateException(
          format(" A graph block returned %d outputs instead of %d.", blocks.size(), numOutputs));
    }
    return blocks;
  }

  void visitInputs(int[] blockIndex, BlockVisitor visitor) {
    inputs.visit(blockIndex, visitor);
  }

  /**
   * One output of the graph as a lazy array.
   *
   * @param output        the output index.
   * @param extraPosition the position of the extra axes among the graph axes.
   * @param extraShape    the shape of the extra axes.
   * @param baseShape     the shape of the trailing axes.
   * @param dtype         the element type.
   * @return a LazyArray.
   */
  public LazyArray output(int output, int extraPosition, int[] extraShape, int[] baseShape,
      DataType dtype) {
    if (output < 0 || output >= numOutputs) {
      throw new IllegalArgumentException(format(" Invalid output %d.", output));
    }
    if (extraPosition < 0 || extraPosition > chunks.length) {
      throw new IllegalArgumentException(format(" Invalid extra axis position %d.",
          extraPosition));
    }
    return new GraphOutput(this, output, extraPosition, extraShape, baseShape, dtype);
  }

  public int[][] getChunks() {
    return Chunks.copy(chunks);
  }

  public int getNumOutputs() {
    return numOutputs;
  }
}
