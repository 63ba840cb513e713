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
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.BackingArray;
import msx.array.Chunks;
import msx.array.ComputableList;
import msx.array.ComputeSettings;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.lazy.BlockGraph;
import msx.array.lazy.LazyArray;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Builds the block graph of a transform applied to an ensemble and wraps its outputs as
 * ArrayObjects.
 *
 * <p>Building is separate from running: the returned objects are lazy unless the settings ask for
 * eager results, in which case every output is computed in one shared pass before returning. Either
 * way the outputs of a multi-output transform share a single evaluation of each block.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EnsembleBuilder {

  private static final Logger logger = Logger.getLogger(EnsembleBuilder.class.getName());

  private EnsembleBuilder() {
  }

  /**
   * Build the outputs of a transform applied to the object produced by a factory.
   *
   * @param transform the transform.
   * @param factory   builds the input object for each block.
   * @param settings  the compute settings.
   * @return the outputs, after squeezing removable axes of length one.
   */
  public static ComputableList<ArrayObject> build(ArrayObjectTransform transform,
      ArrayObjectFactory factory, ComputeSettings settings) {
    return build(transform, factory, settings, 0);
  }

  /**
   * Build the outputs of a transform applied to the object produced by a factory.
   *
   * @param transform the transform.
   * @param factory   builds the input object for each block.
   * @param settings  the compute settings.
   * @param maxBatch  if positive, the maximum number of items per block.
   * @return the outputs, after squeezing removable axes of length one.
   */
  public static ComputableList<ArrayObject> build(ArrayObjectTransform transform,
      ArrayObjectFactory factory, ComputeSettings settings, int maxBatch) {
    Device device = settings.getDevice();
    device.checkAvailable();
    OutputSpecification inputSpec = factory.describe();
    ArrayObject template = inputSpec.template(device);

    int[] ensembleShape = transform.getEnsembleShape();
    int[][] chunks = ensembleChunks(transform, inputSpec.getBaseShape(),
        inputSpec.getDataType().getItemSize(), settings, maxBatch);
    PartitionedArgs args = transform.partitionArgs(chunks);
    List<OutputSpecification> specs = specifications(transform, template);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Building %d output(s) over ensemble %s with chunks %s.",
          specs.size(), Arrays.toString(ensembleShape), Arrays.deepToString(chunks)));
    }

    BlockGraph graph = new BlockGraph(chunks, specs.size(), (context, blockIndex) -> {
      ArrayObjectTransform block = transform.fromPartitionedArgs(args.getBlock(blockIndex));
      ArrayObject input = inputSpec.pack(BackingArray.of(factory.buildArray()),
          Collections.emptyList(), 0, Collections.emptyList(), device);
      return block.calculateNewArrays(input);
    });
    return wrap(graph, transform, specs, Collections.emptyList(), settings);
  }

  /**
   * Apply a transform to an existing object. A lazy input yields lazy outputs whose blocks span
   * the transform's ensemble blocks and the input's blocks; an eager input is transformed directly
   * unless the settings ask for lazy results.
   *
   * @param input     the input object.
   * @param transform the transform.
   * @param settings  the compute settings.
   * @return the outputs, after squeezing removable axes of length one.
   */
  public static ComputableList<ArrayObject> applyTransform(ArrayObject input,
      ArrayObjectTransform transform, ComputeSettings settings) {
    settings.getDevice().checkAvailable();
    if (!input.isLazy() && !settings.isLazy()) {
      ComputableList<ArrayObject> outputs = new ComputableList<>();
      for (ArrayObject output : transform.apply(input)) {
        outputs.add(output.reduceEnsemble());
      }
      return outputs;
    }

    ArrayObject lazyInput = input.ensureLazy(settings);
    int inputDims = lazyInput.getEnsembleDims();
    int[][] inputChunks = lazyInput.getLazyArray().getChunks();
    int[] inputShape = lazyInput.getShape();
    int[] inputBlockShape = new int[inputChunks.length];
    for (int i = 0; i < inputChunks.length; i++) {
      inputBlockShape[i] = i < inputDims ? Arrays.stream(inputChunks[i]).max().orElse(0)
          : inputShape[i];
    }
    LazyArray source = lazyInput.getLazyArray().rechunk(gatherBase(inputChunks, inputDims,
        inputShape));

    int[][] transformChunks = ensembleChunks(transform, inputBlockShape,
        lazyInput.getDataType().getItemSize(), settings, 0);
    int t = transformChunks.length;
    int[][] chunks = new int[t + inputDims][];
    System.arraycopy(transformChunks, 0, chunks, 0, t);
    System.arraycopy(inputChunks, 0, chunks, t, inputDims);

    PartitionedArgs args = transform.partitionArgs(transformChunks);
    List<OutputSpecification> specs = specifications(transform, lazyInput);
    List<AxisMetadata> inputAxes = lazyInput.getEnsembleAxesMetadata();
    int baseDims = lazyInput.getBaseDims();

    BlockGraph graph = new BlockGraph(chunks, specs.size(), (context, blockIndex) -> {
      int[] transformIndex = Arrays.copyOfRange(blockIndex, 0, t);
      int[] inputIndex = inputIndex(blockIndex, t, baseDims);
      ArrayData block = source.getBlock(context, inputIndex);
      int[] start = Chunks.blockStart(inputChunks, inputIndex);
      List<AxisMetadata> blockAxes = new ArrayList<>(inputDims);
      for (int i = 0; i < inputDims; i++) {
        blockAxes.add(inputAxes.get(i).select(start[i], start[i] + block.getShape()[i]));
      }
      ArrayObject blockInput = lazyInput.withArray(BackingArray.of(block), blockAxes);
      return transform.fromPartitionedArgs(args.getBlock(transformIndex))
          .calculateNewArrays(blockInput);
    }, (blockIndex, visitor) -> visitor.visit(source, inputIndex(blockIndex, t, baseDims)));
    return wrap(graph, transform, specs, inputAxes, settings);
  }

  private static int[] inputIndex(int[] blockIndex, int transformDims, int baseDims) {
    return ArrayUtils.addAll(Arrays.copyOfRange(blockIndex, transformDims, blockIndex.length),
        new int[baseDims]);
  }

  private static int[][] gatherBase(int[][] chunks, int ensembleDims, int[] shape) {
    int[][] gathered = Chunks.copy(chunks);
    for (int i = ensembleDims; i < shape.length; i++) {
      gathered[i] = new int[] {shape[i]};
    }
    return gathered;
  }

  private static int[][] ensembleChunks(ArrayObjectTransform transform, int[] itemShape,
      int itemSize, ComputeSettings settings, int maxBatch) {
    int[] ensembleShape = transform.getEnsembleShape();
    int[] requested = transform.getDefaultEnsembleChunks();
    if (requested.length != ensembleShape.length) {
      throw new IllegalStateException(" Default chunks do not match the ensemble shape.");
    }
    long itemBytes = ArrayData.product(itemShape) * itemSize;
    long limit = maxBatch > 0 ? maxBatch * itemBytes : settings.getChunkSize();
    int[] fullShape = ArrayUtils.addAll(ensembleShape, itemShape);
    int[] fullRequest = new int[fullShape.length];
    System.arraycopy(requested, 0, fullRequest, 0, requested.length);
    Arrays.fill(fullRequest, requested.length, fullRequest.length, Chunks.FULL);
    int[][] chunks = Chunks.validate(fullShape, fullRequest, limit, itemSize);
    return Arrays.copyOfRange(chunks, 0, ensembleShape.length);
  }

  private static List<OutputSpecification> specifications(ArrayObjectTransform transform,
      ArrayObject template) {
    List<OutputSpecification> specs = new ArrayList<>(transform.getNumOutputs());
    for (int i = 0; i < transform.getNumOutputs(); i++) {
      specs.add(transform.getOutputSpecification(template, i));
    }
    return specs;
  }

  private static ComputableList<ArrayObject> wrap(BlockGraph graph,
      ArrayObjectTransform transform, List<OutputSpecification> specs,
      List<AxisMetadata> inputAxes, ComputeSettings settings) {
    int position = transform.getExtraAxesPosition();
    ComputableList<ArrayObject> outputs = new ComputableList<>();
    for (int i = 0; i < specs.size(); i++) {
      OutputSpecification spec = specs.get(i);
      LazyArray lazy = graph.output(i, position, spec.getExtraShape(), spec.getBaseShape(),
          spec.getDataType());
      ArrayObject output = spec.pack(BackingArray.of(lazy), transform.getEnsembleAxesMetadata(),
          position, inputAxes, settings.getDevice());
      outputs.add(output.reduceEnsemble());
    }
    if (!settings.isLazy()) {
      outputs.compute(settings);
    }
    return outputs;
  }
}
