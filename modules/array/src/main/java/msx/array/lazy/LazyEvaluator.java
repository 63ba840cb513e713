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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.ComputeSettings;

/**
 * Runs compute passes over one or more lazy arrays. All blocks of all arrays in a pass are
 * submitted to a fixed pool of worker threads and share one {@link ComputeContext}, so nodes that
 * several arrays depend on are evaluated once. The first failing block aborts the pass and its
 * exception is rethrown to the caller.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class LazyEvaluator {

  private static final Logger logger = Logger.getLogger(LazyEvaluator.class.getName());

  private LazyEvaluator() {
  }

  /** Receives computed blocks. */
  @FunctionalInterface
  public interface BlockConsumer {

    /**
     * Accept one computed block. Called concurrently from worker threads.
     *
     * @param array      the position of the array in the computed list.
     * @param blockIndex the block index.
     * @param block      the block.
     * @throws IOException if the block cannot be stored.
     */
    void accept(int array, int[] blockIndex, ArrayData block) throws IOException;
  }

  /**
   * Compute several lazy arrays in one pass.
   *
   * @param arrays   the arrays.
   * @param settings the compute settings.
   * @return the computed arrays, in order.
   */
  public static List<ArrayData> compute(List<? extends LazyArray> arrays,
      ComputeSettings settings) {
    List<ArrayData> results = new ArrayList<>(arrays.size());
    List<int[][]> layouts = new ArrayList<>(arrays.size());
    for (LazyArray array : arrays) {
      results.add(ArrayData.zeros(array.getDataType(), array.getShape()));
      layouts.add(array.getChunks());
    }
    forEachBlock(arrays, settings, (i, blockIndex, block) ->
        results.get(i).setRegion(Chunks.blockStart(layouts.get(i), blockIndex), block));
    return results;
  }

  /**
   * Compute every block of several lazy arrays in one pass and hand them to a consumer.
   *
   * @param arrays   the arrays.
   * @param settings the compute settings.
   * @param consumer receives each block.
   */
  public static void forEachBlock(List<? extends LazyArray> arrays, ComputeSettings settings,
      BlockConsumer consumer) {
    settings.getDevice().checkAvailable();
    forEachBlock(arrays, settings, ComputeContext.plan(arrays), consumer);
  }

  /**
   * Compute every block of several arrays with a planned context. Blocks are submitted in turn
   * from each array, so that blocks shared by sibling arrays are released soon after they are
   * computed.
   */
  static void forEachBlock(List<? extends LazyArray> arrays, ComputeSettings settings,
      ComputeContext context, BlockConsumer consumer) {
    List<List<int[]>> perArray = new ArrayList<>(arrays.size());
    int longest = 0;
    for (LazyArray array : arrays) {
      List<int[]> blocks = Chunks.blockIndices(array.getChunks());
      perArray.add(blocks);
      longest = Math.max(longest, blocks.size());
    }
    List<int[]> indices = new ArrayList<>();
    List<Integer> owners = new ArrayList<>();
    for (int k = 0; k < longest; k++) {
      for (int i = 0; i < arrays.size(); i++) {
        List<int[]> blocks = perArray.get(i);
        if (k < blocks.size()) {
          indices.add(blocks.get(k));
          owners.add(i);
        }
      }
    }
    int total = indices.size();
    if (total == 0) {
      return;
    }

    int threads = Math.max(1, Math.min(settings.getThreads(), total));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Computing %d blocks of %d arrays with %d threads (%d shared).", total,
          arrays.size(), threads, context.pending()));
    }

    ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerFactory());
    try {
      CompletionService<Void> completion = new ExecutorCompletionService<>(executor);
      List<Future<Void>> futures = new ArrayList<>(total);
      for (int k = 0; k < total; k++) {
        int owner = owners.get(k);
        int[] blockIndex = indices.get(k);
        LazyArray array = arrays.get(owner);
        futures.add(completion.submit(() -> {
          ArrayData block = array.getBlock(context, blockIndex);
          consumer.accept(owner, blockIndex, block);
          return null;
        }));
      }
      for (int done = 1; done <= total; done++) {
        Future<Void> future = completion.take();
        try {
          future.get();
        } catch (ExecutionException e) {
          for (Future<Void> f : futures) {
            f.cancel(true);
          }
          throw rethrow(e.getCause());
        }
        if (settings.isProgress()) {
          logger.info(format(" Completed block %d of %d.", done, total));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" Interrupted while computing.", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    if (cause instanceof IOException) {
      return new UncheckedIOException((IOException) cause);
    }
    return new IllegalStateException(" Block computation failed.", cause);
  }

  private static final class WorkerFactory implements ThreadFactory {

    private static final AtomicInteger POOL = new AtomicInteger();
    private final int pool = POOL.incrementAndGet();
    private final AtomicInteger count = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable,
          format("msx-compute-%d-%d", pool, count.incrementAndGet()));
      thread.setDaemon(true);
      return thread;
    }
  }
}
