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

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;
import msx.array.Chunks;

/**
 * State shared by all blocks evaluated in one compute pass.
 *
 * <p>Before a pass starts, {@link #plan(List)} walks the block dependencies of the requested arrays
 * and counts how often each (node, block index) pair will be read. Pairs read once are evaluated
 * directly and never retained. Pairs read several times are evaluated once; the result is kept
 * until its last planned reader has taken it and is then released. The number of blocks held at
 * any time is therefore bounded by the blocks still awaiting readers, not by the size of the
 * graph. This is how several outputs of one multi-output graph share a single evaluation of their
 * common blocks.
 *
 * <p>Reads that were not planned (for example from inside a graph task that declares no inputs)
 * are evaluated directly.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ComputeContext {

  private final ConcurrentHashMap<BlockKey, SharedBlock> shared;
  private final AtomicInteger held = new AtomicInteger();

  private ComputeContext(ConcurrentHashMap<BlockKey, SharedBlock> shared) {
    this.shared = shared;
  }

  /**
   * Plan a compute pass over every block of several arrays.
   *
   * @param arrays the arrays that will be computed.
   * @return a ComputeContext.
   */
  public static ComputeContext plan(List<? extends LazyArray> arrays) {
    Planner planner = new Planner();
    for (LazyArray array : arrays) {
      for (int[] blockIndex : Chunks.blockIndices(array.getChunks())) {
        planner.visit(array, blockIndex);
      }
    }
    ConcurrentHashMap<BlockKey, SharedBlock> shared = new ConcurrentHashMap<>();
    for (Map.Entry<BlockKey, int[]> entry : planner.reads.entrySet()) {
      int reads = entry.getValue()[0];
      if (reads > 1) {
        shared.put(entry.getKey(), new SharedBlock(reads));
      }
    }
    return new ComputeContext(shared);
  }

  /**
   * Evaluate a block of a node, or return the result shared with its other readers.
   *
   * @param node       the node (compared by identity).
   * @param blockIndex the block index.
   * @param task       computes the block.
   * @param <T>        the block type.
   * @return the block.
   */
  @SuppressWarnings("unchecked")
  public <T> T evaluate(Object node, int[] blockIndex, Callable<T> task) {
    BlockKey key = new BlockKey(node, blockIndex);
    SharedBlock block = shared.get(key);
    if (block == null) {
      return call(task);
    }
    FutureTask<Object> future;
    boolean owner = false;
    synchronized (block) {
      if (block.remaining == 0) {
        future = null;
      } else {
        if (block.future == null) {
          block.future = new FutureTask<>(task::call);
          held.incrementAndGet();
          owner = true;
        }
        future = block.future;
        block.remaining--;
        if (block.remaining == 0) {
          block.future = null;
          shared.remove(key);
          held.decrementAndGet();
        }
      }
    }
    if (future == null) {
      return call(task);
    }
    if (owner) {
      future.run();
    }
    return (T) get(future);
  }

  /**
   * Number of evaluated blocks currently held for readers that have not taken them yet.
   *
   * @return the number of held blocks.
   */
  public int size() {
    return held.get();
  }

  /**
   * Number of blocks that the plan expects to share between several readers.
   *
   * @return the number of shared blocks still pending.
   */
  public int pending() {
    return shared.size();
  }

  private static <T> T call(Callable<T> task) {
    try {
      return task.call();
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException(" Block computation failed.", e);
    }
  }

  private static Object get(FutureTask<Object> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" Interrupted while computing a block.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(" Block computation failed.", cause);
    }
  }

  private static final class SharedBlock {

    private int remaining;
    private FutureTask<Object> future;

    SharedBlock(int reads) {
      this.remaining = reads;
    }
  }

  /** Counts the reads of every (node, block index) pair reachable from the computed arrays. */
  private static final class Planner implements BlockVisitor {

    private final Map<BlockKey, int[]> reads = new HashMap<>();

    @Override
    public void visit(LazyArray array, int[] blockIndex) {
      if (count(array, blockIndex)) {
        array.visitInputs(blockIndex, this);
      }
    }

    @Override
    public void visit(BlockGraph graph, int[] blockIndex) {
      if (count(graph, blockIndex)) {
        graph.visitInputs(blockIndex, this);
      }
    }

    /** Returns true the first time a pair is seen. */
    private boolean count(Object node, int[] blockIndex) {
      BlockKey key = new BlockKey(node, blockIndex);
      int[] n = reads.get(key);
      if (n != null) {
        n[0]++;
        return false;
      }
      reads.put(key, new int[] {1});
      return true;
    }
  }

  private static final class BlockKey {

    private final Object node;
    private final int[] index;

    BlockKey(Object node, int[] index) {
      this.node = node;
      this.index = index.clone();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof BlockKey)) {
        return false;
      }
      BlockKey other = (BlockKey) o;
      return node == other.node && Arrays.equals(index, other.index);
    }

    @Override
    public int hashCode() {
      return 31 * System.identityHashCode(node) + Arrays.hashCode(index);
    }
  }
}
