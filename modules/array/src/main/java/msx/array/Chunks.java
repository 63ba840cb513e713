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
package msx.array;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chunk layouts of blocked arrays.
 *
 * <p>A layout is an int[][]: for each axis, the sizes of its consecutive chunks. A requested chunk
 * size per axis may be an explicit size, {@link #AUTO} (chosen to respect a byte limit) or {@link
 * #FULL} (a single chunk).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Chunks {

  private static final Logger logger = Logger.getLogger(Chunks.class.getName());

  /** Choose the chunk size automatically. */
  public static final int AUTO = -2;
  /** Use a single chunk along the axis. */
  public static final int FULL = -1;

  private Chunks() {
  }

  /**
   * Validate requested chunk sizes against a shape and a byte limit.
   *
   * <p>Automatic axes start at the full axis length and the largest of them is halved until a
   * block fits the limit. If no automatic axis can shrink further, explicit chunk sizes are reduced
   * in the same way. Axes requested as FULL are never split. Axes of length zero get a single chunk
   * of size zero.
   *
   * @param shape      the array shape.
   * @param requested  requested chunk size per axis (explicit, AUTO or FULL).
   * @param limitBytes the maximum block size in bytes.
   * @param itemSize   bytes per element.
   * @return the chunk layout.
   */
  public static int[][] validate(int[] shape, int[] requested, long limitBytes, int itemSize) {
    if (requested.length != shape.length) {
      throw new IllegalArgumentException(format(" Chunks %s do not match shape %s.",
          Arrays.toString(requested), Arrays.toString(shape)));
    }
    int rank = shape.length;
    int[] size = new int[rank];
    for (int i = 0; i < rank; i++) {
      int r = requested[i];
      if (r == AUTO || r == FULL) {
        size[i] = shape[i];
      } else if (r > 0) {
        size[i] = Math.min(r, shape[i]);
      } else {
        throw new IllegalArgumentException(format(" Invalid chunk size %d.", r));
      }
    }

    while (blockBytes(size, itemSize) > limitBytes) {
      int axis = largestReducible(size, requested, AUTO);
      if (axis < 0) {
        axis = largestExplicit(size, requested);
      }
      if (axis < 0) {
        logger.warning(format(" A block of shape %s exceeds the chunk limit of %d bytes.",
            Arrays.toString(size), limitBytes));
        break;
      }
      size[axis] = (size[axis] + 1) / 2;
    }

    int[][] chunks = new int[rank][];
    for (int i = 0; i < rank; i++) {
      chunks[i] = split(shape[i], size[i]);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Chunks for shape %s: %s.", Arrays.toString(shape),
          Arrays.deepToString(chunks)));
    }
    return chunks;
  }

  /**
   * Split an axis of length n into chunks of the given size (the last chunk may be smaller).
   *
   * @param n         the axis length.
   * @param chunkSize the chunk size.
   * @return the chunk sizes.
   */
  public static int[] split(int n, int chunkSize) {
    if (n == 0) {
      return new int[] {0};
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException(format(" Invalid chunk size %d.", chunkSize));
    }
    int count = (n + chunkSize - 1) / chunkSize;
    int[] sizes = new int[count];
    for (int i = 0; i < count; i++) {
      sizes[i] = Math.min(chunkSize, n - i * chunkSize);
    }
    return sizes;
  }

  /**
   * A single chunk per axis.
   *
   * @param shape the shape.
   * @return the chunk layout.
   */
  public static int[][] single(int[] shape) {
    int[][] chunks = new int[shape.length][];
    for (int i = 0; i < shape.length; i++) {
      chunks[i] = new int[] {shape[i]};
    }
    return chunks;
  }

  /**
   * Start offsets of each chunk along an axis, followed by the axis length.
   *
   * @param chunks the chunk sizes along one axis.
   * @return chunks.length + 1 boundaries.
   */
  public static int[] boundaries(int[] chunks) {
    int[] b = new int[chunks.length + 1];
    for (int i = 0; i < chunks.length; i++) {
      b[i + 1] = b[i] + chunks[i];
    }
    return b;
  }

  /**
   * The shape implied by a chunk layout.
   *
   * @param chunks the layout.
   * @return the shape.
   */
  public static int[] shape(int[][] chunks) {
    int[] shape = new int[chunks.length];
    for (int i = 0; i < chunks.length; i++) {
      for (int c : chunks[i]) {
        shape[i] += c;
      }
    }
    return shape;
  }

  /**
   * Number of blocks along each axis.
   *
   * @param chunks the layout.
   * @return the block grid shape.
   */
  public static int[] numBlocks(int[][] chunks) {
    int[] n = new int[chunks.length];
    for (int i = 0; i < chunks.length; i++) {
      n[i] = chunks[i].length;
    }
    return n;
  }

  /**
   * All block indices of a layout in row-major order. Layouts that contain an axis of length zero
   * have no blocks.
   *
   * @param chunks the layout.
   * @return the block indices.
   */
  public static List<int[]> blockIndices(int[][] chunks) {
    List<int[]> indices = new ArrayList<>();
    for (int[] axis : chunks) {
      if (axis.length == 1 && axis[0] == 0) {
        return indices;
      }
    }
    int rank = chunks.length;
    int[] counter = new int[rank];
    while (true) {
      indices.add(counter.clone());
      int axis = rank - 1;
      while (axis >= 0) {
        counter[axis]++;
        if (counter[axis] < chunks[axis].length) {
          break;
        }
        counter[axis] = 0;
        axis--;
      }
      if (axis < 0) {
        return indices;
      }
    }
  }

  /**
   * The start of a block.
   *
   * @param chunks     the layout.
   * @param blockIndex the block index.
   * @return the start offset along each axis.
   */
  public static int[] blockStart(int[][] chunks, int[] blockIndex) {
    int[] start = new int[chunks.length];
    for (int i = 0; i < chunks.length; i++) {
      for (int j = 0; j < blockIndex[i]; j++) {
        start[i] += chunks[i][j];
      }
    }
    return start;
  }

  /**
   * The shape of a block.
   *
   * @param chunks     the layout.
   * @param blockIndex the block index.
   * @return the block shape.
   */
  public static int[] blockShape(int[][] chunks, int[] blockIndex) {
    int[] shape = new int[chunks.length];
    for (int i = 0; i < chunks.length; i++) {
      shape[i] = chunks[i][blockIndex[i]];
    }
    return shape;
  }

  /**
   * Size of a block in bytes.
   *
   * @param blockShape the block shape.
   * @param itemSize   bytes per element.
   * @return the byte count.
   */
  public static long blockBytes(int[] blockShape, int itemSize) {
    return ArrayData.product(blockShape) * itemSize;
  }

  /**
   * A deep copy of a layout.
   *
   * @param chunks the layout.
   * @return the copy.
   */
  public static int[][] copy(int[][] chunks) {
    int[][] c = new int[chunks.length][];
    for (int i = 0; i < chunks.length; i++) {
      c[i] = chunks[i].clone();
    }
    return c;
  }

  private static int largestReducible(int[] size, int[] requested, int kind) {
    int axis = -1;
    for (int i = 0; i < size.length; i++) {
      if (requested[i] == kind && size[i] > 1 && (axis < 0 || size[i] > size[axis])) {
        axis = i;
      }
    }
    return axis;
  }

  private static int largestExplicit(int[] size, int[] requested) {
    int axis = -1;
    for (int i = 0; i < size.length; i++) {
      if (requested[i] > 0 && size[i] > 1 && (axis < 0 || size[i] > size[axis])) {
        axis = i;
      }
    }
    return axis;
  }
}
