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
import java.util.Collections;
import java.util.List;

/**
 * The arguments of an ensemble split into blocks: for each ensemble axis, one argument per chunk.
 * The argument of a block is typically the sub-list of the axis values that the chunk covers.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PartitionedArgs {

  private static final PartitionedArgs EMPTY = new PartitionedArgs(Collections.emptyList());

  private final List<List<Object>> axes;

  /**
   * Constructor for PartitionedArgs.
   *
   * @param axes for each ensemble axis, one argument per chunk.
   */
  public PartitionedArgs(List<List<Object>> axes) {
    List<List<Object>> copy = new ArrayList<>(axes.size());
    for (List<Object> axis : axes) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(axis)));
    }
    this.axes = Collections.unmodifiableList(copy);
  }

  /**
   * Arguments of an ensemble without axes.
   *
   * @return the empty arguments.
   */
  public static PartitionedArgs empty() {
    return EMPTY;
  }

  /**
   * Arguments of a single axis whose values are split by chunk.
   *
   * @param values the axis values.
   * @param chunks the chunk sizes.
   * @return the partitioned arguments.
   */
  public static PartitionedArgs of(List<?> values, int[] chunks) {
    return new PartitionedArgs(Collections.singletonList(split(values, chunks)));
  }

  /**
   * Split values into consecutive sub-lists.
   *
   * @param values the values.
   * @param chunks the sub-list sizes.
   * @return one sub-list per chunk.
   */
  public static List<Object> split(List<?> values, int[] chunks) {
    List<Object> blocks = new ArrayList<>(chunks.length);
    int start = 0;
    for (int c : chunks) {
      if (start + c > values.size()) {
        throw new IllegalArgumentException(format(" Chunks exceed the %d values of the axis.",
            values.size()));
      }
      blocks.add(Collections.unmodifiableList(new ArrayList<>(values.subList(start, start + c))));
      start += c;
    }
    return blocks;
  }

  /**
   * The number of ensemble axes.
   *
   * @return the rank.
   */
  public int getRank() {
    return axes.size();
  }

  /**
   * The number of blocks along each axis.
   *
   * @return the block counts.
   */
  public int[] getNumBlocks() {
    int[] n = new int[axes.size()];
    for (int i = 0; i < n.length; i++) {
      n[i] = axes.get(i).size();
    }
    return n;
  }

  /**
   * The arguments of one block.
   *
   * @param blockIndex the block index.
   * @return one argument per axis.
   */
  public Object[] getBlock(int[] blockIndex) {
    if (blockIndex.length != axes.size()) {
      throw new IllegalArgumentException(format(" Block index of rank %d for %d axes.",
          blockIndex.length, axes.size()));
    }
    Object[] args = new Object[axes.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = axes.get(i).get(blockIndex[i]);
    }
    return args;
  }

  /**
   * These arguments followed by another set.
   *
   * @param other the following arguments.
   * @return the combined arguments.
   */
  public PartitionedArgs concat(PartitionedArgs other) {
    List<List<Object>> joined = new ArrayList<>(axes);
    joined.addAll(other.axes);
    return new PartitionedArgs(joined);
  }
}
