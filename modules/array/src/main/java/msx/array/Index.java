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

/**
 * An index along one ensemble axis: either a single position (which removes the axis) or a
 * contiguous range [start, stop) (which keeps it). Negative values count from the end of the axis
 * and ranges are clamped to the axis length.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Index {

  private static final Index ALL = new Index(false, 0, null);

  private final boolean single;
  private final int start;
  private final Integer stop;

  private Index(boolean single, int start, Integer stop) {
    this.single = single;
    this.start = start;
    this.stop = stop;
  }

  /**
   * A single position.
   *
   * @param i the position (negative values count from the end).
   * @return the Index.
   */
  public static Index at(int i) {
    return new Index(true, i, null);
  }

  /**
   * The range [start, stop).
   *
   * @param start first position.
   * @param stop  end position (exclusive).
   * @return the Index.
   */
  public static Index range(int start, int stop) {
    return new Index(false, start, stop);
  }

  /**
   * The range [start, end of axis).
   *
   * @param start first position.
   * @return the Index.
   */
  public static Index from(int start) {
    return new Index(false, start, null);
  }

  /**
   * The full axis.
   *
   * @return the Index.
   */
  public static Index all() {
    return ALL;
  }

  /**
   * True if this Index selects a single position.
   *
   * @return true for a single position.
   */
  public boolean isSingle() {
    return single;
  }

  /**
   * Convert a single position into a range of length one.
   *
   * @return an Index that keeps its axis.
   */
  public Index keepDims() {
    if (!single) {
      return this;
    }
    if (start == -1) {
      return new Index(false, -1, null);
    }
    return new Index(false, start, start + 1);
  }

  /**
   * The first selected position for an axis of length n.
   *
   * @param n the axis length.
   * @return the first position.
   */
  public int getStart(int n) {
    if (single) {
      int i = start < 0 ? start + n : start;
      if (i < 0 || i >= n) {
        throw new IndexOutOfBoundsException(
            format(" Index %d is out of bounds for an axis of length %d.", start, n));
      }
      return i;
    }
    int s = start < 0 ? start + n : start;
    return Math.max(0, Math.min(s, n));
  }

  /**
   * The end (exclusive) of the selection for an axis of length n.
   *
   * @param n the axis length.
   * @return the end position.
   */
  public int getStop(int n) {
    if (single) {
      return getStart(n) + 1;
    }
    int s = getStart(n);
    if (stop == null) {
      return n;
    }
    int e = stop < 0 ? stop + n : stop;
    return Math.max(s, Math.min(e, n));
  }

  /**
   * The number of selected positions.
   *
   * @param n the axis length.
   * @return the selection length.
   */
  public int getLength(int n) {
    return getStop(n) - getStart(n);
  }

  @Override
  public String toString() {
    if (single) {
      return Integer.toString(start);
    }
    return format("%d:%s", start, stop == null ? "" : stop.toString());
  }
}
