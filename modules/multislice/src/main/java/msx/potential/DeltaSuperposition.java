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
package msx.potential;

import static java.lang.String.format;
import static msx.numerics.math.ScalarMath.mod;
import static org.apache.commons.math3.util.FastMath.floor;

/**
 * Deposits point weights on a periodic 2D grid by bilinear interpolation. A point at fractional
 * grid coordinates (r + x, c + y), with integer r and c, deposits the weights (1 - x)(1 - y),
 * x(1 - y), (1 - x)y and xy on the cells (r, c), (r + 1, c), (r, c + 1) and (r + 1, c + 1), with
 * indices wrapped around the grid.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DeltaSuperposition {

  private DeltaSuperposition() {
  }

  /**
   * Deposit points on a single plane.
   *
   * @param positions the positions in grid units, one (row, column) pair per point.
   * @param array     the plane, row-major with shape [nX, nY]; updated in place.
   * @param nX        the number of rows.
   * @param nY        the number of columns.
   * @param weights   the weight of each point (null for unit weights).
   * @return the array.
   */
  public static double[] superpose(double[][] positions, double[] array, int nX, int nY,
      double[] weights) {
    return superpose(positions, array, nX, nY, null, 1, weights);
  }

  /**
   * Deposit points on a stack of planes.
   *
   * @param positions  the positions in grid units, one (row, column) pair per point.
   * @param array      the planes, row-major with shape [nPlanes, nX, nY]; updated in place.
   * @param nX         the number of rows.
   * @param nY         the number of columns.
   * @param planeIndex the plane of each point (null to use plane 0 for every point).
   * @param nPlanes    the number of planes.
   * @param weights    the weight of each point (null for unit weights).
   * @return the array.
   */
  public static double[] superpose(double[][] positions, double[] array, int nX, int nY,
      int[] planeIndex, int nPlanes, double[] weights) {
    int planeSize = nX * nY;
    if (array.length != nPlanes * planeSize) {
      throw new IllegalArgumentException(format(
          " An array of length %d does not hold %d planes of shape [%d, %d].", array.length,
          nPlanes, nX, nY));
    }
    if (planeIndex != null && planeIndex.length != positions.length) {
      throw new IllegalArgumentException(" One plane index is required per point.");
    }
    if (weights != null && weights.length != positions.length) {
      throw new IllegalArgumentException(" One weight is required per point.");
    }
    for (int p = 0; p < positions.length; p++) {
      double px = positions[p][0];
      double py = positions[p][1];
      double rows = floor(px);
      double cols = floor(py);
      double x = px - rows;
      double y = py - cols;
      double xy = x * y;
      double w = weights == null ? 1.0 : weights[p];
      int offset = (planeIndex == null ? 0 : planeIndex[p]) * planeSize;
      int r0 = mod((int) rows, nX);
      int r1 = mod((int) rows + 1, nX);
      int c0 = mod((int) cols, nY);
      int c1 = mod((int) cols + 1, nY);
      array[offset + r0 * nY + c0] += (1.0 + xy - y - x) * w;
      array[offset + r1 * nY + c0] += (x - xy) * w;
      array[offset + r0 * nY + c1] += (y - xy) * w;
      array[offset + r1 * nY + c1] += xy * w;
    }
    return array;
  }
}
