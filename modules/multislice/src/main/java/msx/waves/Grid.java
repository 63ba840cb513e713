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
package msx.waves;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.max;

import java.util.Arrays;
import msx.numerics.fft.FourierSpace;

/**
 * A periodic 2D simulation grid: the lateral extent of a cell and the number of grid points along
 * each axis.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Grid {

  private static final double TOLERANCE = 1.0e-6;

  private final double[] extent;
  private final int[] gpts;

  /**
   * Constructor for Grid.
   *
   * @param extent the extent along x and y [Angstrom].
   * @param gpts   the number of grid points along x and y.
   */
  public Grid(double[] extent, int[] gpts) {
    if (extent.length != 2 || gpts.length != 2) {
      throw new IllegalArgumentException(" A grid has two dimensions.");
    }
    for (int i = 0; i < 2; i++) {
      if (!(extent[i] > 0.0) || gpts[i] < 1) {
        throw new IllegalArgumentException(format(" Invalid grid (extent %s, gpts %s).",
            Arrays.toString(extent), Arrays.toString(gpts)));
      }
    }
    this.extent = extent.clone();
    this.gpts = gpts.clone();
  }

  /**
   * A grid with at most the requested sampling.
   *
   * @param extent   the extent along x and y [Angstrom].
   * @param sampling the requested sampling [Angstrom].
   * @return the grid.
   */
  public static Grid fromSampling(double[] extent, double sampling) {
    int[] gpts = new int[2];
    for (int i = 0; i < 2; i++) {
      gpts[i] = (int) ceil(extent[i] / sampling - TOLERANCE);
    }
    return new Grid(extent, gpts);
  }

  public double[] getExtent() {
    return extent.clone();
  }

  public int[] getGpts() {
    return gpts.clone();
  }

  /**
   * Real space sampling.
   *
   * @return the grid spacing along x and y [Angstrom].
   */
  public double[] getSampling() {
    return new double[] {extent[0] / gpts[0], extent[1] / gpts[1]};
  }

  /**
   * Reciprocal space sampling.
   *
   * @return the spacing of spatial frequencies along x and y [1 / Angstrom].
   */
  public double[] getReciprocalSampling() {
    return new double[] {1.0 / extent[0], 1.0 / extent[1]};
  }

  /**
   * Spatial frequencies along x, in FFT order.
   *
   * @return the frequencies [1 / Angstrom].
   */
  public double[] getFrequenciesX() {
    return FourierSpace.fftfreq(gpts[0], extent[0] / gpts[0]);
  }

  /**
   * Spatial frequencies along y, in FFT order.
   *
   * @return the frequencies [1 / Angstrom].
   */
  public double[] getFrequenciesY() {
    return FourierSpace.fftfreq(gpts[1], extent[1] / gpts[1]);
  }

  /**
   * The number of grid points per plane.
   *
   * @return nX * nY.
   */
  public int size() {
    return gpts[0] * gpts[1];
  }

  /**
   * Throw an IllegalArgumentException if another grid differs from this one.
   *
   * @param other the other grid.
   */
  public void checkMatch(Grid other) {
    for (int i = 0; i < 2; i++) {
      if (gpts[i] != other.gpts[i]
          || abs(extent[i] - other.extent[i]) > TOLERANCE * max(extent[i], other.extent[i])) {
        throw new IllegalArgumentException(format(" Grid mismatch (%s and %s).", this, other));
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Grid grid = (Grid) o;
    return Arrays.equals(extent, grid.extent) && Arrays.equals(gpts, grid.gpts);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(extent) + Arrays.hashCode(gpts);
  }

  @Override
  public String toString() {
    return format("Grid(extent=[%.4f, %.4f], gpts=[%d, %d])", extent[0], extent[1], gpts[0],
        gpts[1]);
  }
}
