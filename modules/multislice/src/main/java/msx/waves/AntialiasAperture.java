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

import static msx.numerics.math.ScalarMath.ensureParity;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import msx.numerics.fft.FourierSpace;

/**
 * The antialiasing aperture removes spatial frequencies above two thirds of the Nyquist frequency,
 * so that products of band-limited functions (for example a transmission function and a wave
 * function) do not wrap around the periodic grid.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AntialiasAperture {

  /** Fraction of the Nyquist frequency that is kept. */
  public static final double CUTOFF = 2.0 / 3.0;

  private static final Map<Grid, double[]> masks = new ConcurrentHashMap<>();

  private AntialiasAperture() {
  }

  /**
   * The cutoff spatial frequency of a grid.
   *
   * @param grid the grid.
   * @return the radius of the aperture [1 / Angstrom].
   */
  public static double cutoffFrequency(Grid grid) {
    double[] sampling = grid.getSampling();
    return CUTOFF / (2.0 * max(sampling[0], sampling[1]));
  }

  /**
   * The aperture on a grid, in FFT order. Shared between callers; must not be modified.
   *
   * @param grid the grid.
   * @return nX * nY values of one (kept) or zero (removed).
   */
  public static double[] mask(Grid grid) {
    return masks.computeIfAbsent(grid, AntialiasAperture::createMask);
  }

  private static double[] createMask(Grid grid) {
    double[] kx = grid.getFrequenciesX();
    double[] ky = grid.getFrequenciesY();
    double cutoff2 = cutoffFrequency(grid) * cutoffFrequency(grid);
    double[] mask = new double[kx.length * ky.length];
    for (int i = 0; i < kx.length; i++) {
      for (int j = 0; j < ky.length; j++) {
        if (kx[i] * kx[i] + ky[j] * ky[j] < cutoff2) {
          mask[i * ky.length + j] = 1.0;
        }
      }
    }
    return mask;
  }

  /**
   * Band-limit a stack of real space complex planes in place.
   *
   * @param data    interleaved complex data.
   * @param nPlanes the number of planes.
   * @param grid    the grid of every plane.
   */
  public static void bandlimit(double[] data, int nPlanes, Grid grid) {
    int[] gpts = grid.getGpts();
    FourierSpace.fft2Convolve(data, nPlanes, gpts[0], gpts[1], mask(grid), null);
  }

  /**
   * Grid points spanned by the aperture diameter, with the parity of the grid.
   *
   * @param grid the grid.
   * @return the number of grid points along x and y.
   */
  public static int[] cutoffGpts(Grid grid) {
    double[] extent = grid.getExtent();
    int[] gpts = grid.getGpts();
    double diameter = 2.0 * cutoffFrequency(grid);
    int[] cutoff = new int[2];
    for (int i = 0; i < 2; i++) {
      cutoff[i] = ensureParity((int) floor(diameter * extent[i] + 1.0e-9), gpts[i] % 2 == 0, 1);
    }
    return cutoff;
  }

  /**
   * Grid points of the largest rectangle that fits inside the aperture, with the parity of the
   * grid.
   *
   * @param grid the grid.
   * @return the number of grid points along x and y.
   */
  public static int[] validGpts(Grid grid) {
    int[] cutoff = cutoffGpts(grid);
    int[] gpts = grid.getGpts();
    int[] valid = new int[2];
    for (int i = 0; i < 2; i++) {
      valid[i] = ensureParity((int) floor(cutoff[i] / sqrt(2.0)), gpts[i] % 2 == 0, 1);
    }
    return valid;
  }
}
