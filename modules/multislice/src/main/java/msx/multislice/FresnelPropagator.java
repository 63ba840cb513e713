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
package msx.multislice;

import static msx.utilities.Constants.MRAD_TO_RAD;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.tan;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import msx.array.ArrayData;
import msx.numerics.fft.FourierSpace;
import msx.waves.AntialiasAperture;
import msx.waves.Energy;
import msx.waves.Grid;

/**
 * The Fresnel free space propagator exp(-i pi lambda k^2 dz), band-limited by the antialias
 * aperture. A beam tilt adds the phase ramp exp(-2 pi i dz (kx tan(tx) + ky tan(ty))).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FresnelPropagator {

  private final Grid grid;
  private final double energy;
  private final double tiltX;
  private final double tiltY;
  private final Map<Double, double[][]> kernels = new ConcurrentHashMap<>();

  /**
   * Constructor for FresnelPropagator.
   *
   * @param grid   the grid.
   * @param energy the electron energy [eV].
   * @param tiltX  the beam tilt along x [mrad].
   * @param tiltY  the beam tilt along y [mrad].
   */
  public FresnelPropagator(Grid grid, double energy, double tiltX, double tiltY) {
    Energy.checkDefined(energy);
    this.grid = grid;
    this.energy = energy;
    this.tiltX = tiltX;
    this.tiltY = tiltY;
  }

  /**
   * An untilted propagator.
   *
   * @param grid   the grid.
   * @param energy the electron energy [eV].
   */
  public FresnelPropagator(Grid grid, double energy) {
    this(grid, energy, 0.0, 0.0);
  }

  public Grid getGrid() {
    return grid;
  }

  public double getEnergy() {
    return energy;
  }

  /**
   * The propagator for a thickness, in FFT order.
   *
   * @param thickness the propagation distance [Angstrom].
   * @return the real and imaginary parts; shared between callers and must not be modified.
   */
  public double[][] getKernel(double thickness) {
    return kernels.computeIfAbsent(thickness, this::createKernel);
  }

  private double[][] createKernel(double thickness) {
    double lambda = Energy.wavelength(energy);
    double[] kx = grid.getFrequenciesX();
    double[] ky = grid.getFrequenciesY();
    double[] mask = AntialiasAperture.mask(grid);
    double tx = tan(tiltX * MRAD_TO_RAD);
    double ty = tan(tiltY * MRAD_TO_RAD);
    int n = kx.length * ky.length;
    double[] re = new double[n];
    double[] im = new double[n];
    for (int i = 0; i < kx.length; i++) {
      for (int j = 0; j < ky.length; j++) {
        int index = i * ky.length + j;
        if (mask[index] == 0.0) {
          continue;
        }
        double phase = -PI * lambda * thickness * (kx[i] * kx[i] + ky[j] * ky[j])
            - 2.0 * PI * thickness * (kx[i] * tx + ky[j] * ty);
        re[index] = cos(phase) * mask[index];
        im[index] = sin(phase) * mask[index];
      }
    }
    return new double[][] {re, im};
  }

  /**
   * Propagate a stack of real space wave functions. The buffer of the argument is reused for the
   * result and the argument handle is invalidated.
   *
   * @param waves     complex planes on the grid of this propagator.
   * @param thickness the propagation distance [Angstrom].
   * @return a handle that owns the propagated waves.
   */
  public ArrayData propagate(ArrayData waves, double thickness) {
    ArrayData owned = waves.transferOwnership();
    propagate(owned.getData(), owned.getSize() / grid.size(), thickness);
    return owned;
  }

  /**
   * Propagate a stack of real space wave functions in place.
   *
   * @param waves     interleaved complex planes.
   * @param nPlanes   the number of planes.
   * @param thickness the propagation distance [Angstrom].
   */
  public void propagate(double[] waves, int nPlanes, double thickness) {
    int[] gpts = grid.getGpts();
    double[][] kernel = getKernel(thickness);
    FourierSpace.fft2Convolve(waves, nPlanes, gpts[0], gpts[1], kernel[0], kernel[1]);
  }
}
