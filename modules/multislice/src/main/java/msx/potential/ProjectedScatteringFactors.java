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

import static msx.numerics.math.ScalarMath.sinc;
import static org.apache.commons.math3.util.FastMath.sqrt;

import msx.waves.Grid;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The projected scattering factor of one element sampled on the spatial frequencies of a grid and
 * divided by the transfer function of bilinear deposition. Convolving a map of atoms deposited with
 * {@link DeltaSuperposition} by this kernel yields the projected potential.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ProjectedScatteringFactors {

  private final int atomicNumber;
  private final Grid grid;
  private final double[] kernel;

  /**
   * Constructor for ProjectedScatteringFactors.
   *
   * @param atomicNumber    the atomic number.
   * @param grid            the grid.
   * @param parametrization the parametrization of the scattering factor.
   */
  public ProjectedScatteringFactors(int atomicNumber, Grid grid,
      ScatteringFactorParametrization parametrization) {
    this.atomicNumber = atomicNumber;
    this.grid = grid;
    UnivariateFunction f = parametrization.projectedScatteringFactor(atomicNumber);
    double[] kx = grid.getFrequenciesX();
    double[] ky = grid.getFrequenciesY();
    double[] sampling = grid.getSampling();
    double area = sampling[0] * sampling[1];
    kernel = new double[kx.length * ky.length];
    for (int i = 0; i < kx.length; i++) {
      double kxs = kx[i] * sampling[0];
      for (int j = 0; j < ky.length; j++) {
        double kys = ky[j] * sampling[1];
        double k = sqrt(kx[i] * kx[i] + ky[j] * ky[j]);
        kernel[i * ky.length + j] = f.value(k) / (sinc(sqrt(kxs * kxs + kys * kys)) * area);
      }
    }
  }

  public int getAtomicNumber() {
    return atomicNumber;
  }

  public Grid getGrid() {
    return grid;
  }

  /**
   * The kernel in FFT order. Shared; must not be modified.
   *
   * @return nX * nY real values.
   */
  public double[] getKernel() {
    return kernel;
  }
}
