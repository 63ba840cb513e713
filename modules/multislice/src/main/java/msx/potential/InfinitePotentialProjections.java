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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.DataType;
import msx.numerics.fft.FourierSpace;
import msx.waves.Grid;

/**
 * Projects atoms onto a periodic grid assuming each atom's potential extends infinitely along z, so
 * that every atom contributes its full projected potential to the slice that contains it.
 *
 * <p>Atoms are deposited on the grid by bilinear interpolation and the deposited map is convolved
 * in Fourier space with each element's projected scattering factor. With several elements, every
 * element is deposited into its own buffer and transformed, the products with the kernels are
 * accumulated in Fourier space and a single inverse transform is applied to the sum.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InfinitePotentialProjections {

  private static final Logger logger =
      Logger.getLogger(InfinitePotentialProjections.class.getName());

  private final ScatteringFactorParametrization parametrization;
  private final Map<String, ProjectedScatteringFactors> kernels = new ConcurrentHashMap<>();

  /**
   * Constructor for InfinitePotentialProjections.
   *
   * @param parametrization the parametrization of the scattering factors.
   */
  public InfinitePotentialProjections(ScatteringFactorParametrization parametrization) {
    this.parametrization = parametrization;
  }

  public ScatteringFactorParametrization getParametrization() {
    return parametrization;
  }

  /**
   * The (cached) kernel of an element on a grid.
   *
   * @param atomicNumber the atomic number.
   * @param grid         the grid.
   * @return the kernel.
   */
  public ProjectedScatteringFactors getScatteringFactors(int atomicNumber, Grid grid) {
    String key = atomicNumber + ":" + grid;
    return kernels.computeIfAbsent(key,
        k -> new ProjectedScatteringFactors(atomicNumber, grid, parametrization));
  }

  /**
   * Project all atoms onto a single plane.
   *
   * @param atoms the atoms.
   * @param grid  the grid.
   * @return the projected potential [V * Angstrom] with shape [1, nX, nY].
   */
  public ArrayData project(Atoms atoms, Grid grid) {
    return project(atoms, grid, null, 1);
  }

  /**
   * Project atoms onto a stack of planes, one plane per slice.
   *
   * @param atoms      the atoms.
   * @param grid       the grid.
   * @param sliceIndex the slice of each atom (null to project every atom onto one plane).
   * @param numSlices  the number of planes.
   * @return the projected potential [V * Angstrom] with shape [numSlices, nX, nY].
   */
  public ArrayData project(Atoms atoms, Grid grid, int[] sliceIndex, int numSlices) {
    int[] gpts = grid.getGpts();
    int nX = gpts[0];
    int nY = gpts[1];
    int planeSize = nX * nY;
    if (sliceIndex == null && numSlices != 1) {
      throw new IllegalArgumentException(
          format(" Slice indices are required to project onto %d planes.", numSlices));
    }
    if (atoms.size() == 0) {
      return ArrayData.zeros(DataType.FLOAT64, numSlices, nX, nY);
    }

    double[] sampling = grid.getSampling();
    double[][] positions = new double[atoms.size()][2];
    for (int i = 0; i < atoms.size(); i++) {
      double[] p = atoms.getPosition(i);
      positions[i][0] = p[0] / sampling[0];
      positions[i][1] = p[1] / sampling[1];
    }

    int[] unique = atoms.getUniqueNumbers();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Projecting %d atoms of %d element(s) onto %d plane(s) of %s.",
          atoms.size(), unique.length, numSlices, grid));
    }

    if (unique.length == 1) {
      double[] deposited = new double[numSlices * planeSize];
      DeltaSuperposition.superpose(positions, deposited, nX, nY, sliceIndex, numSlices, null);
      double[] complex = toComplex(deposited);
      FourierSpace.fft2Convolve(complex, numSlices, nX, nY,
          getScatteringFactors(unique[0], grid).getKernel(), null);
      return ArrayData.wrap(DataType.FLOAT64, realPart(complex), numSlices, nX, nY);
    }

    double[] accumulator = new double[2 * numSlices * planeSize];
    for (int number : unique) {
      int count = 0;
      for (int i = 0; i < atoms.size(); i++) {
        if (atoms.getNumber(i) == number) {
          count++;
        }
      }
      double[][] speciesPositions = new double[count][];
      int[] speciesIndex = sliceIndex == null ? null : new int[count];
      int k = 0;
      for (int i = 0; i < atoms.size(); i++) {
        if (atoms.getNumber(i) == number) {
          speciesPositions[k] = positions[i];
          if (speciesIndex != null) {
            speciesIndex[k] = sliceIndex[i];
          }
          k++;
        }
      }
      // A new buffer per element.
      double[] deposited = new double[numSlices * planeSize];
      DeltaSuperposition.superpose(speciesPositions, deposited, nX, nY, speciesIndex, numSlices,
          null);
      double[] complex = toComplex(deposited);
      FourierSpace.fft2(complex, numSlices, nX, nY);
      FourierSpace.multiply(complex, numSlices, planeSize,
          getScatteringFactors(number, grid).getKernel(), null);
      for (int i = 0; i < accumulator.length; i++) {
        accumulator[i] += complex[i];
      }
    }
    FourierSpace.ifft2(accumulator, numSlices, nX, nY);
    return ArrayData.wrap(DataType.FLOAT64, realPart(accumulator), numSlices, nX, nY);
  }

  private static double[] toComplex(double[] real) {
    double[] complex = new double[2 * real.length];
    for (int i = 0; i < real.length; i++) {
      complex[2 * i] = real[i];
    }
    return complex;
  }

  private static double[] realPart(double[] complex) {
    double[] real = new double[complex.length / 2];
    for (int i = 0; i < real.length; i++) {
      real[i] = complex[2 * i];
    }
    return real;
  }
}
