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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;

import java.util.Arrays;
import org.apache.commons.math3.util.Precision;

/**
 * Validation of the thickness of the slices a structure is divided into.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SliceThickness {

  /** Relative tolerance used when a sum of slice thicknesses is compared to a total. */
  private static final double RELATIVE_TOLERANCE = 1.0e-5;

  /** Absolute tolerance used when a sum of slice thicknesses is compared to a total. */
  private static final double ABSOLUTE_TOLERANCE = 1.0e-8;

  private SliceThickness() {
  }

  /**
   * Divide a total thickness into equal slices no thicker than a step.
   *
   * @param step      the maximum slice thickness [Angstrom].
   * @param thickness the total thickness [Angstrom].
   * @return the slice thicknesses.
   */
  public static double[] validate(double step, double thickness) {
    if (!(step > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid slice thickness %s.", step));
    }
    int n = (int) ceil(thickness / step);
    double[] sliceThickness = new double[n];
    Arrays.fill(sliceThickness, thickness / n);
    return validate(sliceThickness, thickness);
  }

  /**
   * Repeat a slice thickness.
   *
   * @param step      the slice thickness [Angstrom].
   * @param numSlices the number of slices.
   * @return the slice thicknesses.
   */
  public static double[] repeat(double step, int numSlices) {
    if (!(step > 0.0) || numSlices < 0) {
      throw new IllegalArgumentException(
          format(" Invalid slice thickness %s or number of slices %d.", step, numSlices));
    }
    double[] sliceThickness = new double[numSlices];
    Arrays.fill(sliceThickness, step);
    return sliceThickness;
  }

  /**
   * Check that explicit slice thicknesses sum to a total thickness.
   *
   * @param sliceThickness the slice thicknesses [Angstrom].
   * @param thickness      the total thickness [Angstrom].
   * @return a copy of the slice thicknesses.
   */
  public static double[] validate(double[] sliceThickness, double thickness) {
    double sum = checkPositive(sliceThickness);
    if (!isClose(sum, thickness)) {
      throw new IllegalArgumentException(format(
          " The slice thicknesses sum to %12.6f A, not to the thickness %12.6f A.", sum,
          thickness));
    }
    return sliceThickness.clone();
  }

  /**
   * Check the number of explicit slice thicknesses.
   *
   * @param sliceThickness the slice thicknesses [Angstrom].
   * @param numSlices      the required number of slices.
   * @return a copy of the slice thicknesses.
   */
  public static double[] validate(double[] sliceThickness, int numSlices) {
    checkPositive(sliceThickness);
    if (sliceThickness.length != numSlices) {
      throw new IllegalArgumentException(format(" Found %d slice thicknesses for %d slices.",
          sliceThickness.length, numSlices));
    }
    return sliceThickness.clone();
  }

  /**
   * The depth interval covered by each slice.
   *
   * @param sliceThickness the slice thicknesses [Angstrom].
   * @return one (start, end) pair per slice.
   */
  public static double[][] sliceLimits(double[] sliceThickness) {
    double[][] limits = new double[sliceThickness.length][2];
    double z = 0.0;
    for (int i = 0; i < sliceThickness.length; i++) {
      limits[i][0] = z;
      z += sliceThickness[i];
      limits[i][1] = z;
    }
    return limits;
  }

  /**
   * The running sum of the slice thicknesses.
   *
   * @param sliceThickness the slice thicknesses [Angstrom].
   * @return the depth of the exit surface of each slice.
   */
  public static double[] cumulative(double[] sliceThickness) {
    double[] cumulative = new double[sliceThickness.length];
    double z = 0.0;
    for (int i = 0; i < sliceThickness.length; i++) {
      z += sliceThickness[i];
      cumulative[i] = z;
    }
    return cumulative;
  }

  private static double checkPositive(double[] sliceThickness) {
    double sum = 0.0;
    for (double t : sliceThickness) {
      if (!(t > 0.0)) {
        throw new IllegalArgumentException(
            format(" Invalid slice thickness %s in %s.", t, Arrays.toString(sliceThickness)));
      }
      sum += t;
    }
    return sum;
  }

  private static boolean isClose(double a, double b) {
    return Precision.equals(a, b, ABSOLUTE_TOLERANCE)
        || abs(a - b) <= ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * abs(b);
  }
}
