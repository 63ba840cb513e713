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
package msx.numerics.math;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * The ScalarMath class is a simple math library that operates on single variables.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ScalarMath {

  private ScalarMath() {
  }

  /**
   * This is an atypical mod function used by periodic grids. The result is always in [0, b).
   *
   * @param a Value to apply the mod to.
   * @param b Modulus.
   * @return a mod b, non-negative.
   */
  public static int mod(int a, int b) {
    int res = a % b;
    if (res < 0) {
      res += b;
    }
    return res;
  }

  /**
   * This is an atypical mod function used by periodic grids. The result is always in [0, b).
   *
   * @param a Value to apply the mod to.
   * @param b Modulus.
   * @return a mod b, non-negative.
   */
  public static double mod(double a, double b) {
    double res = a % b;
    if (res < 0.0) {
      res += b;
    }
    return res;
  }

  /**
   * The normalized sinc function sin(pi x) / (pi x).
   *
   * @param x the argument.
   * @return sinc(x), with sinc(0) = 1.
   */
  public static double sinc(double x) {
    if (abs(x) < 1.0e-12) {
      return 1.0;
    }
    double px = PI * x;
    return sin(px) / px;
  }

  /**
   * Flip the parity of n when its parity does not match the request.
   *
   * @param n    the value.
   * @param even true if an even value is required.
   * @param step +1 or -1.
   * @return n, or n + step when the parity of n differs from the request.
   */
  public static int ensureParity(int n, boolean even, int step) {
    if (step != 1 && step != -1) {
      throw new IllegalArgumentException(" The parity step must be +1 or -1.");
    }
    boolean isEven = n % 2 == 0;
    if (isEven != even) {
      return n + step;
    }
    return n;
  }
}
