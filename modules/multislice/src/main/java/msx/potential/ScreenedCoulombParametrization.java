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
import static msx.utilities.Constants.BOHR_RADIUS_ANG;
import static msx.utilities.Constants.COULOMB_V_ANG;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cbrt;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The screened Coulomb (Wentzel) atom: a nuclear Coulomb potential screened exponentially with the
 * Thomas-Fermi radius 0.885 a0 Z^(-1/3). Its electron scattering factor in the first Born
 * approximation is f(q) = 2 Z / (a0 (q^2 + 1 / R^2)) with q = 2 pi |k|.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScreenedCoulombParametrization implements ScatteringFactorParametrization {

  /** Thomas-Fermi screening prefactor. */
  private static final double THOMAS_FERMI = 0.885;

  /** Converts a scattering factor [Angstrom] to a potential transform [V * Angstrom^3]. */
  private static final double KAPPA = 2.0 * PI * BOHR_RADIUS_ANG * COULOMB_V_ANG;

  /**
   * The screening radius of an element.
   *
   * @param atomicNumber the atomic number.
   * @return R [Angstrom].
   */
  public static double screeningRadius(int atomicNumber) {
    if (atomicNumber < 1) {
      throw new IllegalArgumentException(format(" Invalid atomic number %d.", atomicNumber));
    }
    return THOMAS_FERMI * BOHR_RADIUS_ANG / cbrt(atomicNumber);
  }

  @Override
  public UnivariateFunction projectedScatteringFactor(int atomicNumber) {
    double radius = screeningRadius(atomicNumber);
    double inverseRadius2 = 1.0 / (radius * radius);
    double prefactor = KAPPA * 2.0 * atomicNumber / BOHR_RADIUS_ANG;
    return k -> {
      double q = 2.0 * PI * k;
      return prefactor / (q * q + inverseRadius2);
    };
  }

  @Override
  public String getName() {
    return "screened Coulomb";
  }
}
