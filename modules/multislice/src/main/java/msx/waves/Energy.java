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
import static msx.utilities.Constants.ELECTRON_REST_ENERGY_EV;
import static msx.utilities.Constants.ELEMENTARY_CHARGE_SI;
import static msx.utilities.Constants.METERS_TO_ANG;
import static msx.utilities.Constants.PLANCK_CONSTANT_SI;
import static msx.utilities.Constants.SPEED_OF_LIGHT_SI;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Relativistic properties of a fast electron of a given kinetic energy.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Energy {

  /** Planck constant times the speed of light in eV*Angstrom. */
  private static final double HC_EV_ANG =
      PLANCK_CONSTANT_SI * SPEED_OF_LIGHT_SI / ELEMENTARY_CHARGE_SI * METERS_TO_ANG;

  /** Relative tolerance when energies are compared. */
  private static final double TOLERANCE = 1.0e-8;

  private Energy() {
  }

  /**
   * Relativistic electron wavelength.
   *
   * @param energy the kinetic energy [eV].
   * @return the wavelength [Angstrom].
   */
  public static double wavelength(double energy) {
    checkDefined(energy);
    return HC_EV_ANG / sqrt(energy * (2.0 * ELECTRON_REST_ENERGY_EV + energy));
  }

  /**
   * Interaction parameter relating the projected potential to the phase shift of the wave.
   *
   * @param energy the kinetic energy [eV].
   * @return sigma [rad / (V * Angstrom)].
   */
  public static double interactionParameter(double energy) {
    checkDefined(energy);
    double lambda = wavelength(energy);
    return 2.0 * PI / (lambda * energy)
        * (ELECTRON_REST_ENERGY_EV + energy) / (2.0 * ELECTRON_REST_ENERGY_EV + energy);
  }

  /**
   * Throw an IllegalStateException unless the energy is a positive number.
   *
   * @param energy the energy [eV].
   */
  public static void checkDefined(double energy) {
    if (!(energy > 0.0) || Double.isInfinite(energy)) {
      throw new IllegalStateException(format(" The energy %s is not defined.", energy));
    }
  }

  /**
   * Throw an IllegalArgumentException if two energies differ.
   *
   * @param energy the energy [eV].
   * @param other  the other energy [eV].
   */
  public static void checkMatch(double energy, double other) {
    checkDefined(energy);
    checkDefined(other);
    if (abs(energy - other) > TOLERANCE * max(abs(energy), abs(other))) {
      throw new IllegalArgumentException(
          format(" Energy mismatch (%12.4f eV and %12.4f eV).", energy, other));
    }
  }
}
