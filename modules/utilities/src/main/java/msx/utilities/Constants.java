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
package msx.utilities;

/**
 * Library class containing physical constants and unit conversions used to describe fast electrons.
 *
 * @author Jacob M. Litman
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  // SI units: kg, m, s, C, K, mol, lm
  // Our typical units: Angstrom, eV, Volts, milliradians.
  // Below constants are defining constants of SI as of May 20 2019 (BIPM).

  /** Speed of light in m/s, defining the meter. <code>SPEED_OF_LIGHT_SI=299792458</code> */
  public static final int SPEED_OF_LIGHT_SI = 299792458;
  /**
   * Planck constant in J*s, defining the kilogram (by defining the derived Joule) <code>
   * PLANCK_CONSTANT_SI=6.62607015E-34d</code>
   */
  public static final double PLANCK_CONSTANT_SI = 6.62607015E-34d;
  /**
   * Elementary charge in Coulombs, defining the Coulomb. <code>
   *  ELEMENTARY_CHARGE_SI=1.602176634E-19d</code>
   */
  public static final double ELEMENTARY_CHARGE_SI = 1.602176634E-19d;
  /**
   * Electron rest mass in kg (CODATA 2018). <code>ELECTRON_MASS_SI=9.1093837015E-31d</code>
   */
  public static final double ELECTRON_MASS_SI = 9.1093837015E-31d;
  /** Constant <code>METERS_TO_ANG=1E10</code> */
  public static final double METERS_TO_ANG = 1E10;
  /** Constant <code>ANG_TO_METERS=1E-10</code> */
  public static final double ANG_TO_METERS = 1E-10;
  /** Constant <code>MRAD_TO_RAD=1E-3</code> */
  public static final double MRAD_TO_RAD = 1E-3;
  /** Constant <code>RAD_TO_MRAD=1E3</code> */
  public static final double RAD_TO_MRAD = 1E3;
  /**
   * Electron rest energy in eV. <code>ELECTRON_REST_ENERGY_EV = ELECTRON_MASS_SI *
   * SPEED_OF_LIGHT_SI^2 / ELEMENTARY_CHARGE_SI</code>
   */
  public static final double ELECTRON_REST_ENERGY_EV =
      ELECTRON_MASS_SI * (double) SPEED_OF_LIGHT_SI * (double) SPEED_OF_LIGHT_SI
          / ELEMENTARY_CHARGE_SI;
  /** Bohr radius in Angstroms (CODATA 2018). <code>BOHR_RADIUS_ANG=0.529177210903</code> */
  public static final double BOHR_RADIUS_ANG = 0.529177210903;
  /**
   * Coulomb constant times the elementary charge, e / (4 pi eps0), in V*Angstrom. <code>
   * COULOMB_V_ANG=14.399645478</code>
   */
  public static final double COULOMB_V_ANG = 14.399645478;
  /** Number of bytes in one mebibyte. <code>MIB=1048576</code> */
  public static final long MIB = 1024L * 1024L;

  private Constants() {
  }
}
