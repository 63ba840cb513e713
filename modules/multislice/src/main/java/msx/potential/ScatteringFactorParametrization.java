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

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * A parametrization of atomic potentials in terms of their Fourier transform.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ScatteringFactorParametrization {

  /**
   * The projected scattering factor of an element: the 2D Fourier transform of the projected
   * potential of one atom as a function of the spatial frequency |k| [1 / Angstrom]. Values are in
   * V * Angstrom^3, so that convolving the number density of atoms [1 / Angstrom^2] with it yields
   * the projected potential in V * Angstrom.
   *
   * @param atomicNumber the atomic number.
   * @return the projected scattering factor.
   */
  UnivariateFunction projectedScatteringFactor(int atomicNumber);

  /**
   * A short name for logging.
   *
   * @return the name.
   */
  String getName();
}
