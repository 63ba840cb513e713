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

import msx.potential.Atoms;
import msx.waves.Waves;

/**
 * Scatters wave functions inelastically at transition sites.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface TransitionPotential {

  /** Label of the axis of scattered waves. */
  String TRANSITIONS_LABEL = "transitions";

  /**
   * The number of transitions per site.
   *
   * @return the number of transitions.
   */
  int getNumTransitions();

  /**
   * The sites where this potential scatters.
   *
   * @param sites candidate sites.
   * @return the sites that take part in a transition.
   */
  Atoms validateSites(Atoms sites);

  /**
   * Scatter real space waves at every transition of every site.
   *
   * @param waves eager real space waves.
   * @param sites the sites (already validated).
   * @return waves with a leading axis of length (number of sites) * (number of transitions),
   *     followed by the ensemble axes of the input.
   */
  Waves generateScatteredWaves(Waves waves, Atoms sites);
}
