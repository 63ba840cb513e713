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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import msx.array.ComputeSettings;
import msx.array.Device;
import msx.potential.Atoms;
import msx.potential.Potential;
import msx.utilities.MSXTest;
import msx.waves.PlaneWave;
import msx.waves.Waves;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Propagation of a plane wave through vacuum must not change its reciprocal space intensity.
 */
@RunWith(Parameterized.class)
public class VacuumPropagationTest extends MSXTest {

  private final String info;
  private final int gpts;
  private final double depth;
  private final double sliceThickness;
  private final double energy;
  private final boolean lazy;

  public VacuumPropagationTest(String info, int gpts, double depth, double sliceThickness,
      double energy, boolean lazy) {
    this.info = info;
    this.gpts = gpts;
    this.depth = depth;
    this.sliceThickness = sliceThickness;
    this.energy = energy;
    this.lazy = lazy;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Single slice", 32, 2.0, 2.0, 100.0e3, false},
        {"Ten slices", 32, 5.0, 0.5, 100.0e3, false},
        {"Odd grid", 45, 4.0, 1.0, 200.0e3, false},
        {"Lazy", 48, 3.0, 1.0, 300.0e3, true}
    });
  }

  @Test
  public void testIntensityIsConserved() {
    Atoms vacuum = new Atoms(new double[0][], new int[0], Atoms.orthogonalCell(6.0, 6.0, depth));
    Potential potential = new Potential(vacuum, new int[] {gpts, gpts}, sliceThickness);
    ComputeSettings settings = new ComputeSettings(Device.CPU, lazy, 1L << 20, 2, false);
    PlaneWave planeWave = new PlaneWave(potential.getGrid(), energy, true, 0.0, 0.0, null);

    Waves entrance = planeWave.build(settings.withLazy(false));
    Waves exit = (Waves) planeWave.multislice(potential, null, settings).get(0)
        .compute(settings);
    assertArrayEquals(info, new int[] {gpts, gpts}, exit.getShape());

    double before = reciprocalIntensity(entrance);
    double after = reciprocalIntensity(exit);
    assertEquals(info + " reciprocal space intensity", 1.0, before, 1.0e-10);
    assertEquals(info + " reciprocal space intensity", before, after, 1.0e-8);
  }

  private static double reciprocalIntensity(Waves waves) {
    double sum = 0.0;
    for (double v : waves.ensureReciprocalSpace().getArray().getData()) {
      sum += v * v;
    }
    return sum;
  }
}
