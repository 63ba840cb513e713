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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests validation of slice thicknesses. */
public class SliceThicknessTest extends MSXTest {

  private static double sum(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum;
  }

  @Test
  public void testStepDividesThickness() {
    double[] thickness = SliceThickness.validate(0.5, 2.0);
    assertArrayEquals(new double[] {0.5, 0.5, 0.5, 0.5}, thickness, 1.0e-12);
  }

  @Test
  public void testStepRoundsUpTheNumberOfSlices() {
    double[] thickness = SliceThickness.validate(0.7, 2.0);
    assertEquals(3, thickness.length);
    assertEquals(2.0, sum(thickness), 1.0e-12);
    assertEquals(2.0 / 3.0, thickness[0], 1.0e-12);
  }

  @Test
  public void testExplicitThickness() {
    double[] thickness = SliceThickness.validate(new double[] {0.5, 1.0, 0.5}, 2.0);
    assertEquals(2.0, sum(thickness), 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInconsistentSum() {
    SliceThickness.validate(new double[] {0.5, 1.0}, 2.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInconsistentNumberOfSlices() {
    SliceThickness.validate(new double[] {1.0, 1.0}, 3);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveThickness() {
    SliceThickness.validate(new double[] {2.5, -0.5}, 2.0);
  }

  @Test
  public void testLimits() {
    double[][] limits = SliceThickness.sliceLimits(new double[] {1.0, 0.5, 0.5});
    assertArrayEquals(new double[] {0.0, 1.0}, limits[0], 1.0e-12);
    assertArrayEquals(new double[] {1.0, 1.5}, limits[1], 1.0e-12);
    assertArrayEquals(new double[] {1.5, 2.0}, limits[2], 1.0e-12);
    assertArrayEquals(new double[] {1.0, 1.5, 2.0},
        SliceThickness.cumulative(new double[] {1.0, 0.5, 0.5}), 1.0e-12);
  }
}
