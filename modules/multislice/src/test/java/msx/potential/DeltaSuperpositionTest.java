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

import static org.junit.Assert.assertEquals;

import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests bilinear scatter-add of points onto a periodic grid. */
public class DeltaSuperpositionTest extends MSXTest {

  private static final double TOLERANCE = 1.0e-12;

  private static double sum(double[] array) {
    double sum = 0.0;
    for (double v : array) {
      sum += v;
    }
    return sum;
  }

  @Test
  public void testWeightsSumToOne() {
    double[][] positions = {{2.3, 1.7}};
    double[] array = DeltaSuperposition.superpose(positions, new double[25], 5, 5, null);
    assertEquals(1.0, sum(array), TOLERANCE);
    assertEquals(0.7 * 0.3, array[2 * 5 + 1], TOLERANCE);
    assertEquals(0.3 * 0.3, array[3 * 5 + 1], TOLERANCE);
    assertEquals(0.7 * 0.7, array[2 * 5 + 2], TOLERANCE);
    assertEquals(0.3 * 0.7, array[3 * 5 + 2], TOLERANCE);
  }

  @Test
  public void testIntegerPositionDepositsOnOneCell() {
    double[][] positions = {{0.0, 0.0}};
    double[] array = DeltaSuperposition.superpose(positions, new double[16], 4, 4, null);
    assertEquals(1.0, array[0], 0.0);
    assertEquals(1.0, sum(array), 0.0);
  }

  @Test
  public void testPeriodicWraparound() {
    int n = 6;
    double[][] positions = {{n - 0.5, 2.0}};
    double[] array = DeltaSuperposition.superpose(positions, new double[n * n], n, n, null);
    assertEquals(0.5, array[(n - 1) * n + 2], TOLERANCE);
    assertEquals(0.5, array[2], TOLERANCE);
    assertEquals(1.0, sum(array), TOLERANCE);
  }

  @Test
  public void testWeightsAndPlanes() {
    double[][] positions = {{1.0, 1.0}, {1.0, 1.0}};
    double[] array = DeltaSuperposition.superpose(positions, new double[2 * 9], 3, 3,
        new int[] {0, 1}, 2, new double[] {2.0, 3.0});
    assertEquals(2.0, array[4], TOLERANCE);
    assertEquals(3.0, array[9 + 4], TOLERANCE);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongArrayLength() {
    DeltaSuperposition.superpose(new double[][] {{0.0, 0.0}}, new double[10], 3, 3, null);
  }
}
