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
package msx.numerics.fft;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import java.util.Random;
import msx.utilities.MSXTest;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class Complex2DTest extends MSXTest {

  private final String info;
  private final int nx;
  private final int ny;
  private final int tot;
  private final double[] data;
  private final double[] expected;
  private final double tolerance = 1.0e-12;

  public Complex2DTest(String info, int nx, int ny) {
    this.info = info;
    this.nx = nx;
    this.ny = ny;
    tot = nx * ny;
    data = new double[tot * 2];
    expected = new double[tot];
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"Test {nx=32, ny=32}", 32, 32},
            {"Test {nx=45, ny=21}", 45, 21}
        });
  }

  @Before
  public void setUp() {
    Random random = new Random();
    for (int i = 0; i < tot; i++) {
      double r = random.nextDouble();
      data[i * 2] = r;
      expected[i] = r;
    }
  }

  /** Test of the fft and ifft methods, of class Complex2D. */
  @Test
  public void testRoundTrip() {
    Complex2D complex2D = new Complex2D(nx, ny);
    complex2D.fft(data, 0);
    complex2D.ifft(data, 0);
    for (int i = 0; i < tot; i++) {
      double actual = data[i * 2] / tot;
      assertEquals(info + " i = " + i, expected[i], actual, tolerance);
      assertEquals(info + " i = " + i, 0.0, data[i * 2 + 1] / tot, tolerance);
    }
  }

  /** The zero frequency of the forward transform is the sum of the input. */
  @Test
  public void testZeroFrequency() {
    double sum = 0.0;
    for (double v : expected) {
      sum += v;
    }
    new Complex2D(nx, ny).fft(data, 0);
    assertEquals(info, sum, data[0], 1.0e-9);
    assertEquals(info, 0.0, data[1], 1.0e-9);
  }
}
