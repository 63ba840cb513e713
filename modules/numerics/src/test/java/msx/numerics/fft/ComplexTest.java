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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
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
 * Compare the 1D FFT against a direct evaluation of the discrete Fourier transform.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class ComplexTest extends MSXTest {

  private final String info;
  private final int n;
  private final double[] data;
  private final double[] expected;
  private final double tolerance = 1.0e-9;

  public ComplexTest(String info, int n) {
    this.info = info;
    this.n = n;
    data = new double[2 * n];
    expected = new double[2 * n];
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"Test n=1", 1},
            {"Test n=16", 16},
            {"Test n=12", 12},
            {"Test n=45", 45},
            {"Test n=97", 97}
        });
  }

  @Before
  public void setUp() {
    Random random = new Random(1);
    for (int i = 0; i < 2 * n; i++) {
      data[i] = random.nextDouble() - 0.5;
    }
    for (int k = 0; k < n; k++) {
      double re = 0.0;
      double im = 0.0;
      for (int j = 0; j < n; j++) {
        double angle = -2.0 * PI * j * k / n;
        re += data[2 * j] * cos(angle) - data[2 * j + 1] * sin(angle);
        im += data[2 * j] * sin(angle) + data[2 * j + 1] * cos(angle);
      }
      expected[2 * k] = re;
      expected[2 * k + 1] = im;
    }
  }

  @Test
  public void testForward() {
    Complex complex = new Complex(n);
    double[] work = data.clone();
    complex.fft(work, 0, 2);
    for (int i = 0; i < 2 * n; i++) {
      assertEquals(info + " i = " + i, expected[i], work[i], tolerance);
    }
  }

  @Test
  public void testRoundTrip() {
    Complex complex = new Complex(n);
    double[] work = data.clone();
    complex.fft(work, 0, 2);
    complex.ifft(work, 0, 2);
    for (int i = 0; i < 2 * n; i++) {
      assertEquals(info + " i = " + i, data[i], work[i] / n, tolerance);
    }
  }

  @Test
  public void testStride() {
    // Place the data at every other complex position after a one element offset.
    double[] strided = new double[4 * n + 1];
    for (int i = 0; i < n; i++) {
      strided[1 + 4 * i] = data[2 * i];
      strided[2 + 4 * i] = data[2 * i + 1];
    }
    new Complex(n).fft(strided, 1, 4);
    for (int i = 0; i < n; i++) {
      assertEquals(info, expected[2 * i], strided[1 + 4 * i], tolerance);
      assertEquals(info, expected[2 * i + 1], strided[2 + 4 * i], tolerance);
    }
  }
}
