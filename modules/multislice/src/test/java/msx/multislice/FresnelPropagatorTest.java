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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import msx.array.ArrayData;
import msx.array.DataType;
import msx.utilities.MSXTest;
import msx.waves.AntialiasAperture;
import msx.waves.Energy;
import msx.waves.Grid;
import org.junit.Test;

/** Tests of the Fresnel free space propagator. */
public class FresnelPropagatorTest extends MSXTest {

  private final Grid grid = new Grid(new double[] {8.0, 8.0}, new int[] {32, 32});

  @Test
  public void testKernel() {
    FresnelPropagator propagator = new FresnelPropagator(grid, 200.0e3);
    double[][] kernel = propagator.getKernel(2.0);
    assertSame(kernel, propagator.getKernel(2.0));

    // Unity at the origin, zero outside the aperture, unit modulus inside.
    assertEquals(1.0, kernel[0][0], 1.0e-12);
    assertEquals(0.0, kernel[1][0], 1.0e-12);
    double[] mask = AntialiasAperture.mask(grid);
    for (int i = 0; i < mask.length; i++) {
      double modulus = kernel[0][i] * kernel[0][i] + kernel[1][i] * kernel[1][i];
      assertEquals(mask[i], modulus, 1.0e-12);
    }

    double lambda = Energy.wavelength(200.0e3);
    double k = 1.0 / 8.0;
    double phase = -Math.PI * lambda * 2.0 * k * k;
    assertEquals(Math.cos(phase), kernel[0][32], 1.0e-12);
    assertEquals(Math.sin(phase), kernel[1][32], 1.0e-12);
  }

  @Test
  public void testTiltShiftsPhase() {
    FresnelPropagator tilted = new FresnelPropagator(grid, 200.0e3, 10.0, 0.0);
    double[][] kernel = tilted.getKernel(1.0);
    double lambda = Energy.wavelength(200.0e3);
    double k = 1.0 / 8.0;
    double phase = -Math.PI * lambda * k * k - 2.0 * Math.PI * k * Math.tan(0.010);
    assertEquals(Math.cos(phase), kernel[0][32], 1.0e-12);
    assertEquals(Math.sin(phase), kernel[1][32], 1.0e-12);
  }

  @Test
  public void testPropagationConservesIntensity() {
    FresnelPropagator propagator = new FresnelPropagator(grid, 200.0e3);
    double[] waves = new double[2 * grid.size()];
    waves[0] = 1.0;
    AntialiasAperture.bandlimit(waves, 1, grid);
    double before = 0.0;
    for (double v : waves) {
      before += v * v;
    }
    propagator.propagate(waves, 1, 5.0);
    double after = 0.0;
    for (double v : waves) {
      after += v * v;
    }
    assertEquals(before, after, 1.0e-10);
  }

  @Test
  public void testPropagateTakesOwnership() {
    FresnelPropagator propagator = new FresnelPropagator(grid, 200.0e3);
    double[] values = new double[2 * grid.size()];
    values[0] = 1.0;
    AntialiasAperture.bandlimit(values, 1, grid);
    double[] expected = values.clone();
    propagator.propagate(expected, 1, 5.0);

    ArrayData waves = ArrayData.wrap(DataType.COMPLEX128, values, grid.getGpts());
    ArrayData propagated = propagator.propagate(waves, 5.0);
    assertFalse(waves.isValid());
    assertSame(values, propagated.getData());
    assertArrayEquals(expected, propagated.getData(), 1.0e-12);
  }
}
