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
package msx.measurements;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import msx.array.ArrayData;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.Device;
import msx.utilities.MSXTest;
import msx.waves.Energy;
import org.junit.Test;

/** Tests of diffraction pattern angles and direct beam handling. */
public class DiffractionPatternsTest extends MSXTest {

  private static final double ENERGY = 100.0e3;

  private static DiffractionPatterns patterns(boolean fftshift, Double semiangle) {
    double[] data = new double[3 * 5 * 5];
    for (int i = 0; i < data.length; i++) {
      data[i] = 1.0 + i;
    }
    Map<String, Object> metadata = DiffractionPatterns.metadata(new double[] {0.1, 0.1},
        fftshift, ENERGY, "intensity", "arb. unit");
    if (semiangle != null) {
      metadata.put(DiffractionPatterns.SEMIANGLE_CUTOFF, semiangle);
    }
    return new DiffractionPatterns(BackingArray.of(ArrayData.wrap(DataType.FLOAT64, data, 3, 5, 5)),
        null, metadata, Device.CPU);
  }

  @Test
  public void testScatteringAngles() {
    double angular = 0.1 * Energy.wavelength(ENERGY) * 1.0e3;
    DiffractionPatterns shifted = patterns(true, null);
    assertArrayEquals(new double[] {angular, angular}, shifted.getAngularSampling(), 1.0e-12);
    double[][] angles = shifted.getScatteringAngles();
    assertEquals(0.0, angles[2][2], 0.0);
    assertEquals(2.0 * angular, angles[0][2], 1.0e-12);

    double[][] unshifted = patterns(false, null).getScatteringAngles();
    assertEquals(0.0, unshifted[0][0], 0.0);
    assertEquals(2.0 * angular, unshifted[3][0], 1.0e-12);
    assertEquals(angular, unshifted[4][0], 1.0e-12);
  }

  @Test
  public void testBaseAxes() {
    DiffractionPatterns shifted = patterns(true, null);
    assertEquals("kx", shifted.getBaseAxesMetadata().get(0).getLabel());
    assertEquals("1/Å", shifted.getBaseAxesMetadata().get(1).getUnits());
  }

  @Test
  public void testDirectBeam() {
    ArrayData direct = patterns(true, null).getDirectBeam();
    assertArrayEquals(new int[] {3}, direct.getShape());
    assertArrayEquals(new double[] {13.0, 38.0, 63.0}, direct.getData(), 0.0);
    assertArrayEquals(new double[] {1.0, 26.0, 51.0},
        patterns(false, null).getDirectBeam().getData(), 0.0);
  }

  @Test
  public void testBlockDirect() {
    double angular = 0.1 * Energy.wavelength(ENERGY) * 1.0e3;
    DiffractionPatterns blocked = patterns(true, 1.2 * angular).blockDirect();
    double[] data = blocked.getArray().getData();
    // The center and its four neighbours are blocked; the diagonals are not.
    assertEquals(0.0, data[2 * 5 + 2], 0.0);
    assertEquals(0.0, data[1 * 5 + 2], 0.0);
    assertEquals(0.0, data[25 + 2 * 5 + 3], 0.0);
    assertEquals(1.0 + 6, data[1 * 5 + 1], 0.0);
    assertTrue(blocked.isFftshift());
    assertArrayEquals(new double[] {0.0, 0.0, 0.0}, blocked.getDirectBeam().getData(), 0.0);
  }

  @Test(expected = IllegalStateException.class)
  public void testBlockDirectWithoutSemiangle() {
    patterns(true, null).blockDirect();
  }
}
