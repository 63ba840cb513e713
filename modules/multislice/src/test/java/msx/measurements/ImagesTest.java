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
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;
import msx.array.ArrayData;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.OrdinalAxis;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of images and their reductions. */
public class ImagesTest extends MSXTest {

  /** Two 4 x 4 images with values 10 * row + column and twice that. */
  private static Images images() {
    double[] data = new double[2 * 16];
    for (int k = 0; k < 2; k++) {
      for (int i = 0; i < 4; i++) {
        for (int j = 0; j < 4; j++) {
          data[k * 16 + i * 4 + j] = (k + 1) * (10.0 * i + j);
        }
      }
    }
    return new Images(BackingArray.of(ArrayData.wrap(DataType.FLOAT64, data, 2, 4, 4)),
        Arrays.asList(new OrdinalAxis("defocus", "Å", Arrays.asList(0.0, 10.0), false, false)),
        Images.metadata(new double[] {0.5, 0.5}, "intensity", "arb. unit"), Device.CPU);
  }

  @Test
  public void testMetadata() {
    Images images = images();
    assertArrayEquals(new double[] {2.0, 2.0}, images.getExtent(), 0.0);
    assertEquals("intensity", images.getLabel());
    assertEquals("arb. unit", images.getUnits());
  }

  @Test
  public void testInterpolateLine() {
    // From pixel (0, 1) to pixel (2, 1).
    RealSpaceLineProfiles profiles = images().interpolateLine(new double[] {0.0, 0.5},
        new double[] {1.0, 0.5}, 0.25);
    assertArrayEquals(new int[] {2, 4}, profiles.getShape());
    assertEquals(0.25, profiles.getSampling(), 1.0e-12);
    assertEquals(1.0, profiles.getLength(), 1.0e-12);
    assertArrayEquals(new double[] {0.0, 0.5, 1.0, 0.5}, profiles.getLine(), 0.0);
    assertArrayEquals(new double[] {1.0, 6.0, 11.0, 16.0, 2.0, 12.0, 22.0, 32.0},
        profiles.getArray().getData(), 1.0e-12);
    assertEquals("defocus", profiles.getEnsembleAxesMetadata().get(0).getLabel());
  }

  @Test
  public void testInterpolationIsPeriodic() {
    // Halfway between row 3 and row 0.
    RealSpaceLineProfiles profiles = images().interpolateLine(new double[] {1.75, 0.0},
        new double[] {1.75, 0.1}, 1.0);
    assertArrayEquals(new int[] {2, 1}, profiles.getShape());
    assertEquals(15.0, profiles.getArray().getData()[0], 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidLineSampling() {
    images().interpolateLine(new double[] {0.0, 0.0}, new double[] {1.0, 0.0}, 0.0);
  }

  @Test
  public void testReductions() {
    Images images = images();
    BaseMeasurement sum = images.sum();
    assertArrayEquals(new int[] {4, 4}, sum.getShape());
    assertEquals(3.0 * 32.0, sum.getArray().getData()[3 * 4 + 2], 1.0e-12);
    BaseMeasurement mean = images.mean(0);
    assertEquals(1.5 * 32.0, mean.getArray().getData()[3 * 4 + 2], 1.0e-12);
    BaseMeasurement doubled = images.add(images);
    assertEquals(2.0 * 64.0, doubled.getArray().getData()[16 + 3 * 4 + 2], 1.0e-12);
    assertEquals(MeasurementType.IMAGES, doubled.getType());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidReductionAxis() {
    images().sum(1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddShapeMismatch() {
    images().add(images().mean());
  }

  @Test
  public void testProfilesWithoutLine() {
    RealSpaceLineProfiles profiles = new RealSpaceLineProfiles(
        BackingArray.of(ArrayData.zeros(DataType.FLOAT64, 5)), null,
        Collections.singletonMap(RealSpaceLineProfiles.SAMPLING, 0.2), Device.CPU);
    assertNull(profiles.getLine());
    assertEquals(1.0, profiles.getLength(), 1.0e-12);
  }
}
