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
package msx.waves;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;
import msx.array.ArrayObject;
import msx.array.ComputeSettings;
import msx.array.Device;
import msx.detectors.Detector;
import msx.detectors.PixelatedDetector;
import msx.measurements.DiffractionPatterns;
import msx.measurements.RealSpaceLineProfiles;
import msx.potential.Atoms;
import msx.potential.Potential;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of focused probes and scans. */
public class ProbeTest extends MSXTest {

  private static final double ENERGY = 100.0e3;

  private final ComputeSettings lazy = new ComputeSettings(Device.CPU, true, 1L << 20, 2, false);
  private final ComputeSettings eager = lazy.withLazy(false);

  private final Grid grid = new Grid(new double[] {10.0, 10.0}, new int[] {64, 64});

  private static int argmax(double[] data) {
    int max = 0;
    for (int i = 1; i < data.length; i++) {
      if (data[i] > data[max]) {
        max = i;
      }
    }
    return max;
  }

  private static double sum(double[] data) {
    double sum = 0.0;
    for (double v : data) {
      sum += v;
    }
    return sum;
  }

  @Test
  public void testReciprocalSpaceNormalization() {
    Probe probe = new Probe(grid, ENERGY, 20.0);
    double[] data = probe.buildArray().abs2().getData();
    assertEquals(1.0, sum(data), 1.0e-10);
    assertEquals(Energy.wavelength(ENERGY) / (4.0 * 0.020), probe.getNyquistSampling(), 1.0e-12);
  }

  @Test
  public void testCenteredProbe() {
    Probe probe = new Probe(grid, ENERGY, 20.0, 0.0, 20.0, 0.0);
    Waves waves = probe.build(eager);
    assertArrayEquals(new int[] {64, 64}, waves.getShape());
    assertEquals(20.0, ((Number) waves.getMetadata().get(Waves.SEMIANGLE_CUTOFF)).doubleValue(),
        0.0);
    double[] intensity = waves.intensity().getArray().getData();
    // Parseval with a unit reciprocal space norm.
    assertEquals(1.0 / grid.size(), sum(intensity), 1.0e-12);
    assertEquals(32 * 64 + 32, argmax(intensity));
  }

  @Test
  public void testGridScan() {
    GridScan scan = GridScan.covering(grid, 2.5);
    assertArrayEquals(new int[] {4, 4}, scan.getEnsembleShape());
    assertArrayEquals(new double[] {2.5, 2.5}, scan.getSampling(), 1.0e-12);
    Waves waves = new Probe(grid, ENERGY, 20.0).build(scan, eager);
    assertArrayEquals(new int[] {4, 4, 64, 64}, waves.getShape());
    assertTrue(!waves.isReciprocalSpace());

    // The probe at (2.5, 5.0) peaks at pixel (16, 32).
    double[] intensity = waves.intensity().getArray().getData();
    double[] item = new double[64 * 64];
    System.arraycopy(intensity, (1 * 4 + 2) * 64 * 64, item, 0, item.length);
    assertEquals(16 * 64 + 32, argmax(item));
  }

  @Test
  public void testLineScan() {
    LineScan scan = new LineScan(new double[] {0.0, 0.0}, new double[] {5.0, 0.0}, 10);
    assertEquals(0.5, scan.getSampling(), 1.0e-12);
    double[][] positions = scan.getPositions();
    assertEquals(10, positions.length);
    assertArrayEquals(new double[] {4.5, 0.0}, positions[9], 1.0e-12);

    Waves waves = new Probe(grid, ENERGY, 20.0).build(scan, lazy.withChunkSize(3 * 64 * 64 * 16));
    assertTrue(waves.isLazy());
    assertArrayEquals(new int[] {10, 64, 64}, waves.getShape());
    Waves eagerWaves = new Probe(grid, ENERGY, 20.0).build(scan, eager);
    assertArrayEquals(eagerWaves.getArray().getData(),
        waves.compute(lazy).getArray().getData(), 1.0e-12);
  }

  @Test
  public void testCustomScanAxis() {
    CustomScan scan = new CustomScan(new double[][] {{1.0, 2.0}, {3.0, 4.0}}, false);
    assertEquals(CustomScan.AXIS_LABEL, scan.getEnsembleAxesMetadata().get(0).getLabel());
    Waves waves = new Probe(grid, ENERGY, 20.0).build(scan, eager);
    assertArrayEquals(new int[] {2, 64, 64}, waves.getShape());
  }

  @Test
  public void testScannedDiffraction() {
    Atoms atoms = new Atoms(new double[][] {{5.0, 5.0, 1.0}}, new int[] {14},
        Atoms.orthogonalCell(10.0, 10.0, 2.0));
    Potential potential = new Potential(atoms, new int[] {32, 32}, 1.0);
    Probe probe = new Probe(potential.getGrid(), ENERGY, 20.0);
    GridScan scan = new GridScan(new double[] {4.0, 4.0}, new double[] {6.0, 6.0},
        new int[] {2, 3});
    List<Detector> detectors = Collections.singletonList(new PixelatedDetector());
    ArrayObject result = probe.multislice(potential, scan, detectors, eager).get(0);
    assertTrue(result instanceof DiffractionPatterns);
    assertArrayEquals(new int[] {2, 3, 23, 23}, result.getShape());
    assertEquals(20.0,
        ((Number) result.getMetadata().get(DiffractionPatterns.SEMIANGLE_CUTOFF)).doubleValue(),
        0.0);
  }

  @Test
  public void testProfiles() {
    Probe probe = new Probe(grid, ENERGY, 20.0);
    RealSpaceLineProfiles profiles = probe.profiles(0.0, eager);
    assertEquals(64, profiles.getShape()[0]);
    assertEquals(10.0, profiles.getLength(), 1.0e-9);
    double[] values = profiles.getArray().getData();
    // The line starts at the edge of the grid, so the center is at the middle of the profile.
    assertEquals(32, argmax(values));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidSemiangle() {
    new Probe(grid, ENERGY, -1.0);
  }
}
