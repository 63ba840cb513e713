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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Device;
import msx.measurements.DiffractionPatterns;
import msx.measurements.Images;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of wave function transforms and measurements. */
public class WavesTest extends MSXTest {

  private static final double ENERGY = 100.0e3;

  private final ComputeSettings lazy = new ComputeSettings(Device.CPU, true, 1L << 20, 2, false);
  private final ComputeSettings eager = lazy.withLazy(false);

  private final Grid grid = new Grid(new double[] {10.0, 10.0}, new int[] {64, 64});

  private static double sum(double[] data) {
    double sum = 0.0;
    for (double v : data) {
      sum += v;
    }
    return sum;
  }

  /** A single off-center point on a complex grid. */
  private Waves point() {
    ArrayData data = ArrayData.zeros(DataType.COMPLEX128, 64, 64);
    data.getData()[2 * (10 * 64 + 20)] = 2.0;
    return Waves.of(data, grid, ENERGY, false);
  }

  @Test
  public void testMetadata() {
    Waves waves = new PlaneWave(grid, ENERGY).build(eager);
    assertArrayEquals(new int[] {64, 64}, waves.getShape());
    assertEquals(ENERGY, waves.getEnergy(), 0.0);
    assertEquals(Energy.wavelength(ENERGY), waves.getWavelength(), 0.0);
    assertEquals(grid, waves.getGrid());
    assertFalse(waves.isReciprocalSpace());
    assertEquals("values", waves.getNormalization());
    assertArrayEquals(new int[] {42, 42}, waves.getAntialiasCutoffGpts());
    assertArrayEquals(new int[] {43, 43}, waves.gptsWithinAngle("cutoff", "odd"));
    assertArrayEquals(new int[] {64, 64}, waves.gptsWithinAngle("full", "same"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRealArrayIsRejected() {
    Waves.of(ArrayData.zeros(DataType.FLOAT64, 64, 64), grid, ENERGY, false);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testUnknownMaxAngle() {
    point().gptsWithinAngle("widest", "odd");
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testUnknownParity() {
    Waves.ensureParityOfGpts(new int[] {4, 4}, new int[] {4, 4}, "prime");
  }

  @Test
  public void testParity() {
    assertArrayEquals(new int[] {5, 7},
        Waves.ensureParityOfGpts(new int[] {4, 7}, new int[] {8, 8}, "odd"));
    assertArrayEquals(new int[] {4, 8},
        Waves.ensureParityOfGpts(new int[] {4, 7}, new int[] {8, 8}, "even"));
    assertArrayEquals(new int[] {5, 7},
        Waves.ensureParityOfGpts(new int[] {4, 7}, new int[] {9, 9}, "same"));
    assertArrayEquals(new int[] {4, 7},
        Waves.ensureParityOfGpts(new int[] {4, 7}, new int[] {9, 9}, "none"));
  }

  @Test
  public void testSpaceRoundTrip() {
    Waves waves = point();
    Waves reciprocal = waves.ensureReciprocalSpace();
    assertTrue(reciprocal.isReciprocalSpace());
    assertTrue(reciprocal == reciprocal.ensureReciprocalSpace());
    assertArrayEquals(waves.getArray().getData(),
        reciprocal.ensureRealSpace().getArray().getData(), 1.0e-12);
  }

  @Test
  public void testNormalize() {
    Waves normalized = point().normalize();
    assertEquals("reciprocal_space", normalized.getNormalization());
    assertFalse(normalized.isReciprocalSpace());
    double[] reciprocal = normalized.ensureReciprocalSpace().getArray().abs2().getData();
    assertEquals(1.0, sum(reciprocal), 1.0e-10);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testNormalizeInRealSpace() {
    point().normalize("real");
  }

  @Test
  public void testPhaseShiftPreservesIntensity() {
    Waves waves = point();
    Waves shifted = waves.phaseShift(Math.PI / 2.0);
    double[] data = shifted.getArray().getData();
    int index = 2 * (10 * 64 + 20);
    assertEquals(0.0, data[index], 1.0e-12);
    assertEquals(2.0, data[index + 1], 1.0e-12);
    assertArrayEquals(waves.intensity().getArray().getData(),
        shifted.intensity().getArray().getData(), 1.0e-12);
  }

  @Test
  public void testTile() {
    Waves tiled = point().tile(2, 3, true);
    assertArrayEquals(new int[] {128, 192}, tiled.getShape());
    assertArrayEquals(new double[] {20.0, 30.0}, tiled.getGrid().getExtent(), 1.0e-12);
    double[] data = tiled.getArray().getData();
    assertEquals(2.0 / 6.0, data[2 * ((64 + 10) * 192 + 128 + 20)], 1.0e-12);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testTileInReciprocalSpace() {
    point().ensureReciprocalSpace().tile(2, 2, false);
  }

  @Test
  public void testIntensity() {
    Images images = point().intensity();
    assertArrayEquals(new int[] {64, 64}, images.getShape());
    assertFalse(images.isComplex());
    assertEquals(4.0, sum(images.getArray().getData()), 1.0e-12);
    assertTrue(point().complexImages().isComplex());
  }

  @Test
  public void testDownsample() {
    Waves waves = new PlaneWave(grid, ENERGY).build(eager);
    Waves downsampled = waves.downsample("cutoff");
    assertArrayEquals(new int[] {42, 42}, downsampled.getShape());
    assertArrayEquals(grid.getExtent(), downsampled.getGrid().getExtent(), 1.0e-12);
    // A constant wave keeps its value and the cutoff of the original grid.
    assertEquals(1.0, downsampled.getArray().getReal(0), 1.0e-10);
    assertArrayEquals(new int[] {42, 42}, downsampled.getAntialiasCutoffGpts());
  }

  @Test
  public void testPlaneWaveDiffraction() {
    DiffractionPatterns patterns = new PlaneWave(grid, ENERGY).build(eager).diffractionPatterns();
    assertArrayEquals(new int[] {43, 43}, patterns.getShape());
    double[] data = patterns.getArray().getData();
    assertEquals(1.0, data[21 * 43 + 21], 1.0e-10);
    assertEquals(1.0, sum(data), 1.0e-10);
    assertEquals(ENERGY, patterns.getEnergy(), 0.0);

    DiffractionPatterns unshifted = new PlaneWave(grid, ENERGY).build(eager)
        .diffractionPatterns("full", 0.0, false, "same", false, true);
    assertArrayEquals(new int[] {64, 64}, unshifted.getShape());
    assertEquals(1.0, unshifted.getArray().getData()[0], 1.0e-10);
  }

  @Test
  public void testDiffractionWithinAngle() {
    Waves waves = new PlaneWave(grid, ENERGY).build(eager);
    double[] angular = waves.getAngularSampling();
    DiffractionPatterns patterns = waves.diffractionPatterns(5.0 * angular[0] - 1.0e-6, 0.0,
        true, "odd", false, true);
    assertArrayEquals(new int[] {11, 11}, patterns.getShape());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testUnknownNormalization() {
    Waves waves = point();
    Waves custom = new Waves(waves.getBackingArray(), null, withNormalization(waves, "unit"),
        Device.CPU);
    custom.diffractionPatterns();
  }

  private static Map<String, Object> withNormalization(Waves waves, String value) {
    Map<String, Object> metadata = new LinkedHashMap<>(waves.getMetadata());
    metadata.put(Waves.NORMALIZATION, value);
    return metadata;
  }

  @Test
  public void testLazyTransformsStayLazy() {
    Waves waves = new PlaneWave(grid, ENERGY).build(lazy);
    assertTrue(waves.isLazy());
    Images images = waves.phaseShift(0.3).intensity();
    assertTrue(images.isLazy());
    ArrayObject computed = images.compute(lazy);
    assertEquals(64 * 64, sum(computed.getArray().getData()), 1.0e-8);
  }

  @Test
  public void testBeamTilt() {
    BeamTilt tilt = new BeamTilt(Arrays.asList(0.0, 5.0, 10.0),
        Arrays.asList(-1.0, 1.0));
    assertArrayEquals(new int[] {3, 2}, tilt.getEnsembleShape());
    PlaneWave planeWave = new PlaneWave(grid, ENERGY, false, 1.0, 0.0, tilt);
    Waves waves = planeWave.build(eager);
    assertArrayEquals(new int[] {3, 2, 64, 64}, waves.getShape());
    double[][] tilts = waves.getTilts();
    assertEquals(6, tilts.length);
    assertArrayEquals(new double[] {1.0, -1.0}, tilts[0], 0.0);
    assertArrayEquals(new double[] {11.0, 1.0}, tilts[5], 0.0);
    List<String> labels = Arrays.asList(
        waves.getEnsembleAxesMetadata().get(0).getLabel(),
        waves.getEnsembleAxesMetadata().get(1).getLabel());
    assertEquals(Arrays.asList(BeamTilt.TILT_X_LABEL, BeamTilt.TILT_Y_LABEL), labels);
  }
}
