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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Device;
import msx.detectors.Detector;
import msx.detectors.ImageDetector;
import msx.detectors.PixelatedDetector;
import msx.detectors.WavesDetector;
import msx.measurements.DiffractionPatterns;
import msx.measurements.Images;
import msx.potential.Atoms;
import msx.potential.FrozenPhonons;
import msx.potential.Potential;
import msx.potential.ScreenedCoulombParametrization;
import msx.potential.SliceThickness;
import msx.potential.TransmissionFunction;
import msx.utilities.MSXTest;
import msx.waves.Grid;
import msx.waves.PlaneWave;
import msx.waves.Waves;
import org.junit.Test;

/** Tests propagation of wave functions through sliced potentials. */
public class MultisliceTest extends MSXTest {

  private static final double ENERGY = 100.0e3;

  private final ComputeSettings lazy = new ComputeSettings(Device.CPU, true, 1L << 20, 2, false);
  private final ComputeSettings eager = lazy.withLazy(false);

  private static Atoms silicon() {
    return new Atoms(new double[][] {{5.0, 5.0, 1.0}}, new int[] {14},
        Atoms.orthogonalCell(10.0, 10.0, 2.0));
  }

  private static Atoms vacuum() {
    return new Atoms(new double[0][], new int[0], Atoms.orthogonalCell(10.0, 10.0, 3.0));
  }

  private static double intensity(double[] complex) {
    double sum = 0.0;
    for (int i = 0; i < complex.length; i += 2) {
      sum += complex[i] * complex[i] + complex[i + 1] * complex[i + 1];
    }
    return sum;
  }

  /** A Gaussian wave packet, well inside the antialias aperture. */
  private static ArrayData packet(Grid grid) {
    int[] gpts = grid.getGpts();
    double[] sampling = grid.getSampling();
    double[] data = new double[2 * grid.size()];
    for (int i = 0; i < gpts[0]; i++) {
      for (int j = 0; j < gpts[1]; j++) {
        double x = i * sampling[0] - 5.0;
        double y = j * sampling[1] - 5.0;
        double amplitude = Math.exp(-(x * x + y * y) / 2.0);
        data[2 * (i * gpts[1] + j)] = amplitude * Math.cos(0.3 * x);
        data[2 * (i * gpts[1] + j) + 1] = amplitude * Math.sin(0.3 * x);
      }
    }
    return ArrayData.wrap(DataType.COMPLEX128, data, gpts);
  }

  private static ArrayData zeros(Grid grid) {
    return ArrayData.zeros(DataType.COMPLEX128, grid.getGpts());
  }

  private static int argmax(double[] data) {
    int max = 0;
    for (int i = 1; i < data.length; i++) {
      if (data[i] > data[max]) {
        max = i;
      }
    }
    return max;
  }

  @Test
  public void testVacuumConservesIntensity() {
    Potential potential = new Potential(vacuum(), new int[] {32, 32}, 1.0);
    TransmissionFunction transmission = potential.build(0).transmissionFunction(ENERGY);
    Grid grid = potential.getGrid();
    ArrayData waves = packet(grid);
    double before = intensity(waves.getData());
    Multislice multislice = new Multislice(waves, grid, ENERGY, new double[][] {{0.0, 0.0}},
        transmission, 0);
    assertEquals(3, multislice.getNumSlices());
    multislice.run();
    assertTrue(multislice.isFinished());
    assertEquals(before, intensity(multislice.getWaves().getData()), 1.0e-3 * before);
  }

  @Test
  public void testOwnershipOfWaves() {
    Potential potential = new Potential(vacuum(), new int[] {32, 32}, 1.0);
    TransmissionFunction transmission = potential.build(0).transmissionFunction(ENERGY);
    Grid grid = potential.getGrid();
    ArrayData waves = packet(grid);
    double before = intensity(waves.getData());
    Multislice multislice = new Multislice(waves, grid, ENERGY, new double[][] {{0.0, 0.0}},
        transmission, 0);
    assertFalse(waves.isValid());

    multislice.step();
    ArrayData snapshot = multislice.getWaves();
    double[] copied = snapshot.getData().clone();
    multislice.step();
    assertArrayEquals(copied, snapshot.getData(), 0.0);

    ArrayData released = multislice.releaseWaves();
    assertEquals(before, intensity(released.getData()), 1.0e-3 * before);
    try {
      multislice.step();
      fail(" A multislice without waves should not step.");
    } catch (IllegalStateException e) {
      assertTrue(released.isValid());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testTransferredWavesCannotBeRead() {
    Potential potential = new Potential(vacuum(), new int[] {16, 16}, 1.0);
    Grid grid = potential.getGrid();
    ArrayData waves = zeros(grid);
    new Multislice(waves, grid, ENERGY, new double[][] {{0.0, 0.0}},
        potential.build(0).transmissionFunction(ENERGY), 0);
    waves.getData();
  }

  @Test
  public void testStepping() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 0.5);
    TransmissionFunction transmission = potential.build(0).transmissionFunction(ENERGY);
    Grid grid = potential.getGrid();
    Multislice multislice = new Multislice(packet(grid), grid, ENERGY,
        new double[][] {{0.0, 0.0}}, transmission, 1);
    assertEquals(1, multislice.getSlice());
    multislice.runTo(3);
    assertEquals(3, multislice.getSlice());
    assertFalse(multislice.isFinished());
    multislice.step();
    assertTrue(multislice.isFinished());
  }

  @Test(expected = IllegalStateException.class)
  public void testStepPastTheExit() {
    Potential potential = new Potential(vacuum(), new int[] {16, 16}, 3.0);
    Grid grid = potential.getGrid();
    Multislice multislice = new Multislice(zeros(grid), grid, ENERGY,
        new double[][] {{0.0, 0.0}}, potential.build(0).transmissionFunction(ENERGY), 0);
    multislice.run();
    multislice.step();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGridMismatch() {
    Potential potential = new Potential(vacuum(), new int[] {16, 16}, 1.0);
    Grid other = new Grid(new double[] {10.0, 10.0}, new int[] {32, 32});
    new Multislice(zeros(other), other, ENERGY, new double[][] {{0.0, 0.0}},
        potential.build(0).transmissionFunction(ENERGY), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEnergyMismatch() {
    Potential potential = new Potential(vacuum(), new int[] {16, 16}, 1.0);
    Grid grid = potential.getGrid();
    new Multislice(zeros(grid), grid, 200.0e3, new double[][] {{0.0, 0.0}},
        potential.build(0).transmissionFunction(ENERGY), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTransformRejectsMismatchedWaves() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    Waves waves = new PlaneWave(new Grid(new double[] {10.0, 10.0}, new int[] {16, 16}), ENERGY)
        .build(eager);
    new MultisliceTransform(potential, null).calculateNewArrays(waves);
  }

  @Test
  public void testSiliconDiffraction() {
    Potential potential = new Potential(silicon(), new int[] {64, 64}, 1.0);
    PlaneWave planeWave = new PlaneWave(potential.getGrid(), ENERGY);
    List<Detector> detectors = Collections.singletonList(new PixelatedDetector());
    ArrayObject result = planeWave.multislice(potential, detectors, eager).get(0);

    assertTrue(result instanceof DiffractionPatterns);
    DiffractionPatterns patterns = (DiffractionPatterns) result;
    assertArrayEquals(new int[] {43, 43}, patterns.getShape());
    assertTrue(patterns.isFftshift());
    assertEquals(21 * 43 + 21, argmax(patterns.getArray().getData()));
  }

  @Test
  public void testRunSummaryIsLogged() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    Waves waves = new PlaneWave(potential.getGrid(), ENERGY).build(eager);
    Logger transformLogger = Logger.getLogger(MultisliceTransform.class.getName());
    Level level = transformLogger.getLevel();
    List<LogRecord> records = Collections.synchronizedList(new ArrayList<>());
    Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {
      }

      @Override
      public void close() {
      }
    };
    transformLogger.setLevel(Level.INFO);
    transformLogger.addHandler(handler);
    try {
      new MultisliceTransform(potential, null).calculateNewArrays(waves);
    } finally {
      transformLogger.removeHandler(handler);
      transformLogger.setLevel(level);
    }
    assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.INFO
        && r.getMessage().startsWith(" Multislice of 1 wave function(s)")));
  }

  @Test
  public void testTwoDetectors() {
    Potential potential = new Potential(silicon(), new int[] {64, 64}, 1.0);
    Waves waves = new PlaneWave(potential.getGrid(), ENERGY).build(eager);
    List<Detector> detectors = Arrays.asList(new PixelatedDetector(), new ImageDetector());
    List<ArrayObject> results = waves.multislice(potential, detectors, eager);
    assertEquals(2, results.size());
    assertArrayEquals(new int[] {43, 43}, results.get(0).getShape());
    assertArrayEquals(new int[] {64, 64}, results.get(1).getShape());
    assertTrue(results.get(1) instanceof Images);
  }

  @Test
  public void testExitPlanes() {
    Atoms atoms = new Atoms(new double[][] {{5.0, 5.0, 1.0}}, new int[] {14},
        Atoms.orthogonalCell(10.0, 10.0, 4.0));
    Potential potential = new Potential(atoms,
        new Grid(new double[] {10.0, 10.0}, new int[] {32, 32}), SliceThickness.repeat(1.0, 4),
        new ScreenedCoulombParametrization(), 2);
    Waves waves = new PlaneWave(potential.getGrid(), ENERGY).build(eager);
    ArrayObject result = waves.multislice(potential,
        Collections.singletonList(new WavesDetector()), eager).get(0);
    assertArrayEquals(new int[] {3, 32, 32}, result.getShape());
    assertEquals(Potential.THICKNESS_LABEL,
        result.getEnsembleAxesMetadata().get(0).getLabel());

    // The first exit plane is the incident wave.
    double[] data = result.getArray().getData();
    for (int i = 0; i < 2 * 32 * 32; i += 2) {
      assertEquals(1.0, data[i], 1.0e-9);
      assertEquals(0.0, data[i + 1], 1.0e-9);
    }
  }

  @Test
  public void testLazyEqualsEager() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    PlaneWave planeWave = new PlaneWave(potential.getGrid(), ENERGY);
    List<Detector> detectors = Collections.singletonList(new PixelatedDetector());
    ArrayObject eagerResult = planeWave.multislice(potential, detectors, eager).get(0);
    ArrayObject lazyResult = planeWave.multislice(potential, detectors, lazy).get(0);
    assertTrue(lazyResult.isLazy());
    assertArrayEquals(eagerResult.getShape(), lazyResult.getShape());
    assertArrayEquals(eagerResult.getArray().getData(),
        lazyResult.compute(lazy).getArray().getData(), 1.0e-10);
  }

  @Test
  public void testFrozenPhononMean() {
    FrozenPhonons phonons = new FrozenPhonons(silicon(), 3, 0.1, 11L);
    Potential potential = new Potential(phonons,
        new Grid(new double[] {10.0, 10.0}, new int[] {32, 32}), SliceThickness.repeat(1.0, 2),
        new ScreenedCoulombParametrization(), 0);
    PlaneWave planeWave = new PlaneWave(potential.getGrid(), ENERGY);
    List<Detector> detectors = Arrays.asList(new ImageDetector(), new WavesDetector());
    List<ArrayObject> results = planeWave.multislice(potential, detectors, eager);

    // Measurements are averaged over configurations; wave functions are not.
    assertArrayEquals(new int[] {32, 32}, results.get(0).getShape());
    assertArrayEquals(new int[] {3, 32, 32}, results.get(1).getShape());

    Waves exit = (Waves) results.get(1);
    ArrayData mean = exit.intensity().getArray().mean(0);
    assertArrayEquals(mean.getData(), results.get(0).getArray().getData(), 1.0e-10);
  }

  @Test
  public void testTransitionPotentialMultislice() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    Waves waves = new PlaneWave(potential.getGrid(), ENERGY).build(eager);
    TransitionPotential transitions =
        new LocalizedTransitionPotential(14, new double[] {1.0e-3, 2.0e-3}, 0.5);
    List<Detector> detectors = Collections.singletonList(new ImageDetector());
    ArrayObject result = waves.applyTransform(
        new TransitionPotentialMultislice(potential, transitions, detectors), eager).get(0);
    assertArrayEquals(new int[] {32, 32}, result.getShape());

    double total = 0.0;
    for (double v : result.getArray().getData()) {
      assertTrue(v >= 0.0);
      total += v;
    }
    assertTrue(total > 0.0);
  }

  @Test
  public void testTransitionsWithoutSites() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    Waves waves = new PlaneWave(potential.getGrid(), ENERGY).build(eager);
    TransitionPotential transitions = new LocalizedTransitionPotential(8, new double[] {1.0}, 0.5);
    ArrayObject result = waves.applyTransform(new TransitionPotentialMultislice(potential,
        transitions, Collections.singletonList(new ImageDetector())), eager).get(0);
    for (double v : result.getArray().getData()) {
      assertEquals(0.0, v, 0.0);
    }
  }
}
