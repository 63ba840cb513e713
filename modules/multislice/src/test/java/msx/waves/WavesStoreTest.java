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

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import msx.array.ArrayObject;
import msx.array.ArrayStore;
import msx.array.ComputeSettings;
import msx.detectors.PixelatedDetector;
import msx.measurements.DiffractionPatterns;
import msx.potential.Atoms;
import msx.potential.Potential;
import msx.utilities.MSXProperties;
import msx.utilities.MSXTest;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/** Round trips of simulation results through the array store. */
public class WavesStoreTest extends MSXTest {

  private static final double ENERGY = 80.0e3;

  private static ComputeSettings settings(boolean lazy) {
    CompositeConfiguration properties = MSXProperties.defaultProperties();
    properties.setProperty(MSXProperties.LAZY, lazy);
    properties.setProperty(MSXProperties.CHUNK_SIZE, 4 * 32 * 32 * 16);
    properties.setProperty(MSXProperties.THREADS, 2);
    return ComputeSettings.fromProperties(properties);
  }

  @Test
  public void testSettingsFromProperties() {
    ComputeSettings settings = settings(false);
    assertEquals(false, settings.isLazy());
    assertEquals(4 * 32 * 32 * 16, settings.getChunkSize());
    assertEquals(2, settings.getThreads());
  }

  @Test
  public void testExitWavesRoundTrip() throws IOException {
    Grid grid = new Grid(new double[] {8.0, 8.0}, new int[] {32, 32});
    BeamTilt tilt = BeamTilt.alongX(0.0, 2.0, 4.0);
    Waves waves = new PlaneWave(grid, ENERGY, true, 0.0, 0.0, tilt).build(settings(false));

    File directory = new File(registerTemporaryDirectory().toFile(), "waves.msx");
    ArrayStore.write(waves, directory, false, settings(true));
    ArrayObject read = ArrayStore.read(directory, Waves.knownTypes());
    assertTrue(read instanceof Waves);
    assertTrue(read.isLazy());
    read = read.compute(settings(true));
    assertEquals(waves, read);

    Waves restored = (Waves) read;
    assertEquals(ENERGY, restored.getEnergy(), 0.0);
    assertEquals("reciprocal_space", restored.getNormalization());
    assertArrayEquals(waves.getTilts()[2], restored.getTilts()[2], 0.0);
  }

  @Test
  public void testDiffractionPatternsRoundTrip() throws IOException {
    Atoms atoms = new Atoms(new double[][] {{4.0, 4.0, 0.5}}, new int[] {6},
        Atoms.orthogonalCell(8.0, 8.0, 1.0));
    Potential potential = new Potential(atoms, new int[] {32, 32}, 0.5);
    ArrayObject patterns = new PlaneWave(potential.getGrid(), ENERGY).multislice(potential,
        Collections.singletonList(new PixelatedDetector()), settings(false)).get(0);

    File directory = new File(registerTemporaryDirectory().toFile(), "patterns.msx");
    ArrayStore.write(patterns, directory, false, settings(false));
    ArrayObject read = ArrayStore.read(directory, Waves.knownTypes()).compute(settings(false));
    assertTrue(read instanceof DiffractionPatterns);
    assertEquals(patterns, read);
    assertTrue(((DiffractionPatterns) read).isFftshift());
  }
}
