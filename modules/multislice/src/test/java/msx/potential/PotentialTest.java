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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import msx.array.ArrayData;
import msx.array.axes.AxisMetadata;
import msx.utilities.MSXTest;
import msx.waves.Grid;
import org.junit.Test;

/** Tests slicing, projection and frozen phonon ensembles of a potential. */
public class PotentialTest extends MSXTest {

  private static Atoms silicon() {
    return new Atoms(new double[][] {{5.0, 5.0, 1.0}}, new int[] {14},
        Atoms.orthogonalCell(10.0, 10.0, 2.0));
  }

  private static Potential potential(int exitPlaneInterval) {
    Atoms atoms = new Atoms(new double[][] {{5.0, 5.0, 1.0}}, new int[] {14},
        Atoms.orthogonalCell(10.0, 10.0, 4.0));
    return new Potential(atoms, new Grid(new double[] {10.0, 10.0}, new int[] {32, 32}),
        SliceThickness.repeat(1.0, 4), new ScreenedCoulombParametrization(), exitPlaneInterval);
  }

  @Test
  public void testExitPlanes() {
    assertArrayEquals(new int[] {3}, potential(0).getExitPlanes());
    assertArrayEquals(new int[] {-1, 1, 3}, potential(2).getExitPlanes());
    assertArrayEquals(new int[] {-1, 2, 3}, potential(3).getExitPlanes());

    AxisMetadata axis = potential(2).getExitPlanesAxis();
    assertEquals(Potential.THICKNESS_LABEL, axis.getLabel());
    assertTrue(potential(0).getExitPlanesAxis().isSqueeze());
  }

  @Test
  public void testProjectionPeaksAtTheAtom() {
    Potential potential = new Potential(silicon(), new int[] {64, 64}, 1.0);
    assertEquals(2, potential.getNumSlices());
    assertEquals(1, potential.getNumConfigurations());
    assertEquals(0, potential.getEnsembleShape().length);

    PotentialArray array = potential.build(0);
    assertArrayEquals(new int[] {2, 64, 64}, array.getArray().getShape());

    // The atom at z = 1 belongs to the second slice.
    ArrayData projected = array.project();
    double[] data = projected.getData();
    int max = 0;
    for (int i = 1; i < data.length; i++) {
      if (data[i] > data[max]) {
        max = i;
      }
    }
    assertEquals(32 * 64 + 32, max);
    assertTrue(data[max] > 0.0);

    double[] first = array.getArray().getData();
    double firstSum = 0.0;
    for (int i = 0; i < 64 * 64; i++) {
      firstSum += Math.abs(first[i]);
    }
    assertEquals(0.0, firstSum, 1.0e-8);
  }

  @Test
  public void testSingleAndStackedProjectionAgree() {
    Potential potential = new Potential(silicon(), new int[] {32, 32}, 1.0);
    InfinitePotentialProjections projections =
        new InfinitePotentialProjections(new ScreenedCoulombParametrization());
    ArrayData single = projections.project(silicon(), potential.getGrid());
    ArrayData stacked = potential.build(0).project();
    assertArrayEquals(single.getData(), stacked.getData(), 1.0e-8);
  }

  @Test
  public void testFrozenPhonons() {
    Atoms atoms = silicon();
    FrozenPhonons phonons = new FrozenPhonons(atoms, 4, 0.1, 7L);
    assertArrayEquals(new int[] {4}, phonons.getEnsembleShape());
    List<AxisMetadata> axes = phonons.getEnsembleAxesMetadata();
    assertEquals(FrozenPhonons.AXIS_LABEL, axes.get(0).getLabel());
    assertFalse(axes.get(0).isSqueeze());

    // Configurations are reproducible and differ from one another.
    assertArrayEquals(phonons.getConfiguration(1).getPosition(0),
        new FrozenPhonons(atoms, 4, 0.1, 7L).getConfiguration(1).getPosition(0), 0.0);
    assertNotEquals(phonons.getConfiguration(0).getPosition(0)[0],
        phonons.getConfiguration(1).getPosition(0)[0], 0.0);

    Potential potential = new Potential(phonons,
        new Grid(new double[] {10.0, 10.0}, new int[] {32, 32}), SliceThickness.repeat(1.0, 2),
        new ScreenedCoulombParametrization(), 0);
    assertTrue(potential.hasFrozenPhonons());
    assertEquals(4, potential.getNumConfigurations());
    assertEquals(4, potential.build().size());
  }

  @Test
  public void testPartitionedConfigurationsMatch() {
    FrozenPhonons phonons = new FrozenPhonons(silicon(), 4, 0.1, 3L);
    Object[] block = phonons.partitionArgs(new int[][] {{2, 2}}).getBlock(new int[] {1});
    FrozenPhonons second = phonons.fromPartitionedArgs(block);
    assertEquals(2, second.getNumConfigurations());
    assertArrayEquals(phonons.getConfiguration(2).getPosition(0),
        second.getConfiguration(0).getPosition(0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGridMustMatchCell() {
    new Potential(silicon(), new Grid(new double[] {12.0, 10.0}, new int[] {32, 32}),
        SliceThickness.repeat(1.0, 2), new ScreenedCoulombParametrization(), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTransmitOutsideSlices() {
    Potential potential = new Potential(silicon(), new int[] {16, 16}, 1.0);
    TransmissionFunction function = potential.build(0).transmissionFunction(100.0e3);
    function.transmit(new double[2 * 16 * 16], 1, 2);
  }
}
