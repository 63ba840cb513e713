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
package msx.array;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.axes.UnknownAxis;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of ensemble indexing, joining and lazy evaluation of ArrayObjects. */
public class ArrayObjectTest extends MSXTest {

  private final ComputeSettings settings = new ComputeSettings(Device.CPU, true, 64, 2, false);

  private static Signal series() {
    double[] values = new double[2 * 3 * 4];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    Signal signal = Signal.of(new int[] {2, 3, 4}, values);
    OrdinalAxis first = new OrdinalAxis("a", "", Arrays.asList(1, 2), true, false);
    OrdinalAxis second = new OrdinalAxis("b", "", Arrays.asList(10, 20, 30), true, false);
    return (Signal) signal.withArray(signal.getBackingArray(), Arrays.asList(first, second));
  }

  @Test
  public void testShapes() {
    Signal s = series();
    assertEquals(2, s.getEnsembleDims());
    assertArrayEquals(new int[] {2, 3}, s.getEnsembleShape());
    assertArrayEquals(new int[] {4}, s.getBaseShape());
    assertEquals(3, s.getAxesMetadata().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAxisMetadataCountMustMatch() {
    new Signal(BackingArray.of(ArrayData.zeros(DataType.FLOAT64, 2, 4)),
        Arrays.<AxisMetadata>asList(new UnknownAxis(), new UnknownAxis()), null, Device.CPU);
  }

  @Test
  public void testGetItems() {
    Signal s = series();
    ArrayObject item = s.get(Index.at(1));
    assertArrayEquals(new int[] {3, 4}, item.getShape());
    assertEquals("b", item.getEnsembleAxesMetadata().get(0).getLabel());
    assertEquals(12.0, item.getArray().getReal(0), 0.0);

    ArrayObject kept = s.getItems(true, Index.at(1), Index.range(1, 3));
    assertArrayEquals(new int[] {1, 2, 4}, kept.getShape());
    OrdinalAxis b = (OrdinalAxis) kept.getEnsembleAxesMetadata().get(1);
    assertEquals(Arrays.<Object>asList(20, 30), b.getValues());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBaseAxesCannotBeIndexed() {
    series().get(Index.at(0), Index.at(0), Index.at(0));
  }

  @Test
  public void testSqueezeRespectsMetadata() {
    Signal s = series();
    ArrayObject one = s.getItems(true, Index.at(0));
    assertArrayEquals(new int[] {1, 3, 4}, one.getShape());
    assertArrayEquals(new int[] {3, 4}, one.squeeze().getShape());

    ArrayObject unknown = s.get(Index.at(0)).expandDims(new int[] {0},
        Collections.singletonList(new UnknownAxis()));
    assertArrayEquals(new int[] {1, 3, 4}, unknown.getShape());
    assertArrayEquals(new int[] {1, 3, 4}, unknown.squeeze().getShape());
    assertArrayEquals(new int[] {3, 4}, unknown.squeeze(0).getShape());
  }

  @Test
  public void testStackAndConcatenate() {
    Signal s = series();
    ArrayObject stacked = ArrayObject.stack(Arrays.asList(s, s), null, 1);
    assertArrayEquals(new int[] {2, 2, 3, 4}, stacked.getShape());
    assertTrue(stacked.getEnsembleAxesMetadata().get(1) instanceof UnknownAxis);

    ArrayObject joined = ArrayObject.concatenate(Arrays.asList(s, s.get(Index.range(0, 1))), 0);
    assertArrayEquals(new int[] {3, 3, 4}, joined.getShape());
    OrdinalAxis a = (OrdinalAxis) joined.getEnsembleAxesMetadata().get(0);
    assertEquals(Arrays.<Object>asList(1, 2, 1), a.getValues());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testStackShapeMismatch() {
    Signal s = series();
    ArrayObject.stack(Arrays.asList(s, s.get(Index.at(0))), null, 0);
  }

  @Test
  public void testLazyMatchesEager() {
    Signal s = series();
    ArrayObject lazy = s.ensureLazy(settings);
    assertTrue(lazy.isLazy());
    assertTrue(lazy.getLazyArray().getNumBlocks()[0] > 1);

    ArrayObject selected = lazy.getItems(false, Index.at(1), Index.range(0, 2));
    assertTrue(selected.isLazy());
    selected.compute(settings);
    assertFalse(selected.isLazy());
    assertEquals(s.getItems(false, Index.at(1), Index.range(0, 2)), selected);
  }

  @Test
  public void testComputeIsIdempotent() {
    Signal s = series();
    ArrayData before = s.getArray();
    assertSame(s, s.compute(settings));
    assertSame(before, s.getArray());
  }

  @Test
  public void testReduceEnsembleAveragesFlaggedAxes() {
    Signal s = Signal.of(new int[] {2, 2}, 1, 2, 3, 4);
    ArrayObject flagged = s.withArray(s.getBackingArray(),
        Collections.singletonList(OrdinalAxis.indexed("Frozen phonons", 2, true, true)));
    ArrayObject reduced = flagged.reduceEnsemble();
    assertArrayEquals(new int[] {2}, reduced.getShape());
    assertArrayEquals(new double[] {2, 3}, reduced.getArray().getData(), 1.0e-12);

    ArrayObject lazyReduced = flagged.ensureLazy(settings).reduceEnsemble().compute(settings);
    assertEquals(reduced, lazyReduced);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testUnavailableDeviceFailsFast() {
    series().copyToDevice(Device.GPU);
  }
}
