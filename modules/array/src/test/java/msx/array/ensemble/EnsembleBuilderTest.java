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
package msx.array.ensemble;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ComputableList;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Device;
import msx.array.Signal;
import msx.array.axes.OrdinalAxis;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of building ensembles of transforms, lazily and eagerly. */
public class EnsembleBuilderTest extends MSXTest {

  private final ComputeSettings lazy = new ComputeSettings(Device.CPU, true, 1L << 20, 2, false);
  private final ComputeSettings eager = lazy.withLazy(false);

  /** Builds the signal [1, 2, 3]. */
  private static final class SignalFactory implements ArrayObjectFactory {

    private final AtomicInteger builds = new AtomicInteger();

    @Override
    public OutputSpecification describe() {
      Signal template = Signal.of(0, 0, 0);
      return new OutputSpecification(Signal.TYPE, new int[] {3},
          template.getBaseAxesMetadata(), DataType.FLOAT64, template.getMetadata());
    }

    @Override
    public ArrayData buildArray() {
      builds.incrementAndGet();
      return ArrayData.wrap(DataType.FLOAT64, new double[] {1, 2, 3}, 3);
    }
  }

  @Test
  public void testLazyBuild() {
    SignalFactory factory = new SignalFactory();
    ScaleSeries scale = new ScaleSeries(Arrays.asList(1.0, 2.0, 3.0, 4.0));
    ComputableList<ArrayObject> outputs = EnsembleBuilder.build(scale, factory,
        lazy.withChunkSize(2 * 3 * 8), 0);
    assertEquals(1, outputs.size());
    ArrayObject result = outputs.get(0);
    assertTrue(result.isLazy());
    assertEquals(0, factory.builds.get());
    assertArrayEquals(new int[] {4, 3}, result.getShape());
    assertArrayEquals(new int[] {2, 2}, result.getLazyArray().getChunks()[0]);

    result.compute(lazy);
    assertEquals(2, factory.builds.get());
    assertArrayEquals(new double[] {1, 2, 3, 2, 4, 6, 3, 6, 9, 4, 8, 12},
        result.getArray().getData(), 0.0);
    assertEquals("scale", result.getEnsembleAxesMetadata().get(0).getLabel());
  }

  @Test
  public void testEagerMatchesLazy() {
    ScaleSeries scale = new ScaleSeries(Arrays.asList(0.5, -1.0));
    ArrayObject eagerResult = EnsembleBuilder.build(scale, new SignalFactory(), eager).get(0);
    assertFalse(eagerResult.isLazy());
    ArrayObject lazyResult = EnsembleBuilder.build(scale, new SignalFactory(), lazy).get(0);
    assertEquals(eagerResult, lazyResult.compute(lazy));
  }

  @Test
  public void testMaxBatch() {
    ScaleSeries scale = new ScaleSeries(Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    ArrayObject result = EnsembleBuilder.build(scale, new SignalFactory(), lazy, 2).get(0);
    assertArrayEquals(new int[] {2, 2, 1}, result.getLazyArray().getChunks()[0]);
  }

  @Test
  public void testSingleValueEnsembleIsSqueezed() {
    ScaleSeries scale = new ScaleSeries(Collections.singletonList(3.0));
    ArrayObject result = EnsembleBuilder.build(scale, new SignalFactory(), eager).get(0);
    assertArrayEquals(new int[] {3}, result.getShape());
    assertArrayEquals(new double[] {3, 6, 9}, result.getArray().getData(), 0.0);
  }

  @Test
  public void testZeroLengthEnsemble() {
    ScaleSeries scale = new ScaleSeries(Collections.emptyList());
    SignalFactory factory = new SignalFactory();
    ArrayObject result = EnsembleBuilder.build(scale, factory, eager).get(0);
    assertArrayEquals(new int[] {0, 3}, result.getShape());
    assertEquals(0, factory.builds.get());
  }

  @Test
  public void testMultipleOutputsShareOnePass() {
    AtomicInteger calls = new AtomicInteger();
    CompositeTransform transform = new CompositeTransform(new SumAndCopy(calls),
        new ScaleSeries(Arrays.asList(1.0, 10.0)));
    ComputableList<ArrayObject> outputs = EnsembleBuilder.build(transform, new SignalFactory(),
        lazy.withChunkSize(3 * 8));
    assertEquals(2, outputs.size());
    assertArrayEquals(new int[] {2, 3}, outputs.get(0).getShape());
    assertArrayEquals(new int[] {2, 2, 1}, outputs.get(1).getShape());
    assertEquals("copy", outputs.get(1).getEnsembleAxesMetadata().get(0).getLabel());
    assertEquals("scale", outputs.get(1).getEnsembleAxesMetadata().get(1).getLabel());

    outputs.compute(lazy);
    assertEquals(2, calls.get());
    assertArrayEquals(new double[] {1, 2, 3, 10, 20, 30}, outputs.get(0).getArray().getData(),
        0.0);
    assertArrayEquals(new double[] {6, 60, 6, 60}, outputs.get(1).getArray().getData(), 0.0);
  }

  @Test
  public void testCompositeOrder() {
    CompositeTransform transform = new CompositeTransform(
        new ScaleSeries(Arrays.asList(1.0, 2.0)), new ScaleSeries(Arrays.asList(1.0, 3.0, 5.0)));
    assertArrayEquals(new int[] {2, 3}, transform.getEnsembleShape());
    ArrayObject result = EnsembleBuilder.build(transform, new SignalFactory(), eager).get(0);
    assertArrayEquals(new int[] {2, 3, 3}, result.getShape());
    // Element [1, 2, 0] is 2 * 5 * 1.
    assertEquals(10.0, result.getArray().getReal(result.getArray().flatIndex(1, 2, 0)), 0.0);
  }

  @Test
  public void testApplyTransformToLazyInput() {
    Signal signal = Signal.of(new int[] {2, 3}, 1, 2, 3, 4, 5, 6);
    ArrayObject input = signal.withArray(signal.getBackingArray(),
        Collections.singletonList(new OrdinalAxis("item", "", Arrays.asList(0, 1), false,
            false))).ensureLazy(lazy.withChunkSize(3 * 8));
    ScaleSeries scale = new ScaleSeries(Arrays.asList(2.0, -1.0));
    List<ArrayObject> outputs = input.applyTransform(scale, lazy);
    ArrayObject result = outputs.get(0);
    assertTrue(result.isLazy());
    assertArrayEquals(new int[] {2, 2, 3}, result.getShape());
    result.compute(lazy);
    assertEquals(scale.apply(signal).get(0).getArray(), result.getArray());
    assertEquals(-6.0, result.getArray().getReal(result.getArray().flatIndex(1, 1, 2)), 0.0);
  }
}
