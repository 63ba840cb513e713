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
package msx.array.lazy;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import msx.array.ArrayData;
import msx.array.Chunks;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Device;
import msx.array.Index;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of lazy, chunked arrays against their eager counterparts. */
public class LazyArrayTest extends MSXTest {

  private final ComputeSettings settings = new ComputeSettings(Device.CPU, true, 1L << 20, 4,
      false);

  private static ArrayData range(int... shape) {
    int n = (int) ArrayData.product(shape);
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = i;
    }
    return ArrayData.wrap(DataType.FLOAT64, values, shape);
  }

  private static LazyArray chunked(ArrayData data, int... chunkSizes) {
    int[] shape = data.getShape();
    int[][] chunks = new int[shape.length][];
    for (int i = 0; i < shape.length; i++) {
      chunks[i] = Chunks.split(shape[i], chunkSizes[i]);
    }
    return LazyArray.fromArray(data, chunks);
  }

  @Test
  public void testComputeMatchesSource() {
    ArrayData data = range(5, 3, 4);
    LazyArray lazy = chunked(data, 2, 3, 4);
    assertArrayEquals(new int[] {3, 1, 1}, lazy.getNumBlocks());
    assertEquals(data, lazy.compute(settings));
  }

  @Test
  public void testGetItems() {
    ArrayData data = range(5, 3, 4);
    LazyArray lazy = chunked(data, 2, 1, 4);
    Index[] items = {Index.range(1, 4), Index.at(2)};
    LazyArray selected = lazy.getItems(items);
    assertArrayEquals(new int[] {3, 4}, selected.getShape());
    assertEquals(data.getItems(items), selected.compute(settings));
  }

  @Test
  public void testExpandSqueezeAndRechunk() {
    ArrayData data = range(4, 6);
    LazyArray lazy = chunked(data, 3, 6);
    LazyArray expanded = lazy.expandDims(1);
    assertArrayEquals(new int[] {4, 1, 6}, expanded.getShape());
    assertEquals(data.expandDims(1), expanded.compute(settings));
    assertEquals(data, expanded.squeeze(1).compute(settings));

    LazyArray rechunked = lazy.rechunk(new int[][] {{1, 1, 1, 1}, {2, 4}});
    assertArrayEquals(new int[] {4, 2}, rechunked.getNumBlocks());
    assertEquals(data, rechunked.compute(settings));
  }

  @Test
  public void testStackAndConcatenate() {
    ArrayData a = range(3, 2);
    ArrayData b = range(3, 2);
    b.scaleInPlace(2.0);
    LazyArray la = chunked(a, 2, 2);
    LazyArray lb = chunked(b, 1, 2);

    LazyArray stacked = LazyArray.stack(Arrays.asList(la, lb), 0);
    assertEquals(ArrayData.stack(Arrays.asList(a, b), 0), stacked.compute(settings));

    LazyArray joined = LazyArray.concatenate(Arrays.asList(la, lb), 0);
    assertArrayEquals(new int[] {6, 2}, joined.getShape());
    assertEquals(ArrayData.concatenate(Arrays.asList(a, b), 0), joined.compute(settings));
  }

  @Test
  public void testMapAndMean() {
    ArrayData data = range(4, 3);
    LazyArray lazy = chunked(data, 1, 3);
    LazyArray summed = lazy.map(1, new int[0], DataType.FLOAT64, block -> block.sum(1));
    assertArrayEquals(new double[] {3, 12, 21, 30}, summed.compute(settings).getData(), 0.0);
    assertArrayEquals(new double[] {4.5, 5.5, 6.5}, lazy.mean(0).compute(settings).getData(),
        1.0e-12);
  }

  @Test
  public void testBlocksEvaluatedOncePerPass() {
    AtomicInteger calls = new AtomicInteger();
    LazyArray source = LazyArray.fromBlocks(new int[][] {{2, 2}, {3}}, DataType.FLOAT64,
        (index, start, shape) -> {
          calls.incrementAndGet();
          return ArrayData.full(DataType.FLOAT64, index[0], 0.0, shape);
        });
    LazyArray a = source.getItems(Index.range(0, 3));
    LazyArray b = source.getItems(Index.range(1, 4));
    LazyEvaluator.compute(Arrays.asList(a, b), settings);
    assertEquals(2, calls.get());
  }

  @Test
  public void testFailureIsRethrown() {
    LazyArray failing = LazyArray.fromBlocks(new int[][] {{1, 1, 1}}, DataType.FLOAT64,
        (index, start, shape) -> {
          if (index[0] == 1) {
            throw new IllegalArgumentException(" Block failed.");
          }
          return ArrayData.zeros(DataType.FLOAT64, shape);
        });
    try {
      failing.compute(settings);
      fail(" The block failure should propagate.");
    } catch (IllegalArgumentException e) {
      assertEquals(" Block failed.", e.getMessage());
    }
  }

  @Test
  public void testZeroLengthArray() {
    LazyArray empty = LazyArray.fromBlocks(new int[][] {{0}, {4}}, DataType.COMPLEX128,
        (index, start, shape) -> {
          throw new IllegalStateException(" No block should be computed.");
        });
    ArrayData result = empty.compute(settings);
    assertArrayEquals(new int[] {0, 4}, result.getShape());
  }
}
