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
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.axes.UnknownAxis;
import msx.utilities.MSXTest;
import org.junit.Test;

/** Round trips of ArrayObjects through the chunked directory store. */
public class ArrayStoreTest extends MSXTest {

  private final ComputeSettings settings = new ComputeSettings(Device.CPU, true, 48, 2, false);
  private final List<ArrayObjectType> types = Collections.singletonList(Signal.TYPE);

  private static Signal signal() {
    double[] values = new double[3 * 5];
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.sqrt(i) - 1.0 / 3.0;
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("sampling", 0.25);
    metadata.put("energy", 100e3);
    metadata.put("label", "Å units, with commas");
    metadata.put("count", 7);
    metadata.put("normalized", true);
    AxisMetadata axis = new OrdinalAxis("defocus", "Å", Arrays.asList(-10.0, 0.0, 10.0), true,
        false);
    return new Signal(BackingArray.of(ArrayData.wrap(DataType.FLOAT64, values, 3, 5)),
        Collections.singletonList(axis), metadata, Device.CPU);
  }

  @Test
  public void testEagerRoundTrip() throws IOException {
    File directory = new File(registerTemporaryDirectory().toFile(), "signal.msx");
    Signal signal = signal();
    ArrayStore.write(signal, directory, false, settings);
    assertTrue(new File(directory, ArrayStore.ATTRIBUTES).isFile());
    assertTrue(new File(new File(directory, ArrayStore.ARRAY), "0.0").isFile());

    ArrayObject read = ArrayStore.read(directory, types);
    assertTrue(read.isLazy());
    assertArrayEquals(signal.getShape(), read.getShape());
    read.compute(settings);
    assertEquals(signal, read);
    assertEquals(Integer.valueOf(7), read.getMetadata().get("count"));
  }

  @Test
  public void testLazyRoundTrip() throws IOException {
    File directory = new File(registerTemporaryDirectory().toFile(), "lazy.msx");
    Signal signal = signal();
    ArrayObject lazy = signal.ensureLazy(settings);
    ArrayStore.write(lazy, directory, false, settings);
    ArrayObject read = ArrayStore.read(directory, types).compute(settings);
    assertEquals(signal, read);
  }

  @Test
  public void testChunkedWriteOfManyBlocks() throws IOException {
    int rows = 64;
    double[] values = new double[rows * 5];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    Signal signal = new Signal(BackingArray.of(ArrayData.wrap(DataType.FLOAT64, values, rows, 5)),
        Collections.singletonList(new UnknownAxis("row")), new LinkedHashMap<>(), Device.CPU);
    ArrayObject lazy = signal.ensureLazy(settings);
    assertEquals(rows, lazy.getLazyArray().getChunks()[0].length);

    File directory = new File(registerTemporaryDirectory().toFile(), "rows.msx");
    ArrayStore.write(lazy, directory, false, settings);
    String[] blocks = new File(directory, ArrayStore.ARRAY).list((dir, name) -> name.endsWith(".0"));
    assertEquals(rows, blocks.length);
    assertEquals(signal, ArrayStore.read(directory, types).compute(settings));
  }

  @Test(expected = FileAlreadyExistsException.class)
  public void testNoOverwrite() throws IOException {
    File directory = new File(registerTemporaryDirectory().toFile(), "twice.msx");
    ArrayStore.write(signal(), directory, false, settings);
    ArrayStore.write(signal(), directory, false, settings);
  }

  @Test
  public void testOverwrite() throws IOException {
    File directory = new File(registerTemporaryDirectory().toFile(), "twice.msx");
    ArrayStore.write(signal(), directory, false, settings);
    Signal other = Signal.of(1.0, 2.0);
    ArrayStore.write(other, directory, true, settings);
    assertEquals(other, ArrayStore.read(directory, types).compute(settings));
  }

  @Test(expected = IOException.class)
  public void testUnknownType() throws IOException {
    File directory = new File(registerTemporaryDirectory().toFile(), "unknown.msx");
    ArrayStore.write(signal(), directory, false, settings);
    ArrayStore.read(directory, Collections.emptyList());
  }
}
