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

import msx.utilities.MSXTest;
import org.junit.Test;

/** Tests of chunk validation and block enumeration. */
public class ChunksTest extends MSXTest {

  @Test
  public void testAutoChunksRespectLimit() {
    int[] shape = {10, 4, 4};
    int[] requested = {Chunks.AUTO, Chunks.FULL, Chunks.FULL};
    // One item is 16 doubles (128 bytes); allow three items per block.
    int[][] chunks = Chunks.validate(shape, requested, 3 * 128, 8);
    assertArrayEquals(new int[] {3, 3, 3, 1}, chunks[0]);
    assertArrayEquals(new int[] {4}, chunks[1]);
    assertArrayEquals(new int[] {4}, chunks[2]);
  }

  @Test
  public void testAutoChunksFitWithoutSplitting() {
    int[][] chunks = Chunks.validate(new int[] {5, 8}, new int[] {Chunks.AUTO, Chunks.FULL},
        1L << 20, 16);
    assertArrayEquals(new int[] {5}, chunks[0]);
  }

  @Test
  public void testExplicitChunks() {
    int[][] chunks = Chunks.validate(new int[] {7, 2}, new int[] {2, Chunks.FULL}, 1L << 20, 8);
    assertArrayEquals(new int[] {2, 2, 2, 1}, chunks[0]);
  }

  @Test
  public void testZeroLengthAxis() {
    int[][] chunks = Chunks.validate(new int[] {0, 4}, new int[] {Chunks.AUTO, Chunks.FULL},
        1L << 20, 8);
    assertArrayEquals(new int[] {0}, chunks[0]);
    assertEquals(0, Chunks.blockIndices(chunks).size());
  }

  @Test
  public void testBlockIndices() {
    int[][] chunks = {{2, 2, 1}, {3, 3}};
    assertEquals(6, Chunks.blockIndices(chunks).size());
    assertArrayEquals(new int[] {4, 3}, Chunks.blockStart(chunks, new int[] {2, 1}));
    assertArrayEquals(new int[] {1, 3}, Chunks.blockShape(chunks, new int[] {2, 1}));
    assertEquals(1, Chunks.blockIndices(new int[0][]).size());
  }
}
