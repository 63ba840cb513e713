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
package msx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.Test;

/** Tests the setup and cleanup shared by all Multislice X tests. */
public class MSXTestSetupTest extends MSXTest {

  @Test
  public void testScratchDirectoryIsDeleted() throws IOException {
    Path dir = registerTemporaryDirectory();
    assertSame(dir, registerTemporaryDirectory());
    Files.write(dir.resolve("block.0"), "data".getBytes(StandardCharsets.UTF_8));
    assertTrue(Files.isDirectory(dir));
    restoreSystemProperties();
    assertFalse(Files.exists(dir));
  }

  @Test
  public void testSystemPropertiesAreRestored() throws IOException {
    String key = "msx.setup.test.key";
    assertNull(System.getProperty(key));
    System.setProperty(key, "set");
    restoreSystemProperties();
    assertNull(System.getProperty(key));
  }

  @Test
  public void testLogLevelFollowsTestProperty() {
    Level expected = Level.WARNING;
    String value = System.getProperty("msx.test.log");
    if (value != null) {
      try {
        expected = Level.parse(value.toUpperCase());
      } catch (IllegalArgumentException e) {
        expected = Level.WARNING;
      }
    }
    assertEquals(expected, Logger.getLogger("msx").getLevel());
  }
}
