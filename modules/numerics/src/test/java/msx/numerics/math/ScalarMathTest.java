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
package msx.numerics.math;

import static org.junit.Assert.assertEquals;

import msx.utilities.MSXTest;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class ScalarMathTest extends MSXTest {

  @Test
  public void testMod() {
    assertEquals(3, ScalarMath.mod(-1, 4));
    assertEquals(0, ScalarMath.mod(8, 4));
    assertEquals(0.5, ScalarMath.mod(-3.5, 2.0), 1e-15);
  }

  @Test
  public void testSinc() {
    assertEquals(1.0, ScalarMath.sinc(0.0), 0.0);
    assertEquals(0.0, ScalarMath.sinc(1.0), 1e-15);
    assertEquals(2.0 / Math.PI, ScalarMath.sinc(0.5), 1e-15);
  }

  @Test
  public void testParity() {
    assertEquals(5, ScalarMath.ensureParity(4, false, 1));
    assertEquals(3, ScalarMath.ensureParity(4, false, -1));
    assertEquals(4, ScalarMath.ensureParity(4, true, 1));
  }
}
