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

import static java.lang.String.format;

import java.util.Arrays;
import msx.array.ArrayData;
import msx.waves.Grid;

/**
 * The projected potential of every slice of one atomic configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PotentialArray {

  private final Grid grid;
  private final double[] sliceThickness;
  private final ArrayData array;

  /**
   * Constructor for PotentialArray.
   *
   * @param grid           the grid of every slice.
   * @param sliceThickness the slice thicknesses [Angstrom].
   * @param array          the projected potential [V * Angstrom], shape [numSlices, nX, nY].
   */
  public PotentialArray(Grid grid, double[] sliceThickness, ArrayData array) {
    int[] gpts = grid.getGpts();
    int[] expected = {sliceThickness.length, gpts[0], gpts[1]};
    if (!Arrays.equals(expected, array.getShape()) || array.getDataType().isComplex()) {
      throw new IllegalArgumentException(format(" A real array of shape %s is required.",
          Arrays.toString(expected)));
    }
    this.grid = grid;
    this.sliceThickness = sliceThickness.clone();
    this.array = array;
  }

  public Grid getGrid() {
    return grid;
  }

  public int getNumSlices() {
    return sliceThickness.length;
  }

  public double[] getSliceThickness() {
    return sliceThickness.clone();
  }

  /**
   * The projected potential of all slices.
   *
   * @return the array of shape [numSlices, nX, nY].
   */
  public ArrayData getArray() {
    return array;
  }

  /**
   * The total projected potential.
   *
   * @return the sum over slices, shape [nX, nY].
   */
  public ArrayData project() {
    return array.sum(0);
  }

  /**
   * The band-limited transmission functions of the slices.
   *
   * @param energy the electron energy [eV].
   * @return the transmission function.
   */
  public TransmissionFunction transmissionFunction(double energy) {
    return new TransmissionFunction(this, energy);
  }
}
