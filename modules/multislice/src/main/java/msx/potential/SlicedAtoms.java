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

/**
 * An atomic structure divided along z into contiguous slices.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class SlicedAtoms {

  protected final Atoms atoms;
  protected final double[] sliceThickness;

  /**
   * Constructor for SlicedAtoms.
   *
   * @param atoms          the structure (orthogonal cell).
   * @param sliceThickness the slice thicknesses; must sum to the cell depth.
   */
  protected SlicedAtoms(Atoms atoms, double[] sliceThickness) {
    atoms.checkOrthogonal();
    this.atoms = atoms;
    this.sliceThickness = SliceThickness.validate(sliceThickness, atoms.getCellLengths()[2]);
  }

  /**
   * Constructor for SlicedAtoms with equal slices.
   *
   * @param atoms the structure (orthogonal cell).
   * @param step  the maximum slice thickness.
   */
  protected SlicedAtoms(Atoms atoms, double step) {
    atoms.checkOrthogonal();
    this.atoms = atoms;
    this.sliceThickness = SliceThickness.validate(step, atoms.getCellLengths()[2]);
  }

  public Atoms getAtoms() {
    return atoms;
  }

  public int getNumSlices() {
    return sliceThickness.length;
  }

  public double[] getSliceThickness() {
    return sliceThickness.clone();
  }

  public double getSliceThickness(int i) {
    return sliceThickness[i];
  }

  public double[][] getSliceLimits() {
    return SliceThickness.sliceLimits(sliceThickness);
  }

  /**
   * The atoms of a range of slices, in the local frame of the range: z is measured from the entrance
   * of the first slice and the cell depth is the thickness of the range.
   *
   * @param first   the first slice.
   * @param last    one past the last slice.
   * @param numbers if given, only atoms with these atomic numbers.
   * @return the atoms.
   */
  public abstract Atoms getAtomsInSlices(int first, int last, int... numbers);

  /**
   * The atoms of one slice.
   *
   * @param i       the slice.
   * @param numbers if given, only atoms with these atomic numbers.
   * @return the atoms.
   */
  public Atoms getSlice(int i, int... numbers) {
    return getAtomsInSlices(i, i + 1, numbers);
  }

  /** Throw an IllegalArgumentException unless [first, last) is a non-empty range of slices. */
  protected void checkRange(int first, int last) {
    if (first < 0 || last > getNumSlices() || first >= last) {
      throw new IllegalArgumentException(
          format(" Invalid slice range [%d, %d) for %d slices.", first, last, getNumSlices()));
    }
  }

  /** True if an atomic number passes an optional filter. */
  protected static boolean accept(int number, int[] numbers) {
    if (numbers == null || numbers.length == 0) {
      return true;
    }
    for (int n : numbers) {
      if (n == number) {
        return true;
      }
    }
    return false;
  }

  /** The cell of a range of slices of the given depth. */
  protected double[][] rangeCell(double depth) {
    double[][] cell = atoms.getCell();
    cell[2] = new double[] {0.0, 0.0, depth};
    return cell;
  }

  @Override
  public String toString() {
    return format("%s(%d atoms, slices=%s)", getClass().getSimpleName(), atoms.size(),
        Arrays.toString(sliceThickness));
  }
}
