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

/**
 * Atoms selected per query by a depth window. An atom belongs to a range of slices if its depth
 * lies in [start - padding, end + padding), so atoms near a slice boundary may be returned for both
 * neighbouring slices. Selected atoms keep their depth in the full structure; only the cell depth is
 * that of the window.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class WindowedSlicedAtoms extends SlicedAtoms {

  private final double zPadding;

  /**
   * Constructor for WindowedSlicedAtoms.
   *
   * @param atoms          the structure (orthogonal cell).
   * @param sliceThickness the slice thicknesses; must sum to the cell depth.
   * @param zPadding       the padding of each window [Angstrom].
   */
  public WindowedSlicedAtoms(Atoms atoms, double[] sliceThickness, double zPadding) {
    super(atoms, sliceThickness);
    if (zPadding < 0.0) {
      throw new IllegalArgumentException(" The padding of a slice window cannot be negative.");
    }
    this.zPadding = zPadding;
  }

  public double getZPadding() {
    return zPadding;
  }

  @Override
  public Atoms getAtomsInSlices(int first, int last, int... numbers) {
    checkRange(first, last);
    double[][] limits = getSliceLimits();
    double a = limits[first][0];
    double b = limits[last - 1][1];
    double lower = a - zPadding;
    double upper = b + zPadding;
    Atoms selected = atoms.select(i -> {
      double z = atoms.getPosition(i)[2];
      return z >= lower && z < upper && accept(atoms.getNumber(i), numbers);
    });
    return new Atoms(selected.getPositions(), selected.getNumbers(), rangeCell(b - a));
  }
}
