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

import java.util.Arrays;

/**
 * Atoms assigned once to the slice that contains them. Atoms above the first slice belong to the
 * first slice and atoms below the last slice belong to the last slice.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SliceIndexedAtoms extends SlicedAtoms {

  private final int[] sliceIndex;

  /**
   * Constructor for SliceIndexedAtoms.
   *
   * @param atoms          the structure (orthogonal cell).
   * @param sliceThickness the slice thicknesses; must sum to the cell depth.
   */
  public SliceIndexedAtoms(Atoms atoms, double[] sliceThickness) {
    super(atoms, sliceThickness);
    this.sliceIndex = label(atoms, this.sliceThickness);
  }

  /**
   * Constructor for SliceIndexedAtoms with equal slices.
   *
   * @param atoms the structure (orthogonal cell).
   * @param step  the maximum slice thickness.
   */
  public SliceIndexedAtoms(Atoms atoms, double step) {
    super(atoms, step);
    this.sliceIndex = label(atoms, this.sliceThickness);
  }

  private static int[] label(Atoms atoms, double[] sliceThickness) {
    double[] boundaries = SliceThickness.cumulative(sliceThickness);
    int n = sliceThickness.length;
    int[] index = new int[atoms.size()];
    for (int i = 0; i < atoms.size(); i++) {
      double z = atoms.getPosition(i)[2];
      // The number of boundaries at or below z, clamped to a valid slice.
      int k = Arrays.binarySearch(boundaries, z);
      k = k >= 0 ? k + 1 : -k - 1;
      index[i] = Math.max(0, Math.min(k, n - 1));
    }
    return index;
  }

  /**
   * The slice of every atom.
   *
   * @return a copy of the slice indices.
   */
  public int[] getSliceIndex() {
    return sliceIndex.clone();
  }

  @Override
  public Atoms getAtomsInSlices(int first, int last, int... numbers) {
    checkRange(first, last);
    Atoms selected = atoms.select(i -> sliceIndex[i] >= first && sliceIndex[i] < last
        && accept(atoms.getNumber(i), numbers));
    double offset = 0.0;
    for (int i = 0; i < first; i++) {
      offset += sliceThickness[i];
    }
    double depth = 0.0;
    for (int i = first; i < last; i++) {
      depth += sliceThickness[i];
    }
    double[][] positions = selected.getPositions();
    for (double[] position : positions) {
      position[2] -= offset;
    }
    return new Atoms(positions, selected.getNumbers(), rangeCell(depth));
  }
}
