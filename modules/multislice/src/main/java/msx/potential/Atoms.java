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
import static org.apache.commons.math3.util.FastMath.abs;

import java.util.Arrays;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * An immutable atomic structure: Cartesian positions, atomic numbers and the unit cell.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Atoms {

  private static final double TOLERANCE = 1.0e-12;

  private final double[][] positions;
  private final int[] numbers;
  private final double[][] cell;

  /**
   * Constructor for Atoms.
   *
   * @param positions the positions, one row of (x, y, z) per atom [Angstrom].
   * @param numbers   the atomic numbers.
   * @param cell      the cell vectors, one per row [Angstrom].
   */
  public Atoms(double[][] positions, int[] numbers, double[][] cell) {
    if (positions.length != numbers.length) {
      throw new IllegalArgumentException(format(" Found %d positions for %d atomic numbers.",
          positions.length, numbers.length));
    }
    if (cell.length != 3) {
      throw new IllegalArgumentException(" The cell requires three vectors.");
    }
    this.positions = new double[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      if (positions[i].length != 3) {
        throw new IllegalArgumentException(format(" Position %d is not three dimensional.", i));
      }
      this.positions[i] = positions[i].clone();
    }
    this.numbers = numbers.clone();
    this.cell = new double[3][];
    for (int i = 0; i < 3; i++) {
      if (cell[i].length != 3) {
        throw new IllegalArgumentException(format(" Cell vector %d is not three dimensional.", i));
      }
      this.cell[i] = cell[i].clone();
    }
  }

  /**
   * An orthogonal cell with the given side lengths.
   *
   * @param a the length along x.
   * @param b the length along y.
   * @param c the length along z.
   * @return the cell vectors.
   */
  public static double[][] orthogonalCell(double a, double b, double c) {
    return new double[][] {{a, 0.0, 0.0}, {0.0, b, 0.0}, {0.0, 0.0, c}};
  }

  public int size() {
    return numbers.length;
  }

  /**
   * The position of one atom.
   *
   * @param i the atom index.
   * @return a copy of (x, y, z).
   */
  public double[] getPosition(int i) {
    return positions[i].clone();
  }

  /**
   * All positions.
   *
   * @return a copy of the positions.
   */
  public double[][] getPositions() {
    double[][] copy = new double[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      copy[i] = positions[i].clone();
    }
    return copy;
  }

  public int getNumber(int i) {
    return numbers[i];
  }

  public int[] getNumbers() {
    return numbers.clone();
  }

  /**
   * The cell vectors.
   *
   * @return a copy of the cell.
   */
  public double[][] getCell() {
    return new double[][] {cell[0].clone(), cell[1].clone(), cell[2].clone()};
  }

  /**
   * The lengths of the diagonal of an orthogonal cell.
   *
   * @return (a, b, c).
   */
  public double[] getCellLengths() {
    checkOrthogonal();
    return new double[] {cell[0][0], cell[1][1], cell[2][2]};
  }

  /**
   * The distinct atomic numbers, in increasing order.
   *
   * @return the atomic numbers.
   */
  public int[] getUniqueNumbers() {
    TreeSet<Integer> unique = new TreeSet<>();
    for (int number : numbers) {
      unique.add(number);
    }
    return unique.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * True if every off-diagonal element of the cell is zero.
   *
   * @return true for an orthogonal cell.
   */
  public boolean isOrthogonal() {
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        if (i != j && abs(cell[i][j]) > TOLERANCE) {
          return false;
        }
      }
    }
    return true;
  }

  /** Throw an IllegalArgumentException if the cell is not orthogonal. */
  public void checkOrthogonal() {
    if (!isOrthogonal()) {
      throw new IllegalArgumentException(
          format(" The cell %s is not orthogonal.", Arrays.deepToString(cell)));
    }
  }

  /**
   * The atoms whose index passes a test, in their original order.
   *
   * @param selection the test.
   * @return the selected atoms, with the same cell.
   */
  public Atoms select(IntPredicate selection) {
    int n = 0;
    for (int i = 0; i < numbers.length; i++) {
      if (selection.test(i)) {
        n++;
      }
    }
    double[][] p = new double[n][];
    int[] z = new int[n];
    int k = 0;
    for (int i = 0; i < numbers.length; i++) {
      if (selection.test(i)) {
        p[k] = positions[i];
        z[k++] = numbers[i];
      }
    }
    return new Atoms(p, z, cell);
  }

  /**
   * A copy with new positions.
   *
   * @param newPositions the positions.
   * @return the new atoms.
   */
  public Atoms withPositions(double[][] newPositions) {
    return new Atoms(newPositions, numbers, cell);
  }

  /**
   * A copy with a new cell.
   *
   * @param newCell the cell.
   * @return the new atoms.
   */
  public Atoms withCell(double[][] newCell) {
    return new Atoms(positions, numbers, newCell);
  }

  /**
   * Join two structures that share a cell.
   *
   * @param other the other atoms.
   * @return the combined atoms with the cell of this structure.
   */
  public Atoms concatenate(Atoms other) {
    double[][] p = new double[size() + other.size()][];
    int[] z = new int[size() + other.size()];
    System.arraycopy(positions, 0, p, 0, size());
    System.arraycopy(other.positions, 0, p, size(), other.size());
    System.arraycopy(numbers, 0, z, 0, size());
    System.arraycopy(other.numbers, 0, z, size(), other.size());
    return new Atoms(p, z, cell);
  }

  @Override
  public String toString() {
    return format("Atoms(%d atoms, cell=%s)", size(), Arrays.deepToString(cell));
  }
}
