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
package msx.waves;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.ensemble.PartitionedArgs;

/**
 * A scan over an arbitrary list of positions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CustomScan extends BaseScan {

  /** Label of the axis of positions. */
  public static final String AXIS_LABEL = "positions";

  private final double[][] positions;
  private final boolean squeeze;

  /**
   * Constructor for CustomScan.
   *
   * @param positions the (x, y) positions [Angstrom].
   * @param squeeze   true if a single position may be squeezed from the result.
   */
  public CustomScan(double[][] positions, boolean squeeze) {
    this.positions = new double[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      if (positions[i].length != 2) {
        throw new IllegalArgumentException(
            format(" Scan position %s is not an (x, y) pair.", Arrays.toString(positions[i])));
      }
      this.positions[i] = positions[i].clone();
    }
    this.squeeze = squeeze;
  }

  @Override
  public double[][] getPositions() {
    double[][] copy = new double[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      copy[i] = positions[i].clone();
    }
    return copy;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    List<String> values = new ArrayList<>(positions.length);
    for (double[] p : positions) {
      values.add(format("(%.4f, %.4f)", p[0], p[1]));
    }
    return Collections.singletonList(new OrdinalAxis(AXIS_LABEL, "Å", values, squeeze, false));
  }

  @Override
  public int[] getEnsembleShape() {
    return new int[] {positions.length};
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return PartitionedArgs.of(Arrays.asList(positions), chunks[0]);
  }

  @Override
  @SuppressWarnings("unchecked")
  public CustomScan fromPartitionedArgs(Object... args) {
    List<double[]> block = (List<double[]>) args[0];
    return new CustomScan(block.toArray(new double[0][]), squeeze);
  }
}
