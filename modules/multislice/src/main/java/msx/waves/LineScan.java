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
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import msx.array.axes.AxisMetadata;
import msx.array.axes.RealSpaceAxis;
import msx.array.ensemble.PartitionedArgs;

/**
 * A scan over equally spaced positions along a line, excluding the end point.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LineScan extends BaseScan {

  private final double[] start;
  private final double[] end;
  private final int gpts;

  /**
   * Constructor for LineScan.
   *
   * @param start the start of the line [Angstrom].
   * @param end   the end of the line [Angstrom].
   * @param gpts  the number of positions.
   */
  public LineScan(double[] start, double[] end, int gpts) {
    if (gpts < 1) {
      throw new IllegalArgumentException(format(" Invalid number of scan positions %d.", gpts));
    }
    this.start = start.clone();
    this.end = end.clone();
    this.gpts = gpts;
  }

  public double getLength() {
    double dx = end[0] - start[0];
    double dy = end[1] - start[1];
    return sqrt(dx * dx + dy * dy);
  }

  /**
   * The distance between positions.
   *
   * @return the sampling [Angstrom].
   */
  public double getSampling() {
    return getLength() / gpts;
  }

  @Override
  public double[][] getPositions() {
    double[][] positions = new double[gpts][2];
    for (int i = 0; i < gpts; i++) {
      positions[i][0] = start[0] + (end[0] - start[0]) * i / gpts;
      positions[i][1] = start[1] + (end[1] - start[1]) * i / gpts;
    }
    return positions;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    return Collections.singletonList(new RealSpaceAxis("r", getSampling(), "Å", 0.0, false));
  }

  @Override
  public int[] getEnsembleShape() {
    return new int[] {gpts};
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return PartitionedArgs.of(Arrays.asList(getPositions()), chunks[0]);
  }

  /**
   * The positions of one block.
   *
   * @param args the block arguments (a list of positions).
   * @return a scan over the positions of the block.
   */
  @Override
  @SuppressWarnings("unchecked")
  public CustomScan fromPartitionedArgs(Object... args) {
    List<double[]> block = (List<double[]>) args[0];
    return new CustomScan(block.toArray(new double[0][]), false);
  }
}
