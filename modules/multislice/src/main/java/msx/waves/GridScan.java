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
import static org.apache.commons.math3.util.FastMath.ceil;

import java.util.ArrayList;
import java.util.List;
import msx.array.axes.AxisMetadata;
import msx.array.axes.RealSpaceAxis;
import msx.array.ensemble.PartitionedArgs;

/**
 * A scan over a regular grid of positions, excluding the end points. The positions along x form
 * the first ensemble axis and the positions along y the second.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GridScan extends BaseScan {

  private final List<Double> x;
  private final List<Double> y;
  private final double[] sampling;

  /**
   * Constructor for GridScan.
   *
   * @param start the lower corner [Angstrom].
   * @param end   the upper corner [Angstrom].
   * @param gpts  the number of positions along x and y.
   */
  public GridScan(double[] start, double[] end, int[] gpts) {
    if (gpts[0] < 1 || gpts[1] < 1) {
      throw new IllegalArgumentException(
          format(" Invalid number of scan positions %d x %d.", gpts[0], gpts[1]));
    }
    sampling = new double[] {(end[0] - start[0]) / gpts[0], (end[1] - start[1]) / gpts[1]};
    x = linspace(start[0], sampling[0], gpts[0]);
    y = linspace(start[1], sampling[1], gpts[1]);
  }

  private GridScan(List<Double> x, List<Double> y, double[] sampling) {
    this.x = x;
    this.y = y;
    this.sampling = sampling;
  }

  /**
   * A scan covering the whole extent of a grid at a sampling.
   *
   * @param grid     the grid.
   * @param sampling the maximum distance between positions [Angstrom].
   * @return the scan.
   */
  public static GridScan covering(Grid grid, double sampling) {
    double[] extent = grid.getExtent();
    int[] gpts = {(int) ceil(extent[0] / sampling), (int) ceil(extent[1] / sampling)};
    return new GridScan(new double[] {0.0, 0.0}, extent, gpts);
  }

  private static List<Double> linspace(double start, double step, int n) {
    List<Double> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      values.add(start + i * step);
    }
    return values;
  }

  public double[] getSampling() {
    return sampling.clone();
  }

  @Override
  public double[][] getPositions() {
    double[][] positions = new double[x.size() * y.size()][];
    int k = 0;
    for (double px : x) {
      for (double py : y) {
        positions[k++] = new double[] {px, py};
      }
    }
    return positions;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    List<AxisMetadata> axes = new ArrayList<>(2);
    axes.add(new RealSpaceAxis("x", sampling[0], "Å", x.isEmpty() ? 0.0 : x.get(0), false));
    axes.add(new RealSpaceAxis("y", sampling[1], "Å", y.isEmpty() ? 0.0 : y.get(0), false));
    return axes;
  }

  @Override
  public int[] getEnsembleShape() {
    return new int[] {x.size(), y.size()};
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return PartitionedArgs.of(x, chunks[0]).concat(PartitionedArgs.of(y, chunks[1]));
  }

  @Override
  @SuppressWarnings("unchecked")
  public GridScan fromPartitionedArgs(Object... args) {
    return new GridScan((List<Double>) args[0], (List<Double>) args[1], sampling);
  }
}
