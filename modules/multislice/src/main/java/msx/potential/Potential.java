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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.ensemble.Ensemble;
import msx.array.ensemble.PartitionedArgs;
import msx.waves.Grid;
import org.apache.commons.lang3.time.StopWatch;

/**
 * The electrostatic potential of an atomic structure, divided into slices along z and projected on
 * a periodic grid. A potential built from a {@link FrozenPhonons} ensemble is itself an ensemble
 * with one configuration per item.
 *
 * <p>Exit planes are the slices after which the wave is detected. By default only the exit surface
 * is an exit plane; with an exit plane interval N the entrance surface and every N-th slice are
 * exit planes as well.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Potential implements Ensemble {

  private static final Logger logger = Logger.getLogger(Potential.class.getName());

  /** Label of the exit plane axis. */
  public static final String THICKNESS_LABEL = "thickness";

  private final Atoms atoms;
  private final FrozenPhonons frozenPhonons;
  private final Grid grid;
  private final double[] sliceThickness;
  private final InfinitePotentialProjections projections;
  private final int exitPlaneInterval;

  /**
   * A potential with equal slices and the screened Coulomb parametrization.
   *
   * @param atoms          the structure (orthogonal cell).
   * @param gpts           the number of grid points along x and y.
   * @param sliceThickness the maximum slice thickness [Angstrom].
   */
  public Potential(Atoms atoms, int[] gpts, double sliceThickness) {
    this(atoms, new Grid(lateralExtent(atoms), gpts),
        SliceThickness.validate(sliceThickness, atoms.getCellLengths()[2]),
        new ScreenedCoulombParametrization(), 0);
  }

  /**
   * Constructor for Potential.
   *
   * @param atoms             the structure (orthogonal cell).
   * @param grid              the grid; its extent must match the cell.
   * @param sliceThickness    the slice thicknesses; must sum to the cell depth.
   * @param parametrization   the parametrization of the scattering factors.
   * @param exitPlaneInterval the number of slices between exit planes (0 for the exit surface only).
   */
  public Potential(Atoms atoms, Grid grid, double[] sliceThickness,
      ScatteringFactorParametrization parametrization, int exitPlaneInterval) {
    this(atoms, null, grid, sliceThickness, new InfinitePotentialProjections(parametrization),
        exitPlaneInterval);
  }

  /**
   * Constructor for a frozen phonon Potential.
   *
   * @param frozenPhonons     the configurations.
   * @param grid              the grid; its extent must match the cell.
   * @param sliceThickness    the slice thicknesses; must sum to the cell depth.
   * @param parametrization   the parametrization of the scattering factors.
   * @param exitPlaneInterval the number of slices between exit planes (0 for the exit surface only).
   */
  public Potential(FrozenPhonons frozenPhonons, Grid grid, double[] sliceThickness,
      ScatteringFactorParametrization parametrization, int exitPlaneInterval) {
    this(frozenPhonons.getAtoms(), frozenPhonons, grid, sliceThickness,
        new InfinitePotentialProjections(parametrization), exitPlaneInterval);
  }

  private Potential(Atoms atoms, FrozenPhonons frozenPhonons, Grid grid, double[] sliceThickness,
      InfinitePotentialProjections projections, int exitPlaneInterval) {
    atoms.checkOrthogonal();
    double[] extent = lateralExtent(atoms);
    double[] gridExtent = grid.getExtent();
    for (int i = 0; i < 2; i++) {
      if (abs(extent[i] - gridExtent[i]) > 1.0e-6 * extent[i]) {
        throw new IllegalArgumentException(format(" The extent of %s does not match the cell %s.",
            grid, Arrays.toString(extent)));
      }
    }
    this.atoms = atoms;
    this.frozenPhonons = frozenPhonons;
    this.grid = grid;
    this.sliceThickness = SliceThickness.validate(sliceThickness, atoms.getCellLengths()[2]);
    this.projections = projections;
    this.exitPlaneInterval = exitPlaneInterval;
  }

  private static double[] lateralExtent(Atoms atoms) {
    double[] lengths = atoms.getCellLengths();
    return new double[] {lengths[0], lengths[1]};
  }

  public Atoms getAtoms() {
    return atoms;
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
   * The total thickness.
   *
   * @return the sum of the slice thicknesses [Angstrom].
   */
  public double getThickness() {
    double sum = 0.0;
    for (double t : sliceThickness) {
      sum += t;
    }
    return sum;
  }

  /**
   * The number of atomic configurations of this potential.
   *
   * @return 1 without frozen phonons.
   */
  public int getNumConfigurations() {
    return frozenPhonons == null ? 1 : frozenPhonons.getNumConfigurations();
  }

  /**
   * True if this potential is an ensemble of frozen phonon configurations.
   *
   * @return true for frozen phonons.
   */
  public boolean hasFrozenPhonons() {
    return frozenPhonons != null;
  }

  /**
   * The slices after which the wave is detected; -1 denotes the entrance surface.
   *
   * @return the exit planes in increasing order.
   */
  public int[] getExitPlanes() {
    int n = sliceThickness.length;
    if (exitPlaneInterval <= 0) {
      return new int[] {n - 1};
    }
    List<Integer> planes = new ArrayList<>();
    for (int i = -1; i < n; i += exitPlaneInterval) {
      planes.add(i);
    }
    if (planes.get(planes.size() - 1) != n - 1) {
      planes.add(n - 1);
    }
    return planes.stream().mapToInt(Integer::intValue).toArray();
  }

  public int getNumExitPlanes() {
    return getExitPlanes().length;
  }

  /**
   * Metadata of the exit plane axis: the depth of every exit plane.
   *
   * @return the axis metadata.
   */
  public AxisMetadata getExitPlanesAxis() {
    double[] cumulative = SliceThickness.cumulative(sliceThickness);
    List<Double> depths = new ArrayList<>();
    for (int plane : getExitPlanes()) {
      depths.add(plane < 0 ? 0.0 : cumulative[plane]);
    }
    return new OrdinalAxis(THICKNESS_LABEL, "Å", depths, true, false);
  }

  /**
   * The atoms of one configuration.
   *
   * @param configuration the configuration.
   * @return the atoms.
   */
  public Atoms getConfiguration(int configuration) {
    if (configuration < 0 || configuration >= getNumConfigurations()) {
      throw new IndexOutOfBoundsException(format(" Configuration %d of %d.", configuration,
          getNumConfigurations()));
    }
    return frozenPhonons == null ? atoms : frozenPhonons.getConfiguration(configuration);
  }

  /**
   * The atoms of one configuration, assigned to slices.
   *
   * @param configuration the configuration.
   * @return the sliced atoms.
   */
  public SliceIndexedAtoms getSlicedAtoms(int configuration) {
    return new SliceIndexedAtoms(getConfiguration(configuration), sliceThickness);
  }

  /**
   * Project the slices of one configuration.
   *
   * @param configuration the configuration.
   * @return the projected potential of every slice.
   */
  public PotentialArray build(int configuration) {
    StopWatch stopWatch = StopWatch.createStarted();
    SliceIndexedAtoms sliced = getSlicedAtoms(configuration);
    ArrayData array = projections.project(sliced.getAtoms(), grid, sliced.getSliceIndex(),
        sliced.getNumSlices());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Projected %d atoms onto %d slices of %s in %s.",
          sliced.getAtoms().size(), sliced.getNumSlices(), grid, stopWatch));
    }
    return new PotentialArray(grid, sliceThickness, array);
  }

  /**
   * Project the slices of every configuration.
   *
   * @return one PotentialArray per configuration.
   */
  public List<PotentialArray> build() {
    StopWatch stopWatch = StopWatch.createStarted();
    List<PotentialArray> arrays = new ArrayList<>(getNumConfigurations());
    for (int i = 0; i < getNumConfigurations(); i++) {
      arrays.add(build(i));
    }
    logger.info(format(" Built %d potential configuration(s) of %d slices (%s) in %s.",
        arrays.size(), getNumSlices(), projections.getParametrization().getName(), stopWatch));
    return arrays;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    return frozenPhonons == null ? Collections.emptyList()
        : frozenPhonons.getEnsembleAxesMetadata();
  }

  @Override
  public int[] getEnsembleShape() {
    return frozenPhonons == null ? new int[0] : frozenPhonons.getEnsembleShape();
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return frozenPhonons == null ? PartitionedArgs.empty() : frozenPhonons.partitionArgs(chunks);
  }

  /**
   * The potential restricted to one block of its ensemble.
   *
   * @param args the block arguments.
   * @return the restricted potential.
   */
  public Potential fromPartitionedArgs(Object... args) {
    if (frozenPhonons == null) {
      return this;
    }
    return new Potential(atoms, frozenPhonons.fromPartitionedArgs(args), grid, sliceThickness,
        projections, exitPlaneInterval);
  }

  @Override
  public String toString() {
    return format("Potential(%d atoms, %d slices, %d configuration(s), %s)", atoms.size(),
        getNumSlices(), getNumConfigurations(), grid);
  }
}
