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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.ensemble.Ensemble;
import msx.array.ensemble.PartitionedArgs;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * An ensemble of atomic configurations with random thermal displacements. Each atom is displaced by
 * a Gaussian of its element's standard deviation along every Cartesian direction. Configuration i is
 * generated from the seed plus i, so any subset of the ensemble can be regenerated independently.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class FrozenPhonons implements Ensemble {

  /** Label of the frozen phonon ensemble axis. */
  public static final String AXIS_LABEL = "Frozen phonons";

  private final Atoms atoms;
  private final Map<Integer, Double> sigmas;
  private final long seed;
  private final int[] configurations;

  /**
   * Constructor for FrozenPhonons with the same displacement for every element.
   *
   * @param atoms            the structure.
   * @param numConfigurations the number of configurations.
   * @param sigma            the standard deviation of the displacements [Angstrom].
   * @param seed             the random seed.
   */
  public FrozenPhonons(Atoms atoms, int numConfigurations, double sigma, long seed) {
    this(atoms, numConfigurations, uniform(atoms, sigma), seed);
  }

  /**
   * Constructor for FrozenPhonons.
   *
   * @param atoms             the structure.
   * @param numConfigurations the number of configurations.
   * @param sigmas            the standard deviation of the displacements of each element.
   * @param seed              the random seed.
   */
  public FrozenPhonons(Atoms atoms, int numConfigurations, Map<Integer, Double> sigmas,
      long seed) {
    this(atoms, sigmas, seed, range(numConfigurations));
  }

  private FrozenPhonons(Atoms atoms, Map<Integer, Double> sigmas, long seed,
      int[] configurations) {
    for (int number : atoms.getUniqueNumbers()) {
      Double sigma = sigmas.get(number);
      if (sigma == null || sigma < 0.0) {
        throw new IllegalArgumentException(
            format(" No valid displacement for atomic number %d.", number));
      }
    }
    this.atoms = atoms;
    this.sigmas = Collections.unmodifiableMap(new HashMap<>(sigmas));
    this.seed = seed;
    this.configurations = configurations;
  }

  private static Map<Integer, Double> uniform(Atoms atoms, double sigma) {
    Map<Integer, Double> sigmas = new HashMap<>();
    for (int number : atoms.getUniqueNumbers()) {
      sigmas.put(number, sigma);
    }
    return sigmas;
  }

  private static int[] range(int n) {
    if (n < 0) {
      throw new IllegalArgumentException(format(" Invalid number of configurations %d.", n));
    }
    int[] range = new int[n];
    Arrays.setAll(range, i -> i);
    return range;
  }

  public Atoms getAtoms() {
    return atoms;
  }

  public int getNumConfigurations() {
    return configurations.length;
  }

  /**
   * Generate one configuration of this ensemble.
   *
   * @param i the position of the configuration in this ensemble.
   * @return the displaced atoms.
   */
  public Atoms getConfiguration(int i) {
    RandomGenerator random = new MersenneTwister(seed + configurations[i]);
    double[][] positions = atoms.getPositions();
    for (int a = 0; a < positions.length; a++) {
      double sigma = sigmas.get(atoms.getNumber(a));
      for (int d = 0; d < 3; d++) {
        positions[a][d] += sigma * random.nextGaussian();
      }
    }
    return atoms.withPositions(positions);
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    List<Integer> values = new ArrayList<>(configurations.length);
    for (int c : configurations) {
      values.add(c);
    }
    return Collections.singletonList(new OrdinalAxis(AXIS_LABEL, "", values, false, true));
  }

  @Override
  public int[] getEnsembleShape() {
    return new int[] {configurations.length};
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    List<Integer> values = new ArrayList<>(configurations.length);
    for (int c : configurations) {
      values.add(c);
    }
    return PartitionedArgs.of(values, chunks[0]);
  }

  /**
   * The sub-ensemble of one block of configurations.
   *
   * @param args the block arguments (a list of configuration indices).
   * @return the sub-ensemble.
   */
  @SuppressWarnings("unchecked")
  public FrozenPhonons fromPartitionedArgs(Object... args) {
    List<Integer> block = (List<Integer>) args[0];
    return new FrozenPhonons(atoms, sigmas, seed,
        block.stream().mapToInt(Integer::intValue).toArray());
  }
}
