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
package msx.multislice;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ensemble.OutputSpecification;
import msx.detectors.Detector;
import msx.potential.Atoms;
import msx.potential.Potential;
import msx.potential.SliceIndexedAtoms;
import msx.potential.TransmissionFunction;
import msx.waves.Waves;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.time.StopWatch;

/**
 * Inelastic multislice with a transition potential. At the entrance of every slice the elastic
 * waves are scattered at the transition sites of that slice; the scattered waves are propagated to
 * the exit surface, detected and summed. The elastic waves then continue through the slice.
 * Output d has the shape [configurations] ++ input ensemble ++ base shape of detector d.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TransitionPotentialMultislice extends AbstractMultisliceTransform {

  private static final Logger logger =
      Logger.getLogger(TransitionPotentialMultislice.class.getName());

  private final TransitionPotential transitionPotential;
  private final SliceIndexedAtoms sites;

  /**
   * Transition sites taken from the atoms of each configuration of the potential.
   *
   * @param potential           the potential.
   * @param transitionPotential the transition potential.
   * @param detectors           the detectors; the exit waves are returned if empty or null.
   */
  public TransitionPotentialMultislice(Potential potential,
      TransitionPotential transitionPotential, List<Detector> detectors) {
    this(potential, transitionPotential, null, detectors);
  }

  /**
   * Constructor for TransitionPotentialMultislice.
   *
   * @param potential           the potential.
   * @param transitionPotential the transition potential.
   * @param sites               the transition sites; the number of slices must match the
   *                            potential. Null to use the atoms of the potential.
   * @param detectors           the detectors; the exit waves are returned if empty or null.
   */
  public TransitionPotentialMultislice(Potential potential,
      TransitionPotential transitionPotential, @Nullable SliceIndexedAtoms sites,
      List<Detector> detectors) {
    super(potential, detectors);
    if (sites != null && sites.getNumSlices() != potential.getNumSlices()) {
      throw new IllegalArgumentException(format(" Transition sites have %d slices, the potential"
          + " has %d.", sites.getNumSlices(), potential.getNumSlices()));
    }
    this.transitionPotential = transitionPotential;
    this.sites = sites;
  }

  @Override
  public TransitionPotentialMultislice fromPartitionedArgs(Object... args) {
    return new TransitionPotentialMultislice(potential.fromPartitionedArgs(args),
        transitionPotential, sites, detectors);
  }

  @Override
  public OutputSpecification getOutputSpecification(ArrayObject template, int output) {
    return detectorSpecification(checkWaves(template), detectors.get(output));
  }

  @Override
  public List<ArrayData> calculateNewArrays(ArrayObject input) {
    Waves waves = checkWaves(input);
    int numConfigurations = potential.getNumConfigurations();
    int[] ensembleShape = waves.getEnsembleShape();
    int nPlanes = (int) ArrayData.product(ensembleShape);
    double[][] tilts = waves.getTilts();
    double energy = waves.getEnergy();

    List<OutputSpecification> specs = new ArrayList<>(detectors.size());
    List<ArrayData> outputs = new ArrayList<>(detectors.size());
    for (Detector detector : detectors) {
      OutputSpecification spec = detectorSpecification(waves, detector);
      specs.add(spec);
      int[] outShape = ArrayUtils.addAll(new int[] {numConfigurations}, ensembleShape);
      outputs.add(ArrayData.zeros(spec.getDataType(),
          ArrayUtils.addAll(outShape, spec.getBaseShape())));
    }

    StopWatch stopWatch = StopWatch.createStarted();
    int numScattered = 0;
    for (int c = 0; c < numConfigurations; c++) {
      TransmissionFunction transmission = potential.build(c).transmissionFunction(energy);
      SliceIndexedAtoms sliced = sites != null ? sites : potential.getSlicedAtoms(c);
      Multislice elastic = new Multislice(initialWaves(waves), waves.getGrid(), energy, tilts,
          transmission, 0);
      List<ArrayData> accumulated = new ArrayList<>(detectors.size());
      for (OutputSpecification spec : specs) {
        accumulated.add(ArrayData.zeros(spec.getDataType(),
            ArrayUtils.addAll(ensembleShape, spec.getBaseShape())));
      }

      for (int i = 0; i < potential.getNumSlices(); i++) {
        Atoms sliceSites = transitionPotential.validateSites(sliced.getSlice(i));
        if (sliceSites.size() > 0) {
          Waves current = wrapWaves(waves, elastic.getWaves(), waves.getEnsembleAxesMetadata());
          Waves scattered = transitionPotential.generateScatteredWaves(current, sliceSites);
          int n = scattered.getEnsembleShape()[0];
          Multislice inelastic = new Multislice(scattered.getArray(), waves.getGrid(), energy,
              repeat(tilts, n), transmission, i);
          inelastic.run();
          Waves exit = wrapWaves(waves, inelastic.releaseWaves(),
              scattered.getEnsembleAxesMetadata());
          for (int d = 0; d < detectors.size(); d++) {
            accumulated.get(d).addInPlace(detectors.get(d).detect(exit).getArray().sum(0));
          }
          numScattered += n;
        }
        elastic.step();
      }

      for (int d = 0; d < detectors.size(); d++) {
        double[] source = accumulated.get(d).getData();
        System.arraycopy(source, 0, outputs.get(d).getData(), c * source.length, source.length);
      }
    }
    logger.info(format(" Transition potential multislice of %d scattered wave(s) over %d"
        + " configuration(s) in %s.", numScattered, numConfigurations, stopWatch));

    if (potential.getEnsembleShape().length == 0) {
      List<ArrayData> squeezed = new ArrayList<>(outputs.size());
      for (ArrayData output : outputs) {
        squeezed.add(output.squeeze(0));
      }
      return squeezed;
    }
    return outputs;
  }

  private static double[][] repeat(double[][] tilts, int n) {
    double[][] repeated = new double[n * tilts.length][];
    for (int i = 0; i < n; i++) {
      System.arraycopy(tilts, 0, repeated, i * tilts.length, tilts.length);
    }
    return repeated;
  }
}
