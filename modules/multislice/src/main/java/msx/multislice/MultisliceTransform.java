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
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.DataType;
import msx.array.ensemble.OutputSpecification;
import msx.detectors.Detector;
import msx.potential.Potential;
import msx.potential.TransmissionFunction;
import msx.waves.Waves;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.time.StopWatch;

/**
 * Propagates wave functions through every configuration of a potential and detects them at each
 * exit plane. Output d has the shape [configurations] ++ [exit planes] ++ input ensemble ++ base
 * shape of detector d.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MultisliceTransform extends AbstractMultisliceTransform {

  private static final Logger logger = Logger.getLogger(MultisliceTransform.class.getName());

  /**
   * Constructor for MultisliceTransform.
   *
   * @param potential the potential.
   * @param detectors the detectors; the exit waves are returned if empty or null.
   */
  public MultisliceTransform(Potential potential, List<Detector> detectors) {
    super(potential, detectors);
  }

  @Override
  public MultisliceTransform fromPartitionedArgs(Object... args) {
    return new MultisliceTransform(potential.fromPartitionedArgs(args), detectors);
  }

  @Override
  public OutputSpecification getOutputSpecification(ArrayObject template, int output) {
    Waves waves = checkWaves(template);
    OutputSpecification spec = detectorSpecification(waves, detectors.get(output));
    return new OutputSpecification(spec.getType(), new int[] {potential.getNumExitPlanes()},
        Collections.singletonList(potential.getExitPlanesAxis()), spec.getBaseShape(),
        spec.getBaseAxes(), spec.getDataType(), spec.getMetadata());
  }

  @Override
  public List<ArrayData> calculateNewArrays(ArrayObject input) {
    Waves waves = checkWaves(input);
    int[] exitPlanes = potential.getExitPlanes();
    int numConfigurations = potential.getNumConfigurations();
    int[] ensembleShape = waves.getEnsembleShape();
    int nPlanes = (int) ArrayData.product(ensembleShape);
    double[][] tilts = waves.getTilts();
    double energy = waves.getEnergy();

    List<OutputSpecification> specs = new ArrayList<>(detectors.size());
    List<double[]> outputs = new ArrayList<>(detectors.size());
    int[] itemSizes = new int[detectors.size()];
    for (int d = 0; d < detectors.size(); d++) {
      OutputSpecification spec = detectorSpecification(waves, detectors.get(d));
      specs.add(spec);
      itemSizes[d] = (int) ArrayData.product(spec.getBaseShape()) * nPlanes
          * spec.getDataType().getWidth();
      outputs.add(new double[numConfigurations * exitPlanes.length * itemSizes[d]]);
    }

    StopWatch stopWatch = StopWatch.createStarted();
    for (int c = 0; c < numConfigurations; c++) {
      TransmissionFunction transmission = potential.build(c).transmissionFunction(energy);
      Multislice multislice = new Multislice(initialWaves(waves), waves.getGrid(), energy, tilts,
          transmission, 0);
      for (int k = 0; k < exitPlanes.length; k++) {
        multislice.runTo(exitPlanes[k] + 1);
        ArrayData current = k == exitPlanes.length - 1 ? multislice.releaseWaves()
            : multislice.getWaves();
        Waves exit = wrapWaves(waves, current, waves.getEnsembleAxesMetadata());
        for (int d = 0; d < detectors.size(); d++) {
          ArrayData detected = detectors.get(d).detect(exit).getArray();
          System.arraycopy(detected.getData(), 0, outputs.get(d),
              (c * exitPlanes.length + k) * itemSizes[d], itemSizes[d]);
        }
      }
    }
    logger.info(format(" Multislice of %d wave function(s) through %d configuration(s) of %d"
            + " slices in %s.", nPlanes, numConfigurations, potential.getNumSlices(),
        stopWatch));

    List<ArrayData> arrays = new ArrayList<>(detectors.size());
    for (int d = 0; d < detectors.size(); d++) {
      OutputSpecification spec = specs.get(d);
      int[] outShape = ArrayUtils.addAll(potential.getEnsembleShape(), exitPlanes.length);
      outShape = ArrayUtils.addAll(outShape, ensembleShape);
      outShape = ArrayUtils.addAll(outShape, spec.getBaseShape());
      DataType dtype = spec.getDataType();
      arrays.add(ArrayData.wrap(dtype, outputs.get(d), outShape));
    }
    return arrays;
  }
}
