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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.axes.AxisMetadata;
import msx.array.ensemble.ArrayObjectTransform;
import msx.array.ensemble.OutputSpecification;
import msx.array.ensemble.PartitionedArgs;
import msx.detectors.Detector;
import msx.detectors.WavesDetector;
import msx.potential.Potential;
import msx.waves.Energy;
import msx.waves.Waves;

/**
 * Base class of transforms that propagate wave functions through a potential and detect them.
 * The ensemble of the transform is the ensemble of the potential (frozen phonon configurations),
 * and there is one output per detector.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class AbstractMultisliceTransform implements ArrayObjectTransform {

  protected final Potential potential;
  protected final List<Detector> detectors;

  /**
   * Constructor for AbstractMultisliceTransform.
   *
   * @param potential the potential.
   * @param detectors the detectors; the exit waves are returned if empty or null.
   */
  protected AbstractMultisliceTransform(Potential potential,
      @Nullable List<Detector> detectors) {
    this.potential = potential;
    if (detectors == null || detectors.isEmpty()) {
      this.detectors = Collections.singletonList(new WavesDetector());
    } else {
      this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }
  }

  public Potential getPotential() {
    return potential;
  }

  public List<Detector> getDetectors() {
    return detectors;
  }

  @Override
  public List<AxisMetadata> getEnsembleAxesMetadata() {
    return potential.getEnsembleAxesMetadata();
  }

  @Override
  public int[] getEnsembleShape() {
    return potential.getEnsembleShape();
  }

  @Override
  public PartitionedArgs partitionArgs(int[][] chunks) {
    return potential.partitionArgs(chunks);
  }

  @Override
  public int getNumOutputs() {
    return detectors.size();
  }

  /**
   * Check that an input holds wave functions that match the potential.
   *
   * @param input the input object or template.
   * @return the input as Waves.
   * @throws IllegalArgumentException if the input is not Waves or its grid or energy differ.
   */
  protected Waves checkWaves(ArrayObject input) {
    if (!(input instanceof Waves)) {
      throw new IllegalArgumentException(
          format(" Multislice requires wave functions, found %s.", input.getType()));
    }
    Waves waves = (Waves) input;
    waves.getGrid().checkMatch(potential.getGrid());
    Energy.checkDefined(waves.getEnergy());
    return waves;
  }

  /**
   * Describe the measurement of one detector.
   *
   * @param waves    the input waves (or their template).
   * @param detector the detector.
   * @return the specification without extra axes.
   */
  protected OutputSpecification detectorSpecification(Waves waves, Detector detector) {
    return detector.getOutputSpecification(realSpaceTemplate(waves));
  }

  private static Waves realSpaceTemplate(Waves waves) {
    if (!waves.isReciprocalSpace()) {
      return waves;
    }
    Map<String, Object> metadata = new LinkedHashMap<>(waves.getMetadata());
    metadata.put(Waves.RECIPROCAL_SPACE, false);
    return new Waves(waves.getBackingArray(), waves.getEnsembleAxesMetadata(), metadata,
        waves.getDevice());
  }

  /**
   * Wrap an array as eager real space waves with the axes and metadata of the input.
   *
   * @param input the input waves.
   * @param data  the array, owned by the caller and not copied.
   * @param axes  the ensemble axes metadata of the array.
   * @return the Waves.
   */
  protected static Waves wrapWaves(Waves input, ArrayData data, List<AxisMetadata> axes) {
    Map<String, Object> metadata = new LinkedHashMap<>(input.getMetadata());
    metadata.put(Waves.RECIPROCAL_SPACE, false);
    return new Waves(BackingArray.of(data), axes, metadata, input.getDevice());
  }

  /**
   * A copy of the real space array of the input, to be handed to a {@link Multislice}.
   *
   * @param waves the input waves.
   * @return a new array owned by the caller.
   */
  protected static ArrayData initialWaves(Waves waves) {
    return waves.ensureRealSpace().getArray().copy();
  }

  @Override
  public String toString() {
    return format("%s(%s, %s)", getClass().getSimpleName(), potential, detectors);
  }
}
