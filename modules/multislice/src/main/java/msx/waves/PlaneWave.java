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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.BackingArray;
import msx.array.ComputableList;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.ensemble.ArrayObjectFactory;
import msx.array.ensemble.ArrayObjectTransform;
import msx.array.ensemble.CompositeTransform;
import msx.array.ensemble.EnsembleBuilder;
import msx.array.ensemble.OutputSpecification;
import msx.detectors.Detector;
import msx.multislice.MultisliceTransform;
import msx.potential.Potential;

/**
 * A plane wave in real space. Without normalization every value is one; normalized waves have a
 * unit total intensity in reciprocal space.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PlaneWave implements ArrayObjectFactory {

  private final Grid grid;
  private final double energy;
  private final boolean normalize;
  private final double tiltX;
  private final double tiltY;
  private final BeamTilt tiltSeries;

  /**
   * An untilted, unnormalized plane wave.
   *
   * @param grid   the grid.
   * @param energy the electron energy [eV].
   */
  public PlaneWave(Grid grid, double energy) {
    this(grid, energy, false, 0.0, 0.0, null);
  }

  /**
   * Constructor for PlaneWave.
   *
   * @param grid       the grid.
   * @param energy     the electron energy [eV].
   * @param normalize  true for unit intensity in reciprocal space.
   * @param tiltX      the base tilt along x [mrad].
   * @param tiltY      the base tilt along y [mrad].
   * @param tiltSeries additional tilts as an ensemble (may be null).
   */
  public PlaneWave(Grid grid, double energy, boolean normalize, double tiltX, double tiltY,
      @Nullable BeamTilt tiltSeries) {
    Energy.checkDefined(energy);
    this.grid = grid;
    this.energy = energy;
    this.normalize = normalize;
    this.tiltX = tiltX;
    this.tiltY = tiltY;
    this.tiltSeries = tiltSeries;
  }

  public Grid getGrid() {
    return grid;
  }

  public double getEnergy() {
    return energy;
  }

  @Override
  public OutputSpecification describe() {
    Map<String, Object> metadata = Waves.metadata(grid, energy, false);
    metadata.put(Waves.NORMALIZATION, normalize ? "reciprocal_space" : "values");
    metadata.put(Waves.TILT_X, tiltX);
    metadata.put(Waves.TILT_Y, tiltY);
    return new OutputSpecification(Waves.TYPE, grid.getGpts(),
        Waves.baseAxes(grid.getSampling()), DataType.COMPLEX128, metadata);
  }

  @Override
  public ArrayData buildArray() {
    double value = normalize ? 1.0 / grid.size() : 1.0;
    return ArrayData.full(DataType.COMPLEX128, value, 0.0, grid.getGpts());
  }

  /**
   * Build the wave functions.
   *
   * @param settings the compute settings.
   * @return the waves, lazy if the settings ask for it.
   */
  public Waves build(ComputeSettings settings) {
    if (tiltSeries == null) {
      ArrayObject waves = describe().pack(BackingArray.of(buildArray()),
          Collections.emptyList(), 0, Collections.emptyList(),
          settings.getDevice());
      return (Waves) (settings.isLazy() ? waves.ensureLazy(settings) : waves);
    }
    return (Waves) EnsembleBuilder.build(tiltSeries, this, settings).get(0);
  }

  /**
   * Propagate the plane wave through a potential and detect it.
   *
   * @param potential the potential.
   * @param detectors the detectors (empty for the exit waves).
   * @param settings  the compute settings.
   * @return one measurement per detector.
   */
  public ComputableList<ArrayObject> multislice(Potential potential, List<Detector> detectors,
      ComputeSettings settings) {
    ArrayObjectTransform transform = new MultisliceTransform(potential, detectors);
    if (tiltSeries != null) {
      transform = new CompositeTransform(transform, tiltSeries);
    }
    return EnsembleBuilder.build(transform, this, settings);
  }
}
