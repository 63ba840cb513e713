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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.ArrayData;
import msx.array.DataType;
import msx.potential.TransmissionFunction;
import msx.waves.Energy;
import msx.waves.Grid;

/**
 * Propagates a stack of real space wave functions through the slices of a potential. The state is
 * the index of the next slice; each step transmits the waves through that slice and propagates
 * them by its thickness. Steps are strictly sequential.
 *
 * <p>The machine owns its waves: the constructor takes over the buffer of its argument, which is
 * invalidated, and every step updates that buffer. {@link #getWaves()} hands out copies and
 * {@link #releaseWaves()} gives the buffer back, after which no further step is possible.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Multislice {

  private static final Logger logger = Logger.getLogger(Multislice.class.getName());

  private final TransmissionFunction transmissionFunction;
  private final int nPlanes;
  private final int planeSize;
  private final FresnelPropagator[] propagators;
  private final boolean uniformTilt;
  private ArrayData waves;
  private int slice;

  /**
   * Constructor for Multislice.
   *
   * @param waves                complex planes in real space, with the grid as trailing axes.
   *                             Ownership of the buffer passes to the new instance.
   * @param grid                 the grid of the waves.
   * @param energy               the energy of the waves [eV].
   * @param tilts                the beam tilt (x, y) of every plane [mrad].
   * @param transmissionFunction the transmission function of the potential.
   * @param start                the first slice.
   * @throws IllegalArgumentException if the grid or energy of the waves and potential differ.
   */
  public Multislice(ArrayData waves, Grid grid, double energy, double[][] tilts,
      TransmissionFunction transmissionFunction, int start) {
    grid.checkMatch(transmissionFunction.getGrid());
    Energy.checkMatch(energy, transmissionFunction.getEnergy());
    if (waves.getDataType() != DataType.COMPLEX128 || waves.getSize() % grid.size() != 0) {
      throw new IllegalArgumentException(format(" Waves of shape %s do not match grid %s.",
          Arrays.toString(waves.getShape()), Arrays.toString(grid.getGpts())));
    }
    int nPlanes = waves.getSize() / grid.size();
    if (start < 0 || start > transmissionFunction.getNumSlices()) {
      throw new IllegalArgumentException(format(" Slice %d is outside the %d slices of the"
          + " potential.", start, transmissionFunction.getNumSlices()));
    }
    if (tilts.length != nPlanes) {
      throw new IllegalArgumentException(
          format(" Found %d tilts for %d planes.", tilts.length, nPlanes));
    }
    this.waves = waves.transferOwnership();
    this.transmissionFunction = transmissionFunction;
    this.nPlanes = nPlanes;
    this.planeSize = 2 * grid.size();
    this.slice = start;

    Map<String, FresnelPropagator> unique = new HashMap<>();
    propagators = new FresnelPropagator[nPlanes];
    for (int p = 0; p < nPlanes; p++) {
      double[] tilt = tilts[p];
      propagators[p] = unique.computeIfAbsent(Arrays.toString(tilt),
          key -> new FresnelPropagator(grid, energy, tilt[0], tilt[1]));
    }
    uniformTilt = unique.size() <= 1;
  }

  public int getSlice() {
    return slice;
  }

  public int getNumSlices() {
    return transmissionFunction.getNumSlices();
  }

  public boolean isFinished() {
    return slice == transmissionFunction.getNumSlices();
  }

  /**
   * A copy of the current waves.
   *
   * @return the waves after the slices propagated so far.
   * @throws IllegalStateException if the waves have been released.
   */
  public ArrayData getWaves() {
    return waves.copy();
  }

  /**
   * Give up the waves without copying them. The machine cannot step afterwards.
   *
   * @return a handle that owns the current waves.
   * @throws IllegalStateException if the waves have already been released.
   */
  public ArrayData releaseWaves() {
    return waves.transferOwnership();
  }

  /**
   * Transmit the waves through the next slice and propagate them by its thickness.
   *
   * @throws IllegalStateException if all slices have been propagated or the waves were released.
   */
  public void step() {
    if (isFinished()) {
      throw new IllegalStateException(
          format(" All %d slices have been propagated.", getNumSlices()));
    }
    if (!waves.isValid()) {
      throw new IllegalStateException(" The waves of this multislice have been released.");
    }
    double thickness = transmissionFunction.getSliceThickness(slice);
    waves = transmissionFunction.transmit(waves, slice);
    if (uniformTilt) {
      if (nPlanes > 0) {
        waves = propagators[0].propagate(waves, thickness);
      }
    } else {
      double[] data = waves.getData();
      double[] plane = new double[planeSize];
      for (int p = 0; p < nPlanes; p++) {
        System.arraycopy(data, p * planeSize, plane, 0, planeSize);
        propagators[p].propagate(plane, 1, thickness);
        System.arraycopy(plane, 0, data, p * planeSize, planeSize);
      }
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Propagated %d plane(s) through slice %d.", nPlanes, slice));
    }
    slice++;
  }

  /**
   * Step until a slice is reached.
   *
   * @param stop the slice to stop before (at most the number of slices).
   */
  public void runTo(int stop) {
    if (stop < slice || stop > getNumSlices()) {
      throw new IllegalArgumentException(format(" Cannot run from slice %d to slice %d of %d.",
          slice, stop, getNumSlices()));
    }
    while (slice < stop) {
      step();
    }
  }

  /**
   * Step through all remaining slices.
   */
  public void run() {
    runTo(getNumSlices());
  }
}
