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
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import msx.array.ArrayData;
import msx.waves.AntialiasAperture;
import msx.waves.Energy;
import msx.waves.Grid;

/**
 * The transmission functions exp(i sigma V) of the slices of a potential, band-limited by the
 * antialiasing aperture.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TransmissionFunction {

  private final Grid grid;
  private final double energy;
  private final double[] sliceThickness;
  private final double[] data;

  /**
   * Constructor for TransmissionFunction.
   *
   * @param potential the projected potential.
   * @param energy    the electron energy [eV].
   */
  public TransmissionFunction(PotentialArray potential, double energy) {
    this.grid = potential.getGrid();
    this.energy = energy;
    this.sliceThickness = potential.getSliceThickness();
    double sigma = Energy.interactionParameter(energy);
    double[] v = potential.getArray().getData();
    data = new double[2 * v.length];
    for (int i = 0; i < v.length; i++) {
      double phase = sigma * v[i];
      data[2 * i] = cos(phase);
      data[2 * i + 1] = sin(phase);
    }
    AntialiasAperture.bandlimit(data, sliceThickness.length, grid);
  }

  public Grid getGrid() {
    return grid;
  }

  public double getEnergy() {
    return energy;
  }

  public int getNumSlices() {
    return sliceThickness.length;
  }

  public double getSliceThickness(int slice) {
    return sliceThickness[slice];
  }

  /**
   * Multiply a stack of real space wave functions by the transmission function of one slice. The
   * buffer of the argument is reused for the result and the argument handle is invalidated.
   *
   * @param waves complex planes on the grid of this function.
   * @param slice the slice.
   * @return a handle that owns the transmitted waves.
   */
  public ArrayData transmit(ArrayData waves, int slice) {
    ArrayData owned = waves.transferOwnership();
    transmit(owned.getData(), owned.getSize() / grid.size(), slice);
    return owned;
  }

  /**
   * Multiply a stack of real space wave functions by the transmission function of one slice.
   *
   * @param waves   interleaved complex planes on the grid of this function; updated in place.
   * @param nPlanes the number of planes.
   * @param slice   the slice.
   */
  public void transmit(double[] waves, int nPlanes, int slice) {
    if (slice < 0 || slice >= sliceThickness.length) {
      throw new IllegalArgumentException(
          format(" Slice %d is outside the %d slices of the potential.", slice,
              sliceThickness.length));
    }
    int planeSize = 2 * grid.size();
    int offset = slice * planeSize;
    for (int p = 0; p < nPlanes; p++) {
      int waveOffset = p * planeSize;
      for (int i = 0; i < planeSize; i += 2) {
        double tr = data[offset + i];
        double ti = data[offset + i + 1];
        double wr = waves[waveOffset + i];
        double wi = waves[waveOffset + i + 1];
        waves[waveOffset + i] = tr * wr - ti * wi;
        waves[waveOffset + i + 1] = tr * wi + ti * wr;
      }
    }
  }
}
