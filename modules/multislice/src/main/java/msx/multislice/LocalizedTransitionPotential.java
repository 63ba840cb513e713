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
import static msx.numerics.math.ScalarMath.mod;
import static org.apache.commons.math3.util.FastMath.exp;

import java.util.ArrayList;
import java.util.List;
import msx.array.ArrayData;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.potential.Atoms;
import msx.waves.Energy;
import msx.waves.Grid;
import msx.waves.Waves;
import org.apache.commons.lang3.ArrayUtils;

/**
 * A transition potential localized around each site as a periodic Gaussian. Transition t of the
 * site at r0 scatters psi into i sigma A_t exp(-|r - r0|^2 / (2 w^2)) psi.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LocalizedTransitionPotential implements TransitionPotential {

  private final int atomicNumber;
  private final double[] strengths;
  private final double width;

  /**
   * Constructor for LocalizedTransitionPotential.
   *
   * @param atomicNumber the element of the sites (0 for every element).
   * @param strengths    the strength A of every transition [V Angstrom].
   * @param width        the width w of the Gaussian [Angstrom].
   */
  public LocalizedTransitionPotential(int atomicNumber, double[] strengths, double width) {
    if (strengths.length == 0) {
      throw new IllegalArgumentException(" At least one transition is required.");
    }
    if (!(width > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid transition width %8.3f.", width));
    }
    this.atomicNumber = atomicNumber;
    this.strengths = strengths.clone();
    this.width = width;
  }

  @Override
  public int getNumTransitions() {
    return strengths.length;
  }

  @Override
  public Atoms validateSites(Atoms sites) {
    if (atomicNumber <= 0) {
      return sites;
    }
    return sites.select(i -> sites.getNumber(i) == atomicNumber);
  }

  @Override
  public Waves generateScatteredWaves(Waves waves, Atoms sites) {
    Grid grid = waves.getGrid();
    int[] gpts = grid.getGpts();
    double[] sampling = grid.getSampling();
    double sigma = Energy.interactionParameter(waves.getEnergy());
    double[] psi = waves.getArray().getData();
    int planeSize = 2 * gpts[0] * gpts[1];
    int nPlanes = psi.length / planeSize;
    int nScattered = sites.size() * strengths.length;
    double[] out = new double[nScattered * psi.length];

    double[] dx2 = new double[gpts[0]];
    double[] dy2 = new double[gpts[1]];
    for (int s = 0; s < sites.size(); s++) {
      double[] site = sites.getPosition(s);
      periodicSquaredDistances(site[0], sampling[0], gpts[0], dx2);
      periodicSquaredDistances(site[1], sampling[1], gpts[1], dy2);
      for (int t = 0; t < strengths.length; t++) {
        double scale = sigma * strengths[t];
        int offset = (s * strengths.length + t) * psi.length;
        for (int p = 0; p < nPlanes; p++) {
          for (int x = 0; x < gpts[0]; x++) {
            for (int y = 0; y < gpts[1]; y++) {
              double g = scale * exp(-(dx2[x] + dy2[y]) / (2.0 * width * width));
              int index = p * planeSize + 2 * (x * gpts[1] + y);
              // Multiplication by i g.
              out[offset + index] = -g * psi[index + 1];
              out[offset + index + 1] = g * psi[index];
            }
          }
        }
      }
    }

    List<AxisMetadata> axes = new ArrayList<>();
    axes.add(OrdinalAxis.indexed(TRANSITIONS_LABEL, nScattered, false, false));
    axes.addAll(waves.getEnsembleAxesMetadata());
    int[] shape = ArrayUtils.addAll(new int[] {nScattered}, waves.getShape());
    return new Waves(BackingArray.of(ArrayData.wrap(DataType.COMPLEX128, out, shape)), axes,
        waves.getMetadata(), waves.getDevice());
  }

  private static void periodicSquaredDistances(double center, double sampling, int n,
      double[] distances) {
    double extent = n * sampling;
    for (int i = 0; i < n; i++) {
      double d = mod(i * sampling - center + extent / 2.0, extent) - extent / 2.0;
      distances[i] = d * d;
    }
  }

  @Override
  public String toString() {
    return format("LocalizedTransitionPotential(Z=%d, transitions=%d, width=%.3f)", atomicNumber,
        strengths.length, width);
  }
}
