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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.DataType;
import msx.array.ensemble.ArrayObjectTransform;
import msx.array.ensemble.OutputSpecification;
import msx.numerics.fft.FourierSpace;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Base class of probe scans. A scan translates wave functions given in reciprocal space to every
 * scan position and returns them in real space.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class BaseScan implements ArrayObjectTransform {

  /**
   * The scan positions in row-major order of the ensemble shape.
   *
   * @return one (x, y) pair per position [Angstrom].
   */
  public abstract double[][] getPositions();

  @Override
  public OutputSpecification getOutputSpecification(ArrayObject template, int output) {
    if (!(template instanceof Waves)) {
      throw new IllegalArgumentException(
          format(" Scans require wave functions, found %s.", template.getType()));
    }
    Map<String, Object> metadata = new LinkedHashMap<>(template.getMetadata());
    metadata.put(Waves.RECIPROCAL_SPACE, false);
    return new OutputSpecification(Waves.TYPE, template.getBaseShape(),
        template.getBaseAxesMetadata(), DataType.COMPLEX128, metadata);
  }

  @Override
  public List<ArrayData> calculateNewArrays(ArrayObject input) {
    Waves waves = ((Waves) input).ensureReciprocalSpace();
    Grid grid = waves.getGrid();
    int[] gpts = grid.getGpts();
    double[] kx = grid.getFrequenciesX();
    double[] ky = grid.getFrequenciesY();
    double[] source = waves.getArray().getData();
    int planeSize = 2 * gpts[0] * gpts[1];
    int nPlanes = source.length / planeSize;
    double[][] positions = getPositions();

    double[] data = new double[positions.length * source.length];
    double[] rampX = new double[2 * gpts[0]];
    double[] rampY = new double[2 * gpts[1]];
    for (int p = 0; p < positions.length; p++) {
      phaseRamp(kx, positions[p][0], rampX);
      phaseRamp(ky, positions[p][1], rampY);
      int offset = p * source.length;
      for (int plane = 0; plane < nPlanes; plane++) {
        for (int i = 0; i < gpts[0]; i++) {
          for (int j = 0; j < gpts[1]; j++) {
            double re = rampX[2 * i] * rampY[2 * j] - rampX[2 * i + 1] * rampY[2 * j + 1];
            double im = rampX[2 * i] * rampY[2 * j + 1] + rampX[2 * i + 1] * rampY[2 * j];
            int index = plane * planeSize + 2 * (i * gpts[1] + j);
            double wr = source[index];
            double wi = source[index + 1];
            data[offset + index] = wr * re - wi * im;
            data[offset + index + 1] = wr * im + wi * re;
          }
        }
      }
    }
    FourierSpace.ifft2(data, positions.length * nPlanes, gpts[0], gpts[1]);
    int[] shape = ArrayUtils.addAll(getEnsembleShape(), waves.getShape());
    return Collections.singletonList(ArrayData.wrap(DataType.COMPLEX128, data, shape));
  }

  /**
   * The factors exp(-2 pi i k r) along one axis.
   */
  private static void phaseRamp(double[] k, double r, double[] ramp) {
    for (int i = 0; i < k.length; i++) {
      double phase = -2.0 * PI * k[i] * r;
      ramp[2 * i] = cos(phase);
      ramp[2 * i + 1] = sin(phase);
    }
  }
}
