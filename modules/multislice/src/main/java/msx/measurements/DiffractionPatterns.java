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
package msx.measurements;

import static msx.utilities.Constants.RAD_TO_MRAD;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.ArrayData;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.axes.ReciprocalSpaceAxis;
import msx.waves.Energy;

/**
 * An ensemble of diffraction patterns. With fftshift the zero scattering angle is at index n / 2
 * of each axis, otherwise it is at index 0.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DiffractionPatterns extends BaseMeasurement {

  /** Metadata key of the reciprocal sampling along x [1/Angstrom]. */
  public static final String SAMPLING_X = "sampling_x";
  /** Metadata key of the reciprocal sampling along y [1/Angstrom]. */
  public static final String SAMPLING_Y = "sampling_y";
  public static final String FFTSHIFT = "fftshift";
  public static final String ENERGY = "energy";
  public static final String SEMIANGLE_CUTOFF = "semiangle_cutoff";

  /**
   * Constructor for DiffractionPatterns.
   *
   * @param array        storage whose last two axes are kx and ky.
   * @param ensembleAxes metadata of the ensemble axes (null for unknown axes).
   * @param metadata     metadata with the reciprocal sampling.
   * @param device       the device of the storage.
   */
  public DiffractionPatterns(BackingArray array, List<AxisMetadata> ensembleAxes,
      Map<String, Object> metadata, Device device) {
    super(array, 2, ensembleAxes, metadata, device);
    if (!(metadata.get(SAMPLING_X) instanceof Number)
        || !(metadata.get(SAMPLING_Y) instanceof Number)) {
      throw new IllegalArgumentException(" Diffraction patterns require a sampling.");
    }
  }

  /**
   * Metadata of diffraction patterns.
   *
   * @param sampling the reciprocal sampling along x and y [1/Angstrom].
   * @param fftshift true if the zero angle is centered.
   * @param energy   the electron energy [eV].
   * @param label    the measured quantity.
   * @param units    the units of the measured quantity.
   * @return a new mutable map.
   */
  public static Map<String, Object> metadata(double[] sampling, boolean fftshift, double energy,
      String label, String units) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(SAMPLING_X, sampling[0]);
    metadata.put(SAMPLING_Y, sampling[1]);
    metadata.put(FFTSHIFT, fftshift);
    metadata.put(ENERGY, energy);
    metadata.put(LABEL, label);
    metadata.put(UNITS, units);
    return metadata;
  }

  @Override
  public ArrayObjectType getType() {
    return MeasurementType.DIFFRACTION_PATTERNS;
  }

  @Override
  public List<AxisMetadata> getBaseAxesMetadata() {
    return baseAxes(getBaseShape(), getSampling(), isFftshift());
  }

  /**
   * Metadata of the base axes of diffraction patterns.
   *
   * @param shape    the base shape.
   * @param sampling the reciprocal sampling along x and y [1/Angstrom].
   * @param fftshift true if the zero angle is centered.
   * @return the kx and ky axes.
   */
  public static List<AxisMetadata> baseAxes(int[] shape, double[] sampling, boolean fftshift) {
    List<AxisMetadata> axes = new ArrayList<>(2);
    axes.add(new ReciprocalSpaceAxis("kx", sampling[0], "1/Å",
        fftshift ? -(shape[0] / 2) * sampling[0] : 0.0, fftshift));
    axes.add(new ReciprocalSpaceAxis("ky", sampling[1], "1/Å",
        fftshift ? -(shape[1] / 2) * sampling[1] : 0.0, fftshift));
    return axes;
  }

  public double[] getSampling() {
    Map<String, Object> metadata = getMetadata();
    return new double[] {((Number) metadata.get(SAMPLING_X)).doubleValue(),
        ((Number) metadata.get(SAMPLING_Y)).doubleValue()};
  }

  public boolean isFftshift() {
    return Boolean.TRUE.equals(getMetadata().get(FFTSHIFT));
  }

  /**
   * The electron energy.
   *
   * @return the energy [eV].
   * @throws IllegalStateException if the energy is not defined.
   */
  public double getEnergy() {
    Object energy = getMetadata().get(ENERGY);
    if (!(energy instanceof Number)) {
      throw new IllegalStateException(" The energy of the diffraction patterns is not defined.");
    }
    return ((Number) energy).doubleValue();
  }

  /**
   * The sampling in scattering angles.
   *
   * @return the angular sampling along x and y [mrad].
   */
  public double[] getAngularSampling() {
    double lambda = Energy.wavelength(getEnergy());
    double[] sampling = getSampling();
    return new double[] {sampling[0] * lambda * RAD_TO_MRAD, sampling[1] * lambda * RAD_TO_MRAD};
  }

  /**
   * The signed frequency index of a pixel along one axis.
   *
   * @param i the pixel.
   * @param n the number of pixels.
   * @return the frequency index.
   */
  private int frequencyIndex(int i, int n) {
    if (isFftshift()) {
      return i - n / 2;
    }
    return i < (n + 1) / 2 ? i : i - n;
  }

  /**
   * The scattering angle of every pixel.
   *
   * @return an array of shape [nX, nY] [mrad].
   */
  public double[][] getScatteringAngles() {
    int[] shape = getBaseShape();
    double[] angular = getAngularSampling();
    double[][] angles = new double[shape[0]][shape[1]];
    for (int i = 0; i < shape[0]; i++) {
      double ax = frequencyIndex(i, shape[0]) * angular[0];
      for (int j = 0; j < shape[1]; j++) {
        double ay = frequencyIndex(j, shape[1]) * angular[1];
        angles[i][j] = sqrt(ax * ax + ay * ay);
      }
    }
    return angles;
  }

  /**
   * Block the direct beam out to the semiangle cutoff of the probe.
   *
   * @return the blocked patterns.
   * @throws IllegalStateException if no semiangle cutoff was recorded.
   */
  public DiffractionPatterns blockDirect() {
    Object semiangle = getMetadata().get(SEMIANGLE_CUTOFF);
    if (!(semiangle instanceof Number)) {
      throw new IllegalStateException(" The semiangle cutoff of the diffraction patterns is"
          + " not defined.");
    }
    return blockDirect(((Number) semiangle).doubleValue());
  }

  /**
   * Set every pixel with a scattering angle below a radius to zero.
   *
   * @param radius the radius of the blocked disk [mrad].
   * @return the blocked patterns.
   */
  public DiffractionPatterns blockDirect(double radius) {
    double[][] angles = getScatteringAngles();
    int[] shape = getBaseShape();
    int width = getDataType().getWidth();
    BackingArray array = mapBase(shape, getDataType(), block -> {
      ArrayData copy = block.copy();
      double[] data = copy.getData();
      int planeSize = shape[0] * shape[1];
      int nPlanes = data.length / (planeSize * width);
      for (int p = 0; p < nPlanes; p++) {
        for (int i = 0; i < shape[0]; i++) {
          for (int j = 0; j < shape[1]; j++) {
            if (angles[i][j] < radius) {
              int index = (p * planeSize + i * shape[1] + j) * width;
              for (int w = 0; w < width; w++) {
                data[index + w] = 0.0;
              }
            }
          }
        }
      }
      return copy;
    });
    return new DiffractionPatterns(array, getEnsembleAxesMetadata(), getMetadata(), getDevice());
  }

  /**
   * The real part of the value at the zero scattering angle of every pattern.
   *
   * @return the eager array of the ensemble shape.
   */
  public ArrayData getDirectBeam() {
    int[] shape = getBaseShape();
    int ix = isFftshift() ? shape[0] / 2 : 0;
    int iy = isFftshift() ? shape[1] / 2 : 0;
    ArrayData array = getArray();
    int nPlanes = array.getSize() / (shape[0] * shape[1]);
    double[] values = new double[nPlanes];
    for (int p = 0; p < nPlanes; p++) {
      values[p] = array.getReal(p * shape[0] * shape[1] + ix * shape[1] + iy);
    }
    return ArrayData.wrap(DataType.FLOAT64, values, getEnsembleShape());
  }
}
