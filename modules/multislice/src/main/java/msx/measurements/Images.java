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

import static java.lang.String.format;
import static msx.numerics.math.ScalarMath.mod;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import msx.array.ArrayData;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.axes.RealSpaceAxis;
import org.apache.commons.lang3.ArrayUtils;

/**
 * An ensemble of real space images, either intensities or complex wave functions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Images extends BaseMeasurement {

  /** Metadata key of the sampling along x [Angstrom]. */
  public static final String SAMPLING_X = "sampling_x";
  /** Metadata key of the sampling along y [Angstrom]. */
  public static final String SAMPLING_Y = "sampling_y";

  /**
   * Constructor for Images.
   *
   * @param array        storage whose last two axes are x and y.
   * @param ensembleAxes metadata of the ensemble axes (null for unknown axes).
   * @param metadata     metadata with the sampling.
   * @param device       the device of the storage.
   */
  public Images(BackingArray array, List<AxisMetadata> ensembleAxes, Map<String, Object> metadata,
      Device device) {
    super(array, 2, ensembleAxes, metadata, device);
    if (!(metadata.get(SAMPLING_X) instanceof Number)
        || !(metadata.get(SAMPLING_Y) instanceof Number)) {
      throw new IllegalArgumentException(" Images require a sampling.");
    }
  }

  /**
   * Metadata of images.
   *
   * @param sampling the sampling along x and y [Angstrom].
   * @param label    the measured quantity.
   * @param units    the units of the measured quantity.
   * @return a new mutable map.
   */
  public static Map<String, Object> metadata(double[] sampling, String label, String units) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(SAMPLING_X, sampling[0]);
    metadata.put(SAMPLING_Y, sampling[1]);
    metadata.put(LABEL, label);
    metadata.put(UNITS, units);
    return metadata;
  }

  @Override
  public ArrayObjectType getType() {
    return MeasurementType.IMAGES;
  }

  @Override
  public List<AxisMetadata> getBaseAxesMetadata() {
    double[] sampling = getSampling();
    List<AxisMetadata> axes = new ArrayList<>(2);
    axes.add(new RealSpaceAxis("x", sampling[0]));
    axes.add(new RealSpaceAxis("y", sampling[1]));
    return axes;
  }

  public double[] getSampling() {
    Map<String, Object> metadata = getMetadata();
    return new double[] {((Number) metadata.get(SAMPLING_X)).doubleValue(),
        ((Number) metadata.get(SAMPLING_Y)).doubleValue()};
  }

  /**
   * The extent of the images.
   *
   * @return the extent along x and y [Angstrom].
   */
  public double[] getExtent() {
    double[] sampling = getSampling();
    int[] shape = getBaseShape();
    return new double[] {shape[0] * sampling[0], shape[1] * sampling[1]};
  }

  public boolean isComplex() {
    return getDataType().isComplex();
  }

  /**
   * The squared modulus of complex images.
   *
   * @return intensity images.
   */
  public Images abs2() {
    if (!isComplex()) {
      return this;
    }
    return new Images(mapBase(getBaseShape(), DataType.FLOAT64, ArrayData::abs2),
        getEnsembleAxesMetadata(), getMetadata(), getDevice());
  }

  /**
   * Interpolate the images along a line. The images are periodic and interpolated bilinearly;
   * pixel (i, j) is located at (i * sampling x, j * sampling y).
   *
   * @param start    the start of the line [Angstrom].
   * @param end      the end of the line [Angstrom].
   * @param sampling the maximum distance between points along the line [Angstrom].
   * @return the line profiles.
   */
  public RealSpaceLineProfiles interpolateLine(double[] start, double[] end, double sampling) {
    if (sampling <= 0.0) {
      throw new IllegalArgumentException(format(" Invalid line sampling %8.3f.", sampling));
    }
    double dx = end[0] - start[0];
    double dy = end[1] - start[1];
    double length = sqrt(dx * dx + dy * dy);
    int n = (int) max(ceil(length / sampling), 1);
    double step = length > 0.0 ? length / n : sampling;
    double[] pixel = getSampling();
    int[] shape = getBaseShape();
    int width = getDataType().getWidth();
    double[][] points = new double[n][2];
    for (int i = 0; i < n; i++) {
      points[i][0] = (start[0] + dx * i / n) / pixel[0];
      points[i][1] = (start[1] + dy * i / n) / pixel[1];
    }

    BackingArray array = mapBase(new int[] {n}, getDataType(), block -> {
      int[] blockShape = block.getShape();
      int nImages = (int) ArrayData.product(
          Arrays.copyOfRange(blockShape, 0, blockShape.length - 2));
      double[] in = block.getData();
      double[] out = new double[nImages * n * width];
      int imageSize = shape[0] * shape[1] * width;
      for (int image = 0; image < nImages; image++) {
        for (int i = 0; i < n; i++) {
          double x = points[i][0];
          double y = points[i][1];
          int x0 = (int) floor(x);
          int y0 = (int) floor(y);
          double fx = x - x0;
          double fy = y - y0;
          int r0 = mod(x0, shape[0]);
          int r1 = mod(x0 + 1, shape[0]);
          int c0 = mod(y0, shape[1]);
          int c1 = mod(y0 + 1, shape[1]);
          for (int w = 0; w < width; w++) {
            int offset = image * imageSize + w;
            double v00 = in[offset + (r0 * shape[1] + c0) * width];
            double v10 = in[offset + (r1 * shape[1] + c0) * width];
            double v01 = in[offset + (r0 * shape[1] + c1) * width];
            double v11 = in[offset + (r1 * shape[1] + c1) * width];
            out[(image * n + i) * width + w] = (1 - fx) * (1 - fy) * v00 + fx * (1 - fy) * v10
                + (1 - fx) * fy * v01 + fx * fy * v11;
          }
        }
      }
      return ArrayData.wrap(block.getDataType(), out,
          ArrayUtils.add(Arrays.copyOfRange(blockShape, 0, blockShape.length - 2), n));
    });

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(RealSpaceLineProfiles.SAMPLING, step);
    metadata.put(RealSpaceLineProfiles.START_X, start[0]);
    metadata.put(RealSpaceLineProfiles.START_Y, start[1]);
    metadata.put(RealSpaceLineProfiles.END_X, end[0]);
    metadata.put(RealSpaceLineProfiles.END_Y, end[1]);
    metadata.put(LABEL, getLabel());
    metadata.put(UNITS, getUnits());
    return new RealSpaceLineProfiles(array, getEnsembleAxesMetadata(), metadata, getDevice());
  }
}
