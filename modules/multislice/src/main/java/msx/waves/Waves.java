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
import static msx.numerics.math.ScalarMath.ensureParity;
import static msx.utilities.Constants.RAD_TO_MRAD;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.ComputableList;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.axes.OrdinalAxis;
import msx.array.axes.RealSpaceAxis;
import msx.detectors.Detector;
import msx.measurements.DiffractionPatterns;
import msx.measurements.Images;
import msx.measurements.MeasurementType;
import msx.multislice.MultisliceTransform;
import msx.numerics.fft.FourierSpace;
import msx.potential.Potential;
import org.apache.commons.lang3.ArrayUtils;

/**
 * An ensemble of complex 2D electron wave functions on a periodic grid.
 *
 * <p>The metadata records the electron energy, the real space sampling, whether the array holds
 * the wave functions in real or reciprocal space, and how the waves were normalized.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Waves extends ArrayObject {

  /** Metadata key of the electron energy [eV]. */
  public static final String ENERGY = "energy";
  /** Metadata key of the flag that marks reciprocal space arrays. */
  public static final String RECIPROCAL_SPACE = "reciprocal_space";
  /** Metadata key of the sampling along x [Angstrom]. */
  public static final String SAMPLING_X = "sampling_x";
  /** Metadata key of the sampling along y [Angstrom]. */
  public static final String SAMPLING_Y = "sampling_y";
  /** Metadata key of the normalization: "values" or "reciprocal_space". */
  public static final String NORMALIZATION = "normalization";
  /** Metadata key of the base beam tilt along x [mrad]. */
  public static final String TILT_X = "tilt_x";
  /** Metadata key of the base beam tilt along y [mrad]. */
  public static final String TILT_Y = "tilt_y";
  /** Metadata key of the probe semiangle cutoff [mrad]. */
  public static final String SEMIANGLE_CUTOFF = "semiangle_cutoff";
  /** Metadata key of the antialias cutoff gpts along x before downsampling. */
  public static final String ADJUSTED_CUTOFF_X = "adjusted_antialias_cutoff_gpts_x";
  /** Metadata key of the antialias cutoff gpts along y before downsampling. */
  public static final String ADJUSTED_CUTOFF_Y = "adjusted_antialias_cutoff_gpts_y";

  /** The kind of Waves objects. */
  public static final ArrayObjectType TYPE = new ArrayObjectType() {
    @Override
    public String getTag() {
      return "waves";
    }

    @Override
    public int getBaseDims() {
      return 2;
    }

    @Override
    public ArrayObject create(BackingArray array, List<AxisMetadata> axesMetadata,
        Map<String, Object> metadata, Device device) {
      return new Waves(array, axesMetadata.subList(0, axesMetadata.size() - 2), metadata,
          device);
    }

    @Override
    public String toString() {
      return getTag();
    }
  };

  /**
   * Constructor for Waves.
   *
   * @param array        complex storage whose last two axes are x and y.
   * @param ensembleAxes metadata of the ensemble axes (null for unknown axes).
   * @param metadata     metadata with at least the energy and sampling.
   * @param device       the device of the storage.
   */
  public Waves(BackingArray array, List<AxisMetadata> ensembleAxes, Map<String, Object> metadata,
      Device device) {
    super(array, 2, ensembleAxes, metadata, device);
    if (!array.getDataType().isComplex()) {
      throw new IllegalArgumentException(" Wave functions require a complex array.");
    }
    if (!(metadata.get(SAMPLING_X) instanceof Number)
        || !(metadata.get(SAMPLING_Y) instanceof Number)) {
      throw new IllegalArgumentException(" Wave functions require a sampling.");
    }
  }

  /**
   * Wave functions without ensemble axes metadata.
   *
   * @param array           complex array whose last two axes match the grid.
   * @param grid            the grid.
   * @param energy          the electron energy [eV].
   * @param reciprocalSpace true if the array is in reciprocal space.
   * @return the Waves.
   */
  public static Waves of(ArrayData array, Grid grid, double energy, boolean reciprocalSpace) {
    int[] shape = array.getShape();
    int[] gpts = grid.getGpts();
    if (shape.length < 2 || shape[shape.length - 2] != gpts[0]
        || shape[shape.length - 1] != gpts[1]) {
      throw new IllegalArgumentException(format(" Array shape %s does not match %s.",
          Arrays.toString(shape), grid));
    }
    return new Waves(BackingArray.of(array), null, metadata(grid, energy, reciprocalSpace),
        Device.CPU);
  }

  /**
   * Metadata of wave functions on a grid.
   *
   * @param grid            the grid.
   * @param energy          the electron energy [eV].
   * @param reciprocalSpace true for reciprocal space arrays.
   * @return a new mutable map.
   */
  public static Map<String, Object> metadata(Grid grid, double energy, boolean reciprocalSpace) {
    double[] sampling = grid.getSampling();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(ENERGY, energy);
    metadata.put(SAMPLING_X, sampling[0]);
    metadata.put(SAMPLING_Y, sampling[1]);
    metadata.put(RECIPROCAL_SPACE, reciprocalSpace);
    return metadata;
  }

  @Override
  public ArrayObjectType getType() {
    return TYPE;
  }

  @Override
  public List<AxisMetadata> getBaseAxesMetadata() {
    return baseAxes(getSampling());
  }

  /**
   * Metadata of the real space base axes.
   *
   * @param sampling the sampling along x and y [Angstrom].
   * @return the x and y axes.
   */
  public static List<AxisMetadata> baseAxes(double[] sampling) {
    List<AxisMetadata> axes = new ArrayList<>(2);
    axes.add(new RealSpaceAxis("x", sampling[0]));
    axes.add(new RealSpaceAxis("y", sampling[1]));
    return axes;
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
      throw new IllegalStateException(" The energy of the wave functions is not defined.");
    }
    double e = ((Number) energy).doubleValue();
    Energy.checkDefined(e);
    return e;
  }

  public double getWavelength() {
    return Energy.wavelength(getEnergy());
  }

  public double[] getSampling() {
    Map<String, Object> metadata = getMetadata();
    return new double[] {((Number) metadata.get(SAMPLING_X)).doubleValue(),
        ((Number) metadata.get(SAMPLING_Y)).doubleValue()};
  }

  /**
   * The grid of the base axes.
   *
   * @return the grid.
   */
  public Grid getGrid() {
    int[] gpts = getBaseShape();
    double[] sampling = getSampling();
    return new Grid(new double[] {gpts[0] * sampling[0], gpts[1] * sampling[1]}, gpts);
  }

  public boolean isReciprocalSpace() {
    return Boolean.TRUE.equals(getMetadata().get(RECIPROCAL_SPACE));
  }

  /**
   * The normalization of the waves.
   *
   * @return "values", "reciprocal_space" or null if unknown.
   */
  @Nullable
  public String getNormalization() {
    Object normalization = getMetadata().get(NORMALIZATION);
    return normalization == null ? null : normalization.toString();
  }

  /**
   * Reciprocal space sampling in scattering angles.
   *
   * @return the angular sampling along x and y [mrad].
   */
  public double[] getAngularSampling() {
    double[] reciprocal = getGrid().getReciprocalSampling();
    double lambda = getWavelength();
    return new double[] {reciprocal[0] * lambda * RAD_TO_MRAD,
        reciprocal[1] * lambda * RAD_TO_MRAD};
  }

  /**
   * Grid points spanned by the antialias aperture, limited by any earlier downsampling.
   *
   * @return the number of grid points along x and y.
   */
  public int[] getAntialiasCutoffGpts() {
    int[] gpts = getBaseShape();
    Map<String, Object> metadata = getMetadata();
    if (metadata.get(ADJUSTED_CUTOFF_X) instanceof Number) {
      return new int[] {
          min(((Number) metadata.get(ADJUSTED_CUTOFF_X)).intValue(), gpts[0]),
          min(((Number) metadata.get(ADJUSTED_CUTOFF_Y)).intValue(), gpts[1])};
    }
    return AntialiasAperture.cutoffGpts(getGrid());
  }

  /**
   * Grid points of the largest rectangle inside the antialias aperture.
   *
   * @return the number of grid points along x and y.
   */
  public int[] getAntialiasValidGpts() {
    int[] cutoff = getAntialiasCutoffGpts();
    int[] gpts = getBaseShape();
    int[] valid = new int[2];
    for (int i = 0; i < 2; i++) {
      valid[i] = ensureParity((int) (cutoff[i] / sqrt(2.0)), gpts[i] % 2 == 0, 1);
      valid[i] = min(valid[i], cutoff[i]);
    }
    return valid;
  }

  /**
   * Scattering angles at the antialias cutoff.
   *
   * @return the cutoff angles along x and y [mrad].
   */
  public double[] getCutoffAngles() {
    int[] cutoff = getAntialiasCutoffGpts();
    double[] angular = getAngularSampling();
    return new double[] {(cutoff[0] / 2) * angular[0], (cutoff[1] / 2) * angular[1]};
  }

  /**
   * Grid points within a named maximum scattering angle.
   *
   * @param maxAngle "cutoff", "valid" or "full".
   * @param parity   "same", "odd", "even" or "none".
   * @return the number of grid points along x and y.
   */
  public int[] gptsWithinAngle(String maxAngle, String parity) {
    int[] gpts;
    if (maxAngle == null || "full".equals(maxAngle)) {
      return getBaseShape();
    } else if ("cutoff".equals(maxAngle)) {
      gpts = getAntialiasCutoffGpts();
    } else if ("valid".equals(maxAngle)) {
      gpts = getAntialiasValidGpts();
    } else {
      throw new UnsupportedOperationException(format(
          " Maximum angle %s is not one of 'cutoff', 'valid' or 'full'.", maxAngle));
    }
    return ensureParityOfGpts(gpts, getBaseShape(), parity);
  }

  /**
   * Grid points within a maximum scattering angle.
   *
   * @param maxAngle the maximum angle [mrad].
   * @param parity   "same", "odd", "even" or "none".
   * @return the number of grid points along x and y.
   */
  public int[] gptsWithinAngle(double maxAngle, String parity) {
    double[] angular = getAngularSampling();
    int[] gpts = {(int) (2 * ceil(maxAngle / angular[0])) + 1,
        (int) (2 * ceil(maxAngle / angular[1])) + 1};
    return ensureParityOfGpts(gpts, getBaseShape(), parity);
  }

  /**
   * Adjust the parity of a number of grid points.
   *
   * @param gpts    the grid points.
   * @param oldGpts the original grid points (for "same").
   * @param parity  "same", "odd", "even" or "none".
   * @return the adjusted grid points.
   */
  public static int[] ensureParityOfGpts(int[] gpts, int[] oldGpts, String parity) {
    switch (parity) {
      case "same":
        return new int[] {ensureParity(gpts[0], oldGpts[0] % 2 == 0, 1),
            ensureParity(gpts[1], oldGpts[1] % 2 == 0, 1)};
      case "odd":
        return new int[] {ensureParity(gpts[0], false, 1), ensureParity(gpts[1], false, 1)};
      case "even":
        return new int[] {ensureParity(gpts[0], true, 1), ensureParity(gpts[1], true, 1)};
      case "none":
        return gpts.clone();
      default:
        throw new UnsupportedOperationException(format(" Parity %s is not recognized.", parity));
    }
  }

  /**
   * The beam tilt of every ensemble item: the base tilt plus the values of any beam tilt axes.
   *
   * @return one (tilt x, tilt y) pair [mrad] per item, in row-major ensemble order.
   */
  public double[][] getTilts() {
    Map<String, Object> metadata = getMetadata();
    double baseX = metadata.get(TILT_X) instanceof Number
        ? ((Number) metadata.get(TILT_X)).doubleValue() : 0.0;
    double baseY = metadata.get(TILT_Y) instanceof Number
        ? ((Number) metadata.get(TILT_Y)).doubleValue() : 0.0;
    int[] ensembleShape = getEnsembleShape();
    List<AxisMetadata> axes = getEnsembleAxesMetadata();
    int n = (int) ArrayData.product(ensembleShape);
    double[][] tilts = new double[n][2];
    int[] strides = ArrayData.strides(ensembleShape);
    for (int item = 0; item < n; item++) {
      tilts[item][0] = baseX;
      tilts[item][1] = baseY;
      for (int a = 0; a < axes.size(); a++) {
        AxisMetadata axis = axes.get(a);
        if (!(axis instanceof OrdinalAxis)) {
          continue;
        }
        int index = (item / strides[a]) % ensembleShape[a];
        if (BeamTilt.TILT_X_LABEL.equals(axis.getLabel())) {
          tilts[item][0] += ((Number) ((OrdinalAxis) axis).getValues().get(index)).doubleValue();
        } else if (BeamTilt.TILT_Y_LABEL.equals(axis.getLabel())) {
          tilts[item][1] += ((Number) ((OrdinalAxis) axis).getValues().get(index)).doubleValue();
        }
      }
    }
    return tilts;
  }

  /**
   * Apply a function to the planes of every ensemble item. Lazy waves stay lazy.
   *
   * @param newBase    the base shape of the result.
   * @param outType    the element type of the result.
   * @param function   maps an array of shape E ++ base to an array of shape E ++ newBase; must
   *                   not modify its argument.
   * @return the storage of the result.
   */
  protected BackingArray mapPlanes(int[] newBase, DataType outType,
      UnaryOperator<ArrayData> function) {
    if (isLazy()) {
      return BackingArray.of(getLazyArray().map(getEnsembleDims(), newBase, outType, function));
    }
    return BackingArray.of(function.apply(getArray()));
  }

  private Waves derive(BackingArray array, Map<String, Object> changes) {
    Map<String, Object> metadata = new LinkedHashMap<>(getMetadata());
    metadata.putAll(changes);
    return new Waves(array, getEnsembleAxesMetadata(), metadata, getDevice());
  }

  /**
   * The number of planes of an array whose last two axes are the base axes.
   *
   * @param array the array.
   * @return the number of planes.
   */
  public static int numPlanes(ArrayData array) {
    int[] shape = array.getShape();
    return (int) ArrayData.product(Arrays.copyOfRange(shape, 0, shape.length - 2));
  }

  /**
   * Transform to reciprocal space.
   *
   * @return these waves if already in reciprocal space, otherwise new waves.
   */
  public Waves ensureReciprocalSpace() {
    if (isReciprocalSpace()) {
      return this;
    }
    int[] gpts = getBaseShape();
    BackingArray array = mapPlanes(gpts, DataType.COMPLEX128, block -> {
      ArrayData copy = block.copy();
      FourierSpace.fft2(copy.getData(), numPlanes(copy), gpts[0], gpts[1]);
      return copy;
    });
    return derive(array, Collections.singletonMap(RECIPROCAL_SPACE, true));
  }

  /**
   * Transform to real space.
   *
   * @return these waves if already in real space, otherwise new waves.
   */
  public Waves ensureRealSpace() {
    if (!isReciprocalSpace()) {
      return this;
    }
    int[] gpts = getBaseShape();
    BackingArray array = mapPlanes(gpts, DataType.COMPLEX128, block -> {
      ArrayData copy = block.copy();
      FourierSpace.ifft2(copy.getData(), numPlanes(copy), gpts[0], gpts[1]);
      return copy;
    });
    return derive(array, Collections.singletonMap(RECIPROCAL_SPACE, false));
  }

  /**
   * Normalize every wave function so that its intensity sums to one in reciprocal space. The
   * result is in the same space as these waves.
   *
   * @return the normalized waves.
   */
  public Waves normalize() {
    return normalize("reciprocal");
  }

  /**
   * Normalize every wave function.
   *
   * @param space only "reciprocal" is supported.
   * @return the normalized waves.
   */
  public Waves normalize(String space) {
    if (!"reciprocal".equals(space)) {
      throw new UnsupportedOperationException(
          format(" Normalization in %s space is not supported.", space));
    }
    int[] gpts = getBaseShape();
    boolean reciprocal = isReciprocalSpace();
    BackingArray array = mapPlanes(gpts, DataType.COMPLEX128, block -> {
      ArrayData copy = block.copy();
      double[] data = copy.getData();
      int nPlanes = numPlanes(copy);
      if (!reciprocal) {
        FourierSpace.fft2(data, nPlanes, gpts[0], gpts[1]);
      }
      int planeSize = 2 * gpts[0] * gpts[1];
      for (int p = 0; p < nPlanes; p++) {
        double sum = 0.0;
        for (int i = p * planeSize; i < (p + 1) * planeSize; i++) {
          sum += data[i] * data[i];
        }
        if (sum > 0.0) {
          double scale = 1.0 / sqrt(sum);
          for (int i = p * planeSize; i < (p + 1) * planeSize; i++) {
            data[i] *= scale;
          }
        }
      }
      if (!reciprocal) {
        FourierSpace.ifft2(data, nPlanes, gpts[0], gpts[1]);
      }
      return copy;
    });
    return derive(array, Collections.singletonMap(NORMALIZATION, "reciprocal_space"));
  }

  /**
   * Multiply every wave function by a constant phase factor.
   *
   * @param amount the phase [rad].
   * @return the shifted waves.
   */
  public Waves phaseShift(double amount) {
    double c = cos(amount);
    double s = sin(amount);
    BackingArray array = mapPlanes(getBaseShape(), DataType.COMPLEX128, block -> {
      ArrayData copy = block.copy();
      double[] data = copy.getData();
      for (int i = 0; i < data.length; i += 2) {
        double re = data[i];
        double im = data[i + 1];
        data[i] = c * re - s * im;
        data[i + 1] = s * re + c * im;
      }
      return copy;
    });
    return derive(array, Collections.emptyMap());
  }

  /**
   * Repeat the wave functions periodically. Only real space waves can be tiled.
   *
   * @param repetitionsX the number of repetitions along x.
   * @param repetitionsY the number of repetitions along y.
   * @param renormalize  true to divide by the number of repetitions.
   * @return the tiled waves.
   */
  public Waves tile(int repetitionsX, int repetitionsY, boolean renormalize) {
    if (isReciprocalSpace()) {
      throw new UnsupportedOperationException(" Wave functions in reciprocal space cannot be tiled.");
    }
    if (repetitionsX < 1 || repetitionsY < 1) {
      throw new IllegalArgumentException(" The number of repetitions must be positive.");
    }
    int[] gpts = getBaseShape();
    int[] tiled = {gpts[0] * repetitionsX, gpts[1] * repetitionsY};
    double scale = renormalize ? 1.0 / (repetitionsX * repetitionsY) : 1.0;
    BackingArray array = mapPlanes(tiled, DataType.COMPLEX128, block -> {
      int nPlanes = numPlanes(block);
      double[] in = block.getData();
      double[] out = new double[2 * nPlanes * tiled[0] * tiled[1]];
      for (int p = 0; p < nPlanes; p++) {
        int inOffset = 2 * p * gpts[0] * gpts[1];
        int outOffset = 2 * p * tiled[0] * tiled[1];
        for (int x = 0; x < tiled[0]; x++) {
          for (int y = 0; y < tiled[1]; y++) {
            int from = inOffset + 2 * ((x % gpts[0]) * gpts[1] + (y % gpts[1]));
            int to = outOffset + 2 * (x * tiled[1] + y);
            out[to] = in[from] * scale;
            out[to + 1] = in[from + 1] * scale;
          }
        }
      }
      int[] shape = block.getShape();
      return ArrayData.wrap(DataType.COMPLEX128, out,
          ArrayUtils.addAll(Arrays.copyOfRange(shape, 0, shape.length - 2), tiled));
    });
    return derive(array, Collections.emptyMap());
  }

  /**
   * The intensity of the wave functions in real space.
   *
   * @return the intensity images.
   */
  public Images intensity() {
    Waves real = ensureRealSpace();
    BackingArray array = real.mapPlanes(getBaseShape(), DataType.FLOAT64, ArrayData::abs2);
    return new Images(array, getEnsembleAxesMetadata(),
        Images.metadata(getSampling(), "intensity", "arb. unit"), getDevice());
  }

  /**
   * The complex wave functions in real space as images.
   *
   * @return complex images.
   */
  public Images complexImages() {
    Waves real = ensureRealSpace();
    BackingArray array = real.mapPlanes(getBaseShape(), DataType.COMPLEX128, ArrayData::copy);
    return new Images(array, getEnsembleAxesMetadata(),
        Images.metadata(getSampling(), "intensity", "arb. unit"), getDevice());
  }

  /**
   * Downsample to the antialias cutoff.
   *
   * @param maxAngle "cutoff", "valid" or "full".
   * @return the downsampled waves.
   */
  public Waves downsample(String maxAngle) {
    return downsample(gptsWithinAngle(maxAngle, "same"));
  }

  /**
   * Downsample by Fourier interpolation, preserving the values of the wave functions.
   *
   * @param newGpts the new number of grid points.
   * @return the downsampled waves.
   */
  public Waves downsample(int[] newGpts) {
    int[] gpts = getBaseShape();
    int[] cutoff = getAntialiasCutoffGpts();
    boolean reciprocal = isReciprocalSpace();
    double scale = (double) (newGpts[0] * newGpts[1]) / (gpts[0] * gpts[1]);
    BackingArray array = mapPlanes(newGpts, DataType.COMPLEX128, block -> {
      int nPlanes = numPlanes(block);
      double[] data = block.getData().clone();
      if (!reciprocal) {
        FourierSpace.fft2(data, nPlanes, gpts[0], gpts[1]);
      }
      double[] cropped = FourierSpace.fftCrop(data, nPlanes, gpts[0], gpts[1], newGpts[0],
          newGpts[1]);
      if (!reciprocal) {
        FourierSpace.ifft2(cropped, nPlanes, newGpts[0], newGpts[1]);
        for (int i = 0; i < cropped.length; i++) {
          cropped[i] *= scale;
        }
      }
      int[] shape = block.getShape();
      return ArrayData.wrap(DataType.COMPLEX128, cropped,
          ArrayUtils.addAll(Arrays.copyOfRange(shape, 0, shape.length - 2), newGpts));
    });
    double[] extent = getGrid().getExtent();
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put(SAMPLING_X, extent[0] / newGpts[0]);
    changes.put(SAMPLING_Y, extent[1] / newGpts[1]);
    changes.put(ADJUSTED_CUTOFF_X, cutoff[0]);
    changes.put(ADJUSTED_CUTOFF_Y, cutoff[1]);
    return derive(array, changes);
  }

  /**
   * Diffraction patterns cropped to the antialias cutoff, with the direct beam at the center.
   *
   * @return the diffraction patterns.
   */
  public DiffractionPatterns diffractionPatterns() {
    return diffractionPatterns("cutoff", 0.0, true, "odd", false, true);
  }

  /**
   * Diffraction patterns within a named maximum scattering angle.
   *
   * @param maxAngle      "cutoff", "valid" or "full".
   * @param blockDirect   if positive, the radius of the blocked direct beam [mrad].
   * @param fftshift      true to move the zero angle to the center.
   * @param parity        "same", "odd", "even" or "none".
   * @param returnComplex true to return the complex reciprocal space wave functions.
   * @param renormalize   true to divide "values" normalized waves by the number of grid points.
   * @return the diffraction patterns.
   */
  public DiffractionPatterns diffractionPatterns(String maxAngle, double blockDirect,
      boolean fftshift, String parity, boolean returnComplex, boolean renormalize) {
    return diffractionPatterns(gptsWithinAngle(maxAngle, parity), blockDirect, fftshift,
        returnComplex, renormalize);
  }

  /**
   * Diffraction patterns within a maximum scattering angle.
   *
   * @param maxAngle      the maximum angle [mrad].
   * @param blockDirect   if positive, the radius of the blocked direct beam [mrad].
   * @param fftshift      true to move the zero angle to the center.
   * @param parity        "same", "odd", "even" or "none".
   * @param returnComplex true to return the complex reciprocal space wave functions.
   * @param renormalize   true to divide "values" normalized waves by the number of grid points.
   * @return the diffraction patterns.
   */
  public DiffractionPatterns diffractionPatterns(double maxAngle, double blockDirect,
      boolean fftshift, String parity, boolean returnComplex, boolean renormalize) {
    return diffractionPatterns(gptsWithinAngle(maxAngle, parity), blockDirect, fftshift,
        returnComplex, renormalize);
  }

  private DiffractionPatterns diffractionPatterns(int[] newGpts, double blockDirect,
      boolean fftshift, boolean returnComplex, boolean renormalize) {
    if (newGpts[0] < 1 || newGpts[1] < 1) {
      throw new IllegalArgumentException(
          format(" Invalid diffraction pattern shape %s.", Arrays.toString(newGpts)));
    }
    boolean divide = false;
    String normalization = getNormalization();
    if (renormalize && normalization != null) {
      if ("values".equals(normalization)) {
        divide = true;
      } else if (!"reciprocal_space".equals(normalization)) {
        throw new UnsupportedOperationException(
            format(" Normalization %s is not recognized.", normalization));
      }
    }
    boolean normalize = divide;
    Waves real = ensureRealSpace();
    int[] gpts = getBaseShape();
    DataType outType = returnComplex ? DataType.COMPLEX128 : DataType.FLOAT64;
    BackingArray array = real.mapPlanes(newGpts, outType, block -> {
      int nPlanes = numPlanes(block);
      double[] data = block.getData().clone();
      if (normalize) {
        double scale = 1.0 / (gpts[0] * gpts[1]);
        for (int i = 0; i < data.length; i++) {
          data[i] *= scale;
        }
      }
      FourierSpace.fft2(data, nPlanes, gpts[0], gpts[1]);
      if (gpts[0] != newGpts[0] || gpts[1] != newGpts[1]) {
        data = FourierSpace.fftCrop(data, nPlanes, gpts[0], gpts[1], newGpts[0], newGpts[1]);
      }
      int[] shape = block.getShape();
      int[] outShape = ArrayUtils.addAll(Arrays.copyOfRange(shape, 0, shape.length - 2),
          newGpts);
      ArrayData result = ArrayData.wrap(DataType.COMPLEX128, data, outShape);
      if (!returnComplex) {
        result = result.abs2();
        if (fftshift) {
          return ArrayData.wrap(DataType.FLOAT64, FourierSpace.fftShiftReal(result.getData(),
              nPlanes, newGpts[0], newGpts[1]), outShape);
        }
        return result;
      }
      if (fftshift) {
        return ArrayData.wrap(DataType.COMPLEX128, FourierSpace.fftShiftComplex(data, nPlanes,
            newGpts[0], newGpts[1]), outShape);
      }
      return result;
    });

    Map<String, Object> metadata = DiffractionPatterns.metadata(getGrid().getReciprocalSampling(),
        fftshift, getEnergy(), "intensity", "arb. unit");
    Object semiangle = getMetadata().get(SEMIANGLE_CUTOFF);
    if (semiangle != null) {
      metadata.put(SEMIANGLE_CUTOFF, semiangle);
    }
    DiffractionPatterns patterns = new DiffractionPatterns(array, getEnsembleAxesMetadata(),
        metadata, getDevice());
    if (blockDirect > 0.0) {
      patterns = patterns.blockDirect(blockDirect);
    }
    return patterns;
  }

  /**
   * Propagate the waves through a potential and detect them.
   *
   * @param potential the potential.
   * @param detectors the detectors (empty for the exit waves).
   * @param settings  the compute settings.
   * @return one measurement per detector.
   */
  public ComputableList<ArrayObject> multislice(Potential potential, List<Detector> detectors,
      ComputeSettings settings) {
    return applyTransform(new MultisliceTransform(potential, detectors), settings);
  }

  /**
   * Propagate the waves through a potential.
   *
   * @param potential the potential.
   * @param settings  the compute settings.
   * @return the exit waves.
   */
  public Waves multislice(Potential potential, ComputeSettings settings) {
    return (Waves) multislice(potential, Collections.emptyList(), settings).get(0);
  }

  /**
   * All kinds of objects produced by wave functions and their measurements.
   *
   * @return the kinds.
   */
  public static List<ArrayObjectType> knownTypes() {
    List<ArrayObjectType> types = new ArrayList<>();
    types.add(TYPE);
    types.addAll(Arrays.asList(MeasurementType.values()));
    return types;
  }
}
