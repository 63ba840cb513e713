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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.BackingArray;
import msx.array.DataType;
import msx.array.Device;
import msx.array.axes.AxisMetadata;

/**
 * Base class of the measurements produced by detectors. Ensemble axes flagged for averaging (for
 * example frozen phonon configurations) are averaged when the ensemble is reduced.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class BaseMeasurement extends ArrayObject {

  /** Metadata key of the measured quantity. */
  public static final String LABEL = "label";
  /** Metadata key of the units of the measured quantity. */
  public static final String UNITS = "units";

  /**
   * Constructor for BaseMeasurement.
   *
   * @param array        the storage.
   * @param baseDims     the number of base axes.
   * @param ensembleAxes metadata of the ensemble axes (null for unknown axes).
   * @param metadata     scalar metadata.
   * @param device       the device of the storage.
   */
  protected BaseMeasurement(BackingArray array, int baseDims, List<AxisMetadata> ensembleAxes,
      Map<String, Object> metadata, Device device) {
    super(array, baseDims, ensembleAxes, metadata, device);
  }

  @Override
  protected boolean isEnsembleMeanSupported() {
    return true;
  }

  public String getLabel() {
    Object label = getMetadata().get(LABEL);
    return label == null ? "" : label.toString();
  }

  public String getUnits() {
    Object units = getMetadata().get(UNITS);
    return units == null ? "" : units.toString();
  }

  /**
   * Apply a function to the base arrays of every ensemble item. Lazy measurements stay lazy.
   *
   * @param newBase  the base shape of the result.
   * @param outType  the element type of the result.
   * @param function maps an array of shape E ++ base to one of shape E ++ newBase; must not modify
   *                 its argument.
   * @return the storage of the result.
   */
  protected BackingArray mapBase(int[] newBase, DataType outType,
      UnaryOperator<ArrayData> function) {
    if (isLazy()) {
      return BackingArray.of(getLazyArray().map(getEnsembleDims(), newBase, outType, function));
    }
    return BackingArray.of(function.apply(getArray()));
  }

  /**
   * The element-wise sum of two measurements of the same kind and shape.
   *
   * @param other the other measurement.
   * @return the sum, with the metadata of this measurement.
   */
  public BaseMeasurement add(BaseMeasurement other) {
    if (other.getType() != getType() || !Arrays.equals(other.getShape(), getShape())) {
      throw new IllegalArgumentException(format(" Cannot add %s of shape %s to %s of shape %s.",
          other.getType(), Arrays.toString(other.getShape()), getType(),
          Arrays.toString(getShape())));
    }
    ArrayData sum = getArray().copy();
    sum.addInPlace(other.getArray());
    return (BaseMeasurement) withArray(BackingArray.of(sum), getEnsembleAxesMetadata());
  }

  /**
   * Sum over ensemble axes.
   *
   * @param axes the ensemble axes to remove (all ensemble axes if none are given).
   * @return the reduced measurement.
   */
  public BaseMeasurement sum(int... axes) {
    return reduce(false, axes);
  }

  /**
   * Average over ensemble axes.
   *
   * @param axes the ensemble axes to remove (all ensemble axes if none are given).
   * @return the reduced measurement.
   */
  public BaseMeasurement mean(int... axes) {
    return reduce(true, axes);
  }

  private BaseMeasurement reduce(boolean mean, int... axes) {
    int ensembleDims = getEnsembleDims();
    if (axes.length == 0) {
      axes = new int[ensembleDims];
      Arrays.setAll(axes, i -> i);
    }
    int[] sorted = axes.clone();
    for (int i = 0; i < sorted.length; i++) {
      if (sorted[i] < 0) {
        sorted[i] += ensembleDims;
      }
      if (sorted[i] < 0 || sorted[i] >= ensembleDims) {
        throw new IllegalArgumentException(
            format(" Axis %d is not one of the %d ensemble axes.", axes[i], ensembleDims));
      }
    }
    Arrays.sort(sorted);
    ArrayData array = getArray();
    List<AxisMetadata> ensembleAxes = new ArrayList<>(getEnsembleAxesMetadata());
    for (int i = sorted.length - 1; i >= 0; i--) {
      if (i < sorted.length - 1 && sorted[i] == sorted[i + 1]) {
        continue;
      }
      array = mean ? array.mean(sorted[i]) : array.sum(sorted[i]);
      ensembleAxes.remove(sorted[i]);
    }
    return (BaseMeasurement) withArray(BackingArray.of(array), ensembleAxes);
  }
}
