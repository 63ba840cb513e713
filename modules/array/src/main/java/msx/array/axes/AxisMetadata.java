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
package msx.array.axes;

import static java.lang.String.format;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Describes one axis of an ArrayObject: what the axis means, its units, whether it may be removed
 * when it has length one, and whether measurements should be averaged over it.
 *
 * <p>Every variant can be converted to and from a flat map of primitive values, which is how axis
 * metadata is persisted.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class AxisMetadata {

  /** Map key of the variant tag. */
  public static final String TYPE = "type";
  /** Map key of the label. */
  public static final String LABEL = "label";
  /** Map key of the units. */
  public static final String UNITS = "units";
  /** Map key of the squeeze flag. */
  public static final String SQUEEZE = "squeeze";
  /** Map key of the ensemble-mean flag. */
  public static final String ENSEMBLE_MEAN = "ensemble_mean";

  protected final String label;
  protected final String units;
  protected final boolean squeeze;
  protected final boolean ensembleMean;

  /**
   * Constructor for AxisMetadata.
   *
   * @param label        the label.
   * @param units        the units (may be empty).
   * @param squeeze      true if the axis may be removed when it has length one.
   * @param ensembleMean true if measurements are averaged over the axis.
   */
  protected AxisMetadata(String label, String units, boolean squeeze, boolean ensembleMean) {
    this.label = label == null ? "" : label;
    this.units = units == null ? "" : units;
    this.squeeze = squeeze;
    this.ensembleMean = ensembleMean;
  }

  /**
   * The variant tag.
   *
   * @return the tag.
   */
  public abstract String getType();

  /**
   * Add variant specific fields to a map.
   *
   * @param map the map.
   */
  protected abstract void addFields(Map<String, Object> map);

  /**
   * The metadata of a contiguous selection [start, stop) of this axis.
   *
   * @param start first position.
   * @param stop  end position (exclusive).
   * @return the metadata of the selection.
   */
  public AxisMetadata select(int start, int stop) {
    return this;
  }

  /**
   * The metadata of this axis concatenated with another.
   *
   * @param other the following axis.
   * @return the metadata of the joined axis.
   */
  public AxisMetadata concatenate(AxisMetadata other) {
    if (!equals(other)) {
      throw new IllegalArgumentException(
          format(" Cannot concatenate axis %s with axis %s.", this, other));
    }
    return this;
  }

  public String getLabel() {
    return label;
  }

  public String getUnits() {
    return units;
  }

  public boolean isSqueeze() {
    return squeeze;
  }

  public boolean isEnsembleMean() {
    return ensembleMean;
  }

  /**
   * A flat map of primitive values describing this axis.
   *
   * @return the map.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TYPE, getType());
    map.put(LABEL, label);
    map.put(UNITS, units);
    map.put(SQUEEZE, squeeze);
    map.put(ENSEMBLE_MEAN, ensembleMean);
    addFields(map);
    return map;
  }

  /**
   * Rebuild axis metadata from a map produced by {@link #toMap()}.
   *
   * @param map the map.
   * @return the AxisMetadata.
   */
  public static AxisMetadata fromMap(Map<String, Object> map) {
    String type = (String) map.get(TYPE);
    if (type == null) {
      throw new IllegalArgumentException(" Axis metadata without a type.");
    }
    String label = (String) map.get(LABEL);
    String units = (String) map.get(UNITS);
    boolean squeeze = Boolean.TRUE.equals(map.get(SQUEEZE));
    boolean ensembleMean = Boolean.TRUE.equals(map.get(ENSEMBLE_MEAN));
    switch (type) {
      case RealSpaceAxis.TYPE_NAME:
        return new RealSpaceAxis(label, number(map, "sampling"), units, number(map, "offset"),
            squeeze);
      case ReciprocalSpaceAxis.TYPE_NAME:
        return new ReciprocalSpaceAxis(label, number(map, "sampling"), units,
            number(map, "offset"), Boolean.TRUE.equals(map.get("fftshift")));
      case OrdinalAxis.TYPE_NAME:
        Object values = map.get("values");
        if (!(values instanceof List)) {
          throw new IllegalArgumentException(" Ordinal axis metadata without values.");
        }
        return new OrdinalAxis(label, units, (List<?>) values, squeeze, ensembleMean);
      case UnknownAxis.TYPE_NAME:
        return new UnknownAxis(label);
      default:
        throw new IllegalArgumentException(format(" Unknown axis metadata type %s.", type));
    }
  }

  private static double number(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(format(" Axis metadata field %s is missing.", key));
    }
    return ((Number) value).doubleValue();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return toMap().equals(((AxisMetadata) o).toMap());
  }

  @Override
  public int hashCode() {
    return toMap().hashCode();
  }

  @Override
  public String toString() {
    ToStringBuilder builder = new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE);
    for (Map.Entry<String, Object> entry : toMap().entrySet()) {
      if (!TYPE.equals(entry.getKey())) {
        builder.append(entry.getKey(), entry.getValue());
      }
    }
    return builder.toString();
  }
}
