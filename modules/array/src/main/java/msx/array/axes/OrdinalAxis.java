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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An axis indexed by a list of values, for example a parameter series or the configurations of a
 * frozen phonon ensemble. Values must be numbers, strings or booleans.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrdinalAxis extends AxisMetadata {

  /** Variant tag. */
  public static final String TYPE_NAME = "ordinal";

  private final List<Object> values;

  /**
   * Constructor for OrdinalAxis.
   *
   * @param label        the label.
   * @param units        the units.
   * @param values       one value per position.
   * @param squeeze      true if the axis may be removed when it has length one.
   * @param ensembleMean true if measurements are averaged over the axis.
   */
  public OrdinalAxis(String label, String units, List<?> values, boolean squeeze,
      boolean ensembleMean) {
    super(label, units, squeeze, ensembleMean);
    for (Object value : values) {
      if (!(value instanceof Number || value instanceof String || value instanceof Boolean)) {
        throw new IllegalArgumentException(
            format(" Unsupported ordinal axis value %s.", value));
      }
    }
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * An ordinal axis labeled 0 ... n-1.
   *
   * @param label        the label.
   * @param n            the axis length.
   * @param squeeze      true if the axis may be removed when it has length one.
   * @param ensembleMean true if measurements are averaged over the axis.
   * @return the OrdinalAxis.
   */
  public static OrdinalAxis indexed(String label, int n, boolean squeeze, boolean ensembleMean) {
    List<Object> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      values.add(i);
    }
    return new OrdinalAxis(label, "", values, squeeze, ensembleMean);
  }

  public List<Object> getValues() {
    return values;
  }

  @Override
  public String getType() {
    return TYPE_NAME;
  }

  @Override
  public AxisMetadata select(int start, int stop) {
    return new OrdinalAxis(label, units, values.subList(start, stop), squeeze, ensembleMean);
  }

  @Override
  public AxisMetadata concatenate(AxisMetadata other) {
    if (!(other instanceof OrdinalAxis) || !label.equals(other.label)) {
      throw new IllegalArgumentException(
          format(" Cannot concatenate axis %s with axis %s.", this, other));
    }
    List<Object> joined = new ArrayList<>(values);
    joined.addAll(((OrdinalAxis) other).values);
    return new OrdinalAxis(label, units, joined, squeeze, ensembleMean);
  }

  @Override
  protected void addFields(Map<String, Object> map) {
    map.put("values", values);
  }
}
