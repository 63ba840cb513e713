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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.Device;
import msx.array.axes.AxisMetadata;
import msx.array.axes.RealSpaceAxis;

/**
 * An ensemble of profiles along a line in real space.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RealSpaceLineProfiles extends BaseMeasurement {

  public static final String SAMPLING = "sampling";
  public static final String START_X = "start_x";
  public static final String START_Y = "start_y";
  public static final String END_X = "end_x";
  public static final String END_Y = "end_y";

  public RealSpaceLineProfiles(BackingArray array, List<AxisMetadata> ensembleAxes,
      Map<String, Object> metadata, Device device) {
    super(array, 1, ensembleAxes, metadata, device);
    if (!(metadata.get(SAMPLING) instanceof Number)) {
      throw new IllegalArgumentException(" Line profiles require a sampling.");
    }
  }

  @Override
  public ArrayObjectType getType() {
    return MeasurementType.REAL_SPACE_LINE_PROFILES;
  }

  @Override
  public List<AxisMetadata> getBaseAxesMetadata() {
    return Collections.singletonList(new RealSpaceAxis("r", getSampling()));
  }

  /**
   * The distance between points along the line.
   *
   * @return the sampling [Angstrom].
   */
  public double getSampling() {
    return ((Number) getMetadata().get(SAMPLING)).doubleValue();
  }

  /**
   * The start and end of the line, if recorded.
   *
   * @return {start x, start y, end x, end y} [Angstrom] or null.
   */
  @Nullable
  public double[] getLine() {
    Map<String, Object> metadata = getMetadata();
    if (!(metadata.get(START_X) instanceof Number)) {
      return null;
    }
    return new double[] {((Number) metadata.get(START_X)).doubleValue(),
        ((Number) metadata.get(START_Y)).doubleValue(),
        ((Number) metadata.get(END_X)).doubleValue(),
        ((Number) metadata.get(END_Y)).doubleValue()};
  }

  /**
   * The length of the profiles.
   *
   * @return the number of points times the sampling [Angstrom].
   */
  public double getLength() {
    return getBaseShape()[0] * getSampling();
  }
}
