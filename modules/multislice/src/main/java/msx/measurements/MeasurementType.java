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

import java.util.List;
import java.util.Map;
import msx.array.ArrayObject;
import msx.array.ArrayObjectType;
import msx.array.BackingArray;
import msx.array.Device;
import msx.array.axes.AxisMetadata;

/**
 * The kinds of measurements, identified by their persisted tag.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum MeasurementType implements ArrayObjectType {
  IMAGES("images", 2),
  DIFFRACTION_PATTERNS("diffraction_patterns", 2),
  REAL_SPACE_LINE_PROFILES("real_space_line_profiles", 1);

  private final String tag;
  private final int baseDims;

  MeasurementType(String tag, int baseDims) {
    this.tag = tag;
    this.baseDims = baseDims;
  }

  @Override
  public String getTag() {
    return tag;
  }

  @Override
  public int getBaseDims() {
    return baseDims;
  }

  @Override
  public ArrayObject create(BackingArray array, List<AxisMetadata> axesMetadata,
      Map<String, Object> metadata, Device device) {
    List<AxisMetadata> ensembleAxes = axesMetadata.subList(0, axesMetadata.size() - baseDims);
    switch (this) {
      case IMAGES:
        return new Images(array, ensembleAxes, metadata, device);
      case DIFFRACTION_PATTERNS:
        return new DiffractionPatterns(array, ensembleAxes, metadata, device);
      case REAL_SPACE_LINE_PROFILES:
      default:
        return new RealSpaceLineProfiles(array, ensembleAxes, metadata, device);
    }
  }

  @Override
  public String toString() {
    return tag;
  }
}
