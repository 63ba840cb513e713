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
package msx.array;

import java.util.List;
import java.util.Map;
import msx.array.axes.AxisMetadata;

/**
 * A concrete kind of ArrayObject. The tag identifies the kind when an object is persisted, and
 * {@link #create(BackingArray, List, Map, Device)} rebuilds an object of the kind from storage,
 * axis metadata and scalar metadata.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ArrayObjectType {

  /**
   * The persisted tag of this kind.
   *
   * @return the tag.
   */
  String getTag();

  /**
   * The number of base (trailing) axes of this kind.
   *
   * @return the base rank.
   */
  int getBaseDims();

  /**
   * Build an object of this kind.
   *
   * @param array        the storage.
   * @param axesMetadata metadata for every axis (ensemble axes followed by base axes).
   * @param metadata     scalar metadata.
   * @param device       the device of the storage.
   * @return the ArrayObject.
   */
  ArrayObject create(BackingArray array, List<AxisMetadata> axesMetadata,
      Map<String, Object> metadata, Device device);
}
