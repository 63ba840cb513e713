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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import msx.array.lazy.LazyArray;
import msx.array.lazy.LazyEvaluator;

/**
 * A list of ArrayObjects that are computed together. All lazy members are evaluated in a single
 * pass so that work shared between them (such as the multislice propagation behind several
 * detectors) is done once.
 *
 * @param <T> the element type.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ComputableList<T extends ArrayObject> extends ArrayList<T> {

  public ComputableList() {
    super();
  }

  public ComputableList(Collection<? extends T> objects) {
    super(objects);
  }

  /**
   * Compute every lazy member with the default settings.
   *
   * @return this list.
   */
  public ComputableList<T> compute() {
    return compute(ComputeSettings.defaults());
  }

  /**
   * Compute every lazy member in one pass.
   *
   * @param settings the compute settings.
   * @return this list.
   */
  public ComputableList<T> compute(ComputeSettings settings) {
    List<T> lazyObjects = new ArrayList<>();
    List<LazyArray> lazyArrays = new ArrayList<>();
    for (T object : this) {
      if (object.isLazy()) {
        lazyObjects.add(object);
        lazyArrays.add(object.getLazyArray());
      }
    }
    if (lazyObjects.isEmpty()) {
      return this;
    }
    List<ArrayData> computed = LazyEvaluator.compute(lazyArrays, settings);
    for (int i = 0; i < lazyObjects.size(); i++) {
      lazyObjects.get(i).setComputed(computed.get(i));
    }
    return this;
  }
}
