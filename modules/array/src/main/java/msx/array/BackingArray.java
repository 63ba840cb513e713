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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import msx.array.lazy.LazyArray;

/**
 * The storage behind an ArrayObject: either an eager {@link ArrayData} or a deferred {@link
 * LazyArray}. Structural operations stay lazy when the storage is lazy.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BackingArray {

  private final ArrayData eager;
  private final LazyArray lazy;

  private BackingArray(ArrayData eager, LazyArray lazy) {
    this.eager = eager;
    this.lazy = lazy;
  }

  /**
   * Eager storage.
   *
   * @param data the array.
   * @return the BackingArray.
   */
  public static BackingArray of(ArrayData data) {
    if (data == null) {
      throw new IllegalArgumentException(" Array data is required.");
    }
    return new BackingArray(data, null);
  }

  /**
   * Lazy storage.
   *
   * @param lazy the lazy array.
   * @return the BackingArray.
   */
  public static BackingArray of(LazyArray lazy) {
    if (lazy == null) {
      throw new IllegalArgumentException(" A lazy array is required.");
    }
    return new BackingArray(null, lazy);
  }

  public boolean isLazy() {
    return lazy != null;
  }

  /**
   * The eager array.
   *
   * @return the array.
   * @throws IllegalStateException if the storage is lazy.
   */
  public ArrayData getArray() {
    if (eager == null) {
      throw new IllegalStateException(" The array is lazy; compute it first.");
    }
    return eager;
  }

  /**
   * The lazy array.
   *
   * @return the lazy array.
   * @throws IllegalStateException if the storage is eager.
   */
  public LazyArray getLazyArray() {
    if (lazy == null) {
      throw new IllegalStateException(" The array is not lazy.");
    }
    return lazy;
  }

  public int[] getShape() {
    return isLazy() ? lazy.getShape() : eager.getShape();
  }

  public DataType getDataType() {
    return isLazy() ? lazy.getDataType() : eager.getDataType();
  }

  public int getRank() {
    return isLazy() ? lazy.getRank() : eager.getRank();
  }

  /**
   * Index the leading axes.
   *
   * @param items the indices.
   * @return the result.
   */
  public BackingArray getItems(Index... items) {
    return isLazy() ? of(lazy.getItems(items)) : of(eager.getItems(items));
  }

  /**
   * Insert axes of length one.
   *
   * @param axes the new axis positions.
   * @return the result.
   */
  public BackingArray expandDims(int... axes) {
    return isLazy() ? of(lazy.expandDims(axes)) : of(eager.expandDims(axes));
  }

  /**
   * Remove axes of length one.
   *
   * @param axes the axes.
   * @return the result.
   */
  public BackingArray squeeze(int... axes) {
    return isLazy() ? of(lazy.squeeze(axes)) : of(eager.squeeze(axes));
  }

  /**
   * Lazy storage with the given chunks. Eager storage is wrapped without copying.
   *
   * @param chunks the chunk layout.
   * @return the result.
   */
  public BackingArray toLazy(int[][] chunks) {
    if (isLazy()) {
      return of(lazy.rechunk(chunks));
    }
    return of(LazyArray.fromArray(eager, chunks));
  }

  /**
   * Eager storage; lazy storage is computed.
   *
   * @param settings the compute settings.
   * @return the result.
   */
  public BackingArray compute(ComputeSettings settings) {
    return isLazy() ? of(lazy.compute(settings)) : this;
  }

  /**
   * Stack along a new axis. The result is lazy if any input is lazy.
   *
   * @param arrays the arrays.
   * @param axis   the new axis position.
   * @return the result.
   */
  public static BackingArray stack(List<BackingArray> arrays, int axis) {
    return join(arrays, axis, true);
  }

  /**
   * Concatenate along an existing axis. The result is lazy if any input is lazy.
   *
   * @param arrays the arrays.
   * @param axis   the axis.
   * @return the result.
   */
  public static BackingArray concatenate(List<BackingArray> arrays, int axis) {
    return join(arrays, axis, false);
  }

  private static BackingArray join(List<BackingArray> arrays, int axis, boolean stack) {
    if (arrays.isEmpty()) {
      throw new IllegalArgumentException(" Cannot join an empty list of arrays.");
    }
    boolean anyLazy = arrays.stream().anyMatch(BackingArray::isLazy);
    if (anyLazy) {
      List<LazyArray> lazyArrays = new ArrayList<>(arrays.size());
      for (BackingArray a : arrays) {
        lazyArrays.add(a.isLazy() ? a.lazy : LazyArray.fromArray(a.eager,
            Chunks.single(a.eager.getShape())));
      }
      return of(stack ? LazyArray.stack(lazyArrays, axis)
          : LazyArray.concatenate(lazyArrays, axis));
    }
    List<ArrayData> eagerArrays = new ArrayList<>(arrays.size());
    for (BackingArray a : arrays) {
      eagerArrays.add(a.eager);
    }
    return of(stack ? ArrayData.stack(eagerArrays, axis)
        : ArrayData.concatenate(eagerArrays, axis));
  }

  @Override
  public String toString() {
    return format("BackingArray(%s)", isLazy() ? lazy : eager);
  }
}
