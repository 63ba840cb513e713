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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import msx.array.axes.AxisMetadata;
import msx.array.axes.UnknownAxis;
import msx.array.ensemble.ArrayObjectTransform;
import msx.array.ensemble.EnsembleBuilder;
import msx.array.lazy.LazyArray;
import org.apache.commons.lang3.ArrayUtils;

/**
 * An n-dimensional array whose leading axes form an ensemble (for example frozen phonon
 * configurations, scan positions or tilts) and whose trailing base axes hold a single item (for
 * example a 2D wave function). Every ensemble axis carries {@link AxisMetadata}; scalar metadata
 * (energy, normalization, ...) is carried alongside.
 *
 * <p>Storage may be eager or lazy. Structural operations return new objects and stay lazy when the
 * input is lazy. {@link #compute(ComputeSettings)} materializes lazy storage in place.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class ArrayObject {

  private static final Logger logger = Logger.getLogger(ArrayObject.class.getName());

  private BackingArray array;
  private final int baseDims;
  private final List<AxisMetadata> ensembleAxesMetadata;
  private final Map<String, Object> metadata;
  private final Device device;

  /**
   * Constructor for ArrayObject.
   *
   * @param array                the storage.
   * @param baseDims             the number of base axes.
   * @param ensembleAxesMetadata metadata for each ensemble axis (null for unknown axes).
   * @param metadata             scalar metadata (may be null).
   * @param device               the device of the storage.
   */
  protected ArrayObject(BackingArray array, int baseDims,
      @Nullable List<AxisMetadata> ensembleAxesMetadata, @Nullable Map<String, Object> metadata,
      Device device) {
    device.checkAvailable();
    int rank = array.getRank();
    if (rank < baseDims) {
      throw new IllegalArgumentException(format(" An array of rank %d cannot have %d base axes.",
          rank, baseDims));
    }
    int ensembleDims = rank - baseDims;
    List<AxisMetadata> axes = new ArrayList<>(ensembleDims);
    if (ensembleAxesMetadata == null) {
      for (int i = 0; i < ensembleDims; i++) {
        axes.add(new UnknownAxis());
      }
    } else {
      if (ensembleAxesMetadata.size() != ensembleDims) {
        throw new IllegalArgumentException(format(
            " Found %d ensemble axis metadata entries for %d ensemble axes.",
            ensembleAxesMetadata.size(), ensembleDims));
      }
      for (AxisMetadata axis : ensembleAxesMetadata) {
        axes.add(axis == null ? new UnknownAxis() : axis);
      }
    }
    Map<String, Object> meta = new LinkedHashMap<>();
    if (metadata != null) {
      for (Map.Entry<String, Object> entry : metadata.entrySet()) {
        Object value = entry.getValue();
        if (!(value instanceof Number || value instanceof String || value instanceof Boolean)) {
          throw new IllegalArgumentException(
              format(" Unsupported metadata value %s for key %s.", value, entry.getKey()));
        }
        meta.put(entry.getKey(), value);
      }
    }
    this.array = array;
    this.baseDims = baseDims;
    this.ensembleAxesMetadata = Collections.unmodifiableList(axes);
    this.metadata = meta;
    this.device = device;
  }

  /**
   * The kind of this object.
   *
   * @return the type.
   */
  public abstract ArrayObjectType getType();

  /**
   * Metadata of the base axes.
   *
   * @return one entry per base axis.
   */
  public abstract List<AxisMetadata> getBaseAxesMetadata();

  /**
   * True if ensemble axes flagged for averaging are averaged by {@link #reduceEnsemble()}.
   *
   * @return false by default.
   */
  protected boolean isEnsembleMeanSupported() {
    return false;
  }

  /**
   * An object of the same kind with new storage and ensemble axis metadata.
   *
   * @param newArray      the storage.
   * @param ensembleAxes  metadata for the ensemble axes of the storage.
   * @return the new ArrayObject.
   */
  public ArrayObject withArray(BackingArray newArray, List<AxisMetadata> ensembleAxes) {
    List<AxisMetadata> axes = new ArrayList<>(ensembleAxes);
    axes.addAll(getBaseAxesMetadata());
    return getType().create(newArray, axes, metadata, device);
  }

  /**
   * The storage.
   *
   * @return the storage.
   */
  public BackingArray getBackingArray() {
    return array;
  }

  /**
   * The eager array.
   *
   * @return the array.
   * @throws IllegalStateException if this object is lazy.
   */
  public ArrayData getArray() {
    return array.getArray();
  }

  /**
   * The lazy array.
   *
   * @return the lazy array.
   * @throws IllegalStateException if this object is eager.
   */
  public LazyArray getLazyArray() {
    return array.getLazyArray();
  }

  public boolean isLazy() {
    return array.isLazy();
  }

  public Device getDevice() {
    return device;
  }

  public DataType getDataType() {
    return array.getDataType();
  }

  public int[] getShape() {
    return array.getShape();
  }

  public int getBaseDims() {
    return baseDims;
  }

  public int getEnsembleDims() {
    return array.getRank() - baseDims;
  }

  public int[] getEnsembleShape() {
    return Arrays.copyOfRange(getShape(), 0, getEnsembleDims());
  }

  public int[] getBaseShape() {
    int[] shape = getShape();
    return Arrays.copyOfRange(shape, shape.length - baseDims, shape.length);
  }

  public List<AxisMetadata> getEnsembleAxesMetadata() {
    return ensembleAxesMetadata;
  }

  /**
   * Metadata of every axis: ensemble axes followed by base axes.
   *
   * @return the axis metadata.
   */
  public List<AxisMetadata> getAxesMetadata() {
    List<AxisMetadata> axes = new ArrayList<>(ensembleAxesMetadata);
    axes.addAll(getBaseAxesMetadata());
    return axes;
  }

  /**
   * Scalar metadata.
   *
   * @return an unmodifiable view of the metadata.
   */
  public Map<String, Object> getMetadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /**
   * Index the ensemble axes. Single positions remove their axis.
   *
   * @param items indices for the leading ensemble axes.
   * @return the selection.
   */
  public ArrayObject get(Index... items) {
    return getItems(false, items);
  }

  /**
   * Index the ensemble axes.
   *
   * @param keepDims true to keep axes indexed by a single position (with length one).
   * @param items    indices for the leading ensemble axes.
   * @return the selection.
   */
  public ArrayObject getItems(boolean keepDims, Index... items) {
    int ensembleDims = getEnsembleDims();
    if (items.length > ensembleDims) {
      throw new IllegalArgumentException(format(
          " Indexing of base axes is not supported (%d indices for %d ensemble axes).",
          items.length, ensembleDims));
    }
    int[] shape = getShape();
    Index[] indices = items.clone();
    List<AxisMetadata> axes = new ArrayList<>();
    for (int i = 0; i < ensembleDims; i++) {
      AxisMetadata axis = ensembleAxesMetadata.get(i);
      if (i >= indices.length) {
        axes.add(axis);
        continue;
      }
      if (keepDims) {
        indices[i] = indices[i].keepDims();
      }
      int start = indices[i].getStart(shape[i]);
      int stop = indices[i].getStop(shape[i]);
      if (!indices[i].isSingle()) {
        axes.add(axis.select(start, stop));
      }
    }
    return withArray(array.getItems(indices), axes);
  }

  /**
   * Insert new ensemble axes of length one.
   *
   * @param axes         positions of the new axes among the output ensemble axes.
   * @param axesMetadata metadata of the new axes (null for unknown axes).
   * @return the expanded object.
   */
  public ArrayObject expandDims(int[] axes, List<AxisMetadata> axesMetadata) {
    int ensembleDims = getEnsembleDims() + axes.length;
    if (axesMetadata != null && axesMetadata.size() != axes.length) {
      throw new IllegalArgumentException(" One metadata entry is required per new axis.");
    }
    int[] sorted = axes.clone();
    for (int i = 0; i < sorted.length; i++) {
      if (sorted[i] < 0) {
        sorted[i] += ensembleDims;
      }
      if (sorted[i] < 0 || sorted[i] >= ensembleDims) {
        throw new IllegalArgumentException(format(" Invalid ensemble axis %d.", axes[i]));
      }
    }
    AxisMetadata[] newAxes = new AxisMetadata[ensembleDims];
    for (int i = 0; i < sorted.length; i++) {
      newAxes[sorted[i]] = axesMetadata == null || axesMetadata.get(i) == null
          ? new UnknownAxis() : axesMetadata.get(i);
    }
    int j = 0;
    for (int i = 0; i < ensembleDims; i++) {
      if (newAxes[i] == null) {
        newAxes[i] = ensembleAxesMetadata.get(j++);
      }
    }
    return withArray(array.expandDims(sorted), Arrays.asList(newAxes));
  }

  /**
   * Remove every ensemble axis of length one whose metadata allows it.
   *
   * @return the squeezed object.
   */
  public ArrayObject squeeze() {
    int[] shape = getShape();
    List<Integer> axes = new ArrayList<>();
    for (int i = 0; i < getEnsembleDims(); i++) {
      if (shape[i] == 1 && ensembleAxesMetadata.get(i).isSqueeze()) {
        axes.add(i);
      }
    }
    if (axes.isEmpty()) {
      return this;
    }
    return squeeze(axes.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Remove the given ensemble axes, which must have length one.
   *
   * @param axes the ensemble axes.
   * @return the squeezed object.
   */
  public ArrayObject squeeze(int... axes) {
    int ensembleDims = getEnsembleDims();
    int[] shape = getShape();
    boolean[] remove = new boolean[ensembleDims];
    for (int a : axes) {
      int axis = a < 0 ? a + ensembleDims : a;
      if (axis < 0 || axis >= ensembleDims) {
        throw new IllegalArgumentException(format(" Invalid ensemble axis %d.", a));
      }
      if (shape[axis] != 1) {
        throw new IllegalArgumentException(
            format(" Cannot squeeze ensemble axis %d of length %d.", a, shape[axis]));
      }
      remove[axis] = true;
    }
    List<AxisMetadata> kept = new ArrayList<>();
    List<Integer> removed = new ArrayList<>();
    for (int i = 0; i < ensembleDims; i++) {
      if (remove[i]) {
        removed.add(i);
      } else {
        kept.add(ensembleAxesMetadata.get(i));
      }
    }
    return withArray(array.squeeze(removed.stream().mapToInt(Integer::intValue).toArray()), kept);
  }

  /**
   * Average over ensemble axes flagged for averaging (for kinds that support it), then remove
   * squeezable axes of length one.
   *
   * @return the reduced object.
   */
  public ArrayObject reduceEnsemble() {
    ArrayObject reduced = this;
    if (isEnsembleMeanSupported()) {
      for (int i = getEnsembleDims() - 1; i >= 0; i--) {
        if (ensembleAxesMetadata.get(i).isEnsembleMean()) {
          reduced = reduced.ensembleMean(i);
        }
      }
    }
    return reduced.squeeze();
  }

  private ArrayObject ensembleMean(int axis) {
    BackingArray mean = array.isLazy() ? BackingArray.of(array.getLazyArray().mean(axis))
        : BackingArray.of(array.getArray().mean(axis));
    List<AxisMetadata> axes = new ArrayList<>(ensembleAxesMetadata);
    axes.remove(axis);
    return withArray(mean, axes);
  }

  /**
   * Stack objects of the same kind and shape along a new ensemble axis.
   *
   * @param objects      the objects.
   * @param axisMetadata metadata of the new axis (null for an unknown axis).
   * @param axis         position of the new axis among the ensemble axes.
   * @return the stacked object.
   */
  public static ArrayObject stack(List<? extends ArrayObject> objects, AxisMetadata axisMetadata,
      int axis) {
    ArrayObject first = checkJoinable(objects);
    int ensembleDims = first.getEnsembleDims() + 1;
    int a = axis < 0 ? axis + ensembleDims : axis;
    if (a < 0 || a >= ensembleDims) {
      throw new IllegalArgumentException(format(" Invalid ensemble axis %d.", axis));
    }
    List<BackingArray> arrays = new ArrayList<>();
    for (ArrayObject o : objects) {
      if (!Arrays.equals(first.getShape(), o.getShape())) {
        throw new IllegalArgumentException(format(" Cannot stack shapes %s and %s.",
            Arrays.toString(first.getShape()), Arrays.toString(o.getShape())));
      }
      arrays.add(o.array);
    }
    List<AxisMetadata> axes = new ArrayList<>(first.ensembleAxesMetadata);
    axes.add(a, axisMetadata == null ? new UnknownAxis() : axisMetadata);
    return first.withArray(BackingArray.stack(arrays, a), axes);
  }

  /**
   * Concatenate objects of the same kind along an existing ensemble axis.
   *
   * @param objects the objects.
   * @param axis    the ensemble axis.
   * @return the concatenated object.
   */
  public static ArrayObject concatenate(List<? extends ArrayObject> objects, int axis) {
    ArrayObject first = checkJoinable(objects);
    int ensembleDims = first.getEnsembleDims();
    int a = axis < 0 ? axis + ensembleDims : axis;
    if (a < 0 || a >= ensembleDims) {
      throw new IllegalArgumentException(format(" Invalid ensemble axis %d.", axis));
    }
    int[] shape = first.getShape();
    AxisMetadata joined = first.ensembleAxesMetadata.get(a);
    List<BackingArray> arrays = new ArrayList<>();
    for (int k = 0; k < objects.size(); k++) {
      ArrayObject o = objects.get(k);
      int[] s = o.getShape();
      if (s.length != shape.length) {
        throw new IllegalArgumentException(" Cannot concatenate objects of different rank.");
      }
      for (int i = 0; i < shape.length; i++) {
        if (i != a && s[i] != shape[i]) {
          throw new IllegalArgumentException(format(" Cannot concatenate shapes %s and %s.",
              Arrays.toString(shape), Arrays.toString(s)));
        }
      }
      if (k > 0) {
        joined = joined.concatenate(o.ensembleAxesMetadata.get(a));
      }
      arrays.add(o.array);
    }
    List<AxisMetadata> axes = new ArrayList<>(first.ensembleAxesMetadata);
    axes.set(a, joined);
    return first.withArray(BackingArray.concatenate(arrays, a), axes);
  }

  private static ArrayObject checkJoinable(List<? extends ArrayObject> objects) {
    if (objects == null || objects.isEmpty()) {
      throw new IllegalArgumentException(" At least one object is required.");
    }
    ArrayObject first = objects.get(0);
    for (ArrayObject o : objects) {
      if (!o.getType().getTag().equals(first.getType().getTag())) {
        throw new IllegalArgumentException(format(" Cannot join %s with %s.",
            first.getType().getTag(), o.getType().getTag()));
      }
      if (o.baseDims != first.baseDims
          || !Arrays.equals(o.getBaseShape(), first.getBaseShape())) {
        throw new IllegalArgumentException(" Cannot join objects with different base shapes.");
      }
    }
    return first;
  }

  /**
   * Lazy storage with automatic ensemble chunks and single-chunk base axes. Lazy objects are
   * returned unchanged.
   *
   * @param settings the compute settings (chunk size limit).
   * @return a lazy object.
   */
  public ArrayObject ensureLazy(ComputeSettings settings) {
    if (isLazy()) {
      return this;
    }
    int[] requested = new int[getShape().length];
    Arrays.fill(requested, 0, getEnsembleDims(), Chunks.AUTO);
    Arrays.fill(requested, getEnsembleDims(), requested.length, Chunks.FULL);
    int[][] chunks = Chunks.validate(getShape(), requested, settings.getChunkSize(),
        getDataType().getItemSize());
    return withArray(array.toLazy(chunks), ensembleAxesMetadata);
  }

  /**
   * Change the chunks of the ensemble axes. Base axes always form a single chunk.
   *
   * @param settings       the compute settings (chunk size limit).
   * @param ensembleChunks requested chunk size per ensemble axis (explicit, AUTO or FULL).
   * @return a lazy object with the new chunks.
   */
  public ArrayObject rechunk(ComputeSettings settings, int... ensembleChunks) {
    if (ensembleChunks.length != getEnsembleDims()) {
      throw new IllegalArgumentException(" One chunk size is required per ensemble axis.");
    }
    int[] requested = ArrayUtils.addAll(ensembleChunks.clone(), fullChunks(baseDims));
    int[][] chunks = Chunks.validate(getShape(), requested, settings.getChunkSize(),
        getDataType().getItemSize());
    return withArray(array.toLazy(chunks), ensembleAxesMetadata);
  }

  private static int[] fullChunks(int n) {
    int[] full = new int[n];
    Arrays.fill(full, Chunks.FULL);
    return full;
  }

  /**
   * Materialize lazy storage with the default settings.
   *
   * @return this object.
   */
  public ArrayObject compute() {
    return compute(ComputeSettings.defaults());
  }

  /**
   * Materialize lazy storage in place. Eager objects are returned unchanged.
   *
   * @param settings the compute settings.
   * @return this object.
   */
  public ArrayObject compute(ComputeSettings settings) {
    if (isLazy()) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Computing %s of shape %s.", getType().getTag(),
            Arrays.toString(getShape())));
      }
      array = array.compute(settings);
    }
    return this;
  }

  /**
   * Replace lazy storage with its computed result.
   *
   * @param computed the computed array.
   */
  void setComputed(ArrayData computed) {
    if (!Arrays.equals(computed.getShape(), getShape())) {
      throw new IllegalArgumentException(" The computed array does not match the lazy shape.");
    }
    array = BackingArray.of(computed);
  }

  /**
   * A copy on another device.
   *
   * @param target the device.
   * @return this object if already on the device, otherwise a copy.
   */
  public ArrayObject copyToDevice(Device target) {
    target.checkAvailable();
    if (target == device) {
      return this;
    }
    List<AxisMetadata> axes = getAxesMetadata();
    BackingArray copy = isLazy() ? array : BackingArray.of(array.getArray().copy());
    return getType().create(copy, axes, metadata, target);
  }

  /**
   * Apply a transform to this object. The result is lazy if this object is lazy or the settings ask
   * for lazy results.
   *
   * @param transform the transform.
   * @param settings  the compute settings.
   * @return the outputs of the transform.
   */
  public ComputableList<ArrayObject> applyTransform(ArrayObjectTransform transform,
      ComputeSettings settings) {
    return EnsembleBuilder.applyTransform(this, transform, settings);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ArrayObject)) {
      return false;
    }
    ArrayObject other = (ArrayObject) o;
    if (!getType().getTag().equals(other.getType().getTag()) || device != other.device
        || !getAxesMetadata().equals(other.getAxesMetadata())
        || !metadata.equals(other.metadata)) {
      return false;
    }
    if (isLazy() || other.isLazy()) {
      return isLazy() && other.isLazy() && getLazyArray() == other.getLazyArray();
    }
    return getArray().equals(other.getArray());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getType().getTag(), Arrays.hashCode(getShape()), metadata);
  }

  @Override
  public String toString() {
    return format("%s(%s, shape=%s, lazy=%b)", getClass().getSimpleName(), getDataType(),
        Arrays.toString(getShape()), isLazy());
  }
}
