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
import static java.lang.System.arraycopy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A dense, row-major, n-dimensional array of real or complex doubles.
 *
 * <p>Complex data is interleaved (real, imaginary). An ArrayData handle owns its buffer; operations
 * that mutate the buffer in place (for example an in-place FFT) must first take ownership with
 * {@link #transferOwnership()}, which invalidates the original handle so that the old view can no
 * longer be read.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ArrayData {

  private final DataType dtype;
  private final int[] shape;
  private double[] data;

  private ArrayData(DataType dtype, double[] data, int[] shape) {
    long size = product(shape);
    if (size * dtype.getWidth() != data.length) {
      throw new IllegalArgumentException(
          format(" A buffer of length %d does not match shape %s with type %s.", data.length,
              Arrays.toString(shape), dtype));
    }
    for (int n : shape) {
      if (n < 0) {
        throw new IllegalArgumentException(format(" Negative dimension in shape %s.",
            Arrays.toString(shape)));
      }
    }
    this.dtype = dtype;
    this.shape = shape.clone();
    this.data = data;
  }

  /**
   * An array of zeros.
   *
   * @param dtype the element type.
   * @param shape the shape.
   * @return a new ArrayData.
   */
  public static ArrayData zeros(DataType dtype, int... shape) {
    return new ArrayData(dtype, new double[Math.toIntExact(product(shape) * dtype.getWidth())],
        shape);
  }

  /**
   * An array filled with a constant value.
   *
   * @param dtype the element type.
   * @param re    the real part.
   * @param im    the imaginary part (ignored for real data).
   * @param shape the shape.
   * @return a new ArrayData.
   */
  public static ArrayData full(DataType dtype, double re, double im, int... shape) {
    ArrayData a = zeros(dtype, shape);
    double[] d = a.data;
    if (dtype.isComplex()) {
      for (int i = 0; i < d.length; i += 2) {
        d[i] = re;
        d[i + 1] = im;
      }
    } else {
      Arrays.fill(d, re);
    }
    return a;
  }

  /**
   * Wrap an existing buffer without copying. The caller transfers ownership of the buffer.
   *
   * @param dtype the element type.
   * @param data  the buffer.
   * @param shape the shape.
   * @return a new ArrayData.
   */
  public static ArrayData wrap(DataType dtype, double[] data, int... shape) {
    return new ArrayData(dtype, data, shape);
  }

  /**
   * The product of the entries of a shape.
   *
   * @param shape the shape.
   * @return the number of elements.
   */
  public static long product(int[] shape) {
    long p = 1;
    for (int n : shape) {
      p *= n;
    }
    return p;
  }

  /**
   * Row-major element strides of a shape.
   *
   * @param shape the shape.
   * @return the strides (in elements).
   */
  public static int[] strides(int[] shape) {
    int[] strides = new int[shape.length];
    int s = 1;
    for (int i = shape.length - 1; i >= 0; i--) {
      strides[i] = s;
      s *= shape[i];
    }
    return strides;
  }

  public DataType getDataType() {
    return dtype;
  }

  public int[] getShape() {
    return shape.clone();
  }

  public int getRank() {
    return shape.length;
  }

  /**
   * The number of elements.
   *
   * @return the element count.
   */
  public int getSize() {
    return (int) product(shape);
  }

  /**
   * The size of the buffer in bytes.
   *
   * @return the byte count.
   */
  public long getNBytes() {
    return product(shape) * dtype.getItemSize();
  }

  /**
   * Direct access to the underlying buffer.
   *
   * @return the buffer.
   * @throws IllegalStateException if ownership of the buffer has been transferred.
   */
  public double[] getData() {
    checkValid();
    return data;
  }

  /**
   * True until ownership of the buffer is transferred.
   *
   * @return true if this handle can be read.
   */
  public boolean isValid() {
    return data != null;
  }

  /**
   * Transfer ownership of the buffer to a new handle. This handle is invalidated.
   *
   * @return a new handle that owns the buffer.
   */
  public ArrayData transferOwnership() {
    checkValid();
    ArrayData owner = new ArrayData(dtype, data, shape);
    data = null;
    return owner;
  }

  /**
   * A deep copy.
   *
   * @return a new ArrayData.
   */
  public ArrayData copy() {
    checkValid();
    return new ArrayData(dtype, data.clone(), shape);
  }

  /**
   * Real element i (or the real part of complex element i).
   *
   * @param i flat element index.
   * @return the value.
   */
  public double getReal(int i) {
    checkValid();
    return data[i * dtype.getWidth()];
  }

  /**
   * Imaginary part of element i (zero for real data).
   *
   * @param i flat element index.
   * @return the value.
   */
  public double getImaginary(int i) {
    checkValid();
    return dtype.isComplex() ? data[2 * i + 1] : 0.0;
  }

  /**
   * Flat element index of a multi-index.
   *
   * @param index the multi-index.
   * @return the flat index.
   */
  public int flatIndex(int... index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException(
          format(" Index of rank %d for an array of rank %d.", index.length, shape.length));
    }
    int[] strides = strides(shape);
    int flat = 0;
    for (int i = 0; i < index.length; i++) {
      if (index[i] < 0 || index[i] >= shape[i]) {
        throw new IndexOutOfBoundsException(
            format(" Index %s out of bounds for shape %s.", Arrays.toString(index),
                Arrays.toString(shape)));
      }
      flat += index[i] * strides[i];
    }
    return flat;
  }

  /**
   * A copy with a new shape of the same size.
   *
   * @param newShape the new shape.
   * @return a new ArrayData.
   */
  public ArrayData reshape(int... newShape) {
    checkValid();
    if (product(newShape) != product(shape)) {
      throw new IllegalArgumentException(format(" Cannot reshape %s into %s.",
          Arrays.toString(shape), Arrays.toString(newShape)));
    }
    return new ArrayData(dtype, data.clone(), newShape);
  }

  /**
   * Index the leading axes. Single positions remove their axis; ranges keep it.
   *
   * @param items indices for the leading axes.
   * @return a new ArrayData.
   */
  public ArrayData getItems(Index... items) {
    if (items.length > shape.length) {
      throw new IllegalArgumentException(
          format(" Too many indices (%d) for an array of rank %d.", items.length, shape.length));
    }
    int[] start = new int[shape.length];
    int[] stop = shape.clone();
    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < shape.length; i++) {
      if (i < items.length) {
        start[i] = items[i].getStart(shape[i]);
        stop[i] = items[i].getStop(shape[i]);
        if (!items[i].isSingle()) {
          kept.add(stop[i] - start[i]);
        }
      } else {
        kept.add(shape[i]);
      }
    }
    ArrayData region = region(start, stop);
    int[] newShape = kept.stream().mapToInt(Integer::intValue).toArray();
    return new ArrayData(dtype, region.data, newShape);
  }

  /**
   * Copy the hyper-rectangle [start, stop).
   *
   * @param start first index along each axis.
   * @param stop  end index (exclusive) along each axis.
   * @return a new ArrayData.
   */
  public ArrayData region(int[] start, int[] stop) {
    checkValid();
    checkRank(start.length);
    checkRank(stop.length);
    int[] count = new int[shape.length];
    for (int i = 0; i < shape.length; i++) {
      if (start[i] < 0 || stop[i] > shape[i] || stop[i] < start[i]) {
        throw new IndexOutOfBoundsException(format(" Region %s:%s is outside of shape %s.",
            Arrays.toString(start), Arrays.toString(stop), Arrays.toString(shape)));
      }
      count[i] = stop[i] - start[i];
    }
    ArrayData out = zeros(dtype, count);
    copy(data, shape, start, out.data, count, new int[count.length], count, dtype.getWidth());
    return out;
  }

  /**
   * Copy a block into this array starting at the given position. Distinct regions may be written
   * concurrently.
   *
   * @param start the position of the block.
   * @param block the block.
   */
  public void setRegion(int[] start, ArrayData block) {
    checkValid();
    checkRank(start.length);
    block.checkRank(shape.length);
    if (block.dtype != dtype) {
      throw new IllegalArgumentException(
          format(" Cannot write %s data into a %s array.", block.dtype, dtype));
    }
    for (int i = 0; i < shape.length; i++) {
      if (start[i] < 0 || start[i] + block.shape[i] > shape[i]) {
        throw new IndexOutOfBoundsException(format(" Block %s at %s is outside of shape %s.",
            Arrays.toString(block.shape), Arrays.toString(start), Arrays.toString(shape)));
      }
    }
    copy(block.getData(), block.shape, new int[shape.length], data, shape, start, block.shape,
        dtype.getWidth());
  }

  /**
   * Insert new axes of length one. Axis positions refer to the output array.
   *
   * @param axes the positions of the new axes.
   * @return a new ArrayData.
   */
  public ArrayData expandDims(int... axes) {
    return reshape(expandShape(shape, axes));
  }

  /**
   * Remove axes of length one.
   *
   * @param axes the axes to remove.
   * @return a new ArrayData.
   */
  public ArrayData squeeze(int... axes) {
    return reshape(squeezeShape(shape, axes));
  }

  /**
   * The shape that results from inserting axes of length one.
   *
   * @param shape the input shape.
   * @param axes  the new axis positions in the output.
   * @return the output shape.
   */
  public static int[] expandShape(int[] shape, int... axes) {
    int rank = shape.length + axes.length;
    boolean[] isNew = new boolean[rank];
    for (int a : axes) {
      int axis = a < 0 ? a + rank : a;
      if (axis < 0 || axis >= rank || isNew[axis]) {
        throw new IllegalArgumentException(format(" Invalid new axis %d for rank %d.", a, rank));
      }
      isNew[axis] = true;
    }
    int[] out = new int[rank];
    int j = 0;
    for (int i = 0; i < rank; i++) {
      out[i] = isNew[i] ? 1 : shape[j++];
    }
    return out;
  }

  /**
   * The shape that results from removing axes of length one.
   *
   * @param shape the input shape.
   * @param axes  the axes to remove.
   * @return the output shape.
   */
  public static int[] squeezeShape(int[] shape, int... axes) {
    boolean[] remove = new boolean[shape.length];
    for (int a : axes) {
      int axis = a < 0 ? a + shape.length : a;
      if (axis < 0 || axis >= shape.length) {
        throw new IllegalArgumentException(
            format(" Invalid axis %d for rank %d.", a, shape.length));
      }
      if (shape[axis] != 1) {
        throw new IllegalArgumentException(
            format(" Cannot squeeze axis %d of length %d.", a, shape[axis]));
      }
      remove[axis] = true;
    }
    int count = 0;
    for (boolean r : remove) {
      if (!r) {
        count++;
      }
    }
    int[] out = new int[count];
    int j = 0;
    for (int i = 0; i < shape.length; i++) {
      if (!remove[i]) {
        out[j++] = shape[i];
      }
    }
    return out;
  }

  /**
   * Stack arrays of equal shape along a new axis.
   *
   * @param arrays the arrays.
   * @param axis   the position of the new axis.
   * @return a new ArrayData.
   */
  public static ArrayData stack(List<ArrayData> arrays, int axis) {
    if (arrays.isEmpty()) {
      throw new IllegalArgumentException(" Cannot stack an empty list of arrays.");
    }
    int[] first = arrays.get(0).shape;
    List<ArrayData> expanded = new ArrayList<>(arrays.size());
    for (ArrayData a : arrays) {
      if (!Arrays.equals(first, a.shape)) {
        throw new IllegalArgumentException(format(" Cannot stack shapes %s and %s.",
            Arrays.toString(first), Arrays.toString(a.shape)));
      }
      expanded.add(a.expandDims(axis));
    }
    int a = axis < 0 ? axis + first.length + 1 : axis;
    return concatenate(expanded, a);
  }

  /**
   * Concatenate arrays along an existing axis.
   *
   * @param arrays the arrays.
   * @param axis   the axis.
   * @return a new ArrayData.
   */
  public static ArrayData concatenate(List<ArrayData> arrays, int axis) {
    if (arrays.isEmpty()) {
      throw new IllegalArgumentException(" Cannot concatenate an empty list of arrays.");
    }
    ArrayData first = arrays.get(0);
    int rank = first.shape.length;
    int ax = axis < 0 ? axis + rank : axis;
    if (ax < 0 || ax >= rank) {
      throw new IllegalArgumentException(format(" Invalid axis %d for rank %d.", axis, rank));
    }
    int[] outShape = first.shape.clone();
    outShape[ax] = 0;
    for (ArrayData a : arrays) {
      if (a.shape.length != rank || a.dtype != first.dtype) {
        throw new IllegalArgumentException(" Cannot concatenate arrays of different rank or type.");
      }
      for (int i = 0; i < rank; i++) {
        if (i != ax && a.shape[i] != first.shape[i]) {
          throw new IllegalArgumentException(format(" Cannot concatenate shapes %s and %s.",
              Arrays.toString(first.shape), Arrays.toString(a.shape)));
        }
      }
      outShape[ax] += a.shape[ax];
    }
    ArrayData out = zeros(first.dtype, outShape);
    int[] start = new int[rank];
    for (ArrayData a : arrays) {
      out.setRegion(start, a);
      start[ax] += a.shape[ax];
    }
    return out;
  }

  /**
   * The real part as a FLOAT64 array.
   *
   * @return a new ArrayData.
   */
  public ArrayData real() {
    checkValid();
    if (!dtype.isComplex()) {
      return copy();
    }
    int n = getSize();
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = data[2 * i];
    }
    return new ArrayData(DataType.FLOAT64, out, shape);
  }

  /**
   * The squared modulus as a FLOAT64 array.
   *
   * @return a new ArrayData.
   */
  public ArrayData abs2() {
    checkValid();
    int n = getSize();
    double[] out = new double[n];
    if (dtype.isComplex()) {
      for (int i = 0; i < n; i++) {
        double re = data[2 * i];
        double im = data[2 * i + 1];
        out[i] = re * re + im * im;
      }
    } else {
      for (int i = 0; i < n; i++) {
        out[i] = data[i] * data[i];
      }
    }
    return new ArrayData(DataType.FLOAT64, out, shape);
  }

  /**
   * Sum over one axis.
   *
   * @param axis the axis.
   * @return a new ArrayData with the axis removed.
   */
  public ArrayData sum(int axis) {
    checkValid();
    int ax = axis < 0 ? axis + shape.length : axis;
    if (ax < 0 || ax >= shape.length) {
      throw new IllegalArgumentException(
          format(" Invalid axis %d for rank %d.", axis, shape.length));
    }
    int outer = (int) product(Arrays.copyOfRange(shape, 0, ax));
    int n = shape[ax];
    int inner = (int) product(Arrays.copyOfRange(shape, ax + 1, shape.length))
        * dtype.getWidth();
    int[] outShape = new int[shape.length - 1];
    arraycopy(shape, 0, outShape, 0, ax);
    arraycopy(shape, ax + 1, outShape, ax, shape.length - ax - 1);
    ArrayData out = zeros(dtype, outShape);
    for (int o = 0; o < outer; o++) {
      for (int k = 0; k < n; k++) {
        int src = (o * n + k) * inner;
        int dst = o * inner;
        for (int i = 0; i < inner; i++) {
          out.data[dst + i] += data[src + i];
        }
      }
    }
    return out;
  }

  /**
   * Mean over one axis.
   *
   * @param axis the axis.
   * @return a new ArrayData with the axis removed.
   */
  public ArrayData mean(int axis) {
    int ax = axis < 0 ? axis + shape.length : axis;
    int n = shape[ax];
    ArrayData sum = sum(axis);
    if (n > 0) {
      sum.scaleInPlace(1.0 / n);
    }
    return sum;
  }

  /**
   * Add another array of the same shape and type to this one in place.
   *
   * @param other the array to add.
   */
  public void addInPlace(ArrayData other) {
    checkValid();
    if (!Arrays.equals(shape, other.shape) || dtype != other.dtype) {
      throw new IllegalArgumentException(format(" Cannot add shape %s to shape %s.",
          Arrays.toString(other.shape), Arrays.toString(shape)));
    }
    double[] o = other.getData();
    for (int i = 0; i < data.length; i++) {
      data[i] += o[i];
    }
  }

  /**
   * Multiply every value by a constant in place.
   *
   * @param factor the scale factor.
   */
  public void scaleInPlace(double factor) {
    checkValid();
    for (int i = 0; i < data.length; i++) {
      data[i] *= factor;
    }
  }

  /**
   * Strided copy of a hyper-rectangle between two row-major buffers.
   */
  private static void copy(double[] src, int[] srcShape, int[] srcStart, double[] dst,
      int[] dstShape, int[] dstStart, int[] count, int width) {
    for (int c : count) {
      if (c == 0) {
        return;
      }
    }
    int rank = count.length;
    if (rank == 0) {
      arraycopy(src, 0, dst, 0, width);
      return;
    }
    int[] srcStrides = strides(srcShape);
    int[] dstStrides = strides(dstShape);
    int srcOffset = 0;
    int dstOffset = 0;
    for (int i = 0; i < rank; i++) {
      srcOffset += srcStart[i] * srcStrides[i];
      dstOffset += dstStart[i] * dstStrides[i];
    }
    copyAxis(0, src, srcStrides, srcOffset, dst, dstStrides, dstOffset, count, width);
  }

  private static void copyAxis(int axis, double[] src, int[] srcStrides, int srcOffset,
      double[] dst, int[] dstStrides, int dstOffset, int[] count, int width) {
    if (axis == count.length - 1) {
      arraycopy(src, srcOffset * width, dst, dstOffset * width, count[axis] * width);
      return;
    }
    for (int i = 0; i < count[axis]; i++) {
      copyAxis(axis + 1, src, srcStrides, srcOffset + i * srcStrides[axis], dst, dstStrides,
          dstOffset + i * dstStrides[axis], count, width);
    }
  }

  private void checkValid() {
    if (data == null) {
      throw new IllegalStateException(" The buffer of this array has been transferred.");
    }
  }

  private void checkRank(int rank) {
    if (rank != shape.length) {
      throw new IllegalArgumentException(
          format(" Expected rank %d but found rank %d.", shape.length, rank));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ArrayData other = (ArrayData) o;
    return dtype == other.dtype && Arrays.equals(shape, other.shape)
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * dtype.hashCode() + Arrays.hashCode(shape)) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return format("ArrayData(%s, %s)", dtype, Arrays.toString(shape));
  }
}
