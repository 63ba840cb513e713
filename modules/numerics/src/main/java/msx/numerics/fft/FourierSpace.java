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
package msx.numerics.fft;

import static msx.numerics.math.ScalarMath.mod;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static helpers for stacks of 2D planes held in flat double arrays.
 *
 * <p>A stack of nPlanes complex planes of shape [nX, nY] is stored interleaved and row-major, plane
 * after plane. A stack of real planes uses one double per point in the same order.
 *
 * <p>Conventions follow the common discrete Fourier transform definitions: the forward transform
 * is not scaled and the inverse transform is scaled by 1 / (nX * nY).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FourierSpace {

  /** Shared transforms, keyed by the plane shape. */
  private static final Map<Long, Complex2D> transforms = new ConcurrentHashMap<>();

  private FourierSpace() {
  }

  /**
   * Return a (cached) 2D transform for planes of shape [nX, nY].
   *
   * @param nX the X-dimension.
   * @param nY the Y-dimension.
   * @return a Complex2D instance.
   */
  public static Complex2D getComplex2D(int nX, int nY) {
    long key = ((long) nX << 32) | (nY & 0xffffffffL);
    return transforms.computeIfAbsent(key, k -> new Complex2D(nX, nY));
  }

  /**
   * Forward FFT of every complex plane of a stack, in place.
   *
   * @param data    interleaved complex data of length 2 * nPlanes * nX * nY.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   */
  public static void fft2(double[] data, int nPlanes, int nX, int nY) {
    Complex2D complex2D = getComplex2D(nX, nY);
    int planeSize = 2 * nX * nY;
    for (int p = 0; p < nPlanes; p++) {
      complex2D.fft(data, p * planeSize);
    }
  }

  /**
   * Normalized inverse FFT of every complex plane of a stack, in place.
   *
   * @param data    interleaved complex data of length 2 * nPlanes * nX * nY.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   */
  public static void ifft2(double[] data, int nPlanes, int nX, int nY) {
    Complex2D complex2D = getComplex2D(nX, nY);
    int planeSize = 2 * nX * nY;
    double scale = 1.0 / (nX * (double) nY);
    for (int p = 0; p < nPlanes; p++) {
      int offset = p * planeSize;
      complex2D.ifft(data, offset);
      for (int i = offset; i < offset + planeSize; i++) {
        data[i] *= scale;
      }
    }
  }

  /**
   * Convolve every complex plane of a stack with a kernel given in Fourier space, in place.
   *
   * @param data         interleaved complex data.
   * @param nPlanes      the number of planes.
   * @param nX           the X-dimension.
   * @param nY           the Y-dimension.
   * @param kernelRe     real part of the Fourier space kernel (nX * nY values).
   * @param kernelIm     imaginary part of the Fourier space kernel (nX * nY values, may be null).
   */
  public static void fft2Convolve(double[] data, int nPlanes, int nX, int nY, double[] kernelRe,
      double[] kernelIm) {
    fft2(data, nPlanes, nX, nY);
    multiply(data, nPlanes, nX * nY, kernelRe, kernelIm);
    ifft2(data, nPlanes, nX, nY);
  }

  /**
   * Multiply every complex plane of a stack by a complex kernel, in place.
   *
   * @param data      interleaved complex data.
   * @param nPlanes   the number of planes.
   * @param planeSize number of points per plane.
   * @param kernelRe  real part of the kernel.
   * @param kernelIm  imaginary part of the kernel (may be null for a real kernel).
   */
  public static void multiply(double[] data, int nPlanes, int planeSize, double[] kernelRe,
      double[] kernelIm) {
    for (int p = 0; p < nPlanes; p++) {
      int offset = 2 * p * planeSize;
      for (int i = 0; i < planeSize; i++) {
        int index = offset + 2 * i;
        double re = data[index];
        double im = data[index + 1];
        double kr = kernelRe[i];
        double ki = kernelIm == null ? 0.0 : kernelIm[i];
        data[index] = re * kr - im * ki;
        data[index + 1] = re * ki + im * kr;
      }
    }
  }

  /**
   * Sample frequencies of a discrete Fourier transform of length n with spacing d.
   *
   * @param n the number of samples.
   * @param d the sample spacing.
   * @return the frequencies [0, 1, ..., (n-1)/2, -n/2, ..., -1] / (n d).
   */
  public static double[] fftfreq(int n, double d) {
    double[] freq = new double[n];
    double scale = 1.0 / (n * d);
    int positive = (n - 1) / 2 + 1;
    for (int i = 0; i < positive; i++) {
      freq[i] = i * scale;
    }
    for (int i = positive; i < n; i++) {
      freq[i] = (i - n) * scale;
    }
    return freq;
  }

  /**
   * Move the zero-frequency component of every real plane of a stack to the center.
   *
   * @param data    real data.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   * @return a new shifted array.
   */
  public static double[] fftShiftReal(double[] data, int nPlanes, int nX, int nY) {
    return shift(data, nPlanes, nX, nY, 1, nX / 2, nY / 2);
  }

  /**
   * Move the zero-frequency component of every complex plane of a stack to the center.
   *
   * @param data    interleaved complex data.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   * @return a new shifted array.
   */
  public static double[] fftShiftComplex(double[] data, int nPlanes, int nX, int nY) {
    return shift(data, nPlanes, nX, nY, 2, nX / 2, nY / 2);
  }

  /**
   * Undo {@link #fftShiftReal(double[], int, int, int)}.
   *
   * @param data    real data.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   * @return a new shifted array.
   */
  public static double[] ifftShiftReal(double[] data, int nPlanes, int nX, int nY) {
    return shift(data, nPlanes, nX, nY, 1, -(nX / 2), -(nY / 2));
  }

  private static double[] shift(double[] data, int nPlanes, int nX, int nY, int width, int sx,
      int sy) {
    double[] out = new double[data.length];
    int planeSize = width * nX * nY;
    for (int p = 0; p < nPlanes; p++) {
      int offset = p * planeSize;
      for (int x = 0; x < nX; x++) {
        int tx = mod(x + sx, nX);
        for (int y = 0; y < nY; y++) {
          int ty = mod(y + sy, nY);
          int from = offset + width * (x * nY + y);
          int to = offset + width * (tx * nY + ty);
          System.arraycopy(data, from, out, to, width);
        }
      }
    }
    return out;
  }

  /**
   * Crop (or zero pad) every complex plane of a stack in Fourier space, keeping the lowest
   * frequencies. The zero frequency stays at index [0, 0].
   *
   * @param data    interleaved complex data.
   * @param nPlanes the number of planes.
   * @param nX      the X-dimension.
   * @param nY      the Y-dimension.
   * @param newX    the new X-dimension.
   * @param newY    the new Y-dimension.
   * @return a new array of length 2 * nPlanes * newX * newY.
   */
  public static double[] fftCrop(double[] data, int nPlanes, int nX, int nY, int newX,
      int newY) {
    int[] mapX = frequencyMap(nX, newX);
    int[] mapY = frequencyMap(nY, newY);
    double[] out = new double[2 * nPlanes * newX * newY];
    for (int p = 0; p < nPlanes; p++) {
      int inOffset = 2 * p * nX * nY;
      int outOffset = 2 * p * newX * newY;
      for (int x = 0; x < newX; x++) {
        if (mapX[x] < 0) {
          continue;
        }
        for (int y = 0; y < newY; y++) {
          if (mapY[y] < 0) {
            continue;
          }
          int from = inOffset + 2 * (mapX[x] * nY + mapY[y]);
          int to = outOffset + 2 * (x * newY + y);
          out[to] = data[from];
          out[to + 1] = data[from + 1];
        }
      }
    }
    return out;
  }

  /**
   * For each index of the new axis, the index of the same frequency in the old axis (-1 if the
   * frequency is not present).
   */
  private static int[] frequencyMap(int n, int newN) {
    int[] map = new int[newN];
    int maxPositive = (n - 1) / 2;
    int maxNegative = n / 2;
    for (int i = 0; i < newN; i++) {
      int f = i < (newN + 1) / 2 ? i : i - newN;
      if (f > maxPositive || -f > maxNegative) {
        map[i] = -1;
      } else {
        map[i] = mod(f, n);
      }
    }
    return map;
  }
}
