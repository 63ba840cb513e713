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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Compute the FFT of complex, double precision data of arbitrary length n.
 *
 * <p>Power of two lengths are transformed directly by the radix-2 transform of Commons Math. Any
 * other length is re-expressed as a circular convolution of power of two length using Bluestein's
 * chirp-z algorithm.
 *
 * <p>The location of point i within the input array is: <br>
 * double real = data[offset + i * stride]<br>
 * double imag = data[offset + i * stride + 1]<br>
 * so that interleaved data use a stride of 2.
 *
 * <p>The forward transform uses the kernel exp(-2 pi i k n / N). The inverse transform uses
 * exp(+2 pi i k n / N) and is not normalized.
 *
 * @author Michael J. Schnieders
 * @see <a href="http://dx.doi.org/10.1109/TAU.1970.1162132" target="_blank"> L. Bluestein, A
 *     linear filtering approach to the computation of discrete Fourier transform, IEEE Transactions
 *     on Audio and Electroacoustics 18 (4), 451 (1970) </a>
 * @since 1.0
 */
public class Complex {

  private static final Logger logger = Logger.getLogger(Complex.class.getName());

  /** Number of complex numbers in the transform. */
  private final int n;
  /** True if n is a power of 2. */
  private final boolean powerOfTwo;
  /** Length of the Bluestein convolution (a power of 2 greater than or equal to 2n - 1). */
  private final int m;
  /** Real part of the chirp exp(i pi k^2 / n). */
  private final double[] chirpRe;
  /** Imaginary part of the chirp exp(i pi k^2 / n). */
  private final double[] chirpIm;
  /** Real part of the transformed, wrapped chirp. */
  private final double[] kernelRe;
  /** Imaginary part of the transformed, wrapped chirp. */
  private final double[] kernelIm;

  /**
   * Construct a Complex instance for data of length n.
   *
   * @param n Number of complex numbers (n &gt; 0).
   */
  public Complex(int n) {
    if (n < 1) {
      throw new IllegalArgumentException(" The FFT length must be positive: " + n);
    }
    this.n = n;
    powerOfTwo = ArithmeticUtils.isPowerOfTwo(n);
    if (powerOfTwo) {
      m = n;
      chirpRe = null;
      chirpIm = null;
      kernelRe = null;
      kernelIm = null;
      return;
    }

    int length = 1;
    while (length < 2 * n - 1) {
      length <<= 1;
    }
    m = length;
    chirpRe = new double[n];
    chirpIm = new double[n];
    long twoN = 2L * n;
    for (int k = 0; k < n; k++) {
      // Reduce k^2 modulo 2n to keep the phase accurate for long transforms.
      long k2 = ((long) k * (long) k) % twoN;
      double angle = PI * k2 / n;
      chirpRe[k] = cos(angle);
      chirpIm[k] = sin(angle);
    }
    double[][] kernel = new double[2][m];
    kernel[0][0] = chirpRe[0];
    kernel[1][0] = chirpIm[0];
    for (int k = 1; k < n; k++) {
      kernel[0][k] = chirpRe[k];
      kernel[1][k] = chirpIm[k];
      kernel[0][m - k] = chirpRe[k];
      kernel[1][m - k] = chirpIm[k];
    }
    FastFourierTransformer.transformInPlace(kernel, DftNormalization.STANDARD,
        TransformType.FORWARD);
    kernelRe = kernel[0];
    kernelIm = kernel[1];
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(String.format(" Bluestein FFT of length %d uses a convolution of length %d.",
          n, m));
    }
  }

  /**
   * Check if a length is handled without the Bluestein convolution.
   *
   * @param n the length.
   * @return true if n is a power of two.
   */
  public static boolean preferredDimension(int n) {
    return n > 0 && ArithmeticUtils.isPowerOfTwo(n);
  }

  /**
   * The transform length.
   *
   * @return the number of complex values transformed.
   */
  public int getN() {
    return n;
  }

  /**
   * Compute the forward Fourier transform of the input data in place.
   *
   * @param data   an array of double.
   * @param offset the offset to the first real value.
   * @param stride the increment between real values.
   */
  public void fft(double[] data, int offset, int stride) {
    double[] re = new double[m];
    double[] im = new double[m];
    gather(data, offset, stride, re, im);
    transform(re, im);
    scatter(data, offset, stride, re, im);
  }

  /**
   * Compute the (unnormalized) inverse Fourier transform of the input data in place.
   *
   * @param data   an array of double.
   * @param offset the offset to the first real value.
   * @param stride the increment between real values.
   */
  public void ifft(double[] data, int offset, int stride) {
    double[] re = new double[m];
    double[] im = new double[m];
    gather(data, offset, stride, re, im);
    // The inverse transform is the conjugate of the forward transform of the conjugate.
    for (int i = 0; i < n; i++) {
      im[i] = -im[i];
    }
    transform(re, im);
    for (int i = 0; i < n; i++) {
      im[i] = -im[i];
    }
    scatter(data, offset, stride, re, im);
  }

  private void gather(double[] data, int offset, int stride, double[] re, double[] im) {
    for (int i = 0, index = offset; i < n; i++, index += stride) {
      re[i] = data[index];
      im[i] = data[index + 1];
    }
  }

  private void scatter(double[] data, int offset, int stride, double[] re, double[] im) {
    for (int i = 0, index = offset; i < n; i++, index += stride) {
      data[index] = re[i];
      data[index + 1] = im[i];
    }
  }

  /**
   * Forward transform of the first n entries of re and im (both of length m).
   */
  private void transform(double[] re, double[] im) {
    if (n == 1) {
      return;
    }
    if (powerOfTwo) {
      FastFourierTransformer.transformInPlace(new double[][] {re, im},
          DftNormalization.STANDARD, TransformType.FORWARD);
      return;
    }

    // a_k = x_k * conj(w_k)
    for (int k = 0; k < n; k++) {
      double xr = re[k];
      double xi = im[k];
      re[k] = xr * chirpRe[k] + xi * chirpIm[k];
      im[k] = xi * chirpRe[k] - xr * chirpIm[k];
    }
    for (int k = n; k < m; k++) {
      re[k] = 0.0;
      im[k] = 0.0;
    }
    double[][] a = {re, im};
    FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.FORWARD);
    for (int k = 0; k < m; k++) {
      double ar = re[k];
      double ai = im[k];
      re[k] = ar * kernelRe[k] - ai * kernelIm[k];
      im[k] = ar * kernelIm[k] + ai * kernelRe[k];
    }
    // The standard inverse includes the 1/m factor of the circular convolution.
    FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.INVERSE);

    // X_k = (a * b)_k * conj(w_k)
    for (int k = 0; k < n; k++) {
      double cr = re[k];
      double ci = im[k];
      re[k] = cr * chirpRe[k] + ci * chirpIm[k];
      im[k] = ci * chirpRe[k] - cr * chirpIm[k];
    }
  }
}
