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

/**
 * Compute the 2D FFT of complex, double precision input of arbitrary dimensions via 1D FFTs.
 *
 * <p>The data are interleaved and row-major with Y as the fastest dimension. The location of the
 * input point [x, y] within the input array must be: <br>
 * double real = input[offset + x*nextX + y*nextY]<br>
 * double imag = input[offset + x*nextX + y*nextY + 1]<br>
 * where <br>
 * nextX = 2*nY<br>
 * nextY = 2
 *
 * <p>Instances hold only precomputed constants and may be shared between threads.
 *
 * @author Michael J. Schnieders
 * @see Complex
 * @since 1.0
 */
public class Complex2D {

  /** The X-dimension. */
  private final int nX;
  /** The Y-dimension. */
  private final int nY;
  /** The next real value along the X dimension. */
  private final int nextX;
  /** The next real value along the Y dimension. */
  private final int nextY;
  /** Compute FFTs along X one at a time. */
  private final Complex fftX;
  /** Compute FFTs along Y one at a time. */
  private final Complex fftY;

  /**
   * Create a new 2D Complex FFT for interleaved data.
   *
   * @param nX The number of points in the X dimension.
   * @param nY The number of points in the Y dimension.
   */
  public Complex2D(int nX, int nY) {
    this.nX = nX;
    this.nY = nY;
    nextY = 2;
    nextX = 2 * nY;
    fftX = new Complex(nX);
    fftY = new Complex(nY);
  }

  /**
   * The number of points in the X dimension.
   *
   * @return nX.
   */
  public int getNX() {
    return nX;
  }

  /**
   * The number of points in the Y dimension.
   *
   * @return nY.
   */
  public int getNY() {
    return nY;
  }

  /**
   * Compute the 2D FFT in place.
   *
   * @param input  The input array must be of size 2 * nX * nY.
   * @param offset The offset into the input array of the first element.
   */
  public void fft(double[] input, int offset) {
    for (int x = 0; x < nX; x++) {
      fftY.fft(input, offset + x * nextX, nextY);
    }
    for (int y = 0; y < nY; y++) {
      fftX.fft(input, offset + y * nextY, nextX);
    }
  }

  /**
   * Compute the (unnormalized) inverse 2D FFT in place.
   *
   * @param input  The input array must be of size 2 * nX * nY.
   * @param offset The offset into the input array of the first element.
   */
  public void ifft(double[] input, int offset) {
    for (int x = 0; x < nX; x++) {
      fftY.ifft(input, offset + x * nextX, nextY);
    }
    for (int y = 0; y < nY; y++) {
      fftX.ifft(input, offset + y * nextY, nextX);
    }
  }
}
