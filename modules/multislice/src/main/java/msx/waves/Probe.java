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
package msx.waves;

import static java.lang.String.format;
import static msx.utilities.Constants.MRAD_TO_RAD;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.List;
import java.util.Map;
import msx.array.ArrayData;
import msx.array.ArrayObject;
import msx.array.ComputableList;
import msx.array.ComputeSettings;
import msx.array.DataType;
import msx.array.ensemble.ArrayObjectFactory;
import msx.array.ensemble.CompositeTransform;
import msx.array.ensemble.EnsembleBuilder;
import msx.array.ensemble.OutputSpecification;
import msx.detectors.Detector;
import msx.measurements.Images;
import msx.measurements.RealSpaceLineProfiles;
import msx.multislice.MultisliceTransform;
import msx.potential.Potential;

/**
 * A focused probe: a circular objective aperture with an optional soft edge, multiplied by the
 * aberration phase exp(-i chi) with chi(alpha) = 2 pi / lambda (C10 alpha^2 / 2 + C30 alpha^4 / 4)
 * and C10 = -defocus. The probe is built in reciprocal space with unit total intensity and is
 * placed at scan positions by a {@link BaseScan}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Probe implements ArrayObjectFactory {

  private final Grid grid;
  private final double energy;
  private final double semiangleCutoff;
  private final double softEdge;
  private final double defocus;
  private final double cs;

  /**
   * A probe without aberrations and with a sharp aperture edge.
   *
   * @param grid            the grid.
   * @param energy          the electron energy [eV].
   * @param semiangleCutoff the aperture semiangle [mrad].
   */
  public Probe(Grid grid, double energy, double semiangleCutoff) {
    this(grid, energy, semiangleCutoff, 0.0, 0.0, 0.0);
  }

  /**
   * Constructor for Probe.
   *
   * @param grid            the grid.
   * @param energy          the electron energy [eV].
   * @param semiangleCutoff the aperture semiangle [mrad].
   * @param softEdge        the width of the aperture edge (0 for a sharp edge) [mrad].
   * @param defocus         the defocus [Angstrom].
   * @param cs              the spherical aberration C30 [Angstrom].
   */
  public Probe(Grid grid, double energy, double semiangleCutoff, double softEdge, double defocus,
      double cs) {
    Energy.checkDefined(energy);
    if (!(semiangleCutoff > 0.0)) {
      throw new IllegalArgumentException(
          format(" Invalid semiangle cutoff %8.3f.", semiangleCutoff));
    }
    if (softEdge < 0.0) {
      throw new IllegalArgumentException(format(" Invalid soft aperture edge %8.3f.", softEdge));
    }
    this.grid = grid;
    this.energy = energy;
    this.semiangleCutoff = semiangleCutoff;
    this.softEdge = softEdge;
    this.defocus = defocus;
    this.cs = cs;
  }

  public Grid getGrid() {
    return grid;
  }

  public double getEnergy() {
    return energy;
  }

  public double getSemiangleCutoff() {
    return semiangleCutoff;
  }

  /**
   * The largest real space sampling that resolves the probe.
   *
   * @return lambda / (4 alpha) [Angstrom].
   */
  public double getNyquistSampling() {
    return Energy.wavelength(energy) / (4.0 * semiangleCutoff * MRAD_TO_RAD);
  }

  @Override
  public OutputSpecification describe() {
    Map<String, Object> metadata = Waves.metadata(grid, energy, true);
    metadata.put(Waves.NORMALIZATION, "reciprocal_space");
    metadata.put(Waves.SEMIANGLE_CUTOFF, semiangleCutoff);
    return new OutputSpecification(Waves.TYPE, grid.getGpts(),
        Waves.baseAxes(grid.getSampling()), DataType.COMPLEX128, metadata);
  }

  /**
   * The probe at the origin in reciprocal space, in FFT order.
   *
   * @return the complex array of the grid shape.
   */
  @Override
  public ArrayData buildArray() {
    int[] gpts = grid.getGpts();
    double lambda = Energy.wavelength(energy);
    double[] kx = grid.getFrequenciesX();
    double[] ky = grid.getFrequenciesY();
    double cutoff = semiangleCutoff * MRAD_TO_RAD;
    double edge = softEdge * MRAD_TO_RAD;
    double c10 = -defocus;
    double[] data = new double[2 * grid.size()];
    double sum = 0.0;
    for (int i = 0; i < gpts[0]; i++) {
      for (int j = 0; j < gpts[1]; j++) {
        double alpha = lambda * sqrt(kx[i] * kx[i] + ky[j] * ky[j]);
        double aperture;
        if (edge > 0.0) {
          aperture = min(1.0, max(0.0, (cutoff - alpha) / edge + 0.5));
        } else {
          aperture = alpha < cutoff ? 1.0 : 0.0;
        }
        if (aperture == 0.0) {
          continue;
        }
        double alpha2 = alpha * alpha;
        double chi = 2.0 * PI / lambda * (0.5 * c10 * alpha2 + 0.25 * cs * alpha2 * alpha2);
        int index = 2 * (i * gpts[1] + j);
        data[index] = aperture * cos(-chi);
        data[index + 1] = aperture * sin(-chi);
        sum += aperture * aperture;
      }
    }
    if (sum > 0.0) {
      double scale = 1.0 / sqrt(sum);
      for (int i = 0; i < data.length; i++) {
        data[i] *= scale;
      }
    }
    return ArrayData.wrap(DataType.COMPLEX128, data, gpts);
  }

  private CustomScan centered() {
    double[] extent = grid.getExtent();
    return new CustomScan(new double[][] {{extent[0] / 2.0, extent[1] / 2.0}}, true);
  }

  /**
   * The probe at the center of the grid, in real space.
   *
   * @param settings the compute settings.
   * @return the probe.
   */
  public Waves build(ComputeSettings settings) {
    return build(centered(), settings);
  }

  /**
   * The probe at every position of a scan, in real space.
   *
   * @param scan     the scan.
   * @param settings the compute settings.
   * @return the probes.
   */
  public Waves build(BaseScan scan, ComputeSettings settings) {
    return (Waves) EnsembleBuilder.build(scan, this, settings).get(0);
  }

  /**
   * Propagate the probe at every scan position through a potential and detect it.
   *
   * @param potential the potential.
   * @param scan      the scan.
   * @param detectors the detectors (empty for the exit waves).
   * @param settings  the compute settings.
   * @return one measurement per detector.
   */
  public ComputableList<ArrayObject> multislice(Potential potential, BaseScan scan,
      List<Detector> detectors, ComputeSettings settings) {
    return EnsembleBuilder.build(
        new CompositeTransform(new MultisliceTransform(potential, detectors), scan), this,
        settings);
  }

  /**
   * A line profile of the intensity through the center of the probe.
   *
   * @param angle    the direction of the line relative to the x axis [degrees].
   * @param settings the compute settings.
   * @return the profile, spanning the smaller extent of the grid.
   */
  public RealSpaceLineProfiles profiles(double angle, ComputeSettings settings) {
    Images intensity = build(settings.withLazy(false)).intensity();
    double[] extent = grid.getExtent();
    double half = min(extent[0], extent[1]) / 2.0;
    double dx = half * cos(toRadians(angle));
    double dy = half * sin(toRadians(angle));
    double[] center = {extent[0] / 2.0, extent[1] / 2.0};
    double[] sampling = grid.getSampling();
    return intensity.interpolateLine(new double[] {center[0] - dx, center[1] - dy},
        new double[] {center[0] + dx, center[1] + dy}, min(sampling[0], sampling[1]));
  }

  @Override
  public String toString() {
    return format("Probe(%s, energy=%.1f eV, semiangle=%.2f mrad, defocus=%.2f, Cs=%.3e)", grid,
        energy, semiangleCutoff, defocus, cs);
  }
}
