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
package msx.detectors;

import static java.lang.String.format;

import java.util.Map;
import msx.array.ArrayObject;
import msx.array.DataType;
import msx.array.ensemble.OutputSpecification;
import msx.measurements.DiffractionPatterns;
import msx.measurements.MeasurementType;
import msx.waves.Waves;

/**
 * Records diffraction patterns within a maximum scattering angle.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PixelatedDetector implements Detector {

  private final String maxAngleName;
  private final double maxAngle;
  private final boolean fftshift;

  /**
   * Patterns cropped to the antialias cutoff with the zero angle at the center.
   */
  public PixelatedDetector() {
    this("cutoff", true);
  }

  /**
   * Constructor for PixelatedDetector.
   *
   * @param maxAngle "cutoff", "valid" or "full".
   * @param fftshift true to move the zero angle to the center.
   */
  public PixelatedDetector(String maxAngle, boolean fftshift) {
    if (!"cutoff".equals(maxAngle) && !"valid".equals(maxAngle) && !"full".equals(maxAngle)) {
      throw new IllegalArgumentException(format(" Unknown maximum angle %s.", maxAngle));
    }
    this.maxAngleName = maxAngle;
    this.maxAngle = Double.NaN;
    this.fftshift = fftshift;
  }

  /**
   * Constructor for PixelatedDetector.
   *
   * @param maxAngle the maximum scattering angle [mrad].
   * @param fftshift true to move the zero angle to the center.
   */
  public PixelatedDetector(double maxAngle, boolean fftshift) {
    if (!(maxAngle > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid maximum angle %8.3f.", maxAngle));
    }
    this.maxAngleName = null;
    this.maxAngle = maxAngle;
    this.fftshift = fftshift;
  }

  private int[] outputGpts(Waves waves) {
    return maxAngleName != null ? waves.gptsWithinAngle(maxAngleName, "odd")
        : waves.gptsWithinAngle(maxAngle, "odd");
  }

  @Override
  public OutputSpecification getOutputSpecification(Waves template) {
    int[] gpts = outputGpts(template);
    Map<String, Object> metadata = DiffractionPatterns.metadata(
        template.getGrid().getReciprocalSampling(), fftshift, template.getEnergy(), "intensity",
        "arb. unit");
    Object semiangle = template.getMetadata().get(Waves.SEMIANGLE_CUTOFF);
    if (semiangle != null) {
      metadata.put(DiffractionPatterns.SEMIANGLE_CUTOFF, semiangle);
    }
    return new OutputSpecification(MeasurementType.DIFFRACTION_PATTERNS, gpts,
        DiffractionPatterns.baseAxes(gpts,
            template.getGrid().getReciprocalSampling(), fftshift), DataType.FLOAT64, metadata);
  }

  @Override
  public ArrayObject detect(Waves waves) {
    if (maxAngleName != null) {
      return waves.diffractionPatterns(maxAngleName, 0.0, fftshift, "odd", false, true);
    }
    return waves.diffractionPatterns(maxAngle, 0.0, fftshift, "odd", false, true);
  }

  @Override
  public String toString() {
    return format("PixelatedDetector(maxAngle=%s, fftshift=%b)",
        maxAngleName != null ? maxAngleName : Double.toString(maxAngle), fftshift);
  }
}
