/*************************************************************************
*                                                                        *
*  This file is part of the labspectra project.                          *
*  labspectra corrects baselines, picks and integrates spectral peaks.   *
*  Copyright (C) 2026 labspectra contributors                            *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.labspectra.conversion;

import org.apache.commons.lang3.Validate;

/**
 * Converts y values between absorbance (A) and percent transmittance (%T):
 *   %T = 10^(-A) * 100
 *   A  = -log10(%T / 100)
 * Inputs are clamped to A in [0, 10] and %T in [0.01, 100] first, so degenerate samples never turn into infinities
 * or NaNs.  Apart from that clamping the two directions are exact inverses.
 */
public final class ModeConverter {
  public static final double MIN_ABSORBANCE = 0.0;
  public static final double MAX_ABSORBANCE = 10.0;
  public static final double MIN_TRANSMITTANCE = 0.01;
  public static final double MAX_TRANSMITTANCE = 100.0;

  private ModeConverter() {
  }

  public static double[] convert(double[] values, DataMode from, DataMode to) {
    Validate.notNull(from, "Source data mode must be specified");
    Validate.notNull(to, "Target data mode must be specified");
    if (values == null) {
      return new double[0];
    }

    double[] converted = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      converted[i] = convert(values[i], from, to);
    }
    return converted;
  }

  public static double convert(double value, DataMode from, DataMode to) {
    if (from == to) {
      return value;
    }
    if (from == DataMode.ABSORBANCE) {
      return absorbanceToTransmittance(value);
    }
    return transmittanceToAbsorbance(value);
  }

  public static double absorbanceToTransmittance(double absorbance) {
    double clamped = clamp(absorbance, MIN_ABSORBANCE, MAX_ABSORBANCE);
    return Math.pow(10.0, -clamped) * 100.0;
  }

  public static double transmittanceToAbsorbance(double transmittance) {
    double clamped = clamp(transmittance, MIN_TRANSMITTANCE, MAX_TRANSMITTANCE);
    return -Math.log10(clamped / 100.0);
  }

  private static double clamp(double value, double min, double max) {
    // NaN compares false everywhere; pin it to the low end of the domain.
    if (Double.isNaN(value)) {
      return min;
    }
    return Math.max(min, Math.min(max, value));
  }
}
