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

import com.labspectra.spectrum.Techniques;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Converts x-axis values between the wavelength-like units labs export:
 *   micrometers <-> wavenumbers (cm^-1):  nu = 10000 / lambda
 *   nanometers  <-> micrometers:          factor 1000
 * Reciprocal conversions drop non-positive and near-zero samples instead of producing infinities.  Unit pairs with
 * no rule pass through untouched and are flagged as not converted.
 */
public class UnitConverter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(UnitConverter.class);

  public static final String WAVENUMBERS = "wavenumbers";
  public static final String NANOMETERS = "nanometers";
  public static final String MICROMETERS = "micrometers";

  public static final String WAVENUMBER_LABEL = "cm⁻¹";
  public static final String MICROMETER_LABEL = "μm";
  public static final String NANOMETER_LABEL = "nm";

  private static final double MICROMETER_WAVENUMBER_FACTOR = 10000.0;
  private static final double NANOMETERS_PER_MICROMETER = 1000.0;
  // Source values this small would map to absurd reciprocal values.
  private static final double MIN_RECIPROCAL_SOURCE = 1e-4;

  enum UnitFamily {
    MICROMETER,
    NANOMETER,
    WAVENUMBER,
    OTHER;

    static UnitFamily of(String unit) {
      String lower = StringUtils.trimToEmpty(unit).toLowerCase();
      if (lower.contains("micrometer") || lower.contains("micron") || lower.equals("um") ||
          lower.equals("μm") || lower.equals("µm")) {
        return MICROMETER;
      }
      if (lower.contains("nanometer") || lower.equals("nm")) {
        return NANOMETER;
      }
      if (lower.contains("wavenumber") || lower.contains("cm-1") || lower.contains("cm^-1") ||
          lower.contains("cm⁻¹") || lower.equals("1/cm")) {
        return WAVENUMBER;
      }
      return OTHER;
    }
  }

  /**
   * Picks the unit a technique is conventionally displayed in, or null when there is no convention.
   */
  public static String defaultTargetUnit(String technique) {
    if (Techniques.isInfrared(technique) || Techniques.isRaman(technique)) {
      return WAVENUMBERS;
    }
    if (Techniques.isUvVis(technique) || Techniques.isLibs(technique)) {
      return NANOMETERS;
    }
    return null;
  }

  public UnitConversionResult convert(double[] x, String fromUnit, String toUnit, String technique) {
    double[] source = x == null ? new double[0] : x;

    String target = StringUtils.isBlank(toUnit) ? defaultTargetUnit(technique) : toUnit;
    if (target == null) {
      LOGGER.debug("No target unit for technique '%s'; leaving x values in %s", technique, fromUnit);
      return UnitConversionResult.unchanged(source, fromUnit);
    }

    UnitFamily from = UnitFamily.of(fromUnit);
    UnitFamily to = UnitFamily.of(target);
    if (StringUtils.equalsIgnoreCase(StringUtils.trim(fromUnit), StringUtils.trim(target)) ||
        (from == to && from != UnitFamily.OTHER)) {
      return UnitConversionResult.unchanged(source, fromUnit);
    }

    if (from == UnitFamily.MICROMETER && to == UnitFamily.WAVENUMBER) {
      return reciprocal(source, WAVENUMBER_LABEL, "Converted from micrometers to wavenumbers (cm⁻¹)");
    }
    if (from == UnitFamily.WAVENUMBER && to == UnitFamily.MICROMETER) {
      return reciprocal(source, MICROMETER_LABEL, "Converted from wavenumbers to micrometers");
    }
    if (from == UnitFamily.NANOMETER && to == UnitFamily.MICROMETER) {
      return scaled(source, v -> v / NANOMETERS_PER_MICROMETER, MICROMETER_LABEL,
          "Converted from nanometers to micrometers");
    }
    if (from == UnitFamily.MICROMETER && to == UnitFamily.NANOMETER) {
      return scaled(source, v -> v * NANOMETERS_PER_MICROMETER, NANOMETER_LABEL,
          "Converted from micrometers to nanometers");
    }

    LOGGER.info("No conversion rule from '%s' to '%s'; x values left as they are", fromUnit, target);
    return UnitConversionResult.unchanged(source, fromUnit);
  }

  private UnitConversionResult reciprocal(double[] source, String unit, String info) {
    double[] converted = new double[source.length];
    int[] kept = new int[source.length];
    int count = 0;
    for (int i = 0; i < source.length; i++) {
      double value = source[i];
      if (value <= 0.0 || value < MIN_RECIPROCAL_SOURCE) {
        continue;
      }
      converted[count] = MICROMETER_WAVENUMBER_FACTOR / value;
      kept[count] = i;
      count++;
    }
    if (count < source.length) {
      LOGGER.warn("Dropped %d non-positive x values during unit conversion", source.length - count);
    }
    return new UnitConversionResult(Arrays.copyOf(converted, count), Arrays.copyOf(kept, count), source.length,
        unit, true, info);
  }

  private UnitConversionResult scaled(double[] source, DoubleUnaryOperator op, String unit, String info) {
    double[] converted = new double[source.length];
    int[] kept = new int[source.length];
    for (int i = 0; i < source.length; i++) {
      converted[i] = op.applyAsDouble(source[i]);
      kept[i] = i;
    }
    return new UnitConversionResult(converted, kept, source.length, unit, true, info);
  }
}
