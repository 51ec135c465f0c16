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
import java.util.List;
import java.util.Map;

/**
 * Decides whether a spectrum's y values are absorbance or transmittance.  Sources are consulted in priority order:
 *   1. the YUNITS metadata field (as written by JCAMP-DX readers),
 *   2. a data-type metadata field,
 *   3. the range and mean of the values themselves (absorption techniques only),
 *   4. the technique's customary mode (IR is usually recorded as %T).
 */
public class DataModeDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DataModeDetector.class);

  private static final List<String> Y_UNITS_KEYS = Arrays.asList("YUNITS", "yunits", "yUnits");
  private static final List<String> DATA_TYPE_KEYS = Arrays.asList("dataType", "DATA_TYPE", "data_type");

  private static final double PERCENT_SCALE_MAX = 100.0;
  private static final double TRANSMITTANCE_MIN_MEAN = 50.0;
  private static final double ABSORBANCE_SCALE_MAX = 5.0;
  private static final double ABSORBANCE_MAX_MEAN = 2.0;

  public DataMode detect(double[] y, String technique, Map<String, ?> metadata) {
    if (metadata != null) {
      String yUnits = firstValue(metadata, Y_UNITS_KEYS);
      if (yUnits != null) {
        DataMode fromUnits = matchYUnits(yUnits);
        if (fromUnits != null) {
          LOGGER.debug("Data mode %s taken from YUNITS '%s'", fromUnits.getName(), yUnits);
          return fromUnits;
        }
      }

      String dataType = firstValue(metadata, DATA_TYPE_KEYS);
      if (dataType != null) {
        DataMode fromType = matchDataType(dataType);
        if (fromType != null) {
          LOGGER.debug("Data mode %s taken from data type '%s'", fromType.getName(), dataType);
          return fromType;
        }
      }
    }

    if (Techniques.isAbsorption(technique) && y != null && y.length > 0) {
      DataMode fromValues = matchValueRange(y);
      if (fromValues != null) {
        LOGGER.debug("Data mode %s inferred from value range", fromValues.getName());
        return fromValues;
      }
    }

    DataMode fallback = Techniques.normalize(technique).contains("ir") ? DataMode.TRANSMITTANCE : DataMode.ABSORBANCE;
    LOGGER.debug("Data mode %s defaulted from technique '%s'", fallback.getName(), technique);
    return fallback;
  }

  static DataMode matchYUnits(String yUnits) {
    String lower = yUnits.trim().toLowerCase();
    if (lower.contains("transmittance") || lower.contains("transmission") || lower.contains("%t") || lower.equals("t")) {
      return DataMode.TRANSMITTANCE;
    }
    if (lower.contains("absorbance") || lower.contains("absorption") || lower.equals("a")) {
      return DataMode.ABSORBANCE;
    }
    return null;
  }

  static DataMode matchDataType(String dataType) {
    String lower = dataType.trim().toLowerCase();
    if (lower.contains("transmittance") || lower.contains("transmission")) {
      return DataMode.TRANSMITTANCE;
    }
    if (lower.contains("absorbance") || lower.contains("absorption")) {
      return DataMode.ABSORBANCE;
    }
    return null;
  }

  static DataMode matchValueRange(double[] y) {
    double max = -Double.MAX_VALUE;
    double min = Double.MAX_VALUE;
    double sum = 0.0;
    for (double v : y) {
      max = Math.max(max, v);
      min = Math.min(min, v);
      sum += v;
    }
    double mean = sum / y.length;

    if (max <= PERCENT_SCALE_MAX && min >= 0.0 && mean > TRANSMITTANCE_MIN_MEAN) {
      return DataMode.TRANSMITTANCE;
    }
    if (max <= ABSORBANCE_SCALE_MAX && min >= 0.0 && mean < ABSORBANCE_MAX_MEAN) {
      return DataMode.ABSORBANCE;
    }
    // Raw counts above 100 are far more likely to be an uncalibrated %T trace than an absorbance.
    if (max > PERCENT_SCALE_MAX) {
      return DataMode.TRANSMITTANCE;
    }
    return null;
  }

  private static String firstValue(Map<String, ?> metadata, List<String> keys) {
    for (String key : keys) {
      Object value = metadata.get(key);
      if (value != null && StringUtils.isNotBlank(value.toString())) {
        return value.toString();
      }
    }
    return null;
  }
}
