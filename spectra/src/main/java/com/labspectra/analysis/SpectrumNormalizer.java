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

package com.labspectra.analysis;

import com.labspectra.conversion.DataMode;
import com.labspectra.conversion.DataModeDetector;
import com.labspectra.conversion.UnitConversionResult;
import com.labspectra.conversion.UnitConverter;
import com.labspectra.conversion.XAxisUnit;
import com.labspectra.spectrum.Spectrum;
import com.labspectra.spectrum.Techniques;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns freshly ingested samples into the first {@link WorkingSpectrum} of a session: the x axis is moved to the
 * technique's conventional unit when the metadata names its current one, and the data mode is detected for
 * absorption techniques.
 */
public class SpectrumNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumNormalizer.class);

  private static final List<String> X_UNITS_KEYS = Arrays.asList("XUNITS", "xunits", "xUnits");

  private final UnitConverter unitConverter;
  private final DataModeDetector modeDetector;

  public SpectrumNormalizer() {
    this(new UnitConverter(), new DataModeDetector());
  }

  public SpectrumNormalizer(UnitConverter unitConverter, DataModeDetector modeDetector) {
    this.unitConverter = unitConverter;
    this.modeDetector = modeDetector;
  }

  public WorkingSpectrum normalize(Spectrum raw, String technique, Map<String, ?> metadata) {
    Spectrum data = raw;
    String xUnit;
    String note = "";

    String declaredUnit = xUnits(metadata);
    if (declaredUnit != null && raw.isWellFormed()) {
      UnitConversionResult conversion = unitConverter.convert(raw.getX(), declaredUnit, null, technique);
      if (conversion.wasConverted()) {
        data = new Spectrum(conversion.getConvertedX(), conversion.filterAligned(raw.getY()));
        xUnit = conversion.getActualUnit();
        note = conversion.getConversionInfo();
        LOGGER.info("%s (%d points dropped)", note, conversion.getDroppedCount());
      } else {
        xUnit = declaredUnit;
      }
    } else {
      xUnit = XAxisUnit.standardFor(technique).getLabel();
    }

    DataMode mode = DataMode.ABSORBANCE;
    if (Techniques.isAbsorption(technique)) {
      mode = modeDetector.detect(raw.getY(), technique, metadata);
    }
    LOGGER.debug("Normalized %s: technique=%s, unit=%s, mode=%s", data, technique, xUnit, mode.getName());
    return new WorkingSpectrum(data, null, technique, xUnit, note, mode, null, null);
  }

  private static String xUnits(Map<String, ?> metadata) {
    if (metadata == null) {
      return null;
    }
    for (String key : X_UNITS_KEYS) {
      Object value = metadata.get(key);
      if (value != null && StringUtils.isNotBlank(value.toString())) {
        return value.toString().trim();
      }
    }
    return null;
  }
}
