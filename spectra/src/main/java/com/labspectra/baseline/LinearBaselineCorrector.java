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

package com.labspectra.baseline;

import com.labspectra.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The simplest baseline: a straight line through the first and the last sample.
 */
public class LinearBaselineCorrector implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LinearBaselineCorrector.class);

  public static final String NAME = "linear";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public BaselineResult correct(Spectrum spectrum) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("Linear baseline skipped: %s is not analyzable", spectrum);
      return BaselineResult.empty();
    }

    double[] x = spectrum.getX();
    double[] y = spectrum.getY();
    int last = y.length - 1;
    double[] baseline = new double[y.length];

    double dx = x[last] - x[0];
    if (dx == 0.0) {
      LOGGER.warn("Linear baseline: x range is empty, using a flat baseline at the first sample");
      for (int i = 0; i < baseline.length; i++) {
        baseline[i] = y[0];
      }
      return BaselineResult.of(y, baseline);
    }

    double slope = (y[last] - y[0]) / dx;
    double intercept = y[0] - slope * x[0];
    for (int i = 0; i < baseline.length; i++) {
      baseline[i] = slope * x[i] + intercept;
    }
    return BaselineResult.of(y, baseline);
  }
}
