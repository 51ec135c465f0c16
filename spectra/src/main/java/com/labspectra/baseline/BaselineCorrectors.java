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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Picks the corrector implementation for a set of baseline parameters.
 */
public final class BaselineCorrectors {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BaselineCorrectors.class);

  // Above this many points the full ALS solve is replaced by the simplified variant.
  public static final int DEFAULT_SIMPLIFIED_THRESHOLD = 2000;

  private BaselineCorrectors() {
  }

  public static BaselineCorrector forParameters(BaselineParameters params, int size) {
    return forParameters(params, size, DEFAULT_SIMPLIFIED_THRESHOLD);
  }

  /**
   * Builds the corrector named by params.getMethod().  An unrecognized method name gets the simplified ALS
   * corrector, as does ALS when it is explicitly requested or the spectrum is longer than simplifiedThreshold.
   * @param params The baseline settings.
   * @param size The number of points in the spectrum to be corrected.
   * @param simplifiedThreshold The size above which ALS runs in its simplified form.
   * @return A corrector ready to run.
   */
  public static BaselineCorrector forParameters(BaselineParameters params, int size, int simplifiedThreshold) {
    BaselineMethod method = BaselineMethod.fromName(params.getMethod());
    if (method == null) {
      LOGGER.warn("Unknown baseline method '%s', falling back to simplified ALS", params.getMethod());
      return simplifiedAls(params);
    }

    switch (method) {
      case LINEAR:
        return new LinearBaselineCorrector();
      case POLYNOMIAL:
        return new PolynomialBaselineCorrector(params.getDegree(), params.getPolynomialStrategy() == null ?
            PolynomialBaselineCorrector.Strategy.LEAST_SQUARES : params.getPolynomialStrategy());
      case ALS:
      default:
        if (params.isUseSimplified() || size > simplifiedThreshold) {
          LOGGER.info("Using simplified ALS for %d points (requested: %s, threshold: %d)",
              size, params.isUseSimplified(), simplifiedThreshold);
          return simplifiedAls(params);
        }
        return new AsymmetricLeastSquaresCorrector(params.getLambda(), params.getP(), params.getIterations());
    }
  }

  private static BaselineCorrector simplifiedAls(BaselineParameters params) {
    return new SimplifiedAsymmetricLeastSquaresCorrector(params.getLambda(), params.getP(), params.getIterations());
  }
}
