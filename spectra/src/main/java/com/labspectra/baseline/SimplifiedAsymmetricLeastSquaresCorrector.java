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
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * A cheap stand-in for the full ALS fit on long spectra.  Instead of solving the penalized system, every pass blends
 * each interior point between its weighted raw value and a 3-point second-difference smooth of the current baseline:
 *   smoothed  = (b[i-1] + 2 b[i] + b[i+1]) / 4
 *   weighted  = w[i] y[i] + (1 - w[i]) smoothed
 *   b'[i]     = (1 - s) weighted + s smoothed,   s = λ / 1000 clamped to [0, 1]
 * Endpoints are kept fixed.  Reweighting follows the ALS rule.  This is a heuristic in its own right, not a
 * reduction of the full algorithm, so its baselines differ from the full fit.
 */
public class SimplifiedAsymmetricLeastSquaresCorrector implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SimplifiedAsymmetricLeastSquaresCorrector.class);

  public static final String NAME = "als_simplified";

  private static final double LAMBDA_NORMALIZATION = 1000.0;

  private final double lambda;
  private final double p;
  private final int maxIterations;

  public SimplifiedAsymmetricLeastSquaresCorrector(double lambda, double p, int maxIterations) {
    Validate.isTrue(lambda > 0.0, "Smoothness lambda must be positive, got %f", lambda);
    Validate.isTrue(p > 0.0 && p < 1.0, "Asymmetry p must lie in (0, 1), got %f", p);
    Validate.isTrue(maxIterations > 0, "Iteration count must be positive, got %d", maxIterations);
    this.lambda = lambda;
    this.p = p;
    this.maxIterations = Math.min(maxIterations, AsymmetricLeastSquaresCorrector.MAX_ITERATIONS);
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public BaselineResult correct(Spectrum spectrum) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("Simplified ALS baseline skipped: %s is not analyzable", spectrum);
      return BaselineResult.empty();
    }

    double[] y = spectrum.getY();
    int n = y.length;
    double smoothness = Math.max(0.0, Math.min(1.0, lambda / LAMBDA_NORMALIZATION));

    double[] weights = new double[n];
    Arrays.fill(weights, 1.0);
    double[] baseline = y.clone();

    for (int iteration = 0; iteration < maxIterations; iteration++) {
      double[] next = new double[n];
      next[0] = baseline[0];
      next[n - 1] = baseline[n - 1];
      for (int i = 1; i < n - 1; i++) {
        double smoothed = (baseline[i - 1] + 2.0 * baseline[i] + baseline[i + 1]) / 4.0;
        double weighted = weights[i] * y[i] + (1.0 - weights[i]) * smoothed;
        next[i] = (1.0 - smoothness) * weighted + smoothness * smoothed;
      }
      baseline = next;

      for (int i = 0; i < n; i++) {
        weights[i] = y[i] >= baseline[i] ? p : 1.0 - p;
      }
    }

    LOGGER.debug("Simplified ALS baseline on %d points finished after %d iterations", n, maxIterations);
    return BaselineResult.of(y, baseline);
  }
}
