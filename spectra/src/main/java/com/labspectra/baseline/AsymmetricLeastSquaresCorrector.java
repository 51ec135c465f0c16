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

import com.labspectra.linalg.ConjugateGradientSolver;
import com.labspectra.linalg.Matrices;
import com.labspectra.spectrum.Spectrum;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Asymmetric least squares baseline (Eilers and Boelens, 2005).  Each pass solves
 *   (W + λ·DᵀD) z = W y
 * with D the second-order difference operator, then gives points above the baseline weight p and points below it
 * weight 1 - p.  With a small p the fit hugs the lower envelope of the signal, so real peaks are left standing.
 */
public class AsymmetricLeastSquaresCorrector implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AsymmetricLeastSquaresCorrector.class);

  public static final String NAME = "als";
  public static final int MAX_ITERATIONS = 20;
  public static final double CONVERGENCE_THRESHOLD = 1e-6;

  private static final int DIFFERENCE_ORDER = 2;

  private final double lambda;
  private final double p;
  private final int maxIterations;
  private final ConjugateGradientSolver solver;

  public AsymmetricLeastSquaresCorrector(double lambda, double p, int maxIterations) {
    this(lambda, p, maxIterations, new ConjugateGradientSolver());
  }

  public AsymmetricLeastSquaresCorrector(double lambda, double p, int maxIterations, ConjugateGradientSolver solver) {
    Validate.isTrue(lambda > 0.0, "Smoothness lambda must be positive, got %f", lambda);
    Validate.isTrue(p > 0.0 && p < 1.0, "Asymmetry p must lie in (0, 1), got %f", p);
    Validate.isTrue(maxIterations > 0, "Iteration count must be positive, got %d", maxIterations);
    this.lambda = lambda;
    this.p = p;
    this.maxIterations = Math.min(maxIterations, MAX_ITERATIONS);
    this.solver = solver;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public BaselineResult correct(Spectrum spectrum) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("ALS baseline skipped: %s is not analyzable", spectrum);
      return BaselineResult.empty();
    }

    double[] y = spectrum.getY();
    int n = y.length;
    RealMatrix penalty = Matrices.gram(Matrices.differenceOperator(n, DIFFERENCE_ORDER));

    double[] weights = new double[n];
    Arrays.fill(weights, 1.0);
    double[] baseline = y.clone();
    double[] rhs = new double[n];

    int iteration = 0;
    while (iteration < maxIterations) {
      iteration++;
      double[] previous = baseline;

      for (int i = 0; i < n; i++) {
        rhs[i] = weights[i] * y[i];
      }
      RealMatrix system = Matrices.penalized(weights, lambda, penalty);
      baseline = solver.solve(system, new ArrayRealVector(rhs, false)).toArray();

      for (int i = 0; i < n; i++) {
        weights[i] = y[i] >= baseline[i] ? p : 1.0 - p;
      }

      double maxChange = 0.0;
      for (int i = 0; i < n; i++) {
        maxChange = Math.max(maxChange, Math.abs(baseline[i] - previous[i]));
      }
      if (maxChange < CONVERGENCE_THRESHOLD) {
        break;
      }
    }

    LOGGER.debug("ALS baseline on %d points finished after %d iterations (lambda=%.1f, p=%.4f)",
        n, iteration, lambda, p);
    return BaselineResult.of(y, baseline);
  }
}
