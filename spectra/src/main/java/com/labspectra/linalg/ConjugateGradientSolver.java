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

package com.labspectra.linalg;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Conjugate gradient solver for symmetric positive (semi)definite systems Ax = b.
 *
 * The iteration count is capped at min(n, maxIterations) so that a baseline fit on a long spectrum has a bounded
 * cost.  The solver never fails on non-convergence: it hands back the iterate with the smallest residual seen.
 * commons-math's own ConjugateGradient throws on exhaustion and on indefinite curvature, which is the wrong contract
 * for a smoothing fit where an approximate answer is fine.
 */
public class ConjugateGradientSolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConjugateGradientSolver.class);

  public static final int DEFAULT_MAX_ITERATIONS = 50;
  public static final double CURVATURE_EPSILON = 1e-12;
  public static final double RESIDUAL_EPSILON = 1e-12;

  private final int maxIterations;

  public ConjugateGradientSolver() {
    this(DEFAULT_MAX_ITERATIONS);
  }

  public ConjugateGradientSolver(int maxIterations) {
    Validate.isTrue(maxIterations > 0, "Iteration cap must be positive, got %d", maxIterations);
    this.maxIterations = maxIterations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public RealVector solve(RealMatrix a, RealVector b) {
    Validate.isTrue(a.isSquare(), "System matrix must be square");
    Validate.isTrue(a.getRowDimension() == b.getDimension(),
        "Matrix dimension %d does not match right-hand side dimension %d", a.getRowDimension(), b.getDimension());

    int n = b.getDimension();
    RealVector x = new ArrayRealVector(n);
    RealVector r = b.copy();
    RealVector p = r.copy();
    double rTr = r.dotProduct(r);

    RealVector best = x.copy();
    double bestResidual = rTr;

    int limit = Math.min(n, maxIterations);
    int iteration = 0;
    for (; iteration < limit; iteration++) {
      if (rTr < RESIDUAL_EPSILON) {
        break;
      }

      RealVector ap = a.operate(p);
      double pAp = p.dotProduct(ap);
      if (Math.abs(pAp) < CURVATURE_EPSILON) {
        LOGGER.debug("Stopping after %d iterations: search direction has no curvature (%e)", iteration, pAp);
        break;
      }

      double alpha = rTr / pAp;
      x.combineToSelf(1.0, alpha, p);
      r.combineToSelf(1.0, -alpha, ap);

      double newRTr = r.dotProduct(r);
      if (newRTr < bestResidual) {
        bestResidual = newRTr;
        best = x.copy();
      }
      if (newRTr < RESIDUAL_EPSILON) {
        iteration++;
        break;
      }

      double beta = newRTr / rTr;
      p.combineToSelf(beta, 1.0, r);
      rTr = newRTr;
    }

    LOGGER.debug("CG finished after %d of %d iterations, residual norm^2 %e", iteration, limit, bestResidual);
    return best;
  }
}
