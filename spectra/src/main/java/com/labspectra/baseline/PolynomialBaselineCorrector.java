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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.labspectra.spectrum.Spectrum;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Baseline through the minimum of each of ~50 equal-size windows.  A degree of 1 fits a least-squares line through
 * those anchors; higher degrees either fit a real polynomial of that order (LEAST_SQUARES) or connect the anchors
 * with straight segments (ANCHOR_INTERPOLATION).
 */
public class PolynomialBaselineCorrector implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PolynomialBaselineCorrector.class);

  public static final String NAME = "polynomial";
  public static final int DEFAULT_DEGREE = 3;

  private static final int MIN_WINDOW_SIZE = 10;
  private static final int TARGET_WINDOWS = 50;

  public enum Strategy {
    LEAST_SQUARES,
    ANCHOR_INTERPOLATION,
    ;

    @JsonCreator
    public static Strategy fromName(String name) {
      if (name == null || name.trim().isEmpty()) {
        return LEAST_SQUARES;
      }
      return Strategy.valueOf(name.trim().toUpperCase());
    }
  }

  private final int degree;
  private final Strategy strategy;

  public PolynomialBaselineCorrector(int degree) {
    this(degree, Strategy.LEAST_SQUARES);
  }

  public PolynomialBaselineCorrector(int degree, Strategy strategy) {
    Validate.isTrue(degree >= 1, "Polynomial degree must be at least 1, got %d", degree);
    Validate.notNull(strategy, "Polynomial strategy must be specified");
    this.degree = degree;
    this.strategy = strategy;
  }

  @Override
  public String getName() {
    return NAME;
  }

  public int getDegree() {
    return degree;
  }

  public Strategy getStrategy() {
    return strategy;
  }

  @Override
  public BaselineResult correct(Spectrum spectrum) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("Polynomial baseline skipped: %s is not analyzable", spectrum);
      return BaselineResult.empty();
    }

    double[] x = spectrum.getX();
    double[] y = spectrum.getY();
    List<Integer> anchors = findAnchors(y);
    LOGGER.debug("Polynomial baseline: %d anchors over %d points (degree %d, %s)",
        anchors.size(), y.length, degree, strategy);

    double[] baseline;
    if (degree == 1) {
      baseline = fitLine(x, y, anchors);
    } else if (strategy == Strategy.ANCHOR_INTERPOLATION) {
      baseline = interpolateAnchors(y, anchors);
    } else {
      baseline = fitPolynomial(x, y, anchors);
    }
    return BaselineResult.of(y, baseline);
  }

  /**
   * Index of the smallest value in each consecutive window of max(10, n / 50) samples.
   */
  static List<Integer> findAnchors(double[] y) {
    int n = y.length;
    int windowSize = Math.max(MIN_WINDOW_SIZE, n / TARGET_WINDOWS);
    List<Integer> anchors = new ArrayList<>();
    for (int start = 0; start < n; start += windowSize) {
      int end = Math.min(start + windowSize, n);
      int minIndex = start;
      for (int j = start; j < end; j++) {
        if (y[j] < y[minIndex]) {
          minIndex = j;
        }
      }
      anchors.add(minIndex);
    }
    return anchors;
  }

  private double[] fitLine(double[] x, double[] y, List<Integer> anchors) {
    SimpleRegression regression = new SimpleRegression();
    for (Integer i : anchors) {
      regression.addData(x[i], y[i]);
    }
    double[] baseline = new double[y.length];
    double slope = regression.getSlope();
    if (Double.isNaN(slope)) {
      // All anchors share one x value (or there is only one anchor): fall back to their mean.
      double mean = meanAt(y, anchors);
      LOGGER.warn("Polynomial baseline: degenerate anchor line, using flat baseline at %.4f", mean);
      for (int i = 0; i < baseline.length; i++) {
        baseline[i] = mean;
      }
      return baseline;
    }
    double intercept = regression.getIntercept();
    for (int i = 0; i < baseline.length; i++) {
      baseline[i] = slope * x[i] + intercept;
    }
    return baseline;
  }

  private double[] fitPolynomial(double[] x, double[] y, List<Integer> anchors) {
    double[] baseline = new double[y.length];
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double v : x) {
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    int effectiveDegree = Math.min(degree, anchors.size() - 1);
    if (max == min || effectiveDegree < 1) {
      double mean = meanAt(y, anchors);
      LOGGER.warn("Polynomial baseline: cannot fit degree %d through %d anchors, using flat baseline at %.4f",
          degree, anchors.size(), mean);
      for (int i = 0; i < baseline.length; i++) {
        baseline[i] = mean;
      }
      return baseline;
    }

    // Map x onto [-1, 1] to keep the normal equations well conditioned for large wavenumbers.
    WeightedObservedPoints points = new WeightedObservedPoints();
    for (Integer i : anchors) {
      points.add(normalize(x[i], min, max), y[i]);
    }
    double[] coefficients = PolynomialCurveFitter.create(effectiveDegree).fit(points.toList());
    PolynomialFunction polynomial = new PolynomialFunction(coefficients);
    for (int i = 0; i < baseline.length; i++) {
      baseline[i] = polynomial.value(normalize(x[i], min, max));
    }
    return baseline;
  }

  private double[] interpolateAnchors(double[] y, List<Integer> anchors) {
    double[] baseline = new double[y.length];
    int lastAnchor = anchors.size() - 1;
    for (int i = 0; i < y.length; i++) {
      // Outside the first and last anchor the segment joining those two is extended.
      int left = 0;
      int right = lastAnchor;
      for (int j = 0; j < lastAnchor; j++) {
        if (i >= anchors.get(j) && i <= anchors.get(j + 1)) {
          left = j;
          right = j + 1;
          break;
        }
      }
      int leftIndex = anchors.get(left);
      int rightIndex = anchors.get(right);
      if (leftIndex == rightIndex) {
        baseline[i] = y[leftIndex];
      } else {
        double ratio = (double) (i - leftIndex) / (rightIndex - leftIndex);
        baseline[i] = y[leftIndex] + ratio * (y[rightIndex] - y[leftIndex]);
      }
    }
    return baseline;
  }

  private static double normalize(double value, double min, double max) {
    return 2.0 * (value - min) / (max - min) - 1.0;
  }

  private static double meanAt(double[] y, List<Integer> indices) {
    double sum = 0.0;
    for (Integer i : indices) {
      sum += y[i];
    }
    return sum / indices.size();
  }
}
