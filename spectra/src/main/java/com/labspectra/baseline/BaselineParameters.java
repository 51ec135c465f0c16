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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Settings for a baseline run.  This is also the "parameters" payload persisted with a baseline_correction record,
 * so field names follow the stored JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineParameters {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String DEFAULT_METHOD = "als";
  public static final double DEFAULT_LAMBDA = 1000.0;
  public static final double DEFAULT_P = 0.01;
  public static final int DEFAULT_ITERATIONS = 10;

  @JsonProperty("method")
  private String method = DEFAULT_METHOD;

  @JsonProperty("lambda")
  private double lambda = DEFAULT_LAMBDA;

  @JsonProperty("p")
  private double p = DEFAULT_P;

  @JsonProperty("iterations")
  private int iterations = DEFAULT_ITERATIONS;

  @JsonProperty("degree")
  private int degree = PolynomialBaselineCorrector.DEFAULT_DEGREE;

  @JsonProperty("use_simplified")
  @JsonAlias("useSimplified")
  private boolean useSimplified = false;

  @JsonProperty("polynomial_strategy")
  private PolynomialBaselineCorrector.Strategy polynomialStrategy = PolynomialBaselineCorrector.Strategy.LEAST_SQUARES;

  public BaselineParameters() {
  }

  public BaselineParameters(BaselineParameters other) {
    this.method = other.method;
    this.lambda = other.lambda;
    this.p = other.p;
    this.iterations = other.iterations;
    this.degree = other.degree;
    this.useSimplified = other.useSimplified;
    this.polynomialStrategy = other.polynomialStrategy;
  }

  public static BaselineParameters fromMap(Map<String, ?> values) {
    if (values == null) {
      return new BaselineParameters();
    }
    return OBJECT_MAPPER.convertValue(values, BaselineParameters.class);
  }

  public Map<String, Object> toMap() {
    return OBJECT_MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
  }

  public String getMethod() {
    return method;
  }

  public BaselineParameters setMethod(String method) {
    this.method = method;
    return this;
  }

  public double getLambda() {
    return lambda;
  }

  public BaselineParameters setLambda(double lambda) {
    this.lambda = lambda;
    return this;
  }

  public double getP() {
    return p;
  }

  public BaselineParameters setP(double p) {
    this.p = p;
    return this;
  }

  public int getIterations() {
    return iterations;
  }

  public BaselineParameters setIterations(int iterations) {
    this.iterations = iterations;
    return this;
  }

  public int getDegree() {
    return degree;
  }

  public BaselineParameters setDegree(int degree) {
    this.degree = degree;
    return this;
  }

  public boolean isUseSimplified() {
    return useSimplified;
  }

  public BaselineParameters setUseSimplified(boolean useSimplified) {
    this.useSimplified = useSimplified;
    return this;
  }

  public PolynomialBaselineCorrector.Strategy getPolynomialStrategy() {
    return polynomialStrategy;
  }

  public BaselineParameters setPolynomialStrategy(PolynomialBaselineCorrector.Strategy polynomialStrategy) {
    this.polynomialStrategy = polynomialStrategy;
    return this;
  }

  @Override
  public String toString() {
    return String.format("BaselineParameters{method=%s, lambda=%.1f, p=%.4f, iterations=%d, degree=%d, " +
        "useSimplified=%s, polynomialStrategy=%s}", method, lambda, p, iterations, degree, useSimplified,
        polynomialStrategy);
  }
}
