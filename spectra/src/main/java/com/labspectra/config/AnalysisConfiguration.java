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

package com.labspectra.config;

import com.labspectra.baseline.BaselineCorrectors;
import com.labspectra.baseline.BaselineParameters;
import com.labspectra.baseline.PolynomialBaselineCorrector;
import com.labspectra.integration.PeakIntegrator;
import com.labspectra.peaks.PeakDetectionParameters;
import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.Configuration;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;

/**
 * Default analysis settings, read from spectral-analysis.properties.  Every key is optional; a missing file or key
 * falls back to the built-in default.
 */
public class AnalysisConfiguration {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisConfiguration.class);

  public static final String DEFAULT_RESOURCE = "spectral-analysis.properties";

  public static final String BASELINE_METHOD = "baseline.method";
  public static final String BASELINE_LAMBDA = "baseline.lambda";
  public static final String BASELINE_P = "baseline.p";
  public static final String BASELINE_ITERATIONS = "baseline.iterations";
  public static final String BASELINE_DEGREE = "baseline.degree";
  public static final String BASELINE_POLYNOMIAL_STRATEGY = "baseline.polynomialStrategy";
  public static final String BASELINE_SIMPLIFIED_THRESHOLD = "baseline.simplifiedThreshold";
  public static final String PEAKS_PROMINENCE = "peaks.prominence";
  public static final String PEAKS_DISTANCE = "peaks.distance";
  public static final String PEAKS_WIDTH = "peaks.width";
  public static final String PEAKS_THRESHOLD = "peaks.threshold";
  public static final String PEAKS_RELATIVE_THRESHOLD = "peaks.relativeThreshold";
  public static final String PEAKS_WINDOW_SIZE = "peaks.windowSize";
  public static final String INTEGRATION_DEFAULT_WIDTH = "integration.defaultWidth";
  public static final String STORE_DIRECTORY = "store.directory";

  public static final String DEFAULT_STORE_DIRECTORY = "analysis-results";

  private final Configuration config;

  public AnalysisConfiguration(Configuration config) {
    this.config = config;
  }

  /**
   * Reads the properties file from the classpath (or working directory).
   */
  public static AnalysisConfiguration load() {
    try {
      return new AnalysisConfiguration(new PropertiesConfiguration(DEFAULT_RESOURCE));
    } catch (ConfigurationException e) {
      LOGGER.warn("No %s found, continuing with default analysis settings", DEFAULT_RESOURCE);
      return defaults();
    }
  }

  public static AnalysisConfiguration load(File file) {
    try {
      return new AnalysisConfiguration(new PropertiesConfiguration(file));
    } catch (ConfigurationException e) {
      LOGGER.warn("Unable to read configuration %s (%s), continuing with default analysis settings",
          file.getAbsolutePath(), e.getMessage());
      return defaults();
    }
  }

  public static AnalysisConfiguration defaults() {
    return new AnalysisConfiguration(new BaseConfiguration());
  }

  /**
   * @return A fresh parameter object the caller may modify.
   */
  public BaselineParameters getBaselineParameters() {
    return new BaselineParameters()
        .setMethod(config.getString(BASELINE_METHOD, BaselineParameters.DEFAULT_METHOD))
        .setLambda(config.getDouble(BASELINE_LAMBDA, BaselineParameters.DEFAULT_LAMBDA))
        .setP(config.getDouble(BASELINE_P, BaselineParameters.DEFAULT_P))
        .setIterations(config.getInt(BASELINE_ITERATIONS, BaselineParameters.DEFAULT_ITERATIONS))
        .setDegree(config.getInt(BASELINE_DEGREE, PolynomialBaselineCorrector.DEFAULT_DEGREE))
        .setPolynomialStrategy(PolynomialBaselineCorrector.Strategy.fromName(
            config.getString(BASELINE_POLYNOMIAL_STRATEGY, null)));
  }

  /**
   * @return A fresh parameter object the caller may modify.
   */
  public PeakDetectionParameters getPeakDetectionParameters() {
    return new PeakDetectionParameters()
        .setProminence(config.getDouble(PEAKS_PROMINENCE, PeakDetectionParameters.DEFAULT_PROMINENCE))
        .setDistance(config.getInt(PEAKS_DISTANCE, PeakDetectionParameters.DEFAULT_DISTANCE))
        .setWidth(config.getDouble(PEAKS_WIDTH, PeakDetectionParameters.DEFAULT_WIDTH))
        .setThreshold(config.getDouble(PEAKS_THRESHOLD, PeakDetectionParameters.DEFAULT_THRESHOLD))
        .setRelativeThreshold(
            config.getDouble(PEAKS_RELATIVE_THRESHOLD, PeakDetectionParameters.DEFAULT_RELATIVE_THRESHOLD))
        .setWindowSize(config.getInt(PEAKS_WINDOW_SIZE, PeakDetectionParameters.DEFAULT_WINDOW_SIZE));
  }

  /**
   * @return True if the configuration fixes the ALS lambda rather than leaving it to the technique's default.
   */
  public boolean hasExplicitLambda() {
    return config.containsKey(BASELINE_LAMBDA);
  }

  public int getSimplifiedThreshold() {
    return config.getInt(BASELINE_SIMPLIFIED_THRESHOLD, BaselineCorrectors.DEFAULT_SIMPLIFIED_THRESHOLD);
  }

  public int getIntegrationDefaultWidth() {
    return config.getInt(INTEGRATION_DEFAULT_WIDTH, PeakIntegrator.DEFAULT_WIDTH);
  }

  public File getStoreDirectory() {
    return new File(config.getString(STORE_DIRECTORY, DEFAULT_STORE_DIRECTORY));
  }
}
