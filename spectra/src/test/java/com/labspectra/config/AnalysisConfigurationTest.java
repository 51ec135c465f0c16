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

import com.labspectra.baseline.BaselineParameters;
import com.labspectra.baseline.PolynomialBaselineCorrector;
import com.labspectra.peaks.PeakDetectionParameters;
import org.junit.Test;

import java.io.File;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class AnalysisConfigurationTest {
  public static final String OVERRIDE_RESOURCE = "/analysis-override.properties";

  private static File overrideFile() throws Exception {
    return new File(AnalysisConfigurationTest.class.getResource(OVERRIDE_RESOURCE).toURI());
  }

  @Test
  public void testDefaults() {
    AnalysisConfiguration config = AnalysisConfiguration.defaults();
    BaselineParameters baseline = config.getBaselineParameters();
    assertEquals("Default method", BaselineParameters.DEFAULT_METHOD, baseline.getMethod());
    assertEquals("Default lambda", BaselineParameters.DEFAULT_LAMBDA, baseline.getLambda(), 0.0);
    assertEquals("Default strategy", PolynomialBaselineCorrector.Strategy.LEAST_SQUARES,
        baseline.getPolynomialStrategy());
    assertFalse("No explicit lambda", config.hasExplicitLambda());
    assertEquals("Default threshold", 2000, config.getSimplifiedThreshold());
    assertEquals("Default integration width", 10, config.getIntegrationDefaultWidth());
    assertEquals("Default store", new File("analysis-results"), config.getStoreDirectory());
  }

  @Test
  public void testBundledPropertiesLeaveLambdaToTechnique() {
    AnalysisConfiguration config = AnalysisConfiguration.load();
    assertFalse("Lambda is commented out", config.hasExplicitLambda());
    assertEquals("ALS by default", "als", config.getBaselineParameters().getMethod());
    assertEquals("Window size", 5, config.getPeakDetectionParameters().getWindowSize());
  }

  @Test
  public void testOverrideFile() throws Exception {
    AnalysisConfiguration config = AnalysisConfiguration.load(overrideFile());
    BaselineParameters baseline = config.getBaselineParameters();
    assertEquals("Method", "polynomial", baseline.getMethod());
    assertEquals("Lambda", 5000.0, baseline.getLambda(), 0.0);
    assertEquals("Degree", 2, baseline.getDegree());
    assertEquals("Strategy from lowercase name", PolynomialBaselineCorrector.Strategy.ANCHOR_INTERPOLATION,
        baseline.getPolynomialStrategy());
    assertTrue("Explicit lambda", config.hasExplicitLambda());

    PeakDetectionParameters peaks = config.getPeakDetectionParameters();
    assertEquals("Prominence", 0.2, peaks.getProminence(), 0.0);
    assertEquals("Distance", 8, peaks.getDistance());
    assertEquals("Unset width keeps its default", PeakDetectionParameters.DEFAULT_WIDTH, peaks.getWidth(), 0.0);

    assertEquals("Integration width", 4, config.getIntegrationDefaultWidth());
    assertEquals("Store directory", new File("target/test-store"), config.getStoreDirectory());
  }

  @Test
  public void testMissingFileFallsBackToDefaults() {
    AnalysisConfiguration config = AnalysisConfiguration.load(new File("does/not/exist.properties"));
    assertEquals("Default method", "als", config.getBaselineParameters().getMethod());
    assertFalse("No explicit lambda", config.hasExplicitLambda());
  }

  @Test
  public void testParameterObjectsAreFresh() {
    AnalysisConfiguration config = AnalysisConfiguration.defaults();
    assertNotSame("New object per call", config.getBaselineParameters(), config.getBaselineParameters());
  }
}
