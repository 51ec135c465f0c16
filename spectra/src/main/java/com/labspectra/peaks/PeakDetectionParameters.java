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

package com.labspectra.peaks;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labspectra.conversion.DataMode;
import com.labspectra.spectrum.Techniques;

import java.util.Map;

/**
 * Detection settings, persisted as the "parameters" payload of a peak_detection record.
 *
 * prominence is a fraction of the intensity range; distance, width and window_size are in samples; threshold is
 * absolute and relative_threshold a fraction of the maximum intensity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeakDetectionParameters {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final double DEFAULT_PROMINENCE = 0.01;
  public static final int DEFAULT_DISTANCE = 5;
  public static final double DEFAULT_WIDTH = 2.0;
  public static final double DEFAULT_THRESHOLD = 0.001;
  public static final double DEFAULT_RELATIVE_THRESHOLD = 0.05;
  public static final int DEFAULT_WINDOW_SIZE = 5;

  @JsonProperty("prominence")
  private double prominence = DEFAULT_PROMINENCE;

  @JsonProperty("distance")
  private int distance = DEFAULT_DISTANCE;

  @JsonProperty("width")
  private double width = DEFAULT_WIDTH;

  @JsonProperty("threshold")
  private double threshold = DEFAULT_THRESHOLD;

  @JsonProperty("relative_threshold")
  @JsonAlias("relativeThreshold")
  private double relativeThreshold = DEFAULT_RELATIVE_THRESHOLD;

  @JsonProperty("detect_valleys")
  @JsonAlias("detectValleys")
  private boolean detectValleys = false;

  @JsonProperty("window_size")
  @JsonAlias("windowSize")
  private int windowSize = DEFAULT_WINDOW_SIZE;

  @JsonProperty("use_simplified")
  @JsonAlias("useSimplified")
  private boolean useSimplified = false;

  @JsonProperty("technique")
  private String technique;

  @JsonProperty("data_mode")
  @JsonAlias("dataMode")
  private DataMode dataMode;

  @JsonProperty("run_id")
  private String runId;

  public PeakDetectionParameters() {
  }

  public PeakDetectionParameters(PeakDetectionParameters other) {
    this.prominence = other.prominence;
    this.distance = other.distance;
    this.width = other.width;
    this.threshold = other.threshold;
    this.relativeThreshold = other.relativeThreshold;
    this.detectValleys = other.detectValleys;
    this.windowSize = other.windowSize;
    this.useSimplified = other.useSimplified;
    this.technique = other.technique;
    this.dataMode = other.dataMode;
    this.runId = other.runId;
  }

  public static PeakDetectionParameters fromMap(Map<String, ?> values) {
    if (values == null) {
      return new PeakDetectionParameters();
    }
    return OBJECT_MAPPER.convertValue(values, PeakDetectionParameters.class);
  }

  public Map<String, Object> toMap() {
    return OBJECT_MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
  }

  /**
   * Absorption features recorded as transmittance are dips, so they are searched for as minima.
   */
  @JsonIgnore
  public boolean isValleyMode() {
    return detectValleys || (dataMode == DataMode.TRANSMITTANCE && Techniques.isAbsorption(technique));
  }

  public double getProminence() {
    return prominence;
  }

  public PeakDetectionParameters setProminence(double prominence) {
    this.prominence = prominence;
    return this;
  }

  public int getDistance() {
    return distance;
  }

  public PeakDetectionParameters setDistance(int distance) {
    this.distance = distance;
    return this;
  }

  public double getWidth() {
    return width;
  }

  public PeakDetectionParameters setWidth(double width) {
    this.width = width;
    return this;
  }

  public double getThreshold() {
    return threshold;
  }

  public PeakDetectionParameters setThreshold(double threshold) {
    this.threshold = threshold;
    return this;
  }

  public double getRelativeThreshold() {
    return relativeThreshold;
  }

  public PeakDetectionParameters setRelativeThreshold(double relativeThreshold) {
    this.relativeThreshold = relativeThreshold;
    return this;
  }

  public boolean isDetectValleys() {
    return detectValleys;
  }

  public PeakDetectionParameters setDetectValleys(boolean detectValleys) {
    this.detectValleys = detectValleys;
    return this;
  }

  public int getWindowSize() {
    return windowSize;
  }

  public PeakDetectionParameters setWindowSize(int windowSize) {
    this.windowSize = windowSize;
    return this;
  }

  public boolean isUseSimplified() {
    return useSimplified;
  }

  public PeakDetectionParameters setUseSimplified(boolean useSimplified) {
    this.useSimplified = useSimplified;
    return this;
  }

  public String getTechnique() {
    return technique;
  }

  public PeakDetectionParameters setTechnique(String technique) {
    this.technique = technique;
    return this;
  }

  public DataMode getDataMode() {
    return dataMode;
  }

  public PeakDetectionParameters setDataMode(DataMode dataMode) {
    this.dataMode = dataMode;
    return this;
  }

  public String getRunId() {
    return runId;
  }

  public PeakDetectionParameters setRunId(String runId) {
    this.runId = runId;
    return this;
  }

  @Override
  public String toString() {
    return String.format("PeakDetectionParameters{prominence=%.4f, distance=%d, width=%.2f, threshold=%.4f, " +
            "relativeThreshold=%.4f, valleys=%s, windowSize=%d, simplified=%s, technique=%s, dataMode=%s}",
        prominence, distance, width, threshold, relativeThreshold, isValleyMode(), windowSize, useSimplified,
        technique, dataMode);
  }
}
