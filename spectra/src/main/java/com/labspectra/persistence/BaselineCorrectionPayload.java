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

package com.labspectra.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Results of a baseline_correction record.  applied marks a baseline that replaced the working intensities.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineCorrectionPayload {
  @JsonProperty("original_intensities")
  private double[] originalIntensities;

  @JsonProperty("corrected_intensities")
  private double[] correctedIntensities;

  @JsonProperty("baseline")
  private double[] baseline;

  @JsonProperty("technique")
  private String technique;

  @JsonProperty("data_mode")
  private String dataMode;

  @JsonProperty("applied")
  private boolean applied;

  // For deserialization.
  protected BaselineCorrectionPayload() {
  }

  public BaselineCorrectionPayload(double[] originalIntensities, double[] correctedIntensities, double[] baseline,
                                   String technique, String dataMode, boolean applied) {
    this.originalIntensities = originalIntensities;
    this.correctedIntensities = correctedIntensities;
    this.baseline = baseline;
    this.technique = technique;
    this.dataMode = dataMode;
    this.applied = applied;
  }

  public double[] getOriginalIntensities() {
    return originalIntensities;
  }

  public double[] getCorrectedIntensities() {
    return correctedIntensities;
  }

  public double[] getBaseline() {
    return baseline;
  }

  public String getTechnique() {
    return technique;
  }

  public String getDataMode() {
    return dataMode;
  }

  public boolean isApplied() {
    return applied;
  }
}
