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

import java.util.ArrayList;
import java.util.List;

/**
 * Results of a peak_integration record.  Only integrated peaks are listed; they are matched back to detected peaks
 * by id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeakIntegrationPayload {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class IntegratedPeakEntry {
    @JsonProperty("id")
    private String id;

    @JsonProperty("position")
    private double position;

    @JsonProperty("intensity")
    private double intensity;

    @JsonProperty("integration_area")
    private double integrationArea;

    @JsonProperty("integration_start")
    private double integrationStart;

    @JsonProperty("integration_end")
    private double integrationEnd;

    @JsonProperty("manually_adjusted")
    private boolean manuallyAdjusted;

    protected IntegratedPeakEntry() {
    }

    public IntegratedPeakEntry(String id, double position, double intensity, double integrationArea,
                               double integrationStart, double integrationEnd, boolean manuallyAdjusted) {
      this.id = id;
      this.position = position;
      this.intensity = intensity;
      this.integrationArea = integrationArea;
      this.integrationStart = integrationStart;
      this.integrationEnd = integrationEnd;
      this.manuallyAdjusted = manuallyAdjusted;
    }

    public String getId() {
      return id;
    }

    public double getPosition() {
      return position;
    }

    public double getIntensity() {
      return intensity;
    }

    public double getIntegrationArea() {
      return integrationArea;
    }

    public double getIntegrationStart() {
      return integrationStart;
    }

    public double getIntegrationEnd() {
      return integrationEnd;
    }

    public boolean isManuallyAdjusted() {
      return manuallyAdjusted;
    }
  }

  @JsonProperty("integrated_peaks")
  private List<IntegratedPeakEntry> integratedPeaks = new ArrayList<>();

  @JsonProperty("total_integrated_peaks")
  private int totalIntegratedPeaks;

  @JsonProperty("technique")
  private String technique;

  @JsonProperty("data_mode")
  private String dataMode;

  protected PeakIntegrationPayload() {
  }

  public PeakIntegrationPayload(List<IntegratedPeakEntry> integratedPeaks, String technique, String dataMode) {
    this.integratedPeaks = new ArrayList<>(integratedPeaks);
    this.totalIntegratedPeaks = integratedPeaks.size();
    this.technique = technique;
    this.dataMode = dataMode;
  }

  public List<IntegratedPeakEntry> getIntegratedPeaks() {
    return integratedPeaks;
  }

  public int getTotalIntegratedPeaks() {
    return totalIntegratedPeaks;
  }

  public String getTechnique() {
    return technique;
  }

  public String getDataMode() {
    return dataMode;
  }
}
