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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Results of a peak_detection record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeakDetectionPayload {

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class PeakEntry {
    @JsonProperty("id")
    private String id;

    @JsonProperty("position")
    private double position;

    @JsonProperty("intensity")
    private double intensity;

    @JsonProperty("width")
    private Double width;

    @JsonProperty("prominence")
    private double prominence;

    protected PeakEntry() {
    }

    public PeakEntry(String id, double position, double intensity, Double width, double prominence) {
      this.id = id;
      this.position = position;
      this.intensity = intensity;
      this.width = width;
      this.prominence = prominence;
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

    public Double getWidth() {
      return width;
    }

    public double getProminence() {
      return prominence;
    }
  }

  @JsonProperty("peaks")
  private List<PeakEntry> peaks = new ArrayList<>();

  @JsonProperty("peak_count")
  private int peakCount;

  @JsonProperty("technique")
  private String technique;

  @JsonProperty("data_mode")
  private String dataMode;

  protected PeakDetectionPayload() {
  }

  public PeakDetectionPayload(List<PeakEntry> peaks, String technique, String dataMode) {
    this.peaks = new ArrayList<>(peaks);
    this.peakCount = peaks.size();
    this.technique = technique;
    this.dataMode = dataMode;
  }

  public List<PeakEntry> getPeaks() {
    return peaks;
  }

  public int getPeakCount() {
    return peakCount;
  }

  public String getTechnique() {
    return technique;
  }

  public String getDataMode() {
    return dataMode;
  }
}
