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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One saved analysis: the method that ran on a spectrum, the parameters it ran with and what it produced.  The
 * parameter and result payloads are opaque to the store.
 */
public class AnalysisRecord {
  @JsonProperty("spectrum_id")
  private String spectrumId;

  @JsonProperty("method_name")
  private String methodName;

  @JsonProperty("parameters")
  private Map<String, Object> parameters;

  @JsonProperty("results")
  private Map<String, Object> results;

  @JsonCreator
  public AnalysisRecord(@JsonProperty("spectrum_id") String spectrumId,
                        @JsonProperty("method_name") String methodName,
                        @JsonProperty("parameters") Map<String, Object> parameters,
                        @JsonProperty("results") Map<String, Object> results) {
    this.spectrumId = spectrumId;
    this.methodName = methodName;
    this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
    this.results = results == null ? new LinkedHashMap<>() : new LinkedHashMap<>(results);
  }

  public String getSpectrumId() {
    return spectrumId;
  }

  public String getMethodName() {
    return methodName;
  }

  public Map<String, Object> getParameters() {
    return Collections.unmodifiableMap(parameters);
  }

  public Map<String, Object> getResults() {
    return Collections.unmodifiableMap(results);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnalysisRecord that = (AnalysisRecord) o;
    return Objects.equals(spectrumId, that.spectrumId) &&
        Objects.equals(methodName, that.methodName) &&
        Objects.equals(parameters, that.parameters) &&
        Objects.equals(results, that.results);
  }

  @Override
  public int hashCode() {
    return Objects.hash(spectrumId, methodName, parameters, results);
  }

  @Override
  public String toString() {
    return String.format("AnalysisRecord{spectrumId=%s, methodName=%s}", spectrumId, methodName);
  }
}
