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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labspectra.analysis.WorkingSpectrum;
import com.labspectra.baseline.BaselineParameters;
import com.labspectra.conversion.DataMode;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.IntegrationRecord;
import com.labspectra.peaks.PeakDetectionParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between a {@link WorkingSpectrum} and the three records saved for it.  Restoring reads the saved
 * arrays back as they are; nothing is recomputed.
 */
public final class AnalysisRecords {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisRecords.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

  public static final String BASELINE_CORRECTION = "baseline_correction";
  public static final String PEAK_DETECTION = "peak_detection";
  public static final String PEAK_INTEGRATION = "peak_integration";

  private AnalysisRecords() {
  }

  public static AnalysisRecord baselineCorrection(String spectrumId, WorkingSpectrum spectrum,
                                                  BaselineParameters params) {
    BaselineCorrectionPayload payload = new BaselineCorrectionPayload(spectrum.getOriginalY(), spectrum.getY(),
        spectrum.getBaseline(), spectrum.getTechnique(), spectrum.getMode().getName(), true);
    return new AnalysisRecord(spectrumId, BASELINE_CORRECTION, params.toMap(), toMap(payload));
  }

  public static AnalysisRecord peakDetection(String spectrumId, WorkingSpectrum spectrum,
                                             PeakDetectionParameters params) {
    List<PeakDetectionPayload.PeakEntry> entries = new ArrayList<>();
    for (DetectedPeak peak : spectrum.getPeaks()) {
      entries.add(new PeakDetectionPayload.PeakEntry(
          peak.getId(), peak.getX(), peak.getY(), peak.getWidth(), peak.getProminence()));
    }
    PeakDetectionPayload payload =
        new PeakDetectionPayload(entries, spectrum.getTechnique(), spectrum.getMode().getName());
    return new AnalysisRecord(spectrumId, PEAK_DETECTION, params.toMap(), toMap(payload));
  }

  public static AnalysisRecord peakIntegration(String spectrumId, WorkingSpectrum spectrum) {
    List<PeakIntegrationPayload.IntegratedPeakEntry> entries = new ArrayList<>();
    for (DetectedPeak peak : spectrum.getPeaks()) {
      IntegrationRecord integration = peak.getIntegration();
      if (integration == null) {
        continue;
      }
      entries.add(new PeakIntegrationPayload.IntegratedPeakEntry(peak.getId(), peak.getX(), peak.getY(),
          integration.getArea(), integration.getStartX(), integration.getEndX(), integration.isManuallyAdjusted()));
    }
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("method", "mixed");
    parameters.put("integration_type", "trapezoidal");
    PeakIntegrationPayload payload =
        new PeakIntegrationPayload(entries, spectrum.getTechnique(), spectrum.getMode().getName());
    return new AnalysisRecord(spectrumId, PEAK_INTEGRATION, parameters, toMap(payload));
  }

  /**
   * Rebuild session state on top of a freshly normalized spectrum.  Records are applied baseline first, then
   * detection, then integration, whatever order they are passed in.  A record whose arrays do not line up with the
   * spectrum is skipped with a warning.
   * @param base The normalized spectrum the records were computed from.
   * @param records The latest record of each method.
   * @return The restored state.
   */
  public static RestoredAnalysis restore(WorkingSpectrum base, List<AnalysisRecord> records) {
    Map<String, AnalysisRecord> byMethod = new HashMap<>();
    for (AnalysisRecord record : records) {
      byMethod.put(record.getMethodName(), record);
    }

    WorkingSpectrum spectrum = base;
    BaselineParameters baselineParams = null;
    PeakDetectionParameters peakParams = null;

    AnalysisRecord baselineRecord = byMethod.get(BASELINE_CORRECTION);
    if (baselineRecord != null) {
      BaselineCorrectionPayload payload =
          OBJECT_MAPPER.convertValue(baselineRecord.getResults(), BaselineCorrectionPayload.class);
      baselineParams = BaselineParameters.fromMap(baselineRecord.getParameters());
      spectrum = restoreBaseline(spectrum, payload);
    }

    AnalysisRecord detectionRecord = byMethod.get(PEAK_DETECTION);
    if (detectionRecord != null) {
      PeakDetectionPayload payload =
          OBJECT_MAPPER.convertValue(detectionRecord.getResults(), PeakDetectionPayload.class);
      peakParams = PeakDetectionParameters.fromMap(detectionRecord.getParameters());
      spectrum = inMode(spectrum, payload.getDataMode());
      List<DetectedPeak> peaks = new ArrayList<>();
      for (PeakDetectionPayload.PeakEntry entry : payload.getPeaks()) {
        peaks.add(new DetectedPeak(entry.getId(), entry.getPosition(), entry.getIntensity(), entry.getProminence(),
            entry.getWidth(), null, null, null));
      }
      spectrum = spectrum.withPeaks(peaks);
      LOGGER.info("Peak detection restored: %d peaks", peaks.size());
    }

    AnalysisRecord integrationRecord = byMethod.get(PEAK_INTEGRATION);
    if (integrationRecord != null) {
      PeakIntegrationPayload payload =
          OBJECT_MAPPER.convertValue(integrationRecord.getResults(), PeakIntegrationPayload.class);
      Map<String, PeakIntegrationPayload.IntegratedPeakEntry> byId = new HashMap<>();
      for (PeakIntegrationPayload.IntegratedPeakEntry entry : payload.getIntegratedPeaks()) {
        byId.put(entry.getId(), entry);
      }
      List<DetectedPeak> peaks = new ArrayList<>();
      for (DetectedPeak peak : spectrum.getPeaks()) {
        PeakIntegrationPayload.IntegratedPeakEntry entry = byId.get(peak.getId());
        peaks.add(entry == null ? peak : peak.withIntegration(new IntegrationRecord(entry.getIntegrationArea(),
            entry.getIntegrationStart(), entry.getIntegrationEnd(), entry.isManuallyAdjusted())));
      }
      spectrum = spectrum.withPeaks(peaks);
      LOGGER.info("Integration results restored for %d peaks", byId.size());
    }

    return new RestoredAnalysis(spectrum, baselineParams, peakParams);
  }

  private static WorkingSpectrum restoreBaseline(WorkingSpectrum spectrum, BaselineCorrectionPayload payload) {
    if (!payload.isApplied() || payload.getCorrectedIntensities() == null) {
      return spectrum;
    }
    int size = spectrum.getData().size();
    double[] corrected = payload.getCorrectedIntensities();
    double[] fitted = payload.getBaseline();
    double[] original = payload.getOriginalIntensities();
    if (corrected.length != size || (fitted != null && fitted.length != size) ||
        (original != null && original.length != size)) {
      LOGGER.warn("Saved baseline correction has %d points but the spectrum has %d; not restored",
          corrected.length, size);
      return spectrum;
    }
    WorkingSpectrum inSavedMode = inMode(spectrum, payload.getDataMode());
    WorkingSpectrum restored = inSavedMode.withRestoredBaseline(
        original == null ? inSavedMode.getOriginalY() : original, corrected, fitted);
    LOGGER.info("Baseline correction restored from saved analysis");
    return restored;
  }

  private static WorkingSpectrum inMode(WorkingSpectrum spectrum, String savedMode) {
    DataMode mode;
    try {
      mode = DataMode.fromName(savedMode);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring unknown saved data mode '%s'", savedMode);
      return spectrum;
    }
    return mode == null ? spectrum : spectrum.withMode(mode);
  }

  private static Map<String, Object> toMap(Object payload) {
    return OBJECT_MAPPER.convertValue(payload, MAP_TYPE);
  }
}
