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

import com.labspectra.analysis.WorkingSpectrum;
import com.labspectra.baseline.BaselineParameters;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.PeakDetectionParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Saves and restores the whole state of an analysis session through an {@link AnalysisStore}.
 */
public class AnalysisArchive {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisArchive.class);

  private final AnalysisStore store;

  public AnalysisArchive(AnalysisStore store) {
    this.store = store;
  }

  /**
   * Save a record for every stage that has produced something: a baseline_correction record if a baseline was
   * applied, a peak_detection record if there are peaks and a peak_integration record if any peak is integrated.
   * @return The records that were saved.
   * @throws AnalysisPersistenceException If the store fails; records saved before the failure stay saved.
   */
  public List<AnalysisRecord> saveAll(String spectrumId, WorkingSpectrum spectrum, BaselineParameters baselineParams,
                                      PeakDetectionParameters peakParams) throws AnalysisPersistenceException {
    List<AnalysisRecord> saved = new ArrayList<>();
    if (spectrum.hasBaseline()) {
      saved.add(AnalysisRecords.baselineCorrection(spectrumId, spectrum,
          baselineParams == null ? new BaselineParameters() : baselineParams));
    }
    if (!spectrum.getPeaks().isEmpty()) {
      saved.add(AnalysisRecords.peakDetection(spectrumId, spectrum,
          peakParams == null ? new PeakDetectionParameters() : peakParams));
    }
    if (hasIntegratedPeak(spectrum.getPeaks())) {
      saved.add(AnalysisRecords.peakIntegration(spectrumId, spectrum));
    }

    for (AnalysisRecord record : saved) {
      store.save(record);
    }
    LOGGER.info("Saved %d analysis type(s) for spectrum %s", saved.size(), spectrumId);
    return saved;
  }

  public RestoredAnalysis restore(String spectrumId, WorkingSpectrum base) throws AnalysisPersistenceException {
    List<AnalysisRecord> records = store.loadLatest(spectrumId);
    LOGGER.debug("Restoring spectrum %s from %d records", spectrumId, records.size());
    return AnalysisRecords.restore(base, records);
  }

  private static boolean hasIntegratedPeak(List<DetectedPeak> peaks) {
    for (DetectedPeak peak : peaks) {
      if (peak.isIntegrated()) {
        return true;
      }
    }
    return false;
  }
}
