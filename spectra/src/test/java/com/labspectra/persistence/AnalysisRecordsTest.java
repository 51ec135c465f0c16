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
import com.labspectra.baseline.LinearBaselineCorrector;
import com.labspectra.conversion.DataMode;
import com.labspectra.integration.PeakIntegrator;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.PeakDetectionParameters;
import com.labspectra.spectrum.Spectrum;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AnalysisRecordsTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private WorkingSpectrum base;
  private WorkingSpectrum analyzed;

  @Before
  public void setUp() {
    double[] x = new double[]{0, 1, 2, 3, 4, 5, 6};
    double[] y = new double[]{1, 1.5, 7, 2.5, 3, 3.5, 4};
    base = WorkingSpectrum.of(new Spectrum(x, y), "raman", "wavenumbers", DataMode.ABSORBANCE);

    WorkingSpectrum corrected = base.withBaseline(new LinearBaselineCorrector().correct(base.getData()));
    List<DetectedPeak> peaks = Arrays.asList(
        new DetectedPeak("peak_t_0_2", 2.0, 5.0, 5.0, 2.0, 1.0, 3.0, null),
        new DetectedPeak("peak_t_1_5", 5.0, 0.0, 0.1));
    WorkingSpectrum withPeaks = corrected.withPeaks(peaks);
    analyzed = withPeaks.withPeaks(new PeakIntegrator().withBoundaries(withPeaks.getData(), withPeaks.getPeaks(),
        "peak_t_0_2", 1.0, 3.0));
  }

  @Test
  public void testBaselineRecordCarriesArraysAndParameters() {
    AnalysisRecord record = AnalysisRecords.baselineCorrection("s1", analyzed,
        new BaselineParameters().setMethod("linear"));
    assertEquals("Method name", AnalysisRecords.BASELINE_CORRECTION, record.getMethodName());
    assertEquals("Parameters", "linear", record.getParameters().get("method"));
    Map<String, Object> results = record.getResults();
    assertEquals("Applied flag", Boolean.TRUE, results.get("applied"));
    assertEquals("Technique", "raman", results.get("technique"));
    assertEquals("Data mode", "absorbance", results.get("data_mode"));
    assertEquals("Corrected array length", 7, ((List<?>) results.get("corrected_intensities")).size());
  }

  @Test
  public void testPeakRecordsUseStoredFieldNames() {
    AnalysisRecord detection = AnalysisRecords.peakDetection("s1", analyzed, new PeakDetectionParameters());
    assertEquals("Peak count", 2, ((Number) detection.getResults().get("peak_count")).intValue());
    Map<?, ?> first = (Map<?, ?>) ((List<?>) detection.getResults().get("peaks")).get(0);
    assertEquals("position key", 2.0, ((Number) first.get("position")).doubleValue(), 0.0);
    assertEquals("intensity key", 5.0, ((Number) first.get("intensity")).doubleValue(), 0.0);

    AnalysisRecord integration = AnalysisRecords.peakIntegration("s1", analyzed);
    assertEquals("Integration method", "mixed", integration.getParameters().get("method"));
    assertEquals("Integration type", "trapezoidal", integration.getParameters().get("integration_type"));
    assertEquals("Only integrated peaks", 1,
        ((Number) integration.getResults().get("total_integrated_peaks")).intValue());
  }

  @Test
  public void testSavedStateRestoresThroughTheFileStore() throws Exception {
    AnalysisArchive archive = new AnalysisArchive(new JsonFileAnalysisStore(tempFolder.getRoot()));
    List<AnalysisRecord> saved = archive.saveAll("s1", analyzed, new BaselineParameters().setMethod("linear"),
        new PeakDetectionParameters().setProminence(0.2));
    assertEquals("Baseline, detection and integration", 3, saved.size());

    RestoredAnalysis restored = archive.restore("s1", base);
    WorkingSpectrum spectrum = restored.getSpectrum();
    assertArrayEquals("Corrected intensities", analyzed.getY(), spectrum.getY(), 1e-12);
    assertArrayEquals("Original intensities", analyzed.getOriginalY(), spectrum.getOriginalY(), 1e-12);
    assertArrayEquals("Fitted baseline", analyzed.getBaseline(), spectrum.getBaseline(), 1e-12);
    assertEquals("Peaks", 2, spectrum.getPeaks().size());

    DetectedPeak integrated = spectrum.findPeak("peak_t_0_2");
    assertTrue("Integration matched by id", integrated.isIntegrated());
    assertEquals("Area", analyzed.findPeak("peak_t_0_2").getIntegration().getArea(),
        integrated.getIntegration().getArea(), 1e-12);
    assertTrue("Manual flag", integrated.isManuallyAdjusted());
    assertFalse("Unintegrated peak stays bare", spectrum.findPeak("peak_t_1_5").isIntegrated());

    assertEquals("Baseline parameters", "linear", restored.getBaselineParameters().getMethod());
    assertEquals("Peak parameters", 0.2, restored.getPeakParameters().getProminence(), 0.0);
  }

  @Test
  public void testBaselineOfWrongLengthIsSkipped() {
    AnalysisRecord record = AnalysisRecords.baselineCorrection("s1", analyzed, new BaselineParameters());
    WorkingSpectrum shorter = WorkingSpectrum.of(new Spectrum(new double[]{0, 1, 2}, new double[]{1, 2, 3}),
        "raman", "wavenumbers", DataMode.ABSORBANCE);
    RestoredAnalysis restored = AnalysisRecords.restore(shorter, Collections.singletonList(record));
    assertFalse("Nothing applied", restored.getSpectrum().hasBaseline());
    assertArrayEquals("Data unchanged", shorter.getY(), restored.getSpectrum().getY(), 0.0);
  }

  @Test
  public void testPeaksRestoreIntoSavedMode() {
    WorkingSpectrum transmittance = analyzed.withMode(DataMode.TRANSMITTANCE);
    AnalysisRecord record = AnalysisRecords.peakDetection("s1", transmittance, new PeakDetectionParameters());
    RestoredAnalysis restored = AnalysisRecords.restore(base, Collections.singletonList(record));
    assertEquals("Spectrum switched to the saved mode", DataMode.TRANSMITTANCE, restored.getSpectrum().getMode());
    assertEquals("Peak y as saved", transmittance.getPeaks().get(0).getY(),
        restored.getSpectrum().getPeaks().get(0).getY(), 1e-12);
    assertNull("No baseline record", restored.getBaselineParameters());
  }

  @Test
  public void testNoRecordsGivesBaseBack() {
    RestoredAnalysis restored = AnalysisRecords.restore(base, Collections.<AnalysisRecord>emptyList());
    assertSame("Untouched", base, restored.getSpectrum());
  }
}
