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

package com.labspectra.analysis;

import com.labspectra.baseline.BaselineCorrector;
import com.labspectra.baseline.BaselineCorrectors;
import com.labspectra.baseline.BaselineParameters;
import com.labspectra.baseline.BaselineResult;
import com.labspectra.baseline.RecommendedLambda;
import com.labspectra.config.AnalysisConfiguration;
import com.labspectra.conversion.DataMode;
import com.labspectra.conversion.UnitConversionResult;
import com.labspectra.conversion.UnitConverter;
import com.labspectra.integration.BoundaryClickResult;
import com.labspectra.integration.BoundarySelection;
import com.labspectra.integration.PeakIntegrator;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.PeakDetectionParameters;
import com.labspectra.peaks.PeakIds;
import com.labspectra.peaks.PeakPicker;
import com.labspectra.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the analysis pipeline:
 *   raw samples -> normalize -> correctBaseline -> detectPeaks -> integrateAll
 * with boundary edits, mode switches and unit conversions applied in between.
 *
 * The engine holds no session state.  Every operation takes the current {@link WorkingSpectrum} and returns the
 * next one, so one engine can serve any number of spectra from any number of threads.
 */
public class SpectralAnalysisEngine {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectralAnalysisEngine.class);

  private final AnalysisConfiguration configuration;
  private final SpectrumNormalizer normalizer;
  private final UnitConverter unitConverter;
  private final PeakPicker peakPicker;
  private final PeakIntegrator integrator;

  public SpectralAnalysisEngine() {
    this(AnalysisConfiguration.load());
  }

  public SpectralAnalysisEngine(AnalysisConfiguration configuration) {
    this(configuration, new SpectrumNormalizer(), new UnitConverter(), new PeakPicker(),
        new PeakIntegrator(configuration.getIntegrationDefaultWidth()));
  }

  public SpectralAnalysisEngine(AnalysisConfiguration configuration, SpectrumNormalizer normalizer,
                                UnitConverter unitConverter, PeakPicker peakPicker, PeakIntegrator integrator) {
    this.configuration = configuration;
    this.normalizer = normalizer;
    this.unitConverter = unitConverter;
    this.peakPicker = peakPicker;
    this.integrator = integrator;
  }

  public AnalysisConfiguration getConfiguration() {
    return configuration;
  }

  public WorkingSpectrum normalize(Spectrum raw, String technique, Map<String, ?> metadata) {
    return normalizer.normalize(raw, technique, metadata);
  }

  /**
   * Configured baseline defaults, with lambda taken from the technique's recommendation unless the configuration
   * sets one.
   */
  public BaselineParameters baselineParametersFor(String technique) {
    BaselineParameters params = configuration.getBaselineParameters();
    if (!configuration.hasExplicitLambda()) {
      params.setLambda(RecommendedLambda.forTechnique(technique).getDefault());
    }
    return params;
  }

  public PeakDetectionParameters peakParametersFor(WorkingSpectrum spectrum) {
    return configuration.getPeakDetectionParameters()
        .setTechnique(spectrum.getTechnique())
        .setDataMode(spectrum.getMode());
  }

  /**
   * Fit a baseline to the current working intensities without applying it.
   */
  public BaselineResult computeBaseline(WorkingSpectrum spectrum, BaselineParameters params) {
    BaselineCorrector corrector =
        BaselineCorrectors.forParameters(params, spectrum.getData().size(), configuration.getSimplifiedThreshold());
    BaselineResult result = corrector.correct(spectrum.getData());
    LOGGER.info("Baseline correction (%s) completed on %d points", corrector.getName(), spectrum.getData().size());
    return result;
  }

  /**
   * Fit a baseline and make the corrected intensities the working ones.  Integrated peaks are re-integrated on the
   * corrected values.  Baselines fitted on an already corrected spectrum stack.
   */
  public WorkingSpectrum correctBaseline(WorkingSpectrum spectrum, BaselineParameters params) {
    return applyBaseline(spectrum, computeBaseline(spectrum, params));
  }

  public WorkingSpectrum applyBaseline(WorkingSpectrum spectrum, BaselineResult result) {
    if (result.isEmpty()) {
      return spectrum;
    }
    WorkingSpectrum corrected = spectrum.withBaseline(result);
    return corrected.withPeaks(integrator.recompute(corrected.getData(), corrected.getPeaks()));
  }

  /**
   * Replace the peaks with those detected on the current working intensities.  Technique and data mode always come
   * from the spectrum, so transmittance absorption data is searched for valleys.
   */
  public WorkingSpectrum detectPeaks(WorkingSpectrum spectrum, PeakDetectionParameters params) {
    PeakDetectionParameters effective = new PeakDetectionParameters(params)
        .setTechnique(spectrum.getTechnique())
        .setDataMode(spectrum.getMode());
    List<DetectedPeak> peaks = peakPicker.pick(spectrum.getData(), effective);
    return spectrum.withPeaks(peaks);
  }

  public WorkingSpectrum integrateAll(WorkingSpectrum spectrum) {
    return spectrum.withPeaks(integrator.integrateAll(spectrum.getData(), spectrum.getPeaks()));
  }

  /**
   * Feed a click into a boundary selection.  The committing click integrates against this spectrum's current data.
   * The returned peaks belong in spectrum.withPeaks(...).
   */
  public BoundaryClickResult clickBoundary(WorkingSpectrum spectrum, BoundarySelection selection, double x) {
    return selection.click(x, spectrum.getData(), spectrum.getPeaks(), integrator);
  }

  public WorkingSpectrum setBoundaries(WorkingSpectrum spectrum, String peakId, double startX, double endX) {
    return spectrum.withPeaks(integrator.withBoundaries(spectrum.getData(), spectrum.getPeaks(), peakId,
        startX, endX));
  }

  public WorkingSpectrum clearIntegration(WorkingSpectrum spectrum, String peakId) {
    return spectrum.withPeaks(PeakIntegrator.clearIntegration(spectrum.getPeaks(), peakId));
  }

  public WorkingSpectrum clearAllIntegrations(WorkingSpectrum spectrum) {
    return spectrum.withPeaks(PeakIntegrator.clearAllIntegrations(spectrum.getPeaks()));
  }

  /**
   * Switch the data mode of everything derived from the spectrum and re-integrate integrated peaks on the
   * converted values.
   */
  public WorkingSpectrum switchMode(WorkingSpectrum spectrum, DataMode target) {
    if (target == spectrum.getMode()) {
      return spectrum;
    }
    WorkingSpectrum converted = spectrum.withMode(target);
    LOGGER.info("Switched data mode from %s to %s", spectrum.getMode().getName(), target.getName());
    return converted.withPeaks(integrator.recompute(converted.getData(), converted.getPeaks()));
  }

  /**
   * Convert the x axis to another unit (the technique's conventional unit if toUnit is null).  Peaks are dropped
   * when the axis changes.
   */
  public WorkingSpectrum convertUnits(WorkingSpectrum spectrum, String toUnit) {
    if (!spectrum.getData().isWellFormed()) {
      LOGGER.warn("Unit conversion skipped: %s is malformed", spectrum);
      return spectrum;
    }
    UnitConversionResult conversion =
        unitConverter.convert(spectrum.getX(), spectrum.getXUnit(), toUnit, spectrum.getTechnique());
    if (conversion.wasConverted() && !spectrum.getPeaks().isEmpty()) {
      LOGGER.info("Discarding %d peaks after converting the x axis", spectrum.getPeaks().size());
    }
    return spectrum.withUnits(conversion);
  }

  public WorkingSpectrum deletePeak(WorkingSpectrum spectrum, String peakId) {
    List<DetectedPeak> remaining = new ArrayList<>(spectrum.getPeaks().size());
    for (DetectedPeak peak : spectrum.getPeaks()) {
      if (!peak.getId().equals(peakId)) {
        remaining.add(peak);
      }
    }
    return spectrum.withPeaks(remaining);
  }

  /**
   * Add a user-placed peak at a clicked point.  It has no prominence or width.
   */
  public WorkingSpectrum addManualPeak(WorkingSpectrum spectrum, double x, double y) {
    List<DetectedPeak> peaks = new ArrayList<>(spectrum.getPeaks());
    peaks.add(new DetectedPeak(PeakIds.manual(), x, y, 0.0));
    return spectrum.withPeaks(peaks);
  }

  public WorkingSpectrum clearManualPeaks(WorkingSpectrum spectrum) {
    List<DetectedPeak> remaining = new ArrayList<>(spectrum.getPeaks().size());
    for (DetectedPeak peak : spectrum.getPeaks()) {
      if (!PeakIds.isManual(peak.getId())) {
        remaining.add(peak);
      }
    }
    return spectrum.withPeaks(remaining);
  }
}
