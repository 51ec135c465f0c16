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

import com.labspectra.baseline.BaselineResult;
import com.labspectra.conversion.DataMode;
import com.labspectra.conversion.ModeConverter;
import com.labspectra.conversion.UnitConversionResult;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.spectrum.Spectrum;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything an analysis session knows about one spectrum: the current (possibly corrected, converted) samples, the
 * intensities as they were before any baseline was applied, the technique, x unit and data mode, the last fitted
 * baseline and the current peaks.  Instances are immutable; every stage hands back a new one.
 */
public class WorkingSpectrum {
  private static final double[] NO_BASELINE = new double[0];

  private final Spectrum data;
  private final double[] originalY;
  private final String technique;
  private final String xUnit;
  private final String unitNote;
  private final DataMode mode;
  private final double[] baseline;
  private final List<DetectedPeak> peaks;

  public WorkingSpectrum(Spectrum data, double[] originalY, String technique, String xUnit, String unitNote,
                         DataMode mode, double[] baseline, List<DetectedPeak> peaks) {
    Validate.notNull(data, "Spectrum data must not be null");
    Validate.notNull(mode, "Data mode must not be null");
    this.data = data;
    this.originalY = originalY == null ? data.getY() : originalY.clone();
    this.technique = technique == null ? "" : technique;
    this.xUnit = xUnit == null ? "" : xUnit;
    this.unitNote = unitNote == null ? "" : unitNote;
    this.mode = mode;
    this.baseline = baseline == null ? NO_BASELINE : baseline.clone();
    this.peaks = peaks == null ? Collections.<DetectedPeak>emptyList() :
        Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  public static WorkingSpectrum of(Spectrum data, String technique, String xUnit, DataMode mode) {
    return new WorkingSpectrum(data, null, technique, xUnit, "", mode, null, null);
  }

  public Spectrum getData() {
    return data;
  }

  public double[] getX() {
    return data.getX();
  }

  public double[] getY() {
    return data.getY();
  }

  /**
   * @return The intensities before baseline correction, in the current data mode and aligned with getX().
   */
  public double[] getOriginalY() {
    return originalY.clone();
  }

  public String getTechnique() {
    return technique;
  }

  public String getXUnit() {
    return xUnit;
  }

  /**
   * @return A human readable note on how the x axis got its current unit, empty if it was never converted.
   */
  public String getUnitNote() {
    return unitNote;
  }

  public DataMode getMode() {
    return mode;
  }

  public double[] getBaseline() {
    return baseline.clone();
  }

  public boolean hasBaseline() {
    return baseline.length > 0;
  }

  public List<DetectedPeak> getPeaks() {
    return peaks;
  }

  public DetectedPeak findPeak(String peakId) {
    for (DetectedPeak peak : peaks) {
      if (peak.getId().equals(peakId)) {
        return peak;
      }
    }
    return null;
  }

  public WorkingSpectrum withPeaks(List<DetectedPeak> newPeaks) {
    return new WorkingSpectrum(data, originalY, technique, xUnit, unitNote, mode, baseline, newPeaks);
  }

  /**
   * Replace the working intensities with a baseline-corrected trace.  The pre-correction intensities are kept.
   */
  public WorkingSpectrum withBaseline(BaselineResult result) {
    if (result.isEmpty()) {
      return this;
    }
    return new WorkingSpectrum(data.withY(result.getCorrected()), originalY, technique, xUnit, unitNote, mode,
        result.getBaseline(), peaks);
  }

  /**
   * Restore state saved with an earlier baseline run without recomputing it.
   */
  public WorkingSpectrum withRestoredBaseline(double[] originalIntensities, double[] corrected, double[] fitted) {
    return new WorkingSpectrum(data.withY(corrected), originalIntensities, technique, xUnit, unitNote, mode, fitted,
        peaks);
  }

  /**
   * Express the working y values, the original y values, the baseline and every peak's y in another data mode.
   * Integrations are carried over unchanged; they have to be recomputed on the new values.
   */
  public WorkingSpectrum withMode(DataMode target) {
    Validate.notNull(target, "Target data mode must not be null");
    if (target == mode) {
      return this;
    }
    List<DetectedPeak> convertedPeaks = new ArrayList<>(peaks.size());
    for (DetectedPeak peak : peaks) {
      convertedPeaks.add(peak.withY(ModeConverter.convert(peak.getY(), mode, target)));
    }
    return new WorkingSpectrum(
        data.withY(ModeConverter.convert(data.getY(), mode, target)),
        ModeConverter.convert(originalY, mode, target),
        technique, xUnit, unitNote, target,
        hasBaseline() ? ModeConverter.convert(baseline, mode, target) : NO_BASELINE,
        convertedPeaks);
  }

  /**
   * Adopt a converted x axis.  y, original y and baseline are filtered to the samples the conversion kept.  Peaks
   * refer to positions on the old axis and are dropped.
   */
  public WorkingSpectrum withUnits(UnitConversionResult conversion) {
    if (!conversion.wasConverted()) {
      return this;
    }
    double[] filteredBaseline = hasBaseline() ? conversion.filterAligned(baseline) : NO_BASELINE;
    return new WorkingSpectrum(
        new Spectrum(conversion.getConvertedX(), conversion.filterAligned(data.getY())),
        conversion.filterAligned(originalY),
        technique, conversion.getActualUnit(), conversion.getConversionInfo(), mode, filteredBaseline, null);
  }

  @Override
  public String toString() {
    return String.format("WorkingSpectrum{points=%d, technique=%s, unit=%s, mode=%s, baseline=%s, peaks=%d}",
        data.size(), technique, xUnit, mode.getName(), hasBaseline(), peaks.size());
  }
}
