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

import com.labspectra.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fast fixed-radius detector.  A point is a peak if it is strictly the largest within window_size samples either
 * side; its prominence is measured against the lowest points of the 2 * window_size samples to its left and right.
 * No width is estimated.
 */
public class WindowedPeakDetector implements PeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WindowedPeakDetector.class);

  @Override
  public List<DetectedPeak> detect(Spectrum spectrum, PeakDetectionParameters params) {
    int windowSize = Math.max(1, params.getWindowSize());
    if (!spectrum.isAnalyzable() || spectrum.size() < 2 * windowSize + 1) {
      LOGGER.warn("Windowed peak detection skipped: %s is too short for a window of %d", spectrum, windowSize);
      return Collections.emptyList();
    }

    double[] x = spectrum.getX();
    double[] y = spectrum.getY();
    int n = y.length;
    boolean valleys = params.isValleyMode();

    double maxIntensity = Double.NEGATIVE_INFINITY;
    double minIntensity = Double.POSITIVE_INFINITY;
    double[] signal = new double[n];
    for (int i = 0; i < n; i++) {
      maxIntensity = Math.max(maxIntensity, y[i]);
      minIntensity = Math.min(minIntensity, y[i]);
      signal[i] = valleys ? -y[i] : y[i];
    }
    double minProminence = params.getProminence() * (maxIntensity - minIntensity);

    String runToken = PeakIds.runToken(params);
    List<DetectedPeak> peaks = new ArrayList<>();
    List<Integer> acceptedIndices = new ArrayList<>();

    for (int i = windowSize; i < n - windowSize; i++) {
      if (!isWindowMaximum(signal, i, windowSize)) {
        continue;
      }

      double leftMin = minOf(signal, Math.max(0, i - 2 * windowSize), i);
      double rightMin = minOf(signal, i + 1, Math.min(n, i + 2 * windowSize + 1));
      double prominence = signal[i] - Math.max(leftMin, rightMin);
      if (prominence < minProminence) {
        continue;
      }

      if (ProminencePeakDetector.isTooClose(i, acceptedIndices, params.getDistance())) {
        continue;
      }

      acceptedIndices.add(i);
      peaks.add(new DetectedPeak(PeakIds.detected(runToken, peaks.size(), i), x[i], y[i], prominence));
    }

    Collections.sort(peaks, (a, b) -> Double.compare(b.getProminence(), a.getProminence()));
    LOGGER.debug("Windowed detection found %d %s in %d points (window %d)",
        peaks.size(), valleys ? "valleys" : "peaks", n, windowSize);
    return peaks;
  }

  private static boolean isWindowMaximum(double[] signal, int index, int windowSize) {
    for (int j = index - windowSize; j <= index + windowSize; j++) {
      if (j != index && signal[j] >= signal[index]) {
        return false;
      }
    }
    return true;
  }

  // Minimum over [from, to).
  private static double minOf(double[] values, int from, int to) {
    double min = Double.POSITIVE_INFINITY;
    for (int i = from; i < to; i++) {
      min = Math.min(min, values[i]);
    }
    return min;
  }
}
