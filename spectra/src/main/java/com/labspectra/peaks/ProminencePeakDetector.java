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
 * Prominence and width filtered extremum finder.
 *
 * Valleys are found by running the peak search over the negated signal, so every comparison below is written for
 * maxima.  For each strict local maximum that clears the intensity gate we:
 *   1) scan outward on both sides for the lowest point, stopping as soon as a higher point is met, which gives the
 *      nearest saddle rather than a global one;
 *   2) take prominence as the height above the higher of the two saddles and drop peaks below prominence * range;
 *   3) walk out from the peak to the half-prominence level (bounded by the saddles) to get a width in samples, and
 *      drop peaks narrower than the minimum width;
 *   4) drop peaks within `distance` samples of one already accepted.
 * Survivors are returned ordered by descending prominence.
 */
public class ProminencePeakDetector implements PeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ProminencePeakDetector.class);

  @Override
  public List<DetectedPeak> detect(Spectrum spectrum, PeakDetectionParameters params) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("Peak detection skipped: %s is not analyzable", spectrum);
      return Collections.emptyList();
    }

    double[] x = spectrum.getX();
    double[] y = spectrum.getY();
    int n = y.length;
    boolean valleys = params.isValleyMode();

    double maxIntensity = Double.NEGATIVE_INFINITY;
    double minIntensity = Double.POSITIVE_INFINITY;
    for (double v : y) {
      maxIntensity = Math.max(maxIntensity, v);
      minIntensity = Math.min(minIntensity, v);
    }
    double minProminence = params.getProminence() * (maxIntensity - minIntensity);
    double gate = Math.max(params.getThreshold(), params.getRelativeThreshold() * maxIntensity);
    // Peaks must reach the gate; valleys must sit at least `gate` below the maximum.
    double orientedGate = valleys ? gate - maxIntensity : gate;

    double[] signal = new double[n];
    for (int i = 0; i < n; i++) {
      signal[i] = valleys ? -y[i] : y[i];
    }

    String runToken = PeakIds.runToken(params);
    List<DetectedPeak> peaks = new ArrayList<>();
    List<Integer> acceptedIndices = new ArrayList<>();

    for (int i = 1; i < n - 1; i++) {
      double current = signal[i];
      if (current < orientedGate) {
        continue;
      }
      if (!(current > signal[i - 1] && current > signal[i + 1])) {
        continue;
      }

      double leftSaddle = current;
      int leftBase = i;
      for (int j = i - 1; j >= 0; j--) {
        if (signal[j] < leftSaddle) {
          leftSaddle = signal[j];
          leftBase = j;
        }
        if (signal[j] > current) {
          break;
        }
      }

      double rightSaddle = current;
      int rightBase = i;
      for (int j = i + 1; j < n; j++) {
        if (signal[j] < rightSaddle) {
          rightSaddle = signal[j];
          rightBase = j;
        }
        if (signal[j] > current) {
          break;
        }
      }

      double saddle = Math.max(leftSaddle, rightSaddle);
      double prominence = current - saddle;
      if (prominence < minProminence) {
        continue;
      }

      double halfLevel = (current + saddle) / 2.0;
      int leftHalf = i;
      for (int j = i - 1; j >= leftBase; j--) {
        if (signal[j] <= halfLevel) {
          leftHalf = j;
          break;
        }
      }
      int rightHalf = i;
      for (int j = i + 1; j <= rightBase; j++) {
        if (signal[j] <= halfLevel) {
          rightHalf = j;
          break;
        }
      }
      int width = rightHalf - leftHalf;
      if (width < params.getWidth()) {
        continue;
      }

      if (isTooClose(i, acceptedIndices, params.getDistance())) {
        continue;
      }

      acceptedIndices.add(i);
      peaks.add(new DetectedPeak(PeakIds.detected(runToken, peaks.size(), i), x[i], y[i], prominence,
          (double) width, x[leftBase], x[rightBase], null));
    }

    Collections.sort(peaks, (a, b) -> Double.compare(b.getProminence(), a.getProminence()));
    LOGGER.debug("Found %d %s in %d points (min prominence %.4f, gate %.4f)",
        peaks.size(), valleys ? "valleys" : "peaks", n, minProminence, gate);
    return peaks;
  }

  static boolean isTooClose(int index, List<Integer> acceptedIndices, int distance) {
    for (Integer accepted : acceptedIndices) {
      if (Math.abs(index - accepted) < distance) {
        return true;
      }
    }
    return false;
  }
}
