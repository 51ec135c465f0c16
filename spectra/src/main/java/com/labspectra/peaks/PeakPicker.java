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

import java.util.List;

/**
 * Runs the full prominence detector, retrying with the windowed detector if it fails.
 */
public class PeakPicker {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakPicker.class);

  private static final int MIN_FALLBACK_WINDOW = 3;
  private static final int FALLBACK_WINDOW_DIVISOR = 100;

  private final PeakDetector fullDetector;
  private final PeakDetector simplifiedDetector;

  public PeakPicker() {
    this(new ProminencePeakDetector(), new WindowedPeakDetector());
  }

  public PeakPicker(PeakDetector fullDetector, PeakDetector simplifiedDetector) {
    this.fullDetector = fullDetector;
    this.simplifiedDetector = simplifiedDetector;
  }

  /**
   * Detect peaks in a spectrum.  When use_simplified is set the windowed detector runs directly with the given
   * window.  Otherwise a failure of the full detector is logged and the windowed detector retried with a window
   * of max(3, n / 100); an exception from that retry is propagated.
   */
  public List<DetectedPeak> pick(Spectrum spectrum, PeakDetectionParameters params) {
    if (params.isUseSimplified()) {
      return simplifiedDetector.detect(spectrum, params);
    }

    try {
      List<DetectedPeak> peaks = fullDetector.detect(spectrum, params);
      LOGGER.info("Peak detection completed: found %d peaks", peaks.size());
      return peaks;
    } catch (RuntimeException e) {
      LOGGER.warn("Peak detection failed, retrying with the windowed detector: %s", e.getMessage());
      PeakDetectionParameters fallback = new PeakDetectionParameters(params)
          .setWindowSize(Math.max(MIN_FALLBACK_WINDOW, spectrum.size() / FALLBACK_WINDOW_DIVISOR));
      List<DetectedPeak> peaks = simplifiedDetector.detect(spectrum, fallback);
      LOGGER.info("Peak detection (windowed) completed: found %d peaks", peaks.size());
      return peaks;
    }
  }
}
