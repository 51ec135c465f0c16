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

import java.util.List;

/**
 * Finds local extrema in a spectrum.  Detection is deterministic for a given run id and has no side effects.
 */
public interface PeakDetector {

  /**
   * Detect peaks (or valleys, see {@link PeakDetectionParameters#isValleyMode()}) in a spectrum.
   * @param spectrum The spectrum to search.
   * @param params Detection thresholds and orientation.
   * @return The accepted peaks ordered by descending prominence; empty for spectra that are not analyzable.
   */
  List<DetectedPeak> detect(Spectrum spectrum, PeakDetectionParameters params);

  default List<DetectedPeak> detect(double[] x, double[] y, PeakDetectionParameters params) {
    return detect(new Spectrum(x, y), params);
  }
}
