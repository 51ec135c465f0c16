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
import com.labspectra.peaks.PeakDetectionParameters;

/**
 * Session state rebuilt from saved records, with the parameters each stage last ran with.  A parameter object is
 * null when no record for that stage was found.
 */
public class RestoredAnalysis {
  private final WorkingSpectrum spectrum;
  private final BaselineParameters baselineParameters;
  private final PeakDetectionParameters peakParameters;

  public RestoredAnalysis(WorkingSpectrum spectrum, BaselineParameters baselineParameters,
                          PeakDetectionParameters peakParameters) {
    this.spectrum = spectrum;
    this.baselineParameters = baselineParameters;
    this.peakParameters = peakParameters;
  }

  public WorkingSpectrum getSpectrum() {
    return spectrum;
  }

  public BaselineParameters getBaselineParameters() {
    return baselineParameters;
  }

  public PeakDetectionParameters getPeakParameters() {
    return peakParameters;
  }
}
