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

package com.labspectra.baseline;

/**
 * A fitted baseline and the spectrum with that baseline removed.  corrected[i] is max(0, y[i] - baseline[i]), so the
 * corrected spectrum never goes negative.
 */
public class BaselineResult {
  private static final BaselineResult EMPTY = new BaselineResult(new double[0], new double[0]);

  private final double[] baseline;
  private final double[] corrected;

  private BaselineResult(double[] baseline, double[] corrected) {
    this.baseline = baseline;
    this.corrected = corrected;
  }

  /**
   * Subtracts a baseline from the raw values.
   * @param y The raw intensities.
   * @param baseline The fitted baseline, index-aligned with y.
   * @return The baseline and the clipped difference.
   */
  public static BaselineResult of(double[] y, double[] baseline) {
    double[] corrected = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      corrected[i] = Math.max(0.0, y[i] - baseline[i]);
    }
    return new BaselineResult(baseline.clone(), corrected);
  }

  public static BaselineResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return baseline.length == 0;
  }

  public double[] getBaseline() {
    return baseline.clone();
  }

  public double[] getCorrected() {
    return corrected.clone();
  }
}
