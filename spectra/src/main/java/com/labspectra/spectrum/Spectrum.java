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

package com.labspectra.spectrum;

import java.util.Arrays;

/**
 * An immutable pair of equal-length sample sequences: x (wavelength, wavenumber, energy) and y (intensity,
 * absorbance, %T).  Order is significant; x may be ascending or descending depending on the technique.
 *
 * Arrays are copied on the way in and on the way out, so a Spectrum can be handed to any number of analysis calls
 * without them interfering with one another.
 */
public class Spectrum {
  public static final int MIN_ANALYZABLE_POINTS = 3;

  private static final double[] NO_VALUES = new double[0];

  private final double[] x;
  private final double[] y;

  public Spectrum(double[] x, double[] y) {
    this.x = x == null ? NO_VALUES : x.clone();
    this.y = y == null ? NO_VALUES : y.clone();
  }

  public static Spectrum empty() {
    return new Spectrum(NO_VALUES, NO_VALUES);
  }

  public double[] getX() {
    return x.clone();
  }

  public double[] getY() {
    return y.clone();
  }

  public int size() {
    return Math.min(x.length, y.length);
  }

  public boolean isWellFormed() {
    return x.length == y.length;
  }

  /**
   * A spectrum can be analyzed (baseline fit, peak detection, integration) only when x and y line up and there are
   * at least {@link #MIN_ANALYZABLE_POINTS} samples.
   */
  public boolean isAnalyzable() {
    return isWellFormed() && x.length >= MIN_ANALYZABLE_POINTS;
  }

  public boolean isAscending() {
    return x.length < 2 || x[0] < x[x.length - 1];
  }

  public Spectrum withY(double[] newY) {
    return new Spectrum(this.x, newY);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Spectrum that = (Spectrum) o;
    return Arrays.equals(x, that.x) && Arrays.equals(y, that.y);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
  }

  @Override
  public String toString() {
    return String.format("Spectrum{points=%d, ascending=%s}", size(), isAscending());
  }
}
