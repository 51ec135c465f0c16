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

import com.labspectra.spectrum.Techniques;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Typical ALS smoothness ranges per technique.  These only scope the values offered to a user; any positive
 * lambda is accepted by the correctors.
 */
public class RecommendedLambda {
  public static final RecommendedLambda DEFAULT = new RecommendedLambda(100, 10000, 1000);

  private static final Map<String, RecommendedLambda> BY_TECHNIQUE;

  static {
    Map<String, RecommendedLambda> table = new HashMap<>();
    table.put(Techniques.UV_VIS, new RecommendedLambda(100, 10000, 1000));
    table.put(Techniques.IR, new RecommendedLambda(1000, 100000, 10000));
    table.put(Techniques.RAMAN, new RecommendedLambda(100, 50000, 5000));
    table.put(Techniques.LIBS, new RecommendedLambda(10, 1000, 100));
    table.put(Techniques.XRF, new RecommendedLambda(100, 10000, 1000));
    BY_TECHNIQUE = Collections.unmodifiableMap(table);
  }

  private final double min;
  private final double max;
  private final double defaultValue;

  public RecommendedLambda(double min, double max, double defaultValue) {
    this.min = min;
    this.max = max;
    this.defaultValue = defaultValue;
  }

  public static RecommendedLambda forTechnique(String technique) {
    RecommendedLambda recommendation = BY_TECHNIQUE.get(Techniques.normalize(technique));
    return recommendation == null ? DEFAULT : recommendation;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getDefault() {
    return defaultValue;
  }

  public boolean contains(double lambda) {
    return lambda >= min && lambda <= max;
  }

  @Override
  public String toString() {
    return String.format("RecommendedLambda{min=%.0f, max=%.0f, default=%.0f}", min, max, defaultValue);
  }
}
