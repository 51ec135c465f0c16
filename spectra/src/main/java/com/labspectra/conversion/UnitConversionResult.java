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

package com.labspectra.conversion;

/**
 * The outcome of an x-axis unit conversion.  When reciprocal conversions drop non-positive samples, keptIndices
 * records which source positions survived so that y values (and anything else index-aligned) can be filtered the
 * same way.
 */
public class UnitConversionResult {
  private final double[] convertedX;
  private final int[] keptIndices;
  private final int sourceSize;
  private final String actualUnit;
  private final boolean converted;
  private final String conversionInfo;

  public UnitConversionResult(double[] convertedX, int[] keptIndices, int sourceSize, String actualUnit,
                              boolean converted, String conversionInfo) {
    this.convertedX = convertedX;
    this.keptIndices = keptIndices;
    this.sourceSize = sourceSize;
    this.actualUnit = actualUnit;
    this.converted = converted;
    this.conversionInfo = conversionInfo;
  }

  public static UnitConversionResult unchanged(double[] x, String unit) {
    int[] all = new int[x.length];
    for (int i = 0; i < all.length; i++) {
      all[i] = i;
    }
    return new UnitConversionResult(x.clone(), all, x.length, unit, false, "");
  }

  public double[] getConvertedX() {
    return convertedX.clone();
  }

  public int[] getKeptIndices() {
    return keptIndices.clone();
  }

  public int getDroppedCount() {
    return sourceSize - keptIndices.length;
  }

  public String getActualUnit() {
    return actualUnit;
  }

  public boolean wasConverted() {
    return converted;
  }

  public String getConversionInfo() {
    return conversionInfo;
  }

  /**
   * Applies the same index filtering the x conversion did to an index-aligned array (y, baseline, ...).
   * @param values An array aligned with the source x values, or null.
   * @return The surviving values in order, or null when values is null.
   */
  public double[] filterAligned(double[] values) {
    if (values == null) {
      return null;
    }
    double[] filtered = new double[keptIndices.length];
    for (int i = 0; i < keptIndices.length; i++) {
      filtered[i] = values[keptIndices[i]];
    }
    return filtered;
  }
}
