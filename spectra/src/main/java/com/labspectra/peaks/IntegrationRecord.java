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

import org.apache.commons.lang3.Validate;

/**
 * The integrated area of a peak between two x boundaries.  Boundaries are stored in ascending order whatever the
 * direction of the x axis they were taken from.
 */
public class IntegrationRecord {
  private final double area;
  private final double startX;
  private final double endX;
  private final boolean manuallyAdjusted;

  public IntegrationRecord(double area, double startX, double endX, boolean manuallyAdjusted) {
    Validate.isTrue(area >= 0.0 || Double.isNaN(area), "Integrated area must not be negative, got %f", area);
    this.area = area;
    this.startX = Math.min(startX, endX);
    this.endX = Math.max(startX, endX);
    this.manuallyAdjusted = manuallyAdjusted;
  }

  public double getArea() {
    return area;
  }

  public double getStartX() {
    return startX;
  }

  public double getEndX() {
    return endX;
  }

  public boolean isManuallyAdjusted() {
    return manuallyAdjusted;
  }

  /**
   * Same boundaries and flag with a freshly computed area.
   */
  public IntegrationRecord withArea(double newArea) {
    return new IntegrationRecord(newArea, startX, endX, manuallyAdjusted);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    IntegrationRecord that = (IntegrationRecord) o;
    return Double.compare(that.area, area) == 0 &&
        Double.compare(that.startX, startX) == 0 &&
        Double.compare(that.endX, endX) == 0 &&
        manuallyAdjusted == that.manuallyAdjusted;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(area);
    result = 31 * result + Double.hashCode(startX);
    result = 31 * result + Double.hashCode(endX);
    result = 31 * result + (manuallyAdjusted ? 1 : 0);
    return result;
  }

  @Override
  public String toString() {
    return String.format("IntegrationRecord{area=%.4f, startX=%.4f, endX=%.4f, manuallyAdjusted=%s}",
        area, startX, endX, manuallyAdjusted);
  }
}
