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

import java.util.Objects;

/**
 * A local extremum found by a detection run, optionally carrying its integration.  Instances are immutable: every
 * edit (a mode switch rescaling y, a new integration, a cleared integration) produces a copy with the same id.
 */
public class DetectedPeak {
  private final String id;
  private final double x;
  private final double y;
  private final double prominence;
  private final Double width;
  private final Double leftBase;
  private final Double rightBase;
  private final IntegrationRecord integration;

  public DetectedPeak(String id, double x, double y, double prominence) {
    this(id, x, y, prominence, null, null, null, null);
  }

  public DetectedPeak(String id, double x, double y, double prominence, Double width, Double leftBase,
                      Double rightBase, IntegrationRecord integration) {
    this.id = id;
    this.x = x;
    this.y = y;
    this.prominence = prominence;
    this.width = width;
    this.leftBase = leftBase;
    this.rightBase = rightBase;
    this.integration = integration;
  }

  /**
   * @return An id unique to this peak and to the detection run that produced it.
   */
  public String getId() {
    return id;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getProminence() {
    return prominence;
  }

  /**
   * @return The half-height width in samples, or null if the detector does not estimate it.
   */
  public Double getWidth() {
    return width;
  }

  public Double getLeftBase() {
    return leftBase;
  }

  public Double getRightBase() {
    return rightBase;
  }

  public IntegrationRecord getIntegration() {
    return integration;
  }

  public boolean isIntegrated() {
    return integration != null;
  }

  public boolean isManuallyAdjusted() {
    return integration != null && integration.isManuallyAdjusted();
  }

  public DetectedPeak withY(double newY) {
    return new DetectedPeak(id, x, newY, prominence, width, leftBase, rightBase, integration);
  }

  public DetectedPeak withIntegration(IntegrationRecord newIntegration) {
    return new DetectedPeak(id, x, y, prominence, width, leftBase, rightBase, newIntegration);
  }

  public DetectedPeak withoutIntegration() {
    return withIntegration(null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DetectedPeak that = (DetectedPeak) o;
    return Double.compare(that.x, x) == 0 &&
        Double.compare(that.y, y) == 0 &&
        Double.compare(that.prominence, prominence) == 0 &&
        Objects.equals(id, that.id) &&
        Objects.equals(width, that.width) &&
        Objects.equals(leftBase, that.leftBase) &&
        Objects.equals(rightBase, that.rightBase) &&
        Objects.equals(integration, that.integration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, x, y, prominence, width, leftBase, rightBase, integration);
  }

  @Override
  public String toString() {
    return String.format("DetectedPeak{id=%s, x=%.4f, y=%.4f, prominence=%.4f, width=%s, integration=%s}",
        id, x, y, prominence, width, integration);
  }
}
