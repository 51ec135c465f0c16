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

package com.labspectra.integration;

import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.IntegrationRecord;
import com.labspectra.spectrum.Spectrum;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trapezoidal peak areas.  A peak that already carries an integration keeps its boundaries and is simply
 * re-integrated against the y values passed in; a peak without one gets a symmetric window around its apex.
 */
public class PeakIntegrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakIntegrator.class);

  public static final int DEFAULT_WIDTH = 10;
  public static final int MIN_AUTOMATIC_WIDTH = 5;
  // How close an x value must be to a peak's position for that sample to count as the apex.
  public static final double APEX_TOLERANCE = 0.01;

  private final int defaultWidth;

  public PeakIntegrator() {
    this(DEFAULT_WIDTH);
  }

  /**
   * @param defaultWidth The half-window, in samples, used for peaks with no detected width.
   */
  public PeakIntegrator(int defaultWidth) {
    Validate.isTrue(defaultWidth > 0, "Default integration width must be positive, got %d", defaultWidth);
    this.defaultWidth = defaultWidth;
  }

  public int getDefaultWidth() {
    return defaultWidth;
  }

  /**
   * Integrate one peak against the current spectrum.
   * @return The integration, or empty if the spectrum is not analyzable or no usable range could be found.
   */
  public Optional<IntegrationRecord> integrate(Spectrum spectrum, DetectedPeak peak) {
    if (!spectrum.isAnalyzable()) {
      LOGGER.warn("Integration of %s skipped: %s is not analyzable", peak.getId(), spectrum);
      return Optional.empty();
    }
    IntegrationRecord existing = peak.getIntegration();
    if (existing != null) {
      return integrateBetween(spectrum, existing.getStartX(), existing.getEndX(), existing.isManuallyAdjusted());
    }
    return integrateAutomatically(spectrum, peak);
  }

  /**
   * Integrate between two x values, in either order.
   */
  public Optional<IntegrationRecord> integrateBetween(Spectrum spectrum, double startX, double endX,
                                                     boolean manuallyAdjusted) {
    if (!spectrum.isAnalyzable()) {
      return Optional.empty();
    }
    double[] x = spectrum.getX();
    Optional<Pair<Integer, Integer>> range = resolveBoundaries(x, startX, endX);
    if (!range.isPresent()) {
      LOGGER.warn("No integration range between %.4f and %.4f", startX, endX);
      return Optional.empty();
    }
    double area = trapezoid(x, spectrum.getY(), range.get().getLeft(), range.get().getRight());
    LOGGER.debug("Integrated %.4f..%.4f over indices %d..%d: area %.4f",
        startX, endX, range.get().getLeft(), range.get().getRight(), area);
    return Optional.of(new IntegrationRecord(area, startX, endX, manuallyAdjusted));
  }

  private Optional<IntegrationRecord> integrateAutomatically(Spectrum spectrum, DetectedPeak peak) {
    double[] x = spectrum.getX();
    Optional<Pair<Integer, Integer>> range = automaticRange(x, peak);
    if (!range.isPresent()) {
      LOGGER.warn("Peak %s at %.4f does not match any sample, not integrated", peak.getId(), peak.getX());
      return Optional.empty();
    }
    int start = range.get().getLeft();
    int end = range.get().getRight();
    double area = trapezoid(x, spectrum.getY(), start, end);
    return Optional.of(new IntegrationRecord(area, x[start], x[end], false));
  }

  /**
   * The apex is the sample nearest the peak's x, if it lies within APEX_TOLERANCE.
   * Window of max(round(2 * width), 5) samples either side of the apex for peaks with a width, defaultWidth
   * otherwise, clipped to the data.
   */
  Optional<Pair<Integer, Integer>> automaticRange(double[] x, DetectedPeak peak) {
    int apex = -1;
    double closest = APEX_TOLERANCE;
    for (int i = 0; i < x.length; i++) {
      double distance = Math.abs(x[i] - peak.getX());
      if (distance < closest) {
        apex = i;
        closest = distance;
      }
    }
    if (apex < 0) {
      return Optional.empty();
    }

    int halfWindow = defaultWidth;
    if (peak.getWidth() != null && peak.getWidth() > 0) {
      halfWindow = Math.max((int) Math.round(peak.getWidth() * 2.0), MIN_AUTOMATIC_WIDTH);
    }
    int start = Math.max(0, apex - halfWindow);
    int end = Math.min(x.length - 1, apex + halfWindow);
    if (start >= end) {
      return Optional.empty();
    }
    return Optional.of(Pair.of(start, end));
  }

  /**
   * Map x boundaries onto the enclosing sample indices.  On an ascending axis that is the first index with
   * x >= low and the last with x <= high; on a descending axis the first with x <= high and the last with x >= low.
   * A range that collapses is widened by one sample on each side where possible.
   * @return The (start, end) index pair with start < end, or empty if no such pair exists.
   */
  static Optional<Pair<Integer, Integer>> resolveBoundaries(double[] x, double boundaryA, double boundaryB) {
    int n = x.length;
    if (n < 2) {
      return Optional.empty();
    }
    double low = Math.min(boundaryA, boundaryB);
    double high = Math.max(boundaryA, boundaryB);
    boolean ascending = x[0] < x[n - 1];

    int start = 0;
    for (int i = 0; i < n; i++) {
      if (ascending ? x[i] >= low : x[i] <= high) {
        start = i;
        break;
      }
    }
    int end = n - 1;
    for (int i = n - 1; i >= 0; i--) {
      if (ascending ? x[i] <= high : x[i] >= low) {
        end = i;
        break;
      }
    }

    if (start >= end) {
      if (start > 0) {
        start--;
      }
      if (end < n - 1) {
        end++;
      }
    }
    if (start >= end) {
      return Optional.empty();
    }
    return Optional.of(Pair.of(start, end));
  }

  /**
   * Absolute trapezoidal area over samples [start, end].
   */
  static double trapezoid(double[] x, double[] y, int start, int end) {
    double area = 0.0;
    for (int i = start; i < end; i++) {
      area += (y[i] + y[i + 1]) / 2.0 * (x[i + 1] - x[i]);
    }
    return Math.abs(area);
  }

  /**
   * Integrate every peak, keeping boundaries that are already set.  Peaks that cannot be integrated are returned
   * unchanged.
   */
  public List<DetectedPeak> integrateAll(Spectrum spectrum, List<DetectedPeak> peaks) {
    List<DetectedPeak> result = new ArrayList<>(peaks.size());
    int integrated = 0;
    for (DetectedPeak peak : peaks) {
      Optional<IntegrationRecord> record = integrate(spectrum, peak);
      if (record.isPresent()) {
        result.add(peak.withIntegration(record.get()));
        integrated++;
      } else {
        result.add(peak);
      }
    }
    LOGGER.info("Integrated %d of %d peaks", integrated, peaks.size());
    return result;
  }

  /**
   * Re-integrate the peaks that already hold an integration, e.g. after the y values changed under them.  Peaks
   * without an integration are left alone.
   */
  public List<DetectedPeak> recompute(Spectrum spectrum, List<DetectedPeak> peaks) {
    List<DetectedPeak> result = new ArrayList<>(peaks.size());
    for (DetectedPeak peak : peaks) {
      IntegrationRecord existing = peak.getIntegration();
      if (existing == null) {
        result.add(peak);
        continue;
      }
      Optional<IntegrationRecord> record =
          integrateBetween(spectrum, existing.getStartX(), existing.getEndX(), existing.isManuallyAdjusted());
      result.add(record.isPresent() ? peak.withIntegration(record.get()) : peak);
    }
    return result;
  }

  /**
   * Set user-chosen boundaries on one peak and integrate it.  The peak is marked as manually adjusted.
   * @return The updated peak list, or the input list unchanged if the id is unknown, the boundaries are closer than
   *         {@link BoundarySelection#MIN_BOUNDARY_SEPARATION} or the range is unusable.
   */
  public List<DetectedPeak> withBoundaries(Spectrum spectrum, List<DetectedPeak> peaks, String peakId,
                                           double startX, double endX) {
    if (Math.abs(endX - startX) < BoundarySelection.MIN_BOUNDARY_SEPARATION) {
      LOGGER.warn("Boundaries %.4f and %.4f for %s are too close, not applied", startX, endX, peakId);
      return peaks;
    }
    List<DetectedPeak> result = new ArrayList<>(peaks.size());
    boolean found = false;
    for (DetectedPeak peak : peaks) {
      if (!peak.getId().equals(peakId)) {
        result.add(peak);
        continue;
      }
      found = true;
      Optional<IntegrationRecord> record = integrateBetween(spectrum, startX, endX, true);
      if (!record.isPresent()) {
        return peaks;
      }
      result.add(peak.withIntegration(record.get()));
    }
    if (!found) {
      LOGGER.warn("No peak with id %s, boundaries not applied", peakId);
      return peaks;
    }
    return result;
  }

  /**
   * Drop the integration of one peak.
   */
  public static List<DetectedPeak> clearIntegration(List<DetectedPeak> peaks, String peakId) {
    List<DetectedPeak> result = new ArrayList<>(peaks.size());
    for (DetectedPeak peak : peaks) {
      result.add(peak.getId().equals(peakId) ? peak.withoutIntegration() : peak);
    }
    return result;
  }

  public static List<DetectedPeak> clearAllIntegrations(List<DetectedPeak> peaks) {
    List<DetectedPeak> result = new ArrayList<>(peaks.size());
    for (DetectedPeak peak : peaks) {
      result.add(peak.withoutIntegration());
    }
    return result;
  }
}
