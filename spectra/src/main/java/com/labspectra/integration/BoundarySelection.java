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
import com.labspectra.spectrum.Spectrum;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Two-click selection of an integration range for one peak.
 *
 *   IDLE --begin(peak)--> AWAITING_START --click(a)--> AWAITING_END --click(b), |b - a| >= 0.01--> IDLE
 *
 * A second click within 0.01 of the first is refused and the selection stays in AWAITING_END.  The pending start
 * lives in the selection itself, so cancel() never touches the peaks.  Instances are immutable; every transition
 * returns a new selection.
 */
public class BoundarySelection {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BoundarySelection.class);

  public static final double MIN_BOUNDARY_SEPARATION = 0.01;

  public static final String SAME_BOUNDARY_MESSAGE =
      "End boundary must be different from start boundary. Please click elsewhere.";

  public enum State {
    IDLE,
    AWAITING_START,
    AWAITING_END,
  }

  private static final BoundarySelection IDLE = new BoundarySelection(State.IDLE, null, null);

  private final State state;
  private final String peakId;
  private final Double pendingStart;

  private BoundarySelection(State state, String peakId, Double pendingStart) {
    this.state = state;
    this.peakId = peakId;
    this.pendingStart = pendingStart;
  }

  public static BoundarySelection idle() {
    return IDLE;
  }

  /**
   * Start adjusting the boundaries of a peak.  Any selection in progress is abandoned.
   */
  public BoundarySelection begin(String peakId) {
    if (StringUtils.isBlank(peakId)) {
      return IDLE;
    }
    return new BoundarySelection(State.AWAITING_START, peakId, null);
  }

  public BoundarySelection cancel() {
    return IDLE;
  }

  public State getState() {
    return state;
  }

  public String getPeakId() {
    return peakId;
  }

  public Double getPendingStart() {
    return pendingStart;
  }

  public String getPrompt() {
    switch (state) {
      case AWAITING_START:
        return "Peak selected. Click on spectrum to set start boundary.";
      case AWAITING_END:
        return String.format("Start boundary set at %.2f. Click again to set end boundary.", pendingStart);
      case IDLE:
      default:
        return "";
    }
  }

  public BoundaryClickResult click(double x, Spectrum spectrum, List<DetectedPeak> peaks) {
    return click(x, spectrum, peaks, new PeakIntegrator());
  }

  /**
   * Feed one click on the spectrum into the protocol.  The committing click integrates against the spectrum passed
   * to this call, so callers must pass their current working data.
   * @param x The clicked x value.
   * @param spectrum The current working spectrum.
   * @param peaks The current peak list.
   * @param integrator Used to integrate the committed range.
   * @return The next selection together with the (possibly updated) peaks.
   */
  public BoundaryClickResult click(double x, Spectrum spectrum, List<DetectedPeak> peaks,
                                   PeakIntegrator integrator) {
    switch (state) {
      case AWAITING_START:
        BoundarySelection next = new BoundarySelection(State.AWAITING_END, peakId, x);
        return new BoundaryClickResult(next, peaks, false, next.getPrompt());

      case AWAITING_END:
        if (Math.abs(x - pendingStart) < MIN_BOUNDARY_SEPARATION) {
          return new BoundaryClickResult(this, peaks, false, SAME_BOUNDARY_MESSAGE);
        }
        double start = Math.min(pendingStart, x);
        double end = Math.max(pendingStart, x);
        List<DetectedPeak> updated = integrator.withBoundaries(spectrum, peaks, peakId, start, end);
        DetectedPeak peak = find(updated, peakId);
        if (updated == peaks || peak == null || peak.getIntegration() == null) {
          LOGGER.warn("Boundaries %.4f..%.4f could not be applied to peak %s", start, end, peakId);
          return new BoundaryClickResult(IDLE, peaks, false,
              String.format("Could not integrate peak between %.2f and %.2f.", start, end));
        }
        LOGGER.info("Peak %s integrated between %.4f and %.4f: area %.4f",
            peakId, start, end, peak.getIntegration().getArea());
        return new BoundaryClickResult(IDLE, updated, true,
            String.format("New integration range set: %.2f to %.2f (Area: %.2f)",
                start, end, peak.getIntegration().getArea()));

      case IDLE:
      default:
        return new BoundaryClickResult(IDLE, peaks, false, "");
    }
  }

  private static DetectedPeak find(List<DetectedPeak> peaks, String id) {
    for (DetectedPeak peak : peaks) {
      if (peak.getId().equals(id)) {
        return peak;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BoundarySelection that = (BoundarySelection) o;
    return state == that.state && Objects.equals(peakId, that.peakId) &&
        Objects.equals(pendingStart, that.pendingStart);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, peakId, pendingStart);
  }

  @Override
  public String toString() {
    return String.format("BoundarySelection{state=%s, peakId=%s, pendingStart=%s}", state, peakId, pendingStart);
  }
}
