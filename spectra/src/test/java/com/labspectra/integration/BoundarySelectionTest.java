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
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BoundarySelectionTest {
  private Spectrum spectrum;
  private List<DetectedPeak> peaks;

  @Before
  public void setUp() {
    double[] x = new double[11];
    double[] y = new double[]{0, 1, 2, 3, 4, 5, 4, 3, 2, 1, 0};
    for (int i = 0; i < x.length; i++) {
      x[i] = i;
    }
    spectrum = new Spectrum(x, y);
    peaks = Collections.singletonList(new DetectedPeak("p1", 5.0, 5.0, 5.0));
  }

  @Test
  public void testTwoClicksSetBoundaries() {
    BoundarySelection selection = BoundarySelection.idle().begin("p1");
    assertEquals("Waiting for the first click", BoundarySelection.State.AWAITING_START, selection.getState());

    BoundaryClickResult first = selection.click(2.0, spectrum, peaks);
    assertFalse("First click commits nothing", first.isAccepted());
    assertEquals("Waiting for the second click", BoundarySelection.State.AWAITING_END,
        first.getSelection().getState());
    assertEquals("Start remembered", Double.valueOf(2.0), first.getSelection().getPendingStart());
    assertFalse("Peaks untouched", first.getPeaks().get(0).isIntegrated());

    BoundaryClickResult second = first.getSelection().click(6.0, spectrum, first.getPeaks());
    assertTrue("Second click commits", second.isAccepted());
    assertEquals("Back to idle", BoundarySelection.State.IDLE, second.getSelection().getState());
    IntegrationRecord record = second.getPeaks().get(0).getIntegration();
    assertEquals("Start", 2.0, record.getStartX(), 0.0);
    assertEquals("End", 6.0, record.getEndX(), 0.0);
    assertEquals("Trapezoid over samples 2..6", 15.0, record.getArea(), 1e-9);
    assertTrue("Manual", record.isManuallyAdjusted());
    assertTrue("Confirmation message", second.getMessage().startsWith("New integration range set:"));
  }

  @Test
  public void testClicksInReverseOrderAreSorted() {
    BoundaryClickResult first = BoundarySelection.idle().begin("p1").click(8.0, spectrum, peaks);
    BoundaryClickResult second = first.getSelection().click(3.0, spectrum, peaks);
    IntegrationRecord record = second.getPeaks().get(0).getIntegration();
    assertTrue("start < end", record.getStartX() < record.getEndX());
    assertEquals("Start is the smaller click", 3.0, record.getStartX(), 0.0);
  }

  @Test
  public void testSecondClickOnSameSpotIsRefused() {
    BoundarySelection awaitingEnd = BoundarySelection.idle().begin("p1").click(4.0, spectrum, peaks).getSelection();
    BoundaryClickResult result = awaitingEnd.click(4.005, spectrum, peaks);
    assertFalse("Not committed", result.isAccepted());
    assertEquals("Explains the refusal", BoundarySelection.SAME_BOUNDARY_MESSAGE, result.getMessage());
    assertSame("Selection unchanged", awaitingEnd, result.getSelection());
    assertSame("Peaks unchanged", peaks.get(0), result.getPeaks().get(0));
  }

  @Test
  public void testCancelLeavesPeaksAlone() {
    BoundarySelection awaitingEnd = BoundarySelection.idle().begin("p1").click(4.0, spectrum, peaks).getSelection();
    BoundarySelection cancelled = awaitingEnd.cancel();
    assertEquals("Idle after cancel", BoundarySelection.State.IDLE, cancelled.getState());
    assertNull("No pending start", cancelled.getPendingStart());
    assertFalse("Peak never integrated", peaks.get(0).isIntegrated());
  }

  @Test
  public void testClickWhileIdleDoesNothing() {
    BoundaryClickResult result = BoundarySelection.idle().click(3.0, spectrum, peaks);
    assertFalse("Ignored", result.isAccepted());
    assertEquals("Still idle", BoundarySelection.idle(), result.getSelection());
  }

  @Test
  public void testBlankPeakIdDoesNotStartSelection() {
    assertEquals("Blank id", BoundarySelection.State.IDLE, BoundarySelection.idle().begin(" ").getState());
  }

  @Test
  public void testUnknownPeakEndsSelectionWithMessage() {
    BoundarySelection awaitingEnd = BoundarySelection.idle().begin("ghost").click(2.0, spectrum, peaks).getSelection();
    BoundaryClickResult result = awaitingEnd.click(6.0, spectrum, peaks);
    assertFalse("Nothing committed", result.isAccepted());
    assertEquals("Selection reset", BoundarySelection.State.IDLE, result.getSelection().getState());
    assertTrue("Failure reported", result.getMessage().startsWith("Could not integrate"));
  }

  @Test
  public void testPrompts() {
    BoundarySelection awaitingStart = BoundarySelection.idle().begin("p1");
    assertTrue("Start prompt", awaitingStart.getPrompt().contains("start boundary"));
    assertEquals("No prompt when idle", "", BoundarySelection.idle().getPrompt());
  }
}
