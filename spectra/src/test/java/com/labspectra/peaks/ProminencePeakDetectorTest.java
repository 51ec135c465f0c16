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

import com.labspectra.conversion.DataMode;
import com.labspectra.spectrum.Spectrum;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProminencePeakDetectorTest {
  private ProminencePeakDetector detector;

  @Before
  public void setUp() {
    detector = new ProminencePeakDetector();
  }

  private static Spectrum indexed(double... y) {
    double[] x = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      x[i] = i;
    }
    return new Spectrum(x, y);
  }

  @Test
  public void testSingleTriangularPeak() {
    List<DetectedPeak> peaks =
        detector.detect(indexed(0, 1, 5, 1, 0), new PeakDetectionParameters().setProminence(0.1));
    assertEquals("Exactly one peak", 1, peaks.size());
    DetectedPeak peak = peaks.get(0);
    assertEquals("Apex position", 2.0, peak.getX(), 0.0);
    assertEquals("Apex height", 5.0, peak.getY(), 0.0);
    assertEquals("Prominence above the saddles", 5.0, peak.getProminence(), 1e-12);
    assertEquals("Half-prominence width in samples", 2.0, peak.getWidth(), 0.0);
    assertEquals("Left base", 0.0, peak.getLeftBase(), 0.0);
    assertEquals("Right base", 4.0, peak.getRightBase(), 0.0);
    assertFalse("Not integrated yet", peak.isIntegrated());
  }

  @Test
  public void testProminenceAndWidthAreRespected() {
    Spectrum spectrum = indexed(0, 2, 0, 0, 5, 0, 0, 1, 3, 4, 3, 1, 0);
    PeakDetectionParameters params = new PeakDetectionParameters().setProminence(0.5).setDistance(1).setWidth(2.0);
    List<DetectedPeak> peaks = detector.detect(spectrum, params);
    double range = 5.0;
    for (DetectedPeak peak : peaks) {
      assertTrue(String.format("Peak at %.1f clears the prominence floor", peak.getX()),
          peak.getProminence() >= 0.5 * range);
      assertTrue(String.format("Peak at %.1f clears the width floor", peak.getX()), peak.getWidth() >= 2.0);
    }
    assertEquals("The small band at x=1 is filtered out", 2, peaks.size());
  }

  @Test
  public void testResultsOrderedByDescendingProminence() {
    Spectrum spectrum = indexed(0, 2, 0, 0, 5, 0, 0);
    List<DetectedPeak> peaks = detector.detect(spectrum, new PeakDetectionParameters().setDistance(1));
    assertEquals("Both peaks found", 2, peaks.size());
    assertEquals("Most prominent first", 4.0, peaks.get(0).getX(), 0.0);
    assertEquals("Smaller second", 1.0, peaks.get(1).getX(), 0.0);
  }

  @Test
  public void testPeaksCloserThanDistanceAreDropped() {
    Spectrum spectrum = indexed(0, 2, 0, 0, 5, 0, 0);
    List<DetectedPeak> peaks = detector.detect(spectrum, new PeakDetectionParameters().setDistance(5));
    assertEquals("Second peak is within five samples of the first", 1, peaks.size());
  }

  @Test
  public void testWidthFloorRemovesNarrowPeaks() {
    List<DetectedPeak> peaks =
        detector.detect(indexed(0, 1, 5, 1, 0), new PeakDetectionParameters().setWidth(3.0));
    assertTrue("Two-sample peak is too narrow", peaks.isEmpty());
  }

  @Test
  public void testIntensityGate() {
    PeakDetectionParameters params = new PeakDetectionParameters().setThreshold(6.0);
    assertTrue("Apex below the absolute threshold", detector.detect(indexed(0, 1, 5, 1, 0), params).isEmpty());
  }

  @Test
  public void testValleysOnRequest() {
    List<DetectedPeak> valleys = detector.detect(indexed(5, 4, 0, 4, 5),
        new PeakDetectionParameters().setDetectValleys(true));
    assertEquals("One valley", 1, valleys.size());
    assertEquals("Valley position", 2.0, valleys.get(0).getX(), 0.0);
    assertEquals("Reported y is the raw minimum", 0.0, valleys.get(0).getY(), 0.0);
    assertEquals("Depth below the higher rim", 5.0, valleys.get(0).getProminence(), 1e-12);
  }

  @Test
  public void testTransmittanceAbsorptionDataIsSearchedForValleys() {
    PeakDetectionParameters params = new PeakDetectionParameters()
        .setTechnique("IR")
        .setDataMode(DataMode.TRANSMITTANCE);
    assertTrue("Valley mode inferred", params.isValleyMode());
    List<DetectedPeak> found = detector.detect(indexed(95, 90, 40, 90, 95), params);
    assertEquals("Absorption band found as a dip", 1, found.size());
    assertEquals("Dip position", 2.0, found.get(0).getX(), 0.0);
  }

  @Test
  public void testRamanTransmittanceStillLooksForPeaks() {
    PeakDetectionParameters params = new PeakDetectionParameters()
        .setTechnique("raman")
        .setDataMode(DataMode.TRANSMITTANCE);
    assertFalse("Raman is not an absorption technique", params.isValleyMode());
  }

  @Test
  public void testIdsCarryRunToken() {
    Spectrum spectrum = indexed(0, 2, 0, 0, 5, 0, 0);
    List<DetectedPeak> peaks =
        detector.detect(spectrum, new PeakDetectionParameters().setDistance(1).setRunId("run1"));
    assertEquals("Larger peak was the second accepted", "peak_run1_1_4", peaks.get(0).getId());
    assertEquals("Smaller peak was the first accepted", "peak_run1_0_1", peaks.get(1).getId());
  }

  @Test
  public void testIdsDifferBetweenRuns() {
    Spectrum spectrum = indexed(0, 1, 5, 1, 0);
    String first = detector.detect(spectrum, new PeakDetectionParameters()).get(0).getId();
    String second = detector.detect(spectrum, new PeakDetectionParameters()).get(0).getId();
    assertFalse("Fresh token per run", first.equals(second));
  }

  @Test
  public void testFlatOrShortSpectraHaveNoPeaks() {
    assertTrue("Flat line", detector.detect(indexed(1, 1, 1, 1), new PeakDetectionParameters()).isEmpty());
    assertTrue("Too short", detector.detect(indexed(1, 3), new PeakDetectionParameters()).isEmpty());
  }

  @Test
  public void testTooCloseUsesIndexDistance() {
    assertTrue("Inside the distance", ProminencePeakDetector.isTooClose(7, Arrays.asList(3, 10), 4));
    assertFalse("Exactly at the distance", ProminencePeakDetector.isTooClose(7, Collections.singletonList(3), 4));
  }
}
