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

import com.labspectra.spectrum.Spectrum;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PeakPickerTest {
  private PeakDetector full;
  private PeakDetector simplified;
  private PeakPicker picker;
  private Spectrum spectrum;
  private List<DetectedPeak> windowedResult;

  @Before
  public void setUp() {
    full = mock(PeakDetector.class);
    simplified = mock(PeakDetector.class);
    picker = new PeakPicker(full, simplified);
    spectrum = new Spectrum(new double[750], new double[750]);
    windowedResult = Collections.singletonList(new DetectedPeak("peak_w_0_10", 10.0, 1.0, 0.5));
  }

  @Test
  public void testFullDetectorResultIsReturned() {
    List<DetectedPeak> expected = Collections.singletonList(new DetectedPeak("peak_f_0_3", 3.0, 2.0, 1.0));
    PeakDetectionParameters params = new PeakDetectionParameters();
    when(full.detect(spectrum, params)).thenReturn(expected);

    assertSame("Full detector output", expected, picker.pick(spectrum, params));
    verify(simplified, never()).detect(any(Spectrum.class), any(PeakDetectionParameters.class));
  }

  @Test
  public void testFailureFallsBackToWindowedDetectorWithScaledWindow() {
    PeakDetectionParameters params = new PeakDetectionParameters().setWindowSize(11).setProminence(0.2);
    when(full.detect(spectrum, params)).thenThrow(new IllegalStateException("boom"));
    when(simplified.detect(any(Spectrum.class), any(PeakDetectionParameters.class))).thenReturn(windowedResult);

    assertSame("Windowed output after failure", windowedResult, picker.pick(spectrum, params));

    ArgumentCaptor<PeakDetectionParameters> captor = ArgumentCaptor.forClass(PeakDetectionParameters.class);
    verify(simplified).detect(any(Spectrum.class), captor.capture());
    assertEquals("Window is max(3, n / 100)", 7, captor.getValue().getWindowSize());
    assertEquals("Other settings carried over", 0.2, captor.getValue().getProminence(), 0.0);
    assertEquals("Caller's parameters untouched", 11, params.getWindowSize());
  }

  @Test
  public void testFallbackWindowHasFloorOfThree() {
    Spectrum small = new Spectrum(new double[50], new double[50]);
    PeakDetectionParameters params = new PeakDetectionParameters();
    when(full.detect(small, params)).thenThrow(new RuntimeException("bad data"));
    when(simplified.detect(any(Spectrum.class), any(PeakDetectionParameters.class))).thenReturn(windowedResult);

    picker.pick(small, params);

    ArgumentCaptor<PeakDetectionParameters> captor = ArgumentCaptor.forClass(PeakDetectionParameters.class);
    verify(simplified).detect(any(Spectrum.class), captor.capture());
    assertEquals("Floor applies to short spectra", 3, captor.getValue().getWindowSize());
  }

  @Test
  public void testSimplifiedRequestSkipsFullDetector() {
    PeakDetectionParameters params = new PeakDetectionParameters().setUseSimplified(true).setWindowSize(4);
    when(simplified.detect(spectrum, params)).thenReturn(windowedResult);

    assertSame("Windowed output", windowedResult, picker.pick(spectrum, params));
    verify(full, never()).detect(any(Spectrum.class), any(PeakDetectionParameters.class));
  }

  @Test(expected = IllegalStateException.class)
  public void testFailureOfFallbackPropagates() {
    PeakDetectionParameters params = new PeakDetectionParameters();
    when(full.detect(spectrum, params)).thenThrow(new RuntimeException("first"));
    when(simplified.detect(any(Spectrum.class), any(PeakDetectionParameters.class)))
        .thenThrow(new IllegalStateException("second"));
    picker.pick(spectrum, params);
  }
}
