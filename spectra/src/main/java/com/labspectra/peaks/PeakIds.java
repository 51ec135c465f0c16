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

import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Peak ids embed a per-run token so that ids from one detection run never collide with those of another.
 */
public final class PeakIds {
  private static final int TOKEN_LENGTH = 8;
  private static final String MANUAL_PREFIX = "manual_peak_";

  private PeakIds() {
  }

  public static String newRunToken() {
    return RandomStringUtils.randomAlphanumeric(TOKEN_LENGTH).toLowerCase();
  }

  /**
   * The run token to use for a detection call: the caller's run id if one was given, a fresh token otherwise.
   */
  public static String runToken(PeakDetectionParameters params) {
    return StringUtils.isBlank(params.getRunId()) ? newRunToken() : params.getRunId().trim();
  }

  public static String detected(String runToken, int ordinal, int index) {
    return String.format("peak_%s_%d_%d", runToken, ordinal, index);
  }

  public static String manual() {
    return MANUAL_PREFIX + newRunToken();
  }

  public static boolean isManual(String peakId) {
    return peakId != null && peakId.startsWith(MANUAL_PREFIX);
  }
}
