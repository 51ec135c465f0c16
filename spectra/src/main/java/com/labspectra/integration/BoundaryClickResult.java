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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one click in the boundary selection protocol.  accepted is true only for the click that commits a new
 * integration range; message is the text to show the user, possibly empty.
 */
public class BoundaryClickResult {
  private final BoundarySelection selection;
  private final List<DetectedPeak> peaks;
  private final boolean accepted;
  private final String message;

  public BoundaryClickResult(BoundarySelection selection, List<DetectedPeak> peaks, boolean accepted,
                             String message) {
    this.selection = selection;
    this.peaks = Collections.unmodifiableList(peaks);
    this.accepted = accepted;
    this.message = message == null ? "" : message;
  }

  public BoundarySelection getSelection() {
    return selection;
  }

  public List<DetectedPeak> getPeaks() {
    return peaks;
  }

  public boolean isAccepted() {
    return accepted;
  }

  public String getMessage() {
    return message;
  }
}
