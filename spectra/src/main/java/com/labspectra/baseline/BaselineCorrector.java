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

package com.labspectra.baseline;

import com.labspectra.spectrum.Spectrum;

/**
 * An algorithm that estimates the background of a spectrum.
 */
public interface BaselineCorrector {

  /**
   * Fit a baseline and subtract it.  Implementations return {@link BaselineResult#empty()} for spectra that are not
   * analyzable instead of throwing.
   */
  BaselineResult correct(Spectrum spectrum);

  /**
   * The method name results are persisted under, e.g. "als".
   */
  String getName();
}
