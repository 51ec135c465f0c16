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

package com.labspectra.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the latest analysis result of each method for each spectrum.
 */
public interface AnalysisStore {

  /**
   * Save a record, replacing any earlier record with the same spectrum id and method name.
   */
  void save(AnalysisRecord record) throws AnalysisPersistenceException;

  Optional<AnalysisRecord> loadLatest(String spectrumId, String methodName) throws AnalysisPersistenceException;

  /**
   * @return The latest record of every method saved for the spectrum, in no particular order.
   */
  List<AnalysisRecord> loadLatest(String spectrumId) throws AnalysisPersistenceException;
}
