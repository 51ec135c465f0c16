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

package com.labspectra.spectrum;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Technique names arrive as free-form strings from ingestion ("UV-Vis", "ir", "Raman", ...).  These helpers
 * centralize the case-insensitive matching used by mode detection, valley detection and unit defaults.
 */
public final class Techniques {
  public static final String UV_VIS = "uv-vis";
  public static final String IR = "ir";
  public static final String RAMAN = "raman";
  public static final String LIBS = "libs";
  public static final String XRF = "xrf";

  // Techniques whose features show up as dips when the data is recorded as transmittance.
  private static final Set<String> ABSORPTION_TECHNIQUES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("uv-vis", "uv", "vis", "ir", "infrared")));

  private static final Set<String> INFRARED_TECHNIQUES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("ir", "infrared")));

  private static final Set<String> UV_VIS_TECHNIQUES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("uv-vis", "uv", "vis")));

  private Techniques() {
  }

  public static String normalize(String technique) {
    return StringUtils.trimToEmpty(technique).toLowerCase();
  }

  public static boolean isAbsorption(String technique) {
    return ABSORPTION_TECHNIQUES.contains(normalize(technique));
  }

  public static boolean isInfrared(String technique) {
    return INFRARED_TECHNIQUES.contains(normalize(technique));
  }

  public static boolean isUvVis(String technique) {
    return UV_VIS_TECHNIQUES.contains(normalize(technique));
  }

  public static boolean isRaman(String technique) {
    return RAMAN.equals(normalize(technique));
  }

  public static boolean isLibs(String technique) {
    return LIBS.equals(normalize(technique));
  }
}
