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

package com.labspectra.conversion;

import com.labspectra.spectrum.Techniques;

/**
 * The conventional x-axis unit and display label for a technique, used when the source file carries no XUNITS.
 */
public class XAxisUnit {
  public static final XAxisUnit UNKNOWN = new XAxisUnit("unknown", "X-axis");

  private final String unit;
  private final String label;

  public XAxisUnit(String unit, String label) {
    this.unit = unit;
    this.label = label;
  }

  public static XAxisUnit standardFor(String technique) {
    if (Techniques.isInfrared(technique)) {
      return new XAxisUnit(UnitConverter.WAVENUMBERS, "Wavenumber (cm⁻¹)");
    }
    if (Techniques.isRaman(technique)) {
      return new XAxisUnit(UnitConverter.WAVENUMBERS, "Raman Shift (cm⁻¹)");
    }
    if (Techniques.isUvVis(technique) || Techniques.isLibs(technique)) {
      return new XAxisUnit(UnitConverter.NANOMETERS, "Wavelength (nm)");
    }
    return UNKNOWN;
  }

  public String getUnit() {
    return unit;
  }

  public String getLabel() {
    return label;
  }
}
