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

import org.apache.commons.lang3.StringUtils;

public enum BaselineMethod {
  ALS("als"),
  POLYNOMIAL("polynomial"),
  LINEAR("linear"),
  ;

  private final String name;

  BaselineMethod(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Case-insensitive lookup.
   * @return The method, or null if the name matches none.
   */
  public static BaselineMethod fromName(String name) {
    String trimmed = StringUtils.trimToEmpty(name);
    for (BaselineMethod method : values()) {
      if (method.name.equalsIgnoreCase(trimmed)) {
        return method;
      }
    }
    return null;
  }
}
