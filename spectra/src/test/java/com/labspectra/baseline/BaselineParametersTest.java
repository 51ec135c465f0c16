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

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BaselineParametersTest {

  @Test
  public void testDefaults() {
    BaselineParameters params = new BaselineParameters();
    assertEquals("Default method", "als", params.getMethod());
    assertEquals("Default lambda", 1000.0, params.getLambda(), 0.0);
    assertEquals("Default p", 0.01, params.getP(), 0.0);
    assertEquals("Default iterations", 10, params.getIterations());
    assertEquals("Default degree", 3, params.getDegree());
    assertFalse("Full algorithm by default", params.isUseSimplified());
  }

  @Test
  public void testFromMapAcceptsBothSpellingsAndIgnoresUnknownKeys() {
    Map<String, Object> values = new HashMap<>();
    values.put("method", "polynomial");
    values.put("degree", 2);
    values.put("useSimplified", true);
    values.put("polynomial_strategy", "anchor_interpolation");
    values.put("operator", "someone");

    BaselineParameters params = BaselineParameters.fromMap(values);
    assertEquals("Method read", "polynomial", params.getMethod());
    assertEquals("Degree read", 2, params.getDegree());
    assertTrue("camelCase alias read", params.isUseSimplified());
    assertEquals("Strategy read", PolynomialBaselineCorrector.Strategy.ANCHOR_INTERPOLATION,
        params.getPolynomialStrategy());
    assertEquals("Unspecified lambda keeps its default", BaselineParameters.DEFAULT_LAMBDA, params.getLambda(), 0.0);
  }

  @Test
  public void testToMapUsesStoredNames() {
    Map<String, Object> map = new BaselineParameters().setLambda(250.0).setUseSimplified(true).toMap();
    assertEquals("lambda stored", 250.0, ((Number) map.get("lambda")).doubleValue(), 0.0);
    assertEquals("snake_case flag", Boolean.TRUE, map.get("use_simplified"));
    assertFalse("No camelCase duplicate", map.containsKey("useSimplified"));
  }

  @Test
  public void testMapRoundTripPreservesSettings() {
    BaselineParameters original = new BaselineParameters()
        .setMethod("polynomial")
        .setDegree(5)
        .setPolynomialStrategy(PolynomialBaselineCorrector.Strategy.ANCHOR_INTERPOLATION);
    BaselineParameters copy = BaselineParameters.fromMap(original.toMap());
    assertEquals("Same description", original.toString(), copy.toString());
  }

  @Test
  public void testNullMapGivesDefaults() {
    assertEquals("Defaults", new BaselineParameters().toString(), BaselineParameters.fromMap(null).toString());
  }

  @Test
  public void testCopyIsIndependent() {
    BaselineParameters original = new BaselineParameters();
    BaselineParameters copy = new BaselineParameters(original).setLambda(5.0);
    assertEquals("Original untouched", BaselineParameters.DEFAULT_LAMBDA, original.getLambda(), 0.0);
    assertEquals("Copy changed", 5.0, copy.getLambda(), 0.0);
  }
}
