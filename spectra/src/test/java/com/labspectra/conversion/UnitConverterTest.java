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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class UnitConverterTest {
  private UnitConverter converter;

  @Before
  public void setUp() {
    converter = new UnitConverter();
  }

  @Test
  public void testMicrometersToWavenumbers() {
    UnitConversionResult result =
        converter.convert(new double[]{2.5, 5.0, 10.0}, "MICROMETERS", UnitConverter.WAVENUMBERS, "ir");
    assertTrue("Conversion rule applied", result.wasConverted());
    assertArrayEquals("nu = 10000 / lambda", new double[]{4000.0, 2000.0, 1000.0}, result.getConvertedX(), 1e-9);
    assertEquals("Unit label", UnitConverter.WAVENUMBER_LABEL, result.getActualUnit());
    assertEquals("Nothing dropped", 0, result.getDroppedCount());
  }

  @Test
  public void testMicrometerWavenumberRoundTrip() {
    double[] micrometers = new double[]{2.5, 3.3, 6.2, 14.0};
    double[] wavenumbers = converter.convert(micrometers, "um", "wavenumbers", null).getConvertedX();
    double[] back = converter.convert(wavenumbers, "cm-1", "micrometers", null).getConvertedX();
    assertArrayEquals("Round trip restores the source axis", micrometers, back, 1e-9);
  }

  @Test
  public void testNonPositiveSamplesAreDroppedAndTracked() {
    UnitConversionResult result =
        converter.convert(new double[]{0.0, -1.0, 2.0, 4.0}, "micrometers", "wavenumbers", null);
    assertArrayEquals("Only positive samples survive", new double[]{5000.0, 2500.0}, result.getConvertedX(), 1e-9);
    assertArrayEquals("Kept positions", new int[]{2, 3}, result.getKeptIndices());
    assertEquals("Two dropped", 2, result.getDroppedCount());
    assertArrayEquals("y filtered the same way", new double[]{30.0, 40.0},
        result.filterAligned(new double[]{10.0, 20.0, 30.0, 40.0}), 0.0);
  }

  @Test
  public void testNanometersToMicrometersAndBack() {
    UnitConversionResult toMicro = converter.convert(new double[]{250.0, 500.0}, "nm", "micrometers", null);
    assertArrayEquals("Divide by 1000", new double[]{0.25, 0.5}, toMicro.getConvertedX(), 1e-12);
    UnitConversionResult toNano = converter.convert(toMicro.getConvertedX(), "micrometers", "nanometers", null);
    assertArrayEquals("Multiply by 1000", new double[]{250.0, 500.0}, toNano.getConvertedX(), 1e-9);
    assertEquals("Unit label", UnitConverter.NANOMETER_LABEL, toNano.getActualUnit());
  }

  @Test
  public void testBlankTargetUsesTechniqueConvention() {
    UnitConversionResult result = converter.convert(new double[]{5.0}, "micrometers", " ", "IR");
    assertTrue("IR defaults to wavenumbers", result.wasConverted());
    assertArrayEquals("Converted", new double[]{2000.0}, result.getConvertedX(), 1e-9);
  }

  @Test
  public void testNoTargetForTechniqueLeavesAxisAlone() {
    UnitConversionResult result = converter.convert(new double[]{1.0, 2.0}, "keV", null, "xrf");
    assertFalse("No convention for XRF", result.wasConverted());
    assertEquals("Unit unchanged", "keV", result.getActualUnit());
  }

  @Test
  public void testSameUnitFamilyIsNotConverted() {
    UnitConversionResult result = converter.convert(new double[]{1.0, 2.0}, "μm", "micrometers", null);
    assertFalse("Already in the target unit", result.wasConverted());
    assertArrayEquals("Values unchanged", new double[]{1.0, 2.0}, result.getConvertedX(), 0.0);
  }

  @Test
  public void testUnsupportedPairPassesThrough() {
    UnitConversionResult result = converter.convert(new double[]{3.0}, "eV", "wavenumbers", null);
    assertFalse("No rule from eV", result.wasConverted());
    assertEquals("Source unit kept", "eV", result.getActualUnit());
  }

  @Test
  public void testNullAxis() {
    assertEquals("Empty result", 0,
        converter.convert(null, "micrometers", "wavenumbers", null).getConvertedX().length);
  }

  @Test
  public void testStandardAxisUnits() {
    assertEquals("IR axis", UnitConverter.WAVENUMBERS, XAxisUnit.standardFor("ir").getUnit());
    assertEquals("UV-Vis axis", "Wavelength (nm)", XAxisUnit.standardFor("UV-Vis").getLabel());
    assertEquals("Unknown technique", XAxisUnit.UNKNOWN, XAxisUnit.standardFor("xrf"));
  }
}
