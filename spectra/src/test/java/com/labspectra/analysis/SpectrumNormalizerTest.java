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

package com.labspectra.analysis;

import com.labspectra.conversion.DataMode;
import com.labspectra.conversion.UnitConverter;
import com.labspectra.spectrum.Spectrum;
import com.labspectra.utils.SpectrumFileReader;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumNormalizerTest {
  private SpectrumNormalizer normalizer;

  @Before
  public void setUp() {
    normalizer = new SpectrumNormalizer();
  }

  @Test
  public void testInfraredMicrometerFileMovesToWavenumbers() throws Exception {
    File file = new File(SpectrumNormalizerTest.class.getResource("/ir_micrometers.txt").toURI());
    SpectrumFileReader.Contents contents = new SpectrumFileReader().read(file);

    WorkingSpectrum spectrum = normalizer.normalize(contents.getSpectrum(), "IR", contents.getMetadata());
    assertEquals("Unit label", UnitConverter.WAVENUMBER_LABEL, spectrum.getXUnit());
    assertEquals("First sample", 4000.0, spectrum.getX()[0], 1e-9);
    assertTrue("Conversion noted", spectrum.getUnitNote().contains("wavenumbers"));
    assertEquals("Mode from YUNITS", DataMode.TRANSMITTANCE, spectrum.getMode());
    assertArrayEquals("y untouched", contents.getSpectrum().getY(), spectrum.getY(), 0.0);
  }

  @Test
  public void testMissingUnitsUseTechniqueLabel() {
    Spectrum raw = new Spectrum(new double[]{200, 300, 400}, new double[]{0.1, 0.9, 0.2});
    WorkingSpectrum spectrum = normalizer.normalize(raw, "uv-vis", Collections.<String, Object>emptyMap());
    assertEquals("Standard label", "Wavelength (nm)", spectrum.getXUnit());
    assertEquals("Absorbance inferred from values", DataMode.ABSORBANCE, spectrum.getMode());
  }

  @Test
  public void testUnconvertibleUnitIsKeptAsDeclared() {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("xunits", "keV");
    Spectrum raw = new Spectrum(new double[]{1, 2, 3}, new double[]{5, 9, 4});
    WorkingSpectrum spectrum = normalizer.normalize(raw, "xrf", metadata);
    assertEquals("Declared unit", "keV", spectrum.getXUnit());
    assertEquals("Non-absorption techniques are absorbance", DataMode.ABSORBANCE, spectrum.getMode());
  }
}
