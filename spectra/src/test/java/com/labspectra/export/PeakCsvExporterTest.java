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

package com.labspectra.export;

import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.IntegrationRecord;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class PeakCsvExporterTest {
  private static final String HEADER_LINE = "Position,Intensity,Width,Prominence,Integration Area,Integration Start," +
      "Integration End,Manually Adjusted";

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private final List<DetectedPeak> peaks = Arrays.asList(
      new DetectedPeak("a", 2.0, 5.0, 5.0, 2.0, 1.0, 3.0, new IntegrationRecord(6.0, 1.0, 3.0, true)),
      new DetectedPeak("b", 1234.56789, 0.5, 0.1));

  @Test
  public void testRowsAndHeader() throws Exception {
    String[] lines = new PeakCsvExporter().toCsv(peaks).split("\r\n");
    assertEquals("Header and one row per peak", 3, lines.length);
    assertEquals("Header", HEADER_LINE, lines[0]);
    assertEquals("Integrated peak", "2.0000,5.0000,2.0000,5.0000,6.0000,1.0000,3.0000,Yes", lines[1]);
    assertEquals("Missing values are empty", "1234.5679,0.5000,,0.1000,,,,No", lines[2]);
  }

  @Test
  public void testEmptyTableHasHeaderOnly() throws Exception {
    assertEquals("Only the header", HEADER_LINE + "\r\n",
        new PeakCsvExporter().toCsv(Collections.<DetectedPeak>emptyList()));
  }

  @Test
  public void testWritesFile() throws Exception {
    File out = new File(tempFolder.getRoot(), "peaks.csv");
    new PeakCsvExporter().write(peaks, out);
    List<String> lines = FileUtils.readLines(out, StandardCharsets.UTF_8);
    assertEquals("Header and two rows", 3, lines.size());
    assertEquals("Header first", HEADER_LINE, lines.get(0));
  }
}
