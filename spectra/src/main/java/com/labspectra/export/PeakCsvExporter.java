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
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Writes a peak table as RFC 4180 CSV.  Numbers carry four decimals, missing values are left empty.
 */
public class PeakCsvExporter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakCsvExporter.class);

  public static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
      "Position",
      "Intensity",
      "Width",
      "Prominence",
      "Integration Area",
      "Integration Start",
      "Integration End",
      "Manually Adjusted"
  ));

  private static final CSVFormat FORMAT = CSVFormat.RFC4180.withHeader(HEADER.toArray(new String[HEADER.size()]));

  public void write(List<DetectedPeak> peaks, Appendable out) throws IOException {
    try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
      for (DetectedPeak peak : peaks) {
        printer.printRecord(row(peak));
      }
      printer.flush();
    }
  }

  public void write(List<DetectedPeak> peaks, File file) throws IOException {
    try (FileWriter writer = new FileWriter(file)) {
      write(peaks, writer);
    }
    LOGGER.info("Wrote %d peaks to %s", peaks.size(), file.getAbsolutePath());
  }

  public String toCsv(List<DetectedPeak> peaks) throws IOException {
    StringWriter writer = new StringWriter();
    write(peaks, writer);
    return writer.toString();
  }

  static List<String> row(DetectedPeak peak) {
    IntegrationRecord integration = peak.getIntegration();
    List<String> values = new ArrayList<>(HEADER.size());
    values.add(format(peak.getX()));
    values.add(format(peak.getY()));
    values.add(format(peak.getWidth()));
    values.add(format(peak.getProminence()));
    values.add(integration == null ? "" : format(integration.getArea()));
    values.add(integration == null ? "" : format(integration.getStartX()));
    values.add(integration == null ? "" : format(integration.getEndX()));
    values.add(peak.isManuallyAdjusted() ? "Yes" : "No");
    return values;
  }

  private static String format(Double value) {
    if (value == null || value.isNaN()) {
      return "";
    }
    return String.format(Locale.US, "%.4f", value);
  }
}
