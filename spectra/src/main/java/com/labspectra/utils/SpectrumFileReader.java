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

package com.labspectra.utils;

import com.labspectra.spectrum.Spectrum;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a two-column (x, y) text spectrum separated by tabs, commas, semicolons or spaces.  Rows whose first two
 * fields are not both numbers (column headers, stray text) are skipped.  Lines of the form "##KEY=value" or
 * "#KEY=value" are collected as metadata, so a file can declare e.g. ##XUNITS=MICROMETERS.
 */
public class SpectrumFileReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumFileReader.class);

  private static final char[] CANDIDATE_DELIMITERS = new char[]{'\t', ',', ';'};

  public static class Contents {
    private final Spectrum spectrum;
    private final Map<String, String> metadata;

    public Contents(Spectrum spectrum, Map<String, String> metadata) {
      this.spectrum = spectrum;
      this.metadata = Collections.unmodifiableMap(metadata);
    }

    public Spectrum getSpectrum() {
      return spectrum;
    }

    public Map<String, String> getMetadata() {
      return metadata;
    }
  }

  public Contents read(File file) throws IOException {
    String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    Contents contents = parse(text);
    LOGGER.info("Read %d points from %s", contents.getSpectrum().size(), file.getAbsolutePath());
    return contents;
  }

  public Contents parse(String text) throws IOException {
    Map<String, String> metadata = new LinkedHashMap<>();
    StringBuilder data = new StringBuilder();
    for (String line : text.split("\\r?\\n")) {
      String trimmed = line.trim();
      if (trimmed.startsWith("#")) {
        readMetadata(trimmed, metadata);
      } else if (!trimmed.isEmpty()) {
        data.append(trimmed).append('\n');
      }
    }

    char delimiter = detectDelimiter(data.toString());
    CSVFormat format = CSVFormat.newFormat(delimiter).withQuote('"').withIgnoreEmptyLines(true);

    List<Double> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    int skipped = 0;
    try (CSVParser parser = new CSVParser(new StringReader(data.toString()), format)) {
      for (CSVRecord record : parser) {
        List<String> fields = new ArrayList<>();
        for (String field : record) {
          if (StringUtils.isNotBlank(field)) {
            fields.add(field.trim());
          }
        }
        Double xValue = fields.size() < 2 ? null : parseNumber(fields.get(0));
        Double yValue = fields.size() < 2 ? null : parseNumber(fields.get(1));
        if (xValue == null || yValue == null) {
          skipped++;
          continue;
        }
        xs.add(xValue);
        ys.add(yValue);
      }
    }
    if (skipped > 0) {
      LOGGER.debug("Skipped %d non-numeric rows", skipped);
    }

    double[] x = new double[xs.size()];
    double[] y = new double[ys.size()];
    for (int i = 0; i < x.length; i++) {
      x[i] = xs.get(i);
      y[i] = ys.get(i);
    }
    return new Contents(new Spectrum(x, y), metadata);
  }

  private static Double parseNumber(String field) {
    if (!NumberUtils.isCreatable(field)) {
      return null;
    }
    try {
      return Double.valueOf(field);
    } catch (NumberFormatException e) {
      // Hex and octal literals pass isCreatable but are not sample values.
      return null;
    }
  }

  private static void readMetadata(String line, Map<String, String> metadata) {
    String body = StringUtils.stripStart(line, "#");
    int eq = body.indexOf('=');
    if (eq <= 0) {
      return;
    }
    String key = body.substring(0, eq).trim();
    String value = body.substring(eq + 1).trim();
    if (!key.isEmpty()) {
      metadata.put(key, value);
    }
  }

  static char detectDelimiter(String data) {
    String firstLine = StringUtils.substringBefore(data, "\n");
    for (char candidate : CANDIDATE_DELIMITERS) {
      if (firstLine.indexOf(candidate) >= 0) {
        return candidate;
      }
    }
    return ' ';
  }
}
