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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Stores each record as a pretty-printed JSON document named <spectrum id>.<method name>.json in one directory.
 * Saving a record overwrites the previous document for the same spectrum and method.
 */
public class JsonFileAnalysisStore implements AnalysisStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(JsonFileAnalysisStore.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final String SUFFIX = ".json";
  private static final String TMP_SUFFIX = ".tmp";

  private final File directory;

  public JsonFileAnalysisStore(File directory) {
    Validate.notNull(directory, "Store directory must not be null");
    this.directory = directory;
  }

  public File getDirectory() {
    return directory;
  }

  @Override
  public void save(AnalysisRecord record) throws AnalysisPersistenceException {
    Validate.notNull(record, "Cannot save a null record");
    if (StringUtils.isBlank(record.getSpectrumId()) || StringUtils.isBlank(record.getMethodName())) {
      throw new AnalysisPersistenceException(
          String.format("Record %s needs both a spectrum id and a method name to be saved", record));
    }
    if (!directory.isDirectory() && !directory.mkdirs()) {
      throw new AnalysisPersistenceException(
          String.format("Unable to create analysis store directory %s", directory.getAbsolutePath()));
    }

    File target = fileFor(record.getSpectrumId(), record.getMethodName());
    File tmp = new File(directory, target.getName() + TMP_SUFFIX);
    try {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp, record);
      Files.move(tmp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      LOGGER.error("Failed to save %s to %s: %s", record, target.getAbsolutePath(), e.getMessage());
      throw new AnalysisPersistenceException(String.format("Unable to save %s", record), e);
    }
    LOGGER.info("Saved %s to %s", record, target.getAbsolutePath());
  }

  @Override
  public Optional<AnalysisRecord> loadLatest(String spectrumId, String methodName)
      throws AnalysisPersistenceException {
    File source = fileFor(spectrumId, methodName);
    if (!source.isFile()) {
      return Optional.empty();
    }
    return Optional.of(read(source));
  }

  @Override
  public List<AnalysisRecord> loadLatest(String spectrumId) throws AnalysisPersistenceException {
    List<AnalysisRecord> records = new ArrayList<>();
    if (!directory.isDirectory()) {
      return records;
    }
    String prefix = sanitize(spectrumId) + ".";
    File[] files = directory.listFiles((dir, name) -> name.startsWith(prefix) && name.endsWith(SUFFIX));
    if (files == null) {
      throw new AnalysisPersistenceException(
          String.format("Unable to list analysis store directory %s", directory.getAbsolutePath()));
    }
    Arrays.sort(files);
    for (File file : files) {
      AnalysisRecord record = read(file);
      // A sanitized prefix can match another id, so check the stored one.
      if (spectrumId.equals(record.getSpectrumId())) {
        records.add(record);
      }
    }
    LOGGER.debug("Loaded %d analysis records for spectrum %s", records.size(), spectrumId);
    return records;
  }

  private AnalysisRecord read(File source) throws AnalysisPersistenceException {
    try {
      return OBJECT_MAPPER.readValue(source, AnalysisRecord.class);
    } catch (IOException e) {
      LOGGER.error("Failed to read analysis record %s: %s", source.getAbsolutePath(), e.getMessage());
      throw new AnalysisPersistenceException(
          String.format("Unable to read analysis record %s", source.getAbsolutePath()), e);
    }
  }

  File fileFor(String spectrumId, String methodName) {
    return new File(directory, sanitize(spectrumId) + "." + sanitize(methodName) + SUFFIX);
  }

  static String sanitize(String name) {
    return StringUtils.defaultString(name).replaceAll("[^A-Za-z0-9_-]", "_");
  }
}
