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

package com.labspectra.tools;

import com.labspectra.analysis.SpectralAnalysisEngine;
import com.labspectra.analysis.WorkingSpectrum;
import com.labspectra.baseline.BaselineParameters;
import com.labspectra.config.AnalysisConfiguration;
import com.labspectra.conversion.DataMode;
import com.labspectra.export.PeakCsvExporter;
import com.labspectra.peaks.DetectedPeak;
import com.labspectra.peaks.PeakDetectionParameters;
import com.labspectra.persistence.AnalysisArchive;
import com.labspectra.persistence.AnalysisPersistenceException;
import com.labspectra.persistence.JsonFileAnalysisStore;
import com.labspectra.persistence.RestoredAnalysis;
import com.labspectra.utils.CLIUtil;
import com.labspectra.utils.SpectrumFileReader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class SpectrumAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumAnalyzer.class);

  private static final String OPTION_INPUT = "i";
  private static final String OPTION_TECHNIQUE = "t";
  private static final String OPTION_SPECTRUM_ID = "s";
  private static final String OPTION_CONFIG = "c";
  private static final String OPTION_OUTPUT_DIR = "o";
  private static final String OPTION_UNITS = "u";
  private static final String OPTION_MODE = "m";
  private static final String OPTION_BASELINE = "b";
  private static final String OPTION_LAMBDA = "lambda";
  private static final String OPTION_P = "asymmetry";
  private static final String OPTION_ITERATIONS = "iterations";
  private static final String OPTION_DEGREE = "degree";
  private static final String OPTION_SIMPLIFIED = "simplified";
  private static final String OPTION_PEAKS = "p";
  private static final String OPTION_PROMINENCE = "prominence";
  private static final String OPTION_DISTANCE = "distance";
  private static final String OPTION_WIDTH = "width";
  private static final String OPTION_VALLEYS = "valleys";
  private static final String OPTION_INTEGRATE = "n";
  private static final String OPTION_CSV = "x";
  private static final String OPTION_RESTORE = "r";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Runs the spectral analysis pipeline over a two-column (x, y) text spectrum: optional unit and data mode ",
      "conversion, baseline correction, peak detection and peak integration.  Results are saved as JSON analysis ",
      "records and the peak table can be exported as CSV."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {
    {
      add(Option.builder(OPTION_INPUT)
          .argName("file")
          .desc("Spectrum file to analyze (tab, comma or space separated x and y columns)")
          .hasArg().required()
          .longOpt("input")
      );
      add(Option.builder(OPTION_TECHNIQUE)
          .argName("technique")
          .desc("Spectroscopic technique, e.g. uv-vis, ir, raman, libs, xrf")
          .hasArg()
          .longOpt("technique")
      );
      add(Option.builder(OPTION_SPECTRUM_ID)
          .argName("id")
          .desc("Id to save results under (defaults to the input file's base name)")
          .hasArg()
          .longOpt("spectrum-id")
      );
      add(Option.builder(OPTION_CONFIG)
          .argName("file")
          .desc("Properties file overriding the default analysis settings")
          .hasArg()
          .longOpt("config")
      );
      add(Option.builder(OPTION_OUTPUT_DIR)
          .argName("dir")
          .desc("Directory for saved analysis records (defaults to store.directory from the configuration)")
          .hasArg()
          .longOpt("output-dir")
      );
      add(Option.builder(OPTION_UNITS)
          .argName("unit")
          .desc("Convert the x axis to this unit (wavenumbers, micrometers, nanometers)")
          .hasArg()
          .longOpt("units")
      );
      add(Option.builder(OPTION_MODE)
          .argName("mode")
          .desc("Express y values as absorbance or transmittance before analysis")
          .hasArg()
          .longOpt("mode")
      );
      add(Option.builder(OPTION_BASELINE)
          .argName("method")
          .desc("Correct the baseline with this method: als, polynomial or linear")
          .hasArg()
          .longOpt("baseline")
      );
      add(Option.builder()
          .argName("lambda")
          .desc("ALS smoothness (defaults to the technique's recommended value)")
          .hasArg()
          .longOpt(OPTION_LAMBDA)
      );
      add(Option.builder()
          .argName("p")
          .desc("ALS asymmetry, between 0 and 1")
          .hasArg()
          .longOpt(OPTION_P)
      );
      add(Option.builder()
          .argName("count")
          .desc("ALS iteration count (at most 20)")
          .hasArg()
          .longOpt(OPTION_ITERATIONS)
      );
      add(Option.builder()
          .argName("degree")
          .desc("Polynomial baseline degree")
          .hasArg()
          .longOpt(OPTION_DEGREE)
      );
      add(Option.builder()
          .desc("Use the simplified ALS baseline and the windowed peak detector")
          .longOpt(OPTION_SIMPLIFIED)
      );
      add(Option.builder(OPTION_PEAKS)
          .desc("Detect peaks")
          .longOpt("peaks")
      );
      add(Option.builder()
          .argName("fraction")
          .desc("Minimum peak prominence as a fraction of the intensity range")
          .hasArg()
          .longOpt(OPTION_PROMINENCE)
      );
      add(Option.builder()
          .argName("points")
          .desc("Minimum distance between peaks, in samples")
          .hasArg()
          .longOpt(OPTION_DISTANCE)
      );
      add(Option.builder()
          .argName("points")
          .desc("Minimum half-height peak width, in samples")
          .hasArg()
          .longOpt(OPTION_WIDTH)
      );
      add(Option.builder()
          .desc("Search for valleys instead of peaks")
          .longOpt(OPTION_VALLEYS)
      );
      add(Option.builder(OPTION_INTEGRATE)
          .desc("Integrate all detected peaks")
          .longOpt("integrate")
      );
      add(Option.builder(OPTION_CSV)
          .argName("file")
          .desc("Write the peak table to this CSV file")
          .hasArg()
          .longOpt("csv")
      );
      add(Option.builder(OPTION_RESTORE)
          .desc("Restore previously saved results instead of recomputing them")
          .longOpt("restore")
      );
    }
  };

  /**
   * Range checks for the baseline options, so bad values end in usage output rather than a corrector failure.
   * @return One message per out-of-range value; empty if all are usable.
   */
  static List<String> baselineOptionErrors(BaselineParameters params) {
    List<String> errors = new ArrayList<>();
    if (!(params.getLambda() > 0.0)) {
      errors.add(String.format("Option --%s must be positive, got %s", OPTION_LAMBDA, params.getLambda()));
    }
    if (!(params.getP() > 0.0 && params.getP() < 1.0)) {
      errors.add(String.format("Option --%s must lie strictly between 0 and 1, got %s", OPTION_P, params.getP()));
    }
    if (params.getIterations() < 1) {
      errors.add(String.format("Option --%s must be at least 1, got %d", OPTION_ITERATIONS, params.getIterations()));
    }
    if (params.getDegree() < 1) {
      errors.add(String.format("Option --%s must be at least 1, got %d", OPTION_DEGREE, params.getDegree()));
    }
    return errors;
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(SpectrumAnalyzer.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.isFile()) {
      cliUtil.failWithMessage("Input file %s does not exist", inputFile.getAbsolutePath());
    }

    AnalysisConfiguration configuration = cl.hasOption(OPTION_CONFIG) ?
        AnalysisConfiguration.load(new File(cl.getOptionValue(OPTION_CONFIG))) : AnalysisConfiguration.load();
    SpectralAnalysisEngine engine = new SpectralAnalysisEngine(configuration);

    String technique = cl.getOptionValue(OPTION_TECHNIQUE, "");
    String spectrumId = cl.getOptionValue(OPTION_SPECTRUM_ID, FilenameUtils.getBaseName(inputFile.getName()));
    File storeDir = cl.hasOption(OPTION_OUTPUT_DIR) ?
        new File(cl.getOptionValue(OPTION_OUTPUT_DIR)) : configuration.getStoreDirectory();
    AnalysisArchive archive = new AnalysisArchive(new JsonFileAnalysisStore(storeDir));

    SpectrumFileReader.Contents contents = new SpectrumFileReader().read(inputFile);
    WorkingSpectrum spectrum = engine.normalize(contents.getSpectrum(), technique, contents.getMetadata());
    LOGGER.info("Loaded %s", spectrum);

    BaselineParameters baselineParams = engine.baselineParametersFor(technique);
    PeakDetectionParameters peakParams = engine.peakParametersFor(spectrum);

    if (cl.hasOption(OPTION_RESTORE)) {
      RestoredAnalysis restored = archive.restore(spectrumId, spectrum);
      spectrum = restored.getSpectrum();
      LOGGER.info("Restored %s", spectrum);
    } else {
      if (cl.hasOption(OPTION_UNITS)) {
        spectrum = engine.convertUnits(spectrum, cl.getOptionValue(OPTION_UNITS));
        LOGGER.info("X axis now in %s. %s", spectrum.getXUnit(), spectrum.getUnitNote());
      }

      if (cl.hasOption(OPTION_MODE)) {
        DataMode mode = null;
        try {
          mode = DataMode.fromName(cl.getOptionValue(OPTION_MODE));
        } catch (IllegalArgumentException e) {
          cliUtil.failWithMessage(e.getMessage());
        }
        if (mode != null) {
          spectrum = engine.switchMode(spectrum, mode);
        }
      }

      if (cl.hasOption(OPTION_BASELINE)) {
        baselineParams
            .setMethod(cl.getOptionValue(OPTION_BASELINE))
            .setLambda(cliUtil.getDouble(OPTION_LAMBDA, baselineParams.getLambda()))
            .setP(cliUtil.getDouble(OPTION_P, baselineParams.getP()))
            .setIterations(cliUtil.getInt(OPTION_ITERATIONS, baselineParams.getIterations()))
            .setDegree(cliUtil.getInt(OPTION_DEGREE, baselineParams.getDegree()))
            .setUseSimplified(cl.hasOption(OPTION_SIMPLIFIED));
        List<String> errors = baselineOptionErrors(baselineParams);
        if (!errors.isEmpty()) {
          cliUtil.failWithMessage(StringUtils.join(errors, "; "));
        }
        spectrum = engine.correctBaseline(spectrum, baselineParams);
      }

      if (cl.hasOption(OPTION_PEAKS) || cl.hasOption(OPTION_INTEGRATE)) {
        peakParams
            .setProminence(cliUtil.getDouble(OPTION_PROMINENCE, peakParams.getProminence()))
            .setDistance(cliUtil.getInt(OPTION_DISTANCE, peakParams.getDistance()))
            .setWidth(cliUtil.getDouble(OPTION_WIDTH, peakParams.getWidth()))
            .setDetectValleys(cl.hasOption(OPTION_VALLEYS))
            .setUseSimplified(cl.hasOption(OPTION_SIMPLIFIED));
        spectrum = engine.detectPeaks(spectrum, peakParams);
      }

      if (cl.hasOption(OPTION_INTEGRATE)) {
        spectrum = engine.integrateAll(spectrum);
      }

      try {
        archive.saveAll(spectrumId, spectrum, baselineParams, peakParams);
      } catch (AnalysisPersistenceException e) {
        LOGGER.error("Failed to save analysis results for %s: %s", spectrumId, e.getMessage());
        throw e;
      }
    }

    for (DetectedPeak peak : spectrum.getPeaks()) {
      LOGGER.info("%s", peak);
    }

    if (cl.hasOption(OPTION_CSV)) {
      File csvFile = new File(cl.getOptionValue(OPTION_CSV));
      try {
        new PeakCsvExporter().write(spectrum.getPeaks(), csvFile);
      } catch (IOException e) {
        LOGGER.error("Unable to write peak table to %s: %s", csvFile.getAbsolutePath(), e.getMessage());
        throw e;
      }
    }
  }
}
