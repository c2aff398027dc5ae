/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
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

package com.twentyn.gammacal;

import com.twentyn.gammacal.io.CalibrationFiles;
import com.twentyn.gammacal.io.CalibrationReport;
import com.twentyn.gammacal.io.LiteratureEnergyReader;
import com.twentyn.gammacal.io.PeakListReader;
import com.twentyn.gammacal.matching.AnchorConvention;
import com.twentyn.gammacal.model.PeakList;
import com.twentyn.gammacal.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line driver: calibrates one or more peak lists against a set of literature energies and writes the
 * resulting calibrations.
 */
public class AutoCalibrate {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AutoCalibrate.class);

  public static final String OPTION_ENERGIES = "e";
  public static final String OPTION_SOURCE = "s";
  public static final String OPTION_PEAKS = "p";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_DEGREE = "d";
  public static final String OPTION_TRIM = "t";
  public static final String OPTION_ANCHORS = "a";
  public static final String OPTION_THREADS = "j";
  public static final String OPTION_OUTPUT_LIST = "o";
  public static final String OPTION_OUTPUT_COEFFICIENTS = "k";
  public static final String OPTION_REPORT = "r";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class matches detected peak positions against known gamma-ray energies of a calibration source and fits ",
      "a channel to energy calibration for every peak list given.  Peak lists hold one 'position [uncertainty]' per ",
      "line; the spectrum name is the peak list's file name without its last extension."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_ENERGIES)
        .argName("energies file")
        .desc("A file of literature energies, whitespace separated, in matching order")
        .hasArg()
        .longOpt("energies")
    );
    add(Option.builder(OPTION_SOURCE)
        .argName("source name")
        .desc("Use the bundled energies of a calibration source (e.g. 226Ra, 152Eu) instead of an energies file")
        .hasArg()
        .longOpt("source")
    );
    add(Option.builder(OPTION_PEAKS)
        .argName("peak lists")
        .desc("One or more peak list files to calibrate")
        .hasArgs().valueSeparator(',').required()
        .longOpt("peaks")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON file with calibration settings; command line options take precedence")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_DEGREE)
        .argName("degree")
        .desc("Degree of the fitted calibration polynomial")
        .hasArg()
        .longOpt("degree")
    );
    add(Option.builder(OPTION_TRIM)
        .argName("count")
        .desc("Number of worst matching literature lines left out of the final fit")
        .hasArg()
        .longOpt("trim")
    );
    add(Option.builder(OPTION_ANCHORS)
        .argName("convention")
        .desc("Literature energies used as anchors: FIRST_TWO or FIRST_AND_LAST")
        .hasArg()
        .longOpt("anchors")
    );
    add(Option.builder(OPTION_THREADS)
        .argName("threads")
        .desc("Number of spectra to calibrate concurrently")
        .hasArg()
        .longOpt("threads")
    );
    add(Option.builder(OPTION_OUTPUT_LIST)
        .argName("calibration list")
        .desc("Write all calibrations to this file as 'name: c0 c1 ...' lines")
        .hasArg()
        .longOpt("output")
    );
    add(Option.builder(OPTION_OUTPUT_COEFFICIENTS)
        .argName("coefficient file")
        .desc("Write the calibration, one coefficient per line (only with a single peak list)")
        .hasArg()
        .longOpt("coefficients")
    );
    add(Option.builder(OPTION_REPORT)
        .argName("report file")
        .desc("Write the peak/energy correspondences of every spectrum as JSON")
        .hasArg()
        .longOpt("report")
    );
  }};

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(AutoCalibrate.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    if (cl.hasOption(OPTION_ENERGIES) == cl.hasOption(OPTION_SOURCE)) {
      cliUtil.failWithMessage("Specify exactly one of --energies or --source");
    }
    if (cl.hasOption(OPTION_OUTPUT_COEFFICIENTS) && cl.getOptionValues(OPTION_PEAKS).length != 1) {
      cliUtil.failWithMessage("--coefficients can only be used with a single peak list");
    }

    BatchCalibrator.BatchResult result;
    try {
      result = new AutoCalibrate().run(cl);
    } catch (IllegalArgumentException e) {
      cliUtil.failWithMessage(e.getMessage());
      return;
    }

    if (!result.getFailures().isEmpty()) {
      System.exit(1);
    }
  }

  public BatchCalibrator.BatchResult run(CommandLine cl) throws IOException, InterruptedException {
    AutocalConfiguration config = buildConfiguration(cl);
    double[] energies = loadEnergies(cl);

    Map<String, PeakList> spectra = new LinkedHashMap<>();
    PeakListReader peakReader = new PeakListReader();
    for (String path : cl.getOptionValues(OPTION_PEAKS)) {
      File file = new File(path);
      String name = spectrumName(file);
      if (spectra.containsKey(name)) {
        throw new IllegalArgumentException(String.format("Two peak lists map to the spectrum name %s", name));
      }
      spectra.put(name, peakReader.read(file));
    }
    LOGGER.info("Calibrating %d spectra against %d literature energies", spectra.size(), energies.length);

    int threads = cl.hasOption(OPTION_THREADS) ? parseInt(cl, OPTION_THREADS) : 1;
    BatchCalibrator.BatchResult result = new BatchCalibrator(new AutoCalibrator(config), threads).
        calibrateAll(spectra, energies);

    List<CalibrationReport> reports = new ArrayList<>();
    for (Map.Entry<String, CalibrationResult> entry : result.getResults().entrySet()) {
      CalibrationReport report = CalibrationReport.fromResult(entry.getKey(), entry.getValue());
      LOGGER.info("%n%s", report.formatTable());
      reports.add(report);
    }
    for (Map.Entry<String, CalibrationException> entry : result.getFailures().entrySet()) {
      LOGGER.error("No calibration for %s: %s", entry.getKey(), entry.getValue().getMessage());
    }

    if (cl.hasOption(OPTION_OUTPUT_LIST)) {
      File listFile = new File(cl.getOptionValue(OPTION_OUTPUT_LIST));
      LOGGER.info("Writing calibration list to %s", listFile.getAbsolutePath());
      CalibrationFiles.writeCalibrationList(listFile, result.getCalibrations());
    }
    if (cl.hasOption(OPTION_OUTPUT_COEFFICIENTS) && !result.getResults().isEmpty()) {
      File coefficientFile = new File(cl.getOptionValue(OPTION_OUTPUT_COEFFICIENTS));
      LOGGER.info("Writing calibration coefficients to %s", coefficientFile.getAbsolutePath());
      CalibrationFiles.writeCoefficients(coefficientFile, result.getResults().values().iterator().next().getModel());
    }
    if (cl.hasOption(OPTION_REPORT)) {
      File reportFile = new File(cl.getOptionValue(OPTION_REPORT));
      LOGGER.info("Writing correspondence report to %s", reportFile.getAbsolutePath());
      CalibrationReport.writeJson(reportFile, reports);
    }
    return result;
  }

  AutocalConfiguration buildConfiguration(CommandLine cl) throws IOException {
    AutocalConfiguration config = cl.hasOption(OPTION_CONFIG) ?
        AutocalConfiguration.readFromFile(new File(cl.getOptionValue(OPTION_CONFIG))) :
        new AutocalConfiguration();

    if (cl.hasOption(OPTION_DEGREE)) {
      config.setFitDegree(parseInt(cl, OPTION_DEGREE));
    }
    if (cl.hasOption(OPTION_TRIM)) {
      config.setTrimCount(parseInt(cl, OPTION_TRIM));
    }
    if (cl.hasOption(OPTION_ANCHORS)) {
      String convention = cl.getOptionValue(OPTION_ANCHORS).toUpperCase();
      try {
        config.setAnchorConvention(AnchorConvention.valueOf(convention));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format("Unknown anchor convention %s", convention), e);
      }
    }
    config.validate();
    return config;
  }

  double[] loadEnergies(CommandLine cl) throws IOException {
    List<Double> energies;
    if (cl.hasOption(OPTION_SOURCE)) {
      CalibrationSourceCorpus corpus = new CalibrationSourceCorpus();
      corpus.loadCorpus();
      energies = corpus.getEnergies(cl.getOptionValue(OPTION_SOURCE));
    } else {
      energies = new LiteratureEnergyReader().read(new File(cl.getOptionValue(OPTION_ENERGIES)));
    }
    return energies.stream().mapToDouble(Double::doubleValue).toArray();
  }

  static String spectrumName(File peakFile) {
    String fileName = peakFile.getName();
    return fileName.contains(".") ? StringUtils.substringBeforeLast(fileName, ".") : fileName;
  }

  private static int parseInt(CommandLine cl, String option) {
    String value = cl.getOptionValue(option);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Option -%s expects an integer, got '%s'", option, value), e);
    }
  }
}
