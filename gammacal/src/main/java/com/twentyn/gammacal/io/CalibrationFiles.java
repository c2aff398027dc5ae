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

package com.twentyn.gammacal.io;

import com.twentyn.gammacal.model.CalibrationModel;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plain text persistence of calibrations.
 *
 * Coefficient files hold one coefficient per line, lowest degree first; a file with all coefficients on a single
 * whitespace separated line is accepted as well.  Calibration lists hold one "name: c0 c1 c2 ..." line per spectrum.
 */
public class CalibrationFiles {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CalibrationFiles.class);

  private static final char NAME_SEPARATOR = ':';

  public static CalibrationModel readCoefficients(File file) throws IOException {
    try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
      return readCoefficients(reader, file.getPath());
    }
  }

  public static CalibrationModel readCoefficients(Reader in, String sourceName) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<Double> coefficients = new ArrayList<>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String[] fields = StringUtils.split(LiteratureEnergyReader.stripComment(line));
      if (fields.length == 0) {
        continue;
      }
      for (String field : fields) {
        coefficients.add(LiteratureEnergyReader.parseValue(field, sourceName, lineNumber));
      }
      if (fields.length > 1) {
        // Single line format: everything after it is ignored.
        break;
      }
    }
    if (coefficients.isEmpty()) {
      throw new IOException(String.format("%s: no calibration coefficients found", sourceName));
    }
    return new CalibrationModel(coefficients);
  }

  public static void writeCoefficients(File file, CalibrationModel model) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(new FileWriter(file))) {
      writeCoefficients(writer, model);
    }
  }

  public static void writeCoefficients(Writer writer, CalibrationModel model) throws IOException {
    for (double c : model.getCoefficients()) {
      writer.write(Double.toString(c));
      writer.write("\n");
    }
  }

  /**
   * Read a calibration list.  Lines that cannot be parsed are skipped with a warning.
   *
   * @return Calibrations by spectrum name, in file order.
   */
  public static Map<String, CalibrationModel> readCalibrationList(File file) throws IOException {
    try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
      return readCalibrationList(reader, file.getPath());
    }
  }

  public static Map<String, CalibrationModel> readCalibrationList(Reader in, String sourceName) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    Map<String, CalibrationModel> calibrations = new LinkedHashMap<>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (StringUtils.isBlank(line)) {
        continue;
      }
      int separator = line.indexOf(NAME_SEPARATOR);
      String name = separator > 0 ? line.substring(0, separator).trim() : "";
      if (name.isEmpty()) {
        LOGGER.warn("Could not parse line %d of file %s: ignored", lineNumber, sourceName);
        continue;
      }
      try {
        List<Double> coefficients = new ArrayList<>();
        for (String field : StringUtils.split(line.substring(separator + 1))) {
          coefficients.add(Double.parseDouble(field));
        }
        calibrations.put(name, new CalibrationModel(coefficients));
      } catch (IllegalArgumentException e) {
        // Covers NumberFormatException as well as an empty or non-finite coefficient list.
        LOGGER.warn("Could not parse line %d of file %s: ignored (%s)", lineNumber, sourceName, e.getMessage());
      }
    }
    return calibrations;
  }

  public static void writeCalibrationList(File file, Map<String, CalibrationModel> calibrations) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(new FileWriter(file))) {
      writeCalibrationList(writer, calibrations);
    }
  }

  /**
   * Write one "name: c0 c1 ..." line per calibration, sorted by name.
   */
  public static void writeCalibrationList(Writer writer, Map<String, CalibrationModel> calibrations)
      throws IOException {
    for (Map.Entry<String, CalibrationModel> entry : new TreeMap<>(calibrations).entrySet()) {
      writer.write(formatListEntry(entry.getKey(), entry.getValue()));
      writer.write("\n");
    }
  }

  public static String formatListEntry(String name, CalibrationModel model) {
    if (name.indexOf(NAME_SEPARATOR) >= 0) {
      throw new IllegalArgumentException(String.format("Spectrum name '%s' must not contain '%c'", name,
          NAME_SEPARATOR));
    }
    return name + NAME_SEPARATOR + " " + model.toString();
  }
}
