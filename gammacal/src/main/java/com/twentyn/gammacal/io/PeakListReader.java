package com.twentyn.gammacal.io;

import com.twentyn.gammacal.model.PeakList;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads peak lists written by a peak finder: one peak per line, "position [uncertainty]", '#' comments.  Peaks are
 * returned sorted by position.  Uncertainties are only kept when every peak has one.
 */
public class PeakListReader {

  public PeakList read(File file) throws IOException {
    try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
      return read(reader, file.getPath());
    }
  }

  public PeakList read(Reader in, String sourceName) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<double[]> rows = new ArrayList<>();
    boolean allHaveUncertainty = true;

    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String[] fields = StringUtils.split(LiteratureEnergyReader.stripComment(line));
      if (fields.length == 0) {
        continue;
      }
      if (fields.length > 2) {
        throw new IOException(String.format(
            "%s:%d: expected 'position [uncertainty]', got %d fields", sourceName, lineNumber, fields.length));
      }
      double position = LiteratureEnergyReader.parseValue(fields[0], sourceName, lineNumber);
      double uncertainty = Double.NaN;
      if (fields.length == 2) {
        uncertainty = LiteratureEnergyReader.parseValue(fields[1], sourceName, lineNumber);
      } else {
        allHaveUncertainty = false;
      }
      rows.add(new double[]{position, uncertainty});
    }

    rows.sort(Comparator.comparingDouble(r -> r[0]));
    double[] positions = new double[rows.size()];
    double[] uncertainties = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      positions[i] = rows.get(i)[0];
      uncertainties[i] = rows.get(i)[1];
    }
    return new PeakList(positions, allHaveUncertainty && !rows.isEmpty() ? uncertainties : null);
  }
}
