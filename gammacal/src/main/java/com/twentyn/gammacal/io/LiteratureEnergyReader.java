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

import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads literature energies from plain text: any number of whitespace separated values per line, '#' starts a
 * comment.  The order of the file is kept.
 */
public class LiteratureEnergyReader {
  public static final String COMMENT_PREFIX = "#";

  public List<Double> read(File file) throws IOException {
    try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
      return read(reader, file.getPath());
    }
  }

  public List<Double> read(Reader in, String sourceName) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<Double> energies = new ArrayList<>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String content = stripComment(line);
      for (String token : StringUtils.split(content)) {
        energies.add(parseValue(token, sourceName, lineNumber));
      }
    }
    return energies;
  }

  static String stripComment(String line) {
    int commentStart = line.indexOf(COMMENT_PREFIX);
    return commentStart >= 0 ? line.substring(0, commentStart) : line;
  }

  static double parseValue(String token, String sourceName, int lineNumber) throws IOException {
    double value;
    try {
      value = Double.parseDouble(token);
    } catch (NumberFormatException e) {
      throw new IOException(String.format("%s:%d: malformed number '%s'", sourceName, lineNumber, token), e);
    }
    if (!Double.isFinite(value)) {
      throw new IOException(String.format("%s:%d: value '%s' is not finite", sourceName, lineNumber, token));
    }
    return value;
  }
}
