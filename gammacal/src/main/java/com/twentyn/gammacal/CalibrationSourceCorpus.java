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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gamma lines of common calibration sources, bundled as a JSON resource.  Energies are listed in the conventional
 * order used for matching (ascending).
 */
public class CalibrationSourceCorpus {
  private static final String SOURCES_FILE_PATH = "calibration_sources.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private final Class INSTANCE_CLASS_LOADER = getClass();

  private Map<String, List<Double>> nameToEnergies = new LinkedHashMap<>();

  @JsonProperty("sources")
  private List<Source> sources;

  public static class Source {
    @JsonProperty("name")
    private String name;

    @JsonProperty("energies")
    private List<Double> energies;

    public String getName() {
      return name;
    }

    public List<Double> getEnergies() {
      return energies;
    }
  }

  public CalibrationSourceCorpus() {}

  public void loadCorpus() throws IOException {
    try (InputStream sourcesStream = INSTANCE_CLASS_LOADER.getResourceAsStream(SOURCES_FILE_PATH)) {
      if (sourcesStream == null) {
        throw new IOException(String.format("Missing resource %s", SOURCES_FILE_PATH));
      }
      CalibrationSourceCorpus corpus = OBJECT_MAPPER.readValue(sourcesStream, CalibrationSourceCorpus.class);
      this.sources = corpus.getSources();
    }
    nameToEnergies.clear();
    for (Source source : sources) {
      nameToEnergies.put(source.getName(), Collections.unmodifiableList(new ArrayList<>(source.getEnergies())));
    }
  }

  public List<Source> getSources() {
    return sources;
  }

  public List<String> getSourceNames() {
    return new ArrayList<>(nameToEnergies.keySet());
  }

  /**
   * @param name A source name such as "152Eu".
   * @return The source's literature energies.
   * @throws IllegalArgumentException If the corpus has no such source.
   */
  public List<Double> getEnergies(String name) {
    List<Double> energies = nameToEnergies.get(name);
    if (energies == null) {
      throw new IllegalArgumentException(String.format(
          "There is no calibration source called %s in the table (known: %s)", name, nameToEnergies.keySet()));
    }
    return energies;
  }
}
