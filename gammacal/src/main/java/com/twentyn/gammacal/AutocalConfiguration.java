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
import com.twentyn.gammacal.matching.AnchorConvention;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Tunables of the automatic calibration.  Every field has a usable default, so an empty JSON object is a valid
 * configuration file.
 */
public class AutocalConfiguration {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final int DEFAULT_TRIM_COUNT = 3;
  public static final double DEFAULT_DEGENERACY_PENALTY = 10000.0;

  @JsonProperty("anchor_convention")
  private AnchorConvention anchorConvention = AnchorConvention.FIRST_TWO;

  // Anchors closer than this many peak indices are not tried.
  @JsonProperty("min_anchor_separation")
  private int minAnchorSeparation = 1;

  // Only let anchors skip as many peaks as there are surplus peaks over literature lines.
  @JsonProperty("restrict_to_excess")
  private boolean restrictToExcess = false;

  @JsonProperty("trim_count")
  private int trimCount = DEFAULT_TRIM_COUNT;

  @JsonProperty("cost_trim_count")
  private int costTrimCount = 0;

  // Energy units per channel the detector is expected to be set up for.
  @JsonProperty("expected_slope")
  private double expectedSlope = 1.0;

  @JsonProperty("slope_tolerance")
  private double slopeTolerance = 5.0;

  @JsonProperty("intercept_bound")
  private double interceptBound = 10000.0;

  @JsonProperty("degeneracy_penalty")
  private double degeneracyPenalty = DEFAULT_DEGENERACY_PENALTY;

  @JsonProperty("fit_degree")
  private int fitDegree = 1;

  @JsonProperty("parallel_search")
  private boolean parallelSearch = false;

  @JsonProperty("use_peak_uncertainties")
  private boolean usePeakUncertainties = true;

  public AutocalConfiguration() {

  }

  public static AutocalConfiguration readFromFile(File file) throws IOException {
    AutocalConfiguration config = OBJECT_MAPPER.readValue(file, AutocalConfiguration.class);
    config.validate();
    return config;
  }

  public static AutocalConfiguration readFromStream(InputStream stream) throws IOException {
    AutocalConfiguration config = OBJECT_MAPPER.readValue(stream, AutocalConfiguration.class);
    config.validate();
    return config;
  }

  public void validate() {
    if (anchorConvention == null) {
      throw new IllegalArgumentException("anchor_convention must be set");
    }
    if (minAnchorSeparation < 1) {
      throw new IllegalArgumentException(
          String.format("min_anchor_separation must be at least 1, got %d", minAnchorSeparation));
    }
    if (trimCount < 0) {
      throw new IllegalArgumentException(String.format("trim_count must not be negative, got %d", trimCount));
    }
    if (costTrimCount < 0) {
      throw new IllegalArgumentException(
          String.format("cost_trim_count must not be negative, got %d", costTrimCount));
    }
    if (!(slopeTolerance > 0.0)) {
      throw new IllegalArgumentException(String.format("slope_tolerance must be positive, got %s", slopeTolerance));
    }
    if (!(interceptBound > 0.0)) {
      throw new IllegalArgumentException(String.format("intercept_bound must be positive, got %s", interceptBound));
    }
    if (!(degeneracyPenalty >= 0.0) || Double.isInfinite(degeneracyPenalty)) {
      throw new IllegalArgumentException(
          String.format("degeneracy_penalty must be finite and non-negative, got %s", degeneracyPenalty));
    }
    if (!Double.isFinite(expectedSlope)) {
      throw new IllegalArgumentException(String.format("expected_slope must be finite, got %s", expectedSlope));
    }
    if (fitDegree < 1) {
      throw new IllegalArgumentException(String.format("fit_degree must be at least 1, got %d", fitDegree));
    }
  }

  public AnchorConvention getAnchorConvention() {
    return anchorConvention;
  }

  public AutocalConfiguration setAnchorConvention(AnchorConvention anchorConvention) {
    this.anchorConvention = anchorConvention;
    return this;
  }

  public int getMinAnchorSeparation() {
    return minAnchorSeparation;
  }

  public AutocalConfiguration setMinAnchorSeparation(int minAnchorSeparation) {
    this.minAnchorSeparation = minAnchorSeparation;
    return this;
  }

  public boolean isRestrictToExcess() {
    return restrictToExcess;
  }

  public AutocalConfiguration setRestrictToExcess(boolean restrictToExcess) {
    this.restrictToExcess = restrictToExcess;
    return this;
  }

  public int getTrimCount() {
    return trimCount;
  }

  public AutocalConfiguration setTrimCount(int trimCount) {
    this.trimCount = trimCount;
    return this;
  }

  public int getCostTrimCount() {
    return costTrimCount;
  }

  public AutocalConfiguration setCostTrimCount(int costTrimCount) {
    this.costTrimCount = costTrimCount;
    return this;
  }

  public double getExpectedSlope() {
    return expectedSlope;
  }

  public AutocalConfiguration setExpectedSlope(double expectedSlope) {
    this.expectedSlope = expectedSlope;
    return this;
  }

  public double getSlopeTolerance() {
    return slopeTolerance;
  }

  public AutocalConfiguration setSlopeTolerance(double slopeTolerance) {
    this.slopeTolerance = slopeTolerance;
    return this;
  }

  public double getInterceptBound() {
    return interceptBound;
  }

  public AutocalConfiguration setInterceptBound(double interceptBound) {
    this.interceptBound = interceptBound;
    return this;
  }

  public double getDegeneracyPenalty() {
    return degeneracyPenalty;
  }

  public AutocalConfiguration setDegeneracyPenalty(double degeneracyPenalty) {
    this.degeneracyPenalty = degeneracyPenalty;
    return this;
  }

  public int getFitDegree() {
    return fitDegree;
  }

  public AutocalConfiguration setFitDegree(int fitDegree) {
    this.fitDegree = fitDegree;
    return this;
  }

  public boolean isParallelSearch() {
    return parallelSearch;
  }

  public AutocalConfiguration setParallelSearch(boolean parallelSearch) {
    this.parallelSearch = parallelSearch;
    return this;
  }

  public boolean isUsePeakUncertainties() {
    return usePeakUncertainties;
  }

  public AutocalConfiguration setUsePeakUncertainties(boolean usePeakUncertainties) {
    this.usePeakUncertainties = usePeakUncertainties;
    return this;
  }
}
