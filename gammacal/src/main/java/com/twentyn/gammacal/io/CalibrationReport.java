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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.gammacal.CalibrationResult;
import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.Correspondence;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Diagnostic view of a calibration run: which literature line went to which peak, how far off it was and whether it
 * took part in the final fit.  Serializes to JSON and renders as a text table.
 */
public class CalibrationReport {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  public static class Line {
    @JsonProperty("literature_energy")
    private Double literatureEnergy;

    @JsonProperty("peak_index")
    private Integer peakIndex;

    @JsonProperty("peak_position")
    private Double peakPosition;

    @JsonProperty("calibrated_energy")
    private Double calibratedEnergy;

    // Channel distance between the peak and the anchor calibration's prediction.
    @JsonProperty("residual")
    private Double residual;

    @JsonProperty("accepted")
    private Boolean accepted;

    private Line() { // For deserialization.

    }

    public Line(Double literatureEnergy, Integer peakIndex, Double peakPosition, Double calibratedEnergy,
                Double residual, Boolean accepted) {
      this.literatureEnergy = literatureEnergy;
      this.peakIndex = peakIndex;
      this.peakPosition = peakPosition;
      this.calibratedEnergy = calibratedEnergy;
      this.residual = residual;
      this.accepted = accepted;
    }

    public Double getLiteratureEnergy() {
      return literatureEnergy;
    }

    public Integer getPeakIndex() {
      return peakIndex;
    }

    public Double getPeakPosition() {
      return peakPosition;
    }

    public Double getCalibratedEnergy() {
      return calibratedEnergy;
    }

    public Double getResidual() {
      return residual;
    }

    public Boolean getAccepted() {
      return accepted;
    }
  }

  @JsonProperty("name")
  private String name;

  @JsonProperty("coefficients")
  private List<Double> coefficients;

  @JsonProperty("coefficient_errors")
  private List<Double> coefficientErrors;

  @JsonProperty("chi_square")
  private Double chiSquare;

  @JsonProperty("anchor_peaks")
  private List<Integer> anchorPeaks;

  @JsonProperty("search_cost")
  private Double searchCost;

  @JsonProperty("lines")
  private List<Line> lines;

  private CalibrationReport() { // For deserialization.

  }

  public static CalibrationReport fromResult(String name, CalibrationResult result) {
    CalibrationReport report = new CalibrationReport();
    CalibrationModel model = result.getModel();
    double[] energies = result.getEnergies();
    Correspondence full = result.getFullAssignment();
    Correspondence accepted = result.getAcceptedAssignment();

    report.name = name;
    report.coefficients = model.getCoefficientList();
    report.coefficientErrors = new ArrayList<>();
    for (double e : result.getFit().getCoefficientErrors()) {
      report.coefficientErrors.add(e);
    }
    report.chiSquare = result.getChiSquare();
    report.anchorPeaks = new ArrayList<>();
    report.anchorPeaks.add(result.getBestAnchorPair().getFirst());
    report.anchorPeaks.add(result.getBestAnchorPair().getSecond());
    report.searchCost = result.getBestCost();

    report.lines = new ArrayList<>(energies.length);
    for (int i = 0; i < energies.length; i++) {
      int peakIndex = full.getPeakIndex(i);
      double position = result.getPeaks().getPosition(peakIndex);
      report.lines.add(new Line(energies[i], peakIndex, position, model.toEnergy(position), full.getResidual(i),
          accepted.isMatched(i)));
    }
    return report;
  }

  public String getName() {
    return name;
  }

  public List<Double> getCoefficients() {
    return coefficients;
  }

  public List<Double> getCoefficientErrors() {
    return coefficientErrors;
  }

  public Double getChiSquare() {
    return chiSquare;
  }

  public List<Integer> getAnchorPeaks() {
    return anchorPeaks;
  }

  public Double getSearchCost() {
    return searchCost;
  }

  public List<Line> getLines() {
    return lines;
  }

  /**
   * Render the correspondence table; trimmed lines are flagged with '*'.
   */
  public String formatTable() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%s%n", name));
    sb.append(String.format("  %8s %9s %9s %9s%n", "FitPos", "CalcEn", "LitEn", "Residual"));
    for (Line line : lines) {
      sb.append(String.format("%s %8.2f %9.2f %9.2f %9.3f%n",
          line.getAccepted() ? " " : "*", line.getPeakPosition(), line.getCalibratedEnergy(),
          line.getLiteratureEnergy(), line.getResidual()));
    }
    sb.append(String.format("Calibration: %s (chi^2 = %.6g)%n",
        new CalibrationModel(coefficients).toString(), chiSquare));
    return sb.toString();
  }

  public static void writeJson(File file, Collection<CalibrationReport> reports) throws IOException {
    OBJECT_MAPPER.writeValue(file, reports);
  }

  public static void writeJson(OutputStream out, Collection<CalibrationReport> reports) throws IOException {
    OBJECT_MAPPER.writeValue(out, reports);
  }

  public static List<CalibrationReport> readJson(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file,
        OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, CalibrationReport.class));
  }
}
