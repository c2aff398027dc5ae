package com.twentyn.gammacal;

import com.twentyn.gammacal.fit.FitResult;
import com.twentyn.gammacal.matching.AnchorSearch;
import com.twentyn.gammacal.matching.OutlierTrimmer;
import com.twentyn.gammacal.model.AnchorPair;
import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.Correspondence;
import com.twentyn.gammacal.model.PeakList;

import java.util.Arrays;
import java.util.List;

/**
 * Everything one automatic calibration run produced: the search winner, both assignments and the final fit.
 */
public class CalibrationResult {
  private final PeakList peaks;
  private final double[] energies;
  private final AnchorSearch.Result search;
  private final OutlierTrimmer.Result trim;
  private final FitResult fit;

  public CalibrationResult(PeakList peaks, double[] energies, AnchorSearch.Result search, OutlierTrimmer.Result trim,
                           FitResult fit) {
    this.peaks = peaks;
    this.energies = Arrays.copyOf(energies, energies.length);
    this.search = search;
    this.trim = trim;
    this.fit = fit;
  }

  public PeakList getPeaks() {
    return peaks;
  }

  public double[] getEnergies() {
    return Arrays.copyOf(energies, energies.length);
  }

  public AnchorPair getBestAnchorPair() {
    return search.getBestPair();
  }

  public double getBestCost() {
    return search.getBestCost();
  }

  public AnchorSearch.Result getSearchResult() {
    return search;
  }

  public CalibrationModel getAnchorModel() {
    return trim.getAnchorModel();
  }

  public Correspondence getFullAssignment() {
    return trim.getFullAssignment();
  }

  public Correspondence getAcceptedAssignment() {
    return trim.getAcceptedAssignment();
  }

  public List<Integer> getTrimmedIndices() {
    return trim.getTrimmedIndices();
  }

  public FitResult getFit() {
    return fit;
  }

  public CalibrationModel getModel() {
    return fit.getModel();
  }

  public double getChiSquare() {
    return fit.getChiSquare();
  }
}
