package com.twentyn.gammacal.matching;

import com.twentyn.gammacal.CalibrationException.DegenerateAnchorPairException;
import com.twentyn.gammacal.model.AnchorPair;
import com.twentyn.gammacal.model.CalibrationModel;

/**
 * Which two literature energies are paired with the anchor peaks.
 */
public enum AnchorConvention {
  FIRST_TWO,       // Literature energies 0 and 1.
  FIRST_AND_LAST,  // Literature energies 0 and n - 1; longer lever arm, needs the last line to be visible.
  ;

  public int firstLiteratureIndex(int literatureCount) {
    return 0;
  }

  public int secondLiteratureIndex(int literatureCount) {
    return this == FIRST_TWO ? 1 : literatureCount - 1;
  }

  /**
   * Build the trial affine calibration that maps the anchor peaks onto the anchor energies.
   *
   * @throws DegenerateAnchorPairException If the anchor peaks coincide or the anchor energies are equal.
   */
  public CalibrationModel anchorModel(double[] peaks, double[] energies, AnchorPair pair)
      throws DegenerateAnchorPairException {
    return CalibrationModel.fromPoints(
        peaks[pair.getFirst()], energies[firstLiteratureIndex(energies.length)],
        peaks[pair.getSecond()], energies[secondLiteratureIndex(energies.length)]);
  }
}
