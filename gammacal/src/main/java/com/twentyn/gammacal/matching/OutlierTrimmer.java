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

package com.twentyn.gammacal.matching;

import com.twentyn.gammacal.CalibrationException.DegenerateAnchorPairException;
import com.twentyn.gammacal.CalibrationException.DegenerateModelException;
import com.twentyn.gammacal.model.AnchorPair;
import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.Correspondence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns every literature energy to its nearest peak under the winning anchor calibration, then drops the worst
 * fitting assignments before the precision fit.
 */
public class OutlierTrimmer {

  public static class Result {
    private final CalibrationModel anchorModel;
    private final Correspondence fullAssignment;
    private final Correspondence acceptedAssignment;
    private final List<Integer> trimmedIndices;

    Result(CalibrationModel anchorModel, Correspondence fullAssignment, Correspondence acceptedAssignment,
           List<Integer> trimmedIndices) {
      this.anchorModel = anchorModel;
      this.fullAssignment = fullAssignment;
      this.acceptedAssignment = acceptedAssignment;
      this.trimmedIndices = trimmedIndices;
    }

    public CalibrationModel getAnchorModel() {
      return anchorModel;
    }

    /**
     * Every literature energy with its nearest peak; never trimmed.
     */
    public Correspondence getFullAssignment() {
      return fullAssignment;
    }

    public Correspondence getAcceptedAssignment() {
      return acceptedAssignment;
    }

    /**
     * Literature indices set to unmatched in the accepted assignment, ascending.
     */
    public List<Integer> getTrimmedIndices() {
      return trimmedIndices;
    }
  }

  private final double[] peaks;
  private final double[] energies;
  private final AnchorConvention convention;
  private final NearestPeakLocator locator;

  public OutlierTrimmer(double[] peaks, double[] energies, AnchorConvention convention) {
    this.peaks = peaks;
    this.energies = energies;
    this.convention = convention;
    this.locator = new NearestPeakLocator(peaks);
  }

  /**
   * Clamp a requested trim count so that at least two correspondences are left to fit.
   */
  public static int effectiveTrimCount(int requested, int literatureCount) {
    if (requested < 0) {
      throw new IllegalArgumentException(String.format("Trim count must not be negative, got %d", requested));
    }
    return Math.max(0, Math.min(requested, literatureCount - 2));
  }

  /**
   * @param pair The winning anchor pair.
   * @param trimCount How many of the largest-residual assignments to discard; clamped to (energies - 2).
   */
  public Result trim(AnchorPair pair, int trimCount)
      throws DegenerateAnchorPairException, DegenerateModelException {
    CalibrationModel model = convention.anchorModel(peaks, energies, pair);

    int[] peakIndices = new int[energies.length];
    double[] residuals = new double[energies.length];
    for (int i = 0; i < energies.length; i++) {
      double predicted = model.toChannel(energies[i]);
      peakIndices[i] = locator.locate(predicted);
      residuals[i] = Math.abs(peaks[peakIndices[i]] - predicted);
    }
    Correspondence full = new Correspondence(peakIndices, residuals);

    // Stable sort: among equal residuals the later literature lines count as worse.
    List<Integer> byResidual = new ArrayList<>(energies.length);
    for (int i = 0; i < energies.length; i++) {
      byResidual.add(i);
    }
    byResidual.sort(Comparator.comparingDouble(i -> residuals[i]));

    int effective = effectiveTrimCount(trimCount, energies.length);
    List<Integer> trimmed = new ArrayList<>(byResidual.subList(energies.length - effective, energies.length));
    Collections.sort(trimmed);

    return new Result(model, full, full.withUnmatched(trimmed), Collections.unmodifiableList(trimmed));
  }
}
