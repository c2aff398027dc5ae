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

import com.twentyn.gammacal.AutocalConfiguration;
import com.twentyn.gammacal.CalibrationException.DegenerateAnchorPairException;
import com.twentyn.gammacal.CalibrationException.DegenerateModelException;
import com.twentyn.gammacal.model.AnchorPair;
import com.twentyn.gammacal.model.CalibrationModel;

import java.util.PriorityQueue;

/**
 * Scores a single anchor pair: the affine calibration through the two anchors is used to predict where every
 * literature line should sit on the channel axis, and the squared distances to the nearest detected peaks are summed.
 *
 * Two things make the score useful inside a large search:
 * <ul>
 *   <li>Evaluation stops as soon as the partial cost exceeds the best complete cost seen so far.  Terms are never
 *   negative, so a partial cost is a lower bound of the final one.</li>
 *   <li>Calibrations whose slope strays from the expected gain, or whose offset is huge, get a fixed penalty per
 *   violated bound.  They are ranked down, not rejected, so noisy peak lists still yield an answer.</li>
 * </ul>
 */
public class CandidateEvaluator {

  public enum Outcome {
    COMPLETE,   // Every literature line was scored.
    PRUNED,     // Partial cost already exceeded the bound; the cost is a lower bound only.
    DEGENERATE, // Anchors coincide or the anchor energies are equal; no calibration exists.
  }

  public static class Candidate {
    private final AnchorPair pair;
    private final CalibrationModel model;
    private final double cost;
    private final Outcome outcome;
    private final boolean penalized;

    Candidate(AnchorPair pair, CalibrationModel model, double cost, Outcome outcome, boolean penalized) {
      this.pair = pair;
      this.model = model;
      this.cost = cost;
      this.outcome = outcome;
      this.penalized = penalized;
    }

    static Candidate degenerate(AnchorPair pair) {
      return new Candidate(pair, null, Double.POSITIVE_INFINITY, Outcome.DEGENERATE, false);
    }

    public AnchorPair getPair() {
      return pair;
    }

    /**
     * @return The trial affine calibration, or null for a degenerate pair.
     */
    public CalibrationModel getModel() {
      return model;
    }

    public double getCost() {
      return cost;
    }

    public Outcome getOutcome() {
      return outcome;
    }

    public boolean isEarlyStop() {
      return outcome == Outcome.PRUNED;
    }

    public boolean isPenalized() {
      return penalized;
    }
  }

  private final double[] peaks;
  private final double[] energies;
  private final AnchorConvention convention;
  private final NearestPeakLocator locator;
  private final double expectedSlope;
  private final double slopeTolerance;
  private final double interceptBound;
  private final double degeneracyPenalty;
  private final int costTrimCount;

  public CandidateEvaluator(double[] peaks, double[] energies, AutocalConfiguration config) {
    if (energies.length < 2) {
      throw new IllegalArgumentException("At least two literature energies are needed to build anchors");
    }
    this.peaks = peaks;
    this.energies = energies;
    this.convention = config.getAnchorConvention();
    this.locator = new NearestPeakLocator(peaks);
    this.expectedSlope = config.getExpectedSlope();
    this.slopeTolerance = config.getSlopeTolerance();
    this.interceptBound = config.getInterceptBound();
    this.degeneracyPenalty = config.getDegeneracyPenalty();
    // The two anchors always fit exactly, so ignoring more than the remaining lines would ignore everything.
    this.costTrimCount = Math.min(config.getCostTrimCount(), energies.length - 2);
  }

  public Candidate evaluate(AnchorPair pair) {
    return evaluate(pair, Double.POSITIVE_INFINITY);
  }

  /**
   * @param pair The anchor peak indices.
   * @param bestSoFar The best complete cost found so far; evaluation stops once the partial cost exceeds it.
   * @return The scored candidate.  Its cost is only a lower bound if the outcome is {@link Outcome#PRUNED}.
   */
  public Candidate evaluate(AnchorPair pair, double bestSoFar) {
    CalibrationModel model;
    try {
      model = convention.anchorModel(peaks, energies, pair);
    } catch (DegenerateAnchorPairException e) {
      return Candidate.degenerate(pair);
    }

    int violations = countViolations(model);
    double penalty = violations * degeneracyPenalty;
    boolean penalized = violations > 0;
    if (penalty > bestSoFar) {
      return new Candidate(pair, model, penalty, Outcome.PRUNED, penalized);
    }

    // Min-heap holding the costTrimCount largest terms seen so far; their sum is excluded from the cost.
    PriorityQueue<Double> largestTerms = costTrimCount > 0 ? new PriorityQueue<>(costTrimCount) : null;
    double total = 0.0;
    double excluded = 0.0;
    double cost = penalty;

    for (double energy : energies) {
      double predicted = predictChannel(model, energy);
      double distance = locator.distanceToNearest(predicted);
      double term = distance * distance;
      total += term;

      if (largestTerms != null) {
        if (largestTerms.size() < costTrimCount) {
          largestTerms.add(term);
          excluded += term;
        } else if (term > largestTerms.peek()) {
          excluded += term - largestTerms.poll();
          largestTerms.add(term);
        }
      }

      /* With trimming, total - excluded is the sum of the smallest (j - k) terms out of the j seen; at most k of
       * the seen terms can end up excluded from the final sum, so this is still a lower bound of the final cost. */
      cost = penalty + (total - excluded);
      if (cost > bestSoFar) {
        return new Candidate(pair, model, cost, Outcome.PRUNED, penalized);
      }
    }

    return new Candidate(pair, model, cost, Outcome.COMPLETE, penalized);
  }

  /**
   * @return The number of plausibility bounds (slope, intercept) the calibration violates.
   */
  public int countViolations(CalibrationModel model) {
    int violations = 0;
    if (Math.abs(model.getSlope() - expectedSlope) > slopeTolerance) {
      violations++;
    }
    if (Math.abs(model.getIntercept()) > interceptBound) {
      violations++;
    }
    return violations;
  }

  private static double predictChannel(CalibrationModel model, double energy) {
    try {
      return model.toChannel(energy);
    } catch (DegenerateModelException e) {
      // anchorModel never returns a zero slope.
      throw new IllegalStateException("Anchor calibration is not invertible", e);
    }
  }
}
