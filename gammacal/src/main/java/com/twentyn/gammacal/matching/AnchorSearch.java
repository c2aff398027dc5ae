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
import com.twentyn.gammacal.CalibrationException;
import com.twentyn.gammacal.CalibrationException.DegenerateAnchorPairException;
import com.twentyn.gammacal.CalibrationException.InsufficientPeaksException;
import com.twentyn.gammacal.CalibrationException.InsufficientReferenceDataException;
import com.twentyn.gammacal.CalibrationException.NoFeasibleCalibrationException;
import com.twentyn.gammacal.matching.CandidateEvaluator.Candidate;
import com.twentyn.gammacal.model.AnchorPair;
import com.twentyn.gammacal.model.CalibrationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.stream.IntStream;

/**
 * Tries anchor pairs (i1, i2), i1 < i2, over the detected peaks and keeps the one whose trial calibration puts the
 * literature lines closest to detected peaks.
 *
 * The search is a fold over the pairs in (i1, i2) lexicographic order with an explicit accumulator; the running best
 * cost doubles as the pruning bound handed to the {@link CandidateEvaluator}.  Ties keep the first pair found.  In
 * parallel mode every row i1 is folded on its own, with its own bound, and the row winners are reduced by
 * (cost, pair); the outcome is the same as the sequential fold.
 */
public class AnchorSearch {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnchorSearch.class);

  /**
   * The winning anchor pair plus some bookkeeping about the search.
   */
  public static class Result {
    private final Candidate best;
    private final long evaluated;
    private final long pruned;
    private final long degenerate;
    private final long plausible;

    Result(Candidate best, long evaluated, long pruned, long degenerate, long plausible) {
      this.best = best;
      this.evaluated = evaluated;
      this.pruned = pruned;
      this.degenerate = degenerate;
      this.plausible = plausible;
    }

    public AnchorPair getBestPair() {
      return best.getPair();
    }

    public double getBestCost() {
      return best.getCost();
    }

    public CalibrationModel getAnchorModel() {
      return best.getModel();
    }

    public boolean isPenalized() {
      return best.isPenalized();
    }

    public long getEvaluatedCount() {
      return evaluated;
    }

    public long getPrunedCount() {
      return pruned;
    }

    public long getDegenerateCount() {
      return degenerate;
    }

    public long getPlausibleCount() {
      return plausible;
    }
  }

  // Accumulator of the fold.  Each instance is confined to one thread.
  private static class SearchState {
    Candidate best = null;
    long evaluated = 0L;
    long pruned = 0L;
    long degenerate = 0L;
    long plausible = 0L;

    double bound() {
      return best == null ? Double.POSITIVE_INFINITY : best.getCost();
    }

    SearchState accept(Candidate candidate) {
      evaluated++;
      switch (candidate.getOutcome()) {
        case DEGENERATE:
          degenerate++;
          return this;
        case PRUNED:
          pruned++;
          break;
        case COMPLETE:
          if (best == null || candidate.getCost() < best.getCost()) {
            best = candidate;
          }
          break;
        default:
          throw new IllegalStateException("Unknown outcome " + candidate.getOutcome());
      }
      if (!candidate.isPenalized()) {
        plausible++;
      }
      return this;
    }

    static SearchState merge(SearchState a, SearchState b) {
      SearchState merged = new SearchState();
      merged.evaluated = a.evaluated + b.evaluated;
      merged.pruned = a.pruned + b.pruned;
      merged.degenerate = a.degenerate + b.degenerate;
      merged.plausible = a.plausible + b.plausible;
      merged.best = better(a.best, b.best);
      return merged;
    }

    private static Candidate better(Candidate a, Candidate b) {
      if (a == null) {
        return b;
      }
      if (b == null) {
        return a;
      }
      int c = Double.compare(a.getCost(), b.getCost());
      if (c != 0) {
        return c < 0 ? a : b;
      }
      return a.getPair().compareTo(b.getPair()) <= 0 ? a : b;
    }
  }

  private final double[] peaks;
  private final double[] energies;
  private final AutocalConfiguration config;
  private final CandidateEvaluator evaluator;

  public AnchorSearch(double[] peaks, double[] energies, AutocalConfiguration config)
      throws InsufficientReferenceDataException, InsufficientPeaksException {
    checkInputSizes(peaks.length, energies.length);
    this.peaks = peaks;
    this.energies = energies;
    this.config = config;
    this.evaluator = new CandidateEvaluator(peaks, energies, config);
  }

  public static void checkInputSizes(int peakCount, int literatureCount)
      throws InsufficientReferenceDataException, InsufficientPeaksException {
    if (literatureCount < 2) {
      throw new InsufficientReferenceDataException(
          String.format("Too few literature energies given: %d, need at least 2", literatureCount));
    }
    if (peakCount < literatureCount) {
      throw new InsufficientPeaksException(
          String.format("Too few peaks found: %d peaks for %d literature energies", peakCount, literatureCount));
    }
  }

  public CandidateEvaluator getEvaluator() {
    return evaluator;
  }

  /**
   * Run the search.
   *
   * @return The best anchor pair and its cost.
   * @throws DegenerateAnchorPairException If no anchor pair yields a calibration at all.
   * @throws NoFeasibleCalibrationException If every calibration tried violates the plausibility bounds.
   * @throws IllegalArgumentException If the configured anchor window leaves no pair to try.
   */
  public Result search() throws CalibrationException {
    int firstLo = firstAnchorLow();
    int firstHi = firstAnchorHigh();
    // The second anchor's lower limit only grows with i1, so the first row decides whether any pair exists.
    if (firstHi < firstLo || secondAnchorLow(firstLo) > secondAnchorHigh()) {
      throw new IllegalArgumentException(String.format(
          "No anchor pair to try among %d peaks with a minimum anchor separation of %d",
          peaks.length, config.getMinAnchorSeparation()));
    }

    SearchState state;
    if (config.isParallelSearch()) {
      state = IntStream.rangeClosed(firstLo, firstHi).parallel().
          mapToObj(i1 -> searchRow(i1, new SearchState())).
          reduce(new SearchState(), SearchState::merge);
    } else {
      state = new SearchState();
      for (int i1 = firstLo; i1 <= firstHi; i1++) {
        searchRow(i1, state);
      }
    }

    LOGGER.debug("Anchor search over %d peaks and %d energies: %d pairs evaluated, %d pruned, %d degenerate",
        peaks.length, energies.length, state.evaluated, state.pruned, state.degenerate);

    if (state.best == null) {
      throw new DegenerateAnchorPairException(String.format(
          "None of the %d anchor pairs tried yields a calibration (%d degenerate)",
          state.evaluated, state.degenerate));
    }
    if (state.plausible == 0L) {
      throw new NoFeasibleCalibrationException(String.format(
          "All %d calibrations tried violate the plausibility bounds (slope %.3f +- %.3f, |offset| <= %.1f)",
          state.evaluated - state.degenerate, config.getExpectedSlope(), config.getSlopeTolerance(),
          config.getInterceptBound()));
    }
    if (state.best.isPenalized()) {
      LOGGER.warn("Best anchor pair %s carries a plausibility penalty (cost %.3f)",
          state.best.getPair(), state.best.getCost());
    }

    return new Result(state.best, state.evaluated, state.pruned, state.degenerate, state.plausible);
  }

  private SearchState searchRow(int i1, SearchState state) {
    int secondHi = secondAnchorHigh();
    for (int i2 = secondAnchorLow(i1); i2 <= secondHi; i2++) {
      state.accept(evaluator.evaluate(new AnchorPair(i1, i2), state.bound()));
    }
    return state;
  }

  private int excess() {
    return peaks.length - energies.length;
  }

  int firstAnchorLow() {
    return config.isRestrictToExcess() ? config.getAnchorConvention().firstLiteratureIndex(energies.length) : 0;
  }

  int firstAnchorHigh() {
    int hi = peaks.length - 1 - config.getMinAnchorSeparation();
    if (config.isRestrictToExcess()) {
      hi = Math.min(hi, firstAnchorLow() + excess());
    }
    return hi;
  }

  int secondAnchorLow(int i1) {
    int lo = i1 + config.getMinAnchorSeparation();
    if (config.isRestrictToExcess()) {
      lo = Math.max(lo, config.getAnchorConvention().secondLiteratureIndex(energies.length));
    }
    return lo;
  }

  int secondAnchorHigh() {
    int hi = peaks.length - 1;
    if (config.isRestrictToExcess()) {
      hi = Math.min(hi, config.getAnchorConvention().secondLiteratureIndex(energies.length) + excess());
    }
    return hi;
  }
}
