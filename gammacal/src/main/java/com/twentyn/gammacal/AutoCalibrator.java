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

import com.twentyn.gammacal.fit.CalibrationFitter;
import com.twentyn.gammacal.fit.FitResult;
import com.twentyn.gammacal.matching.AnchorSearch;
import com.twentyn.gammacal.matching.OutlierTrimmer;
import com.twentyn.gammacal.model.Correspondence;
import com.twentyn.gammacal.model.PeakList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Automatic energy calibration by peak matching.
 *
 * Given detected peak positions and a list of literature energies (in the caller's order, which is taken as
 * authoritative and never re-sorted), this
 * <ol>
 *   <li>searches for the anchor pair whose affine calibration best explains all literature lines,</li>
 *   <li>assigns every literature line to its nearest peak under that calibration and drops the worst few,</li>
 *   <li>fits the final polynomial over the remaining correspondences.</li>
 * </ol>
 * The computation is deterministic and keeps no state between calls.
 */
public class AutoCalibrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AutoCalibrator.class);

  private final AutocalConfiguration config;
  private final CalibrationFitter fitter;

  public AutoCalibrator() {
    this(new AutocalConfiguration());
  }

  public AutoCalibrator(AutocalConfiguration config) {
    config.validate();
    this.config = config;
    this.fitter = new CalibrationFitter();
  }

  public AutocalConfiguration getConfiguration() {
    return config;
  }

  public CalibrationResult calibrate(double[] peaks, double[] energies) throws CalibrationException {
    return calibrate(PeakList.of(peaks), energies);
  }

  public CalibrationResult calibrate(PeakList peakList, List<Double> energies) throws CalibrationException {
    return calibrate(peakList, energies.stream().mapToDouble(Double::doubleValue).toArray());
  }

  public CalibrationResult calibrate(PeakList peakList, double[] energies) throws CalibrationException {
    for (int i = 0; i < energies.length; i++) {
      if (!Double.isFinite(energies[i])) {
        throw new IllegalArgumentException(
            String.format("Literature energy %d is not a finite number: %s", i, energies[i]));
      }
    }
    double[] peaks = peakList.getPositions();

    AnchorSearch.Result search = new AnchorSearch(peaks, energies, config).search();
    LOGGER.info("Best anchor pair %s (channels %.3f, %.3f) with cost %.4f",
        search.getBestPair(), peaks[search.getBestPair().getFirst()], peaks[search.getBestPair().getSecond()],
        search.getBestCost());

    OutlierTrimmer.Result trim = new OutlierTrimmer(peaks, energies, config.getAnchorConvention()).
        trim(search.getBestPair(), config.getTrimCount());
    Correspondence accepted = trim.getAcceptedAssignment();
    warnOnMultipleUse(accepted);

    double[] sigmas = energySigmas(peakList, accepted, trim.getAnchorModel().getSlope());
    FitResult fit = fitter.fit(accepted, peaks, energies, config.getFitDegree(), sigmas);
    LOGGER.info("Calibration %s from %d of %d literature lines, chi^2 = %.6g",
        fit.getModel(), fit.getPointCount(), energies.length, fit.getChiSquare());

    return new CalibrationResult(peakList, energies, search, trim, fit);
  }

  /**
   * Energy-domain uncertainties of the accepted lines, propagated from the peak position errors through the anchor
   * gain; null (unweighted fit) unless every accepted peak has a positive uncertainty.
   */
  private double[] energySigmas(PeakList peakList, Correspondence accepted, double gain) {
    if (!config.isUsePeakUncertainties() || !peakList.hasUncertainties()) {
      return null;
    }
    double[] sigmas = new double[accepted.size()];
    for (int i = 0; i < accepted.size(); i++) {
      if (!accepted.isMatched(i)) {
        sigmas[i] = Double.NaN;
        continue;
      }
      double sigma = peakList.getUncertainty(accepted.getPeakIndex(i));
      if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
        LOGGER.warn("Peak %d has no usable position uncertainty (%s), falling back to an unweighted fit",
            accepted.getPeakIndex(i), sigma);
        return null;
      }
      sigmas[i] = Math.abs(gain) * sigma;
    }
    return sigmas;
  }

  private void warnOnMultipleUse(Correspondence accepted) {
    for (Map.Entry<Integer, Integer> entry : accepted.findMultiplyAssignedPeaks().entrySet()) {
      LOGGER.warn("Peak %d is matched to %d literature energies", entry.getKey(), entry.getValue());
    }
  }
}
