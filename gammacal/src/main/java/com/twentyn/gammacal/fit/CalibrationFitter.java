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

package com.twentyn.gammacal.fit;

import com.twentyn.gammacal.CalibrationException.InsufficientFitPointsException;
import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.Correspondence;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Linear least squares fit of energy as a polynomial in channel over the accepted peak/energy correspondences.
 *
 * The system is solved by QR decomposition.  Channels are divided by the largest |channel| before building the
 * Vandermonde matrix so that higher degree fits stay well conditioned; coefficients and their errors are scaled back
 * afterwards.
 */
public class CalibrationFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CalibrationFitter.class);

  public FitResult fit(Correspondence accepted, double[] peaks, double[] energies, int degree)
      throws InsufficientFitPointsException {
    return fit(accepted, peaks, energies, degree, null);
  }

  /**
   * @param accepted Literature index to peak index assignments; unmatched entries are skipped.
   * @param peaks Peak channel positions.
   * @param energies Literature energies.
   * @param degree Polynomial degree, at least 1.
   * @param energySigmas Per literature index uncertainties in energy units, or null for an unweighted fit.  Only the
   *                     entries of matched literature lines are read and they must be positive.
   * @return The fitted model, chi-square and coefficient errors.
   * @throws InsufficientFitPointsException If fewer than degree + 1 distinct channels are matched.
   */
  public FitResult fit(Correspondence accepted, double[] peaks, double[] energies, int degree, double[] energySigmas)
      throws InsufficientFitPointsException {
    if (degree < 1) {
      throw new IllegalArgumentException(String.format("Fit degree must be at least 1, got %d", degree));
    }
    if (accepted.size() != energies.length) {
      throw new IllegalArgumentException(String.format(
          "Assignment covers %d literature energies, but %d were given", accepted.size(), energies.length));
    }

    List<Integer> used = new ArrayList<>();
    Set<Double> distinctChannels = new HashSet<>();
    for (int i = 0; i < accepted.size(); i++) {
      if (accepted.isMatched(i)) {
        used.add(i);
        distinctChannels.add(peaks[accepted.getPeakIndex(i)]);
      }
    }

    int parameters = degree + 1;
    if (used.size() < parameters) {
      throw new InsufficientFitPointsException(String.format(
          "A degree %d fit needs %d points, only %d correspondences accepted", degree, parameters, used.size()));
    }
    if (distinctChannels.size() < parameters) {
      throw new InsufficientFitPointsException(String.format(
          "A degree %d fit needs %d distinct channels, accepted correspondences only cover %d",
          degree, parameters, distinctChannels.size()));
    }

    boolean weighted = energySigmas != null;
    double scale = 0.0;
    for (Integer i : used) {
      scale = Math.max(scale, Math.abs(peaks[accepted.getPeakIndex(i)]));
    }
    if (scale == 0.0) {
      scale = 1.0;
    }

    double[][] design = new double[used.size()][parameters];
    double[] target = new double[used.size()];
    for (int row = 0; row < used.size(); row++) {
      int lit = used.get(row);
      double weight = 1.0;
      if (weighted) {
        double sigma = energySigmas[lit];
        if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
          throw new IllegalArgumentException(
              String.format("Uncertainty of literature energy %d must be positive and finite, got %s", lit, sigma));
        }
        weight = 1.0 / sigma;
      }
      double x = peaks[accepted.getPeakIndex(lit)] / scale;
      double power = 1.0;
      for (int k = 0; k < parameters; k++) {
        design[row][k] = power * weight;
        power *= x;
      }
      target[row] = energies[lit] * weight;
    }

    RealMatrix a = new Array2DRowRealMatrix(design, false);
    RealVector b = new ArrayRealVector(target, false);

    RealVector scaledCoefficients;
    RealMatrix scaledCovariance;
    try {
      scaledCoefficients = new QRDecomposition(a).getSolver().solve(b);
      scaledCovariance = new LUDecomposition(a.transpose().multiply(a)).getSolver().getInverse();
    } catch (SingularMatrixException e) {
      throw new InsufficientFitPointsException(
          String.format("Degree %d fit over %d points is singular", degree, used.size()), e);
    }

    double chiSquare = 0.0;
    RealVector residuals = b.subtract(a.operate(scaledCoefficients));
    for (int i = 0; i < residuals.getDimension(); i++) {
      chiSquare += residuals.getEntry(i) * residuals.getEntry(i);
    }

    int dof = used.size() - parameters;
    // Without per-point errors the residual scatter is the only error estimate.
    double covarianceScale = !weighted && dof > 0 ? chiSquare / dof : 1.0;

    double[] coefficients = new double[parameters];
    double[] errors = new double[parameters];
    double scalePower = 1.0;
    for (int k = 0; k < parameters; k++) {
      coefficients[k] = scaledCoefficients.getEntry(k) / scalePower;
      errors[k] = Math.sqrt(scaledCovariance.getEntry(k, k) * covarianceScale) / scalePower;
      scalePower *= scale;
    }

    CalibrationModel model = new CalibrationModel(coefficients);
    LOGGER.debug("Fitted degree %d calibration over %d points%s: %s, chi^2 = %.6g",
        degree, used.size(), weighted ? " (weighted)" : "", model, chiSquare);
    return new FitResult(model, chiSquare, errors, used.size(), weighted);
  }
}
