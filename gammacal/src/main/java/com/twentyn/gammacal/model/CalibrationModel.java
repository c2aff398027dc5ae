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

package com.twentyn.gammacal.model;

import com.twentyn.gammacal.CalibrationException.DegenerateAnchorPairException;
import com.twentyn.gammacal.CalibrationException.DegenerateModelException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A polynomial channel to energy mapping, energy = p0 + p1 * x + p2 * x^2 + ...
 *
 * Coefficients are stored lowest degree first.  Instances are immutable.
 */
public class CalibrationModel {
  private final double[] coefficients;

  public CalibrationModel(double... coefficients) {
    if (coefficients == null || coefficients.length == 0) {
      throw new IllegalArgumentException("A calibration needs at least one coefficient");
    }
    for (double c : coefficients) {
      if (!Double.isFinite(c)) {
        throw new IllegalArgumentException(
            String.format("Calibration coefficients must be finite, got %s", Arrays.toString(coefficients)));
      }
    }
    this.coefficients = Arrays.copyOf(coefficients, coefficients.length);
  }

  public CalibrationModel(List<Double> coefficients) {
    this(coefficients.stream().mapToDouble(Double::doubleValue).toArray());
  }

  /**
   * The uncalibrated mapping, energy == channel.
   */
  public static CalibrationModel identity() {
    return new CalibrationModel(0.0, 1.0);
  }

  /**
   * Build the affine calibration passing through two (channel, energy) points.
   *
   * @param a The first (channel, energy) pair.
   * @param b The second (channel, energy) pair.
   * @return An affine model with p1 = (Eb - Ea) / (xb - xa).
   * @throws DegenerateAnchorPairException If both channels are equal or the resulting slope is zero.
   */
  public static CalibrationModel fromPairs(Pair<Double, Double> a, Pair<Double, Double> b)
      throws DegenerateAnchorPairException {
    return fromPoints(a.getLeft(), a.getRight(), b.getLeft(), b.getRight());
  }

  public static CalibrationModel fromPoints(double x1, double e1, double x2, double e2)
      throws DegenerateAnchorPairException {
    if (x1 == x2) {
      throw new DegenerateAnchorPairException(
          String.format("Anchor channels coincide at %.4f, slope is undefined", x1));
    }
    double slope = (e2 - e1) / (x2 - x1);
    if (slope == 0.0 || !Double.isFinite(slope)) {
      throw new DegenerateAnchorPairException(
          String.format("Anchors (%.4f, %.4f) and (%.4f, %.4f) give a degenerate slope %s", x1, e1, x2, e2, slope));
    }
    double intercept = e1 - slope * x1;
    return new CalibrationModel(intercept, slope);
  }

  public int getDegree() {
    return coefficients.length - 1;
  }

  public double getCoefficient(int power) {
    return power < coefficients.length ? coefficients[power] : 0.0;
  }

  public double[] getCoefficients() {
    return Arrays.copyOf(coefficients, coefficients.length);
  }

  public List<Double> getCoefficientList() {
    List<Double> result = new ArrayList<>(coefficients.length);
    for (double c : coefficients) {
      result.add(c);
    }
    return result;
  }

  public double getIntercept() {
    return coefficients[0];
  }

  public double getSlope() {
    return getCoefficient(1);
  }

  public boolean isInvertible() {
    return getDegree() == 1 && coefficients[1] != 0.0;
  }

  /**
   * Evaluate the polynomial at a channel (Horner's scheme).
   */
  public double toEnergy(double channel) {
    double result = 0.0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      result = result * channel + coefficients[i];
    }
    return result;
  }

  /**
   * Invert an affine calibration.  Higher degree inversion is not supported.
   *
   * @param energy The energy to map back onto the channel axis.
   * @return (energy - p0) / p1
   * @throws DegenerateModelException If the linear coefficient is zero.
   */
  public double toChannel(double energy) throws DegenerateModelException {
    if (getDegree() != 1) {
      throw new UnsupportedOperationException(
          String.format("Only affine calibrations can be inverted, this one has degree %d", getDegree()));
    }
    if (coefficients[1] == 0.0) {
      throw new DegenerateModelException("Cannot invert a calibration with zero linear coefficient");
    }
    return (energy - coefficients[0]) / coefficients[1];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CalibrationModel that = (CalibrationModel) o;
    return Arrays.equals(coefficients, that.coefficients);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coefficients);
  }

  /**
   * Space separated coefficients, lowest degree first, as used in calibration lists.
   */
  @Override
  public String toString() {
    List<String> parts = new ArrayList<>(coefficients.length);
    for (double c : coefficients) {
      parts.add(Double.toString(c));
    }
    return StringUtils.join(parts, ' ');
  }
}
