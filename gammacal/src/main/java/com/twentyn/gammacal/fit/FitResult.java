package com.twentyn.gammacal.fit;

import com.twentyn.gammacal.model.CalibrationModel;

import java.util.Arrays;

public class FitResult {
  private final CalibrationModel model;
  private final double chiSquare;
  private final double[] coefficientErrors;
  private final int pointCount;
  private final boolean weighted;

  public FitResult(CalibrationModel model, double chiSquare, double[] coefficientErrors, int pointCount,
                   boolean weighted) {
    this.model = model;
    this.chiSquare = chiSquare;
    this.coefficientErrors = Arrays.copyOf(coefficientErrors, coefficientErrors.length);
    this.pointCount = pointCount;
    this.weighted = weighted;
  }

  public CalibrationModel getModel() {
    return model;
  }

  /**
   * Sum of squared (weighted) energy residuals.
   */
  public double getChiSquare() {
    return chiSquare;
  }

  public double[] getCoefficientErrors() {
    return Arrays.copyOf(coefficientErrors, coefficientErrors.length);
  }

  public int getPointCount() {
    return pointCount;
  }

  public int getDegreesOfFreedom() {
    return pointCount - (model.getDegree() + 1);
  }

  /**
   * @return chi^2 / dof, or NaN for an exactly determined fit.
   */
  public double getReducedChiSquare() {
    int dof = getDegreesOfFreedom();
    return dof > 0 ? chiSquare / dof : Double.NaN;
  }

  public boolean isWeighted() {
    return weighted;
  }
}
