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

/**
 * Base class for every failure the automatic calibration can report.  None of these are recovered internally: the
 * caller decides whether to retry with other parameters or give up.
 */
public class CalibrationException extends Exception {
  public CalibrationException(String message) {
    super(message);
  }

  public CalibrationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Fewer than two literature energies were supplied.
   */
  public static class InsufficientReferenceDataException extends CalibrationException {
    public InsufficientReferenceDataException(String message) {
      super(message);
    }
  }

  /**
   * Fewer detected peaks than literature energies.
   */
  public static class InsufficientPeaksException extends CalibrationException {
    public InsufficientPeaksException(String message) {
      super(message);
    }
  }

  /**
   * Two anchor peaks sit at the same channel, or the anchor energies give a zero slope.  Single pairs like this are
   * skipped during the search; this is only raised when no usable pair is left at all.
   */
  public static class DegenerateAnchorPairException extends CalibrationException {
    public DegenerateAnchorPairException(String message) {
      super(message);
    }
  }

  /**
   * Every candidate calibration violated the slope/intercept plausibility bounds.
   */
  public static class NoFeasibleCalibrationException extends CalibrationException {
    public NoFeasibleCalibrationException(String message) {
      super(message);
    }
  }

  /**
   * Too few accepted correspondences remain for a polynomial fit of the requested degree.
   */
  public static class InsufficientFitPointsException extends CalibrationException {
    public InsufficientFitPointsException(String message) {
      super(message);
    }

    public InsufficientFitPointsException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Inverse evaluation was requested on a model that cannot be inverted.
   */
  public static class DegenerateModelException extends CalibrationException {
    public DegenerateModelException(String message) {
      super(message);
    }
  }
}
