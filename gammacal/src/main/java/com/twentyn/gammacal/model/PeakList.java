package com.twentyn.gammacal.model;

import java.util.Arrays;

/**
 * Detected peak channel positions, ascending, with optional per-peak position uncertainties (channel units) as
 * reported by the peak fitter.
 */
public class PeakList {
  private final double[] positions;
  private final double[] uncertainties; // May be null.

  public PeakList(double[] positions, double[] uncertainties) {
    if (positions == null) {
      throw new IllegalArgumentException("Peak positions must not be null");
    }
    if (uncertainties != null && uncertainties.length != positions.length) {
      throw new IllegalArgumentException(String.format(
          "Got %d uncertainties for %d peaks", uncertainties.length, positions.length));
    }
    for (int i = 0; i < positions.length; i++) {
      if (!Double.isFinite(positions[i])) {
        throw new IllegalArgumentException(String.format("Peak %d has non-finite position %s", i, positions[i]));
      }
      if (i > 0 && positions[i] < positions[i - 1]) {
        throw new IllegalArgumentException(String.format(
            "Peak positions must be sorted ascending, but peak %d (%.4f) < peak %d (%.4f)",
            i, positions[i], i - 1, positions[i - 1]));
      }
    }
    this.positions = Arrays.copyOf(positions, positions.length);
    this.uncertainties = uncertainties == null ? null : Arrays.copyOf(uncertainties, uncertainties.length);
  }

  public static PeakList of(double... positions) {
    return new PeakList(positions, null);
  }

  public int size() {
    return positions.length;
  }

  public double getPosition(int i) {
    return positions[i];
  }

  public double[] getPositions() {
    return Arrays.copyOf(positions, positions.length);
  }

  public boolean hasUncertainties() {
    return uncertainties != null;
  }

  /**
   * @return The position uncertainty of peak i, or NaN if none was reported.
   */
  public double getUncertainty(int i) {
    return uncertainties == null ? Double.NaN : uncertainties[i];
  }
}
