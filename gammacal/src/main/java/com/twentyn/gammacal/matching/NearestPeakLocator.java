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

/**
 * Finds the detected peak closest to an arbitrary channel position.
 *
 * The distance |peaks[i] - query| over an ascending array is unimodal in i, so the answer sits next to the insertion
 * point of the query and can be found by binary search.  When several peaks are equally close, the highest index wins;
 * this is what a left-to-right scan that stops at the first strict increase of the distance would return.
 */
public class NearestPeakLocator {
  private final double[] peaks;

  /**
   * @param peaks Peak positions, sorted ascending, at least one.  Not copied and never modified.
   */
  public NearestPeakLocator(double[] peaks) {
    if (peaks.length == 0) {
      throw new IllegalArgumentException("Cannot locate peaks in an empty peak list");
    }
    for (int i = 1; i < peaks.length; i++) {
      if (!(peaks[i] >= peaks[i - 1])) {
        throw new IllegalArgumentException(String.format(
            "Peak positions must be sorted ascending, but peak %d (%.4f) < peak %d (%.4f)",
            i, peaks[i], i - 1, peaks[i - 1]));
      }
    }
    this.peaks = peaks;
  }

  /**
   * @param query A channel position.
   * @return The index of the closest peak.
   */
  public int locate(double query) {
    // Index of the first peak strictly above the query; everything before it is <= query.
    int right = upperBound(query);
    int left = right - 1;

    if (left < 0) {
      return upperBound(peaks[0]) - 1;
    }
    if (right >= peaks.length) {
      return left;
    }
    if (peaks[right] - query <= query - peaks[left]) {
      // Skip over duplicates of the right neighbour.
      return upperBound(peaks[right]) - 1;
    }
    return left;
  }

  /**
   * @return The channel distance between the query and its nearest peak.
   */
  public double distanceToNearest(double query) {
    return Math.abs(peaks[locate(query)] - query);
  }

  private int upperBound(double value) {
    int lo = 0;
    int hi = peaks.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (peaks[mid] <= value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
