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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every literature energy (by index) to the index of a detected peak, or to {@link #UNMATCHED}.  Each entry also
 * carries the channel distance between the peak and the position the energy was predicted at.
 */
public class Correspondence {
  public static final int UNMATCHED = -1;

  private final int[] peakIndices;
  private final double[] residuals;

  public Correspondence(int[] peakIndices, double[] residuals) {
    if (peakIndices.length != residuals.length) {
      throw new IllegalArgumentException(String.format(
          "Got %d residuals for %d assignments", residuals.length, peakIndices.length));
    }
    this.peakIndices = Arrays.copyOf(peakIndices, peakIndices.length);
    this.residuals = Arrays.copyOf(residuals, residuals.length);
  }

  public int size() {
    return peakIndices.length;
  }

  public int getPeakIndex(int literatureIndex) {
    return peakIndices[literatureIndex];
  }

  public boolean isMatched(int literatureIndex) {
    return peakIndices[literatureIndex] != UNMATCHED;
  }

  public double getResidual(int literatureIndex) {
    return residuals[literatureIndex];
  }

  public int getMatchedCount() {
    int count = 0;
    for (int p : peakIndices) {
      if (p != UNMATCHED) {
        count++;
      }
    }
    return count;
  }

  public List<Integer> getUnmatchedIndices() {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < peakIndices.length; i++) {
      if (peakIndices[i] == UNMATCHED) {
        result.add(i);
      }
    }
    return result;
  }

  /**
   * @return A copy of this correspondence with the given literature entries set to unmatched.  Residuals are kept so
   * the trimmed entries can still be reported.
   */
  public Correspondence withUnmatched(Collection<Integer> literatureIndices) {
    int[] indices = Arrays.copyOf(peakIndices, peakIndices.length);
    for (Integer i : literatureIndices) {
      indices[i] = UNMATCHED;
    }
    return new Correspondence(indices, residuals);
  }

  /**
   * @return Peak indices that more than one matched literature energy points at, with the number of uses.
   */
  public Map<Integer, Integer> findMultiplyAssignedPeaks() {
    Map<Integer, Integer> uses = new HashMap<>();
    for (int p : peakIndices) {
      if (p != UNMATCHED) {
        uses.merge(p, 1, Integer::sum);
      }
    }
    uses.values().removeIf(n -> n < 2);
    return uses;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Correspondence that = (Correspondence) o;
    return Arrays.equals(peakIndices, that.peakIndices) && Arrays.equals(residuals, that.residuals);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(peakIndices) + Arrays.hashCode(residuals);
  }

  @Override
  public String toString() {
    return Arrays.toString(peakIndices);
  }
}
