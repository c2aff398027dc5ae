package com.twentyn.gammacal.model;

import java.util.Objects;

/**
 * Indices (i1, i2), i1 < i2, of two detected peaks hypothesized to be the two anchor literature lines.
 */
public class AnchorPair implements Comparable<AnchorPair> {
  private final int first;
  private final int second;

  public AnchorPair(int first, int second) {
    if (first < 0 || second <= first) {
      throw new IllegalArgumentException(String.format("Invalid anchor pair (%d, %d)", first, second));
    }
    this.first = first;
    this.second = second;
  }

  public int getFirst() {
    return first;
  }

  public int getSecond() {
    return second;
  }

  // Iteration order of the search: i1 ascending, then i2 ascending.
  @Override
  public int compareTo(AnchorPair o) {
    int c = Integer.compare(first, o.first);
    return c != 0 ? c : Integer.compare(second, o.second);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AnchorPair that = (AnchorPair) o;
    return first == that.first && second == that.second;
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public String toString() {
    return String.format("(%d, %d)", first, second);
  }
}
