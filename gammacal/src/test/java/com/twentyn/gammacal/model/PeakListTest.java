package com.twentyn.gammacal.model;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PeakListTest {

  @Test
  public void testEqualPositionsAreAllowed() {
    PeakList peaks = PeakList.of(1.0, 2.0, 2.0, 3.0);
    assertEquals(4, peaks.size());
    assertFalse(peaks.hasUncertainties());
    assertTrue("No uncertainty reads as NaN", Double.isNaN(peaks.getUncertainty(1)));
  }

  @Test
  public void testUncertainties() {
    PeakList peaks = new PeakList(new double[]{1.0, 2.0}, new double[]{0.1, 0.2});
    assertTrue(peaks.hasUncertainties());
    assertEquals(0.2, peaks.getUncertainty(1), 0.0);
    assertArrayEquals(new double[]{1.0, 2.0}, peaks.getPositions(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsortedPositionsAreRejected() {
    PeakList.of(1.0, 3.0, 2.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFinitePositionsAreRejected() {
    PeakList.of(1.0, Double.POSITIVE_INFINITY);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUncertaintyCountMustMatch() {
    new PeakList(new double[]{1.0, 2.0}, new double[]{0.1});
  }
}
