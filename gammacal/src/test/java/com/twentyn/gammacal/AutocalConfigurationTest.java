package com.twentyn.gammacal;

import com.twentyn.gammacal.matching.AnchorConvention;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AutocalConfigurationTest {

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testEmptyObjectGivesDefaults() throws Exception {
    AutocalConfiguration config = AutocalConfiguration.readFromStream(json("{}"));
    assertEquals(AnchorConvention.FIRST_TWO, config.getAnchorConvention());
    assertEquals(AutocalConfiguration.DEFAULT_TRIM_COUNT, config.getTrimCount());
    assertEquals(AutocalConfiguration.DEFAULT_DEGENERACY_PENALTY, config.getDegeneracyPenalty(), 0.0);
    assertEquals(1, config.getMinAnchorSeparation());
    assertEquals(1, config.getFitDegree());
    assertFalse(config.isRestrictToExcess());
    assertFalse(config.isParallelSearch());
    assertTrue(config.isUsePeakUncertainties());
  }

  @Test
  public void testValuesAreRead() throws Exception {
    AutocalConfiguration config = AutocalConfiguration.readFromStream(json(
        "{\"anchor_convention\": \"FIRST_AND_LAST\", \"trim_count\": 2, \"min_anchor_separation\": 4, " +
            "\"restrict_to_excess\": true, \"expected_slope\": 0.5, \"slope_tolerance\": 0.1, " +
            "\"fit_degree\": 2, \"parallel_search\": true, \"cost_trim_count\": 1}"));
    assertEquals(AnchorConvention.FIRST_AND_LAST, config.getAnchorConvention());
    assertEquals(2, config.getTrimCount());
    assertEquals(4, config.getMinAnchorSeparation());
    assertTrue(config.isRestrictToExcess());
    assertEquals(0.5, config.getExpectedSlope(), 0.0);
    assertEquals(0.1, config.getSlopeTolerance(), 0.0);
    assertEquals(2, config.getFitDegree());
    assertTrue(config.isParallelSearch());
    assertEquals(1, config.getCostTrimCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidValuesAreRejected() throws Exception {
    AutocalConfiguration.readFromStream(json("{\"fit_degree\": 0}"));
  }

  @Test(expected = IOException.class)
  public void testUnknownKeysAreRejected() throws Exception {
    AutocalConfiguration.readFromStream(json("{\"trim\": 2}"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroSeparationIsRejected() {
    new AutocalConfiguration().setMinAnchorSeparation(0).validate();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveSlopeToleranceIsRejected() {
    new AutocalConfiguration().setSlopeTolerance(0.0).validate();
  }
}
