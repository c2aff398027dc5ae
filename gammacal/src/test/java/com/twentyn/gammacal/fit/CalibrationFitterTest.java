package com.twentyn.gammacal.fit;

import com.twentyn.gammacal.CalibrationException.InsufficientFitPointsException;
import com.twentyn.gammacal.model.Correspondence;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CalibrationFitterTest {
  private static final double TOLERANCE = 1e-6;

  private CalibrationFitter fitter;

  @Before
  public void setUp() {
    fitter = new CalibrationFitter();
  }

  private static Correspondence identityAssignment(int n) {
    int[] indices = new int[n];
    for (int i = 0; i < n; i++) {
      indices[i] = i;
    }
    return new Correspondence(indices, new double[n]);
  }

  @Test
  public void testExactLinearData() throws Exception {
    double[] peaks = {90.60, 118.50, 145.10, 173.45, 302.15, 557.65, 879.75, 1221.40};
    double[] energies = {186.2, 242.0, 295.2, 351.9, 609.3, 1120.3, 1764.5, 2447.8};
    FitResult result = fitter.fit(identityAssignment(8), peaks, energies, 1);

    assertEquals(5.0, result.getModel().getIntercept(), TOLERANCE);
    assertEquals(2.0, result.getModel().getSlope(), TOLERANCE);
    assertEquals(0.0, result.getChiSquare(), TOLERANCE);
    assertEquals(8, result.getPointCount());
    assertEquals(6, result.getDegreesOfFreedom());
    assertFalse(result.isWeighted());
  }

  @Test
  public void testAgreesWithSimpleRegression() throws Exception {
    double[] peaks = {100.0, 250.0, 400.0, 610.0, 800.0, 1200.0};
    double[] energies = {121.1, 243.9, 347.2, 511.5, 663.9, 964.2};

    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < peaks.length; i++) {
      regression.addData(peaks[i], energies[i]);
    }

    FitResult result = fitter.fit(identityAssignment(peaks.length), peaks, energies, 1);
    assertEquals("Intercept", regression.getIntercept(), result.getModel().getIntercept(), TOLERANCE);
    assertEquals("Slope", regression.getSlope(), result.getModel().getSlope(), TOLERANCE);
    assertEquals("Sum of squared residuals", regression.getSumSquaredErrors(), result.getChiSquare(), TOLERANCE);
    assertEquals("Intercept error", regression.getInterceptStdErr(), result.getCoefficientErrors()[0], TOLERANCE);
    assertEquals("Slope error", regression.getSlopeStdErr(), result.getCoefficientErrors()[1], TOLERANCE);
  }

  @Test
  public void testUnmatchedEntriesAreSkipped() throws Exception {
    double[] peaks = {10.0, 20.0, 30.0, 40.0};
    double[] energies = {25.0, 45.0, 999.0, 85.0};
    Correspondence accepted = identityAssignment(4).withUnmatched(Arrays.asList(2));
    FitResult result = fitter.fit(accepted, peaks, energies, 1);

    assertEquals(5.0, result.getModel().getIntercept(), TOLERANCE);
    assertEquals(2.0, result.getModel().getSlope(), TOLERANCE);
    assertEquals(3, result.getPointCount());
  }

  @Test
  public void testQuadraticData() throws Exception {
    double[] peaks = {50.0, 400.0, 1100.0, 2300.0, 4100.0, 7900.0};
    double[] energies = new double[peaks.length];
    for (int i = 0; i < peaks.length; i++) {
      energies[i] = 1.5 + 0.33 * peaks[i] + 2.0e-6 * peaks[i] * peaks[i];
    }
    FitResult result = fitter.fit(identityAssignment(peaks.length), peaks, energies, 2);

    assertEquals(2, result.getModel().getDegree());
    assertEquals(1.5, result.getModel().getCoefficient(0), 1e-5);
    assertEquals(0.33, result.getModel().getCoefficient(1), 1e-8);
    assertEquals(2.0e-6, result.getModel().getCoefficient(2), 1e-11);
  }

  @Test
  public void testWeightedFit() throws Exception {
    double[] peaks = {100.0, 250.0, 400.0, 610.0, 800.0, 1200.0};
    double[] energies = {121.1, 243.9, 347.2, 511.5, 663.9, 964.2};
    double[] sigmas = new double[peaks.length];
    Arrays.fill(sigmas, 0.5);

    FitResult unweighted = fitter.fit(identityAssignment(peaks.length), peaks, energies, 1);
    FitResult weighted = fitter.fit(identityAssignment(peaks.length), peaks, energies, 1, sigmas);

    assertTrue(weighted.isWeighted());
    assertEquals("Equal weights do not move the line",
        unweighted.getModel().getSlope(), weighted.getModel().getSlope(), TOLERANCE);
    assertEquals("Chi-square is measured in units of sigma",
        unweighted.getChiSquare() / 0.25, weighted.getChiSquare(), TOLERANCE);
  }

  @Test
  public void testPreciseLineDominatesWeightedFit() throws Exception {
    double[] peaks = {10.0, 20.0, 30.0};
    double[] energies = {10.0, 20.0, 33.0};
    double[] sigmas = {0.001, 0.001, 100.0};
    FitResult result = fitter.fit(identityAssignment(3), peaks, energies, 1, sigmas);
    assertEquals(1.0, result.getModel().getSlope(), 1e-3);
    assertEquals(0.0, result.getModel().getIntercept(), 1e-2);
  }

  @Test
  public void testExactlyDeterminedFit() throws Exception {
    FitResult result = fitter.fit(identityAssignment(2), new double[]{10.0, 20.0}, new double[]{100.0, 300.0}, 1);
    assertEquals(20.0, result.getModel().getSlope(), TOLERANCE);
    assertEquals(0, result.getDegreesOfFreedom());
    assertTrue(Double.isNaN(result.getReducedChiSquare()));
  }

  @Test(expected = InsufficientFitPointsException.class)
  public void testTooFewPoints() throws Exception {
    Correspondence accepted = identityAssignment(3).withUnmatched(Arrays.asList(1, 2));
    fitter.fit(accepted, new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0}, 1);
  }

  @Test(expected = InsufficientFitPointsException.class)
  public void testAllPointsOnOneChannel() throws Exception {
    Correspondence accepted = new Correspondence(new int[]{1, 1, 1}, new double[3]);
    fitter.fit(accepted, new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0}, 1);
  }

  @Test(expected = InsufficientFitPointsException.class)
  public void testQuadraticNeedsThreeChannels() throws Exception {
    Correspondence accepted = new Correspondence(new int[]{0, 1, 1}, new double[3]);
    fitter.fit(accepted, new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0}, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDegreeZeroIsRejected() throws Exception {
    fitter.fit(identityAssignment(3), new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0}, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveSigmaIsRejected() throws Exception {
    fitter.fit(identityAssignment(3), new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0}, 1,
        new double[]{1.0, 0.0, 1.0});
  }
}
