package com.twentyn.gammacal;

import com.twentyn.gammacal.CalibrationException.NoFeasibleCalibrationException;
import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.PeakList;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BatchCalibratorTest {
  private static final double[] ENERGIES = {186.2, 242.0, 295.2, 351.9, 609.3, 1120.3, 1764.5, 2447.8};
  private static final double[] PEAKS = {90.60, 118.50, 145.10, 173.45, 302.15, 557.65, 879.75, 1221.40};

  private AutoCalibrator mockCalibrator;
  private PeakList goodPeaks;
  private PeakList badPeaks;
  private CalibrationResult goodResult;

  @Before
  public void setUp() throws Exception {
    mockCalibrator = Mockito.mock(AutoCalibrator.class);
    goodPeaks = PeakList.of(PEAKS);
    badPeaks = PeakList.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0);
    goodResult = Mockito.mock(CalibrationResult.class);
    Mockito.when(goodResult.getModel()).thenReturn(new CalibrationModel(5.0, 2.0));

    Mockito.when(mockCalibrator.calibrate(Mockito.eq(goodPeaks), Mockito.any(double[].class))).thenReturn(goodResult);
    Mockito.when(mockCalibrator.calibrate(Mockito.eq(badPeaks), Mockito.any(double[].class)))
        .thenThrow(new NoFeasibleCalibrationException("nothing plausible"));
  }

  @Test
  public void testFailuresDoNotStopTheBatch() throws Exception {
    Map<String, PeakList> spectra = new LinkedHashMap<>();
    spectra.put("ge2", badPeaks);
    spectra.put("ge1", goodPeaks);
    spectra.put("ge3", goodPeaks);

    BatchCalibrator.BatchResult result = new BatchCalibrator(mockCalibrator, 2).calibrateAll(spectra, ENERGIES);

    assertEquals(Arrays.asList("ge1", "ge3"), Arrays.asList(result.getResults().keySet().toArray()));
    assertSame(goodResult, result.getResults().get("ge1"));
    assertEquals(1, result.getFailures().size());
    assertTrue(result.getFailures().get("ge2") instanceof NoFeasibleCalibrationException);
    assertEquals(new CalibrationModel(5.0, 2.0), result.getCalibrations().get("ge3"));
    Mockito.verify(mockCalibrator, Mockito.times(3)).calibrate(Mockito.any(PeakList.class),
        Mockito.any(double[].class));
  }

  @Test(expected = IllegalStateException.class)
  public void testUnexpectedErrorsPropagate() throws Exception {
    PeakList broken = PeakList.of(PEAKS);
    Mockito.when(mockCalibrator.calibrate(Mockito.eq(broken), Mockito.any(double[].class)))
        .thenThrow(new IllegalStateException("boom"));
    Map<String, PeakList> spectra = new LinkedHashMap<>();
    spectra.put("broken", broken);
    new BatchCalibrator(mockCalibrator, 1).calibrateAll(spectra, ENERGIES);
  }

  @Test
  public void testRealCalibrations() throws Exception {
    double[] shifted = new double[PEAKS.length];
    for (int i = 0; i < PEAKS.length; i++) {
      // Same detector with the offset moved from 5 to -15 keV.
      shifted[i] = PEAKS[i] + 10.0;
    }
    Map<String, PeakList> spectra = new LinkedHashMap<>();
    spectra.put("a", PeakList.of(PEAKS));
    spectra.put("b", PeakList.of(shifted));
    spectra.put("c", PeakList.of(1.0, 2.0));

    BatchCalibrator.BatchResult result = new BatchCalibrator(new AutoCalibrator(), 3).calibrateAll(spectra, ENERGIES);
    assertEquals(2, result.getResults().size());
    assertEquals(5.0, result.getCalibrations().get("a").getIntercept(), 1e-6);
    assertEquals(-15.0, result.getCalibrations().get("b").getIntercept(), 1e-6);
    assertTrue(result.getFailures().get("c") instanceof CalibrationException.InsufficientPeaksException);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNeedsAWorker() {
    new BatchCalibrator(mockCalibrator, 0);
  }
}
