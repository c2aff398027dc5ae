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

import com.twentyn.gammacal.model.CalibrationModel;
import com.twentyn.gammacal.model.PeakList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Calibrates many spectra (for example one per detector) against the same literature energies.  Runs are independent
 * and go to a fixed size worker pool; a failing spectrum is recorded and does not stop the batch.
 */
public class BatchCalibrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BatchCalibrator.class);

  public static class BatchResult {
    private final SortedMap<String, CalibrationResult> results;
    private final SortedMap<String, CalibrationException> failures;

    BatchResult(SortedMap<String, CalibrationResult> results, SortedMap<String, CalibrationException> failures) {
      this.results = Collections.unmodifiableSortedMap(results);
      this.failures = Collections.unmodifiableSortedMap(failures);
    }

    public SortedMap<String, CalibrationResult> getResults() {
      return results;
    }

    public SortedMap<String, CalibrationException> getFailures() {
      return failures;
    }

    /**
     * @return The final calibration of every successful spectrum, by name.
     */
    public SortedMap<String, CalibrationModel> getCalibrations() {
      SortedMap<String, CalibrationModel> calibrations = new TreeMap<>();
      for (Map.Entry<String, CalibrationResult> entry : results.entrySet()) {
        calibrations.put(entry.getKey(), entry.getValue().getModel());
      }
      return calibrations;
    }
  }

  private final AutoCalibrator calibrator;
  private final int threads;

  public BatchCalibrator(AutoCalibrator calibrator, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException(String.format("Need at least one worker thread, got %d", threads));
    }
    this.calibrator = calibrator;
    this.threads = threads;
  }

  public BatchResult calibrateAll(Map<String, PeakList> spectra, double[] energies) throws InterruptedException {
    double[] sharedEnergies = Arrays.copyOf(energies, energies.length);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    Map<String, Future<CalibrationResult>> futures = new LinkedHashMap<>();
    try {
      for (Map.Entry<String, PeakList> entry : spectra.entrySet()) {
        PeakList peaks = entry.getValue();
        futures.put(entry.getKey(), executor.submit(() -> calibrator.calibrate(peaks, sharedEnergies)));
      }

      SortedMap<String, CalibrationResult> results = new TreeMap<>();
      SortedMap<String, CalibrationException> failures = new TreeMap<>();
      for (Map.Entry<String, Future<CalibrationResult>> entry : futures.entrySet()) {
        String name = entry.getKey();
        try {
          results.put(name, entry.getValue().get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof CalibrationException) {
            LOGGER.warn("Calibration of %s failed: %s", name, cause.getMessage());
            failures.put(name, (CalibrationException) cause);
          } else if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          } else {
            throw new RuntimeException(String.format("Calibration of %s failed unexpectedly", name), cause);
          }
        }
      }

      LOGGER.info("Calibrated %d of %d spectra", results.size(), spectra.size());
      return new BatchResult(results, failures);
    } finally {
      executor.shutdownNow();
      executor.awaitTermination(1, TimeUnit.MINUTES);
    }
  }
}
