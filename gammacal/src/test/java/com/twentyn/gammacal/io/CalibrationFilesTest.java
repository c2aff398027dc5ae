package com.twentyn.gammacal.io;

import com.twentyn.gammacal.model.CalibrationModel;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class CalibrationFilesTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testCoefficientsOnePerLine() throws Exception {
    CalibrationModel model = CalibrationFiles.readCoefficients(new StringReader("5.0\n2.0\n\n1e-6\n"), "cal");
    assertEquals(new CalibrationModel(5.0, 2.0, 1e-6), model);
  }

  @Test
  public void testCoefficientsOnOneLine() throws Exception {
    CalibrationModel model = CalibrationFiles.readCoefficients(new StringReader("5.0 2.0\n"), "cal");
    assertEquals(new CalibrationModel(5.0, 2.0), model);
  }

  @Test(expected = IOException.class)
  public void testEmptyCoefficientFile() throws Exception {
    CalibrationFiles.readCoefficients(new StringReader("\n# empty\n"), "cal");
  }

  @Test
  public void testWriteCoefficientsOnePerLine() throws Exception {
    File file = tempFolder.newFile("ge1.cal");
    CalibrationFiles.writeCoefficients(file, new CalibrationModel(-15.0, 2.0));
    assertEquals("-15.0\n2.0\n", FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    assertEquals(new CalibrationModel(-15.0, 2.0), CalibrationFiles.readCoefficients(file));
  }

  @Test
  public void testCalibrationListSkipsMalformedLines() throws Exception {
    Map<String, CalibrationModel> calibrations = CalibrationFiles.readCalibrationList(new StringReader(
        "ge1: 5.0 2.0\n" +
            "this line has no name separator\n" +
            "\n" +
            "ge2: 1.0 banana\n" +
            ": 1.0 2.0\n" +
            "ge3.0072 :  -0.5   0.33  2e-6\n"), "cal.list");

    assertEquals(Arrays.asList("ge1", "ge3.0072"), Arrays.asList(calibrations.keySet().toArray()));
    assertEquals(new CalibrationModel(5.0, 2.0), calibrations.get("ge1"));
    assertEquals(new CalibrationModel(-0.5, 0.33, 2e-6), calibrations.get("ge3.0072"));
  }

  @Test
  public void testCalibrationListIsWrittenSortedByName() throws Exception {
    Map<String, CalibrationModel> calibrations = new LinkedHashMap<>();
    calibrations.put("ge2", new CalibrationModel(1.0, 0.5));
    calibrations.put("ge10", new CalibrationModel(-2.0, 0.25));
    calibrations.put("ge1", new CalibrationModel(0.0, 1.0));

    StringWriter writer = new StringWriter();
    CalibrationFiles.writeCalibrationList(writer, calibrations);
    assertEquals("ge1: 0.0 1.0\nge10: -2.0 0.25\nge2: 1.0 0.5\n", writer.toString());

    File file = tempFolder.newFile("cal.list");
    CalibrationFiles.writeCalibrationList(file, calibrations);
    Map<String, CalibrationModel> read = CalibrationFiles.readCalibrationList(file);
    assertEquals(calibrations, read);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNameWithSeparatorIsRejected() {
    CalibrationFiles.formatListEntry("ge:1", new CalibrationModel(0.0, 1.0));
  }
}
