package com.twentyn.gammacal.io;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LiteratureEnergyReaderTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testReadsValuesInFileOrder() throws Exception {
    List<Double> energies = new LiteratureEnergyReader().read(new StringReader(
        "# 226Ra\n242.0 186.2\n\n295.2   # Pb-214\n351.9\n"), "ra.txt");
    assertEquals("Order is kept as written", Arrays.asList(242.0, 186.2, 295.2, 351.9), energies);
  }

  @Test
  public void testReadsFile() throws Exception {
    File file = tempFolder.newFile("eu152.txt");
    FileUtils.writeStringToFile(file, "121.78\n244.70\n344.28\n", StandardCharsets.UTF_8);
    assertEquals(Arrays.asList(121.78, 244.70, 344.28), new LiteratureEnergyReader().read(file));
  }

  @Test
  public void testMalformedNumberReportsLine() {
    try {
      new LiteratureEnergyReader().read(new StringReader("121.78\n244.7O\n"), "eu.txt");
      fail("Malformed value should not parse");
    } catch (IOException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("eu.txt:2:"));
    }
  }

  @Test(expected = IOException.class)
  public void testNonFiniteValueIsRejected() throws Exception {
    new LiteratureEnergyReader().read(new StringReader("NaN\n"), "x");
  }
}
