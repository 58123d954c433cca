// ******************************************************************************
//
// Title:       ElliptiCBn.
// Description: ElliptiCBn - Ellipticity of Cucurbituril Macrocycles.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of ElliptiCBn.
//
// ElliptiCBn is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// ElliptiCBn is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// ElliptiCBn; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************

package ellipticbn.macrocycle.commands;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import ellipticbn.macrocycle.FileOutcome;
import ellipticbn.macrocycle.ReasonTag;
import ellipticbn.macrocycle.parsers.EllipticityWorkbookWriter;
import ellipticbn.utilities.EllipticbnBinding;
import ellipticbn.utilities.EllipticbnTest;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the Ellipticity command.
 */
public class EllipticityTest extends EllipticbnTest {

  private Path outputDir;
  private String dodecagon;
  private String mixture;
  private String malformed;

  @Before
  public void setUp() {
    outputDir = registerTemporaryDirectory();
    dodecagon = getResourceFile("ellipticbn/macrocycle/structures/dodecagon.xyz").getPath();
    mixture = getResourceFile("ellipticbn/macrocycle/structures/mixture.xyz").getPath();
    malformed = getResourceFile("ellipticbn/macrocycle/structures/malformed.xyz").getPath();
  }

  private Ellipticity run(String... args) {
    return runIn(outputDir, args);
  }

  private Ellipticity runIn(Path directory, String... args) {
    List<String> list = new ArrayList<>(List.of("-d", directory.toString()));
    list.addAll(Arrays.asList(args));
    EllipticbnBinding binding = new EllipticbnBinding();
    binding.setVariable("args", list);
    Ellipticity ellipticity = new Ellipticity(binding);
    ellipticity.run();
    return ellipticity;
  }

  private File output(String name) {
    return outputDir.resolve(name).toFile();
  }

  private List<String> lines(String name) throws IOException {
    return Files.readAllLines(outputDir.resolve(name), StandardCharsets.UTF_8);
  }

  private Workbook workbook(String name) throws IOException {
    return WorkbookFactory.create(output(name));
  }

  @Test
  public void testSingleFile() throws IOException {
    Ellipticity ellipticity = run(dodecagon);
    assertEquals(0, ellipticity.getExitStatus());
    assertEquals(1, ellipticity.getOutcomes().size());
    assertTrue(ellipticity.getOutcomes().get(0).isSuccess());

    List<String> ellipticities = lines("dodecagon.xyz" + Ellipticity.ELLIPTICITY_SUFFIX);
    assertEquals(2, ellipticities.size());
    assertTrue(ellipticities.get(1).contains(",12,0.000000,1.000000,"));
    assertEquals(4, lines("dodecagon.xyz" + Ellipticity.AXES_SUFFIX).size());
    assertEquals(13, lines("dodecagon.xyz" + Ellipticity.ATOMS_SUFFIX).size());

    try (Workbook workbook = workbook("dodecagon.xyz" + Ellipticity.WORKBOOK_SUFFIX)) {
      assertEquals(3, workbook.getNumberOfSheets());
      Sheet ellipticitySheet = workbook.getSheet(EllipticityWorkbookWriter.ELLIPTICITY_SHEET);
      assertEquals(1, ellipticitySheet.getLastRowNum());
      assertEquals(12.0, ellipticitySheet.getRow(1).getCell(4).getNumericCellValue(), 0.0);
      assertEquals(0.0, ellipticitySheet.getRow(1).getCell(5).getNumericCellValue(), 1.0e-6);
      assertEquals(3, workbook.getSheet(EllipticityWorkbookWriter.AXES_SHEET).getLastRowNum());
      assertEquals(12, workbook.getSheet(EllipticityWorkbookWriter.ATOMS_SHEET).getLastRowNum());
    }

    // The summary is only written for more than one file.
    assertFalse(output("summary.xlsx").exists());
    assertNotNull(ellipticity.binding.getVariable("outcomes"));
  }

  @Test
  public void testSummary() throws IOException {
    Ellipticity ellipticity = run("--summaryFile", "all.csv", dodecagon, mixture);
    assertEquals(0, ellipticity.getExitStatus());
    List<String> summary = lines("all.csv");
    assertEquals(3, summary.size());
    assertTrue(summary.get(1).contains("dodecagon.xyz"));
    assertTrue(summary.get(2).contains("mixture.xyz"));
    assertTrue(output("mixture.xyz" + Ellipticity.ATOMS_SUFFIX).exists());
  }

  @Test
  public void testWorkbookSummary() throws IOException {
    Ellipticity ellipticity = run(dodecagon, mixture);
    assertEquals(0, ellipticity.getExitStatus());
    try (Workbook summary = workbook("summary.xlsx")) {
      Sheet sheet = summary.getSheet(EllipticityWorkbookWriter.ELLIPTICITY_SHEET);
      assertEquals("id", sheet.getRow(0).getCell(0).getStringCellValue());
      assertEquals(2, sheet.getLastRowNum());
      assertTrue(sheet.getRow(1).getCell(1).getStringCellValue().endsWith("dodecagon.xyz"));
      assertTrue(sheet.getRow(2).getCell(1).getStringCellValue().endsWith("mixture.xyz"));
    }
  }

  @Test
  public void testSameFileNameInTwoDirectories() throws IOException {
    Path first = Files.createDirectories(outputDir.resolve("first"));
    Path second = Files.createDirectories(outputDir.resolve("second"));
    Path copy1 = Files.copy(Path.of(dodecagon), first.resolve("cb.xyz"));
    Path copy2 = Files.copy(Path.of(dodecagon), second.resolve("cb.xyz"));
    Ellipticity ellipticity = run("--overwrite", "-t", "2", copy1.toString(), copy2.toString());
    assertEquals(0, ellipticity.getExitStatus());
    List<FileOutcome> outcomes = ellipticity.getOutcomes();
    assertEquals(2, outcomes.size());
    assertTrue(outcomes.get(0).isSuccess());
    assertEquals(ReasonTag.OUTPUT_EXISTS, outcomes.get(1).failure());
    assertEquals(2, lines("cb.xyz" + Ellipticity.ELLIPTICITY_SUFFIX).size());
  }

  @Test
  public void testExistingOutput() throws IOException {
    assertEquals(0, run(dodecagon).getExitStatus());

    Ellipticity second = run(dodecagon);
    assertEquals(1, second.getExitStatus());
    FileOutcome outcome = second.getOutcomes().get(0);
    assertEquals(ReasonTag.OUTPUT_EXISTS, outcome.failure());

    Ellipticity third = run("--overwrite", dodecagon);
    assertEquals(0, third.getExitStatus());
    assertEquals(2, lines("dodecagon.xyz" + Ellipticity.ELLIPTICITY_SUFFIX).size());
  }

  @Test
  public void testMalformedFileDoesNotStopBatch() throws IOException {
    Ellipticity ellipticity = run(malformed, dodecagon);
    assertEquals(0, ellipticity.getExitStatus());
    List<FileOutcome> outcomes = ellipticity.getOutcomes();
    assertEquals(2, outcomes.size());
    assertEquals(ReasonTag.INVALID_INPUT, outcomes.get(0).failure());
    assertTrue(outcomes.get(1).isSuccess());
    assertFalse(output("malformed.xyz" + Ellipticity.ELLIPTICITY_SUFFIX).exists());
    try (Workbook summary = workbook("summary.xlsx")) {
      assertEquals(1, summary.getSheetAt(0).getLastRowNum());
    }
  }

  @Test
  public void testNoCarbons() throws IOException {
    String water = getResourceFile("ellipticbn/macrocycle/structures/water.xyz").getPath();
    Ellipticity ellipticity = run(water);
    assertEquals(0, ellipticity.getExitStatus());
    assertTrue(ellipticity.getOutcomes().get(0).isSuccess());
    assertEquals(1, lines("water.xyz" + Ellipticity.ELLIPTICITY_SUFFIX).size());
    assertEquals(4, lines("water.xyz" + Ellipticity.ATOMS_SUFFIX).size());
  }

  @Test
  public void testOnlyFailures() {
    Ellipticity ellipticity = run(malformed);
    assertEquals(1, ellipticity.getExitStatus());
  }

  @Test
  public void testNoFiles() {
    assertEquals(1, run().getExitStatus());
  }

  @Test
  public void testSummaryExtension() {
    Ellipticity ellipticity = run("-s", "summary.txt", dodecagon, mixture);
    assertEquals(1, ellipticity.getExitStatus());
    assertTrue(ellipticity.getOutcomes().isEmpty());
  }

  @Test
  public void testInvalidSettings() {
    assertEquals(1, run("--minCarbons", "30", dodecagon).getExitStatus());
  }

  @Test
  public void testParallelMatchesSerial() throws IOException {
    Path serialDir = outputDir.resolve("serial");
    Path parallelDir = outputDir.resolve("parallel");
    Ellipticity serial = runIn(serialDir, "-s", "summary.csv", "-t", "1", dodecagon, mixture);
    Ellipticity parallel = runIn(parallelDir, "-s", "summary.csv", "-t", "2", dodecagon, mixture);
    assertEquals(0, serial.getExitStatus());
    assertEquals(0, parallel.getExitStatus());
    assertEquals(Files.readAllLines(serialDir.resolve("summary.csv")),
        Files.readAllLines(parallelDir.resolve("summary.csv")));
  }
}
