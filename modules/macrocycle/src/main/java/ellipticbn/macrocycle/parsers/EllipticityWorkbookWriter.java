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

package ellipticbn.macrocycle.parsers;

import static ellipticbn.macrocycle.parsers.EllipticityTableWriter.ATOMS_HEADER;
import static ellipticbn.macrocycle.parsers.EllipticityTableWriter.AXES_HEADER;
import static ellipticbn.macrocycle.parsers.EllipticityTableWriter.ELLIPTICITY_HEADER;

import ellipticbn.macrocycle.FileAnalysis;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.List;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Writes the result tables as Excel workbooks with Apache POI.
 * <p>
 * The sheets hold the same columns as the CSV tables; real numbers are stored as numeric cells
 * at full precision.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EllipticityWorkbookWriter {

  public static final String ELLIPTICITY_SHEET = "ellipticity";
  public static final String AXES_SHEET = "axes";
  public static final String ATOMS_SHEET = "atoms";

  private EllipticityWorkbookWriter() {
  }

  /**
   * Write one workbook with the ellipticity, principal axis and annotated atom sheets of a file.
   *
   * @param analysis The analysis of one file.
   * @param workbookFile The destination.
   * @throws IOException If writing fails.
   */
  public static void writeWorkbook(FileAnalysis analysis, File workbookFile) throws IOException {
    try (Workbook workbook = new XSSFWorkbook()) {
      addSheet(workbook, ELLIPTICITY_SHEET, ELLIPTICITY_HEADER,
          EllipticityTableWriter.ellipticityRows(analysis.results()));
      addSheet(workbook, AXES_SHEET, AXES_HEADER,
          EllipticityTableWriter.axisRows(analysis.results()));
      addSheet(workbook, ATOMS_SHEET, ATOMS_HEADER,
          EllipticityTableWriter.atomRows(analysis.atoms()));
      write(workbook, workbookFile);
    }
  }

  /**
   * Write the summary workbook: the ellipticity rows of all files in one sheet.
   *
   * @param analyses The file analyses.
   * @param summaryFile The destination.
   * @throws IOException If writing fails.
   */
  public static void writeSummary(List<FileAnalysis> analyses, File summaryFile)
      throws IOException {
    try (Workbook workbook = new XSSFWorkbook()) {
      addSheet(workbook, ELLIPTICITY_SHEET, ELLIPTICITY_HEADER,
          EllipticityTableWriter.summaryRows(analyses));
      write(workbook, summaryFile);
    }
  }

  private static void addSheet(Workbook workbook, String name, String[] header,
      List<Object[]> rows) {
    Sheet sheet = workbook.createSheet(name);
    Row headerRow = sheet.createRow(0);
    for (int c = 0; c < header.length; c++) {
      headerRow.createCell(c).setCellValue(header[c]);
    }
    int r = 1;
    for (Object[] values : rows) {
      Row row = sheet.createRow(r++);
      for (int c = 0; c < values.length; c++) {
        Object value = values[c];
        if (value instanceof Number number) {
          row.createCell(c).setCellValue(number.doubleValue());
        } else if (value instanceof Boolean bool) {
          row.createCell(c).setCellValue(bool);
        } else {
          row.createCell(c).setCellValue(String.valueOf(value));
        }
      }
    }
  }

  private static void write(Workbook workbook, File file) throws IOException {
    try (OutputStream out = Files.newOutputStream(file.toPath())) {
      workbook.write(out);
    }
  }
}
