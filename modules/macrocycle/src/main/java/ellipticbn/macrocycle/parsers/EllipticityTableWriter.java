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

import static org.apache.commons.math3.util.FastMath.sqrt;

import ellipticbn.macrocycle.AnnotatedAtom;
import ellipticbn.macrocycle.Atom;
import ellipticbn.macrocycle.EllipticityResult;
import ellipticbn.macrocycle.FileAnalysis;
import ellipticbn.numerics.PrincipalAxes;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes the result tables as CSV with Apache Commons CSV.
 * <p>
 * Real numbers are written with a fixed number of decimals in the root locale, so identical
 * results always produce identical bytes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EllipticityTableWriter {

  public static final String[] ELLIPTICITY_HEADER = {"id", "file", "molecule", "ring",
      "num_carbons", "ellipticity", "aspect_ratio", "centroid_x", "centroid_y", "centroid_z",
      "atoms"};
  public static final String[] AXES_HEADER = {"id", "axis", "x", "y", "z", "length"};
  public static final String[] ATOMS_HEADER = {"index", "element", "x", "y", "z", "molecule",
      "ring_candidate", "ring", "status"};

  /** Status of an atom that is not part of a candidate ring. */
  public static final String NO_RING = "none";

  private static final String[] AXIS_NAMES = {"major", "minor", "normal"};

  private EllipticityTableWriter() {
  }

  private static CSVFormat format(String[] header) {
    return CSVFormat.DEFAULT.builder().setHeader(header).setRecordSeparator('\n').build();
  }

  private static String decimal(double value) {
    return String.format(Locale.ROOT, "%.6f", value);
  }

  /**
   * @param results The accepted rings.
   * @return one row per accepted ring, in {@link #ELLIPTICITY_HEADER} order.
   */
  static List<Object[]> ellipticityRows(List<EllipticityResult> results) {
    List<Object[]> rows = new ArrayList<>(results.size());
    for (EllipticityResult result : results) {
      double[] centroid = result.axes().getCentroid();
      String atoms = result.ring().atoms().stream().map(String::valueOf)
          .collect(Collectors.joining(" "));
      rows.add(new Object[] {result.id(), result.file(), result.molecule(), result.ring().ring(),
          result.numCarbons(), result.ellipticity(), result.aspectRatio(), centroid[0],
          centroid[1], centroid[2], atoms});
    }
    return rows;
  }

  /**
   * Three rows (major, minor, normal) per accepted ring. Each axis is a unit vector; the length is
   * the semi-axis sqrt(2 * variance) of the matching ellipse.
   *
   * @param results The accepted rings.
   * @return the rows, in {@link #AXES_HEADER} order.
   */
  static List<Object[]> axisRows(List<EllipticityResult> results) {
    List<Object[]> rows = new ArrayList<>(3 * results.size());
    for (EllipticityResult result : results) {
      PrincipalAxes axes = result.axes();
      double[][] vectors = {axes.getMajorAxis(), axes.getMinorAxis(), axes.getNormal()};
      double[] variances = axes.getVariances();
      for (int i = 0; i < 3; i++) {
        rows.add(new Object[] {result.id(), AXIS_NAMES[i], vectors[i][0], vectors[i][1],
            vectors[i][2], sqrt(2.0 * variances[i])});
      }
    }
    return rows;
  }

  /**
   * @param atoms The annotated atoms.
   * @return one row per input atom, in {@link #ATOMS_HEADER} order.
   */
  static List<Object[]> atomRows(List<AnnotatedAtom> atoms) {
    List<Object[]> rows = new ArrayList<>(atoms.size());
    for (AnnotatedAtom annotated : atoms) {
      Atom atom = annotated.atom();
      rows.add(new Object[] {atom.index(), atom.element(), atom.x(), atom.y(), atom.z(),
          annotated.molecule(), annotated.ringCandidate(),
          annotated.ring() == null ? "" : annotated.ring(),
          annotated.status() == null ? NO_RING : annotated.status().tag()});
    }
    return rows;
  }

  /**
   * @param analyses The file analyses.
   * @return the ellipticity rows of every file, in input order.
   */
  static List<Object[]> summaryRows(List<FileAnalysis> analyses) {
    List<Object[]> rows = new ArrayList<>();
    for (FileAnalysis analysis : analyses) {
      rows.addAll(ellipticityRows(analysis.results()));
    }
    return rows;
  }

  private static void print(String[] header, List<Object[]> rows, Appendable out)
      throws IOException {
    try (CSVPrinter printer = new CSVPrinter(out, format(header))) {
      for (Object[] row : rows) {
        Object[] record = new Object[row.length];
        for (int i = 0; i < row.length; i++) {
          record[i] = row[i] instanceof Double value ? decimal(value) : row[i];
        }
        printer.printRecord(record);
      }
    }
  }

  /**
   * Write the ellipticity table: one row per accepted ring.
   *
   * @param results The accepted rings.
   * @param out The destination.
   * @throws IOException If writing fails.
   */
  public static void writeEllipticities(List<EllipticityResult> results, Appendable out)
      throws IOException {
    print(ELLIPTICITY_HEADER, ellipticityRows(results), out);
  }

  /**
   * Write the principal axis table: three rows (major, minor, normal) per accepted ring.
   *
   * @param results The accepted rings.
   * @param out The destination.
   * @throws IOException If writing fails.
   */
  public static void writeAxes(List<EllipticityResult> results, Appendable out)
      throws IOException {
    print(AXES_HEADER, axisRows(results), out);
  }

  /**
   * Write the annotated atom table: one row per input atom.
   *
   * @param atoms The annotated atoms.
   * @param out The destination.
   * @throws IOException If writing fails.
   */
  public static void writeAtoms(List<AnnotatedAtom> atoms, Appendable out) throws IOException {
    print(ATOMS_HEADER, atomRows(atoms), out);
  }

  /**
   * Write the summary table: the ellipticity tables of all files in order, under one header.
   *
   * @param analyses The file analyses.
   * @param out The destination.
   * @throws IOException If writing fails.
   */
  public static void writeSummary(List<FileAnalysis> analyses, Appendable out) throws IOException {
    print(ELLIPTICITY_HEADER, summaryRows(analyses), out);
  }

  /**
   * Write the three per-file tables.
   *
   * @param analysis The analysis of one file.
   * @param ellipticityFile Destination of the ellipticity table.
   * @param axesFile Destination of the principal axis table.
   * @param atomsFile Destination of the annotated atom table.
   * @throws IOException If writing fails.
   */
  public static void writeFiles(FileAnalysis analysis, File ellipticityFile, File axesFile,
      File atomsFile) throws IOException {
    try (BufferedWriter bw = newWriter(ellipticityFile)) {
      writeEllipticities(analysis.results(), bw);
    }
    try (BufferedWriter bw = newWriter(axesFile)) {
      writeAxes(analysis.results(), bw);
    }
    try (BufferedWriter bw = newWriter(atomsFile)) {
      writeAtoms(analysis.atoms(), bw);
    }
  }

  /**
   * Write the summary table to a file.
   *
   * @param analyses The file analyses.
   * @param summaryFile The destination.
   * @throws IOException If writing fails.
   */
  public static void writeSummary(List<FileAnalysis> analyses, File summaryFile)
      throws IOException {
    try (BufferedWriter bw = newWriter(summaryFile)) {
      writeSummary(analyses, bw);
    }
  }

  private static BufferedWriter newWriter(File file) throws IOException {
    return Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
  }
}
