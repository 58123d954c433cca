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

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.getExtension;
import static org.apache.commons.io.FilenameUtils.getName;

import ellipticbn.macrocycle.Atom;
import ellipticbn.macrocycle.EllipticityBatch;
import ellipticbn.macrocycle.FileAnalysis;
import ellipticbn.macrocycle.FileOutcome;
import ellipticbn.macrocycle.InvalidInputException;
import ellipticbn.macrocycle.MacrocycleAnalysis;
import ellipticbn.macrocycle.MacrocycleProperties;
import ellipticbn.macrocycle.ReasonTag;
import ellipticbn.macrocycle.cli.MacrocycleOptions;
import ellipticbn.macrocycle.parsers.EllipticityTableWriter;
import ellipticbn.macrocycle.parsers.EllipticityWorkbookWriter;
import ellipticbn.macrocycle.parsers.XYZFilter;
import ellipticbn.utilities.EllipticbnBinding;
import ellipticbn.utilities.EllipticbnCommand;
import ellipticbn.utilities.FileUtils;
import ellipticbn.utilities.PropertyLoader;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Find the macrocycles in XYZ files and measure their ellipticity.
 * <p>
 * Usage:
 * <p>
 * ellipticbn Ellipticity [options] &lt;filename&gt; [&lt;filename&gt; ...]
 */
@Command(name = "Ellipticity", description = " Find macrocycles in XYZ files and compute their ellipticity.")
public class Ellipticity extends EllipticbnCommand {

  /** Suffix of the per-file ellipticity table. */
  public static final String ELLIPTICITY_SUFFIX = ".ellipticity.csv";
  /** Suffix of the per-file principal axis table. */
  public static final String AXES_SUFFIX = ".axes.csv";
  /** Suffix of the per-file annotated atom table. */
  public static final String ATOMS_SUFFIX = ".atoms.csv";
  /** Suffix of the per-file workbook holding all three tables. */
  public static final String WORKBOOK_SUFFIX = ".xlsx";

  @Mixin
  private MacrocycleOptions macrocycleOptions = new MacrocycleOptions();

  /** -d or --outputDir Directory for the output tables. */
  @Option(names = {"-d", "--outputDir"}, paramLabel = ".", defaultValue = ".",
      description = "Write the output tables to this directory.")
  private String outputDir = ".";

  /** -s or --summaryFile Summary table (.xlsx or .csv) written when more than one file is given. */
  @Option(names = {"-s", "--summaryFile"}, paramLabel = "summary.xlsx", defaultValue = "summary.xlsx",
      description = "Summary of all rings (.xlsx or .csv), written when more than one file is given.")
  private String summaryFile = "summary.xlsx";

  /** --overwrite Replace existing output files. */
  @Option(names = {"--overwrite"}, paramLabel = "false", defaultValue = "false",
      description = "Overwrite existing output files.")
  private boolean overwrite = false;

  /** -t or --threads Number of files processed concurrently. */
  @Option(names = {"-t", "--threads"}, paramLabel = "1",
      description = "Number of files processed concurrently.")
  private Integer threads = null;

  /** The final arguments are XYZ coordinate files. */
  @Parameters(arity = "0..*", paramLabel = "files",
      description = "XYZ coordinate files.")
  private List<String> filenames = null;

  private List<FileOutcome> outcomes = new ArrayList<>();
  private int exitStatus = 0;

  public Ellipticity() {
    super();
  }

  public Ellipticity(EllipticbnBinding binding) {
    super(binding);
  }

  public Ellipticity(String[] args) {
    super(args);
  }

  @Override
  public Ellipticity run() {
    if (!init()) {
      return this;
    }

    if (filenames == null || filenames.isEmpty()) {
      logger.warning(" No input files were specified.");
      logger.info(helpString());
      exitStatus = 1;
      return this;
    }

    List<File> files = filenames.stream().map(File::new).toList();
    File outputDirectory = new File(outputDir);

    // Settings for every file are validated before any file is processed.
    Map<File, MacrocycleProperties> properties = new LinkedHashMap<>();
    try {
      for (File file : files) {
        properties.put(file, macrocycleOptions.toProperties(PropertyLoader.loadProperties(file)));
      }
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Invalid settings:%s", e.getMessage()));
      exitStatus = 1;
      return this;
    }
    if (logger.isLoggable(Level.FINE)) {
      properties.forEach((file, p) -> logger.fine(format(" %s\n%s", file, p)));
    }

    File summary = null;
    try {
      FileUtils.prepareOutputDirectory(outputDirectory, overwrite);
      if (files.size() > 1) {
        String extension = getExtension(summaryFile);
        if (!"xlsx".equalsIgnoreCase(extension) && !"csv".equalsIgnoreCase(extension)) {
          logger.warning(
              format(" The summary file %s must have a .xlsx or .csv extension.", summaryFile));
          exitStatus = 1;
          return this;
        }
        summary = FileUtils.resolveOutputFile(summaryFile, outputDirectory, overwrite);
      }
    } catch (FileAlreadyExistsException e) {
      logger.warning(format(" %s: %s (use --overwrite to replace it).", e.getFile(), e.getReason()));
      exitStatus = 1;
      return this;
    } catch (IOException e) {
      logger.warning(format(" The output location could not be prepared: %s", e));
      exitStatus = 1;
      return this;
    }

    int nThreads = threads != null ? threads : EllipticityBatch.defaultThreads();
    EllipticityBatch batch;
    try {
      batch = new EllipticityBatch(nThreads);
    } catch (IllegalArgumentException e) {
      logger.warning(e.getMessage());
      exitStatus = 1;
      return this;
    }

    logger.info(format("\n Processing %d file(s) into %s.", files.size(), outputDirectory));
    // Inputs with the same file name would write the same outputs; only the first one runs.
    Set<String> roots = new HashSet<>();
    List<File> unique = new ArrayList<>();
    Map<Integer, FileOutcome> duplicates = new HashMap<>();
    for (int i = 0; i < files.size(); i++) {
      File file = files.get(i);
      if (roots.add(getName(file.getPath()))) {
        unique.add(file);
      } else {
        duplicates.put(i, FileOutcome.failure(file, ReasonTag.OUTPUT_EXISTS,
            format(" %s has the same file name as an earlier input.", file)));
      }
    }

    Iterator<FileOutcome> processed = batch.run(unique,
        file -> process(file, properties.get(file), outputDirectory)).iterator();
    outcomes = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      FileOutcome duplicate = duplicates.get(i);
      outcomes.add(duplicate != null ? duplicate : processed.next());
    }

    List<FileAnalysis> analyses = new ArrayList<>();
    int failed = 0;
    for (FileOutcome outcome : outcomes) {
      if (outcome.isSuccess()) {
        analyses.add(outcome.analysis());
      } else {
        failed++;
        logger.warning(format(" %s failed (%s):%s", outcome.file(), outcome.failure().tag(),
            outcome.message()));
      }
    }

    if (summary != null && !analyses.isEmpty()) {
      try {
        if ("xlsx".equalsIgnoreCase(getExtension(summary.getName()))) {
          EllipticityWorkbookWriter.writeSummary(analyses, summary);
        } else {
          EllipticityTableWriter.writeSummary(analyses, summary);
        }
        logger.info(format(" Summary written to %s.", summary));
      } catch (IOException e) {
        logger.warning(format(" The summary %s could not be written: %s", summary, e));
        failed = outcomes.size();
        analyses.clear();
      }
    }

    int rings = analyses.stream().mapToInt(FileAnalysis::ringCount).sum();
    int accepted = analyses.stream().mapToInt(FileAnalysis::acceptedCount).sum();
    logger.info(format("\n Batch summary: %d of %d files succeeded, %d rings found, %d accepted.",
        analyses.size(), outcomes.size(), rings, accepted));

    if (failed > 0 && analyses.isEmpty()) {
      exitStatus = 1;
    }

    binding.setVariable("outcomes", outcomes);
    binding.setVariable("analyses", analyses);
    return this;
  }

  /**
   * Analyze one file and write its tables.
   */
  private FileOutcome process(File file, MacrocycleProperties settings, File outputDirectory) {
    String root = getName(file.getPath());
    File ellipticityFile;
    File axesFile;
    File atomsFile;
    File workbookFile;
    try {
      ellipticityFile = FileUtils.resolveOutputFile(root + ELLIPTICITY_SUFFIX, outputDirectory, overwrite);
      axesFile = FileUtils.resolveOutputFile(root + AXES_SUFFIX, outputDirectory, overwrite);
      atomsFile = FileUtils.resolveOutputFile(root + ATOMS_SUFFIX, outputDirectory, overwrite);
      workbookFile = FileUtils.resolveOutputFile(root + WORKBOOK_SUFFIX, outputDirectory, overwrite);
    } catch (FileAlreadyExistsException e) {
      return FileOutcome.failure(file, ReasonTag.OUTPUT_EXISTS,
          format(" %s already exists (use --overwrite to replace it).", e.getFile()));
    } catch (IOException e) {
      return FileOutcome.failure(file, ReasonTag.IO_ERROR, " " + e);
    }

    FileAnalysis analysis;
    try {
      List<Atom> atoms = XYZFilter.readFile(file);
      analysis = new MacrocycleAnalysis(settings).analyze(file.getPath(), atoms);
    } catch (InvalidInputException e) {
      return FileOutcome.failure(file, ReasonTag.INVALID_INPUT, e.getMessage());
    } catch (IOException e) {
      return FileOutcome.failure(file, ReasonTag.IO_ERROR, " " + e);
    }

    try {
      EllipticityTableWriter.writeFiles(analysis, ellipticityFile, axesFile, atomsFile);
      EllipticityWorkbookWriter.writeWorkbook(analysis, workbookFile);
    } catch (IOException e) {
      return FileOutcome.failure(file, ReasonTag.IO_ERROR, " " + e);
    }
    logger.info(analysis.toString());
    return FileOutcome.success(file, analysis);
  }

  /**
   * @return the outcome of each input file, in input order.
   */
  public List<FileOutcome> getOutcomes() {
    return outcomes;
  }

  @Override
  public int getExitStatus() {
    return exitStatus;
  }
}
