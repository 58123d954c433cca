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

package ellipticbn.macrocycle;

import static java.lang.String.format;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one task per input file on a fixed thread pool and collects the outcomes in input order. A
 * task that throws is recorded as a failure of its file; the other files continue.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class EllipticityBatch {

  private static final Logger logger = Logger.getLogger(EllipticityBatch.class.getName());

  /** System property for the default number of worker threads. */
  public static final String THREADS_PROPERTY = "ellipticbn.threads";

  private final int nThreads;

  /**
   * @param nThreads Number of worker threads (at least 1).
   */
  public EllipticityBatch(int nThreads) {
    if (nThreads < 1) {
      throw new IllegalArgumentException(format(" The number of threads must be positive (found %d).", nThreads));
    }
    this.nThreads = nThreads;
  }

  /**
   * @return the thread count from the ellipticbn.threads system property, or 1.
   */
  public static int defaultThreads() {
    return Integer.getInteger(THREADS_PROPERTY, 1);
  }

  public int getThreads() {
    return nThreads;
  }

  /**
   * Process the files.
   *
   * @param files The input files.
   * @param task Processes one file.
   * @return one outcome per file, in input order.
   */
  public List<FileOutcome> run(List<File> files, Function<File, FileOutcome> task) {
    List<FileOutcome> outcomes = new ArrayList<>(files.size());
    if (files.isEmpty()) {
      return outcomes;
    }
    int poolSize = Math.min(nThreads, files.size());
    logger.fine(format(" Processing %d files with %d threads.", files.size(), poolSize));
    ExecutorService executor = Executors.newFixedThreadPool(poolSize);
    try {
      List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
      for (File file : files) {
        futures.add(executor.submit(() -> task.apply(file)));
      }
      for (int i = 0; i < files.size(); i++) {
        outcomes.add(collect(files.get(i), futures.get(i)));
      }
    } finally {
      executor.shutdownNow();
    }
    return outcomes;
  }

  private static FileOutcome collect(File file, Future<FileOutcome> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" The batch was interrupted.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      logger.log(Level.WARNING, format(" %s failed.", file), cause);
      return FileOutcome.failure(file, ReasonTag.IO_ERROR, String.valueOf(cause.getMessage()));
    }
  }
}
