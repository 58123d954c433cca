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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import ellipticbn.utilities.EllipticbnTest;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.Test;

/**
 * Tests the batch runner.
 */
public class EllipticityBatchTest extends EllipticbnTest {

  @Test
  public void testOutcomesInInputOrder() {
    List<File> files = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      files.add(new File("file" + i + ".xyz"));
    }
    List<FileOutcome> outcomes = new EllipticityBatch(4).run(files, file -> {
      try {
        // Later files finish first.
        Thread.sleep(40 - 2L * files.indexOf(file));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return FileOutcome.failure(file, ReasonTag.INVALID_INPUT, file.getName());
    });
    assertEquals(files.size(), outcomes.size());
    for (int i = 0; i < files.size(); i++) {
      assertEquals(files.get(i), outcomes.get(i).file());
    }
  }

  @Test
  public void testFailureDoesNotAbortBatch() {
    // The exception is logged at WARNING.
    Logger.getLogger(EllipticityBatch.class.getName()).setLevel(Level.OFF);
    List<File> files = List.of(new File("a.xyz"), new File("b.xyz"), new File("c.xyz"));
    List<FileOutcome> outcomes = new EllipticityBatch(2).run(files, file -> {
      if (file.getName().equals("b.xyz")) {
        throw new IllegalStateException("unexpected");
      }
      return FileOutcome.success(file, new FileAnalysis(file.getName(), List.of(), List.of(), List.of()));
    });
    Logger.getLogger(EllipticityBatch.class.getName()).setLevel(null);
    assertTrue(outcomes.get(0).isSuccess());
    assertFalse(outcomes.get(1).isSuccess());
    assertEquals(ReasonTag.IO_ERROR, outcomes.get(1).failure());
    assertTrue(outcomes.get(2).isSuccess());
  }

  @Test
  public void testNoFiles() {
    assertTrue(new EllipticityBatch(1).run(List.of(), file -> null).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidThreads() {
    new EllipticityBatch(0);
  }

  @Test
  public void testDefaultThreads() {
    System.setProperty(EllipticityBatch.THREADS_PROPERTY, "3");
    assertEquals(3, EllipticityBatch.defaultThreads());
    System.clearProperty(EllipticityBatch.THREADS_PROPERTY);
    assertEquals(1, EllipticityBatch.defaultThreads());
  }
}
