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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import ellipticbn.macrocycle.Atom;
import ellipticbn.macrocycle.InvalidInputException;
import ellipticbn.utilities.EllipticbnTest;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import org.junit.Test;

/**
 * Tests reading XYZ files.
 */
public class XYZFilterTest extends EllipticbnTest {

  private static List<Atom> read(String text) throws IOException, InvalidInputException {
    return XYZFilter.read(new BufferedReader(new StringReader(text)), "test.xyz");
  }

  @Test
  public void testReadFile() throws IOException, InvalidInputException {
    List<Atom> atoms = XYZFilter.readFile(getResourceFile("ellipticbn/macrocycle/structures/dodecagon.xyz"));
    assertEquals(12, atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      assertEquals(i, atoms.get(i).index());
      assertTrue(atoms.get(i).isCarbon());
    }
    assertEquals(3.0, atoms.get(0).x(), 1.0e-6);
    assertEquals(0.0, atoms.get(0).y(), 1.0e-6);
    assertEquals(3.0, atoms.get(3).y(), 1.0e-6);
  }

  @Test
  public void testExtraColumnsAndBlankLines() throws IOException, InvalidInputException {
    List<Atom> atoms = read("2\n\nC 0.0 0.0 0.0 -0.1\n  O\t1.2 0.0 0.0\n\n\n");
    assertEquals(2, atoms.size());
    assertEquals("O", atoms.get(1).element());
    assertEquals(1.2, atoms.get(1).x(), 0.0);
  }

  @Test
  public void testFirstFrameOfTrajectory() throws IOException, InvalidInputException {
    List<Atom> atoms = read("1\nframe 1\nC 0 0 0\n1\nframe 2\nC 1 1 1\n");
    assertEquals(1, atoms.size());
    assertEquals(0.0, atoms.get(0).x(), 0.0);
  }

  @Test(expected = InvalidInputException.class)
  public void testMalformedFile() throws IOException, InvalidInputException {
    XYZFilter.readFile(getResourceFile("ellipticbn/macrocycle/structures/malformed.xyz"));
  }

  @Test(expected = InvalidInputException.class)
  public void testEmpty() throws IOException, InvalidInputException {
    read("");
  }

  @Test(expected = InvalidInputException.class)
  public void testBadCount() throws IOException, InvalidInputException {
    read("twelve\ncomment\nC 0 0 0\n");
  }

  @Test(expected = InvalidInputException.class)
  public void testZeroAtoms() throws IOException, InvalidInputException {
    read("0\ncomment\n");
  }

  @Test(expected = InvalidInputException.class)
  public void testTooFewAtomLines() throws IOException, InvalidInputException {
    read("3\ncomment\nC 0 0 0\nC 1 0 0\n");
  }

  @Test(expected = InvalidInputException.class)
  public void testMissingCoordinate() throws IOException, InvalidInputException {
    read("1\ncomment\nC 0 0\n");
  }

  @Test(expected = InvalidInputException.class)
  public void testNonFiniteCoordinate() throws IOException, InvalidInputException {
    read("1\ncomment\nC 0 NaN 0\n");
  }
}
