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

import ellipticbn.macrocycle.FileAnalysis;
import ellipticbn.macrocycle.InvalidInputException;
import ellipticbn.macrocycle.MacrocycleAnalysis;
import ellipticbn.macrocycle.MacrocycleProperties;
import ellipticbn.macrocycle.TestGeometry;
import ellipticbn.utilities.EllipticbnTest;
import java.io.IOException;
import java.util.List;
import org.junit.Test;

/**
 * Tests the CSV tables.
 */
public class EllipticityTableWriterTest extends EllipticbnTest {

  private final MacrocycleAnalysis analysis = new MacrocycleAnalysis(MacrocycleProperties.defaults());

  private FileAnalysis dodecagon(String file) throws InvalidInputException {
    return analysis.analyze(file, TestGeometry.dodecagon());
  }

  private static String[] lines(StringBuilder sb) {
    return sb.toString().split("\n");
  }

  @Test
  public void testEllipticityTable() throws IOException, InvalidInputException {
    StringBuilder sb = new StringBuilder();
    EllipticityTableWriter.writeEllipticities(dodecagon("ring.xyz").results(), sb);
    String[] lines = lines(sb);
    assertEquals(2, lines.length);
    assertEquals("id,file,molecule,ring,num_carbons,ellipticity,aspect_ratio,centroid_x,centroid_y,"
        + "centroid_z,atoms", lines[0]);
    assertTrue(lines[1].startsWith("0.0,ring.xyz,0,0,12,0.000000,1.000000,"));
    assertTrue(lines[1].endsWith(",0 1 2 3 4 5 6 7 8 9 10 11"));
  }

  @Test
  public void testAxesTable() throws IOException, InvalidInputException {
    StringBuilder sb = new StringBuilder();
    EllipticityTableWriter.writeAxes(dodecagon("ring.xyz").results(), sb);
    String[] lines = lines(sb);
    assertEquals(4, lines.length);
    assertEquals("id,axis,x,y,z,length", lines[0]);
    assertTrue(lines[1].startsWith("0.0,major,"));
    assertTrue(lines[1].endsWith(",3.000000"));
    assertTrue(lines[2].startsWith("0.0,minor,"));
    assertTrue(lines[3].startsWith("0.0,normal,"));
    assertTrue(lines[3].endsWith(",0.000000"));
  }

  @Test
  public void testAtomTable() throws IOException, InvalidInputException {
    FileAnalysis result = analysis.analyze("mixed.xyz", TestGeometry.join(TestGeometry.dodecagon(),
        TestGeometry.water(new double[] {20.0, 0.0, 0.0}, 12)));
    StringBuilder sb = new StringBuilder();
    EllipticityTableWriter.writeAtoms(result.atoms(), sb);
    String[] lines = lines(sb);
    assertEquals(16, lines.length);
    assertEquals("index,element,x,y,z,molecule,ring_candidate,ring,status", lines[0]);
    assertEquals("0,C,3.000000,0.000000,0.000000,0,true,0.0,accepted", lines[1]);
    assertEquals("12,O,20.000000,0.000000,0.000000,1,false,,none", lines[13]);
  }

  @Test
  public void testSummaryConcatenatesFiles() throws IOException, InvalidInputException {
    StringBuilder sb = new StringBuilder();
    EllipticityTableWriter.writeSummary(List.of(dodecagon("first.xyz"), dodecagon("second.xyz")), sb);
    String[] lines = lines(sb);
    assertEquals(3, lines.length);
    assertTrue(lines[1].startsWith("0.0,first.xyz,"));
    assertTrue(lines[2].startsWith("0.0,second.xyz,"));
  }

  @Test
  public void testRowsKeepFullPrecision() throws InvalidInputException {
    List<Object[]> rows = EllipticityTableWriter.axisRows(dodecagon("ring.xyz").results());
    assertEquals(3, rows.size());
    assertEquals("major", rows.get(0)[1]);
    assertTrue(rows.get(0)[5] instanceof Double);
    assertEquals(3.0, (Double) rows.get(0)[5], 1.0e-10);
  }

  @Test
  public void testEmptyTable() throws IOException {
    StringBuilder sb = new StringBuilder();
    EllipticityTableWriter.writeEllipticities(List.of(), sb);
    assertEquals(1, lines(sb).length);
  }
}
