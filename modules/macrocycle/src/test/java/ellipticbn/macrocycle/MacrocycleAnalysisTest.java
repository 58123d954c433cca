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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import ellipticbn.macrocycle.parsers.EllipticityTableWriter;
import ellipticbn.macrocycle.parsers.XYZFilter;
import ellipticbn.utilities.EllipticbnTest;
import java.io.IOException;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.Test;

/**
 * Tests the per-file pipeline.
 */
public class MacrocycleAnalysisTest extends EllipticbnTest {

  private final MacrocycleAnalysis analysis = new MacrocycleAnalysis(MacrocycleProperties.defaults());

  private static MacrocycleAnalysis withFilter(double aspectRatioFilter) {
    return new MacrocycleAnalysis(new MacrocycleProperties(2.5, aspectRatioFilter, 2.9, 10, 20,
        1.3, 1.7));
  }

  @Test
  public void testDodecagon() throws InvalidInputException {
    FileAnalysis result = analysis.analyze("dodecagon.xyz", TestGeometry.dodecagon());
    assertEquals(1, result.molecules().size());
    assertEquals(1, result.ringCount());
    assertEquals(1, result.acceptedCount());

    EllipticityResult ring = result.results().get(0);
    assertEquals("0.0", ring.id());
    assertEquals("dodecagon.xyz", ring.file());
    assertEquals(12, ring.numCarbons());
    assertEquals(0.0, ring.ellipticity(), 1.0e-8);
    assertEquals(1.0, ring.aspectRatio(), 1.0e-8);

    for (AnnotatedAtom atom : result.atoms()) {
      assertEquals(0, atom.molecule());
      assertTrue(atom.ringCandidate());
      assertEquals("0.0", atom.ring());
      assertEquals(ReasonTag.ACCEPTED, atom.status());
    }
  }

  @Test
  public void testStretchedRing() throws InvalidInputException {
    // Stretching 3x on x breaks the C-C window, so the ring is given explicitly.
    List<Atom> atoms = TestGeometry.carbonRing(12, 3.0, 3.0, new double[3], 0);
    CandidateRing ring = new CandidateRing(0, 0, IntStream.range(0, 12).boxed().toList());

    RingOutcome rejected = withFilter(3.0).evaluate("stretched.xyz", atoms, ring);
    assertEquals(ReasonTag.ASPECT_RATIO, rejected.status());
    assertNull(rejected.result());

    RingOutcome accepted = withFilter(5.0).evaluate("stretched.xyz", atoms, ring);
    assertEquals(ReasonTag.ACCEPTED, accepted.status());
    assertTrue(accepted.result().ellipticity() > 0.0);
    assertEquals(2.0 / 3.0, accepted.result().ellipticity(), 1.0e-8);
  }

  @Test(expected = InvalidInputException.class)
  public void testRingWithMissingAtom() throws InvalidInputException {
    analysis.evaluate("dodecagon.xyz", TestGeometry.dodecagon(), new CandidateRing(0, 0, List.of(0, 1, 42)));
  }

  @Test
  public void testNoCarbons() throws InvalidInputException {
    List<Atom> atoms = TestGeometry.join(TestGeometry.water(new double[3], 0),
        TestGeometry.water(new double[] {10.0, 0.0, 0.0}, 3));
    FileAnalysis result = analysis.analyze("water.xyz", atoms);
    assertTrue(result.results().isEmpty());
    assertEquals(2, result.molecules().size());
    assertEquals(2, result.countSkipped(ReasonTag.TOO_FEW_CARBONS));
    for (AnnotatedAtom atom : result.atoms()) {
      assertFalse(atom.ringCandidate());
      assertNull(atom.ring());
      assertNull(atom.status());
    }
  }

  @Test(expected = InvalidInputException.class)
  public void testNoAtoms() throws InvalidInputException {
    analysis.analyze("empty.xyz", List.of());
  }

  @Test(expected = InvalidInputException.class)
  public void testDuplicateIndex() throws InvalidInputException {
    analysis.analyze("duplicate.xyz", List.of(new Atom(0, "C", 0, 0, 0), new Atom(0, "C", 1, 0, 0)));
  }

  @Test
  public void testMixture() throws IOException, InvalidInputException {
    List<Atom> atoms = XYZFilter.readFile(getResourceFile("ellipticbn/macrocycle/structures/mixture.xyz"));
    FileAnalysis result = analysis.analyze("mixture.xyz", atoms);

    // The ring with its carbonyl arm, then two waters.
    assertEquals(3, result.molecules().size());
    MoleculeReport host = result.molecules().get(0);
    assertFalse(host.isSkipped());
    assertEquals(12, host.nRingCarbons());
    assertEquals(1, host.acceptedCount());
    assertEquals(ReasonTag.TOO_FEW_CARBONS, result.molecules().get(1).skipped());
    assertEquals(ReasonTag.TOO_FEW_CARBONS, result.molecules().get(2).skipped());

    List<AnnotatedAtom> table = result.atoms();
    assertEquals(atoms.size(), table.size());
    // The arm carbons are within the oxygen cutoff.
    assertFalse(table.get(12).ringCandidate());
    assertFalse(table.get(13).ringCandidate());
    assertNull(table.get(12).ring());
    assertEquals("0.0", table.get(0).ring());
    assertEquals(1, table.get(15).molecule());
    assertEquals(2, table.get(18).molecule());
  }

  @Test
  public void testTwoHosts() throws InvalidInputException {
    List<Atom> atoms = TestGeometry.join(TestGeometry.dodecagon(),
        TestGeometry.carbonRing(12, 3.0, 1.0, new double[] {0.0, 0.0, 15.0}, 12));
    FileAnalysis result = analysis.analyze("pair.xyz", atoms);
    assertEquals(2, result.acceptedCount());
    assertEquals("0.0", result.results().get(0).id());
    assertEquals("1.0", result.results().get(1).id());
    assertEquals(15.0, result.results().get(1).axes().getCentroid()[2], 1.0e-10);
  }

  @Test
  public void testInvariantToRigidMotion() throws InvalidInputException {
    List<Atom> ring = TestGeometry.carbonRing(12, 3.0, 1.05, new double[3], 0);
    double reference = analysis.analyze("a.xyz", ring).results().get(0).ellipticity();
    List<Atom> moved = TestGeometry.transform(ring, 1.0, 0.4, 1.0, new double[] {3.0, -7.0, 2.0});
    assertEquals(reference, analysis.analyze("b.xyz", moved).results().get(0).ellipticity(), 1.0e-8);
  }

  @Test
  public void testDeterministicTables() throws IOException, InvalidInputException {
    List<Atom> atoms = XYZFilter.readFile(getResourceFile("ellipticbn/macrocycle/structures/mixture.xyz"));
    StringBuilder first = new StringBuilder();
    StringBuilder second = new StringBuilder();
    EllipticityTableWriter.writeEllipticities(analysis.analyze("mixture.xyz", atoms).results(), first);
    EllipticityTableWriter.writeEllipticities(analysis.analyze("mixture.xyz", atoms).results(), second);
    assertEquals(first.toString(), second.toString());
  }
}
