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
import static org.junit.Assert.assertTrue;

import ellipticbn.numerics.PrincipalAxes;
import ellipticbn.utilities.EllipticbnTest;
import java.util.List;
import org.junit.Test;

/**
 * Tests the ellipticity measure.
 */
public class EllipticityCalculatorTest extends EllipticbnTest {

  private static final double tolerance = 1.0e-10;

  private static double ellipticity(List<Atom> atoms) {
    double[][] points = atoms.stream().map(Atom::getXYZ).toArray(double[][]::new);
    return EllipticityCalculator.ellipticity(PrincipalAxes.fit(points));
  }

  @Test
  public void testRegularPolygonIsCircular() {
    assertEquals(0.0, ellipticity(TestGeometry.dodecagon()), tolerance);
    assertEquals(0.0, ellipticity(TestGeometry.carbonRing(7, 2.0, 1.0, new double[3], 0)), tolerance);
  }

  @Test
  public void testStretchIncreasesEllipticity() {
    double previous = -1.0;
    for (double stretch = 1.0; stretch <= 4.0; stretch += 0.5) {
      double e = ellipticity(TestGeometry.carbonRing(12, 3.0, stretch, new double[3], 0));
      assertTrue(e > previous);
      assertEquals(1.0 - 1.0 / stretch, e, 1.0e-8);
      previous = e;
    }
  }

  @Test
  public void testRotationAndScaleInvariance() {
    List<Atom> ring = TestGeometry.carbonRing(14, 3.0, 1.8, new double[] {1.0, 2.0, 3.0}, 0);
    double reference = ellipticity(ring);
    double moved = ellipticity(TestGeometry.transform(ring, 0.7, -1.3, 2.5, new double[] {-4.0, 5.0, 6.0}));
    assertEquals(reference, moved, 1.0e-8);
  }

  @Test
  public void testAtomOrderInvariance() {
    List<Atom> ring = TestGeometry.carbonRing(12, 3.0, 1.5, new double[3], 0);
    List<Atom> shuffled = List.of(ring.get(5), ring.get(0), ring.get(11), ring.get(2), ring.get(7),
        ring.get(1), ring.get(9), ring.get(3), ring.get(10), ring.get(4), ring.get(8), ring.get(6));
    assertEquals(ellipticity(ring), ellipticity(shuffled), tolerance);
  }

  @Test
  public void testResult() {
    List<Atom> ring = TestGeometry.carbonRing(12, 3.0, 2.0, new double[3], 0);
    double[][] points = ring.stream().map(Atom::getXYZ).toArray(double[][]::new);
    CandidateRing candidate = new CandidateRing(1, 2, List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));
    EllipticityResult result = EllipticityCalculator.calculate("ring.xyz", candidate,
        PrincipalAxes.fit(points));
    assertEquals("1.2", result.id());
    assertEquals(1, result.molecule());
    assertEquals(12, result.numCarbons());
    assertEquals(2.0, result.aspectRatio(), 1.0e-8);
    assertEquals(0.5, result.ellipticity(), 1.0e-8);
  }
}
