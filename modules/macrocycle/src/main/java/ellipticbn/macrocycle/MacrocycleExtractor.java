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

import static ellipticbn.numerics.math.DoubleMath.dist;
import static java.lang.String.format;

import ellipticbn.macrocycle.graph.BondGraph;
import ellipticbn.macrocycle.graph.CycleBasis;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Isolates the macrocycle of a molecule.
 * <p>
 * Carbons bonded to (or near) an oxygen are removed first, since the carbonyl and ether carbons
 * of a cucurbituril sit outside its central ring. The remaining carbons are connected by the C-C
 * bond length window, and the rings are the cycles of a minimum cycle basis of that graph whose
 * size is allowed.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MacrocycleExtractor {

  private static final Logger logger = Logger.getLogger(MacrocycleExtractor.class.getName());

  private final MacrocycleProperties properties;

  public MacrocycleExtractor(MacrocycleProperties properties) {
    this.properties = properties;
  }

  /**
   * Keep the carbons whose distance to every oxygen of the molecule is greater than the oxygen
   * cutoff.
   *
   * @param molecule The molecule.
   * @return the ring carbon candidates sorted by index.
   */
  public List<Atom> ringCarbons(Molecule molecule) {
    double cutoff = properties.getOxygenDistCutoff();
    List<Atom> oxygens = molecule.atoms().stream().filter(Atom::isOxygen).toList();
    List<Atom> carbons = new ArrayList<>();
    for (Atom atom : molecule.atoms()) {
      if (!atom.isCarbon()) {
        continue;
      }
      double[] xyz = atom.getXYZ();
      boolean farFromOxygen = true;
      for (Atom oxygen : oxygens) {
        if (dist(xyz, oxygen.getXYZ()) <= cutoff) {
          farFromOxygen = false;
          break;
        }
      }
      if (farFromOxygen) {
        carbons.add(atom);
      }
    }
    return carbons;
  }

  /**
   * Find the candidate rings of a molecule.
   *
   * @param molecule The molecule.
   * @return the rings, at least one.
   * @throws InsufficientAtomsException If too few carbons survive the oxygen filter, or no cycle
   *     has an allowed size.
   */
  public List<CandidateRing> extract(Molecule molecule) throws InsufficientAtomsException {
    List<Atom> carbons = ringCarbons(molecule);
    int nCarbons = carbons.size();
    if (nCarbons < properties.getMinNumCarbons()) {
      throw new InsufficientAtomsException(molecule.number(), ReasonTag.TOO_FEW_CARBONS, nCarbons);
    }

    BondGraph carbonGraph = BondGraph.connect(carbons, properties::isRingBond);
    CycleBasis cycleBasis = CycleBasis.minimumCycleBasis(carbonGraph);

    List<CandidateRing> rings = new ArrayList<>();
    for (List<Integer> cycle : cycleBasis.getCycles()) {
      if (properties.isAllowedRingSize(cycle.size())) {
        rings.add(new CandidateRing(molecule.number(), rings.size(), cycle));
      } else if (logger.isLoggable(Level.FINER)) {
        logger.finer(format(" Molecule %d: skipping a %d-membered cycle.", molecule.number(),
            cycle.size()));
      }
    }

    if (rings.isEmpty()) {
      throw new InsufficientAtomsException(molecule.number(), ReasonTag.NO_RINGS, nCarbons);
    }
    logger.fine(format(" Molecule %d: %d ring carbons, %d cycles, %d candidate rings.",
        molecule.number(), nCarbons, cycleBasis.size(), rings.size()));
    return rings;
  }
}
