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

import ellipticbn.macrocycle.graph.BondGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.logging.Logger;

/**
 * Splits the atoms of one input file into molecules: the connected components of the bond graph
 * built with the bond distance.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MoleculeSeparator {

  private static final Logger logger = Logger.getLogger(MoleculeSeparator.class.getName());

  private MoleculeSeparator() {
  }

  /**
   * Separate atoms into molecules.
   *
   * @param atoms The atoms of one file.
   * @param bondDist Atoms closer than this distance are bonded.
   * @return the molecules, numbered in order of their smallest atom index.
   * @throws InvalidInputException If there are no atoms or the bond distance is not positive.
   */
  public static List<Molecule> separate(List<Atom> atoms, double bondDist)
      throws InvalidInputException {
    BondGraph bondGraph = BondGraph.bondGraph(atoms, bondDist);
    Map<Integer, Atom> byIndex = new HashMap<>();
    for (Atom atom : atoms) {
      byIndex.put(atom.index(), atom);
    }

    List<SortedSet<Integer>> components = bondGraph.connectedComponents();
    List<Molecule> molecules = new ArrayList<>(components.size());
    for (SortedSet<Integer> component : components) {
      List<Atom> members = new ArrayList<>(component.size());
      for (int index : component) {
        members.add(byIndex.get(index));
      }
      molecules.add(new Molecule(molecules.size(), members));
    }

    logger.fine(format(" %s separated into %d molecules.", bondGraph, molecules.size()));
    return molecules;
  }
}
