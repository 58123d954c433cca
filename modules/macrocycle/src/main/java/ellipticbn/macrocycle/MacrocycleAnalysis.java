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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The per-file pipeline: molecule separation, macrocycle extraction, the shape filter and
 * ellipticity. It performs no I/O and keeps no state between files, so one instance may be shared
 * by concurrent tasks.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MacrocycleAnalysis {

  private static final Logger logger = Logger.getLogger(MacrocycleAnalysis.class.getName());

  private final MacrocycleProperties properties;
  private final MacrocycleExtractor extractor;
  private final ShapeFilter shapeFilter;

  public MacrocycleAnalysis(MacrocycleProperties properties) {
    this.properties = properties;
    extractor = new MacrocycleExtractor(properties);
    shapeFilter = new ShapeFilter(properties.getAspectRatioFilter());
  }

  public MacrocycleProperties getProperties() {
    return properties;
  }

  /**
   * Analyze the atoms of one file.
   *
   * @param file The file identifier written to the result rows.
   * @param atoms The atoms of the file.
   * @return the analysis.
   * @throws InvalidInputException If there are no atoms or two atoms share an index.
   */
  public FileAnalysis analyze(String file, List<Atom> atoms) throws InvalidInputException {
    Map<Integer, Atom> byIndex = indexAtoms(atoms);
    List<Molecule> molecules = MoleculeSeparator.separate(atoms, properties.getBondDist());

    List<MoleculeReport> reports = new ArrayList<>(molecules.size());
    List<EllipticityResult> results = new ArrayList<>();
    Map<Integer, Integer> moleculeOf = new HashMap<>();
    Set<Integer> ringCandidates = new HashSet<>();
    Map<Integer, RingOutcome> ringOf = new HashMap<>();

    for (Molecule molecule : molecules) {
      for (Atom atom : molecule.atoms()) {
        moleculeOf.put(atom.index(), molecule.number());
      }
      List<Atom> carbons = extractor.ringCarbons(molecule);
      carbons.forEach(c -> ringCandidates.add(c.index()));

      List<CandidateRing> rings;
      try {
        rings = extractor.extract(molecule);
      } catch (InsufficientAtomsException e) {
        logger.fine(format(" %s%s", file, e.getMessage()));
        reports.add(new MoleculeReport(molecule, e.nCarbons, List.of(), e.reason));
        continue;
      }

      List<RingOutcome> outcomes = new ArrayList<>(rings.size());
      for (CandidateRing ring : rings) {
        RingOutcome outcome = evaluate(file, byIndex, ring);
        outcomes.add(outcome);
        if (outcome.isAccepted()) {
          results.add(outcome.result());
        }
        for (int index : ring.atoms()) {
          RingOutcome current = ringOf.get(index);
          // An atom shared by fused rings is labelled with its first accepted ring.
          if (current == null || (!current.isAccepted() && outcome.isAccepted())) {
            ringOf.put(index, outcome);
          }
        }
      }
      reports.add(new MoleculeReport(molecule, carbons.size(), outcomes, null));
    }

    List<AnnotatedAtom> table = new ArrayList<>(atoms.size());
    for (Atom atom : atoms) {
      RingOutcome ring = ringOf.get(atom.index());
      table.add(new AnnotatedAtom(atom, moleculeOf.get(atom.index()),
          ringCandidates.contains(atom.index()),
          ring == null ? null : ring.ring().id(),
          ring == null ? null : ring.status()));
    }

    FileAnalysis analysis = new FileAnalysis(file, reports, results, table);
    logger.fine(analysis.toString());
    return analysis;
  }

  /**
   * Apply the shape filter to one candidate ring and compute its ellipticity if it passes.
   *
   * @param file The file identifier written to the result row.
   * @param atoms The atoms the ring indices refer to.
   * @param ring The candidate ring.
   * @return the outcome.
   * @throws InvalidInputException If two atoms share an index or the ring refers to a missing
   *     atom.
   */
  public RingOutcome evaluate(String file, List<Atom> atoms, CandidateRing ring)
      throws InvalidInputException {
    Map<Integer, Atom> byIndex = indexAtoms(atoms);
    for (int index : ring.atoms()) {
      if (!byIndex.containsKey(index)) {
        throw new InvalidInputException(format(" Ring %s refers to missing atom %d.", ring.id(), index));
      }
    }
    return evaluate(file, byIndex, ring);
  }

  private RingOutcome evaluate(String file, Map<Integer, Atom> byIndex, CandidateRing ring) {
    double[][] points = new double[ring.size()][];
    for (int i = 0; i < ring.size(); i++) {
      points[i] = byIndex.get(ring.atoms().get(i)).getXYZ();
    }
    ShapeAssessment assessment = shapeFilter.assess(points);
    EllipticityResult result = null;
    if (assessment.isAccepted()) {
      result = EllipticityCalculator.calculate(file, ring, assessment.axes());
    }
    logger.fine(format(" %s ring %s: %d carbons, aspect ratio %8.4f, %s", file, ring.id(),
        ring.size(), assessment.aspectRatio(), assessment.status().tag()));
    return new RingOutcome(ring, assessment, result);
  }

  private static Map<Integer, Atom> indexAtoms(List<Atom> atoms) throws InvalidInputException {
    if (atoms.isEmpty()) {
      throw new InvalidInputException(" No atoms were found.");
    }
    Map<Integer, Atom> byIndex = new HashMap<>();
    for (Atom atom : atoms) {
      if (byIndex.put(atom.index(), atom) != null) {
        throw new InvalidInputException(format(" Atom index %d appears more than once.", atom.index()));
      }
    }
    return byIndex;
  }
}
