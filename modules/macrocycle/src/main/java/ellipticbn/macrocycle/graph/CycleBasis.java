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

package ellipticbn.macrocycle.graph;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.openscience.cdk.graph.MinimumCycleBasis;

/**
 * Minimum cycle basis of a bond graph, computed with the CDK {@link MinimumCycleBasis}.
 * <p>
 * CDK works on a compact adjacency list over vertex positions 0..n-1; atom indices are mapped
 * onto positions in ascending order and back again.
 * <p>
 * Each cycle is returned as a vertex walk that starts at its smallest index and continues toward
 * the smaller of that vertex's two cycle neighbors. Cycles are ordered by length, then by walk, so
 * the basis is deterministic.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class CycleBasis {

  private static final Logger logger = Logger.getLogger(CycleBasis.class.getName());

  private final List<List<Integer>> cycles;

  private CycleBasis(List<List<Integer>> cycles) {
    this.cycles = Collections.unmodifiableList(cycles);
  }

  /**
   * Compute the minimum cycle basis of a graph.
   *
   * @param graph The graph.
   * @return the basis.
   */
  public static CycleBasis minimumCycleBasis(BondGraph graph) {
    int[] atomIndex = graph.nodes().stream().mapToInt(Integer::intValue).toArray();
    Map<Integer, Integer> position = new TreeMap<>();
    for (int i = 0; i < atomIndex.length; i++) {
      position.put(atomIndex[i], i);
    }

    int[][] adjacency = new int[atomIndex.length][];
    for (int i = 0; i < atomIndex.length; i++) {
      adjacency[i] = graph.neighbors(atomIndex[i]).stream().mapToInt(position::get).toArray();
    }

    int[][] paths = new MinimumCycleBasis(adjacency).paths();
    List<List<Integer>> cycles = new ArrayList<>(paths.length);
    for (int[] path : paths) {
      // CDK paths are closed: the first vertex is repeated at the end.
      int n = path.length > 1 && path[0] == path[path.length - 1] ? path.length - 1 : path.length;
      List<Integer> walk = new ArrayList<>(n);
      for (int k = 0; k < n; k++) {
        walk.add(atomIndex[path[k]]);
      }
      cycles.add(canonicalWalk(walk));
    }
    cycles.sort(Comparator.<List<Integer>>comparingInt(List::size)
        .thenComparing(CycleBasis::compareWalks));

    logger.fine(format(" %d basis cycles for a graph with %d atoms and %d bonds.",
        cycles.size(), graph.nodeCount(), graph.edgeCount()));
    return new CycleBasis(cycles);
  }

  /**
   * The cyclomatic number E - V + C, which is the size of every cycle basis.
   *
   * @param graph The graph.
   * @return the dimension of the cycle space.
   */
  public static int cycleSpaceDimension(BondGraph graph) {
    return graph.edgeCount() - graph.nodeCount() + graph.connectedComponents().size();
  }

  /**
   * @return the basis cycles, shortest first.
   */
  public List<List<Integer>> getCycles() {
    return cycles;
  }

  public int size() {
    return cycles.size();
  }

  /**
   * Rotate a closed walk to start at its smallest vertex, heading toward the smaller of that
   * vertex's two neighbors on the cycle.
   *
   * @param walk A closed walk without the repeated first vertex.
   * @return the canonical walk.
   */
  static List<Integer> canonicalWalk(List<Integer> walk) {
    int n = walk.size();
    int start = 0;
    for (int i = 1; i < n; i++) {
      if (walk.get(i) < walk.get(start)) {
        start = i;
      }
    }
    int next = walk.get((start + 1) % n);
    int previous = walk.get((start - 1 + n) % n);
    int step = next <= previous ? 1 : n - 1;
    List<Integer> canonical = new ArrayList<>(n);
    for (int i = 0, k = start; i < n; i++, k = (k + step) % n) {
      canonical.add(walk.get(k));
    }
    return Collections.unmodifiableList(canonical);
  }

  private static int compareWalks(List<Integer> a, List<Integer> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int c = Integer.compare(a.get(i), b.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(a.size(), b.size());
  }
}
