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

import static ellipticbn.numerics.math.DoubleMath.dist;
import static java.lang.String.format;
import static java.util.Collections.unmodifiableSortedSet;

import ellipticbn.macrocycle.Atom;
import ellipticbn.macrocycle.InvalidInputException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.DoublePredicate;

/**
 * An undirected graph over atom indices whose edges are inferred from interatomic distances.
 * <p>
 * Nodes are the indices of the atoms the graph was built from (not necessarily contiguous).
 * Adjacency is stored as sorted sets keyed by atom index, so every traversal is deterministic.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BondGraph {

  private final TreeMap<Integer, TreeSet<Integer>> adjacency = new TreeMap<>();
  private int nEdges = 0;

  private BondGraph() {
  }

  /**
   * Build the bond graph used to separate molecules: atoms closer than bondDist are bonded.
   *
   * @param atoms The atoms of one input file.
   * @param bondDist The bond distance (Angstroms).
   * @return the bond graph.
   * @throws InvalidInputException If there are no atoms, or bondDist is not a positive number.
   */
  public static BondGraph bondGraph(Collection<Atom> atoms, double bondDist)
      throws InvalidInputException {
    if (atoms.isEmpty()) {
      throw new InvalidInputException(" The bond graph requires at least one atom.");
    }
    if (!Double.isFinite(bondDist) || bondDist <= 0.0) {
      throw new InvalidInputException(format(" The bond distance must be positive (found %s).", bondDist));
    }
    return connect(atoms, d -> d < bondDist);
  }

  /**
   * Connect every pair of atoms whose distance satisfies the edge predicate.
   *
   * @param atoms The nodes of the graph.
   * @param isBond Edge predicate evaluated on the interatomic distance.
   * @return the graph.
   */
  public static BondGraph connect(Collection<Atom> atoms, DoublePredicate isBond) {
    BondGraph graph = new BondGraph();
    Atom[] nodes = atoms.toArray(new Atom[0]);
    double[][] xyz = new double[nodes.length][];
    for (int i = 0; i < nodes.length; i++) {
      graph.addNode(nodes[i].index());
      xyz[i] = nodes[i].getXYZ();
    }
    for (int i = 0; i < nodes.length; i++) {
      for (int j = i + 1; j < nodes.length; j++) {
        if (isBond.test(dist(xyz[i], xyz[j]))) {
          graph.addEdge(nodes[i].index(), nodes[j].index());
        }
      }
    }
    return graph;
  }

  private void addNode(int node) {
    if (adjacency.putIfAbsent(node, new TreeSet<>()) != null) {
      throw new IllegalArgumentException(format(" Atom index %d appears more than once.", node));
    }
  }

  private void addEdge(int i, int j) {
    if (i == j) {
      return;
    }
    if (adjacency.get(i).add(j)) {
      adjacency.get(j).add(i);
      nEdges++;
    }
  }

  /**
   * @return the atom indices of the graph in ascending order.
   */
  public SortedSet<Integer> nodes() {
    return unmodifiableSortedSet(adjacency.navigableKeySet());
  }

  public int nodeCount() {
    return adjacency.size();
  }

  public int edgeCount() {
    return nEdges;
  }

  public boolean containsNode(int node) {
    return adjacency.containsKey(node);
  }

  /**
   * @param node An atom index of the graph.
   * @return its neighbors in ascending order.
   */
  public SortedSet<Integer> neighbors(int node) {
    TreeSet<Integer> neighbors = adjacency.get(node);
    if (neighbors == null) {
      throw new IllegalArgumentException(format(" Atom index %d is not in the graph.", node));
    }
    return unmodifiableSortedSet(neighbors);
  }

  public int degree(int node) {
    return neighbors(node).size();
  }

  public boolean hasEdge(int i, int j) {
    TreeSet<Integer> neighbors = adjacency.get(i);
    return neighbors != null && neighbors.contains(j);
  }

  /**
   * @return every edge once as {i, j} with i &lt; j, in lexicographic order.
   */
  public List<int[]> edges() {
    List<int[]> edges = new ArrayList<>(nEdges);
    adjacency.forEach((i, neighbors) -> {
      for (int j : neighbors.tailSet(i, false)) {
        edges.add(new int[] {i, j});
      }
    });
    return edges;
  }

  /**
   * Breadth-first search for the connected components.
   *
   * @return the components ordered by their smallest atom index; each component is sorted.
   */
  public List<SortedSet<Integer>> connectedComponents() {
    List<SortedSet<Integer>> components = new ArrayList<>();
    TreeSet<Integer> visited = new TreeSet<>();
    for (int seed : adjacency.keySet()) {
      if (visited.contains(seed)) {
        continue;
      }
      TreeSet<Integer> component = new TreeSet<>();
      Deque<Integer> queue = new ArrayDeque<>();
      queue.add(seed);
      visited.add(seed);
      while (!queue.isEmpty()) {
        int node = queue.poll();
        component.add(node);
        for (int neighbor : adjacency.get(node)) {
          if (visited.add(neighbor)) {
            queue.add(neighbor);
          }
        }
      }
      components.add(unmodifiableSortedSet(component));
    }
    return components;
  }

  @Override
  public String toString() {
    return format(" Bond graph with %d atoms and %d bonds", nodeCount(), nEdges);
  }
}
