// ******************************************************************************
//
// Title:       Slab X.
// Description: Slab X - Surface Slab Generation for Periodic Crystals.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of Slab X.
//
// Slab X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Slab X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Slab X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package slabx.topology;

import static slabx.numerics.math.IntegerMath.X;
import static slabx.numerics.math.IntegerMath.dot;

import java.util.ArrayList;
import java.util.List;

/**
 * Union-find over (atom, lattice image) identities.
 * <p>
 * Every atom stores its image offset relative to its parent, so each component carries a
 * consistent placement of its atoms. A bond that closes a cycle with a non-zero net translation
 * shows that the component repeats periodically along that translation; the independent cycle
 * translations give the periodic dimensionality of the component.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
final class PeriodicUnionFind {

  private final int[] parent;
  private final int[] rank;
  /** Image of each atom relative to its parent. */
  private final int[][] offset;
  /** Independent cycle translations per root (at most three). */
  private final List<List<int[]>> cycles;

  PeriodicUnionFind(int n) {
    parent = new int[n];
    rank = new int[n];
    offset = new int[n][3];
    cycles = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      parent[i] = i;
      cycles.add(new ArrayList<>(3));
    }
  }

  /**
   * Find the root of an atom and compress the path.
   *
   * @param i the atom.
   * @return the root; afterwards offset[i] is the image of i relative to the root.
   */
  int find(int i) {
    int p = parent[i];
    if (p == i) {
      return i;
    }
    int root = find(p);
    if (p != root) {
      // offset[p] now refers to the root.
      offset[i][0] += offset[p][0];
      offset[i][1] += offset[p][1];
      offset[i][2] += offset[p][2];
    }
    parent[i] = root;
    return root;
  }

  /**
   * Image of an atom relative to its root.
   *
   * @param i the atom.
   * @return a copy of the offset.
   */
  int[] offsetToRoot(int i) {
    find(i);
    return offset[i].clone();
  }

  /**
   * Record that atom j in image t is bonded to atom i in the home cell.
   *
   * @param i the first atom.
   * @param j the second atom.
   * @param t the image of j.
   */
  void union(int i, int j, int[] t) {
    int ri = find(i);
    int rj = find(j);
    int[] oi = offset[i].clone();
    int[] oj = offset[j].clone();
    // Placement of j implied by the bond, relative to ri.
    int[] implied = {oi[0] + t[0], oi[1] + t[1], oi[2] + t[2]};
    if (ri == rj) {
      int[] cycle = {implied[0] - oj[0], implied[1] - oj[1], implied[2] - oj[2]};
      addCycle(ri, cycle);
      return;
    }
    // Attach the shallower tree; the attached root gets the offset that places j at "implied".
    int[] rootShift = {implied[0] - oj[0], implied[1] - oj[1], implied[2] - oj[2]};
    if (rank[ri] < rank[rj]) {
      parent[ri] = rj;
      offset[ri] = new int[] {-rootShift[0], -rootShift[1], -rootShift[2]};
      for (int[] c : cycles.get(ri)) {
        addCycle(rj, c);
      }
      cycles.get(ri).clear();
    } else {
      parent[rj] = ri;
      offset[rj] = rootShift;
      if (rank[ri] == rank[rj]) {
        rank[ri]++;
      }
      for (int[] c : cycles.get(rj)) {
        addCycle(ri, c);
      }
      cycles.get(rj).clear();
    }
  }

  /**
   * Number of independent periodic directions of the component that contains an atom.
   *
   * @param i the atom.
   * @return 0 for a finite molecule, up to 3 for a framework.
   */
  int dimensionality(int i) {
    return cycles.get(find(i)).size();
  }

  private void addCycle(int root, int[] cycle) {
    if (cycle[0] == 0 && cycle[1] == 0 && cycle[2] == 0) {
      return;
    }
    List<int[]> basis = cycles.get(root);
    if (isIndependent(basis, cycle)) {
      basis.add(cycle);
    }
  }

  private static boolean isIndependent(List<int[]> basis, int[] v) {
    switch (basis.size()) {
      case 0:
        return true;
      case 1: {
        int[] c = X(basis.get(0), v);
        return c[0] != 0 || c[1] != 0 || c[2] != 0;
      }
      case 2:
        return dot(X(basis.get(0), basis.get(1)), v) != 0;
      default:
        return false;
    }
  }
}
