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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.floor;
import static slabx.numerics.math.DoubleMath.add;
import static slabx.numerics.math.DoubleMath.length;
import static slabx.numerics.math.DoubleMath.sub;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Atom;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;

/**
 * Builds the periodic {@link BondGraph} of a Crystal.
 * <p>
 * Neighbours are searched in the home cell and in every lattice image close enough to hold a
 * partner within the largest cutoff, so cells that are small relative to the cutoff search more
 * than the 26 adjacent images.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BondGraphBuilder {

  private static final Logger logger = Logger.getLogger(BondGraphBuilder.class.getName());

  private BondGraphBuilder() {
  }

  /**
   * Build the bond graph. Zero bonds is valid: each atom is then a molecule of size 1.
   *
   * @param crystal the crystal.
   * @param cutoffPolicy the bonding distance per pair of elements.
   * @return the bond graph.
   */
  public static BondGraph buildBonds(Crystal crystal, CutoffPolicy cutoffPolicy) {
    int nAtoms = crystal.getAtomCount();
    Lattice lattice = crystal.getLattice();

    Set<String> elements = new TreeSet<>();
    for (Atom atom : crystal.getAtoms()) {
      elements.add(atom.getElement());
    }
    double maxCutoff = cutoffPolicy.maxCutoff(elements);
    int[] range = new int[3];
    for (int axis = 0; axis < 3; axis++) {
      range[axis] = (int) floor(maxCutoff / lattice.planeSpacing(axis)) + 1;
    }

    double[][] xyz = new double[nAtoms][];
    for (int i = 0; i < nAtoms; i++) {
      xyz[i] = crystal.getCartesian(i);
    }

    List<Bond> bonds = new ArrayList<>();
    for (int i = 0; i < nAtoms; i++) {
      String elementI = crystal.getAtom(i).getElement();
      for (int j = i; j < nAtoms; j++) {
        double cutoff = cutoffPolicy.maxBondDistance(elementI, crystal.getAtom(j).getElement());
        for (int ta = -range[0]; ta <= range[0]; ta++) {
          for (int tb = -range[1]; tb <= range[1]; tb++) {
            for (int tc = -range[2]; tc <= range[2]; tc++) {
              int[] t = {ta, tb, tc};
              // A self bond and its inverse are the same bond; keep the positive half.
              if (i == j && !isPositive(t)) {
                continue;
              }
              double[] xj = add(xyz[j], lattice.toCartesian(t));
              double r = length(sub(xj, xyz[i]));
              if (r > cutoff) {
                continue;
              }
              if (r < CutoffPolicy.MIN_BOND_DISTANCE) {
                if (logger.isLoggable(Level.FINE)) {
                  logger.fine(format(" Atoms %d and %d overlap (%6.3f A).", i, j, r));
                }
                continue;
              }
              bonds.add(new Bond(i, j, t, r));
            }
          }
        }
      }
    }

    PeriodicUnionFind unionFind = new PeriodicUnionFind(nAtoms);
    for (Bond bond : bonds) {
      unionFind.union(bond.getI(), bond.getJ(), bond.getImage());
    }
    BondGraph graph = new BondGraph(nAtoms, bonds, collectMolecules(unionFind, nAtoms),
        cutoffPolicy);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(graph.toString());
    }
    return graph;
  }

  /**
   * Group atoms by root. Images are shifted so that the smallest atom index of each molecule sits
   * in the home cell.
   */
  private static List<Molecule> collectMolecules(PeriodicUnionFind unionFind, int nAtoms) {
    Map<Integer, List<Integer>> components = new LinkedHashMap<>();
    for (int i = 0; i < nAtoms; i++) {
      components.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(i);
    }
    List<Molecule> molecules = new ArrayList<>(components.size());
    for (List<Integer> members : components.values()) {
      int size = members.size();
      int[] atoms = new int[size];
      int[][] images = new int[size][];
      int[] reference = unionFind.offsetToRoot(members.get(0));
      for (int m = 0; m < size; m++) {
        atoms[m] = members.get(m);
        int[] offset = unionFind.offsetToRoot(atoms[m]);
        images[m] = new int[] {offset[0] - reference[0], offset[1] - reference[1],
            offset[2] - reference[2]};
      }
      molecules.add(new Molecule(atoms, images, unionFind.dimensionality(atoms[0])));
    }
    return molecules;
  }

  private static boolean isPositive(int[] t) {
    if (t[0] != 0) {
      return t[0] > 0;
    }
    if (t[1] != 0) {
      return t[1] > 0;
    }
    return t[2] > 0;
  }
}
