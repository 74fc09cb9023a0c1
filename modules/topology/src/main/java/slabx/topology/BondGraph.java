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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A BondGraph holds the bonds of a crystal, each annotated with the lattice translation it
 * crosses, and the molecules they define.
 * <p>
 * A BondGraph is immutable and may be shared read-only between concurrent requests for the same
 * Crystal.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BondGraph {

  private final int atomCount;
  private final List<Bond> bonds;
  private final int[] coordination;
  private final List<Molecule> molecules;
  private final int[] moleculeOf;
  private final CutoffPolicy cutoffPolicy;

  BondGraph(int atomCount, List<Bond> bonds, List<Molecule> molecules,
      CutoffPolicy cutoffPolicy) {
    this.atomCount = atomCount;
    this.bonds = Collections.unmodifiableList(new ArrayList<>(bonds));
    this.molecules = Collections.unmodifiableList(new ArrayList<>(molecules));
    this.cutoffPolicy = cutoffPolicy;
    coordination = new int[atomCount];
    for (Bond bond : bonds) {
      coordination[bond.getI()]++;
      coordination[bond.getJ()]++;
    }
    moleculeOf = new int[atomCount];
    for (int m = 0; m < molecules.size(); m++) {
      for (int atom : molecules.get(m).getAtoms()) {
        moleculeOf[atom] = m;
      }
    }
  }

  /**
   * Number of atoms (nodes) in the graph.
   *
   * @return the atom count.
   */
  public int getAtomCount() {
    return atomCount;
  }

  /**
   * The bonds, one per unordered atom pair per distinct translation.
   *
   * @return an unmodifiable list of bonds.
   */
  public List<Bond> getBonds() {
    return bonds;
  }

  /**
   * getBondCount.
   *
   * @return the number of bonds.
   */
  public int getBondCount() {
    return bonds.size();
  }

  /**
   * Number of bonds incident to an atom. A bond from an atom to its own image counts twice.
   *
   * @param atom the atom index.
   * @return the coordination number.
   */
  public int getCoordination(int atom) {
    return coordination[atom];
  }

  /**
   * The molecules, ordered by their smallest atom index.
   *
   * @return an unmodifiable list of molecules.
   */
  public List<Molecule> getMolecules() {
    return molecules;
  }

  /**
   * The molecule that contains an atom.
   *
   * @param atom the atom index.
   * @return the molecule.
   */
  public Molecule getMolecule(int atom) {
    return molecules.get(moleculeOf[atom]);
  }

  /**
   * Sizes of all molecules, sorted ascending.
   *
   * @return molecule sizes.
   */
  public int[] getMoleculeSizes() {
    int[] sizes = new int[molecules.size()];
    for (int i = 0; i < sizes.length; i++) {
      sizes[i] = molecules.get(i).size();
    }
    Arrays.sort(sizes);
    return sizes;
  }

  /**
   * The policy used to build the graph.
   *
   * @return the cutoff policy.
   */
  public CutoffPolicy getCutoffPolicy() {
    return cutoffPolicy;
  }

  @Override
  public String toString() {
    int periodic = 0;
    for (Molecule molecule : molecules) {
      if (molecule.isPeriodic()) {
        periodic++;
      }
    }
    return format(" Bond graph: %d atoms, %d bonds, %d molecules (%d periodic); %s", atomCount,
        bonds.size(), molecules.size(), periodic, cutoffPolicy);
  }
}
