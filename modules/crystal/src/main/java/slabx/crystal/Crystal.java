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
package slabx.crystal;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * A Crystal is a Lattice plus an ordered, immutable list of Atoms in fractional coordinates.
 * <p>
 * Atom order carries no meaning but is stable, so output built from a Crystal is reproducible.
 * Variants (charged, tagged) are new Crystal instances.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Crystal {

  private final String name;
  private final Lattice lattice;
  private final List<Atom> atoms;

  /**
   * Constructor for Crystal.
   *
   * @param name a title for the structure (for example the CIF data block name).
   * @param lattice the lattice.
   * @param atoms the atoms; copied.
   */
  public Crystal(String name, Lattice lattice, List<Atom> atoms) {
    if (lattice == null) {
      throw new IllegalArgumentException(" A crystal requires a lattice.");
    }
    this.name = (name == null || name.isBlank()) ? "crystal" : name;
    this.lattice = lattice;
    this.atoms = Collections.unmodifiableList(new ArrayList<>(atoms));
  }

  /**
   * The structure title.
   *
   * @return the name.
   */
  public String getName() {
    return name;
  }

  /**
   * The lattice.
   *
   * @return the lattice.
   */
  public Lattice getLattice() {
    return lattice;
  }

  /**
   * The atoms, as an unmodifiable list.
   *
   * @return the atoms.
   */
  public List<Atom> getAtoms() {
    return atoms;
  }

  /**
   * getAtom.
   *
   * @param i the atom index.
   * @return the atom.
   */
  public Atom getAtom(int i) {
    return atoms.get(i);
  }

  /**
   * getAtomCount.
   *
   * @return the number of atoms.
   */
  public int getAtomCount() {
    return atoms.size();
  }

  /**
   * Cartesian coordinates of an atom in the home cell.
   *
   * @param i the atom index.
   * @return Cartesian coordinates.
   */
  public double[] getCartesian(int i) {
    return lattice.toCartesian(atoms.get(i).getXYZ());
  }

  /**
   * Count atoms per element, sorted by element symbol.
   *
   * @return element to count.
   */
  public SortedMap<String, Integer> getComposition() {
    SortedMap<String, Integer> composition = new TreeMap<>();
    for (Atom atom : atoms) {
      composition.merge(atom.getElement(), 1, Integer::sum);
    }
    return composition;
  }

  /**
   * Sum of formal charges.
   *
   * @return the total charge.
   */
  public double getTotalCharge() {
    double total = 0.0;
    for (Atom atom : atoms) {
      total += atom.getCharge();
    }
    return total;
  }

  /**
   * True if every atom carries a formal charge.
   *
   * @return true if the crystal is fully charged.
   */
  public boolean hasCharges() {
    if (atoms.isEmpty()) {
      return false;
    }
    for (Atom atom : atoms) {
      if (!atom.hasCharge()) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if any atom carries a role other than UNKNOWN.
   *
   * @return true if role tags are present.
   */
  public boolean hasRoles() {
    for (Atom atom : atoms) {
      if (atom.getRole() != RoleTag.UNKNOWN) {
        return true;
      }
    }
    return false;
  }

  /**
   * A copy of this crystal with the given atoms.
   *
   * @param newAtoms the atoms.
   * @return a new Crystal.
   */
  public Crystal withAtoms(List<Atom> newAtoms) {
    return new Crystal(name, lattice, newAtoms);
  }

  /**
   * A copy of this crystal with every atom transformed.
   *
   * @param operator the transform.
   * @return a new Crystal.
   */
  public Crystal mapAtoms(UnaryOperator<Atom> operator) {
    List<Atom> mapped = new ArrayList<>(atoms.size());
    for (Atom atom : atoms) {
      mapped.add(operator.apply(atom));
    }
    return withAtoms(mapped);
  }

  /**
   * A copy of this crystal with role tags applied. Atoms absent from the map become UNKNOWN.
   *
   * @param roles map from atom index to role.
   * @return a new Crystal.
   */
  public Crystal withRoles(Map<Integer, RoleTag> roles) {
    List<Atom> tagged = new ArrayList<>(atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      tagged.add(atoms.get(i).withRole(roles.getOrDefault(i, RoleTag.UNKNOWN)));
    }
    return withAtoms(tagged);
  }

  /**
   * Format the composition as, for example, "Cl4 Na4".
   *
   * @return the formula.
   */
  public String getFormula() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Integer> entry : getComposition().entrySet()) {
      if (sb.length() > 0) {
        sb.append(" ");
      }
      sb.append(entry.getKey()).append(entry.getValue());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return format(" %s: %d atoms (%s)\n%s", name, atoms.size(), getFormula(), lattice);
  }
}
