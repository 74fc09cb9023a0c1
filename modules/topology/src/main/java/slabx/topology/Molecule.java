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

import java.util.Arrays;
import java.util.SortedMap;
import java.util.TreeMap;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;

/**
 * A Molecule is a connected component of a {@link BondGraph}: atoms that must stay together when a
 * slab is cut. Each atom carries the lattice image that places it contiguously with the rest of
 * the component.
 * <p>
 * Components that are bonded to their own periodic images (chains, layers and frameworks) are
 * valid molecules with a periodic dimensionality above zero.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Molecule {

  private final int[] atoms;
  private final int[][] images;
  private final int dimensionality;

  /**
   * Constructor for Molecule.
   *
   * @param atoms sorted atom indices.
   * @param images the image of each atom, parallel to atoms.
   * @param dimensionality the number of independent periodic directions.
   */
  Molecule(int[] atoms, int[][] images, int dimensionality) {
    this.atoms = atoms;
    this.images = images;
    this.dimensionality = dimensionality;
  }

  /**
   * The atom indices of this molecule, sorted.
   *
   * @return a copy of the atom indices.
   */
  public int[] getAtoms() {
    return atoms.clone();
  }

  /**
   * size.
   *
   * @return the number of atoms.
   */
  public int size() {
    return atoms.length;
  }

  /**
   * True if the molecule contains an atom.
   *
   * @param atom the atom index.
   * @return true if present.
   */
  public boolean contains(int atom) {
    return Arrays.binarySearch(atoms, atom) >= 0;
  }

  /**
   * The lattice image that places an atom contiguously with the rest of the molecule.
   *
   * @param atom the atom index.
   * @return a copy of the image offset.
   * @throws IllegalArgumentException if the atom is not part of this molecule.
   */
  public int[] getImage(int atom) {
    int index = Arrays.binarySearch(atoms, atom);
    if (index < 0) {
      throw new IllegalArgumentException(format(" Atom %d is not part of this molecule.", atom));
    }
    return images[index].clone();
  }

  /**
   * Periodic dimensionality: 0 for a finite molecule, 1 for a chain, 2 for a layer and 3 for a
   * framework.
   *
   * @return the dimensionality.
   */
  public int getDimensionality() {
    return dimensionality;
  }

  /**
   * True if the molecule is bonded to its own periodic images.
   *
   * @return true for chains, layers and frameworks.
   */
  public boolean isPeriodic() {
    return dimensionality > 0;
  }

  /**
   * Fractional coordinates of an atom unwrapped into the placement of this molecule.
   *
   * @param crystal the crystal the molecule was built from.
   * @param atom the atom index.
   * @return unwrapped fractional coordinates.
   */
  public double[] getUnwrappedXYZ(Crystal crystal, int atom) {
    double[] xyz = crystal.getAtom(atom).getXYZ();
    int[] image = getImage(atom);
    return new double[] {xyz[0] + image[0], xyz[1] + image[1], xyz[2] + image[2]};
  }

  /**
   * Fractional centroid of the unwrapped molecule, moved into the home cell.
   *
   * @param crystal the crystal the molecule was built from.
   * @return the centroid.
   */
  public double[] getCentroid(Crystal crystal) {
    double[] sum = new double[3];
    for (int atom : atoms) {
      double[] x = getUnwrappedXYZ(crystal, atom);
      sum[0] += x[0];
      sum[1] += x[1];
      sum[2] += x[2];
    }
    return Lattice.wrap(new double[] {sum[0] / atoms.length, sum[1] / atoms.length,
        sum[2] / atoms.length});
  }

  /**
   * Count atoms per element.
   *
   * @param crystal the crystal the molecule was built from.
   * @return element to count.
   */
  public SortedMap<String, Integer> getComposition(Crystal crystal) {
    SortedMap<String, Integer> composition = new TreeMap<>();
    for (int atom : atoms) {
      composition.merge(crystal.getAtom(atom).getElement(), 1, Integer::sum);
    }
    return composition;
  }

  @Override
  public String toString() {
    String kind = switch (dimensionality) {
      case 0 -> "finite";
      case 1 -> "chain";
      case 2 -> "layer";
      default -> "framework";
    };
    return format(" Molecule of %d atoms (%s)", atoms.length, kind);
  }
}
