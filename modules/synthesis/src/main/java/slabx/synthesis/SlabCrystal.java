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
package slabx.synthesis;

import static java.lang.String.format;

import java.util.List;
import slabx.crystal.Atom;
import slabx.crystal.Crystal;

/**
 * The SlabCrystal class extends Crystal with the provenance of a surface slab: the slab cell, the
 * cut offset and, per atom, the bulk atom and lattice translation it was generated from.
 * <p>
 * Atoms are stored in the fractional frame of the slab lattice; the vacuum is unoccupied cell
 * volume.
 *
 * @author Michael J. Schnieders
 * @see Crystal
 * @since 1.0
 */
public class SlabCrystal extends Crystal {

  private final SlabCell slabCell;
  private final double offset;
  private final int[] sourceIndex;
  private final int[][] sourceTranslation;

  /**
   * Constructor for a SlabCrystal.
   *
   * @param name the structure title.
   * @param slabCell the slab cell.
   * @param offset the cut offset as a fraction of the transverse repeat.
   * @param atoms the atoms in slab fractional coordinates.
   * @param sourceIndex bulk atom index of each atom.
   * @param sourceTranslation bulk lattice translation of each atom.
   */
  public SlabCrystal(String name, SlabCell slabCell, double offset, List<Atom> atoms,
      int[] sourceIndex, int[][] sourceTranslation) {
    super(name, slabCell.getLattice(), atoms);
    if (sourceIndex.length != atoms.size() || sourceTranslation.length != atoms.size()) {
      throw new IllegalArgumentException(" Provenance must be given for every slab atom.");
    }
    this.slabCell = slabCell;
    this.offset = offset;
    this.sourceIndex = sourceIndex.clone();
    this.sourceTranslation = new int[sourceTranslation.length][];
    for (int i = 0; i < sourceTranslation.length; i++) {
      this.sourceTranslation[i] = sourceTranslation[i].clone();
    }
  }

  public SlabCell getSlabCell() {
    return slabCell;
  }

  /**
   * The cut offset along the transverse repeat, in [0, 1).
   *
   * @return the offset.
   */
  public double getOffset() {
    return offset;
  }

  /**
   * Index of the bulk atom that atom i was generated from.
   *
   * @param i the slab atom index.
   * @return the bulk atom index.
   */
  public int getSourceIndex(int i) {
    return sourceIndex[i];
  }

  /**
   * Bulk lattice translation that generated atom i.
   *
   * @param i the slab atom index.
   * @return a copy of the translation.
   */
  public int[] getSourceTranslation(int i) {
    return sourceTranslation[i].clone();
  }

  /**
   * Height of atom i above the bottom of the cell, measured along the plane normal.
   *
   * @param i the atom index.
   * @return the normal position in Angstroms.
   */
  public double getNormalPosition(int i) {
    return getAtom(i).getXYZ(2) * slabCell.getNormalLength();
  }

  /**
   * Normal positions of all atoms.
   *
   * @return the positions in Angstroms.
   */
  public double[] getNormalPositions() {
    double[] z = new double[getAtomCount()];
    for (int i = 0; i < z.length; i++) {
      z[i] = getNormalPosition(i);
    }
    return z;
  }

  /**
   * A copy of this slab with new atoms; provenance is kept, so the atom count must match.
   *
   * @param newAtoms the atoms.
   * @return a new SlabCrystal.
   */
  @Override
  public SlabCrystal withAtoms(List<Atom> newAtoms) {
    return new SlabCrystal(getName(), slabCell, offset, newAtoms, sourceIndex, sourceTranslation);
  }

  /**
   * A copy of this slab with new atoms and provenance.
   *
   * @param newAtoms the atoms.
   * @param newSourceTranslation the bulk translation of each atom.
   * @return a new SlabCrystal.
   */
  SlabCrystal withAtoms(List<Atom> newAtoms, int[][] newSourceTranslation) {
    return new SlabCrystal(getName(), slabCell, offset, newAtoms, sourceIndex,
        newSourceTranslation);
  }

  @Override
  public String toString() {
    return format(" %s: %d atoms (%s), offset %6.4f", getName(), getAtomCount(), getFormula(),
        offset);
  }
}
