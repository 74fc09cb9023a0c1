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

/**
 * A candidate slab boundary along the plane normal, expressed as a fraction of the transverse
 * lattice vector (one plane spacing).
 *
 * @param offset the boundary position in [0, 1).
 * @param gapWidth width of the bond-free gap that contains the offset, as a fraction; 0 when the
 *     offset is forbidden.
 * @param gapWidthAngstroms the same width in Angstroms.
 * @param quality clearance score in [0, 1]: min(1, gap / 3 A).
 * @param chemistryScore fraction of preferred-role atoms just above the offset, or NaN when no
 *     role bias was applied.
 * @param safe true if no bond or atom lies on the boundary.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record CutOffset(double offset, double gapWidth, double gapWidthAngstroms, double quality,
                        double chemistryScore, boolean safe) {

  /** Gaps this wide (in Angstroms) or wider score a quality of 1. */
  public static final double CLEAN_GAP = 3.0;

  /**
   * A copy with a chemistry score.
   *
   * @param score the score.
   * @return a new CutOffset.
   */
  public CutOffset withChemistryScore(double score) {
    return new CutOffset(offset, gapWidth, gapWidthAngstroms, quality, score, safe);
  }

  @Override
  public String toString() {
    String s = format(" Offset %7.4f: gap %6.3f A, quality %4.2f%s", offset, gapWidthAngstroms,
        quality, safe ? "" : " (UNSAFE)");
    if (!Double.isNaN(chemistryScore)) {
      s += format(", chemistry %4.2f", chemistryScore);
    }
    return s;
  }
}
