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
import slabx.crystal.Advisory;

/**
 * The outcome of an ionic reconstruction.
 *
 * @param slab the reconstructed slab.
 * @param strategy the strategy applied.
 * @param dipoleBefore the normal dipole before reconstruction, in e*Angstrom.
 * @param dipoleAfter the normal dipole after reconstruction, in e*Angstrom.
 * @param ionsMoved the number of ions relocated by TRANSFER_IONS.
 * @param topScale the charge scale factor of the top layer under SCALE_LAYER_CHARGE.
 * @param bottomScale the charge scale factor of the bottom layer under SCALE_LAYER_CHARGE.
 * @param advisories recoverable conditions raised.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record ReconstructionResult(SlabCrystal slab, ReconstructionStrategy strategy,
                                   double dipoleBefore, double dipoleAfter, int ionsMoved,
                                   double topScale, double bottomScale,
                                   List<Advisory> advisories) {

  /**
   * One line describing what was done.
   *
   * @return the summary.
   */
  public String summary() {
    return switch (strategy) {
      case NONE -> format("Dipole %8.3f eA; no reconstruction applied.", dipoleBefore);
      case TRANSFER_IONS -> (ionsMoved == 0)
          ? format("Surface is stable (dipole %8.3f eA).", dipoleAfter)
          : format("Dipole %8.3f eA; moved %d ions to the opposite face (dipole %8.3f eA).",
              dipoleBefore, ionsMoved, dipoleAfter);
      case SCALE_LAYER_CHARGE -> format(
          "Dipole %8.3f eA; scaled top/bottom layer charges by %6.3f/%6.3f (dipole %8.3f eA).",
          dipoleBefore, topScale, bottomScale, dipoleAfter);
    };
  }
}
