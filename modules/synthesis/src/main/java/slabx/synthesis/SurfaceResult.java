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

import java.util.List;
import slabx.crystal.Advisory;
import slabx.crystal.SurfaceCondition;
import slabx.topology.CutOffset;

/**
 * A generated surface slab with the recoverable conditions raised while building it.
 *
 * @param slab the slab crystal.
 * @param slabCell the slab cell.
 * @param offset the cut offset used.
 * @param reconstruction the outcome of ionic reconstruction.
 * @param advisories recoverable conditions, in the order they were raised.
 * @param report a multi-line human-readable report.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record SurfaceResult(SlabCrystal slab, SlabCell slabCell, CutOffset offset,
                            ReconstructionResult reconstruction, List<Advisory> advisories,
                            String report) {

  /**
   * True if an advisory of the given kind was raised.
   *
   * @param condition the condition.
   * @return true if present.
   */
  public boolean hasAdvisory(SurfaceCondition condition) {
    for (Advisory advisory : advisories) {
      if (advisory.condition() == condition) {
        return true;
      }
    }
    return false;
  }
}
