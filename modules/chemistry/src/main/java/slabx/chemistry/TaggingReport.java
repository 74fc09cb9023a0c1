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
package slabx.chemistry;

import static java.lang.String.format;

import java.util.Map;
import slabx.crystal.RoleTag;

/**
 * Outcome of mapping fragments onto a crystal.
 *
 * @param roles atom index to role, for tagged atoms only.
 * @param nodeFragments node fragments that matched at least one atom.
 * @param linkerFragments linker fragments that matched at least one atom.
 * @param atomCount number of atoms in the crystal.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record TaggingReport(Map<Integer, RoleTag> roles, int nodeFragments, int linkerFragments,
                            int atomCount) {

  /**
   * Fraction of atoms that received a role.
   *
   * @return the coverage in [0, 1].
   */
  public double getCoverage() {
    return (atomCount == 0) ? 0.0 : (double) roles.size() / atomCount;
  }

  @Override
  public String toString() {
    return format(" Semantic tagging:\n  %-14s %d\n  %-14s %d\n  %-14s %d/%d atoms (%5.1f%%)",
        "Nodes", nodeFragments, "Linkers", linkerFragments, "Coverage", roles.size(), atomCount,
        100.0 * getCoverage());
  }
}
