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

/**
 * Configuration keys understood by the surface generator. The property form of a keyword is its
 * name in lower case with dashes, for example {@code slab-thickness}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum SurfaceKeyword {
  SLAB_THICKNESS("Minimum material thickness along the normal (A)."),
  SLAB_VACUUM("Vacuum gap along the normal (A)."),
  BOND_TOLERANCE("Factor applied to covalent radius sums."),
  BOND_CUTOFF("Uniform bond cutoff (A) replacing the covalent heuristic."),
  BOND_TABLE("Explicit pair cutoffs, for example Zn-O:2.3."),
  CUT_MARGIN("Clearance around bonds and atoms at the cut (A)."),
  OFFSET_CANDIDATES("Maximum number of ranked cut offsets."),
  ROLE_SHELL("Thickness of the shell above a cut scored for role bias (A)."),
  LAYER_TOLERANCE("Width of an atomic layer along the normal (A)."),
  DIPOLE_TOLERANCE("Residual dipole accepted as zero (eA)."),
  RECONSTRUCTION("Ionic reconstruction strategy."),
  GUESS_CHARGES("Assign common oxidation states to uncharged input."),
  CENTER_SLAB("Split the vacuum evenly above and below the slab."),
  DUPLICATE_TOLERANCE("Fractional distance below which two atoms coincide."),
  TAGGING_TIMEOUT("Time limit of the external tagging tool (s)."),
  TAGGING_EXECUTABLE("Path of the external tagging tool."),
  TAGGING_WORKDIR("Working directory of the external tagging tool.");

  private final String description;

  SurfaceKeyword(String description) {
    this.description = description;
  }

  /**
   * The property key.
   *
   * @return the key, for example "slab-thickness".
   */
  public String key() {
    return name().toLowerCase().replace('_', '-');
  }

  public String getDescription() {
    return description;
  }
}
