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
import static org.apache.commons.math3.util.FastMath.min;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Crystal;
import slabx.crystal.RoleTag;
import slabx.crystal.SurfaceBasis;
import slabx.numerics.math.ScalarMath;

/**
 * The VoidCrawler finds cut offsets along a plane normal that sever no bond.
 * <p>
 * Candidates are the midpoints of the gaps between merged {@link ForbiddenIntervals}, widest gap
 * first (ties by position). When atoms carry role tags and a role is preferred, candidates are
 * re-ranked with a stable sort by the fraction of preferred-role atoms in a thin shell just above
 * the offset; the safe/unsafe partition is unchanged.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class VoidCrawler {

  private static final Logger logger = Logger.getLogger(VoidCrawler.class.getName());

  /** Default clearance around bonds and atoms, in Angstroms. */
  public static final double DEFAULT_MARGIN = 0.1;

  /** Default thickness of the shell scored for role bias, in Angstroms. */
  public static final double DEFAULT_ROLE_SHELL = 2.0;

  private final double margin;
  private final double roleShell;
  private final RoleTag preferredRole;

  /**
   * VoidCrawler with default margin and no role bias.
   */
  public VoidCrawler() {
    this(DEFAULT_MARGIN, DEFAULT_ROLE_SHELL, RoleTag.UNKNOWN);
  }

  /**
   * Constructor for VoidCrawler.
   *
   * @param margin clearance around bonds and atoms in Angstroms.
   * @param roleShell thickness of the shell above a cut scored for role bias, in Angstroms.
   * @param preferredRole the role to expose; UNKNOWN disables the bias.
   */
  public VoidCrawler(double margin, double roleShell, RoleTag preferredRole) {
    this.margin = margin;
    this.roleShell = roleShell;
    this.preferredRole = (preferredRole == null) ? RoleTag.UNKNOWN : preferredRole;
  }

  /**
   * Find safe offsets, best first.
   *
   * @param crystal the crystal.
   * @param graph its bond graph.
   * @param basis the surface basis that defines the normal axis.
   * @param candidateCount the maximum number of offsets to return.
   * @return a lazy, restartable sequence; empty when every offset severs a bond.
   */
  public SafeOffsetSequence findSafeOffsets(Crystal crystal, BondGraph graph, SurfaceBasis basis,
      int candidateCount) {
    if (candidateCount < 0) {
      throw new IllegalArgumentException(format(" Invalid candidate count %d.", candidateCount));
    }
    return new SafeOffsetSequence(() -> rank(crystal, graph, basis, candidateCount));
  }

  /**
   * Check an explicit offset against the forbidden intervals.
   *
   * @param crystal the crystal.
   * @param graph its bond graph.
   * @param basis the surface basis.
   * @param offset the offset.
   * @return the offset, with safe set to false if it lies in a forbidden interval.
   */
  public CutOffset validateOffset(Crystal crystal, BondGraph graph, SurfaceBasis basis,
      double offset) {
    double d = basis.getDSpacing();
    ForbiddenIntervals forbidden = ForbiddenIntervals.compute(crystal, graph,
        basis.getMillerIndices(), d, margin);
    double wrapped = ScalarMath.mod(offset, 1.0);
    ForbiddenIntervals.Gap gap = forbidden.gapContaining(wrapped);
    if (gap == null) {
      return new CutOffset(wrapped, 0.0, 0.0, 0.0, Double.NaN, false);
    }
    return toCutOffset(wrapped, gap, d);
  }

  private List<CutOffset> rank(Crystal crystal, BondGraph graph, SurfaceBasis basis,
      int candidateCount) {
    double d = basis.getDSpacing();
    ForbiddenIntervals forbidden = ForbiddenIntervals.compute(crystal, graph,
        basis.getMillerIndices(), d, margin);
    List<ForbiddenIntervals.Gap> gaps = new ArrayList<>(forbidden.getGaps());
    gaps.sort(Comparator.comparingDouble(ForbiddenIntervals.Gap::width).reversed()
        .thenComparingDouble(ForbiddenIntervals.Gap::midpoint));

    List<CutOffset> offsets = new ArrayList<>(gaps.size());
    for (ForbiddenIntervals.Gap gap : gaps) {
      offsets.add(toCutOffset(gap.midpoint(), gap, d));
    }

    if (preferredRole != RoleTag.UNKNOWN && crystal.hasRoles()) {
      List<CutOffset> scored = new ArrayList<>(offsets.size());
      for (CutOffset offset : offsets) {
        scored.add(offset.withChemistryScore(roleScore(crystal, basis, offset.offset())));
      }
      scored.sort(Comparator.comparingDouble(CutOffset::chemistryScore).reversed());
      offsets = scored;
    }

    if (offsets.size() > candidateCount) {
      offsets = new ArrayList<>(offsets.subList(0, candidateCount));
    }
    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder(format(" %d safe offsets for %s:",
          offsets.size(), basis.getMillerIndices()));
      for (CutOffset offset : offsets) {
        sb.append("\n").append(offset);
      }
      logger.fine(sb.toString());
    }
    return offsets;
  }

  private static CutOffset toCutOffset(double offset, ForbiddenIntervals.Gap gap, double d) {
    double widthAngstroms = gap.width() * d;
    return new CutOffset(offset, gap.width(), widthAngstroms,
        min(1.0, widthAngstroms / CutOffset.CLEAN_GAP), Double.NaN, true);
  }

  /**
   * Fraction of atoms within the shell above an offset that carry the preferred role.
   */
  private double roleScore(Crystal crystal, SurfaceBasis basis, double offset) {
    double shell = min(1.0, roleShell / basis.getDSpacing());
    int inShell = 0;
    int preferred = 0;
    for (int i = 0; i < crystal.getAtomCount(); i++) {
      double s = ForbiddenIntervals.normalCoordinate(crystal.getAtom(i).getXYZ(),
          basis.getMillerIndices());
      double above = ScalarMath.mod(s - offset, 1.0);
      if (above > 0.0 && above <= shell) {
        inShell++;
        if (crystal.getAtom(i).getRole() == preferredRole) {
          preferred++;
        }
      }
    }
    return (inShell == 0) ? 0.0 : (double) preferred / inShell;
  }
}
