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
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import slabx.crystal.Crystal;
import slabx.crystal.MillerIndices;
import slabx.numerics.math.ScalarMath;

/**
 * The union of normal-axis intervals where a cut would sever a bond or pass through an atom.
 * <p>
 * Positions are measured by s = h.x for fractional coordinates x, so one period of s is one plane
 * spacing. Each bond forbids the span between its two ends and each atom a small window around
 * itself, both widened by a clearance margin. A span of one period or more forbids the whole
 * axis. Intervals are merged analytically; the complement is the set of gaps.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ForbiddenIntervals {

  /**
   * A bond-free gap [start, end) along the normal axis; end may exceed 1 for a gap that wraps.
   *
   * @param start the lower edge.
   * @param end the upper edge.
   */
  public record Gap(double start, double end) {

    /**
     * Width of the gap as a fraction of the period.
     *
     * @return the width.
     */
    public double width() {
      return end - start;
    }

    /**
     * Midpoint of the gap, in [0, 1).
     *
     * @return the midpoint.
     */
    public double midpoint() {
      return ScalarMath.mod(0.5 * (start + end), 1.0);
    }
  }

  private final boolean full;
  /** Sorted, disjoint [lo, hi] pairs in [0, 1]. */
  private final List<double[]> merged;
  private final List<Gap> gaps;

  private ForbiddenIntervals(boolean full, List<double[]> merged) {
    this.full = full;
    this.merged = merged;
    this.gaps = full ? List.of() : computeGaps(merged);
  }

  /**
   * Compute the forbidden intervals of a crystal for a plane.
   *
   * @param crystal the crystal.
   * @param graph the bond graph of the crystal.
   * @param hkl the plane.
   * @param dSpacing the plane spacing in Angstroms.
   * @param margin clearance around bonds and atoms in Angstroms.
   * @return the forbidden intervals.
   */
  public static ForbiddenIntervals compute(Crystal crystal, BondGraph graph, MillerIndices hkl,
      double dSpacing, double margin) {
    if (margin < 0.0) {
      throw new IllegalArgumentException(format(" Invalid cut margin %8.4f.", margin));
    }
    double m = margin / dSpacing;
    int nAtoms = crystal.getAtomCount();
    double[] s = new double[nAtoms];
    for (int i = 0; i < nAtoms; i++) {
      s[i] = normalCoordinate(crystal.getAtom(i).getXYZ(), hkl);
    }

    List<double[]> intervals = new ArrayList<>();
    boolean full = false;
    for (int i = 0; i < nAtoms && !full; i++) {
      full = add(intervals, s[i] - m, s[i] + m);
    }
    int[] h = hkl.toArray();
    for (Bond bond : graph.getBonds()) {
      if (full) {
        break;
      }
      double si = s[bond.getI()];
      double sj = s[bond.getJ()] + h[0] * bond.getImage(0) + h[1] * bond.getImage(1)
          + h[2] * bond.getImage(2);
      full = add(intervals, min(si, sj) - m, max(si, sj) + m);
    }
    return new ForbiddenIntervals(full, full ? List.of() : merge(intervals));
  }

  /**
   * Normal coordinate s = h.x of a fractional position (not reduced modulo 1).
   *
   * @param xyz fractional coordinates.
   * @param hkl the plane.
   * @return the normal coordinate.
   */
  public static double normalCoordinate(double[] xyz, MillerIndices hkl) {
    return hkl.h() * xyz[0] + hkl.k() * xyz[1] + hkl.l() * xyz[2];
  }

  /**
   * Add [lo, hi] modulo 1, splitting intervals that wrap.
   *
   * @return true if the interval covers a full period.
   */
  private static boolean add(List<double[]> intervals, double lo, double hi) {
    if (hi - lo >= 1.0) {
      return true;
    }
    double start = ScalarMath.mod(lo, 1.0);
    double end = start + (hi - lo);
    if (end > 1.0) {
      intervals.add(new double[] {start, 1.0});
      intervals.add(new double[] {0.0, end - 1.0});
    } else {
      intervals.add(new double[] {start, end});
    }
    return false;
  }

  private static List<double[]> merge(List<double[]> intervals) {
    List<double[]> sorted = new ArrayList<>(intervals);
    sorted.sort(Comparator.comparingDouble(a -> a[0]));
    List<double[]> merged = new ArrayList<>();
    for (double[] interval : sorted) {
      if (!merged.isEmpty() && interval[0] <= merged.get(merged.size() - 1)[1]) {
        double[] last = merged.get(merged.size() - 1);
        last[1] = max(last[1], interval[1]);
      } else {
        merged.add(new double[] {interval[0], interval[1]});
      }
    }
    return Collections.unmodifiableList(merged);
  }

  private static List<Gap> computeGaps(List<double[]> merged) {
    List<Gap> gaps = new ArrayList<>();
    if (merged.isEmpty()) {
      gaps.add(new Gap(0.0, 1.0));
      return gaps;
    }
    for (int i = 0; i + 1 < merged.size(); i++) {
      double start = merged.get(i)[1];
      double end = merged.get(i + 1)[0];
      if (end > start) {
        gaps.add(new Gap(start, end));
      }
    }
    // Wrap-around gap from the last interval to the first one in the next period.
    double start = merged.get(merged.size() - 1)[1];
    double end = merged.get(0)[0] + 1.0;
    if (end > start) {
      gaps.add(new Gap(start, end));
    }
    return gaps;
  }

  /**
   * True if the forbidden intervals cover the entire normal axis.
   *
   * @return true if no safe offset exists.
   */
  public boolean coversAxis() {
    return full || gaps.isEmpty();
  }

  /**
   * True if an offset lies inside (or on the edge of) a forbidden interval.
   *
   * @param offset the offset; reduced modulo 1.
   * @return true if the offset is forbidden.
   */
  public boolean isForbidden(double offset) {
    if (full) {
      return true;
    }
    double s = ScalarMath.mod(offset, 1.0);
    for (double[] interval : merged) {
      if (s >= interval[0] && s <= interval[1]) {
        return true;
      }
    }
    // The interval ending at 1.0 also covers s = 0.
    return s == 0.0 && !merged.isEmpty() && merged.get(merged.size() - 1)[1] >= 1.0;
  }

  /**
   * The gap that contains an offset.
   *
   * @param offset the offset; reduced modulo 1.
   * @return the gap, or null if the offset is forbidden.
   */
  public Gap gapContaining(double offset) {
    if (isForbidden(offset)) {
      return null;
    }
    double s = ScalarMath.mod(offset, 1.0);
    for (Gap gap : gaps) {
      if ((s > gap.start() && s < gap.end()) || (s + 1.0 > gap.start() && s + 1.0 < gap.end())) {
        return gap;
      }
    }
    return null;
  }

  /**
   * The bond-free gaps, in axis order.
   *
   * @return the gaps.
   */
  public List<Gap> getGaps() {
    return Collections.unmodifiableList(gaps);
  }
}
