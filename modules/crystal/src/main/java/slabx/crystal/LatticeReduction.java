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

import static org.apache.commons.math3.util.FastMath.abs;
import static slabx.numerics.math.DoubleMath.X;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.IntegerMath.addMultiple;
import static slabx.numerics.math.IntegerMath.negate;

/**
 * Two-dimensional (Gauss-Lagrange) lattice basis reduction of a pair of integer lattice vectors,
 * using the Cartesian metric of the lattice.
 * <p>
 * The reduced pair (u, v) satisfies |u| &lt;= |v| and |u.v| &lt;= |u|^2 / 2, so the angle between
 * them lies in [60, 120] degrees and the pair spans the same two-dimensional lattice with the
 * shortest possible vectors. The output is canonical: the first non-zero index of u is positive and
 * (u x v) points along the supplied normal. Reducing an already reduced pair returns it unchanged.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class LatticeReduction {

  /** Relative tolerance for length and projection comparisons. */
  private static final double TOLERANCE = 1.0e-9;

  private LatticeReduction() {
  }

  /**
   * Reduce a pair of integer lattice vectors.
   *
   * @param lattice the lattice that defines the metric.
   * @param u the first vector, as lattice indices.
   * @param v the second vector, as lattice indices.
   * @param normal a Cartesian direction that (u x v) should point along.
   * @return the reduced pair {u, v}.
   * @throws IllegalArgumentException if u and v are linearly dependent.
   */
  public static int[][] reduce(Lattice lattice, int[] u, int[] v, double[] normal) {
    double[] cross = X(lattice.toCartesian(u), lattice.toCartesian(v));
    if (dot(cross, cross) < TOLERANCE) {
      throw new IllegalArgumentException(" Cannot reduce linearly dependent vectors.");
    }

    int[] p = u.clone();
    int[] q = v.clone();
    double pp = norm2(lattice, p);
    double qq = norm2(lattice, q);
    while (true) {
      if (qq < pp * (1.0 - TOLERANCE)) {
        int[] tmp = p;
        p = q;
        q = tmp;
        double t = pp;
        pp = qq;
        qq = t;
      }
      double ratio = dot(lattice.toCartesian(p), lattice.toCartesian(q)) / pp;
      if (abs(ratio) <= 0.5 + TOLERANCE) {
        break;
      }
      int mu = (int) Math.round(ratio);
      q = addMultiple(q, -mu, p);
      qq = norm2(lattice, q);
    }

    // Canonical sign: the first non-zero index of u is positive.
    for (int i = 0; i < 3; i++) {
      if (p[i] != 0) {
        if (p[i] < 0) {
          p = negate(p);
          q = negate(q);
        }
        break;
      }
    }

    // Right-handed about the normal.
    if (dot(X(lattice.toCartesian(p), lattice.toCartesian(q)), normal) < 0.0) {
      q = negate(q);
    }
    return new int[][] {p, q};
  }

  /**
   * True if a pair satisfies the Gauss-Lagrange reduction conditions.
   *
   * @param lattice the lattice that defines the metric.
   * @param u the first vector.
   * @param v the second vector.
   * @return true if |u| &lt;= |v| and |u.v| &lt;= |u|^2 / 2.
   */
  public static boolean isReduced(Lattice lattice, int[] u, int[] v) {
    double uu = norm2(lattice, u);
    double vv = norm2(lattice, v);
    double uv = dot(lattice.toCartesian(u), lattice.toCartesian(v));
    return uu <= vv * (1.0 + TOLERANCE) && abs(uv) <= (0.5 + TOLERANCE) * uu;
  }

  private static double norm2(Lattice lattice, int[] indices) {
    double[] x = lattice.toCartesian(indices);
    return dot(x, x);
  }
}
