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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.floor;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.fma;
import static slabx.numerics.math.DoubleMath.length2;
import static slabx.numerics.math.DoubleMath.scale;
import static slabx.numerics.math.DoubleMath.sub;
import static slabx.numerics.math.IntegerMath.addMultiple;
import static slabx.numerics.math.IntegerMath.dot;
import static slabx.numerics.math.IntegerMath.extendedGcd;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the integer {@link SurfaceBasis} of a lattice plane.
 * <p>
 * For reduced indices (h k l) with d = gcd(h, k) and p*h + q*k = d, the vectors u = (k/d, -h/d, 0)
 * and v = (p*l, q*l, -d) lie in the plane and satisfy u x v = (h k l), so they span the full
 * two-dimensional lattice of the plane. With a*d + b*l = 1 the transverse vector w = (a*p, a*q, b)
 * satisfies h.w = 1, so it crosses exactly one plane spacing. The in-plane pair is then reduced
 * and integer multiples of it are removed from w to minimise its shear.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SurfaceBasisFinder {

  private static final Logger logger = Logger.getLogger(SurfaceBasisFinder.class.getName());

  private SurfaceBasisFinder() {
  }

  /**
   * Find the surface basis of a plane.
   *
   * @param lattice the bulk lattice.
   * @param hkl the plane; construction of (0 0 0) already fails with DEGENERATE_PLANE.
   * @return the surface basis.
   */
  public static SurfaceBasis findSurfaceBasis(Lattice lattice, MillerIndices hkl) {
    int h = hkl.h();
    int k = hkl.k();
    int l = hkl.l();
    int[] u;
    int[] v;
    int[] w;
    if (h == 0 && k == 0) {
      // Reduced indices are (0 0 +-1).
      u = new int[] {1, 0, 0};
      v = new int[] {0, 1, 0};
      w = new int[] {0, 0, l};
    } else {
      long[] hk = extendedGcd(h, k);
      int d = (int) hk[0];
      int p = (int) hk[1];
      int q = (int) hk[2];
      u = new int[] {k / d, -h / d, 0};
      v = new int[] {p * l, q * l, -d};
      long[] dl = extendedGcd(d, l);
      int a = (int) dl[1];
      int b = (int) dl[2];
      w = new int[] {a * p, a * q, b};
    }
    int[] indices = hkl.toArray();
    if (dot(indices, u) != 0 || dot(indices, v) != 0 || dot(indices, w) != 1) {
      throw new IllegalStateException(format(" Invalid integer basis for %s.", hkl));
    }

    double[] normal = lattice.reciprocalVector(hkl);
    int[][] reduced = LatticeReduction.reduce(lattice, u, v, normal);
    int[] transverse = minimizeShear(lattice, reduced[0], reduced[1], w, normal);

    SurfaceBasis basis = new SurfaceBasis(lattice, hkl, u, v, reduced[0], reduced[1], transverse);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(basis.toString());
    }
    return basis;
  }

  /**
   * Subtract the integer combination of u and v that minimises the in-plane component of w.
   * For a reduced pair the optimum lies within one step of the floor/ceiling of the real-valued
   * least-squares solution.
   */
  private static int[] minimizeShear(Lattice lattice, int[] u, int[] v, int[] w,
      double[] normal) {
    double[] uc = lattice.toCartesian(u);
    double[] vc = lattice.toCartesian(v);
    double[] wc = lattice.toCartesian(w);
    double nn = dot(normal, normal);
    double[] inPlane = fma(normal, -dot(wc, normal) / nn, wc);

    double uu = dot(uc, uc);
    double uv = dot(uc, vc);
    double vv = dot(vc, vc);
    double wu = dot(inPlane, uc);
    double wv = dot(inPlane, vc);
    double det = uu * vv - uv * uv;
    double m = (wu * vv - wv * uv) / det;
    double n = (wv * uu - wu * uv) / det;

    int[] best = w;
    double bestResidual = Double.MAX_VALUE;
    int bestSteps = Integer.MAX_VALUE;
    for (int mi = (int) floor(m) - 1; mi <= (int) ceil(m) + 1; mi++) {
      for (int ni = (int) floor(n) - 1; ni <= (int) ceil(n) + 1; ni++) {
        double[] residual = sub(sub(inPlane, scale(uc, mi)), scale(vc, ni));
        double r2 = length2(residual);
        int steps = abs(mi) + abs(ni);
        if (r2 < bestResidual - 1.0e-10 || (abs(r2 - bestResidual) <= 1.0e-10
            && steps < bestSteps)) {
          bestResidual = r2;
          bestSteps = steps;
          best = addMultiple(addMultiple(w, -mi, u), -ni, v);
        }
      }
    }
    return best;
  }
}
