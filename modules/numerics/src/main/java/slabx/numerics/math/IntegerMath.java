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
package slabx.numerics.math;

import static java.lang.Math.abs;
import static java.lang.String.format;

/**
 * Exact integer arithmetic on lattice index vectors.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class IntegerMath {

  private IntegerMath() {
    // Prevent instantiation.
  }

  /**
   * Greatest common divisor; always non-negative.
   *
   * @param a an int.
   * @param b an int.
   * @return gcd(|a|, |b|), with gcd(0, 0) = 0.
   */
  public static int gcd(int a, int b) {
    a = abs(a);
    b = abs(b);
    while (b != 0) {
      int t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  /**
   * Greatest common divisor of three integers.
   *
   * @param a an int.
   * @param b an int.
   * @param c an int.
   * @return gcd(|a|, |b|, |c|).
   */
  public static int gcd(int a, int b, int c) {
    return gcd(gcd(a, b), c);
  }

  /**
   * Extended Euclidean algorithm.
   * <p>
   * Returns {g, x, y} with a * x + b * y = g, where g = gcd(a, b) &gt;= 0.
   *
   * @param a an int.
   * @param b an int.
   * @return the gcd followed by the two Bezout coefficients.
   */
  public static long[] extendedGcd(long a, long b) {
    long oldR = a;
    long r = b;
    long oldS = 1;
    long s = 0;
    long oldT = 0;
    long t = 1;
    while (r != 0) {
      long q = Math.floorDiv(oldR, r);
      long tmp = oldR - q * r;
      oldR = r;
      r = tmp;
      tmp = oldS - q * s;
      oldS = s;
      s = tmp;
      tmp = oldT - q * t;
      oldT = t;
      t = tmp;
    }
    if (oldR < 0) {
      oldR = -oldR;
      oldS = -oldS;
      oldT = -oldT;
    }
    return new long[] {oldR, oldS, oldT};
  }

  /**
   * Integer cross product.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns a x b.
   */
  public static int[] X(int[] a, int[] b) {
    return new int[] {
        a[1] * b[2] - a[2] * b[1],
        a[2] * b[0] - a[0] * b[2],
        a[0] * b[1] - a[1] * b[0]};
  }

  /**
   * Integer dot product.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns a . b.
   */
  public static int dot(int[] a, int[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * Integer linear combination.
   *
   * @param a First vector.
   * @param m Multiple of b to add.
   * @param b Second vector.
   * @return Returns a + m * b.
   */
  public static int[] addMultiple(int[] a, int m, int[] b) {
    return new int[] {a[0] + m * b[0], a[1] + m * b[1], a[2] + m * b[2]};
  }

  /**
   * Negate a vector.
   *
   * @param a the vector.
   * @return Returns -a.
   */
  public static int[] negate(int[] a) {
    return new int[] {-a[0], -a[1], -a[2]};
  }

  /**
   * Determinant of a 3x3 integer matrix stored by rows.
   *
   * @param m the matrix.
   * @return Returns the determinant.
   */
  public static int determinant3(int[][] m) {
    return dot(m[0], X(m[1], m[2]));
  }

  /**
   * Format an index vector as [u v w].
   *
   * @param a the vector.
   * @return Returns a String representation.
   */
  public static String toString(int[] a) {
    return format("[%d %d %d]", a[0], a[1], a[2]);
  }
}
