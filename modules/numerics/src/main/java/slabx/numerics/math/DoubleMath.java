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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The DoubleMath class is a simple math library that operates on 3-coordinate double arrays.
 *
 * <p>All methods are static and thread-safe.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DoubleMath {

  private DoubleMath() {
    // Prevent instantiation.
  }

  /**
   * Finds the cross-product between two vectors
   *
   * @param a First vector
   * @param b Second vector
   * @return Returns the cross-product.
   */
  public static double[] X(double[] a, double[] b) {
    double[] ret = new double[3];
    ret[0] = a[1] * b[2] - a[2] * b[1];
    ret[1] = a[2] * b[0] - a[0] * b[2];
    ret[2] = a[0] * b[1] - a[1] * b[0];
    return ret;
  }

  /**
   * sum
   *
   * @param a an array of double.
   * @param b an array of double.
   * @return Returns a + b in a new array.
   */
  public static double[] add(double[] a, double[] b) {
    return new double[] {a[0] + b[0], a[1] + b[1], a[2] + b[2]};
  }

  /**
   * difference
   *
   * @param a an array of double.
   * @param b an array of double.
   * @return Returns a - b in a new array.
   */
  public static double[] sub(double[] a, double[] b) {
    return new double[] {a[0] - b[0], a[1] - b[1], a[2] - b[2]};
  }

  /**
   * scale
   *
   * @param n an array of double.
   * @param a a double.
   * @return Returns n * a in a new array.
   */
  public static double[] scale(double[] n, double a) {
    return new double[] {n[0] * a, n[1] * a, n[2] * a};
  }

  /**
   * Compute a * b + c and return the result in a new array.
   *
   * @param a First vector.
   * @param b Scalar.
   * @param c Second vector.
   * @return Returns a * b + c.
   */
  public static double[] fma(double[] a, double b, double[] c) {
    return new double[] {Math.fma(a[0], b, c[0]), Math.fma(a[1], b, c[1]),
        Math.fma(a[2], b, c[2])};
  }

  /**
   * dot
   *
   * @param a an array of double.
   * @param b an array of double.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * length
   *
   * @param d an array of double.
   * @return Returns the length of the vector.
   */
  public static double length(double[] d) {
    return sqrt(length2(d));
  }

  /**
   * length2
   *
   * @param d an array of double.
   * @return Returns the squared length of the vector.
   */
  public static double length2(double[] d) {
    return d[0] * d[0] + d[1] * d[1] + d[2] * d[2];
  }

  /**
   * Determinant of a 3x3 matrix stored by rows.
   *
   * @param m the matrix.
   * @return Returns the determinant.
   */
  public static double determinant3(double[][] m) {
    return dot(m[0], X(m[1], m[2]));
  }

  /**
   * Multiply a row vector by a 3x3 matrix (v * m).
   *
   * @param v the row vector.
   * @param m the matrix.
   * @return Returns v * m in a new array.
   */
  public static double[] vecMat(double[] v, double[][] m) {
    double[] ret = new double[3];
    for (int j = 0; j < 3; j++) {
      ret[j] = v[0] * m[0][j] + v[1] * m[1][j] + v[2] * m[2][j];
    }
    return ret;
  }

  /**
   * True if all components agree within a tolerance.
   *
   * @param a First vector.
   * @param b Second vector.
   * @param tolerance Absolute tolerance.
   * @return Returns true if a and b agree.
   */
  public static boolean equals(double[] a, double[] b, double tolerance) {
    return abs(a[0] - b[0]) <= tolerance && abs(a[1] - b[1]) <= tolerance
        && abs(a[2] - b[2]) <= tolerance;
  }

  /**
   * Format a vector.
   *
   * @param v the vector.
   * @return Returns a String representation of the vector.
   */
  public static String toString(double[] v) {
    return format("(%10.6f, %10.6f, %10.6f)", v[0], v[1], v[2]);
  }
}
