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
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toDegrees;
import static org.apache.commons.math3.util.FastMath.toRadians;
import static slabx.numerics.math.DoubleMath.determinant3;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.length;
import static slabx.numerics.math.DoubleMath.vecMat;

import java.util.Arrays;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import slabx.numerics.math.ScalarMath;

/**
 * The Lattice class encapsulates the three basis vectors that describe the periodicity of a
 * crystal. Methods are available to convert between fractional and Cartesian coordinates, to apply
 * the minimum image convention and to compute reciprocal-space quantities of lattice planes.
 * <p>
 * A Lattice is immutable; transformed cells are new instances.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Lattice {

  /** Determinants smaller than this (in cubic Angstroms) mark a degenerate cell. */
  private static final double MIN_VOLUME = 1.0e-6;

  /** Length of basis vector a in Angstroms. */
  public final double a;
  /** Length of basis vector b in Angstroms. */
  public final double b;
  /** Length of basis vector c in Angstroms. */
  public final double c;
  /** The angle between b and c in degrees. */
  public final double alpha;
  /** The angle between a and c in degrees. */
  public final double beta;
  /** The angle between a and b in degrees. */
  public final double gamma;
  /** Signed volume of the cell in cubic Angstroms. */
  public final double volume;

  /**
   * The direct matrix: its rows are the Cartesian a, b and c vectors.
   */
  private final double[][] Ai = new double[3][3];
  /**
   * The inverse of the direct matrix: its columns are the reciprocal vectors a*, b* and c*.
   */
  private final double[][] A = new double[3][3];
  /**
   * The reciprocal metric tensor.
   */
  private final double[][] Gstar = new double[3][3];

  /**
   * Lattice constructor from lattice parameters, using the standard orientation with a along x
   * and b in the xy-plane.
   *
   * @param a The a-axis length.
   * @param b The b-axis length.
   * @param c The c-axis length.
   * @param alpha The alpha angle.
   * @param beta The beta angle.
   * @param gamma The gamma angle.
   * @throws IllegalArgumentException if the parameters do not describe a valid cell.
   */
  public Lattice(double a, double b, double c, double alpha, double beta, double gamma) {
    if (!(a > 0.0 && b > 0.0 && c > 0.0)) {
      throw new IllegalArgumentException(
          format(" Lattice lengths must be positive (%8.4f %8.4f %8.4f).", a, b, c));
    }
    double cosAlpha = cos(toRadians(alpha));
    double cosBeta = cos(toRadians(beta));
    double cosGamma = cos(toRadians(gamma));
    double sinGamma = sin(toRadians(gamma));
    double sinBeta = sin(toRadians(beta));
    double betaTerm = (cosAlpha - cosBeta * cosGamma) / sinGamma;
    double gammaTerm2 = sinBeta * sinBeta - betaTerm * betaTerm;
    if (!(gammaTerm2 > 0.0) || sinGamma <= 0.0) {
      throw new IllegalArgumentException(
          format(" The angles (%8.4f %8.4f %8.4f) do not describe a valid cell.", alpha, beta,
              gamma));
    }
    double gammaTerm = sqrt(gammaTerm2);

    Ai[0][0] = a;
    Ai[0][1] = 0.0;
    Ai[0][2] = 0.0;
    Ai[1][0] = b * cosGamma;
    Ai[1][1] = b * sinGamma;
    Ai[1][2] = 0.0;
    Ai[2][0] = c * cosBeta;
    Ai[2][1] = c * betaTerm;
    Ai[2][2] = c * gammaTerm;

    this.a = a;
    this.b = b;
    this.c = c;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
    this.volume = sinGamma * gammaTerm * a * b * c;
    if (volume < MIN_VOLUME) {
      throw new IllegalArgumentException(format(" Degenerate cell volume %12.6e.", volume));
    }
    invert();
  }

  /**
   * Lattice constructor from three Cartesian basis vectors, kept exactly as given.
   *
   * @param aVector the a vector.
   * @param bVector the b vector.
   * @param cVector the c vector.
   */
  private Lattice(double[] aVector, double[] bVector, double[] cVector) {
    for (int i = 0; i < 3; i++) {
      Ai[0][i] = aVector[i];
      Ai[1][i] = bVector[i];
      Ai[2][i] = cVector[i];
    }
    volume = determinant3(Ai);
    if (abs(volume) < MIN_VOLUME || Double.isNaN(volume)) {
      throw new IllegalArgumentException(format(" Degenerate cell volume %12.6e.", volume));
    }
    a = length(aVector);
    b = length(bVector);
    c = length(cVector);
    alpha = angle(bVector, cVector);
    beta = angle(aVector, cVector);
    gamma = angle(aVector, bVector);
    invert();
  }

  /**
   * Create a Lattice from Cartesian row vectors.
   *
   * @param aVector the a vector.
   * @param bVector the b vector.
   * @param cVector the c vector.
   * @return a new Lattice.
   * @throws IllegalArgumentException if the vectors are (nearly) coplanar.
   */
  public static Lattice fromVectors(double[] aVector, double[] bVector, double[] cVector) {
    return new Lattice(aVector, bVector, cVector);
  }

  private static double angle(double[] u, double[] v) {
    double cosine = dot(u, v) / (length(u) * length(v));
    return toDegrees(acos(max(-1.0, min(1.0, cosine))));
  }

  private void invert() {
    RealMatrix m = new Array2DRowRealMatrix(Ai, true);
    m = new LUDecomposition(m).getSolver().getInverse();
    double[][] inverse = m.getData();
    for (int i = 0; i < 3; i++) {
      System.arraycopy(inverse[i], 0, A[i], 0, 3);
    }
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        Gstar[i][j] = A[0][i] * A[0][j] + A[1][i] * A[1][j] + A[2][i] * A[2][j];
      }
    }
  }

  /**
   * The Cartesian lattice vector for an axis.
   *
   * @param axis 0, 1 or 2 for a, b or c.
   * @return a copy of the vector.
   */
  public double[] getVector(int axis) {
    return Ai[axis].clone();
  }

  /**
   * A copy of the direct matrix, whose rows are the Cartesian lattice vectors.
   *
   * @return the direct matrix.
   */
  public double[][] getMatrix() {
    return new double[][] {Ai[0].clone(), Ai[1].clone(), Ai[2].clone()};
  }

  /**
   * Convert an integer combination of lattice vectors into a Cartesian vector.
   *
   * @param indices the integer coefficients [u v w].
   * @return the Cartesian vector u*a + v*b + w*c.
   */
  public double[] toCartesian(int[] indices) {
    return vecMat(new double[] {indices[0], indices[1], indices[2]}, Ai);
  }

  /**
   * Apply the fractional to Cartesian transform.
   *
   * @param xf Input fractional coordinates.
   * @return Cartesian coordinates.
   */
  public double[] toCartesian(double[] xf) {
    return vecMat(xf, Ai);
  }

  /**
   * Apply the Cartesian to fractional transform.
   *
   * @param x Input Cartesian coordinates.
   * @return Fractional coordinates.
   */
  public double[] toFractional(double[] x) {
    return vecMat(x, A);
  }

  /**
   * The Cartesian reciprocal lattice vector g = h*a* + k*b* + l*c* of a plane, which is normal to
   * the plane and has length 1/d.
   *
   * @param hkl the Miller indices.
   * @return the reciprocal vector.
   */
  public double[] reciprocalVector(MillerIndices hkl) {
    int h = hkl.h();
    int k = hkl.k();
    int l = hkl.l();
    double[] g = new double[3];
    for (int i = 0; i < 3; i++) {
      g[i] = h * A[i][0] + k * A[i][1] + l * A[i][2];
    }
    return g;
  }

  /**
   * Interplanar spacing d(hkl) = 1 / sqrt(h' G* h).
   *
   * @param hkl the Miller indices.
   * @return the spacing in Angstroms.
   */
  public double dSpacing(MillerIndices hkl) {
    return 1.0 / sqrt(quadForm(hkl.toArray(), Gstar));
  }

  /**
   * The spacing between adjacent lattice planes parallel to two basis vectors, i.e. the inverse
   * length of a reciprocal basis vector.
   *
   * @param axis 0, 1 or 2 for the planes normal to a*, b* or c*.
   * @return the plane spacing in Angstroms.
   */
  public double planeSpacing(int axis) {
    return 1.0 / sqrt(Gstar[axis][axis]);
  }

  private static double quadForm(int[] v, double[][] m) {
    double sum = 0.0;
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        sum += v[i] * m[i][j] * v[j];
      }
    }
    return sum;
  }

  /**
   * Apply the minimum image convention to a Cartesian displacement.
   *
   * @param dx the displacement.
   * @return the shortest equivalent displacement, approximated by rounding the fractional
   *     components (exact for reduced cells).
   */
  public double[] image(double[] dx) {
    double[] xf = toFractional(dx);
    for (int i = 0; i < 3; i++) {
      xf[i] -= floor(xf[i] + 0.5);
    }
    return toCartesian(xf);
  }

  /**
   * Wrap fractional coordinates into [0, 1).
   *
   * @param xf fractional coordinates.
   * @return new wrapped coordinates.
   */
  public static double[] wrap(double[] xf) {
    return new double[] {ScalarMath.mod(xf[0], 1.0), ScalarMath.mod(xf[1], 1.0),
        ScalarMath.mod(xf[2], 1.0)};
  }

  /**
   * A String containing the lattice parameters.
   *
   * @return a String with the lattice parameters.
   */
  public String toShortString() {
    return format("%6.2f %6.2f %6.2f %6.2f %6.2f %6.2f", a, b, c, alpha, beta, gamma);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Unit cell: %10.4f %10.4f %10.4f %8.3f %8.3f %8.3f (V = %12.4f)", a, b, c,
        alpha, beta, gamma, volume);
  }

  /**
   * Two lattices are equal when their Cartesian basis vectors are identical.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Lattice other)) {
      return false;
    }
    return Arrays.deepEquals(Ai, other.Ai);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(Ai);
  }
}
