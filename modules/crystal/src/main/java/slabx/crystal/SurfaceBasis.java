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
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.toDegrees;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.fma;
import static slabx.numerics.math.DoubleMath.length;

import slabx.numerics.math.IntegerMath;

/**
 * The SurfaceBasis of a plane: two integer lattice vectors spanning the (hkl) plane, one transverse
 * integer vector crossing exactly one plane spacing, and the reduced version of the in-plane pair.
 * <p>
 * Instances are created by {@link SurfaceBasisFinder} and never mutated.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SurfaceBasis {

  private final Lattice lattice;
  private final MillerIndices millerIndices;
  private final int[] planeU;
  private final int[] planeV;
  private final int[] reducedU;
  private final int[] reducedV;
  private final int[] transverse;
  private final double[] normal;
  private final double dSpacing;

  SurfaceBasis(Lattice lattice, MillerIndices millerIndices, int[] planeU, int[] planeV,
      int[] reducedU, int[] reducedV, int[] transverse) {
    this.lattice = lattice;
    this.millerIndices = millerIndices;
    this.planeU = planeU.clone();
    this.planeV = planeV.clone();
    this.reducedU = reducedU.clone();
    this.reducedV = reducedV.clone();
    this.transverse = transverse.clone();
    double[] g = lattice.reciprocalVector(millerIndices);
    double gLength = length(g);
    this.normal = new double[] {g[0] / gLength, g[1] / gLength, g[2] / gLength};
    this.dSpacing = 1.0 / gLength;
  }

  /**
   * The lattice the basis was derived from.
   *
   * @return the lattice.
   */
  public Lattice getLattice() {
    return lattice;
  }

  /**
   * The (reduced) Miller indices of the plane.
   *
   * @return the Miller indices.
   */
  public MillerIndices getMillerIndices() {
    return millerIndices;
  }

  /**
   * First in-plane vector from the extended Euclidean construction, before reduction.
   *
   * @return lattice indices.
   */
  public int[] getPlaneU() {
    return planeU.clone();
  }

  /**
   * Second in-plane vector from the extended Euclidean construction, before reduction.
   *
   * @return lattice indices.
   */
  public int[] getPlaneV() {
    return planeV.clone();
  }

  /**
   * First reduced in-plane vector (the shortest lattice vector in the plane).
   *
   * @return lattice indices.
   */
  public int[] getReducedU() {
    return reducedU.clone();
  }

  /**
   * Second reduced in-plane vector.
   *
   * @return lattice indices.
   */
  public int[] getReducedV() {
    return reducedV.clone();
  }

  /**
   * Transverse vector with h.w = 1 and minimal in-plane (shear) component.
   *
   * @return lattice indices.
   */
  public int[] getTransverse() {
    return transverse.clone();
  }

  /**
   * Unit Cartesian plane normal, parallel to the reciprocal vector of the plane.
   *
   * @return the normal.
   */
  public double[] getNormal() {
    return normal.clone();
  }

  /**
   * The interplanar spacing, which equals the projection of the transverse vector on the normal.
   *
   * @return d(hkl) in Angstroms.
   */
  public double getDSpacing() {
    return dSpacing;
  }

  /**
   * Cartesian first reduced in-plane vector.
   *
   * @return the vector.
   */
  public double[] getCartesianU() {
    return lattice.toCartesian(reducedU);
  }

  /**
   * Cartesian second reduced in-plane vector.
   *
   * @return the vector.
   */
  public double[] getCartesianV() {
    return lattice.toCartesian(reducedV);
  }

  /**
   * Cartesian transverse vector.
   *
   * @return the vector.
   */
  public double[] getCartesianTransverse() {
    return lattice.toCartesian(transverse);
  }

  /**
   * Length of the in-plane (shear) component of the transverse vector.
   *
   * @return the shear in Angstroms.
   */
  public double getShear() {
    double[] w = getCartesianTransverse();
    return length(fma(normal, -dot(w, normal), w));
  }

  /**
   * Ratio of the longer to the shorter reduced in-plane vector.
   *
   * @return the aspect ratio (at least 1).
   */
  public double getAspectRatio() {
    double lu = length(getCartesianU());
    double lv = length(getCartesianV());
    return max(lu, lv) / min(lu, lv);
  }

  /**
   * Angle between the reduced in-plane vectors.
   *
   * @return the angle in degrees.
   */
  public double getInPlaneAngle() {
    double[] u = getCartesianU();
    double[] v = getCartesianV();
    double cosine = dot(u, v) / (length(u) * length(v));
    return toDegrees(acos(max(-1.0, min(1.0, cosine))));
  }

  @Override
  public String toString() {
    return format(" Surface basis for %s (d = %8.4f A)\n"
            + "  u = %-12s |u| = %8.4f\n"
            + "  v = %-12s |v| = %8.4f (angle %6.2f)\n"
            + "  w = %-12s shear = %8.4f",
        millerIndices, dSpacing,
        IntegerMath.toString(reducedU), length(getCartesianU()),
        IntegerMath.toString(reducedV), length(getCartesianV()), getInPlaneAngle(),
        IntegerMath.toString(transverse), getShear());
  }
}
