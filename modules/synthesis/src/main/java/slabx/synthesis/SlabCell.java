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

import static java.lang.String.format;

import slabx.crystal.Lattice;
import slabx.crystal.SurfaceBasis;
import slabx.numerics.math.IntegerMath;

/**
 * The periodic cell of a surface slab: the reduced in-plane vectors of a {@link SurfaceBasis}, and
 * a third vector spanning n stacking repeats of the transverse vector plus vacuum along the exact
 * plane normal.
 * <p>
 * Thickness and vacuum are measured along the normal, so the cell is oblique whenever the
 * transverse vector is sheared.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SlabCell {

  private final SurfaceBasis basis;
  private final Lattice lattice;
  private final int repeatCount;
  private final double requestedThickness;
  private final double vacuum;
  private final int[][] transform;

  SlabCell(SurfaceBasis basis, Lattice lattice, int repeatCount, double requestedThickness,
      double vacuum) {
    this.basis = basis;
    this.lattice = lattice;
    this.repeatCount = repeatCount;
    this.requestedThickness = requestedThickness;
    this.vacuum = vacuum;
    int[] w = basis.getTransverse();
    transform = new int[][] {basis.getReducedU(), basis.getReducedV(),
        {repeatCount * w[0], repeatCount * w[1], repeatCount * w[2]}};
  }

  /**
   * The slab lattice; rows u, v and c' in Cartesian coordinates.
   *
   * @return the lattice.
   */
  public Lattice getLattice() {
    return lattice;
  }

  /**
   * The surface basis the cell was built from.
   *
   * @return the surface basis.
   */
  public SurfaceBasis getSurfaceBasis() {
    return basis;
  }

  /**
   * Number of transverse repeats of the bulk cell spanned by the material.
   *
   * @return n.
   */
  public int getRepeatCount() {
    return repeatCount;
  }

  public double getDSpacing() {
    return basis.getDSpacing();
  }

  public double getRequestedThickness() {
    return requestedThickness;
  }

  /**
   * Thickness actually realised by the material, n * d(hkl).
   *
   * @return the material thickness in Angstroms.
   */
  public double getMaterialThickness() {
    return repeatCount * basis.getDSpacing();
  }

  public double getVacuum() {
    return vacuum;
  }

  /**
   * Height of the cell along the plane normal, material plus vacuum.
   *
   * @return the height in Angstroms.
   */
  public double getNormalLength() {
    return getMaterialThickness() + vacuum;
  }

  /**
   * Fraction of the normal height occupied by material.
   *
   * @return n*d / (n*d + vacuum).
   */
  public double getMaterialFraction() {
    return getMaterialThickness() / getNormalLength();
  }

  /**
   * The material Cartesian stacking vector n * w.
   *
   * @return the stacking vector.
   */
  public double[] getStackingVector() {
    return basis.getLattice().toCartesian(transform[2]);
  }

  /**
   * Integer transformation from the bulk lattice to the material block of the slab; rows are u, v
   * and n*w in bulk lattice coordinates.
   *
   * @return a copy of the matrix.
   */
  public int[][] getTransform() {
    return new int[][] {transform[0].clone(), transform[1].clone(), transform[2].clone()};
  }

  /**
   * Determinant of the transformation, the number of bulk cells in the material block.
   *
   * @return the determinant (equal to n).
   */
  public int getTransformDeterminant() {
    return IntegerMath.determinant3(transform);
  }

  @Override
  public String toString() {
    return format(" Slab cell for %s: %d repeats x %8.4f A = %8.4f A material + %8.4f A vacuum\n%s",
        basis.getMillerIndices(), repeatCount, basis.getDSpacing(), getMaterialThickness(),
        vacuum, lattice);
  }
}
