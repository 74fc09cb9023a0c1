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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static slabx.numerics.math.DoubleMath.X;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.length;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import slabx.numerics.math.IntegerMath;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class SurfaceBasisFinderTest extends SlabXTest {

  private static final double tolerance = 1.0e-8;

  @Parameters
  public static Collection<Object[]> data() {
    Lattice cubic = new Lattice(4.0, 4.0, 4.0, 90.0, 90.0, 90.0);
    Lattice hexagonal = new Lattice(3.2, 3.2, 5.2, 90.0, 90.0, 120.0);
    Lattice monoclinic = new Lattice(5.6, 7.1, 9.3, 90.0, 104.3, 90.0);
    Lattice triclinic = new Lattice(5.1, 6.3, 7.7, 81.0, 97.5, 103.2);
    return Arrays.asList(new Object[][] {
        {"Cubic (1 0 0)", cubic, new MillerIndices(1, 0, 0)},
        {"Cubic (1 1 0)", cubic, new MillerIndices(1, 1, 0)},
        {"Cubic (1 1 1)", cubic, new MillerIndices(1, 1, 1)},
        {"Cubic (0 0 -1)", cubic, new MillerIndices(0, 0, -1)},
        {"Cubic (3 2 1)", cubic, new MillerIndices(3, 2, 1)},
        {"Hexagonal (0 0 1)", hexagonal, new MillerIndices(0, 0, 1)},
        {"Hexagonal (1 0 1)", hexagonal, new MillerIndices(1, 0, 1)},
        {"Monoclinic (2 0 -1)", monoclinic, new MillerIndices(2, 0, -1)},
        {"Monoclinic (1 1 1)", monoclinic, new MillerIndices(1, 1, 1)},
        {"Triclinic (1 2 3)", triclinic, new MillerIndices(1, 2, 3)},
        {"Triclinic (-2 1 5)", triclinic, new MillerIndices(-2, 1, 5)},
        {"Triclinic (4 6 0)", triclinic, new MillerIndices(4, 6, 0)}
    });
  }

  private final String info;
  private final Lattice lattice;
  private final MillerIndices hkl;
  private final SurfaceBasis basis;

  public SurfaceBasisFinderTest(String info, Lattice lattice, MillerIndices hkl) {
    this.info = info;
    this.lattice = lattice;
    this.hkl = hkl;
    this.basis = SurfaceBasisFinder.findSurfaceBasis(lattice, hkl);
  }

  @Test
  public void testInPlaneVectorsAreNormalToReciprocalVector() {
    double[] g = lattice.reciprocalVector(hkl);
    assertEquals(info, 0.0, dot(basis.getCartesianU(), g), tolerance);
    assertEquals(info, 0.0, dot(basis.getCartesianV(), g), tolerance);
    assertEquals(info, 0.0, dot(lattice.toCartesian(basis.getPlaneU()), g), tolerance);
    assertEquals(info, 0.0, dot(lattice.toCartesian(basis.getPlaneV()), g), tolerance);
  }

  @Test
  public void testBasisIsPrimitiveAndRightHanded() {
    int[][] cell = {basis.getReducedU(), basis.getReducedV(), basis.getTransverse()};
    assertEquals(info, 1, IntegerMath.determinant3(cell));
    assertEquals(info, 1, IntegerMath.dot(hkl.toArray(), basis.getTransverse()));
    double[] cross = X(basis.getCartesianU(), basis.getCartesianV());
    assertTrue(info, dot(cross, basis.getNormal()) > 0.0);
  }

  @Test
  public void testTransverseProjectionIsDSpacing() {
    double projection = dot(basis.getCartesianTransverse(), basis.getNormal());
    assertEquals(info, lattice.dSpacing(hkl), projection, tolerance);
    assertEquals(info, basis.getDSpacing(), projection, tolerance);
  }

  @Test
  public void testReducedAreaMatchesPlaneArea() {
    double area = length(X(basis.getCartesianU(), basis.getCartesianV()));
    double expected = lattice.volume / lattice.dSpacing(hkl);
    assertEquals(info, expected, area, 1.0e-6 * expected);
    assertTrue(info, LatticeReduction.isReduced(lattice, basis.getReducedU(),
        basis.getReducedV()));
  }

  @Test
  public void testReductionIsIdempotent() {
    int[][] again = LatticeReduction.reduce(lattice, basis.getReducedU(), basis.getReducedV(),
        basis.getNormal());
    assertArrayEquals(info, basis.getReducedU(), again[0]);
    assertArrayEquals(info, basis.getReducedV(), again[1]);
  }

  @Test
  public void testShearIsMinimal() {
    // No single in-plane step shortens the in-plane part of the transverse vector.
    double shear = basis.getShear();
    int[][] steps = {basis.getReducedU(), basis.getReducedV()};
    for (int[] step : steps) {
      for (int sign : new int[] {-1, 1}) {
        int[] w = IntegerMath.addMultiple(basis.getTransverse(), sign, step);
        double[] wc = lattice.toCartesian(w);
        double[] n = basis.getNormal();
        double[] inPlane = {wc[0] - dot(wc, n) * n[0], wc[1] - dot(wc, n) * n[1],
            wc[2] - dot(wc, n) * n[2]};
        assertTrue(info, length(inPlane) >= shear - tolerance);
      }
    }
  }
}
