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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.length;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import slabx.crystal.Lattice;
import slabx.crystal.MillerIndices;
import slabx.crystal.SurfaceBasis;
import slabx.crystal.SurfaceBasisFinder;
import slabx.crystal.SurfaceCondition;
import slabx.crystal.SurfaceException;
import slabx.utilities.SlabXTest;

/**
 * Test slab cell construction across lattices and planes.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class SlabBuilderTest extends SlabXTest {

  private static final double TOLERANCE = 1.0e-8;

  private final String info;
  private final Lattice lattice;
  private final MillerIndices hkl;
  private final double thickness;
  private final double vacuum;

  public SlabBuilderTest(String info, Lattice lattice, int[] hkl, double thickness,
      double vacuum) {
    this.info = info;
    this.lattice = lattice;
    this.hkl = new MillerIndices(hkl[0], hkl[1], hkl[2]);
    this.thickness = thickness;
    this.vacuum = vacuum;
  }

  @Parameters
  public static Collection<Object[]> data() {
    Lattice cubic = new Lattice(4.0, 4.0, 4.0, 90.0, 90.0, 90.0);
    Lattice hexagonal = new Lattice(3.0, 3.0, 5.0, 90.0, 90.0, 120.0);
    Lattice triclinic = new Lattice(5.1, 6.3, 7.2, 81.0, 97.0, 104.0);
    return Arrays.asList(new Object[][] {
        {"Cubic (100)", cubic, new int[] {1, 0, 0}, 8.0, 10.0},
        {"Cubic (111)", cubic, new int[] {1, 1, 1}, 12.0, 15.0},
        {"Hexagonal (001)", hexagonal, new int[] {0, 0, 1}, 9.0, 0.0},
        {"Hexagonal (101)", hexagonal, new int[] {1, 0, 1}, 10.0, 12.0},
        {"Hexagonal (112)", hexagonal, new int[] {1, 1, 2}, 6.0, 7.5},
        {"Triclinic (1-12)", triclinic, new int[] {1, -1, 2}, 15.0, 15.0},
        {"Triclinic (210)", triclinic, new int[] {2, 1, 0}, 3.0, 20.0}
    });
  }

  @Test
  public void testRepeatCount() {
    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(lattice, hkl);
    SlabCell cell = SlabBuilder.buildSlabCell(lattice, basis, thickness, vacuum);
    double d = basis.getDSpacing();
    int n = cell.getRepeatCount();
    assertEquals(info, d, cell.getDSpacing(), 0.0);
    assertEquals(info, n * d, cell.getMaterialThickness(), TOLERANCE);
    assertTrue(info + " material covers the thickness",
        cell.getMaterialThickness() >= thickness - TOLERANCE);
    assertTrue(info + " the repeat count is minimal",
        n == 1 || (n - 1) * d < thickness - TOLERANCE);
    assertEquals(info, n, cell.getTransformDeterminant());
  }

  @Test
  public void testSlabGeometry() {
    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(lattice, hkl);
    SlabCell cell = SlabBuilder.buildSlabCell(lattice, basis, thickness, vacuum);
    Lattice slab = cell.getLattice();
    double[] normal = basis.getNormal();

    // In-plane vectors come straight from the reduced basis.
    assertArrayEquals(info, basis.getCartesianU(), slab.getVector(0), TOLERANCE);
    assertArrayEquals(info, basis.getCartesianV(), slab.getVector(1), TOLERANCE);
    assertEquals(info, 0.0, dot(slab.getVector(0), normal), TOLERANCE);
    assertEquals(info, 0.0, dot(slab.getVector(1), normal), TOLERANCE);

    // Thickness and vacuum are measured along the normal, whatever the shear.
    double height = dot(slab.getVector(2), normal);
    assertEquals(info, cell.getMaterialThickness() + vacuum, height, TOLERANCE);
    assertEquals(info, height, cell.getNormalLength(), TOLERANCE);
    assertTrue(info, length(slab.getVector(2)) >= height - TOLERANCE);

    // The material block holds n bulk cells.
    double area = lattice.volume / basis.getDSpacing();
    assertEquals(info, area * height, slab.volume, 1.0e-6 * slab.volume);
    assertEquals(info, cell.getMaterialThickness() / height, cell.getMaterialFraction(),
        TOLERANCE);
  }

  @Test
  public void testInvalidThicknessAndVacuum() {
    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(lattice, hkl);
    for (double bad : new double[] {0.0, -1.0, Double.NaN}) {
      try {
        SlabBuilder.buildSlabCell(lattice, basis, bad, vacuum);
        fail(info + " accepted thickness " + bad);
      } catch (SurfaceException e) {
        assertEquals(SurfaceCondition.THICKNESS_TOO_SMALL, e.getCondition());
      }
    }
    for (double bad : new double[] {-0.1, Double.NaN}) {
      try {
        SlabBuilder.buildSlabCell(lattice, basis, thickness, bad);
        fail(info + " accepted vacuum " + bad);
      } catch (SurfaceException e) {
        assertEquals(SurfaceCondition.INVALID_VACUUM, e.getCondition());
      }
    }
  }
}
