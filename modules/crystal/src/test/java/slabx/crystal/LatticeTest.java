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

import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class LatticeTest extends SlabXTest {

  private static final double tolerance = 1.0e-10;

  @Test
  public void testFractionalCartesianRoundTrip() {
    Lattice lattice = new Lattice(5.1, 6.3, 7.7, 81.0, 97.5, 103.2);
    double[] xf = {0.13, 0.71, 0.42};
    double[] back = lattice.toFractional(lattice.toCartesian(xf));
    assertArrayEquals(xf, back, tolerance);
  }

  @Test
  public void testFromVectorsRecoversParameters() {
    Lattice lattice = new Lattice(5.1, 6.3, 7.7, 81.0, 97.5, 103.2);
    Lattice copy = Lattice.fromVectors(lattice.getVector(0), lattice.getVector(1),
        lattice.getVector(2));
    assertEquals(lattice.a, copy.a, tolerance);
    assertEquals(lattice.b, copy.b, tolerance);
    assertEquals(lattice.c, copy.c, tolerance);
    assertEquals(lattice.alpha, copy.alpha, 1.0e-8);
    assertEquals(lattice.beta, copy.beta, 1.0e-8);
    assertEquals(lattice.gamma, copy.gamma, 1.0e-8);
    assertEquals(lattice.volume, copy.volume, 1.0e-8);
    assertEquals(lattice, copy);
  }

  @Test
  public void testCubicDSpacing() {
    Lattice lattice = new Lattice(4.0, 4.0, 4.0, 90.0, 90.0, 90.0);
    assertEquals(4.0, lattice.dSpacing(new MillerIndices(1, 0, 0)), tolerance);
    assertEquals(4.0 / sqrt(2.0), lattice.dSpacing(new MillerIndices(1, 1, 0)), tolerance);
    assertEquals(4.0 / sqrt(3.0), lattice.dSpacing(new MillerIndices(1, 1, 1)), tolerance);
    // Indices are reduced before the spacing is computed.
    assertEquals(4.0 / sqrt(2.0), lattice.dSpacing(new MillerIndices(2, 2, 0)), tolerance);
  }

  @Test
  public void testHexagonalDSpacing() {
    Lattice lattice = new Lattice(3.0, 3.0, 5.0, 90.0, 90.0, 120.0);
    assertEquals(3.0 * sqrt(3.0) / 2.0, lattice.dSpacing(new MillerIndices(1, 0, 0)), tolerance);
    assertEquals(5.0, lattice.dSpacing(new MillerIndices(0, 0, 1)), tolerance);
  }

  @Test
  public void testMinimumImage() {
    Lattice lattice = new Lattice(10.0, 10.0, 10.0, 90.0, 90.0, 90.0);
    assertArrayEquals(new double[] {-1.0, 2.0, 0.0},
        lattice.image(new double[] {9.0, 2.0, 10.0}), tolerance);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDegenerateVectors() {
    Lattice.fromVectors(new double[] {1.0, 0.0, 0.0}, new double[] {0.0, 1.0, 0.0},
        new double[] {1.0, 1.0, 0.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidAngles() {
    new Lattice(4.0, 4.0, 4.0, 150.0, 150.0, 150.0);
  }
}
