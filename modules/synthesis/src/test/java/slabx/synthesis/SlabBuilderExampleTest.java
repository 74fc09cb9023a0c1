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

import org.junit.Test;
import slabx.crystal.Lattice;
import slabx.crystal.MillerIndices;
import slabx.crystal.SurfaceBasis;
import slabx.crystal.SurfaceBasisFinder;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class SlabBuilderExampleTest extends SlabXTest {

  @Test
  public void testCubicSlabCell() {
    Lattice lattice = new Lattice(4.0, 4.0, 4.0, 90.0, 90.0, 90.0);
    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(lattice, new MillerIndices(1, 0, 0));
    SlabCell cell = SlabBuilder.buildSlabCell(lattice, basis, 8.0, 10.0);
    assertEquals(2, cell.getRepeatCount());
    assertTrue(cell.getLattice().c >= 18.0 - 1.0e-10);
    assertArrayEquals(lattice.getVector(1), cell.getLattice().getVector(0), 1.0e-12);
    assertArrayEquals(lattice.getVector(2), cell.getLattice().getVector(1), 1.0e-12);
    assertArrayEquals(new int[][] {{0, 1, 0}, {0, 0, 1}, {2, 0, 0}}, cell.getTransform());
  }

  @Test
  public void testExactMultipleDoesNotAddRepeat() {
    Lattice lattice = new Lattice(4.0, 4.0, 4.0, 90.0, 90.0, 90.0);
    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(lattice, new MillerIndices(1, 0, 0));
    assertEquals(2, SlabBuilder.buildSlabCell(lattice, basis, 7.9, 0.0).getRepeatCount());
    assertEquals(2, SlabBuilder.buildSlabCell(lattice, basis, 8.0, 0.0).getRepeatCount());
    assertEquals(3, SlabBuilder.buildSlabCell(lattice, basis, 8.1, 0.0).getRepeatCount());
    assertEquals(1, SlabBuilder.buildSlabCell(lattice, basis, 0.5, 0.0).getRepeatCount());
  }
}
