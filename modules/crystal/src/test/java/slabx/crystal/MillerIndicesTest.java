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
import static org.junit.Assert.fail;

import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class MillerIndicesTest extends SlabXTest {

  @Test
  public void testReduction() {
    MillerIndices hkl = new MillerIndices(2, -4, 6);
    assertArrayEquals(new int[] {1, -2, 3}, hkl.toArray());
    assertArrayEquals(new int[] {2, -4, 6}, hkl.getOriginal());
    assertEquals(new MillerIndices(1, -2, 3), hkl);
  }

  @Test
  public void testDegeneratePlane() {
    try {
      new MillerIndices(0, 0, 0);
      fail(" (0 0 0) should be rejected.");
    } catch (SurfaceException e) {
      assertEquals(SurfaceCondition.DEGENERATE_PLANE, e.getCondition());
      assertEquals(true, e.getCondition().isFatal());
    }
  }

  @Test
  public void testParse() {
    assertEquals(new MillerIndices(1, 1, 0), MillerIndices.parse("(110)"));
    assertEquals(new MillerIndices(1, -1, 0), MillerIndices.parse("1 -1 0"));
    assertEquals(new MillerIndices(1, -1, 2), MillerIndices.parse("(1-12)"));
    assertEquals(new MillerIndices(0, 0, 1), MillerIndices.parse("0,0,2"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseFailure() {
    MillerIndices.parse("one one zero");
  }
}
