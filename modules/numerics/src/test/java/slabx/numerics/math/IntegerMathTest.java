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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static slabx.numerics.math.IntegerMath.X;
import static slabx.numerics.math.IntegerMath.dot;
import static slabx.numerics.math.IntegerMath.extendedGcd;
import static slabx.numerics.math.IntegerMath.gcd;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class IntegerMathTest extends SlabXTest {

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Coprime", 3, 7, 1},
        {"Common factor", 12, 18, 6},
        {"Negative first", -4, 6, 2},
        {"Negative second", 9, -6, 3},
        {"Zero first", 0, 5, 5},
        {"Zero second", -5, 0, 5},
        {"Both zero", 0, 0, 0}
    });
  }

  private final String info;
  private final int a;
  private final int b;
  private final int expected;

  public IntegerMathTest(String info, int a, int b, int expected) {
    this.info = info;
    this.a = a;
    this.b = b;
    this.expected = expected;
  }

  @Test
  public void testGcd() {
    assertEquals(info, expected, gcd(a, b));
  }

  @Test
  public void testBezoutIdentity() {
    long[] egcd = extendedGcd(a, b);
    assertEquals(info, expected, egcd[0]);
    assertEquals(info, egcd[0], a * egcd[1] + b * egcd[2]);
  }

  @Test
  public void testCrossIsOrthogonal() {
    int[] u = {a, b, 1};
    int[] v = {b, 2, -a};
    int[] w = X(u, v);
    assertEquals(info, 0, dot(u, w));
    assertEquals(info, 0, dot(v, w));
    assertArrayEquals(info, IntegerMath.negate(w), X(v, u));
  }
}
