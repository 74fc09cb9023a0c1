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

/**
 * The ScalarMath class is a simple math library that operates on single variables
 *
 * @author Jacob M. Litman
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ScalarMath {

  private ScalarMath() {
    // Prevent instantiation.
  }

  /**
   * This is an atypical mod function used by crystallography methods.
   * <p>
   * The result is always in [0, b), including for tiny negative inputs whose naive result rounds
   * up to b.
   *
   * @param a Value to mod.
   * @param b Value to mod by.
   * @return Positive a % b.
   */
  public static double mod(double a, double b) {
    var res = a % b;
    if (res < 0.0) {
      res += b;
    }
    if (res >= b) {
      res = 0.0;
    }
    return res;
  }

  /**
   * Atypical mod function used to move a value into the range lb &lt;= value &lt; ub, assuming the
   * domain is periodic with a period of (ub - lb).
   *
   * @param value Value to move between bounds.
   * @param lb Lower bound.
   * @param ub Upper bound.
   * @return Returns periodic copy of value, in the range lb &lt;= value &lt; ub.
   */
  public static double modToRange(double value, double lb, double ub) {
    return mod(value - lb, ub - lb) + lb;
  }

  /**
   * Signed distance on a circle of unit period: the value of (a - b) moved into [-0.5, 0.5).
   *
   * @param a First coordinate.
   * @param b Second coordinate.
   * @return Returns the minimum-image difference.
   */
  public static double periodicDelta(double a, double b) {
    return modToRange(a - b, -0.5, 0.5);
  }
}
