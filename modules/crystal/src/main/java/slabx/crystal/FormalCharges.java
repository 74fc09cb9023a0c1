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

import java.util.Map;

/**
 * Guesses formal charges from element symbols using common oxidation states.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FormalCharges {

  private static final Map<String, Double> COMMON_OXIDATION_STATES = Map.ofEntries(
      Map.entry("H", 1.0),
      Map.entry("Li", 1.0),
      Map.entry("Na", 1.0),
      Map.entry("K", 1.0),
      Map.entry("Rb", 1.0),
      Map.entry("Cs", 1.0),
      Map.entry("Mg", 2.0),
      Map.entry("Ca", 2.0),
      Map.entry("Sr", 2.0),
      Map.entry("Ba", 2.0),
      Map.entry("Zn", 2.0),
      Map.entry("Fe", 2.0),
      Map.entry("Al", 3.0),
      Map.entry("F", -1.0),
      Map.entry("Cl", -1.0),
      Map.entry("Br", -1.0),
      Map.entry("I", -1.0),
      Map.entry("O", -2.0),
      Map.entry("S", -2.0),
      Map.entry("N", -3.0));

  private FormalCharges() {
  }

  /**
   * Guess the formal charge of an element.
   *
   * @param element the element symbol.
   * @return the common oxidation state, or 0.0 for unlisted elements.
   */
  public static double guess(String element) {
    return COMMON_OXIDATION_STATES.getOrDefault(element, 0.0);
  }

  /**
   * Charge every atom that carries no charge yet.
   *
   * @param crystal the crystal.
   * @return a new Crystal in which every atom is charged.
   */
  public static Crystal assign(Crystal crystal) {
    return crystal.mapAtoms(
        atom -> atom.hasCharge() ? atom : atom.withCharge(guess(atom.getElement())));
  }
}
