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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class AtomTest extends SlabXTest {

  @Test
  public void testElementOf() {
    assertEquals("Fe", Atom.elementOf("Fe3+"));
    assertEquals("O", Atom.elementOf("O2-"));
    assertEquals("C", Atom.elementOf("C12A"));
    assertEquals("Cl", Atom.elementOf("CL1"));
    assertEquals("Zn", Atom.elementOf("Zn1"));
  }

  @Test
  public void testChargeOf() {
    assertEquals(3.0, Atom.chargeOf("Fe3+"), 0.0);
    assertEquals(-2.0, Atom.chargeOf("O2-"), 0.0);
    assertEquals(1.0, Atom.chargeOf("Na+"), 0.0);
    assertNull(Atom.chargeOf("O2"));
  }

  @Test
  public void testCoordinatesAreWrapped() {
    Atom atom = new Atom("Na", new double[] {-0.25, 1.5, 3.0});
    assertArrayEquals(new double[] {0.75, 0.5, 0.0}, atom.getXYZ(), 1.0e-12);
    assertFalse(atom.hasCharge());
    assertEquals(RoleTag.UNKNOWN, atom.getRole());
  }

  @Test
  public void testCrystalComposition() {
    Lattice lattice = new Lattice(5.64, 5.64, 5.64, 90.0, 90.0, 90.0);
    Crystal crystal = new Crystal("rocksalt", lattice, List.of(
        new Atom("Na+", new double[] {0.0, 0.0, 0.0}),
        new Atom("Cl-", new double[] {0.5, 0.5, 0.5}),
        new Atom("Na+", new double[] {0.5, 0.5, 0.0}),
        new Atom("Cl-", new double[] {0.0, 0.0, 0.5})));
    assertEquals(Map.of("Cl", 2, "Na", 2), crystal.getComposition());
    assertTrue(crystal.hasCharges());
    assertEquals(0.0, crystal.getTotalCharge(), 0.0);
    assertEquals("Cl2 Na2", crystal.getFormula());

    Crystal tagged = crystal.withRoles(Map.of(0, RoleTag.NODE));
    assertEquals(RoleTag.NODE, tagged.getAtom(0).getRole());
    assertEquals(RoleTag.UNKNOWN, tagged.getAtom(1).getRole());
    assertFalse(crystal.hasRoles());
  }

  @Test
  public void testGuessedCharges() {
    Lattice lattice = new Lattice(4.2, 4.2, 4.2, 90.0, 90.0, 90.0);
    Crystal crystal = new Crystal("periclase", lattice, List.of(
        new Atom("Mg1", new double[] {0.0, 0.0, 0.0}),
        new Atom("O1", new double[] {0.5, 0.5, 0.5})));
    assertFalse(crystal.hasCharges());
    Crystal charged = FormalCharges.assign(crystal);
    assertTrue(charged.hasCharges());
    assertEquals(2.0, charged.getAtom(0).getCharge(), 0.0);
    assertEquals(-2.0, charged.getAtom(1).getCharge(), 0.0);
    assertEquals(0.0, FormalCharges.guess("Xe"), 0.0);
  }
}
