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
package slabx.parsers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;
import slabx.crystal.Atom;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;
import slabx.crystal.RoleTag;
import slabx.utilities.SlabXTest;

/**
 * @author Aaron J. Nessler
 * @author Michael J. Schnieders
 */
public class CIFFilterTest extends SlabXTest {

  private static final double TOLERANCE = 1.0e-6;

  @Test
  public void testReadRockSalt() throws IOException {
    Crystal crystal = CIFFilter.read(getResourcePath("slabx/parsers/rocksalt.cif"));
    assertEquals("NaCl", crystal.getName());
    assertEquals(5.6402, crystal.getLattice().a, TOLERANCE);
    assertEquals(90.0, crystal.getLattice().gamma, TOLERANCE);
    assertEquals(8, crystal.getAtomCount());
    assertEquals("Cl4 Na4", crystal.getFormula());
    assertTrue(crystal.hasCharges());
    assertEquals(0.0, crystal.getTotalCharge(), TOLERANCE);
    Atom sodium = crystal.getAtom(1);
    assertEquals("Na", sodium.getElement());
    assertEquals(1.0, sodium.getCharge(), TOLERANCE);
    assertEquals(0.5, sodium.getXYZ(2), TOLERANCE);
    assertEquals(-1.0, crystal.getAtom(4).getCharge(), TOLERANCE);
  }

  @Test
  public void testReadCartesian() throws IOException {
    Crystal crystal = CIFFilter.read(getResourcePath("slabx/parsers/cartesian.cif"));
    assertEquals(2, crystal.getAtomCount());
    assertEquals("Zn", crystal.getAtom(0).getElement());
    Atom oxygen = crystal.getAtom(1);
    assertEquals("O", oxygen.getElement());
    assertEquals(0.5, oxygen.getXYZ(0), TOLERANCE);
    assertEquals(0.25, oxygen.getXYZ(1), TOLERANCE);
    assertEquals(0.75, oxygen.getXYZ(2), TOLERANCE);
    assertFalse(crystal.hasCharges());
  }

  @Test
  public void testSymmetryIsNotExpanded() throws IOException {
    Crystal crystal = CIFFilter.read(getResourcePath("slabx/parsers/spinel-asu.cif"));
    assertEquals(3, crystal.getAtomCount());
  }

  @Test
  public void testMissingCell() {
    try {
      CIFFilter.read(getResourcePath("slabx/parsers/nocell.cif"));
      fail(" A CIF without a unit cell was accepted.");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("unit cell"));
    }
  }

  @Test(expected = IOException.class)
  public void testMissingFile() throws IOException {
    CIFFilter.read(registerTemporaryDirectory().resolve("absent.cif"));
  }

  @Test
  public void testWrittenChargesAreReadBack() throws IOException {
    Lattice lattice = new Lattice(3.0, 4.0, 12.0, 90.0, 90.0, 100.0);
    Crystal slab = new Crystal("NaCl (1 1 0) slab", lattice, List.of(
        new Atom("Na", new double[] {0.0, 0.0, 0.1}, 1.0 / 3.0, RoleTag.UNKNOWN),
        new Atom("Cl", new double[] {0.5, 0.5, 0.1}, -1.0, RoleTag.UNKNOWN),
        new Atom("Na", new double[] {0.5, 0.0, 0.3}, 1.0, RoleTag.UNKNOWN),
        new Atom("Ar", new double[] {0.25, 0.75, 0.2})));
    Path path = registerTemporaryDirectory().resolve("slab.cif");
    CIFFilter.write(slab, path);

    Crystal read = CIFFilter.read(path);
    assertEquals("NaCl_(1_1_0)_slab", read.getName());
    assertEquals(lattice.c, read.getLattice().c, TOLERANCE);
    assertEquals(lattice.gamma, read.getLattice().gamma, TOLERANCE);
    assertEquals(slab.getAtomCount(), read.getAtomCount());
    for (int i = 0; i < slab.getAtomCount(); i++) {
      Atom expected = slab.getAtom(i);
      Atom actual = read.getAtom(i);
      assertEquals(expected.getElement(), actual.getElement());
      for (int axis = 0; axis < 3; axis++) {
        assertEquals(expected.getXYZ(axis), actual.getXYZ(axis), TOLERANCE);
      }
    }
    assertEquals(1.0 / 3.0, read.getAtom(0).getCharge(), 1.0e-4);
    assertEquals(-1.0, read.getAtom(1).getCharge(), TOLERANCE);
    assertEquals(1.0, read.getAtom(2).getCharge(), TOLERANCE);
    assertFalse(read.getAtom(3).hasCharge());
  }

  @Test
  public void testTypeSymbols() {
    double[] origin = {0.0, 0.0, 0.0};
    assertEquals("O2-", CIFFilter.typeSymbol(new Atom("O", origin, -2.0, null)));
    assertEquals("Fe3+", CIFFilter.typeSymbol(new Atom("Fe3+", origin)));
    assertEquals("Na0.5+", CIFFilter.typeSymbol(new Atom("Na", origin, 0.5, null)));
    assertEquals("C", CIFFilter.typeSymbol(new Atom("C12", origin)));
  }
}
