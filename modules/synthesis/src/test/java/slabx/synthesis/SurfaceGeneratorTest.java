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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import slabx.crystal.Atom;
import slabx.crystal.ChemistryTagger;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;
import slabx.crystal.MillerIndices;
import slabx.crystal.RoleTag;
import slabx.crystal.SurfaceCondition;
import slabx.crystal.SurfaceException;
import slabx.crystal.TaggingUnavailableException;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class SurfaceGeneratorTest extends SlabXTest {

  private static final double TOLERANCE = 1.0e-8;

  private static Crystal network() {
    Lattice lattice = new Lattice(2.0, 2.0, 2.0, 90.0, 90.0, 90.0);
    return new Crystal("network", lattice,
        List.of(new Atom("Po", new double[] {0.0, 0.0, 0.0})));
  }

  @Test
  public void testCubicExample() {
    Crystal crystal = SlabFixtures.simpleCubic();
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0).build();
    SurfaceResult result = new SurfaceGenerator(config)
        .generate(crystal, new MillerIndices(1, 0, 0));

    SlabCrystal slab = result.slab();
    assertEquals(2, slab.getAtomCount());
    assertTrue(slab.getLattice().c >= 18.0 - TOLERANCE);
    assertArrayEquals(crystal.getLattice().getVector(1), slab.getLattice().getVector(0),
        TOLERANCE);
    assertArrayEquals(crystal.getLattice().getVector(2), slab.getLattice().getVector(1),
        TOLERANCE);
    assertEquals(0.5, result.offset().offset(), TOLERANCE);
    assertTrue(result.advisories().isEmpty());
    assertTrue(result.report().contains("(1 0 0)"));
    for (int i = 0; i < slab.getAtomCount(); i++) {
      assertTrue(slab.getNormalPosition(i) < result.slabCell().getMaterialThickness());
    }
  }

  @Test
  public void testDegeneratePlane() {
    try {
      new MillerIndices(0, 0, 0);
      fail(" (0 0 0) was accepted.");
    } catch (SurfaceException e) {
      assertEquals(SurfaceCondition.DEGENERATE_PLANE, e.getCondition());
      assertTrue(e.getCondition().isFatal());
    }
  }

  @Test
  public void testGeometryErrorsAreFatal() {
    Crystal crystal = SlabFixtures.simpleCubic();
    MillerIndices hkl = new MillerIndices(1, 0, 0);
    try {
      new SurfaceGenerator(SurfaceConfig.builder().thickness(0.0).build()).generate(crystal, hkl);
      fail(" A zero thickness was accepted.");
    } catch (SurfaceException e) {
      assertEquals(SurfaceCondition.THICKNESS_TOO_SMALL, e.getCondition());
    }
    try {
      new SurfaceGenerator(SurfaceConfig.builder().vacuum(-1.0).build()).generate(crystal, hkl);
      fail(" A negative vacuum was accepted.");
    } catch (SurfaceException e) {
      assertEquals(SurfaceCondition.INVALID_VACUUM, e.getCondition());
    }
  }

  @Test
  public void testNoSafeOffsetIsFatal() {
    SurfaceConfig config = SurfaceConfig.builder().bondCutoff(2.1).build();
    try {
      new SurfaceGenerator(config).generate(network(), new MillerIndices(1, 0, 0));
      fail(" A fully bonded network was cut.");
    } catch (SurfaceException e) {
      assertEquals(SurfaceCondition.NO_SAFE_OFFSET_FOUND, e.getCondition());
    }
  }

  @Test
  public void testExplicitOffsetDowngradesToAdvisory() {
    SurfaceConfig config = SurfaceConfig.builder().bondCutoff(2.1).thickness(4.0).vacuum(5.0)
        .offset(0.3).build();
    SurfaceResult result = new SurfaceGenerator(config)
        .generate(network(), new MillerIndices(1, 0, 0));
    assertTrue(result.hasAdvisory(SurfaceCondition.UNSAFE_OFFSET));
    assertFalse(result.offset().safe());
    assertEquals(2, result.slab().getAtomCount());
  }

  @Test
  public void testUnsafeExplicitOffset() {
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0).offset(0.0)
        .build();
    SurfaceResult result = new SurfaceGenerator(config)
        .generate(SlabFixtures.simpleCubic(), new MillerIndices(1, 0, 0));
    assertEquals(1, result.advisories().size());
    assertEquals(SurfaceCondition.UNSAFE_OFFSET, result.advisories().get(0).condition());
    assertFalse(result.advisories().get(0).condition().isFatal());
    assertEquals(2, result.slab().getAtomCount());
  }

  @Test
  public void testCenteredSlab() {
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0).centerSlab(true)
        .build();
    SurfaceResult result = new SurfaceGenerator(config)
        .generate(SlabFixtures.simpleCubic(), new MillerIndices(1, 0, 0));
    assertEquals(7.0, result.slab().getNormalPosition(0), TOLERANCE);
    assertEquals(11.0, result.slab().getNormalPosition(1), TOLERANCE);
  }

  @Test
  public void testReconstructionConservesCharge() {
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0).bondCutoff(1.0)
        .offset(0.0).strategy(ReconstructionStrategy.TRANSFER_IONS).build();
    Crystal crystal = SlabFixtures.polarLayers();
    SurfaceResult result = new SurfaceGenerator(config)
        .generate(crystal, new MillerIndices(0, 0, 1));
    assertTrue(result.advisories().isEmpty());
    assertEquals(1, result.reconstruction().ionsMoved());
    assertEquals(0.0, result.reconstruction().dipoleAfter(), TOLERANCE);
    assertEquals(0.0, result.slab().getTotalCharge(), TOLERANCE);
    assertEquals(2 * crystal.getAtomCount(), result.slab().getAtomCount());
  }

  @Test
  public void testTaggingFailureDegrades() {
    ChemistryTagger broken = crystal -> {
      throw new TaggingUnavailableException("sbu executable not found");
    };
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0)
        .preferredRole(RoleTag.NODE).build();
    SurfaceResult result = new SurfaceGenerator(config, broken)
        .generate(SlabFixtures.simpleCubic(), new MillerIndices(1, 0, 0));
    assertTrue(result.hasAdvisory(SurfaceCondition.TAGGING_UNAVAILABLE));
    assertEquals(2, result.slab().getAtomCount());
    assertFalse(result.slab().hasRoles());
  }

  @Test
  public void testTagsReachTheSlab() {
    ChemistryTagger tagger = crystal -> {
      Map<Integer, RoleTag> roles = new HashMap<>();
      for (int i = 0; i < crystal.getAtomCount(); i++) {
        roles.put(i, RoleTag.NODE);
      }
      return roles;
    };
    SurfaceConfig config = SurfaceConfig.builder().thickness(8.0).vacuum(10.0)
        .preferredRole(RoleTag.NODE).build();
    SurfaceResult result = new SurfaceGenerator(config, tagger)
        .generate(SlabFixtures.simpleCubic(), new MillerIndices(1, 0, 0));
    assertTrue(result.advisories().isEmpty());
    for (Atom atom : result.slab().getAtoms()) {
      assertEquals(RoleTag.NODE, atom.getRole());
    }
  }
}
