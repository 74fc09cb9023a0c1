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
package slabx.chemistry;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class FragmentArtifactsTest extends SlabXTest {

  private static final String CIF = "data_fragment\n_cell_length_a 10.0\n_cell_length_b 10.0\n"
      + "_cell_length_c 10.0\n_cell_angle_alpha 90.0\n_cell_angle_beta 90.0\n"
      + "_cell_angle_gamma 90.0\nloop_\n_atom_site_label\n_atom_site_type_symbol\n"
      + "_atom_site_fract_x\n_atom_site_fract_y\n_atom_site_fract_z\n";

  private static void write(Path path, String text) throws IOException {
    Files.createDirectories(path.getParent());
    Files.writeString(path, text, StandardCharsets.UTF_8);
  }

  @Test
  public void testXYZFragments() throws IOException {
    Path root = registerTemporaryDirectory();
    write(root.resolve("Nodes/node_1.xyz"), "2\nZn node\nZn 0.0 0.0 0.0\nO 2.0 0.0 0.0\n");
    write(root.resolve("Linkers/linker_1.xyz"), "1\n\nC 5.0 5.0 5.0\n");
    write(root.resolve("Linkers/linker_2.xyz"), "1\n\nH 6.0 5.0 5.0\n");
    write(root.resolve("Linkers/notes.txt"), "ignored\n");

    FragmentArtifacts artifacts = FragmentArtifacts.locate(root);
    assertEquals(1, artifacts.getNodes().size());
    assertEquals(2, artifacts.getNodes().get(0).size());
    assertEquals(2, artifacts.getLinkers().size());
    assertEquals(6.0, artifacts.getLinkers().get(1).get(0)[0], 0.0);
  }

  @Test
  public void testCIFFallbackPrefersEdges() throws IOException {
    Path root = registerTemporaryDirectory();
    write(root.resolve("nodes.cif"), CIF + "Zn1 Zn 0.0 0.0 0.0\n");
    write(root.resolve("edges.cif"), CIF + "C1 C 0.5 0.5 0.5\nH1 H 0.6 0.5 0.5\n");
    write(root.resolve("linkers.cif"), CIF + "C1 C 0.1 0.1 0.1\n");

    FragmentArtifacts artifacts = FragmentArtifacts.locate(root);
    assertEquals(1, artifacts.getNodes().size());
    assertEquals(1, artifacts.getLinkers().size());
    assertEquals(2, artifacts.getLinkers().get(0).size());
    assertEquals(6.0, artifacts.getLinkers().get(0).get(1)[0], 1.0e-8);
  }

  @Test(expected = IOException.class)
  public void testNoFragments() throws IOException {
    FragmentArtifacts.locate(registerTemporaryDirectory());
  }

  @Test(expected = IOException.class)
  public void testMissingDirectory() throws IOException {
    FragmentArtifacts.locate(registerTemporaryDirectory().resolve("absent"));
  }
}
