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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class XYZFilterTest extends SlabXTest {

  private Path write(String text) throws IOException {
    Path path = registerTemporaryDirectory().resolve("fragment.xyz");
    Files.writeString(path, text, StandardCharsets.UTF_8);
    return path;
  }

  @Test
  public void testReadFragment() throws IOException {
    Path path = write("3\nzinc carboxylate node\nZn 0.0 0.0 0.0\nO1 1.95 0.0 0.0\n"
        + "C  2.60   1.05  -0.25\n");
    List<XYZFilter.CartesianSite> sites = XYZFilter.readCartesian(path);
    assertEquals(3, sites.size());
    assertEquals("Zn", sites.get(0).element());
    assertEquals("O", sites.get(1).element());
    assertArrayEquals(new double[] {2.60, 1.05, -0.25}, sites.get(2).getXYZ(), 0.0);
  }

  @Test
  public void testOnlyTheFirstFrameIsRead() throws IOException {
    Path path = write("1\n\nAr 1.0 2.0 3.0\n1\n\nAr 9.0 9.0 9.0\n");
    List<XYZFilter.CartesianSite> sites = XYZFilter.readCartesian(path);
    assertEquals(1, sites.size());
    assertEquals(1.0, sites.get(0).x(), 0.0);
  }

  @Test(expected = IOException.class)
  public void testMissingCount() throws IOException {
    XYZFilter.readCartesian(write("Zn 0.0 0.0 0.0\n"));
  }

  @Test(expected = IOException.class)
  public void testTruncatedFile() throws IOException {
    XYZFilter.readCartesian(write("2\ncomment\nZn 0.0 0.0 0.0\n"));
  }

  @Test(expected = IOException.class)
  public void testInvalidCoordinate() throws IOException {
    XYZFilter.readCartesian(write("1\ncomment\nZn 0.0 zero 0.0\n"));
  }
}
