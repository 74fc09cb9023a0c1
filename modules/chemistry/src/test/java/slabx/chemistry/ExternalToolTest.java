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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import slabx.utilities.SlabXTest;

/**
 * @author Michael J. Schnieders
 */
public class ExternalToolTest extends SlabXTest {

  private Path script(String body) throws IOException {
    assumeTrue("POSIX shell required", File.separatorChar == '/'
        && Files.isExecutable(Path.of("/bin/sh")));
    Path script = registerTemporaryDirectory().resolve("tool.sh");
    Files.writeString(script, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
    assertTrue(script.toFile().setExecutable(true));
    return script;
  }

  @Test
  public void testOutputIsCaptured() throws IOException {
    Path script = script("echo \"$1 $2\"\necho warning >&2\n");
    String output = new ExternalTool(script, 30).run(script.getParent().resolve("work"), "a",
        "b");
    assertTrue(output.contains("a b"));
    assertTrue(output.contains("warning"));
  }

  @Test
  public void testTimeout() throws IOException {
    Path script = script("sleep 30\n");
    long start = System.nanoTime();
    try {
      new ExternalTool(script, 1).run(script.getParent());
      fail(" The time limit was not enforced.");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("did not finish"));
    }
    assertTrue((System.nanoTime() - start) / 1.0e9 < 20.0);
  }

  @Test
  public void testExitStatus() throws IOException {
    Path script = script("echo broken\nexit 4\n");
    try {
      new ExternalTool(script, 30).run(script.getParent());
      fail(" A failing program was accepted.");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("status 4"));
      assertTrue(e.getMessage().contains("broken"));
    }
  }

  @Test(expected = IOException.class)
  public void testNotExecutable() throws IOException {
    Path dir = registerTemporaryDirectory();
    new ExternalTool(dir.resolve("missing"), 30).run(dir);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidTimeout() {
    assertEquals(0, new ExternalTool(Path.of("sbu"), 0).getTimeoutSeconds());
  }
}
