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
package slabx.utilities;

import static java.lang.String.format;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * The SlabXTest configures the context for Slab X tests. This includes:
 * <br>
 * 1) Configures the logging level, using the slabx.test.log System property (default: WARNING).
 * <br>
 * 2) Stores System properties prior to each test, and restores them after each test (i.e.
 * properties set by a test do not effect the next test).
 * <br>
 * 3) Upon request, creates a temporary directory that is deleted after the current test is
 * completed.
 *
 * @author Michael J. Schnieders
 */
public abstract class SlabXTest {

  /** Constant <code>logger</code> */
  protected static final Logger logger = Logger.getLogger(SlabXTest.class.getName());

  private static final Level origLevel;
  private static final Level testLevel;
  private static Properties properties;
  private Path path = null;

  static {
    Level level;
    try {
      level = Level.parse(System.getProperty("slabx.log", "INFO").toUpperCase());
    } catch (Exception ex) {
      logger.warning(format(" Exception %s in parsing value of slabx.log", ex));
      level = Level.INFO;
    }
    origLevel = level;

    try {
      level = Level.parse(System.getProperty("slabx.test.log", "WARNING").toUpperCase());
    } catch (Exception ex) {
      logger.warning(format(" Exception %s in parsing value of slabx.test.log", ex));
      level = origLevel;
    }
    testLevel = level;
  }

  /** afterClass. */
  @AfterClass
  public static void afterClass() {
    Logger.getGlobal().setLevel(origLevel);
    Logger.getLogger("slabx").setLevel(origLevel);
    logger.setLevel(origLevel);
  }

  /** beforeClass. */
  @BeforeClass
  public static void beforeClass() {
    Logger.getGlobal().setLevel(testLevel);
    Logger.getLogger("slabx").setLevel(testLevel);
    logger.setLevel(testLevel);
  }

  /**
   * Create temporary testing directory that will be deleted after the current test.
   *
   * @return Path to the testing directory.
   */
  public Path registerTemporaryDirectory() {
    deleteTemporaryDirectory();
    try {
      path = Files.createTempDirectory("SlabXTestDirectory");
    } catch (IOException e) {
      fail(" Could not create a temporary directory.");
    }
    return path;
  }

  /**
   * Locate a test resource on the class path.
   *
   * @param name the resource name, for example "slabx/parsers/rocksalt.cif".
   * @return Path to the resource.
   */
  public Path getResourcePath(String name) {
    URL url = getClass().getClassLoader().getResource(name);
    if (url == null) {
      fail(format(" Test resource %s was not found.", name));
    }
    try {
      return Paths.get(url.toURI());
    } catch (URISyntaxException e) {
      fail(format(" Test resource %s has an invalid location: %s", name, e));
      return null;
    }
  }

  private void deleteTemporaryDirectory() {
    if (path != null) {
      try {
        FileUtils.deleteDirectory(path.toFile());
      } catch (IOException e) {
        fail(format(" Exception deleting %s: %s", path, e));
      }
      path = null;
    }
  }

  /** afterTest. */
  @After
  public void afterTest() {
    // All properties are set to the values they were at the beginning of the test.
    System.setProperties(properties);
    deleteTemporaryDirectory();
  }

  /** beforeTest. */
  @Before
  public void beforeTest() {
    properties = new Properties();
    Properties currentProperties = System.getProperties();
    currentProperties.stringPropertyNames()
        .forEach(key -> properties.setProperty(key, currentProperties.getProperty(key)));
  }
}
