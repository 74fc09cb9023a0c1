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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import slabx.crystal.Crystal;
import slabx.parsers.CIFFilter;
import slabx.parsers.XYZFilter;

/**
 * The node and linker fragment files written by a framework decomposition.
 * <p>
 * Each fragment is a list of Cartesian positions. XYZ fragments are read from the Nodes and
 * Linkers directories; when a directory holds none, a single nodes.cif (or edges.cif, then
 * linkers.cif) is used instead.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FragmentArtifacts {

  private static final Logger logger = Logger.getLogger(FragmentArtifacts.class.getName());

  /** Directory of node XYZ fragments. */
  public static final String NODES_DIR = "Nodes";
  /** Directory of linker XYZ fragments. */
  public static final String LINKERS_DIR = "Linkers";

  private static final String[] NODE_CIFS = {"nodes.cif"};
  private static final String[] LINKER_CIFS = {"edges.cif", "linkers.cif"};

  private final List<List<double[]>> nodes;
  private final List<List<double[]>> linkers;

  FragmentArtifacts(List<List<double[]>> nodes, List<List<double[]>> linkers) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.linkers = Collections.unmodifiableList(linkers);
  }

  /**
   * Locate and read the fragments under a decomposition output directory.
   *
   * @param root the output directory.
   * @return the fragments.
   * @throws IOException if the directory holds no fragments at all.
   */
  public static FragmentArtifacts locate(Path root) throws IOException {
    if (!Files.isDirectory(root)) {
      throw new IOException(format(" Decomposition output %s does not exist.", root));
    }
    List<List<double[]>> nodes = readFragments(directory(root, NODES_DIR), NODE_CIFS);
    List<List<double[]>> linkers = readFragments(directory(root, LINKERS_DIR), LINKER_CIFS);
    if (nodes.isEmpty() && linkers.isEmpty()) {
      throw new IOException(format(" No node or linker fragments were found under %s.", root));
    }
    logger.info(format(" Read %d node and %d linker fragments.", nodes.size(), linkers.size()));
    return new FragmentArtifacts(nodes, linkers);
  }

  private static Path directory(Path root, String name) {
    Path dir = root.resolve(name);
    return Files.isDirectory(dir) ? dir : root;
  }

  private static List<List<double[]>> readFragments(Path dir, String[] cifNames) {
    List<List<double[]>> fragments = new ArrayList<>();
    Collection<File> files = FileUtils.listFiles(dir.toFile(), new String[] {"xyz"}, false);
    List<File> sorted = new ArrayList<>(files);
    Collections.sort(sorted);
    for (File file : sorted) {
      try {
        fragments.add(toPositions(XYZFilter.readCartesian(file.toPath())));
      } catch (IOException e) {
        logger.warning(format(" Skipping unreadable fragment %s:%s", file.getName(),
            e.getMessage()));
      }
    }
    if (!fragments.isEmpty()) {
      return fragments;
    }
    for (String name : cifNames) {
      Path cif = dir.resolve(name);
      if (Files.exists(cif)) {
        try {
          fragments.add(toPositions(CIFFilter.read(cif)));
        } catch (IOException e) {
          logger.warning(format(" Skipping unreadable fragment %s:%s", name, e.getMessage()));
        }
        break;
      }
    }
    return fragments;
  }

  private static List<double[]> toPositions(List<XYZFilter.CartesianSite> sites) {
    List<double[]> positions = new ArrayList<>(sites.size());
    for (XYZFilter.CartesianSite site : sites) {
      positions.add(site.getXYZ());
    }
    return positions;
  }

  private static List<double[]> toPositions(Crystal fragment) {
    List<double[]> positions = new ArrayList<>(fragment.getAtomCount());
    for (int i = 0; i < fragment.getAtomCount(); i++) {
      positions.add(fragment.getCartesian(i));
    }
    return positions;
  }

  /**
   * Node fragments, each a list of Cartesian positions.
   *
   * @return the node fragments.
   */
  public List<List<double[]>> getNodes() {
    return nodes;
  }

  /**
   * Linker fragments, each a list of Cartesian positions.
   *
   * @return the linker fragments.
   */
  public List<List<double[]>> getLinkers() {
    return linkers;
  }
}
