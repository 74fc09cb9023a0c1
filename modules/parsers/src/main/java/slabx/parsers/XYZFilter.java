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

import static java.lang.String.format;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import slabx.crystal.Atom;

/**
 * The XYZFilter class reads plain XYZ coordinate files: an atom count, a comment line and one
 * "symbol x y z" line per atom, in Cartesian Angstroms.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class XYZFilter {

  private static final Logger logger = Logger.getLogger(XYZFilter.class.getName());

  /**
   * One atom of an XYZ file.
   *
   * @param element the element symbol.
   * @param x Cartesian x.
   * @param y Cartesian y.
   * @param z Cartesian z.
   */
  public record CartesianSite(String element, double x, double y, double z) {

    public double[] getXYZ() {
      return new double[] {x, y, z};
    }
  }

  private XYZFilter() {
  }

  /**
   * Read the first frame of an XYZ file.
   *
   * @param path the file.
   * @return the sites in file order.
   * @throws IOException if the file cannot be read or is malformed.
   */
  public static List<CartesianSite> readCartesian(Path path) throws IOException {
    try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String header = br.readLine();
      if (header == null || header.isBlank()) {
        throw new IOException(format(" XYZ file %s is empty.", path));
      }
      int nAtoms;
      try {
        nAtoms = Integer.parseInt(header.trim().split("\\s+")[0]);
      } catch (NumberFormatException e) {
        throw new IOException(format(" XYZ file %s does not begin with an atom count.", path), e);
      }
      if (nAtoms < 0) {
        throw new IOException(format(" XYZ file %s has a negative atom count.", path));
      }
      // Comment line.
      br.readLine();
      List<CartesianSite> sites = new ArrayList<>(nAtoms);
      for (int i = 0; i < nAtoms; i++) {
        String line = br.readLine();
        if (line == null) {
          throw new IOException(format(" XYZ file %s ends after %d of %d atoms.", path, i,
              nAtoms));
        }
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length < 4) {
          throw new IOException(format(" Invalid XYZ record %d in %s: %s", i + 1, path, line));
        }
        try {
          sites.add(new CartesianSite(Atom.elementOf(tokens[0]), Double.parseDouble(tokens[1]),
              Double.parseDouble(tokens[2]), Double.parseDouble(tokens[3])));
        } catch (NumberFormatException e) {
          throw new IOException(format(" Invalid XYZ record %d in %s: %s", i + 1, path, line), e);
        }
      }
      logger.fine(format(" Read %d atoms from %s.", nAtoms, path.getFileName()));
      return Collections.unmodifiableList(sites);
    }
  }
}
