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
import static org.apache.commons.io.FilenameUtils.getBaseName;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import org.rcsb.cif.CifIO;
import org.rcsb.cif.model.Column;
import org.rcsb.cif.schema.StandardSchemata;
import org.rcsb.cif.schema.core.AtomSite;
import org.rcsb.cif.schema.core.AtomType;
import org.rcsb.cif.schema.core.Cell;
import org.rcsb.cif.schema.core.CifCoreBlock;
import org.rcsb.cif.schema.core.CifCoreFile;
import org.rcsb.cif.schema.core.Symmetry;
import slabx.crystal.Atom;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;
import slabx.crystal.RoleTag;

/**
 * The CIFFilter class reads and writes P1 crystal structures in CIF format.
 * <p>
 * Symmetry expansion is not performed: the atom_site loop is taken as the full unit cell.
 *
 * @author Aaron J. Nessler
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class CIFFilter {

  private static final Logger logger = Logger.getLogger(CIFFilter.class.getName());

  private CIFFilter() {
  }

  /**
   * Parse the first data block of a CIF file.
   *
   * @param path the CIF file.
   * @return the crystal, named after the data block.
   * @throws IOException if the file cannot be read, or lacks a cell or atoms.
   */
  public static Crystal read(Path path) throws IOException {
    CifCoreFile cifFile;
    try {
      cifFile = CifIO.readFromPath(path).as(StandardSchemata.CIF_CORE);
    } catch (IOException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new IOException(format(" Failed to parse CIF file %s: %s", path, e.getMessage()), e);
    }
    List<CifCoreBlock> blocks = cifFile.getBlocks();
    if (blocks.isEmpty()) {
      throw new IOException(format(" CIF file %s contains no data block.", path));
    }
    if (blocks.size() > 1) {
      logger.info(format(" CIF file %s contains %d blocks; reading the first.", path,
          blocks.size()));
    }
    CifCoreBlock block = blocks.get(0);
    String name = block.getBlockHeader();
    if (StringUtils.isBlank(name)) {
      name = getBaseName(path.toString());
    }
    logger.info(format("\n Block ID: %s", name));

    checkSpaceGroup(block);
    Lattice lattice = parseCell(block, path);
    Map<String, Double> oxidationNumbers = parseOxidationNumbers(block);
    List<Atom> atoms = parseAtoms(block, lattice, oxidationNumbers, path);
    Crystal crystal = new Crystal(name, lattice, atoms);
    logger.info(crystal.toString());
    return crystal;
  }

  private static void checkSpaceGroup(CifCoreBlock block) {
    Symmetry symmetry = block.getSymmetry();
    String sgName = null;
    if (symmetry.getSpaceGroupNameH_M().getRowCount() > 0) {
      sgName = symmetry.getSpaceGroupNameH_M().get(0);
    } else if (block.getSpaceGroup().getNameH_mAlt().getRowCount() > 0) {
      sgName = block.getSpaceGroup().getNameH_mAlt().get(0);
    }
    int sgNum = -1;
    if (symmetry.getIntTablesNumber().getRowCount() > 0) {
      sgNum = symmetry.getIntTablesNumber().get(0);
    }
    boolean p1 = true;
    if (sgName != null && !sgName.isBlank() && !sgName.equals("?")) {
      p1 = sgName.replaceAll("[\\s'\"]", "").equalsIgnoreCase("P1");
    } else if (sgNum > 0) {
      p1 = (sgNum == 1);
    }
    if (!p1) {
      logger.warning(format(
          " Space group %s is not expanded; the atom_site loop is treated as the full P1 cell.",
          (sgName != null) ? sgName.trim() : Integer.toString(sgNum)));
    }
  }

  private static Lattice parseCell(CifCoreBlock block, Path path) throws IOException {
    Cell cell = block.getCell();
    if (!cell.isDefined()) {
      throw new IOException(format(" CIF file %s does not define a unit cell.", path));
    }
    double a = value(cell.getLengthA(), 0, "_cell_length_a");
    double b = value(cell.getLengthB(), 0, "_cell_length_b");
    double c = value(cell.getLengthC(), 0, "_cell_length_c");
    double alpha = value(cell.getAngleAlpha(), 0, "_cell_angle_alpha");
    double beta = value(cell.getAngleBeta(), 0, "_cell_angle_beta");
    double gamma = value(cell.getAngleGamma(), 0, "_cell_angle_gamma");
    try {
      return new Lattice(a, b, c, alpha, beta, gamma);
    } catch (IllegalArgumentException e) {
      throw new IOException(format(" Invalid unit cell in %s:%s", path, e.getMessage()), e);
    }
  }

  /**
   * Oxidation numbers keyed by atom type symbol.
   */
  private static Map<String, Double> parseOxidationNumbers(CifCoreBlock block) throws IOException {
    Map<String, Double> oxidationNumbers = new HashMap<>();
    AtomType atomType = block.getAtomType();
    Column<?> symbol = atomType.getSymbol();
    Column<?> oxidation = atomType.getOxidationNumber();
    if (!symbol.isDefined() || !oxidation.isDefined()) {
      return oxidationNumbers;
    }
    for (int i = 0; i < symbol.getRowCount(); i++) {
      if (isMissing(oxidation, i)) {
        continue;
      }
      oxidationNumbers.put(symbol.getStringData(i).trim(),
          value(oxidation, i, "_atom_type_oxidation_number"));
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Oxidation numbers: %s", oxidationNumbers));
    }
    return oxidationNumbers;
  }

  private static List<Atom> parseAtoms(CifCoreBlock block, Lattice lattice,
      Map<String, Double> oxidationNumbers, Path path) throws IOException {
    AtomSite atomSite = block.getAtomSite();
    Column<?> label = atomSite.getLabel();
    Column<?> typeSymbol = atomSite.getTypeSymbol();
    Column<?> fractX = atomSite.getFractX();
    Column<?> fractY = atomSite.getFractY();
    Column<?> fractZ = atomSite.getFractZ();
    Column<?> cartX = atomSite.getCartnX();
    Column<?> cartY = atomSite.getCartnY();
    Column<?> cartZ = atomSite.getCartnZ();

    int nAtoms = Math.max(label.getRowCount(), typeSymbol.getRowCount());
    if (nAtoms < 1) {
      throw new IOException(format(" CIF file %s did not contain coordinates.", path));
    }
    boolean fractional = fractX.isDefined();
    if (!fractional && !cartX.isDefined()) {
      throw new IOException(format(" CIF file %s has neither fractional nor Cartesian "
          + "coordinates.", path));
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Number of atoms in CIF: %d", nAtoms));
    }

    List<Atom> atoms = new ArrayList<>(nAtoms);
    for (int i = 0; i < nAtoms; i++) {
      String species = (typeSymbol.getRowCount() > i && !isMissing(typeSymbol, i))
          ? typeSymbol.getStringData(i).trim() : label.getStringData(i).trim();
      double[] xyz;
      if (fractional) {
        xyz = new double[] {value(fractX, i, "_atom_site_fract_x"),
            value(fractY, i, "_atom_site_fract_y"), value(fractZ, i, "_atom_site_fract_z")};
      } else {
        xyz = lattice.toFractional(new double[] {value(cartX, i, "_atom_site_Cartn_x"),
            value(cartY, i, "_atom_site_Cartn_y"), value(cartZ, i, "_atom_site_Cartn_z")});
      }
      atoms.add(new Atom(species, xyz, oxidationNumbers.get(species), RoleTag.UNKNOWN));
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" Atom %3d %-8s %s", i + 1, species, atoms.get(i)));
      }
    }
    return atoms;
  }

  private static boolean isMissing(Column<?> column, int row) {
    if (!column.isDefined() || row >= column.getRowCount()) {
      return true;
    }
    String text = column.getStringData(row);
    return text == null || text.isBlank() || text.equals("?") || text.equals(".");
  }

  /**
   * Parse a numeric CIF value, dropping a standard uncertainty such as the "(5)" of "1.234(5)".
   */
  private static double value(Column<?> column, int row, String tag) throws IOException {
    if (isMissing(column, row)) {
      throw new IOException(format(" CIF tag %s is missing a value (row %d).", tag, row + 1));
    }
    String text = StringUtils.substringBefore(column.getStringData(row).trim(), "(");
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new IOException(format(" CIF tag %s has a non-numeric value %s.", tag, text), e);
    }
  }

  /**
   * Write a crystal as a P1 CIF file. Charged atoms are given decorated type symbols, such as
   * "Na1+", which an atom_type loop maps to their oxidation numbers.
   *
   * @param crystal the crystal to write.
   * @param path the destination; replaced if it exists.
   * @throws IOException if the file cannot be written.
   */
  public static void write(Crystal crystal, Path path) throws IOException {
    Lattice lattice = crystal.getLattice();
    Map<String, Double> types = new LinkedHashMap<>();
    List<String> symbols = new ArrayList<>();
    for (Atom atom : crystal.getAtoms()) {
      String symbol = typeSymbol(atom);
      symbols.add(symbol);
      if (atom.hasCharge()) {
        types.putIfAbsent(symbol, atom.getCharge());
      }
    }

    try (BufferedWriter bw = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      bw.write("data_" + crystal.getName().replaceAll("\\s+", "_"));
      bw.write("\n_symmetry_space_group_name_H-M\t'P 1'");
      bw.write("\n_symmetry_Int_Tables_number\t1");
      bw.write("\nloop_\n_symmetry_equiv_pos_site_id\n_symmetry_equiv_pos_as_xyz\n1 x,y,z");
      bw.write(format("\n_cell_length_a\t%.6f", lattice.a));
      bw.write(format("\n_cell_length_b\t%.6f", lattice.b));
      bw.write(format("\n_cell_length_c\t%.6f", lattice.c));
      bw.write(format("\n_cell_angle_alpha\t%.6f", lattice.alpha));
      bw.write(format("\n_cell_angle_beta\t%.6f", lattice.beta));
      bw.write(format("\n_cell_angle_gamma\t%.6f", lattice.gamma));
      bw.write(format("\n_cell_volume\t%.4f", Math.abs(lattice.volume)));
      if (!types.isEmpty()) {
        bw.write("\nloop_\n_atom_type_symbol\n_atom_type_oxidation_number");
        for (Map.Entry<String, Double> entry : types.entrySet()) {
          bw.write(format("\n%-10s %10.6f", entry.getKey(), entry.getValue()));
        }
      }
      bw.write("\nloop_");
      bw.write("\n_atom_site_label");
      bw.write("\n_atom_site_type_symbol");
      bw.write("\n_atom_site_fract_x");
      bw.write("\n_atom_site_fract_y");
      bw.write("\n_atom_site_fract_z");
      Map<String, Integer> counts = new HashMap<>();
      for (int i = 0; i < crystal.getAtomCount(); i++) {
        Atom atom = crystal.getAtom(i);
        String element = atom.getElement();
        int count = counts.merge(element, 1, Integer::sum);
        double[] xyz = atom.getXYZ();
        bw.write(format("\n%-6s %-10s %10.6f %10.6f %10.6f", element + count, symbols.get(i),
            xyz[0], xyz[1], xyz[2]));
      }
      bw.write("\n#END\n");
    }
    logger.info(format(" Wrote CIF file: %s", path.toAbsolutePath()));
  }

  /**
   * The type symbol of an atom: its element, decorated with its charge when it has one.
   */
  static String typeSymbol(Atom atom) {
    if (!atom.hasCharge() || atom.getCharge() == 0.0) {
      return atom.getElement();
    }
    double charge = atom.getCharge();
    String magnitude = format("%.4f", Math.abs(charge)).replaceAll("\\.?0+$", "");
    return atom.getElement() + magnitude + (charge > 0.0 ? "+" : "-");
  }
}
