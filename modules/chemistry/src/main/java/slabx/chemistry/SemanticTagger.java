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
import static org.apache.commons.math3.util.FastMath.floor;
import static slabx.numerics.math.DoubleMath.length2;
import static slabx.numerics.math.DoubleMath.sub;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;
import slabx.crystal.RoleTag;

/**
 * Maps node and linker fragments onto the atoms of a bulk crystal.
 * <p>
 * A fragment atom tags every bulk atom within {@link #MATCH_TOLERANCE} of it under periodic
 * boundary conditions. Bulk atoms are hashed into a Cartesian grid so each fragment atom only
 * examines the 3x3x3 neighbourhood of its grid cell. Node tags are never replaced by linker tags.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SemanticTagger {

  private static final Logger logger = Logger.getLogger(SemanticTagger.class.getName());

  /** Edge length of a grid cell in Angstroms. */
  public static final double GRID_SPACING = 2.0;

  /** Largest distance in Angstroms between a fragment atom and the bulk atom it tags. */
  public static final double MATCH_TOLERANCE = 0.5;

  private record GridCell(int i, int j, int k) {
  }

  private final Lattice lattice;
  private final double[][] positions;
  private final Map<GridCell, int[]> grid = new HashMap<>();
  private final RoleTag[] roles;

  /**
   * Index the atoms of a crystal.
   *
   * @param crystal the bulk crystal.
   */
  public SemanticTagger(Crystal crystal) {
    this.lattice = crystal.getLattice();
    int nAtoms = crystal.getAtomCount();
    positions = new double[nAtoms][];
    roles = new RoleTag[nAtoms];
    Arrays.fill(roles, RoleTag.UNKNOWN);
    for (int i = 0; i < nAtoms; i++) {
      positions[i] = crystal.getCartesian(i);
      GridCell cell = cellOf(positions[i]);
      int[] members = grid.get(cell);
      grid.put(cell, (members == null) ? new int[] {i} : append(members, i));
    }
  }

  private static int[] append(int[] members, int i) {
    int[] grown = Arrays.copyOf(members, members.length + 1);
    grown[members.length] = i;
    return grown;
  }

  private static GridCell cellOf(double[] x) {
    return new GridCell((int) floor(x[0] / GRID_SPACING), (int) floor(x[1] / GRID_SPACING),
        (int) floor(x[2] / GRID_SPACING));
  }

  /**
   * Tag the bulk atoms matched by one fragment.
   *
   * @param fragment Cartesian positions of the fragment atoms (any periodic image).
   * @param role NODE or LINKER.
   * @return true if at least one bulk atom was tagged.
   */
  public boolean apply(List<double[]> fragment, RoleTag role) {
    if (role == RoleTag.UNKNOWN) {
      throw new IllegalArgumentException(" Fragments must be tagged as NODE or LINKER.");
    }
    double tolerance2 = MATCH_TOLERANCE * MATCH_TOLERANCE;
    boolean matched = false;
    for (double[] x : fragment) {
      for (int i : candidates(x)) {
        if (roles[i] == RoleTag.NODE && role == RoleTag.LINKER) {
          continue;
        }
        if (minimumDistance2(x, positions[i]) < tolerance2) {
          roles[i] = role;
          matched = true;
        }
      }
    }
    return matched;
  }

  /**
   * Bulk atoms near any periodic image of a point.
   */
  private SortedSet<Integer> candidates(double[] x) {
    double[] xf = Lattice.wrap(lattice.toFractional(x));
    SortedSet<Integer> candidates = new TreeSet<>();
    double[] image = new double[3];
    for (int ta = -1; ta <= 1; ta++) {
      for (int tb = -1; tb <= 1; tb++) {
        for (int tc = -1; tc <= 1; tc++) {
          image[0] = xf[0] + ta;
          image[1] = xf[1] + tb;
          image[2] = xf[2] + tc;
          GridCell center = cellOf(lattice.toCartesian(image));
          for (int di = -1; di <= 1; di++) {
            for (int dj = -1; dj <= 1; dj++) {
              for (int dk = -1; dk <= 1; dk++) {
                int[] members = grid.get(
                    new GridCell(center.i() + di, center.j() + dj, center.k() + dk));
                if (members != null) {
                  for (int member : members) {
                    candidates.add(member);
                  }
                }
              }
            }
          }
        }
      }
    }
    return candidates;
  }

  /**
   * Squared distance between a point and the nearest of the 27 neighbouring images of an atom.
   */
  private double minimumDistance2(double[] x, double[] atom) {
    double[] xf = Lattice.wrap(lattice.toFractional(x));
    double[] wrapped = lattice.toCartesian(xf);
    double best = Double.POSITIVE_INFINITY;
    double[] shift = new double[3];
    for (int ta = -1; ta <= 1; ta++) {
      for (int tb = -1; tb <= 1; tb++) {
        for (int tc = -1; tc <= 1; tc++) {
          shift[0] = ta;
          shift[1] = tb;
          shift[2] = tc;
          double[] t = lattice.toCartesian(shift);
          double[] image = {atom[0] + t[0], atom[1] + t[1], atom[2] + t[2]};
          best = Math.min(best, length2(sub(wrapped, image)));
        }
      }
    }
    return best;
  }

  /**
   * Tag a crystal from node and linker fragments. Nodes are applied first.
   *
   * @param crystal the bulk crystal.
   * @param artifacts the fragments.
   * @return the tagging report.
   */
  public static TaggingReport tag(Crystal crystal, FragmentArtifacts artifacts) {
    SemanticTagger tagger = new SemanticTagger(crystal);
    int nodes = 0;
    for (List<double[]> fragment : artifacts.getNodes()) {
      if (tagger.apply(fragment, RoleTag.NODE)) {
        nodes++;
      }
    }
    int linkers = 0;
    for (List<double[]> fragment : artifacts.getLinkers()) {
      if (tagger.apply(fragment, RoleTag.LINKER)) {
        linkers++;
      }
    }
    TaggingReport report = new TaggingReport(tagger.getRoles(), nodes, linkers,
        crystal.getAtomCount());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Tagged %s.", crystal.getName()));
    }
    return report;
  }

  /**
   * The tagged atoms.
   *
   * @return atom index to role, for atoms with a role other than UNKNOWN.
   */
  public Map<Integer, RoleTag> getRoles() {
    Map<Integer, RoleTag> tagged = new HashMap<>();
    for (int i = 0; i < roles.length; i++) {
      if (roles[i] != RoleTag.UNKNOWN) {
        tagged.put(i, roles[i]);
      }
    }
    return Collections.unmodifiableMap(tagged);
  }
}
