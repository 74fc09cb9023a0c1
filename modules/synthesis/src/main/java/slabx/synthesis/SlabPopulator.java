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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static slabx.numerics.math.DoubleMath.dot;
import static slabx.numerics.math.DoubleMath.sub;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Atom;
import slabx.crystal.Crystal;
import slabx.crystal.Lattice;
import slabx.crystal.SurfaceBasis;
import slabx.numerics.math.ScalarMath;

/**
 * Fills a {@link SlabCell} with the periodic images of a bulk crystal.
 * <p>
 * Bulk lattice translations covering the material block are enumerated, each translated atom is
 * moved into the fractional frame of the slab lattice with the cut offset at the origin, and it
 * is kept when it falls inside the in-plane cell and below the material thickness along the
 * normal. The offset has been validated as bond free, so molecules are never split and atoms are
 * judged one at a time.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SlabPopulator {

  private static final Logger logger = Logger.getLogger(SlabPopulator.class.getName());

  /** Default tolerance on fractional coordinates when matching duplicate atoms. */
  public static final double DEFAULT_DUPLICATE_TOLERANCE = 1.0e-4;

  /** Tolerance on the in-plane fractional window. */
  private static final double WINDOW_EPSILON = 1.0e-8;

  /** Tolerance on the normal window, in Angstroms. */
  private static final double NORMAL_EPSILON = 1.0e-6;

  /** Height of the buckets used to find duplicates, in Angstroms. */
  private static final double BUCKET_HEIGHT = 0.5;

  private SlabPopulator() {
  }

  /**
   * Populate a slab with the default duplicate tolerance.
   *
   * @param crystal the bulk crystal.
   * @param slabCell the slab cell.
   * @param offset the cut offset as a fraction of the transverse repeat.
   * @param repeatCount the number of transverse repeats of material.
   * @return the slab crystal.
   */
  public static SlabCrystal populate(Crystal crystal, SlabCell slabCell, double offset,
      int repeatCount) {
    return populate(crystal, slabCell, offset, repeatCount, DEFAULT_DUPLICATE_TOLERANCE);
  }

  /**
   * Populate a slab.
   *
   * @param crystal the bulk crystal.
   * @param slabCell the slab cell.
   * @param offset the cut offset as a fraction of the transverse repeat.
   * @param repeatCount the number of transverse repeats of material; at most the repeat count of
   *     the slab cell.
   * @param duplicateTolerance fractional distance below which two atoms of the same species are
   *     the same atom.
   * @return the slab crystal.
   */
  public static SlabCrystal populate(Crystal crystal, SlabCell slabCell, double offset,
      int repeatCount, double duplicateTolerance) {
    if (repeatCount < 1 || repeatCount > slabCell.getRepeatCount()) {
      throw new IllegalArgumentException(format(" Invalid repeat count %d for a cell of %d.",
          repeatCount, slabCell.getRepeatCount()));
    }
    if (!crystal.getLattice().equals(slabCell.getSurfaceBasis().getLattice())) {
      throw new IllegalArgumentException(" The slab cell was built for a different lattice.");
    }
    SurfaceBasis basis = slabCell.getSurfaceBasis();
    Lattice bulk = crystal.getLattice();
    Lattice slab = slabCell.getLattice();
    double[] normal = basis.getNormal();
    double wrapped = ScalarMath.mod(offset, 1.0);
    double height = repeatCount * basis.getDSpacing();
    double cellHeight = slabCell.getNormalLength();

    int[] w = basis.getTransverse();
    double[] originFrac = {wrapped * w[0], wrapped * w[1], wrapped * w[2]};
    double[] origin = bulk.toCartesian(originFrac);
    int[][] range = translationRange(originFrac, basis.getReducedU(), basis.getReducedV(),
        new int[] {repeatCount * w[0], repeatCount * w[1], repeatCount * w[2]});

    List<Atom> atoms = new ArrayList<>();
    List<Integer> sources = new ArrayList<>();
    List<int[]> translations = new ArrayList<>();
    Map<Long, List<Integer>> buckets = new HashMap<>();
    int duplicates = 0;

    for (int ta = range[0][0]; ta <= range[0][1]; ta++) {
      for (int tb = range[1][0]; tb <= range[1][1]; tb++) {
        for (int tc = range[2][0]; tc <= range[2][1]; tc++) {
          for (int i = 0; i < crystal.getAtomCount(); i++) {
            Atom atom = crystal.getAtom(i);
            double[] x = atom.getXYZ();
            double[] r = sub(bulk.toCartesian(new double[] {x[0] + ta, x[1] + tb, x[2] + tc}),
                origin);
            double[] f = slab.toFractional(r);
            if (f[0] < -WINDOW_EPSILON || f[0] >= 1.0 - WINDOW_EPSILON
                || f[1] < -WINDOW_EPSILON || f[1] >= 1.0 - WINDOW_EPSILON) {
              continue;
            }
            double z = dot(r, normal);
            if (z < -NORMAL_EPSILON || z >= height - NORMAL_EPSILON) {
              continue;
            }
            double[] xyz = {ScalarMath.mod(f[0], 1.0), ScalarMath.mod(f[1], 1.0),
                max(0.0, z) / cellHeight};
            long bucket = (long) floor(max(0.0, z) / BUCKET_HEIGHT);
            if (isDuplicate(atoms, buckets, bucket, atom.getSpecies(), xyz, duplicateTolerance)) {
              duplicates++;
              continue;
            }
            buckets.computeIfAbsent(bucket, k -> new ArrayList<>()).add(atoms.size());
            atoms.add(atom.withXYZ(xyz));
            sources.add(i);
            translations.add(new int[] {ta, tb, tc});
          }
        }
      }
    }

    int[] sourceIndex = new int[atoms.size()];
    int[][] sourceTranslation = new int[atoms.size()][];
    for (int i = 0; i < sourceIndex.length; i++) {
      sourceIndex[i] = sources.get(i);
      sourceTranslation[i] = translations.get(i);
    }
    String name = format("%s %s slab", crystal.getName(), basis.getMillerIndices());
    SlabCrystal slabCrystal = new SlabCrystal(name, slabCell, wrapped, atoms, sourceIndex,
        sourceTranslation);

    if (duplicates > 0) {
      logger.info(format(" Removed %d duplicate atoms.", duplicates));
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Populated %d atoms from %d bulk atoms over translations "
              + "[%d,%d] x [%d,%d] x [%d,%d].", atoms.size(), crystal.getAtomCount(),
          range[0][0], range[0][1], range[1][0], range[1][1], range[2][0], range[2][1]));
    }
    return slabCrystal;
  }

  /**
   * Shift the material block along the slab c-axis so the vacuum is split evenly above and below.
   *
   * @param slab the slab, with material starting at the bottom of the cell.
   * @return the centred slab.
   */
  public static SlabCrystal center(SlabCrystal slab) {
    double shift = 0.5 * (1.0 - slab.getSlabCell().getMaterialFraction());
    if (shift <= 0.0) {
      return slab;
    }
    List<Atom> atoms = new ArrayList<>(slab.getAtomCount());
    for (Atom atom : slab.getAtoms()) {
      double[] xyz = atom.getXYZ();
      xyz[2] += shift;
      atoms.add(atom.withXYZ(xyz));
    }
    return slab.withAtoms(atoms);
  }

  /**
   * Bounding range of integer translations whose unit cells can reach the material block.
   *
   * @return per-axis [min, max] translations.
   */
  private static int[][] translationRange(double[] origin, int[] u, int[] v, int[] w) {
    int[][] range = new int[3][2];
    for (int axis = 0; axis < 3; axis++) {
      double lo = Double.POSITIVE_INFINITY;
      double hi = Double.NEGATIVE_INFINITY;
      for (int a = 0; a <= 1; a++) {
        for (int b = 0; b <= 1; b++) {
          for (int c = 0; c <= 1; c++) {
            double corner = origin[axis] + a * u[axis] + b * v[axis] + c * w[axis];
            lo = min(lo, corner);
            hi = max(hi, corner);
          }
        }
      }
      range[axis][0] = (int) floor(lo) - 1;
      range[axis][1] = (int) ceil(hi) + 1;
    }
    return range;
  }

  private static boolean isDuplicate(List<Atom> atoms, Map<Long, List<Integer>> buckets,
      long bucket, String species, double[] xyz, double tolerance) {
    for (long b = bucket - 1; b <= bucket + 1; b++) {
      List<Integer> members = buckets.get(b);
      if (members == null) {
        continue;
      }
      for (int index : members) {
        Atom other = atoms.get(index);
        if (!other.getSpecies().equals(species)) {
          continue;
        }
        double[] y = other.getXYZ();
        if (abs(ScalarMath.periodicDelta(xyz[0], y[0])) < tolerance
            && abs(ScalarMath.periodicDelta(xyz[1], y[1])) < tolerance
            && abs(xyz[2] - y[2]) < tolerance) {
          return true;
        }
      }
    }
    return false;
  }
}
