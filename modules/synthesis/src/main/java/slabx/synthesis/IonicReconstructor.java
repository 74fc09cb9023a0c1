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
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static slabx.numerics.math.DoubleMath.add;
import static slabx.numerics.math.DoubleMath.scale;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Advisory;
import slabx.crystal.Atom;
import slabx.crystal.Lattice;
import slabx.crystal.SurfaceCondition;
import slabx.topology.BondGraph;
import slabx.topology.BondGraphBuilder;
import slabx.topology.CutoffPolicy;

/**
 * Tasker type III reconstruction of polar slabs.
 * <p>
 * The dipole along the normal is D = sum q_i (z_i - z_mid), where z_mid is the midpoint of the
 * occupied range. Atoms are clustered into layers along the normal; the outermost layers are the
 * terminations. {@link ReconstructionStrategy#TRANSFER_IONS} relocates terminal ions by one
 * material repeat to the opposite face, {@link ReconstructionStrategy#SCALE_LAYER_CHARGE} scales
 * the terminal layer charges. Both keep the total charge of the slab.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IonicReconstructor {

  private static final Logger logger = Logger.getLogger(IonicReconstructor.class.getName());

  /** Default width of a layer along the normal, in Angstroms. */
  public static final double DEFAULT_LAYER_TOLERANCE = 0.25;

  /** Default residual dipole accepted as zero, in e*Angstrom. */
  public static final double DEFAULT_DIPOLE_TOLERANCE = 0.05;

  private static final double EPSILON = 1.0e-10;

  private final ReconstructionStrategy strategy;
  private final double layerTolerance;
  private final double dipoleTolerance;
  private final CutoffPolicy cutoffPolicy;

  /**
   * IonicReconstructor with default tolerances and covalent bonding.
   *
   * @param strategy the strategy.
   */
  public IonicReconstructor(ReconstructionStrategy strategy) {
    this(strategy, DEFAULT_LAYER_TOLERANCE, DEFAULT_DIPOLE_TOLERANCE,
        CutoffPolicy.covalent(CutoffPolicy.DEFAULT_TOLERANCE));
  }

  /**
   * Constructor for IonicReconstructor.
   *
   * @param strategy the strategy.
   * @param layerTolerance width of a layer along the normal, in Angstroms.
   * @param dipoleTolerance residual dipole accepted as zero, in e*Angstrom.
   * @param cutoffPolicy bonding policy used to rank terminal ions by coordination.
   */
  public IonicReconstructor(ReconstructionStrategy strategy, double layerTolerance,
      double dipoleTolerance, CutoffPolicy cutoffPolicy) {
    this.strategy = (strategy == null) ? ReconstructionStrategy.NONE : strategy;
    this.layerTolerance = layerTolerance;
    this.dipoleTolerance = dipoleTolerance;
    this.cutoffPolicy = cutoffPolicy;
  }

  public ReconstructionStrategy getStrategy() {
    return strategy;
  }

  /**
   * Normal dipole of a slab about the midpoint of its occupied range.
   *
   * @param slab the slab.
   * @return the dipole in e*Angstrom.
   */
  public static double dipole(SlabCrystal slab) {
    double[] q = new double[slab.getAtomCount()];
    for (int i = 0; i < q.length; i++) {
      q[i] = slab.getAtom(i).getCharge();
    }
    return dipole(slab.getNormalPositions(), q);
  }

  static double dipole(double[] z, double[] q) {
    if (z.length == 0) {
      return 0.0;
    }
    double zMin = Double.POSITIVE_INFINITY;
    double zMax = Double.NEGATIVE_INFINITY;
    for (double zi : z) {
      zMin = min(zMin, zi);
      zMax = max(zMax, zi);
    }
    double zMid = 0.5 * (zMin + zMax);
    double sum = 0.0;
    for (int i = 0; i < z.length; i++) {
      sum += q[i] * (z[i] - zMid);
    }
    return sum;
  }

  /**
   * Cluster atoms into layers along the normal. A layer starts at its lowest atom and collects
   * every atom within the tolerance of it.
   *
   * @param z normal positions.
   * @param tolerance the layer width.
   * @return atom indices per layer, bottom layer first.
   */
  public static List<int[]> findLayers(double[] z, double tolerance) {
    Integer[] order = new Integer[z.length];
    for (int i = 0; i < z.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> z[i]).thenComparingInt(i -> i));
    List<int[]> layers = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    double start = Double.NaN;
    for (int i : order) {
      if (!current.isEmpty() && abs(z[i] - start) >= tolerance) {
        layers.add(toArray(current, true));
        current.clear();
      }
      if (current.isEmpty()) {
        start = z[i];
      }
      current.add(i);
    }
    if (!current.isEmpty()) {
      layers.add(toArray(current, true));
    }
    return layers;
  }

  /**
   * Reconstruct a slab.
   *
   * @param slab the slab; every atom must carry a formal charge unless the strategy is NONE.
   * @return the result, with a NON_STOICHIOMETRIC_RESULT advisory when the residual dipole
   *     exceeds the tolerance.
   * @throws IllegalArgumentException if charges are missing.
   */
  public ReconstructionResult reconstruct(SlabCrystal slab) {
    if (strategy == ReconstructionStrategy.NONE || slab.getAtomCount() == 0) {
      double d = dipole(slab);
      return new ReconstructionResult(slab, strategy, d, d, 0, 1.0, 1.0, List.of());
    }
    if (!slab.hasCharges()) {
      throw new IllegalArgumentException(" Ionic reconstruction requires formal charges.");
    }

    int n = slab.getAtomCount();
    double[] z = slab.getNormalPositions();
    double[] q = new double[n];
    for (int i = 0; i < n; i++) {
      q[i] = slab.getAtom(i).getCharge();
    }
    double before = dipole(z, q);
    if (abs(before) <= dipoleTolerance) {
      logger.info(format(" Surface is stable (dipole %8.3f eA).", before));
      return new ReconstructionResult(slab, strategy, before, before, 0, 1.0, 1.0, List.of());
    }

    List<int[]> layers = findLayers(z, layerTolerance);
    if (layers.size() < 2) {
      Advisory advisory = new Advisory(SurfaceCondition.NON_STOICHIOMETRIC_RESULT,
          format("A single layer cannot cancel a dipole of %8.3f eA.", before));
      logger.warning(advisory.toString());
      return new ReconstructionResult(slab, strategy, before, before, 0, 1.0, 1.0,
          List.of(advisory));
    }

    ReconstructionResult result = (strategy == ReconstructionStrategy.TRANSFER_IONS)
        ? transferIons(slab, z, q, layers, before)
        : scaleLayerCharge(slab, z, q, layers, before);
    logger.info(" " + result.summary());
    return result;
  }

  private ReconstructionResult transferIons(SlabCrystal slab, double[] z, double[] q,
      List<int[]> layers, double before) {
    BondGraph graph = BondGraphBuilder.buildBonds(slab, cutoffPolicy);
    double step = slab.getSlabCell().getMaterialThickness();
    int[][] faces = {terminalIons(layers.get(layers.size() - 1), q, graph),
        terminalIons(layers.get(0), q, graph)};
    double[] shifts = {-step, step};

    // Relocated ions must fit below the top of the cell without wrapping into the material.
    double height = slab.getSlabCell().getNormalLength();
    int bestFace = -1;
    int bestCount = 0;
    double best = abs(before);
    double blocked = best;
    for (int face = 0; face < 2; face++) {
      double[] trial = z.clone();
      for (int k = 1; k <= faces[face].length; k++) {
        trial[faces[face][k - 1]] += shifts[face];
        double d = abs(dipole(trial, q));
        if (span(trial) >= height - EPSILON) {
          blocked = min(blocked, d);
        } else if (d < best - EPSILON) {
          best = d;
          bestFace = face;
          bestCount = k;
        }
      }
    }
    Advisory vacuumAdvisory = null;
    if (blocked < best - EPSILON) {
      vacuumAdvisory = new Advisory(SurfaceCondition.NON_STOICHIOMETRIC_RESULT,
          format("The vacuum of %6.2f A is too thin to hold the relocated ions.",
              slab.getSlabCell().getVacuum()));
      logger.warning(vacuumAdvisory.toString());
    }
    if (bestFace < 0) {
      return withResidual(slab, before, before, 0, 1.0, 1.0, vacuumAdvisory);
    }

    int[] moved = Arrays.copyOf(faces[bestFace], bestCount);
    int direction = (bestFace == 0) ? -1 : 1;
    SlabCrystal relocated = relocate(slab, moved, direction);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Moved ions %s from the %s face.", Arrays.toString(moved),
          (bestFace == 0) ? "top" : "bottom"));
    }
    return withResidual(relocated, before, dipole(relocated), moved.length, 1.0, 1.0,
        vacuumAdvisory);
  }

  private static double span(double[] z) {
    double zMin = Double.POSITIVE_INFINITY;
    double zMax = Double.NEGATIVE_INFINITY;
    for (double zi : z) {
      zMin = min(zMin, zi);
      zMax = max(zMax, zi);
    }
    return zMax - zMin;
  }

  /**
   * Charged ions of a terminal layer, lowest coordination first, then smallest index.
   */
  private static int[] terminalIons(int[] layer, double[] q, BondGraph graph) {
    List<Integer> ions = new ArrayList<>();
    for (int i : layer) {
      if (abs(q[i]) > EPSILON) {
        ions.add(i);
      }
    }
    ions.sort(Comparator.comparingInt((Integer i) -> graph.getCoordination(i))
        .thenComparingInt(i -> i));
    return toArray(ions, false);
  }

  private static int[] toArray(List<Integer> list, boolean sort) {
    int[] array = new int[list.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = list.get(i);
    }
    if (sort) {
      Arrays.sort(array);
    }
    return array;
  }

  /**
   * Move atoms by one material repeat along the stacking vector, then shift the whole slab up if
   * an atom ends below the cell origin.
   */
  private static SlabCrystal relocate(SlabCrystal slab, int[] moved, int direction) {
    SlabCell cell = slab.getSlabCell();
    Lattice lattice = slab.getLattice();
    double[] stacking = scale(cell.getStackingVector(), direction);
    int[][] transform = cell.getTransform();
    int n = slab.getAtomCount();

    double[][] frac = new double[n][];
    int[][] translations = new int[n][];
    for (int i = 0; i < n; i++) {
      frac[i] = slab.getAtom(i).getXYZ();
      translations[i] = slab.getSourceTranslation(i);
    }
    for (int i : moved) {
      frac[i] = lattice.toFractional(add(lattice.toCartesian(frac[i]), stacking));
      for (int axis = 0; axis < 3; axis++) {
        translations[i][axis] += direction * transform[2][axis];
      }
    }

    double gammaMin = 0.0;
    for (double[] f : frac) {
      gammaMin = min(gammaMin, f[2]);
    }
    List<Atom> atoms = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      double[] f = frac[i];
      atoms.add(slab.getAtom(i).withXYZ(new double[] {f[0], f[1], f[2] - gammaMin}));
    }
    return slab.withAtoms(atoms, translations);
  }

  private ReconstructionResult scaleLayerCharge(SlabCrystal slab, double[] z, double[] q,
      List<int[]> layers, double before) {
    double zMin = Arrays.stream(z).min().orElse(0.0);
    double zMax = Arrays.stream(z).max().orElse(0.0);
    double zMid = 0.5 * (zMin + zMax);
    int[] top = layers.get(layers.size() - 1);
    int[] bottom = layers.get(0);
    double qTop = 0.0;
    double mTop = 0.0;
    for (int i : top) {
      qTop += q[i];
      mTop += q[i] * (z[i] - zMid);
    }
    double qBottom = 0.0;
    double mBottom = 0.0;
    for (int i : bottom) {
      qBottom += q[i];
      mBottom += q[i] * (z[i] - zMid);
    }

    // Charge conservation fixes fBottom - 1 = -(fTop - 1) * qTop / qBottom.
    double denominator = Double.NaN;
    if (abs(qBottom) > EPSILON) {
      denominator = mTop - qTop * mBottom / qBottom;
    }
    if (Double.isNaN(denominator) || abs(denominator) < EPSILON) {
      Advisory advisory = new Advisory(SurfaceCondition.NON_STOICHIOMETRIC_RESULT,
          format("The terminal layers cannot cancel a dipole of %8.3f eA.", before));
      logger.warning(advisory.toString());
      return new ReconstructionResult(slab, strategy, before, before, 0, 1.0, 1.0,
          List.of(advisory));
    }
    // The dipole is linear in x; both factors must stay non-negative.
    double ratio = qTop / qBottom;
    double lower = -1.0;
    double upper = Double.POSITIVE_INFINITY;
    if (ratio > EPSILON) {
      upper = 1.0 / ratio;
    } else if (ratio < -EPSILON) {
      lower = max(lower, 1.0 / ratio);
    }
    double exact = -before / denominator;
    double x = max(lower, min(upper, exact));
    if (x != exact) {
      logger.warning(format(
          " Cancelling a dipole of %8.3f eA would reverse terminal charges; scaling is limited.",
          before));
    }
    double topScale = 1.0 + x;
    double bottomScale = max(0.0, 1.0 - x * ratio);

    List<Atom> atoms = new ArrayList<>(slab.getAtoms());
    for (int i : top) {
      atoms.set(i, atoms.get(i).withCharge(q[i] * topScale));
    }
    for (int i : bottom) {
      atoms.set(i, atoms.get(i).withCharge(q[i] * bottomScale));
    }
    SlabCrystal scaled = slab.withAtoms(atoms);
    return withResidual(scaled, before, dipole(scaled), 0, topScale, bottomScale, null);
  }

  private ReconstructionResult withResidual(SlabCrystal slab, double before, double after,
      int moved, double topScale, double bottomScale, Advisory limit) {
    List<Advisory> advisories = new ArrayList<>();
    if (limit != null) {
      advisories.add(limit);
    }
    if (abs(after) > dipoleTolerance) {
      Advisory advisory = new Advisory(SurfaceCondition.NON_STOICHIOMETRIC_RESULT,
          format("Residual dipole %8.3f eA exceeds the tolerance of %6.3f eA.", after,
              dipoleTolerance));
      logger.warning(advisory.toString());
      advisories.add(advisory);
    }
    return new ReconstructionResult(slab, strategy, before, after, moved, topScale, bottomScale,
        Collections.unmodifiableList(advisories));
  }
}
