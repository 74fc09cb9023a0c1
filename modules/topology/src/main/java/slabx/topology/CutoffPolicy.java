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
package slabx.topology;

import static java.lang.String.format;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.openscience.cdk.tools.periodictable.PeriodicTable;

/**
 * A CutoffPolicy maps a pair of elements to the maximum distance at which they are bonded.
 * <p>
 * Pairs listed in the explicit table use their tabulated distance. Other pairs use either a
 * uniform distance or the sum of covalent radii scaled by a tolerance factor.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class CutoffPolicy {

  private static final Logger logger = Logger.getLogger(CutoffPolicy.class.getName());

  /** Default multiplicative tolerance on covalent-radius sums. */
  public static final double DEFAULT_TOLERANCE = 1.15;

  /** Uniform cutoff used when molecules are identified without element-specific radii. */
  public static final double DEFAULT_UNIFORM_CUTOFF = 2.0;

  /** Covalent radius assumed for elements without tabulated data. */
  public static final double FALLBACK_COVALENT_RADIUS = 0.75;

  /** Separations below this are overlapping sites, never bonds. */
  public static final double MIN_BOND_DISTANCE = 0.5;

  private static final Map<String, Double> radii = new ConcurrentHashMap<>();

  private final double tolerance;
  private final double uniformCutoff;
  private final Map<String, Double> pairTable;

  private CutoffPolicy(double tolerance, double uniformCutoff, Map<String, Double> pairTable) {
    this.tolerance = tolerance;
    this.uniformCutoff = uniformCutoff;
    this.pairTable = Collections.unmodifiableMap(new HashMap<>(pairTable));
  }

  /**
   * Covalent-radius sum heuristic: bonded if d &lt;= (r_i + r_j) * tolerance.
   *
   * @param tolerance the multiplicative tolerance factor.
   * @return a new CutoffPolicy.
   */
  public static CutoffPolicy covalent(double tolerance) {
    if (!(tolerance > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid bond tolerance %8.4f.", tolerance));
    }
    return new CutoffPolicy(tolerance, Double.NaN, Map.of());
  }

  /**
   * The same cutoff for every pair of elements.
   *
   * @param cutoff the bonding distance in Angstroms.
   * @return a new CutoffPolicy.
   */
  public static CutoffPolicy uniform(double cutoff) {
    if (!(cutoff > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid bond cutoff %8.4f.", cutoff));
    }
    return new CutoffPolicy(Double.NaN, cutoff, Map.of());
  }

  /**
   * A copy of this policy with an explicit distance for one pair of elements.
   *
   * @param elementA the first element.
   * @param elementB the second element.
   * @param cutoff the bonding distance in Angstroms.
   * @return a new CutoffPolicy.
   */
  public CutoffPolicy withPair(String elementA, String elementB, double cutoff) {
    if (!(cutoff > 0.0)) {
      throw new IllegalArgumentException(format(" Invalid bond cutoff %8.4f.", cutoff));
    }
    Map<String, Double> table = new HashMap<>(pairTable);
    table.put(pairKey(elementA, elementB), cutoff);
    return new CutoffPolicy(tolerance, uniformCutoff, table);
  }

  /**
   * Parse explicit pair entries of the form "A-B:distance" and add them to this policy.
   *
   * @param entries the entries, for example "Zn-O:2.3".
   * @return a new CutoffPolicy.
   * @throws IllegalArgumentException if an entry is malformed.
   */
  public CutoffPolicy withPairs(Collection<String> entries) {
    CutoffPolicy policy = this;
    for (String entry : entries) {
      String[] tokens = entry.trim().split("[-:]");
      if (tokens.length != 3) {
        throw new IllegalArgumentException(format(" Invalid bond table entry %s.", entry));
      }
      try {
        policy = policy.withPair(tokens[0].trim(), tokens[1].trim(),
            Double.parseDouble(tokens[2].trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(format(" Invalid bond table entry %s.", entry), e);
      }
    }
    return policy;
  }

  /**
   * Maximum bonding distance for a pair of elements.
   *
   * @param elementA the first element.
   * @param elementB the second element.
   * @return the cutoff in Angstroms.
   */
  public double maxBondDistance(String elementA, String elementB) {
    Double tabulated = pairTable.get(pairKey(elementA, elementB));
    if (tabulated != null) {
      return tabulated;
    }
    if (!Double.isNaN(uniformCutoff)) {
      return uniformCutoff;
    }
    return (covalentRadius(elementA) + covalentRadius(elementB)) * tolerance;
  }

  /**
   * Largest cutoff over all pairs drawn from a set of elements.
   *
   * @param elements the elements present.
   * @return the largest cutoff in Angstroms.
   */
  public double maxCutoff(Collection<String> elements) {
    double max = 0.0;
    for (String a : elements) {
      for (String b : elements) {
        max = Math.max(max, maxBondDistance(a, b));
      }
    }
    return max;
  }

  /**
   * Covalent radius of an element from the CDK periodic table.
   *
   * @param element the element symbol.
   * @return the radius in Angstroms.
   */
  public static double covalentRadius(String element) {
    return radii.computeIfAbsent(element, symbol -> {
      Double radius = PeriodicTable.getCovalentRadius(symbol);
      if (radius == null || !(radius > 0.0)) {
        logger.warning(format(" No covalent radius for %s; using %4.2f A.", symbol,
            FALLBACK_COVALENT_RADIUS));
        return FALLBACK_COVALENT_RADIUS;
      }
      return radius;
    });
  }

  private static String pairKey(String elementA, String elementB) {
    return (elementA.compareTo(elementB) <= 0) ? elementA + "-" + elementB
        : elementB + "-" + elementA;
  }

  @Override
  public String toString() {
    String base = Double.isNaN(uniformCutoff)
        ? format("covalent radii x %5.3f", tolerance)
        : format("uniform %5.3f A", uniformCutoff);
    return pairTable.isEmpty() ? base : base + " with " + pairTable.size() + " pair overrides";
  }
}
