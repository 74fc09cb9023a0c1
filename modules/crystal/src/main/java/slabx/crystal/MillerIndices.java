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
package slabx.crystal;

import static java.lang.String.format;
import static slabx.numerics.math.IntegerMath.gcd;

import java.util.Objects;

/**
 * The MillerIndices class represents a crystallographic plane orientation (h k l).
 * <p>
 * Indices are stored in reduced form, divided by their greatest common divisor, since scaling does
 * not change the plane. The indices as given are kept for display.
 *
 * @author Timothy D. Fenn
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MillerIndices {

  private final int h;
  private final int k;
  private final int l;
  private final int[] original;

  /**
   * Constructor for MillerIndices.
   *
   * @param h The h-index of the plane.
   * @param k The k-index of the plane.
   * @param l The l-index of the plane.
   * @throws SurfaceException with {@link SurfaceCondition#DEGENERATE_PLANE} for (0 0 0).
   */
  public MillerIndices(int h, int k, int l) {
    if (h == 0 && k == 0 && l == 0) {
      throw new SurfaceException(SurfaceCondition.DEGENERATE_PLANE,
          "Miller indices (0 0 0) do not define a plane.");
    }
    int divisor = gcd(h, k, l);
    this.h = h / divisor;
    this.k = k / divisor;
    this.l = l / divisor;
    this.original = new int[] {h, k, l};
  }

  /**
   * Parse Miller indices written as "1 1 0", "1,1,0", "(110)" or "(1 -1 0)".
   *
   * @param text the indices.
   * @return the parsed MillerIndices.
   * @throws IllegalArgumentException if the text cannot be parsed.
   */
  public static MillerIndices parse(String text) {
    String trimmed = text.trim().replaceAll("[()\\[\\]]", "").trim();
    String[] tokens = trimmed.split("[\\s,]+");
    try {
      if (tokens.length == 3) {
        return new MillerIndices(Integer.parseInt(tokens[0]), Integer.parseInt(tokens[1]),
            Integer.parseInt(tokens[2]));
      }
      if (tokens.length == 1 && trimmed.matches("(-?\\d){3}")) {
        int[] hkl = new int[3];
        int n = 0;
        for (int i = 0; i < trimmed.length(); i++) {
          int sign = 1;
          if (trimmed.charAt(i) == '-') {
            sign = -1;
            i++;
          }
          hkl[n++] = sign * Character.digit(trimmed.charAt(i), 10);
        }
        return new MillerIndices(hkl[0], hkl[1], hkl[2]);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(format(" Could not parse Miller indices %s.", text), e);
    }
    throw new IllegalArgumentException(format(" Could not parse Miller indices %s.", text));
  }

  /**
   * The reduced h-index.
   *
   * @return h.
   */
  public int h() {
    return h;
  }

  /**
   * The reduced k-index.
   *
   * @return k.
   */
  public int k() {
    return k;
  }

  /**
   * The reduced l-index.
   *
   * @return l.
   */
  public int l() {
    return l;
  }

  /**
   * The reduced indices as a new array.
   *
   * @return {h, k, l}.
   */
  public int[] toArray() {
    return new int[] {h, k, l};
  }

  /**
   * The indices as originally given, before reduction.
   *
   * @return a copy of the original indices.
   */
  public int[] getOriginal() {
    return original.clone();
  }

  /** Planes are equal when their reduced indices agree. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MillerIndices other = (MillerIndices) o;
    return h == other.h && k == other.k && l == other.l;
  }

  @Override
  public int hashCode() {
    return Objects.hash(h, k, l);
  }

  @Override
  public String toString() {
    return format("(%d %d %d)", h, k, l);
  }
}
