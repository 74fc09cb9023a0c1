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

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An Atom of a Crystal: a species, fractional coordinates wrapped into [0, 1), an optional formal
 * charge and a role tag.
 * <p>
 * Atoms are immutable; the "with" methods return new instances.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Atom {

  /** Species decorated with an oxidation state, such as Fe3+, O2- or Na+. */
  private static final Pattern DECORATED_SPECIES = Pattern.compile("^([A-Za-z]+)(\\d*)([+-])$");

  private final String species;
  private final String element;
  private final double[] xyz;
  private final Double charge;
  private final RoleTag role;

  /**
   * Constructor for an uncharged, untagged Atom.
   *
   * @param species the species identifier (element symbol, CIF label or decorated ion).
   * @param xyz fractional coordinates; reduced modulo 1.
   */
  public Atom(String species, double[] xyz) {
    this(species, xyz, null, RoleTag.UNKNOWN);
  }

  /**
   * Constructor for Atom.
   *
   * @param species the species identifier.
   * @param xyz fractional coordinates; reduced modulo 1.
   * @param charge the formal charge, or null. A null charge falls back to the oxidation state
   *     encoded in a decorated species such as O2-.
   * @param role the role tag; null is treated as {@link RoleTag#UNKNOWN}.
   */
  public Atom(String species, double[] xyz, Double charge, RoleTag role) {
    if (species == null || species.isBlank()) {
      throw new IllegalArgumentException(" An atom requires a species.");
    }
    if (xyz == null || xyz.length != 3) {
      throw new IllegalArgumentException(" Fractional coordinates require three components.");
    }
    for (double x : xyz) {
      if (!Double.isFinite(x)) {
        throw new IllegalArgumentException(
            format(" Invalid fractional coordinates %s.", Arrays.toString(xyz)));
      }
    }
    this.species = species.trim();
    this.element = elementOf(this.species);
    this.xyz = Lattice.wrap(xyz);
    this.charge = (charge != null) ? charge : chargeOf(this.species);
    this.role = (role == null) ? RoleTag.UNKNOWN : role;
  }

  /**
   * Derive the chemical element of a species by stripping label digits, suffixes and charge text
   * (e.g. "Fe3+" gives "Fe", "C12A" gives "C" and "CL1" gives "Cl").
   *
   * @param species the species identifier.
   * @return the element symbol.
   */
  public static String elementOf(String species) {
    StringBuilder letters = new StringBuilder();
    for (char ch : species.trim().toCharArray()) {
      if (!Character.isLetter(ch)) {
        break;
      }
      letters.append(ch);
    }
    if (letters.length() == 0) {
      return species.trim();
    }
    String symbol = letters.length() > 2 ? letters.substring(0, 2) : letters.toString();
    // Three or more capitals, such as "CAB": a one-letter element with a label suffix.
    if (symbol.length() == 2 && Character.isUpperCase(symbol.charAt(1))
        && letters.length() > 2) {
      symbol = symbol.substring(0, 1);
    }
    return Character.toUpperCase(symbol.charAt(0)) + symbol.substring(1).toLowerCase();
  }

  /**
   * Parse the oxidation state of a decorated species.
   *
   * @param species the species identifier.
   * @return the charge (for example -2.0 for O2-), or null if the species is not decorated.
   */
  public static Double chargeOf(String species) {
    Matcher matcher = DECORATED_SPECIES.matcher(species.trim());
    if (!matcher.matches()) {
      return null;
    }
    String digits = matcher.group(2);
    double magnitude = digits.isEmpty() ? 1.0 : Integer.parseInt(digits);
    return matcher.group(3).equals("-") ? -magnitude : magnitude;
  }

  /**
   * The species identifier.
   *
   * @return the species.
   */
  public String getSpecies() {
    return species;
  }

  /**
   * The chemical element symbol.
   *
   * @return the element.
   */
  public String getElement() {
    return element;
  }

  /**
   * A copy of the fractional coordinates.
   *
   * @return fractional coordinates in [0, 1).
   */
  public double[] getXYZ() {
    return xyz.clone();
  }

  /**
   * A single fractional coordinate.
   *
   * @param axis 0, 1 or 2.
   * @return the coordinate.
   */
  public double getXYZ(int axis) {
    return xyz[axis];
  }

  /**
   * True if the atom carries a formal charge.
   *
   * @return true if charged.
   */
  public boolean hasCharge() {
    return charge != null;
  }

  /**
   * The formal charge.
   *
   * @return the charge, or 0.0 when no charge is present.
   */
  public double getCharge() {
    return (charge == null) ? 0.0 : charge;
  }

  /**
   * The role tag.
   *
   * @return the role.
   */
  public RoleTag getRole() {
    return role;
  }

  /**
   * A copy of this atom at new fractional coordinates.
   *
   * @param newXYZ fractional coordinates.
   * @return a new Atom.
   */
  public Atom withXYZ(double[] newXYZ) {
    return new Atom(species, newXYZ, charge, role);
  }

  /**
   * A copy of this atom with a new formal charge.
   *
   * @param newCharge the charge, or null to clear it.
   * @return a new Atom.
   */
  public Atom withCharge(Double newCharge) {
    return new Atom(species, xyz, newCharge, role);
  }

  /**
   * A copy of this atom with a new role.
   *
   * @param newRole the role.
   * @return a new Atom.
   */
  public Atom withRole(RoleTag newRole) {
    return new Atom(species, xyz, charge, newRole);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Atom other)) {
      return false;
    }
    return species.equals(other.species) && Arrays.equals(xyz, other.xyz)
        && Objects.equals(charge, other.charge) && role == other.role;
  }

  @Override
  public int hashCode() {
    return Objects.hash(species, Arrays.hashCode(xyz), charge, role);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(
        format("%-6s %9.6f %9.6f %9.6f", species, xyz[0], xyz[1], xyz[2]));
    if (charge != null) {
      sb.append(format(" %+6.3f", charge));
    }
    if (role != RoleTag.UNKNOWN) {
      sb.append(" ").append(role);
    }
    return sb.toString();
  }
}
