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

/**
 * Conditions that a surface generation request can raise.
 * <p>
 * Fatal conditions abort the request without producing a slab; advisory conditions are reported
 * alongside a completed result.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum SurfaceCondition {

  /** The Miller indices are (0 0 0). */
  DEGENERATE_PLANE(true, 10, "Degenerate plane"),
  /** Forbidden cut intervals cover the entire normal axis. */
  NO_SAFE_OFFSET_FOUND(true, 11, "No safe offset found"),
  /** An explicit offset falls inside a forbidden interval. */
  UNSAFE_OFFSET(false, 12, "Unsafe offset"),
  /** The requested thickness is not positive. */
  THICKNESS_TOO_SMALL(true, 13, "Thickness too small"),
  /** The requested vacuum is negative. */
  INVALID_VACUUM(true, 14, "Invalid vacuum"),
  /** The reconstructed slab retains a dipole above tolerance. */
  NON_STOICHIOMETRIC_RESULT(false, 15, "Non-stoichiometric result"),
  /** Chemistry tagging failed; the request continues untagged. */
  TAGGING_UNAVAILABLE(false, 16, "Tagging unavailable");

  private final boolean fatal;
  private final int exitCode;
  private final String description;

  SurfaceCondition(boolean fatal, int exitCode, String description) {
    this.fatal = fatal;
    this.exitCode = exitCode;
    this.description = description;
  }

  /**
   * True if this condition aborts the request.
   *
   * @return true for fatal conditions.
   */
  public boolean isFatal() {
    return fatal;
  }

  /**
   * Distinct non-zero process exit code for this condition.
   *
   * @return the exit code.
   */
  public int getExitCode() {
    return exitCode;
  }

  /**
   * Short human-readable description.
   *
   * @return the description.
   */
  public String getDescription() {
    return description;
  }
}
