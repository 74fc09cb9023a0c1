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
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.max;
import static slabx.numerics.math.DoubleMath.add;
import static slabx.numerics.math.DoubleMath.scale;

import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Lattice;
import slabx.crystal.SurfaceBasis;
import slabx.crystal.SurfaceCondition;
import slabx.crystal.SurfaceException;

/**
 * Builds the {@link SlabCell} for a surface basis, thickness and vacuum.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SlabBuilder {

  private static final Logger logger = Logger.getLogger(SlabBuilder.class.getName());

  /** In-plane aspect ratios above this value are reported. */
  public static final double MAX_ASPECT_RATIO = 5.0;

  /** Slack on thickness / d so an exact multiple does not round up to an extra repeat. */
  private static final double REPEAT_EPSILON = 1.0e-8;

  private SlabBuilder() {
  }

  /**
   * Build the slab cell.
   *
   * @param lattice the bulk lattice.
   * @param basis the surface basis of the plane.
   * @param thickness the minimum material thickness along the normal, in Angstroms.
   * @param vacuum the vacuum gap along the normal, in Angstroms.
   * @return the slab cell.
   * @throws SurfaceException with THICKNESS_TOO_SMALL or INVALID_VACUUM.
   */
  public static SlabCell buildSlabCell(Lattice lattice, SurfaceBasis basis, double thickness,
      double vacuum) {
    if (!(thickness > 0.0) || Double.isInfinite(thickness)) {
      throw new SurfaceException(SurfaceCondition.THICKNESS_TOO_SMALL,
          format(" The slab thickness must be positive (%s).", thickness));
    }
    if (!(vacuum >= 0.0) || Double.isInfinite(vacuum)) {
      throw new SurfaceException(SurfaceCondition.INVALID_VACUUM,
          format(" The vacuum must not be negative (%s).", vacuum));
    }
    if (!lattice.equals(basis.getLattice())) {
      throw new IllegalArgumentException(" The surface basis belongs to a different lattice.");
    }

    double d = basis.getDSpacing();
    int n = max(1, (int) ceil(thickness / d - REPEAT_EPSILON));

    double[] u = basis.getCartesianU();
    double[] v = basis.getCartesianV();
    double[] w = basis.getCartesianTransverse();
    double[] c = add(scale(w, n), scale(basis.getNormal(), vacuum));
    Lattice slabLattice = Lattice.fromVectors(u, v, c);

    double aspectRatio = basis.getAspectRatio();
    if (aspectRatio > MAX_ASPECT_RATIO) {
      logger.warning(format(" High in-plane aspect ratio (%4.1f) for surface %s.", aspectRatio,
          basis.getMillerIndices()));
    }

    SlabCell cell = new SlabCell(basis, slabLattice, n, thickness, vacuum);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(cell.toString());
    }
    return cell;
  }
}
