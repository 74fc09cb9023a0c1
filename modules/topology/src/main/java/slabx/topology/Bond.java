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

import java.util.Arrays;
import java.util.Objects;

/**
 * A bond from atom i in the home cell to atom j displaced by an integer lattice translation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Bond {

  private final int i;
  private final int j;
  private final int[] image;
  private final double distance;

  /**
   * Constructor for Bond.
   *
   * @param i the first atom index.
   * @param j the second atom index.
   * @param image the translation applied to atom j.
   * @param distance the bond length in Angstroms.
   */
  public Bond(int i, int j, int[] image, double distance) {
    this.i = i;
    this.j = j;
    this.image = image.clone();
    this.distance = distance;
  }

  /**
   * getI.
   *
   * @return the first atom index.
   */
  public int getI() {
    return i;
  }

  /**
   * getJ.
   *
   * @return the second atom index.
   */
  public int getJ() {
    return j;
  }

  /**
   * The lattice translation applied to atom j.
   *
   * @return a copy of the image offset.
   */
  public int[] getImage() {
    return image.clone();
  }

  /**
   * One component of the image offset.
   *
   * @param axis 0, 1 or 2.
   * @return the component.
   */
  public int getImage(int axis) {
    return image[axis];
  }

  /**
   * getDistance.
   *
   * @return the bond length in Angstroms.
   */
  public double getDistance() {
    return distance;
  }

  /**
   * True if the bond connects an atom to a periodic copy of a different cell.
   *
   * @return true for bonds that cross the cell boundary.
   */
  public boolean crossesBoundary() {
    return image[0] != 0 || image[1] != 0 || image[2] != 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Bond other)) {
      return false;
    }
    return i == other.i && j == other.j && Arrays.equals(image, other.image);
  }

  @Override
  public int hashCode() {
    return Objects.hash(i, j, Arrays.hashCode(image));
  }

  @Override
  public String toString() {
    return format("%d-%d [%d %d %d] %7.4f", i, j, image[0], image[1], image[2], distance);
  }
}
