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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * A lazy, finite and restartable sequence of safe cut offsets, ordered by preference.
 * <p>
 * The ranking is computed on first use and cached; every call to {@link #iterator()} replays it
 * from the start.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SafeOffsetSequence implements Iterable<CutOffset> {

  private final Supplier<List<CutOffset>> supplier;
  private volatile List<CutOffset> offsets;

  SafeOffsetSequence(Supplier<List<CutOffset>> supplier) {
    this.supplier = supplier;
  }

  private List<CutOffset> offsets() {
    List<CutOffset> result = offsets;
    if (result == null) {
      synchronized (this) {
        result = offsets;
        if (result == null) {
          result = Collections.unmodifiableList(supplier.get());
          offsets = result;
        }
      }
    }
    return result;
  }

  @Override
  public Iterator<CutOffset> iterator() {
    return offsets().iterator();
  }

  /**
   * True if no safe offset exists.
   *
   * @return true if the sequence is empty.
   */
  public boolean isEmpty() {
    return offsets().isEmpty();
  }

  /**
   * Number of offsets in the sequence.
   *
   * @return the size.
   */
  public int size() {
    return offsets().size();
  }

  /**
   * The preferred offset.
   *
   * @return the first offset, or null if the sequence is empty.
   */
  public CutOffset first() {
    List<CutOffset> list = offsets();
    return list.isEmpty() ? null : list.get(0);
  }

  /**
   * The ranked offsets.
   *
   * @return an unmodifiable list.
   */
  public List<CutOffset> toList() {
    return offsets();
  }
}
