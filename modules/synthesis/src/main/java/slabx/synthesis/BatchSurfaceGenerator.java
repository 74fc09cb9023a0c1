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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import slabx.crystal.Advisory;
import slabx.crystal.Crystal;
import slabx.crystal.MillerIndices;
import slabx.crystal.SurfaceException;
import slabx.topology.BondGraph;

/**
 * Generates surfaces for many planes of one crystal in parallel. The crystal is prepared and its
 * bond graph built once; both are shared read-only by every plane.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BatchSurfaceGenerator {

  private static final Logger logger = Logger.getLogger(BatchSurfaceGenerator.class.getName());

  /**
   * The outcome for one plane: a result or the fatal condition that stopped it.
   *
   * @param plane the plane.
   * @param result the result, or null on failure.
   * @param failure the failure, or null on success.
   */
  public record PlaneResult(MillerIndices plane, SurfaceResult result, SurfaceException failure) {

    public boolean isSuccess() {
      return failure == null;
    }
  }

  private final SurfaceGenerator generator;
  private final int threadCount;

  /**
   * Constructor for BatchSurfaceGenerator.
   *
   * @param generator the single-plane generator.
   * @param threadCount the number of worker threads.
   */
  public BatchSurfaceGenerator(SurfaceGenerator generator, int threadCount) {
    if (threadCount < 1) {
      throw new IllegalArgumentException(format(" Invalid thread count %d.", threadCount));
    }
    this.generator = generator;
    this.threadCount = threadCount;
  }

  /**
   * Generate a surface for every plane.
   *
   * @param crystal the bulk crystal.
   * @param planes the planes.
   * @return one result per plane, in input order.
   * @throws IllegalStateException if interrupted while waiting for results.
   */
  public List<PlaneResult> generate(Crystal crystal, List<MillerIndices> planes) {
    List<Advisory> advisories = new ArrayList<>();
    Crystal prepared = generator.prepare(crystal, advisories);
    BondGraph graph = generator.buildBonds(prepared);
    logger.info(format(" Generating %d surfaces of %s on %d threads.", planes.size(),
        prepared.getName(), threadCount));

    List<PlaneResult> results = new ArrayList<>(planes.size());
    if (planes.isEmpty()) {
      return results;
    }
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, planes.size()));
    try {
      List<Future<SurfaceResult>> futures = new ArrayList<>(planes.size());
      for (MillerIndices plane : planes) {
        futures.add(executor.submit(() -> generator.generate(prepared, graph, plane, advisories)));
      }
      for (int i = 0; i < planes.size(); i++) {
        MillerIndices plane = planes.get(i);
        try {
          results.add(new PlaneResult(plane, futures.get(i).get(), null));
        } catch (ExecutionException e) {
          if (e.getCause() instanceof SurfaceException surfaceException) {
            logger.warning(format(" Surface %s failed: %s", plane, surfaceException.getMessage()));
            results.add(new PlaneResult(plane, null, surfaceException));
          } else if (e.getCause() instanceof RuntimeException runtimeException) {
            throw runtimeException;
          } else {
            throw new IllegalStateException(e.getCause());
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" Interrupted while generating surfaces.", e);
    } finally {
      executor.shutdownNow();
    }
    if (logger.isLoggable(Level.FINE)) {
      long failed = results.stream().filter(r -> !r.isSuccess()).count();
      logger.fine(format(" %d of %d surfaces failed.", failed, results.size()));
    }
    return results;
  }
}
