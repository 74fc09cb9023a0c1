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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import slabx.crystal.Advisory;
import slabx.crystal.ChemistryTagger;
import slabx.crystal.Crystal;
import slabx.crystal.FormalCharges;
import slabx.crystal.MillerIndices;
import slabx.crystal.RoleTag;
import slabx.crystal.SurfaceBasis;
import slabx.crystal.SurfaceBasisFinder;
import slabx.crystal.SurfaceCondition;
import slabx.crystal.SurfaceException;
import slabx.crystal.TaggingUnavailableException;
import slabx.topology.BondGraph;
import slabx.topology.BondGraphBuilder;
import slabx.topology.CutOffset;
import slabx.topology.SafeOffsetSequence;
import slabx.topology.VoidCrawler;

/**
 * The surface generation pipeline: surface basis, slab cell, cut offset, population, optional
 * centring and ionic reconstruction.
 * <p>
 * Fatal conditions are thrown as {@link SurfaceException} before any slab is built; recoverable
 * ones are returned as advisories of the {@link SurfaceResult}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SurfaceGenerator {

  private static final Logger logger = Logger.getLogger(SurfaceGenerator.class.getName());

  private final SurfaceConfig config;
  private final ChemistryTagger tagger;

  /**
   * SurfaceGenerator without chemistry tagging.
   *
   * @param config the settings.
   */
  public SurfaceGenerator(SurfaceConfig config) {
    this(config, null);
  }

  /**
   * Constructor for SurfaceGenerator.
   *
   * @param config the settings.
   * @param tagger the chemistry tagger, or null to leave atoms untagged.
   */
  public SurfaceGenerator(SurfaceConfig config, ChemistryTagger tagger) {
    this.config = config;
    this.tagger = tagger;
  }

  public SurfaceConfig getConfig() {
    return config;
  }

  /**
   * Charge and tag a bulk crystal. Tagging failures degrade to untagged mode.
   *
   * @param crystal the bulk crystal.
   * @param advisories receives a TAGGING_UNAVAILABLE advisory on failure.
   * @return the prepared crystal.
   */
  public Crystal prepare(Crystal crystal, List<Advisory> advisories) {
    Crystal prepared = assignCharges(crystal);
    if (tagger != null) {
      try {
        Map<Integer, RoleTag> roles = tagger.tag(prepared);
        prepared = prepared.withRoles(roles);
        logger.info(format(" Tagged %d of %d atoms.", roles.size(), prepared.getAtomCount()));
      } catch (TaggingUnavailableException e) {
        Advisory advisory = new Advisory(SurfaceCondition.TAGGING_UNAVAILABLE, e.getMessage());
        logger.warning(advisory.toString());
        advisories.add(advisory);
      }
    }
    return prepared;
  }

  /**
   * Build the bond graph of a crystal with the configured cutoff policy.
   *
   * @param crystal the crystal.
   * @return the bond graph.
   */
  public BondGraph buildBonds(Crystal crystal) {
    return BondGraphBuilder.buildBonds(crystal, config.getCutoffPolicy());
  }

  /**
   * Prepare a crystal, build its bonds and generate one surface.
   *
   * @param crystal the bulk crystal.
   * @param hkl the plane.
   * @return the result.
   * @throws SurfaceException for fatal conditions.
   */
  public SurfaceResult generate(Crystal crystal, MillerIndices hkl) {
    List<Advisory> advisories = new ArrayList<>();
    Crystal prepared = prepare(crystal, advisories);
    return generate(prepared, buildBonds(prepared), hkl, advisories);
  }

  /**
   * Generate one surface from a prepared crystal and a shared bond graph. Neither is modified.
   *
   * @param crystal the prepared bulk crystal.
   * @param graph its bond graph.
   * @param hkl the plane.
   * @param inherited advisories raised while preparing the crystal; copied into the result.
   * @return the result.
   * @throws SurfaceException for fatal conditions.
   */
  public SurfaceResult generate(Crystal crystal, BondGraph graph, MillerIndices hkl,
      List<Advisory> inherited) {
    List<Advisory> advisories = new ArrayList<>(inherited);
    Crystal charged = assignCharges(crystal);

    SurfaceBasis basis = SurfaceBasisFinder.findSurfaceBasis(charged.getLattice(), hkl);
    SlabCell cell = SlabBuilder.buildSlabCell(charged.getLattice(), basis,
        config.getThickness(), config.getVacuum());

    VoidCrawler crawler = new VoidCrawler(config.getCutMargin(), config.getRoleShell(),
        config.getPreferredRole());
    CutOffset cut;
    if (config.getOffset() != null) {
      cut = crawler.validateOffset(charged, graph, basis, config.getOffset());
      if (!cut.safe()) {
        SafeOffsetSequence safe = crawler.findSafeOffsets(charged, graph, basis, 1);
        String message = safe.isEmpty()
            ? format("No safe offset exists for %s; the explicit offset %6.4f severs bonds.",
            hkl, cut.offset())
            : format("The explicit offset %6.4f severs bonds; the best safe offset is %6.4f.",
                cut.offset(), safe.first().offset());
        Advisory advisory = new Advisory(SurfaceCondition.UNSAFE_OFFSET, message);
        logger.warning(advisory.toString());
        advisories.add(advisory);
      }
    } else {
      cut = crawler.findSafeOffsets(charged, graph, basis, config.getOffsetCandidates()).first();
      if (cut == null) {
        throw new SurfaceException(SurfaceCondition.NO_SAFE_OFFSET_FOUND,
            format(" Every offset along %s severs a bond.", hkl));
      }
    }

    SlabCrystal slab = SlabPopulator.populate(charged, cell, cut.offset(), cell.getRepeatCount(),
        config.getDuplicateTolerance());
    if (config.isCenterSlab()) {
      slab = SlabPopulator.center(slab);
    }

    IonicReconstructor reconstructor = new IonicReconstructor(config.getStrategy(),
        config.getLayerTolerance(), config.getDipoleTolerance(), config.getCutoffPolicy());
    ReconstructionResult reconstruction = reconstructor.reconstruct(slab);
    advisories.addAll(reconstruction.advisories());

    String report = report(charged, cell, cut, reconstruction, advisories);
    logger.info(report);
    return new SurfaceResult(reconstruction.slab(), cell, cut, reconstruction,
        Collections.unmodifiableList(advisories), report);
  }

  /**
   * Charges are guessed on request, or when reconstruction needs them and the input has none.
   */
  private Crystal assignCharges(Crystal crystal) {
    if (crystal.hasCharges()) {
      return crystal;
    }
    if (config.isGuessCharges() || config.getStrategy() != ReconstructionStrategy.NONE) {
      logger.fine(" Assigning common oxidation states as formal charges.");
      return FormalCharges.assign(crystal);
    }
    return crystal;
  }

  private static String report(Crystal crystal, SlabCell cell, CutOffset cut,
      ReconstructionResult reconstruction, List<Advisory> advisories) {
    SlabCrystal slab = reconstruction.slab();
    StringBuilder sb = new StringBuilder();
    sb.append(format("\n Surface %s of %s\n", cell.getSurfaceBasis().getMillerIndices(),
        crystal.getName()));
    sb.append(format("  %-20s %10.4f A\n", "d-spacing", cell.getDSpacing()));
    sb.append(format("  %-20s %10.4f A -> %d repeats = %10.4f A\n", "Thickness",
        cell.getRequestedThickness(), cell.getRepeatCount(), cell.getMaterialThickness()));
    sb.append(format("  %-20s %10.4f A\n", "Vacuum", cell.getVacuum()));
    sb.append(format("  %-20s %s\n", "Cell", slab.getLattice().toShortString()));
    sb.append(format("  %-20s %10.4f (gap %6.3f A, quality %4.2f)\n", "Cut offset",
        cut.offset(), cut.gapWidthAngstroms(), cut.quality()));
    sb.append(format("  %-20s %d (%s)\n", "Atoms", slab.getAtomCount(), slab.getFormula()));
    sb.append(format("  %-20s %s\n", "Physics", reconstruction.summary()));
    for (Advisory advisory : advisories) {
      sb.append(" ").append(advisory).append("\n");
    }
    return sb.toString();
  }
}
