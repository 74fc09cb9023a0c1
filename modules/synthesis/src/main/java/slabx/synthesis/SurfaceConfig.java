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
import static slabx.synthesis.SurfaceKeyword.BOND_CUTOFF;
import static slabx.synthesis.SurfaceKeyword.BOND_TABLE;
import static slabx.synthesis.SurfaceKeyword.BOND_TOLERANCE;
import static slabx.synthesis.SurfaceKeyword.CENTER_SLAB;
import static slabx.synthesis.SurfaceKeyword.CUT_MARGIN;
import static slabx.synthesis.SurfaceKeyword.DIPOLE_TOLERANCE;
import static slabx.synthesis.SurfaceKeyword.DUPLICATE_TOLERANCE;
import static slabx.synthesis.SurfaceKeyword.GUESS_CHARGES;
import static slabx.synthesis.SurfaceKeyword.LAYER_TOLERANCE;
import static slabx.synthesis.SurfaceKeyword.OFFSET_CANDIDATES;
import static slabx.synthesis.SurfaceKeyword.RECONSTRUCTION;
import static slabx.synthesis.SurfaceKeyword.ROLE_SHELL;
import static slabx.synthesis.SurfaceKeyword.SLAB_THICKNESS;
import static slabx.synthesis.SurfaceKeyword.SLAB_VACUUM;
import static slabx.synthesis.SurfaceKeyword.TAGGING_EXECUTABLE;
import static slabx.synthesis.SurfaceKeyword.TAGGING_TIMEOUT;
import static slabx.synthesis.SurfaceKeyword.TAGGING_WORKDIR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.configuration2.CompositeConfiguration;
import slabx.crystal.RoleTag;
import slabx.topology.CutoffPolicy;
import slabx.topology.VoidCrawler;

/**
 * Immutable settings of a surface generation request.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SurfaceConfig {

  public static final double DEFAULT_THICKNESS = 15.0;
  public static final double DEFAULT_VACUUM = 15.0;
  public static final int DEFAULT_OFFSET_CANDIDATES = 5;
  public static final long DEFAULT_TAGGING_TIMEOUT = 120;
  public static final String DEFAULT_TAGGING_WORKDIR = "mofid_work";

  private final double thickness;
  private final double vacuum;
  private final Double offset;
  private final ReconstructionStrategy strategy;
  private final RoleTag preferredRole;
  private final double bondTolerance;
  private final Double bondCutoff;
  private final List<String> bondTable;
  private final double cutMargin;
  private final int offsetCandidates;
  private final double roleShell;
  private final double layerTolerance;
  private final double dipoleTolerance;
  private final boolean guessCharges;
  private final boolean centerSlab;
  private final double duplicateTolerance;
  private final long taggingTimeout;
  private final String taggingExecutable;
  private final String taggingWorkDir;

  private SurfaceConfig(Builder builder) {
    thickness = builder.thickness;
    vacuum = builder.vacuum;
    offset = builder.offset;
    strategy = builder.strategy;
    preferredRole = builder.preferredRole;
    bondTolerance = builder.bondTolerance;
    bondCutoff = builder.bondCutoff;
    bondTable = Collections.unmodifiableList(new ArrayList<>(builder.bondTable));
    cutMargin = builder.cutMargin;
    offsetCandidates = builder.offsetCandidates;
    roleShell = builder.roleShell;
    layerTolerance = builder.layerTolerance;
    dipoleTolerance = builder.dipoleTolerance;
    guessCharges = builder.guessCharges;
    centerSlab = builder.centerSlab;
    duplicateTolerance = builder.duplicateTolerance;
    taggingTimeout = builder.taggingTimeout;
    taggingExecutable = builder.taggingExecutable;
    taggingWorkDir = builder.taggingWorkDir;
  }

  /**
   * A new builder holding the defaults.
   *
   * @return the builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Map configuration properties (see {@link SurfaceKeyword}) onto a builder; keys that are
   * absent keep their defaults.
   *
   * @param properties the configuration.
   * @return a builder, so command line options can still override values.
   * @throws IllegalArgumentException if a value cannot be interpreted.
   */
  public static Builder fromProperties(CompositeConfiguration properties) {
    Builder builder = new Builder();
    try {
      builder.thickness(properties.getDouble(SLAB_THICKNESS.key(), builder.thickness))
          .vacuum(properties.getDouble(SLAB_VACUUM.key(), builder.vacuum))
          .bondTolerance(properties.getDouble(BOND_TOLERANCE.key(), builder.bondTolerance))
          .cutMargin(properties.getDouble(CUT_MARGIN.key(), builder.cutMargin))
          .offsetCandidates(properties.getInt(OFFSET_CANDIDATES.key(), builder.offsetCandidates))
          .roleShell(properties.getDouble(ROLE_SHELL.key(), builder.roleShell))
          .layerTolerance(properties.getDouble(LAYER_TOLERANCE.key(), builder.layerTolerance))
          .dipoleTolerance(properties.getDouble(DIPOLE_TOLERANCE.key(), builder.dipoleTolerance))
          .guessCharges(properties.getBoolean(GUESS_CHARGES.key(), builder.guessCharges))
          .centerSlab(properties.getBoolean(CENTER_SLAB.key(), builder.centerSlab))
          .duplicateTolerance(
              properties.getDouble(DUPLICATE_TOLERANCE.key(), builder.duplicateTolerance))
          .taggingTimeout(properties.getLong(TAGGING_TIMEOUT.key(), builder.taggingTimeout))
          .taggingExecutable(properties.getString(TAGGING_EXECUTABLE.key(), null))
          .taggingWorkDir(properties.getString(TAGGING_WORKDIR.key(), builder.taggingWorkDir));
      if (properties.containsKey(BOND_CUTOFF.key())) {
        builder.bondCutoff(properties.getDouble(BOND_CUTOFF.key()));
      }
      if (properties.containsKey(RECONSTRUCTION.key())) {
        builder.strategy(ReconstructionStrategy.parse(properties.getString(RECONSTRUCTION.key())));
      }
      List<String> entries = new ArrayList<>();
      for (String value : properties.getStringArray(BOND_TABLE.key())) {
        for (String entry : value.split("[,\\s]+")) {
          if (!entry.isBlank()) {
            entries.add(entry);
          }
        }
      }
      builder.bondTable(entries);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(format(" Invalid surface configuration: %s",
          e.getMessage()), e);
    }
    return builder;
  }

  /**
   * A builder initialised with this configuration.
   *
   * @return the builder.
   */
  public Builder toBuilder() {
    return new Builder()
        .thickness(thickness)
        .vacuum(vacuum)
        .offset(offset)
        .strategy(strategy)
        .preferredRole(preferredRole)
        .bondTolerance(bondTolerance)
        .bondCutoff(bondCutoff)
        .bondTable(bondTable)
        .cutMargin(cutMargin)
        .offsetCandidates(offsetCandidates)
        .roleShell(roleShell)
        .layerTolerance(layerTolerance)
        .dipoleTolerance(dipoleTolerance)
        .guessCharges(guessCharges)
        .centerSlab(centerSlab)
        .duplicateTolerance(duplicateTolerance)
        .taggingTimeout(taggingTimeout)
        .taggingExecutable(taggingExecutable)
        .taggingWorkDir(taggingWorkDir);
  }

  /**
   * The bonding policy: a uniform cutoff when one is set, otherwise the covalent heuristic, with
   * the explicit pair table layered over either.
   *
   * @return the cutoff policy.
   */
  public CutoffPolicy getCutoffPolicy() {
    CutoffPolicy policy = (bondCutoff != null) ? CutoffPolicy.uniform(bondCutoff)
        : CutoffPolicy.covalent(bondTolerance);
    return policy.withPairs(bondTable);
  }

  public double getThickness() {
    return thickness;
  }

  public double getVacuum() {
    return vacuum;
  }

  /**
   * The explicit cut offset.
   *
   * @return the offset, or null to let the void crawler choose.
   */
  public Double getOffset() {
    return offset;
  }

  public ReconstructionStrategy getStrategy() {
    return strategy;
  }

  public RoleTag getPreferredRole() {
    return preferredRole;
  }

  public double getBondTolerance() {
    return bondTolerance;
  }

  public Double getBondCutoff() {
    return bondCutoff;
  }

  public List<String> getBondTable() {
    return bondTable;
  }

  public double getCutMargin() {
    return cutMargin;
  }

  public int getOffsetCandidates() {
    return offsetCandidates;
  }

  public double getRoleShell() {
    return roleShell;
  }

  public double getLayerTolerance() {
    return layerTolerance;
  }

  public double getDipoleTolerance() {
    return dipoleTolerance;
  }

  public boolean isGuessCharges() {
    return guessCharges;
  }

  public boolean isCenterSlab() {
    return centerSlab;
  }

  public double getDuplicateTolerance() {
    return duplicateTolerance;
  }

  public long getTaggingTimeout() {
    return taggingTimeout;
  }

  public String getTaggingExecutable() {
    return taggingExecutable;
  }

  public String getTaggingWorkDir() {
    return taggingWorkDir;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Surface settings:\n");
    sb.append(format("  %-22s %8.3f A\n", "Thickness", thickness));
    sb.append(format("  %-22s %8.3f A\n", "Vacuum", vacuum));
    if (offset != null) {
      sb.append(format("  %-22s %8.4f\n", "Offset", offset));
    }
    sb.append(format("  %-22s %s\n", "Bonding", getCutoffPolicy()));
    sb.append(format("  %-22s %s\n", "Reconstruction", strategy));
    if (preferredRole != RoleTag.UNKNOWN) {
      sb.append(format("  %-22s %s\n", "Exposed role", preferredRole));
    }
    return sb.toString();
  }

  /**
   * Builder for SurfaceConfig.
   */
  public static final class Builder {

    private double thickness = DEFAULT_THICKNESS;
    private double vacuum = DEFAULT_VACUUM;
    private Double offset = null;
    private ReconstructionStrategy strategy = ReconstructionStrategy.NONE;
    private RoleTag preferredRole = RoleTag.UNKNOWN;
    private double bondTolerance = CutoffPolicy.DEFAULT_TOLERANCE;
    private Double bondCutoff = null;
    private List<String> bondTable = List.of();
    private double cutMargin = VoidCrawler.DEFAULT_MARGIN;
    private int offsetCandidates = DEFAULT_OFFSET_CANDIDATES;
    private double roleShell = VoidCrawler.DEFAULT_ROLE_SHELL;
    private double layerTolerance = IonicReconstructor.DEFAULT_LAYER_TOLERANCE;
    private double dipoleTolerance = IonicReconstructor.DEFAULT_DIPOLE_TOLERANCE;
    private boolean guessCharges = false;
    private boolean centerSlab = false;
    private double duplicateTolerance = SlabPopulator.DEFAULT_DUPLICATE_TOLERANCE;
    private long taggingTimeout = DEFAULT_TAGGING_TIMEOUT;
    private String taggingExecutable = null;
    private String taggingWorkDir = DEFAULT_TAGGING_WORKDIR;

    private Builder() {
    }

    public Builder thickness(double thickness) {
      this.thickness = thickness;
      return this;
    }

    public Builder vacuum(double vacuum) {
      this.vacuum = vacuum;
      return this;
    }

    public Builder offset(Double offset) {
      this.offset = offset;
      return this;
    }

    public Builder strategy(ReconstructionStrategy strategy) {
      this.strategy = (strategy == null) ? ReconstructionStrategy.NONE : strategy;
      return this;
    }

    public Builder preferredRole(RoleTag preferredRole) {
      this.preferredRole = (preferredRole == null) ? RoleTag.UNKNOWN : preferredRole;
      return this;
    }

    public Builder bondTolerance(double bondTolerance) {
      this.bondTolerance = bondTolerance;
      return this;
    }

    public Builder bondCutoff(Double bondCutoff) {
      this.bondCutoff = bondCutoff;
      return this;
    }

    public Builder bondTable(List<String> bondTable) {
      this.bondTable = (bondTable == null) ? List.of() : List.copyOf(bondTable);
      return this;
    }

    public Builder cutMargin(double cutMargin) {
      this.cutMargin = cutMargin;
      return this;
    }

    public Builder offsetCandidates(int offsetCandidates) {
      this.offsetCandidates = offsetCandidates;
      return this;
    }

    public Builder roleShell(double roleShell) {
      this.roleShell = roleShell;
      return this;
    }

    public Builder layerTolerance(double layerTolerance) {
      this.layerTolerance = layerTolerance;
      return this;
    }

    public Builder dipoleTolerance(double dipoleTolerance) {
      this.dipoleTolerance = dipoleTolerance;
      return this;
    }

    public Builder guessCharges(boolean guessCharges) {
      this.guessCharges = guessCharges;
      return this;
    }

    public Builder centerSlab(boolean centerSlab) {
      this.centerSlab = centerSlab;
      return this;
    }

    public Builder duplicateTolerance(double duplicateTolerance) {
      this.duplicateTolerance = duplicateTolerance;
      return this;
    }

    public Builder taggingTimeout(long taggingTimeout) {
      this.taggingTimeout = taggingTimeout;
      return this;
    }

    public Builder taggingExecutable(String taggingExecutable) {
      this.taggingExecutable = taggingExecutable;
      return this;
    }

    public Builder taggingWorkDir(String taggingWorkDir) {
      this.taggingWorkDir = taggingWorkDir;
      return this;
    }

    /**
     * Build the configuration. Thickness and vacuum are checked when the slab is built.
     *
     * @return the configuration.
     * @throws IllegalArgumentException if a tolerance or count is out of range.
     */
    public SurfaceConfig build() {
      if (offsetCandidates < 1) {
        throw new IllegalArgumentException(
            format(" At least one offset candidate is required (%d).", offsetCandidates));
      }
      if (!(cutMargin >= 0.0) || !(layerTolerance > 0.0) || !(dipoleTolerance >= 0.0)
          || !(duplicateTolerance > 0.0) || !(roleShell > 0.0)) {
        throw new IllegalArgumentException(" Tolerances must be positive.");
      }
      if (taggingTimeout < 1) {
        throw new IllegalArgumentException(
            format(" The tagging timeout must be positive (%d s).", taggingTimeout));
      }
      return new SurfaceConfig(this);
    }
  }
}
