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
package slabx.commands;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import slabx.Main;
import slabx.chemistry.MofidTagger;
import slabx.crystal.Advisory;
import slabx.crystal.ChemistryTagger;
import slabx.crystal.Crystal;
import slabx.crystal.MillerIndices;
import slabx.crystal.RoleTag;
import slabx.crystal.SurfaceException;
import slabx.parsers.CIFFilter;
import slabx.synthesis.ReconstructionStrategy;
import slabx.synthesis.SurfaceConfig;
import slabx.synthesis.SurfaceGenerator;
import slabx.synthesis.SurfaceResult;
import slabx.utilities.SlabProperties;
import slabx.utilities.SlabXCommand;

/**
 * The Generate command cuts a surface slab from a bulk crystal.
 * <br>
 * Usage:
 * <br>
 * slabx Generate -i bulk.cif -o slab.cif h k l
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
@Command(name = "Generate", description = " Generate a surface slab from a periodic crystal.")
public class Generate extends SlabXCommand {

  /** -i or --input The bulk crystal CIF. */
  @Option(names = {"-i", "--input"}, paramLabel = "bulk.cif", required = true,
      description = "The bulk crystal in CIF format.")
  private String input;

  /** -o or --output The slab CIF to write. */
  @Option(names = {"-o", "--output"}, paramLabel = "slab.cif", required = true,
      description = "The slab CIF to write.")
  private String output;

  /** --thickness Minimum material thickness in Angstroms. */
  @Option(names = {"-t", "--thickness"}, paramLabel = "15.0",
      description = "Minimum material thickness along the surface normal (A).")
  private Double thickness = null;

  /** --vacuum Vacuum gap in Angstroms. */
  @Option(names = {"-v", "--vacuum"}, paramLabel = "15.0",
      description = "Vacuum gap along the surface normal (A).")
  private Double vacuum = null;

  /** --offset Explicit fractional cut offset. */
  @Option(names = {"--offset"}, paramLabel = "0.0",
      description = "Explicit fractional cut offset in [0, 1); the safe offset search is skipped.")
  private Double offset = null;

  /** --bond-cutoff Uniform bond cutoff. */
  @Option(names = {"--bond-cutoff"}, paramLabel = "2.5",
      description = "Uniform bond cutoff (A) replacing the covalent radius heuristic.")
  private Double bondCutoff = null;

  /** --reconstruct Cancel the dipole of polar slabs. */
  @Option(names = {"--reconstruct"}, arity = "0..1", paramLabel = "strategy",
      fallbackValue = "transfer-ions",
      description = "Ionic reconstruction of polar slabs: transfer-ions (default) or scale-layer-charge.")
  private String reconstruct = null;

  /** --center Split the vacuum above and below the slab. */
  @Option(names = {"--center"}, defaultValue = "false",
      description = "Center the slab in the vacuum.")
  private boolean center = false;

  /** --with-tagging Tag framework nodes and linkers with the external decomposition tool. */
  @Option(names = {"--with-tagging"}, defaultValue = "false",
      description = "Tag nodes and linkers with the external decomposition tool.")
  private boolean withTagging = false;

  /** --tagging-work-dir Working directory of the decomposition tool. */
  @Option(names = {"--tagging-work-dir"}, paramLabel = "mofid_work",
      description = "Working directory of the decomposition tool.")
  private String taggingWorkDir = null;

  /** --tagging-executable Path of the decomposition tool. */
  @Option(names = {"--tagging-executable"}, paramLabel = "path",
      description = "Path of the decomposition tool.")
  private String taggingExecutable = null;

  /** The surface chemistry to expose. */
  @ArgGroup(exclusive = true, multiplicity = "0..1")
  private ExposureOptions exposure = null;

  /** The Miller indices h k l. */
  @Parameters(arity = "3", paramLabel = "h k l", description = "Miller indices of the surface.")
  private int[] hkl = null;

  /**
   * Mutually exclusive exposure preferences.
   */
  static class ExposureOptions {

    /** --expose-nodes Prefer cuts that expose metal nodes. */
    @Option(names = {"--expose-nodes"}, defaultValue = "false",
        description = "Prefer cuts that expose framework nodes.")
    boolean nodes = false;

    /** --expose-linkers Prefer cuts that expose organic linkers. */
    @Option(names = {"--expose-linkers"}, defaultValue = "false",
        description = "Prefer cuts that expose framework linkers.")
    boolean linkers = false;

    RoleTag getRole() {
      if (nodes) {
        return RoleTag.NODE;
      }
      if (linkers) {
        return RoleTag.LINKER;
      }
      return RoleTag.UNKNOWN;
    }
  }

  private int exitCode = 0;
  private SurfaceResult result = null;

  /**
   * Generate constructor.
   *
   * @param args the command line arguments.
   */
  public Generate(String[] args) {
    super(args);
  }

  /**
   * The process exit code of the last run.
   *
   * @return 0 on success.
   */
  public int getExitCode() {
    return exitCode;
  }

  /**
   * The slab produced by the last run.
   *
   * @return the result, or null if none was generated.
   */
  public SurfaceResult getResult() {
    return result;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Generate run() {
    try {
      if (!init()) {
        return this;
      }
    } catch (CommandLine.ParameterException e) {
      logger.warning(format(" %s", e.getMessage()));
      logger.info(helpString());
      exitCode = Main.USAGE_ERROR;
      return this;
    }

    Path inputPath = Paths.get(input);
    Path outputPath = Paths.get(output);

    MillerIndices millerIndices;
    try {
      millerIndices = new MillerIndices(hkl[0], hkl[1], hkl[2]);
    } catch (SurfaceException e) {
      logger.severe(e.getMessage());
      exitCode = e.getCondition().getExitCode();
      return this;
    }

    SurfaceConfig config;
    try {
      config = configure(inputPath.toFile());
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Invalid arguments: %s", e.getMessage()));
      exitCode = Main.USAGE_ERROR;
      return this;
    }

    Crystal crystal;
    try {
      crystal = CIFFilter.read(inputPath);
    } catch (IOException e) {
      logger.warning(format(" Could not read %s: %s", inputPath, e.getMessage()));
      exitCode = Main.IO_ERROR;
      return this;
    }
    logger.info(format(" Read %s (%s, %d atoms).", inputPath, crystal.getFormula(),
        crystal.getAtomCount()));

    ChemistryTagger tagger = null;
    if (withTagging) {
      Path executable = (config.getTaggingExecutable() == null) ? null
          : Paths.get(config.getTaggingExecutable());
      tagger = new MofidTagger(executable, Paths.get(config.getTaggingWorkDir()),
          config.getTaggingTimeout());
    } else if (config.getPreferredRole() != RoleTag.UNKNOWN) {
      logger.warning(format(" Exposing %s atoms requires --with-tagging; no role bias is applied.",
          config.getPreferredRole()));
    }

    try {
      result = new SurfaceGenerator(config, tagger).generate(crystal, millerIndices);
    } catch (SurfaceException e) {
      logger.severe(e.getMessage());
      exitCode = e.getCondition().getExitCode();
      return this;
    }

    try {
      Path parent = outputPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      CIFFilter.write(result.slab(), outputPath);
    } catch (IOException e) {
      logger.warning(format(" Could not write %s: %s", outputPath, e.getMessage()));
      exitCode = Main.IO_ERROR;
      return this;
    }

    logger.info(format(" Wrote %s (%d atoms).", outputPath, result.slab().getAtomCount()));
    for (Advisory advisory : result.advisories()) {
      logger.info(format(" Advisory %s", advisory));
    }
    exitCode = 0;
    return this;
  }

  /**
   * Layer command line options over the property configuration.
   */
  private SurfaceConfig configure(File structure) {
    CompositeConfiguration properties = SlabProperties.loadProperties(structure);
    SurfaceConfig.Builder builder = SurfaceConfig.fromProperties(properties);
    if (thickness != null) {
      builder.thickness(thickness);
    }
    if (vacuum != null) {
      builder.vacuum(vacuum);
    }
    if (offset != null) {
      builder.offset(offset);
    }
    if (bondCutoff != null) {
      builder.bondCutoff(bondCutoff);
    }
    if (reconstruct != null) {
      builder.strategy(ReconstructionStrategy.parse(reconstruct));
    }
    if (center) {
      builder.centerSlab(true);
    }
    if (taggingWorkDir != null) {
      builder.taggingWorkDir(taggingWorkDir);
    }
    if (taggingExecutable != null) {
      builder.taggingExecutable(taggingExecutable);
    }
    if (exposure != null) {
      builder.preferredRole(exposure.getRole());
    }
    SurfaceConfig config = builder.build();
    logger.info(config.toString());
    return config;
  }
}
