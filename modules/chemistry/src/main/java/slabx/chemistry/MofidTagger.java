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
package slabx.chemistry;

import static java.lang.String.format;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;
import slabx.crystal.ChemistryTagger;
import slabx.crystal.Crystal;
import slabx.crystal.RoleTag;
import slabx.crystal.TaggingUnavailableException;
import slabx.parsers.CIFFilter;

/**
 * Tags node and linker atoms by running a MOFid-style decomposition executable.
 * <p>
 * The crystal is written to the working directory as a P1 CIF, the executable is invoked as
 * {@code <executable> <cif> <output directory>}, and the fragments it writes are mapped back onto
 * the crystal with the {@link SemanticTagger}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MofidTagger implements ChemistryTagger {

  private static final Logger logger = Logger.getLogger(MofidTagger.class.getName());

  /** Name of the structure written for the decomposition. */
  public static final String INPUT_CIF = "input.cif";
  /** Name of the decomposition output directory. */
  public static final String OUTPUT_DIR = "output";

  private final ExternalTool tool;
  private final Path workDir;

  /**
   * Constructor for MofidTagger.
   *
   * @param executable the decomposition executable, or null if none is installed.
   * @param workDir the directory for intermediate files.
   * @param timeoutSeconds the time limit of one decomposition.
   */
  public MofidTagger(Path executable, Path workDir, long timeoutSeconds) {
    this.tool = (executable == null) ? null : new ExternalTool(executable, timeoutSeconds);
    this.workDir = workDir;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Map<Integer, RoleTag> tag(Crystal crystal) throws TaggingUnavailableException {
    if (tool == null) {
      throw new TaggingUnavailableException(
          "No decomposition executable is configured (set tagging-executable).");
    }
    Path output = workDir.resolve(OUTPUT_DIR);
    FragmentArtifacts artifacts;
    try {
      Files.createDirectories(workDir);
      Path cif = workDir.resolve(INPUT_CIF);
      CIFFilter.write(crystal, cif);
      tool.run(workDir, cif.toAbsolutePath().toString(), output.toAbsolutePath().toString());
      artifacts = FragmentArtifacts.locate(output);
    } catch (IOException e) {
      throw new TaggingUnavailableException(
          format("Framework decomposition failed:%s", e.getMessage()), e);
    }
    TaggingReport report = SemanticTagger.tag(crystal, artifacts);
    logger.info(report.toString());
    if (report.roles().isEmpty()) {
      logger.warning(" No fragment atom matched the structure; no role tags were assigned.");
    }
    return report.roles();
  }
}
