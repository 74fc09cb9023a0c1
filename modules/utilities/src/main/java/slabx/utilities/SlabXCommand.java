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
package slabx.utilities;

import static java.lang.String.format;
import static picocli.CommandLine.usage;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Base Slab X Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class SlabXCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(SlabXCommand.class.getName());

  /**
   * Color for command line help.
   */
  public final Ansi color;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the Slab X version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Slab X version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public SlabXCommand(String[] args) {
    this.args = (args == null) ? new String[0] : args;
    color = Ansi.AUTO;
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (PrintStream printStream = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      usage(this, printStream, color);
    }
    return " " + bytes.toString(StandardCharsets.UTF_8);
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   * @throws picocli.CommandLine.ParameterException if the arguments cannot be parsed.
   */
  public boolean init() {
    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(format(
          " Unmatched argument; long-form options (such as --vacuum) need two dashes. %s",
          uae.getMessage()));
      throw uae;
    }

    if (help) {
      logger.info(helpString());
      return false;
    }
    if (version) {
      commandLine.printVersionHelp(System.out);
      return false;
    }
    return true;
  }

  /**
   * Execute this Command.
   *
   * @return The current SlabXCommand.
   */
  public abstract SlabXCommand run();
}
