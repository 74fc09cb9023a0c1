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
package slabx;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;
import org.apache.commons.lang3.time.StopWatch;
import slabx.commands.Generate;

/**
 * The main entry point for Slab X.
 * <p>
 * Usage: slabx [-D&lt;property=value&gt;] Generate [options] h k l
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /** Exit code for unreadable input or unwritable output. */
  public static final int IO_ERROR = 1;
  /** Exit code for invalid command line arguments or configuration values. */
  public static final int USAGE_ERROR = 2;

  private static final String BORDER =
      " ______________________________________________________________________________";

  private Main() {
  }

  /**
   * Run Slab X and exit with its status code.
   *
   * @param args the command line arguments.
   */
  public static void main(String[] args) {
    int status = run(args);
    System.exit(status);
  }

  /**
   * Run Slab X.
   *
   * @param args the command line arguments.
   * @return the process exit code.
   */
  public static int run(String[] args) {
    StopWatch stopWatch = StopWatch.createStarted();
    // Process any "-D" command line flags.
    args = processProperties(args);

    // Configure our logging.
    startLogging();
    header();

    if (args.length == 0) {
      commandLineInterfaceHelp();
      return USAGE_ERROR;
    }
    String command = args[0];
    String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
    if (command.equals("-h") || command.equals("--help")) {
      commandLineInterfaceHelp();
      return 0;
    }
    if (!command.toLowerCase(Locale.ROOT).equals("generate")) {
      logger.warning(format(" Unknown command %s.", command));
      commandLineInterfaceHelp();
      return USAGE_ERROR;
    }

    int status = new Generate(commandArgs).run().getExitCode();
    stopWatch.stop();
    logger.info(format("\n Total time: %6.3f (sec)", stopWatch.getTime() / 1000.0));
    return status;
  }

  private static void commandLineInterfaceHelp() {
    logger.info(" usage: slabx [-D<property=value>] Generate [-options] h k l");
    logger.info(" For help on the command use:  slabx Generate -h\n");
  }

  private static void header() {
    StringBuilder sb = new StringBuilder();
    sb.append(BORDER).append("\n");
    sb.append("\n                                   SLAB X\n");
    sb.append("\n      Surface slab generation for periodic crystals, molecular crystals\n");
    sb.append("                      and metal-organic frameworks.\n");
    sb.append(BORDER).append("\n");
    logger.info(sb.toString());
  }

  /**
   * Set "-Dkey=value" arguments as system properties.
   *
   * @param args the command line arguments.
   * @return the remaining arguments.
   */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          System.setProperty(key, value);
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger slabxLogger = Logger.getLogger("slabx");
    // Remove any existing handlers.
    for (Handler handler : slabxLogger.getHandlers()) {
      slabxLogger.removeHandler(handler);
    }

    // Retrieve the log level from the slabx.log system property.
    String logLevel = System.getProperty("slabx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (Exception e) {
      level = Level.INFO;
    }
    boolean debug = Boolean.parseBoolean(System.getProperty("slabx.debug", "false"));

    StreamHandler stdout = new StreamHandler(System.out, new LogFormatter(debug)) {
      @Override
      public synchronized void publish(LogRecord record) {
        super.publish(record);
        flush();
      }
    };
    stdout.setLevel(level);
    slabxLogger.addHandler(stdout);
    slabxLogger.setLevel(level);
    slabxLogger.setUseParentHandlers(false);
  }
}
