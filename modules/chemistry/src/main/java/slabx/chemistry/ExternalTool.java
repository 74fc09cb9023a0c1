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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.StopWatch;

/**
 * Runs an external executable with a time limit. Standard output and error are captured in a log
 * file in the working directory.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ExternalTool {

  private static final Logger logger = Logger.getLogger(ExternalTool.class.getName());

  /** Name of the captured output file, relative to the working directory. */
  public static final String LOG_FILE = "tool.log";

  private final Path executable;
  private final long timeoutSeconds;

  /**
   * Constructor for ExternalTool.
   *
   * @param executable the program.
   * @param timeoutSeconds the time limit in seconds.
   */
  public ExternalTool(Path executable, long timeoutSeconds) {
    if (timeoutSeconds < 1) {
      throw new IllegalArgumentException(format(" Invalid timeout %d s.", timeoutSeconds));
    }
    this.executable = executable;
    this.timeoutSeconds = timeoutSeconds;
  }

  public Path getExecutable() {
    return executable;
  }

  public long getTimeoutSeconds() {
    return timeoutSeconds;
  }

  /**
   * Run the program to completion.
   *
   * @param workDir the working directory; created if needed.
   * @param args the arguments.
   * @return the captured output.
   * @throws IOException if the program cannot be started, exceeds the time limit, exits with a
   *     non-zero status or the calling thread is interrupted.
   */
  public String run(Path workDir, String... args) throws IOException {
    if (!Files.isExecutable(executable)) {
      throw new IOException(format(" %s is not an executable file.", executable));
    }
    Files.createDirectories(workDir);
    Path logFile = workDir.resolve(LOG_FILE);

    List<String> command = new ArrayList<>();
    command.add(executable.toString());
    command.addAll(List.of(args));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Running: %s (in %s)", StringUtils.join(command, " "), workDir));
    }

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.directory(workDir.toFile());
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    StopWatch stopWatch = StopWatch.createStarted();
    Process process = pb.start();
    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(format(" %s did not finish within %d s.", executable.getFileName(),
            timeoutSeconds));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException(format(" Interrupted while waiting for %s.",
          executable.getFileName()), e);
    }
    stopWatch.stop();

    String output = Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8) : "";
    int exitValue = process.exitValue();
    if (exitValue != 0) {
      throw new IOException(format(" %s exited with status %d:\n%s", executable.getFileName(),
          exitValue, StringUtils.abbreviate(output.trim(), 2000)));
    }
    logger.info(format(" %s finished in %6.3f s.", executable.getFileName(),
        stopWatch.getTime() / 1000.0));
    return output;
  }
}
