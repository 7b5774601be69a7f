/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.pwk.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.pwk.common.exceptions.InvalidOptionException;
import exm.pwk.common.exceptions.PWKRuntimeError;

public class Logging {
  private static final String PWK_LOGGER_NAME = "exm.pwk";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getPWKLogger() {
    return Logger.getLogger(PWK_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  Warnings always go to stderr.
   * @param logfile if non-empty, also log to this file
   * @param trace log at trace level to the file instead of debug
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger pwkLogger = getPWKLogger();
    pwkLogger.removeAllAppenders();
    pwkLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
        new PatternLayout(LOG_PATTERN), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    pwkLogger.addAppender(console);

    if (StringUtils.isBlank(logfile)) {
      pwkLogger.setLevel(Level.WARN);
      return pwkLogger;
    }

    try {
      FileAppender file = new FileAppender(new PatternLayout(LOG_PATTERN),
                                           logfile, false);
      pwkLogger.addAppender(file);
    } catch (IOException e) {
      throw new PWKRuntimeError("Could not open log file " + logfile + ": "
                                + e.getMessage());
    }
    pwkLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return pwkLogger;
  }

  /**
   * Configure logging from the pwk.log.file and pwk.log.trace settings
   */
  public static Logger setupLoggingFromSettings()
      throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getPWKLogger().warn(msg);
    } else {
      getPWKLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
