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
package exm.yang.common;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.yang.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String YANG_LOGGER_NAME = "exm.yang";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getYangLogger() {
    return Logger.getLogger(YANG_LOGGER_NAME);
  }

  /**
   * Attach a single appender to the parser logger.
   * @param logfile file to append to, or empty/null for stderr
   * @param trace if true, log everything down to TRACE level
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger yangLogger = getYangLogger();
    yangLogger.removeAllAppenders();
    yangLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    Appender appender;
    if (StringUtils.isBlank(logfile)) {
      ConsoleAppender console = new ConsoleAppender(layout,
                                      ConsoleAppender.SYSTEM_ERR);
      appender = console;
      yangLogger.setLevel(trace ? Level.TRACE : Level.INFO);
    } else {
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
            + logfile + ": " + e.getMessage());
      }
      yangLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    yangLogger.addAppender(appender);
    return yangLogger;
  }

  /**
   * Set up logging from the {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE} options.
   */
  public static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }
}
