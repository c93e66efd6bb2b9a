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
package exm.tlang.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import exm.tlang.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String TLANG_LOGGER_NAME = "exm.tlang";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final SetMultimap<Level, String> emitted =
       HashMultimap.create();

  /** File appender added by the last setupLogging call, if any */
  private static FileAppender fileAppender = null;

  public static Logger getTLangLogger()
  {
    return Logger.getLogger(TLANG_LOGGER_NAME);
  }

  /**
   * Send project log output to a file, if one is given.  Any file set up
   * by an earlier call is detached first, and without a file the log4j
   * configuration from the classpath applies.
   * @param logfile file path, or null/empty for no file logging
   * @param trace if true, log at TRACE rather than DEBUG level
   * @return the project logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static synchronized Logger setupLogging(String logfile,
                                                boolean trace)
      throws InvalidOptionException
  {
    Logger tlangLogger = getTLangLogger();
    if (fileAppender != null) {
      tlangLogger.removeAppender(fileAppender);
      fileAppender.close();
      fileAppender = null;
      // Inherit level from root again
      tlangLogger.setLevel(null);
    }
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(LOG_PATTERN);
      try {
        fileAppender = new FileAppender(layout, logfile, false);
        tlangLogger.addAppender(fileAppender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \""
                                  + logfile + "\": " + e.getMessage());
      }
      tlangLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return tlangLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.put(level, msg);
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getTLangLogger().warn(msg);
    else
      getTLangLogger().debug("Duplicate Warning: " + msg);
  }
}
