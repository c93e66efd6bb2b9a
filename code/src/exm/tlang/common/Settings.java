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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.tlang.common.exceptions.InvalidOptionException;

/**
 * General interpreter settings
 *
 * Each key can be overridden with a Java system property of the same
 * name, e.g. -Dtlang.max-call-depth=200, and some from the command line.
 * */
public class Settings
{
  public static final String LOG_FILE = "tlang.log.file";
  public static final String LOG_TRACE = "tlang.log.trace";

  /** Max nesting of active function calls before RecursionError */
  public static final String MAX_CALL_DEPTH = "tlang.max-call-depth";
  /** Max bytes of print output per run */
  public static final String MAX_OUTPUT_BYTES = "tlang.max-output-bytes";
  /** Wall-clock limit for runs submitted to ExecutionService */
  public static final String TIMEOUT_MS = "tlang.timeout-ms";
  /** Stack size for ExecutionService worker threads */
  public static final String THREAD_STACK_SIZE = "tlang.thread-stack-size";

  private static final Properties defaults;

  /** Current settings, layered over defaults */
  private static volatile Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(MAX_CALL_DEPTH, "1000");
    defaults.setProperty(MAX_OUTPUT_BYTES, "1048576");
    defaults.setProperty(TIMEOUT_MS, "10000");
    defaults.setProperty(THREAD_STACK_SIZE, "67108864");
    properties = new Properties(defaults);
  }

  /**
     Start again from the defaults, then overwrite each with the value
     from System if set.  Values from earlier set() calls are discarded.
   */
  public static void initTLangProperties() throws InvalidOptionException {
    Properties fresh = new Properties(defaults);
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        fresh.setProperty(key, sysVal);
      }
    }
    properties = fresh;
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    checkPositive(MAX_CALL_DEPTH, getInt(MAX_CALL_DEPTH));
    checkPositive(MAX_OUTPUT_BYTES, getLong(MAX_OUTPUT_BYTES));
    checkPositive(TIMEOUT_MS, getLong(TIMEOUT_MS));
    checkPositive(THREAD_STACK_SIZE, getLong(THREAD_STACK_SIZE));
  }

  private static void checkPositive(String key, long val)
                                        throws InvalidOptionException {
    if (val <= 0) {
      throw new InvalidOptionException("Expected property " + key +
                                " to be positive but was " + val);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
