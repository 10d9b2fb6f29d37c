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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.yang.common.exceptions.InvalidOptionException;

/**
 * General parser settings.
 *
 * Defaults are set here and may be overridden by Java system properties
 * of the same name through {@link #initProperties()}.
 * */
public class Settings
{
  public static final String LOG_FILE = "yang.log.file";
  public static final String LOG_TRACE = "yang.log.trace";

  /** Columns a tab advances when re-indenting multi-line strings */
  public static final String TAB_WIDTH = "yang.lexer.tab-width";

  /** Name reported in source positions for error messages */
  public static final String INPUT_NAME = "yang.input-name";

  /** Deepest nesting of statement blocks accepted by the parser */
  public static final String MAX_DEPTH = "yang.parser.max-depth";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    // RFC 7950 section 6.1.3
    defaults.setProperty(TAB_WIDTH, "8");
    defaults.setProperty(INPUT_NAME, "<input>");
    defaults.setProperty(MAX_DEPTH, "1000");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, going back to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getTabWidth();
    getMaxDepth();
  }

  public static int getTabWidth() throws InvalidOptionException {
    int width = getInt(TAB_WIDTH);
    if (width <= 0) {
      throw new InvalidOptionException("option " + TAB_WIDTH +
                      " must be a positive number of columns, but was " + width);
    }
    return width;
  }

  public static int getMaxDepth() throws InvalidOptionException {
    int depth = getInt(MAX_DEPTH);
    if (depth <= 0) {
      throw new InvalidOptionException("option " + MAX_DEPTH +
                      " must be a positive nesting depth, but was " + depth);
    }
    return depth;
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = getRequired(key);
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("option " + key +
                          " must be an integer, but was '" + strVal + "'");
    }
  }

  /**
   * Case-insensitive true or false
   */
  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = getRequired(key).trim();
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    }
    throw new InvalidOptionException("option " + key +
                  " must be true or false, but was '" + strVal + "'");
  }

  private static String getRequired(String key)
      throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    return strVal;
  }
}
