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

package exm.tdl.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.tdl.common.exceptions.InvalidOptionException;

/**
 * General TDL tool settings.
 *
 * Only the command line layer reads these; the parser itself is
 * configured through its own API so that independent parses share
 * no state.
 * */
public class Settings {
  public static final String LOG_FILE = "tdl.log.file";
  public static final String LOG_TRACE = "tdl.log.trace";

  public static final String INPUT_ENCODING = "tdl.input.encoding";

  /** Skip statements with syntax errors instead of stopping */
  public static final String PARSE_RECOVER = "tdl.parse.recover";
  /** Treat a coreference tag used only once as an error */
  public static final String PARSE_STRICT_COREFS =
                                  "tdl.parse.strict-coreferences";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(INPUT_ENCODING, "UTF-8");
    defaults.setProperty(PARSE_RECOVER, "false");
    defaults.setProperty(PARSE_STRICT_COREFS, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initTDLProperties() throws InvalidOptionException {
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

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PARSE_RECOVER);
    getBoolean(PARSE_STRICT_COREFS);
    if (get(INPUT_ENCODING).trim().length() == 0) {
      throw new InvalidOptionException("Empty value for " + INPUT_ENCODING);
    }
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Unknown setting " + key);
    }
    value = value.trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for " + key
                                        + ": \"" + value + "\"");
    }
  }
}
