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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.pwk.common.exceptions.InvalidOptionException;

/**
 * General kernel compiler settings
 *
 * Defaults are set here and may be overridden by Java system properties
 * with the same key, see {@link #initPWKProperties()}.
 * */
public class Settings
{
  /* Builder stages that can be switched off, e.g. to inspect unoptimised
   * graphs.  Sum canonicalisation and hash-consing are always on. */
  public static final String OPT_CONSTANT_FOLD = "pwk.opt.constant-fold";
  public static final String OPT_STRENGTH_REDUCE = "pwk.opt.strength-reduce";
  public static final String OPT_FUSE = "pwk.opt.fuse";
  public static final String OPT_CSE = "pwk.opt.cse";

  public static final String LOG_FILE = "pwk.log.file";
  public static final String LOG_TRACE = "pwk.log.trace";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(OPT_CONSTANT_FOLD, "true");
    defaults.setProperty(OPT_STRENGTH_REDUCE, "true");
    defaults.setProperty(OPT_FUSE, "true");
    defaults.setProperty(OPT_CSE, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initPWKProperties() throws InvalidOptionException {
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
   * Drop any value set for key, reverting to the default
   */
  public static void unset(String key) {
    properties.remove(key);
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
    getBoolean(OPT_CONSTANT_FOLD);
    getBoolean(OPT_STRENGTH_REDUCE);
    getBoolean(OPT_FUSE);
    getBoolean(OPT_CSE);
    getBoolean(LOG_TRACE);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
