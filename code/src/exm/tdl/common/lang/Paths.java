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
package exm.tdl.common.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Feature names and helpers for dotted feature paths.
 * Feature names are case-insensitive and stored upper case.
 */
public class Paths {
  /** feature for list items */
  public static final String FIRST = "FIRST";
  /** feature for list tails */
  public static final String REST = "REST";
  /** feature for the list of a diff-list */
  public static final String LIST = "LIST";
  /** feature for the last position of a diff-list */
  public static final String LAST = "LAST";

  /**
   * Split a dotted path into canonical feature names
   * @param path e.g. "synsem.LOCAL.cat"
   * @return e.g. [SYNSEM, LOCAL, CAT], or null if some component is empty
   */
  public static List<String> split(String path) {
    List<String> result = new ArrayList<String>();
    int start = 0;
    while (true) {
      int dot = path.indexOf('.', start);
      String component = dot < 0 ? path.substring(start)
                                 : path.substring(start, dot);
      if (component.isEmpty()) {
        return null;
      }
      result.add(canonicalize(component));
      if (dot < 0) {
        return result;
      }
      start = dot + 1;
    }
  }

  public static String canonicalize(String feature) {
    return feature.toUpperCase();
  }

  public static String join(String prefix, String feature) {
    if (prefix == null || prefix.isEmpty()) {
      return feature;
    }
    return prefix + "." + feature;
  }
}
