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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Attribute-value matrix: canonical (upper case) feature name to value,
 * kept in declaration order.
 */
public class AVM {

  /**
   * Notation the AVM was written in.  Lists are stored as ordinary
   * FIRST/REST and LIST/LAST features; this only records how to write
   * them back out.
   */
  public static enum Kind {
    PLAIN,
    CONS_LIST,
    DIFF_LIST,
  }

  private final Map<String, Conjunction> features =
                          new LinkedHashMap<String, Conjunction>();
  private Kind kind;

  public AVM() {
    this(Kind.PLAIN);
  }

  public AVM(Kind kind) {
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public void setKind(Kind kind) {
    this.kind = kind;
  }

  public Conjunction get(String feature) {
    return features.get(Paths.canonicalize(feature));
  }

  public void put(String feature, Conjunction value) {
    assert(value != null);
    features.put(Paths.canonicalize(feature), value);
  }

  public Conjunction remove(String feature) {
    return features.remove(Paths.canonicalize(feature));
  }

  public boolean containsFeature(String feature) {
    return features.containsKey(Paths.canonicalize(feature));
  }

  public Set<String> featureNames() {
    return Collections.unmodifiableSet(features.keySet());
  }

  public Set<Map.Entry<String, Conjunction>> entries() {
    return Collections.unmodifiableMap(features).entrySet();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public int size() {
    return features.size();
  }

  /** Equality ignores declaration order and notation */
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof AVM))
      return false;
    return features.equals(((AVM)obj).features);
  }

  @Override
  public int hashCode() {
    return features.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[ ");
    boolean first = true;
    for (Map.Entry<String, Conjunction> e: features.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(e.getKey()).append(' ').append(e.getValue());
    }
    sb.append(first ? "]" : " ]");
    return sb.toString();
  }
}
