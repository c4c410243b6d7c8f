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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.tdl.common.exceptions.UndefinedPathException;

/**
 * One node of a feature structure: a conjunction of supertypes,
 * at most one literal leaf, and at most one AVM.
 *
 * A node holding a literal holds no AVM.  A node may instead be the
 * empty-list marker, which holds nothing at all and terminates a list.
 *
 * Coreferenced paths each own their own node; sharing is recorded on
 * the enclosing {@link TypeDefinition}, not in the tree.
 */
public class Conjunction {
  private final List<TypeIdentifier> supertypes =
                                new ArrayList<TypeIdentifier>();
  private Term literal = null;
  private AVM avm = null;
  private boolean emptyList = false;

  /** Coreference tags written directly on this node, e.g. "#x" */
  private final List<String> tags = new ArrayList<String>();

  public Conjunction() {
  }

  /**
   * @return a new node marking a terminated list, as for {@code < >}
   */
  public static Conjunction emptyList() {
    Conjunction result = new Conjunction();
    result.emptyList = true;
    return result;
  }

  public static Conjunction of(TypeIdentifier... types) {
    Conjunction result = new Conjunction();
    for (TypeIdentifier type: types) {
      result.addSupertype(type);
    }
    return result;
  }

  public static Conjunction ofLiteral(Term literal) {
    Conjunction result = new Conjunction();
    result.setLiteral(literal);
    return result;
  }

  public List<TypeIdentifier> getSupertypes() {
    return Collections.unmodifiableList(supertypes);
  }

  public void addSupertype(TypeIdentifier type) {
    checkNotEmptyList();
    supertypes.add(type);
  }

  public Term getLiteral() {
    return literal;
  }

  public boolean hasLiteral() {
    return literal != null;
  }

  public void setLiteral(Term literal) {
    assert(!(literal instanceof TypeIdentifier)) : "Types aren't literals";
    checkNotEmptyList();
    if (avm != null) {
      throw new IllegalStateException("Node with AVM can't hold literal "
                                      + literal);
    }
    this.literal = literal;
  }

  public boolean hasAVM() {
    return avm != null;
  }

  /**
   * @return the AVM, or null if this node has none
   */
  public AVM getAVM() {
    return avm;
  }

  /**
   * @return the AVM, creating an empty one if needed
   */
  public AVM getOrCreateAVM() {
    checkNotEmptyList();
    if (literal != null) {
      throw new IllegalStateException("Node with literal " + literal
                                      + " can't hold AVM");
    }
    if (avm == null) {
      avm = new AVM();
    }
    return avm;
  }

  public boolean isEmptyList() {
    return emptyList;
  }

  /**
   * Turn this node into the empty-list marker.  Tags may already be
   * present; any other constraint may not.
   */
  public void makeEmptyList() {
    if (!supertypes.isEmpty() || literal != null || avm != null) {
      throw new IllegalStateException("Constrained node can't be "
                                      + "an empty list: " + this);
    }
    emptyList = true;
  }

  public List<String> getTags() {
    return Collections.unmodifiableList(tags);
  }

  public void addTag(String tag) {
    if (!tags.contains(tag)) {
      tags.add(tag);
    }
  }

  /**
   * @return true if the node constrains nothing, e.g. a coreference
   *         target or the open end of a diff-list
   */
  public boolean isUnconstrained() {
    return !emptyList && supertypes.isEmpty() && literal == null
        && (avm == null || avm.isEmpty());
  }

  private void checkNotEmptyList() {
    if (emptyList) {
      throw new IllegalStateException("Empty list can't be constrained");
    }
  }

  /**
   * Line used in error messages; overridden by definitions.
   */
  protected int definitionLine() {
    return -1;
  }

  /**
   * Look up the node at a dotted feature path.
   * @param path e.g. "SYNSEM.LOCAL"; case-insensitive
   * @return the node, which may be the empty-list marker
   * @throws UndefinedPathException if some feature on the path is absent
   */
  public Conjunction get(String path) {
    Conjunction result = resolve(path);
    if (result == null) {
      throw new UndefinedPathException(path, definitionLine(),
                                       "Undefined feature path");
    }
    return result;
  }

  /**
   * @return true if a value is defined at the path.  Only feature
   *         names are considered, never supertype names.
   */
  public boolean contains(String path) {
    return resolve(path) != null;
  }

  private Conjunction resolve(String path) {
    List<String> features = Paths.split(path);
    if (features == null) {
      return null;
    }
    Conjunction node = this;
    for (String feature: features) {
      if (node.avm == null) {
        // Literal leaves, empty lists and bare types have no features
        return null;
      }
      node = node.avm.get(feature);
      if (node == null) {
        return null;
      }
    }
    return node;
  }

  /**
   * Assign a value at a dotted path, creating intermediate AVMs.
   * @throws UndefinedPathException if the path runs through a literal
   *          or an empty list
   */
  public void set(String path, Conjunction value) {
    List<String> features = Paths.split(path);
    if (features == null) {
      throw new UndefinedPathException(path, definitionLine(),
                                       "Malformed feature path");
    }
    Conjunction node = this;
    for (int i = 0; i < features.size() - 1; i++) {
      node = node.child(path, features.get(i));
    }
    node.checkCanHoldAVM(path);
    node.getOrCreateAVM().put(features.get(features.size() - 1), value);
  }

  private Conjunction child(String path, String feature) {
    checkCanHoldAVM(path);
    AVM a = getOrCreateAVM();
    Conjunction next = a.get(feature);
    if (next == null) {
      next = new Conjunction();
      a.put(feature, next);
    }
    return next;
  }

  private void checkCanHoldAVM(String path) {
    if (emptyList || literal != null) {
      throw new UndefinedPathException(path, definitionLine(),
          "Feature path runs through " +
          (emptyList ? "an empty list" : "literal " + literal));
    }
  }

  /**
   * Features of this node, depth first, in declaration order.  Descent
   * stops at typed nodes: a sub-AVM with supertypes is reported as a
   * single value.
   */
  public List<Feature> features() {
    List<Feature> result = new ArrayList<Feature>();
    collect("", this, true, result);
    return result;
  }

  /**
   * Like {@link #features()}, but descends through typed nodes too,
   * so every leaf path of the whole tree is reported.  A typed node
   * is reported itself before its features, so the paths of
   * {@link #features()} are always among these.
   */
  public List<Feature> localConstraints() {
    List<Feature> result = new ArrayList<Feature>();
    collect("", this, false, result);
    return result;
  }

  private static void collect(String prefix, Conjunction node,
                    boolean stopAtTypes, List<Feature> out) {
    if (node.avm == null) {
      return;
    }
    for (Map.Entry<String, Conjunction> e: node.avm.entries()) {
      String path = Paths.join(prefix, e.getKey());
      Conjunction val = e.getValue();
      boolean typed = !val.supertypes.isEmpty();
      if (val.avm == null || val.avm.isEmpty() || (typed && stopAtTypes)) {
        out.add(new Feature(path, val));
      } else {
        if (typed) {
          out.add(new Feature(path, val));
        }
        collect(path, val, stopAtTypes, out);
      }
    }
  }

  /** [ ] constrains nothing, so compares like no AVM */
  private AVM constrainingAVM() {
    return avm == null || avm.isEmpty() ? null : avm;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Conjunction))
      return false;
    Conjunction other = (Conjunction)obj;
    if (emptyList != other.emptyList)
      return false;
    if (!supertypes.equals(other.supertypes))
      return false;
    if (literal == null ? other.literal != null
                        : !literal.equals(other.literal))
      return false;
    AVM mine = constrainingAVM(), theirs = other.constrainingAVM();
    if (mine == null ? theirs != null : !mine.equals(theirs))
      return false;
    return tags.equals(other.tags);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = emptyList ? 1 : 0;
    result = prime * result + supertypes.hashCode();
    result = prime * result + (literal == null ? 0 : literal.hashCode());
    AVM mine = constrainingAVM();
    result = prime * result + (mine == null ? 0 : mine.hashCode());
    result = prime * result + tags.hashCode();
    return result;
  }

  @Override
  public String toString() {
    if (emptyList) {
      return "< >";
    }
    List<String> parts = new ArrayList<String>();
    for (String tag: tags) {
      parts.add(tag);
    }
    for (TypeIdentifier type: supertypes) {
      parts.add(type.toString());
    }
    if (literal != null) {
      parts.add(literal.toString());
    }
    if (avm != null) {
      parts.add(avm.toString());
    }
    if (parts.isEmpty()) {
      return "[ ]";
    }
    return String.join(" & ", parts);
  }
}
