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

/**
 * A named top-level conjunction, e.g. {@code type := super & [ ATTR val ].}
 */
public class TypeDefinition extends Conjunction {
  private final String identifier;
  private final DefinitionOperator operator;
  private final int line;
  private String docstring;
  private Environment environment = null;
  private final List<Coreference> coreferences = new ArrayList<Coreference>();

  public TypeDefinition(String identifier, DefinitionOperator operator,
                        int line) {
    assert(identifier != null);
    assert(operator != null);
    this.identifier = identifier;
    this.operator = operator;
    this.line = line;
  }

  public TypeDefinition(String identifier) {
    this(identifier, DefinitionOperator.DEFINE, -1);
  }

  public String getIdentifier() {
    return identifier;
  }

  public DefinitionOperator getOperator() {
    return operator;
  }

  /**
   * @return 1-based line where the definition starts, -1 if not parsed
   */
  public int getLine() {
    return line;
  }

  @Override
  protected int definitionLine() {
    return line;
  }

  /**
   * @return text of the block comment before the definition,
   *         without the #| |# delimiters, or null
   */
  public String getDocstring() {
    return docstring;
  }

  public void setDocstring(String docstring) {
    this.docstring = docstring;
  }

  /**
   * @return innermost :begin block around the definition, or null
   */
  public Environment getEnvironment() {
    return environment;
  }

  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  public List<Coreference> getCoreferences() {
    return Collections.unmodifiableList(coreferences);
  }

  public void addCoreference(Coreference coreference) {
    coreferences.add(coreference);
  }

  /**
   * @return the coreference with the given tag, or null
   */
  public Coreference getCoreference(String tag) {
    for (Coreference c: coreferences) {
      if (tag.equals(c.getTag())) {
        return c;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeDefinition) || !super.equals(obj))
      return false;
    TypeDefinition other = (TypeDefinition)obj;
    if (!identifier.equals(other.identifier))
      return false;
    if (docstring == null ? other.docstring != null
                          : !docstring.equals(other.docstring))
      return false;
    return operator == other.operator &&
           coreferences.equals(other.coreferences);
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + identifier.hashCode();
  }

  @Override
  public String toString() {
    return identifier + " " + operator.token() + " " + super.toString();
  }
}
