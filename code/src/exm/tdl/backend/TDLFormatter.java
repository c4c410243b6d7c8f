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
package exm.tdl.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.tdl.common.lang.AVM;
import exm.tdl.common.lang.Conjunction;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.LexicalRuleDefinition;
import exm.tdl.common.lang.LexicalRuleDefinition.AffixPattern;
import exm.tdl.common.lang.MorphSet;
import exm.tdl.common.lang.Paths;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.TypeIdentifier;

/**
 * Writes the model back out as TDL.
 *
 * Features come out in declaration order.  A sub-AVM holding a single
 * feature and nothing else is folded into a dotted path, so
 * {@code [ A [ B x ] ]} is written {@code [ A.B x ]}.  AVMs parsed from
 * list notation are written as lists again when their shape still
 * allows it, otherwise as plain FIRST/REST or LIST/LAST features.
 */
public class TDLFormatter {

  private final int indentWidth;

  public TDLFormatter(int indentWidth) {
    this.indentWidth = indentWidth;
  }

  public TDLFormatter() {
    this(2);
  }

  public String format(TypeDefinition def) {
    StringBuilder sb = new StringBuilder();
    if (def.getDocstring() != null) {
      sb.append("#|").append(def.getDocstring()).append("|#\n");
    }
    sb.append(def.getIdentifier()).append(' ');
    sb.append(def.getOperator().token());
    if (def instanceof LexicalRuleDefinition) {
      LexicalRuleDefinition rule = (LexicalRuleDefinition)def;
      sb.append(' ').append(rule.getAffixType().keyword());
      for (AffixPattern p: rule.getPatterns()) {
        sb.append(" (").append(p.match).append(' ')
          .append(p.replacement).append(')');
      }
      sb.append('\n').append(indent(1));
    } else {
      sb.append(' ');
    }
    sb.append(conjunction(def, 1));
    sb.append('.');
    return sb.toString();
  }

  /**
   * Format a value as it would appear after a feature name
   */
  public String format(Conjunction value) {
    return conjunction(value, 0);
  }

  /**
   * @return e.g. "%(letter-set (!v aeiou))"
   */
  public String format(MorphSet set) {
    return "%(" + set.macroName() + " (" + set.getVariable() + " " +
           escape(set.getCharacters()) + "))";
  }

  /**
   * @return e.g. ":begin :instance :status lex-entry."
   */
  public String begin(Environment env) {
    StringBuilder sb = new StringBuilder(":begin ");
    sb.append(env.getKind().keyword());
    String status = env.getStatus();
    if (status != null && !status.equals(Environment.DEFAULT_STATUS)) {
      sb.append(" :status ").append(status);
    }
    return sb.append('.').toString();
  }

  /**
   * @return e.g. ":end :type."
   */
  public String end(Environment env) {
    return ":end " + env.getKind().keyword() + ".";
  }

  /**
   * Backslash-escape characters that would otherwise end a character list
   */
  public static String escape(String chars) {
    StringBuilder sb = new StringBuilder(chars.length());
    for (int i = 0; i < chars.length(); i++) {
      char c = chars.charAt(i);
      if (c == ')' || c == '\\' || Character.isWhitespace(c)) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private String conjunction(Conjunction node, int depth) {
    List<String> parts = new ArrayList<String>(node.getTags());
    for (TypeIdentifier type: node.getSupertypes()) {
      parts.add(type.toString());
    }
    if (node.hasLiteral()) {
      parts.add(node.getLiteral().toString());
    }
    if (node.isEmptyList()) {
      parts.add("< >");
    } else if (node.hasAVM() &&
               (!node.getAVM().isEmpty() || parts.isEmpty() ||
                node.getAVM().getKind() != AVM.Kind.PLAIN)) {
      parts.add(avm(node.getAVM(), depth));
    }
    if (parts.isEmpty()) {
      return "[ ]";
    }
    return StringUtils.join(parts, " & ");
  }

  private String avm(AVM avm, int depth) {
    String list = null;
    if (avm.getKind() == AVM.Kind.CONS_LIST) {
      list = consList(avm, depth);
    } else if (avm.getKind() == AVM.Kind.DIFF_LIST) {
      list = diffList(avm, depth);
    }
    if (list != null) {
      return list;
    }

    if (avm.isEmpty()) {
      return "[ ]";
    }
    List<String> pairs = new ArrayList<String>();
    for (Map.Entry<String, Conjunction> e: avm.entries()) {
      String path = e.getKey();
      Conjunction value = e.getValue();
      while (foldable(value)) {
        Map.Entry<String, Conjunction> only =
                        value.getAVM().entries().iterator().next();
        path = Paths.join(path, only.getKey());
        value = only.getValue();
      }
      pairs.add(path + " " + conjunction(value, depth + 1));
    }
    return "[ " + StringUtils.join(pairs, ",\n" + indent(depth)) + " ]";
  }

  /**
   * @return true if node is nothing but an AVM with one feature
   */
  private static boolean foldable(Conjunction node) {
    return node.hasAVM() && node.getAVM().size() == 1 &&
           node.getAVM().getKind() == AVM.Kind.PLAIN &&
           node.getSupertypes().isEmpty() && node.getTags().isEmpty();
  }

  /**
   * @return list notation, or null if the AVM is no longer a list
   */
  private String consList(AVM head, int depth) {
    if (head.isEmpty()) {
      return "< ... >";
    }
    List<String> items = new ArrayList<String>();
    AVM avm = head;
    while (true) {
      Conjunction first = avm.get(Paths.FIRST);
      if (first == null || !onlyFeatures(avm, Paths.FIRST, Paths.REST)) {
        return null;
      }
      items.add(conjunction(first, depth + 1));
      Conjunction rest = avm.get(Paths.REST);
      String written = StringUtils.join(items, ", ");
      if (rest == null) {
        return "< " + written + ", ... >";
      } else if (rest.isEmptyList() && rest.getTags().isEmpty()) {
        return "< " + written + " >";
      } else if (rest.getTags().size() == 1 && rest.isUnconstrained()) {
        return "< " + written + " . " + rest.getTags().get(0) + " >";
      } else if (rest.getTags().isEmpty() && rest.hasAVM() &&
                 !rest.getAVM().isEmpty() &&
                 rest.getSupertypes().isEmpty()) {
        avm = rest.getAVM();
      } else {
        return null;
      }
    }
  }

  private String diffList(AVM avm, int depth) {
    Conjunction list = avm.get(Paths.LIST);
    Conjunction last = avm.get(Paths.LAST);
    if (list == null || last == null ||
        !onlyFeatures(avm, Paths.LIST, Paths.LAST) ||
        !last.isUnconstrained() || !last.getTags().isEmpty()) {
      return null;
    }
    List<String> items = new ArrayList<String>();
    Conjunction node = list;
    while (node.hasAVM() && !node.getAVM().isEmpty()) {
      AVM cell = node.getAVM();
      if (!node.getSupertypes().isEmpty() || !node.getTags().isEmpty() ||
          cell.get(Paths.FIRST) == null || cell.get(Paths.REST) == null ||
          !onlyFeatures(cell, Paths.FIRST, Paths.REST)) {
        return null;
      }
      items.add(conjunction(cell.get(Paths.FIRST), depth + 1));
      node = cell.get(Paths.REST);
    }
    if (!node.isUnconstrained() || !node.getTags().isEmpty()) {
      return null;
    }
    if (items.isEmpty()) {
      return "<! !>";
    }
    return "<! " + StringUtils.join(items, ", ") + " !>";
  }

  private static boolean onlyFeatures(AVM avm, String... allowed) {
    for (String name: avm.featureNames()) {
      boolean ok = false;
      for (String a: allowed) {
        ok = ok || a.equals(name);
      }
      if (!ok) {
        return false;
      }
    }
    return true;
  }

  private String indent(int depth) {
    return StringUtils.repeat(' ', depth * indentWidth);
  }
}
