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
package exm.tdl.frontend;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.lang.AVM;
import exm.tdl.common.lang.Conjunction;
import exm.tdl.common.lang.Coreference;
import exm.tdl.common.lang.DefinitionOperator;
import exm.tdl.common.lang.IntegerLiteral;
import exm.tdl.common.lang.LexicalRuleDefinition;
import exm.tdl.common.lang.LexicalRuleDefinition.AffixPattern;
import exm.tdl.common.lang.LexicalRuleDefinition.AffixType;
import exm.tdl.common.lang.Paths;
import exm.tdl.common.lang.Regex;
import exm.tdl.common.lang.StringLiteral;
import exm.tdl.common.lang.Term;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.TypeIdentifier;

/**
 * Builds a {@link TypeDefinition} from the tokens of one TYPEDEF
 * statement.
 *
 * Values are written straight into the node at their full path, so
 * list sugar and dotted feature names never survive parsing.  Nodes
 * reached more than once (e.g. {@code [A.B x] & [A.C y]}) accumulate
 * constraints.
 *
 * One instance parses one statement at a time.
 */
public class ConjunctionParser {

  private final String source;
  private final boolean strictCoreferences;
  private final Logger logger = Logging.getTDLLogger();

  /* State for the statement being parsed */
  private TokenCursor cursor;
  private ListMultimap<String, String> namedTags;
  private List<Coreference> anonymous;

  public ConjunctionParser(String source, boolean strictCoreferences) {
    this.source = source;
    this.strictCoreferences = strictCoreferences;
  }

  public ConjunctionParser() {
    this(null, false);
  }

  /**
   * Parse one type definition.  Either the whole definition is
   * returned or an exception is thrown; no partial tree escapes.
   * @param statement a TYPEDEF statement
   * @throws InvalidSyntaxException
   */
  public TypeDefinition parse(Statement statement)
      throws InvalidSyntaxException {
    assert(statement.getKind() == StatementKind.TYPEDEF) : statement;
    cursor = new TokenCursor(statement, source);
    namedTags = LinkedListMultimap.create();
    anonymous = new ArrayList<Coreference>();
    try {
      TypeDefinition def = definition(statement.getLine());
      def.setDocstring(statement.getDocstring());
      addCoreferences(def);
      if (logger.isDebugEnabled()) {
        logger.debug("parsed " + def.getIdentifier() + " at line " +
                     def.getLine());
      }
      return def;
    } finally {
      cursor = null;
      namedTags = null;
      anonymous = null;
    }
  }

  private TypeDefinition definition(int line) throws InvalidSyntaxException {
    Token id = cursor.next();
    if (id.kind != TokenKind.ATOM && id.kind != TokenKind.NUMBER) {
      throw cursor.error("Expected type identifier at start of " +
                         "definition but found '" + id.text + "'");
    }
    Token opTok = cursor.next();
    DefinitionOperator op = opTok.kind == TokenKind.PUNCTUATION ?
                    DefinitionOperator.fromToken(opTok.text) : null;
    if (op == null) {
      throw cursor.error("Expected :=, :+ or :< after " + id.text +
                         " but found '" + opTok.text + "'");
    }
    if (op == DefinitionOperator.SUBTYPE) {
      logger.warn(location() + "subtype operator :< in definition of " +
                  id.text);
    }

    TypeDefinition def;
    AffixType affixType = affixType(cursor.peek());
    if (affixType != null) {
      cursor.next();
      List<AffixPattern> patterns = affixPatterns();
      def = new LexicalRuleDefinition(id.text, op, line, affixType, patterns);
    } else {
      def = new TypeDefinition(id.text, op, line);
    }

    conjunction(def, "");
    if (op != DefinitionOperator.ADDENDUM && def.getSupertypes().isEmpty()) {
      throw cursor.error("No supertypes defined on " + id.text);
    }
    cursor.expect(".");
    if (!cursor.atEnd()) {
      throw cursor.unexpected("end of definition");
    }
    return def;
  }

  private static AffixType affixType(Token tok) {
    if (tok == null || tok.kind != TokenKind.ATOM) {
      return null;
    }
    return AffixType.fromKeyword(tok.text.toLowerCase());
  }

  /**
   * One or more groups like (y ies) or (!c !cs)
   */
  private List<AffixPattern> affixPatterns() throws InvalidSyntaxException {
    List<AffixPattern> patterns = new ArrayList<AffixPattern>();
    do {
      cursor.expect("(");
      String match = patternWord();
      String replacement = patternWord();
      cursor.expect(")");
      patterns.add(new AffixPattern(match, replacement));
    } while (cursor.peekIs("("));
    return patterns;
  }

  /**
   * A pattern word is a run of tokens written without whitespace,
   * e.g. "!c" followed directly by "s".
   */
  private String patternWord() throws InvalidSyntaxException {
    Token tok = cursor.peek();
    if (tok == null || tok.is(")") || tok.is("(")) {
      throw cursor.unexpected("affix pattern");
    }
    StringBuilder sb = new StringBuilder();
    Token prev = cursor.next();
    sb.append(prev.text);
    while (prev.adjoins(cursor.peek()) && !cursor.peekIs(")")) {
      prev = cursor.next();
      sb.append(prev.text);
    }
    return sb.toString();
  }

  /**
   * Parse terms separated by '&' into target
   * @param path full path of target, "" for the definition itself
   */
  private void conjunction(Conjunction target, String path)
      throws InvalidSyntaxException {
    term(target, path);
    while (cursor.accept("&")) {
      term(target, path);
    }
  }

  private void term(Conjunction target, String path)
      throws InvalidSyntaxException {
    Token tok = cursor.peek();
    if (tok == null) {
      throw cursor.unexpected("a value");
    }
    switch (tok.kind) {
      case ATOM:
        cursor.next();
        addSupertype(target, path, new TypeIdentifier(tok.text));
        break;
      case SINGLE_QUOTED:
        cursor.next();
        logger.warn(location() + "single-quoted symbol " + tok.text +
                    " read as a type");
        addSupertype(target, path,
                     new TypeIdentifier(tok.text.substring(1)));
        break;
      case REGEX:
        cursor.next();
        addSupertype(target, path,
                     new Regex(tok.text.substring(1, tok.text.length() - 1)));
        break;
      case DOUBLE_QUOTED:
        cursor.next();
        setLiteral(target, path, new StringLiteral(
                          tok.text.substring(1, tok.text.length() - 1)));
        break;
      case NUMBER:
        cursor.next();
        setLiteral(target, path, integer(tok));
        break;
      case COREFERENCE:
        cursor.next();
        coreference(target, path, tok.text);
        break;
      case PUNCTUATION:
        if (tok.is("[")) {
          avm(target, path);
        } else if (tok.is("<")) {
          consList(target, path);
        } else if (tok.is("<!")) {
          diffList(target, path);
        } else {
          throw cursor.unexpected("a type, literal, AVM, list or " +
                                  "coreference");
        }
        break;
      default:
        throw cursor.unexpected("a value");
    }
  }

  private IntegerLiteral integer(Token tok) throws InvalidSyntaxException {
    String digits = tok.text.startsWith("+") ? tok.text.substring(1)
                                              : tok.text;
    try {
      return new IntegerLiteral(tok.text, Long.parseLong(digits));
    } catch (NumberFormatException e) {
      throw cursor.error("Integer out of range: " + tok.text);
    }
  }

  private void addSupertype(Conjunction target, String path,
                            TypeIdentifier type) throws InvalidSyntaxException {
    if (target.isEmptyList()) {
      throw cursor.error("Type " + type + " conjoined with empty list at " +
                         describe(path));
    }
    target.addSupertype(type);
  }

  private void setLiteral(Conjunction target, String path, Term literal)
      throws InvalidSyntaxException {
    if (target.isEmptyList()) {
      throw cursor.error("Literal " + literal + " conjoined with empty " +
                         "list at " + describe(path));
    } else if (target.hasAVM()) {
      throw cursor.error("Literal " + literal + " conjoined with AVM at " +
                         describe(path));
    } else if (target.hasLiteral() && !target.getLiteral().equals(literal)) {
      throw cursor.error("Conflicting literals " + target.getLiteral() +
                         " and " + literal + " at " + describe(path));
    }
    target.setLiteral(literal);
  }

  private void coreference(Conjunction target, String path, String tag)
      throws InvalidSyntaxException {
    if (path.isEmpty()) {
      throw cursor.error("Coreference " + tag + " on whole definition");
    }
    if (!namedTags.containsEntry(tag, path)) {
      namedTags.put(tag, path);
    }
    target.addTag(tag);
  }

  /**
   * [ FEAT value, FEAT.FEAT value, ... ]
   */
  private void avm(Conjunction target, String path)
      throws InvalidSyntaxException {
    cursor.expect("[");
    checkCanHoldAVM(target, path);
    target.getOrCreateAVM();
    if (cursor.accept("]")) {
      return;
    }
    Set<String> written = new HashSet<String>();
    do {
      List<String> features = featurePath();
      String relative = String.join(".", features);
      if (!written.add(relative)) {
        throw cursor.error("Duplicate feature " + relative + " at " +
                           describe(path));
      }
      Conjunction node = target;
      String nodePath = path;
      for (String feature: features) {
        node = child(node, nodePath, feature);
        nodePath = Paths.join(nodePath, feature);
      }
      conjunction(node, nodePath);
    } while (cursor.accept(","));
    cursor.expect("]");
  }

  /**
   * @return canonical feature names of a possibly dotted feature path
   */
  private List<String> featurePath() throws InvalidSyntaxException {
    List<String> features = new ArrayList<String>();
    do {
      Token tok = cursor.peek();
      if (tok == null || tok.kind != TokenKind.ATOM) {
        throw cursor.unexpected("feature name");
      }
      cursor.next();
      features.add(Paths.canonicalize(tok.text));
    } while (cursor.accept("."));
    return features;
  }

  /**
   * < >, < ... >, < a, b >, < a, ... >, < a . #rest >
   */
  private void consList(Conjunction target, String path)
      throws InvalidSyntaxException {
    cursor.expect("<");
    if (cursor.accept(">")) {
      makeEmptyList(target, path);
      return;
    }
    checkCanHoldAVM(target, path);
    target.getOrCreateAVM().setKind(AVM.Kind.CONS_LIST);
    if (cursor.accept("...")) {
      cursor.expect(">");
      return;
    }

    Conjunction node = target;
    String nodePath = path;
    while (true) {
      conjunction(child(node, nodePath, Paths.FIRST),
                  Paths.join(nodePath, Paths.FIRST));
      String restPath = Paths.join(nodePath, Paths.REST);
      if (cursor.accept(",")) {
        if (cursor.accept("...")) {
          // Open list: no REST
          cursor.expect(">");
          return;
        }
        node = child(node, nodePath, Paths.REST);
        nodePath = restPath;
      } else if (cursor.accept(".")) {
        Token tag = cursor.peek();
        if (tag == null || tag.kind != TokenKind.COREFERENCE) {
          throw cursor.error("List tail after '.' must be a coreference");
        }
        cursor.next();
        coreference(child(node, nodePath, Paths.REST), restPath, tag.text);
        cursor.expect(">");
        return;
      } else if (cursor.accept(">")) {
        makeEmptyList(child(node, nodePath, Paths.REST), restPath);
        return;
      } else {
        throw cursor.unexpected("',', '.' or '>' in list");
      }
    }
  }

  /**
   * <! !>, <! a, b !>.  The end of the list is coreferenced with LAST.
   */
  private void diffList(Conjunction target, String path)
      throws InvalidSyntaxException {
    cursor.expect("<!");
    checkCanHoldAVM(target, path);
    target.getOrCreateAVM().setKind(AVM.Kind.DIFF_LIST);

    Conjunction node = child(target, path, Paths.LIST);
    String nodePath = Paths.join(path, Paths.LIST);
    if (!cursor.accept("!>")) {
      while (true) {
        conjunction(child(node, nodePath, Paths.FIRST),
                    Paths.join(nodePath, Paths.FIRST));
        node = child(node, nodePath, Paths.REST);
        nodePath = Paths.join(nodePath, Paths.REST);
        if (cursor.accept("!>")) {
          break;
        } else if (!cursor.accept(",")) {
          throw cursor.unexpected("',' or '!>' in diff-list");
        }
      }
    }
    String lastPath = Paths.join(path, Paths.LAST);
    child(target, path, Paths.LAST);
    Coreference end = new Coreference(null);
    end.addPath(nodePath);
    end.addPath(lastPath);
    anonymous.add(end);
  }

  /**
   * @return node for feature under parent, created if missing
   */
  private Conjunction child(Conjunction parent, String path, String feature)
      throws InvalidSyntaxException {
    checkCanHoldAVM(parent, path);
    AVM avm = parent.getOrCreateAVM();
    Conjunction node = avm.get(feature);
    if (node == null) {
      node = new Conjunction();
      avm.put(feature, node);
    }
    return node;
  }

  private void makeEmptyList(Conjunction node, String path)
      throws InvalidSyntaxException {
    if (node.isEmptyList()) {
      return;
    }
    if (node.hasAVM() || node.hasLiteral() ||
        !node.getSupertypes().isEmpty()) {
      throw cursor.error("Empty list conjoined with other constraints " +
                         "at " + describe(path));
    }
    node.makeEmptyList();
  }

  private void checkCanHoldAVM(Conjunction node, String path)
      throws InvalidSyntaxException {
    if (node.hasLiteral()) {
      throw cursor.error("Features conjoined with literal " +
                         node.getLiteral() + " at " + describe(path));
    } else if (node.isEmptyList()) {
      throw cursor.error("Features conjoined with empty list at " +
                         describe(path));
    }
  }

  private void addCoreferences(TypeDefinition def)
      throws InvalidSyntaxException {
    for (String tag: namedTags.keySet()) {
      List<String> paths = namedTags.get(tag);
      Coreference c = new Coreference(tag, paths);
      if (!c.isComplete()) {
        String msg = "Coreference " + tag + " occurs only at " + paths.get(0);
        if (strictCoreferences) {
          throw cursor.error(msg);
        }
        logger.warn(location() + msg + " in " + def.getIdentifier());
      }
      def.addCoreference(c);
    }
    for (Coreference c: anonymous) {
      def.addCoreference(c);
    }
  }

  private String location() {
    return (source == null ? "<input>" : source) + ":" + cursor.line() + ": ";
  }

  private static String describe(String path) {
    return path.isEmpty() ? "top level" : path;
  }
}
