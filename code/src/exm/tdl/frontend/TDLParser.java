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

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.exceptions.TDLRuntimeError;
import exm.tdl.common.exceptions.UserException;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.MorphSet;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.WildCard;

/**
 * Reads type definitions from TDL text, one per call to {@link #next()}.
 *
 * Letter-set and wild-card macros are collected on the way and can be
 * looked up by variable.  Comments are consumed; a block comment right
 * before a definition becomes its docstring.  Each definition records
 * the :begin block it appears in.
 *
 * Parsers share no state, so separate inputs can be read on separate
 * threads.  One parser must not be used from two threads.
 */
public class TDLParser {

  private final String source;
  private final StatementLexer lexer;
  private final MorphSetParser morphSetParser;
  private final EnvironmentParser environmentParser;
  private final Logger logger = Logging.getTDLLogger();

  private boolean recover = false;
  private boolean strictCoreferences = false;

  private final Map<String, LetterSet> letterSets =
                          new LinkedHashMap<String, LetterSet>();
  private final Map<String, WildCard> wildCards =
                          new LinkedHashMap<String, WildCard>();
  private final List<InvalidSyntaxException> errors =
                          new ArrayList<InvalidSyntaxException>();

  /** Innermost open :begin block */
  private Environment environment = null;

  /** Created on first use, once options are settled */
  private ConjunctionParser conjunctionParser = null;

  public TDLParser(CharSequence text, String source) {
    this.source = source;
    this.lexer = new StatementLexer(new Tokenizer(text, source));
    this.morphSetParser = new MorphSetParser(source);
    this.environmentParser = new EnvironmentParser(source);
  }

  public static TDLParser fromString(CharSequence text, String source) {
    return new TDLParser(text, source);
  }

  public static TDLParser fromString(CharSequence text) {
    return new TDLParser(text, null);
  }

  public static TDLParser fromFile(File file, Charset charset)
      throws IOException {
    String text = FileUtils.readFileToString(file, charset);
    return new TDLParser(text, file.getPath());
  }

  public String getSource() {
    return source;
  }

  /**
   * Skip definitions with syntax errors instead of failing.  Skipped
   * errors are logged and kept in {@link #getErrors()}.  Lexical errors
   * are never skipped.
   */
  public TDLParser setRecover(boolean recover) {
    this.recover = recover;
    return this;
  }

  /**
   * Treat a coreference tag that occurs only once as a syntax error
   */
  public TDLParser setStrictCoreferences(boolean strict) {
    this.strictCoreferences = strict;
    this.conjunctionParser = null;
    return this;
  }

  /**
   * @return next type definition in source order, or null at end of input
   * @throws UserException
   */
  public TypeDefinition next() throws UserException {
    while (true) {
      try {
        Statement statement = lexer.next();
        if (statement == null) {
          if (environment != null) {
            logger.warn(sourceName() + ": block " + environment +
                        " at line " + environment.getLine() +
                        " not closed at end of input");
            environment = null;
          }
          return null;
        }
        switch (statement.getKind()) {
          case TYPEDEF:
            TypeDefinition def = definitionParser().parse(statement);
            def.setEnvironment(environment);
            return def;
          case LETTERSET:
            addMorphSet(morphSetParser.parse(statement));
            break;
          case ENVIRONMENT:
            environment = environmentParser.parse(statement, environment);
            logger.debug("line " + statement.getLine() + ": now in " +
                (environment == null ? "top level" : environment.toString()));
            break;
          default:
            logger.trace("skipping " + statement.getKind() + " at line " +
                         statement.getLine());
        }
      } catch (InvalidSyntaxException e) {
        if (!recover) {
          throw e;
        }
        logger.error(e.getMessage());
        errors.add(e);
      }
    }
  }

  private String sourceName() {
    return source == null ? "<input>" : source;
  }

  /**
   * @return innermost :begin block open at the current position, or null
   */
  public Environment getEnvironment() {
    return environment;
  }

  private ConjunctionParser definitionParser() {
    if (conjunctionParser == null) {
      conjunctionParser = new ConjunctionParser(source, strictCoreferences);
    }
    return conjunctionParser;
  }

  private void addMorphSet(MorphSet set) {
    logger.debug("defined " + set);
    if (set instanceof LetterSet) {
      letterSets.put(set.getVariable(), (LetterSet)set);
    } else if (set instanceof WildCard) {
      wildCards.put(set.getVariable(), (WildCard)set);
    } else {
      throw new TDLRuntimeError("Unexpected macro: " + set);
    }
  }

  /**
   * Read all remaining definitions
   */
  public List<TypeDefinition> parseAll() throws UserException {
    List<TypeDefinition> result = new ArrayList<TypeDefinition>();
    TypeDefinition def;
    while ((def = next()) != null) {
      result.add(def);
    }
    return result;
  }

  /**
   * @return letter sets read so far, by variable, e.g. "!v"
   */
  public Map<String, LetterSet> getLetterSets() {
    return Collections.unmodifiableMap(letterSets);
  }

  /**
   * @return wild cards read so far, by variable, e.g. "?v"
   */
  public Map<String, WildCard> getWildCards() {
    return Collections.unmodifiableMap(wildCards);
  }

  /**
   * @return syntax errors skipped in recovery mode
   */
  public List<InvalidSyntaxException> getErrors() {
    return Collections.unmodifiableList(errors);
  }
}
