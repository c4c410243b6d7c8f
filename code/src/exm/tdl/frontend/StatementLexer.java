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
import java.util.List;

import org.apache.log4j.Logger;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.exceptions.LexicalException;
import exm.tdl.common.exceptions.UserException;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.WildCard;

/**
 * Groups tokens into top-level statements.
 *
 * A definition runs until a '.' outside of any brackets.  A letter-set
 * or wild-card macro runs until its outer parenthesis closes; a '.'
 * right after it is taken as part of it, and its character list is read
 * as raw text.  Environment markers such as ":begin :type." run until
 * a '.' like definitions do.  Comments between statements
 * are statements of their own; comments inside a statement are
 * dropped.
 */
public class StatementLexer {
  private final Tokenizer tokenizer;
  private final Logger logger = Logging.getTDLLogger();

  /** One token of lookahead */
  private Token pushedBack = null;

  /** Block comment just emitted, if nothing has come since */
  private String pendingDocstring = null;

  public StatementLexer(Tokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  private Token take() throws LexicalException {
    if (pushedBack != null) {
      Token tok = pushedBack;
      pushedBack = null;
      return tok;
    }
    return tokenizer.next();
  }

  private Token peek() throws LexicalException {
    if (pushedBack == null) {
      pushedBack = tokenizer.next();
    }
    return pushedBack;
  }

  /**
   * @return next statement in source order, or null at end of input
   * @throws LexicalException on unterminated quotes or comments, or
   *            brackets left open at end of input
   * @throws InvalidSyntaxException on closing brackets without opener,
   *            or a statement missing its final '.'
   */
  public Statement next() throws UserException {
    Token tok = take();
    if (tok == null) {
      return null;
    }
    switch (tok.kind) {
      case LINE_COMMENT:
        pendingDocstring = null;
        return Statement.comment(tok.line, StatementKind.LINECOMMENT,
                                 tok.text);
      case BLOCK_COMMENT:
        pendingDocstring = tok.text.substring(2, tok.text.length() - 2);
        return Statement.comment(tok.line, StatementKind.BLOCKCOMMENT,
                                 tok.text);
      default:
        String docstring = pendingDocstring;
        pendingDocstring = null;
        return readDefinition(tok, docstring);
    }
  }

  private Statement readDefinition(Token first, String docstring)
      throws UserException {
    boolean macro = first.kind == TokenKind.PUNCTUATION ||
                    first.kind == TokenKind.ATOM;
    macro = macro && first.text.equals("%");
    StatementKind kind;
    if (macro) {
      kind = StatementKind.LETTERSET;
    } else if (first.is(":")) {
      kind = StatementKind.ENVIRONMENT;
    } else {
      kind = StatementKind.TYPEDEF;
    }
    int line = first.line;
    List<Token> tokens = new ArrayList<Token>();
    int depth = 0;
    String unbalanced = null;

    Token tok = first;
    while (true) {
      if (tok == null) {
        if (depth > 0) {
          throw new LexicalException(tokenizer.getSource(), line,
              "Unbalanced brackets at end of input");
        }
        throw new InvalidSyntaxException(tokenizer.getSource(), line,
            "Statement not terminated by '.'");
      }
      if (tok.isComment()) {
        logger.trace("dropping comment inside statement at line " + tok.line);
        tok = take();
        continue;
      }
      tokens.add(tok);
      if (tok.opensGroup()) {
        depth++;
      } else if (tok.closesGroup()) {
        depth--;
        if (depth < 0) {
          // Keep going to the end of the statement so that the
          // next call starts at the following one
          if (unbalanced == null) {
            unbalanced = "Unbalanced '" + tok.text + "' at line " + tok.line;
          }
          depth = 0;
        }
      }

      if (macro && depth == 2 && atCharacterSet(tokens)) {
        Token chars = tokenizer.nextCharacterSet();
        if (chars != null) {
          tokens.add(chars);
        }
      }

      if (depth == 0 && macro && tok.closesGroup()) {
        Token after = peek();
        if (after != null && after.is(".")) {
          tokens.add(take());
        }
        break;
      } else if (depth == 0 && !macro && tok.is(".")) {
        break;
      }
      tok = take();
    }

    if (unbalanced != null) {
      throw new InvalidSyntaxException(tokenizer.getSource(), line,
                                       unbalanced);
    }
    if (logger.isTraceEnabled()) {
      logger.trace("statement " + kind + " at line " + line + ": " +
                   tokens.size() + " tokens");
    }
    return Statement.definition(line, kind, tokens, docstring);
  }

  /**
   * @return true if tokens hold exactly "%(letter-set (!v" or
   *         "%(wild-card (?v", so the character list comes next
   */
  private boolean atCharacterSet(List<Token> tokens) {
    if (tokens.size() != 5 || pushedBack != null) {
      return false;
    }
    String macro = tokens.get(2).text;
    return tokens.get(1).is("(") && tokens.get(3).is("(") &&
           (macro.equalsIgnoreCase(LetterSet.MACRO) ||
            macro.equalsIgnoreCase(WildCard.MACRO));
  }
}
