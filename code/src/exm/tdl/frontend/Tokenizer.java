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
import exm.tdl.common.exceptions.LexicalException;

/**
 * Splits TDL text into tokens on demand.  Each call to {@link #next()}
 * advances a private cursor; nothing is read ahead of the caller.
 */
public class Tokenizer {

  /** Characters that end an atom and form tokens of their own */
  private static final String BREAK_CHARACTERS = "<>!=:.#&,[];$()^/\"";

  private final CharSequence text;
  private final String source;
  private final Logger logger = Logging.getTDLLogger();

  private int pos = 0;
  private int line = 1;

  public Tokenizer(CharSequence text, String source) {
    this.text = text;
    this.source = source;
  }

  public Tokenizer(CharSequence text) {
    this(text, null);
  }

  public String getSource() {
    return source;
  }

  /**
   * Tokenize a whole string, dropping comments.
   * @return token texts in order
   * @throws LexicalException on unterminated quotes or comments
   */
  public static List<String> tokenize(CharSequence text)
      throws LexicalException {
    Tokenizer tokenizer = new Tokenizer(text);
    List<String> result = new ArrayList<String>();
    Token tok;
    while ((tok = tokenizer.next()) != null) {
      if (!tok.isComment()) {
        result.add(tok.text);
      }
    }
    return result;
  }

  public static boolean isBreakCharacter(char c) {
    return BREAK_CHARACTERS.indexOf(c) >= 0;
  }

  private static boolean isAtomCharacter(char c) {
    return !Character.isWhitespace(c) && !isBreakCharacter(c);
  }

  /**
   * @return the next token, or null at end of input
   * @throws LexicalException
   */
  public Token next() throws LexicalException {
    skipWhitespace();
    if (pos >= text.length()) {
      return null;
    }
    int start = pos;
    int startLine = line;
    char c = text.charAt(pos);
    TokenKind kind;
    switch (c) {
      case ';':
        while (pos < text.length() && text.charAt(pos) != '\n') {
          pos++;
        }
        kind = TokenKind.LINE_COMMENT;
        break;
      case '#':
        if (lookingAt("#|")) {
          scanBlockComment(startLine);
          kind = TokenKind.BLOCK_COMMENT;
        } else if (pos + 1 < text.length() &&
                   isAtomCharacter(text.charAt(pos + 1))) {
          pos++;
          scanAtom();
          kind = TokenKind.COREFERENCE;
        } else {
          pos++;
          kind = TokenKind.PUNCTUATION;
        }
        break;
      case '"':
        scanDoubleQuoted(startLine);
        kind = TokenKind.DOUBLE_QUOTED;
        break;
      case '\'':
        scanSingleQuoted(startLine);
        kind = TokenKind.SINGLE_QUOTED;
        break;
      case '^':
        scanRegex(startLine);
        kind = TokenKind.REGEX;
        break;
      case ':':
        pos += (lookingAt(":=") || lookingAt(":+") || lookingAt(":<")) ? 2 : 1;
        kind = TokenKind.PUNCTUATION;
        break;
      case '<':
        pos += lookingAt("<!") ? 2 : 1;
        kind = TokenKind.PUNCTUATION;
        break;
      case '!':
        if (lookingAt("!>")) {
          pos += 2;
          kind = TokenKind.PUNCTUATION;
        } else if (pos + 1 < text.length() &&
                   Character.isLetter(text.charAt(pos + 1))) {
          pos += 2;
          kind = TokenKind.LETTER_VARIABLE;
        } else {
          pos++;
          kind = TokenKind.PUNCTUATION;
        }
        break;
      case '.':
        pos += lookingAt("...") ? 3 : 1;
        kind = TokenKind.PUNCTUATION;
        break;
      default:
        if (isBreakCharacter(c)) {
          pos++;
          kind = TokenKind.PUNCTUATION;
        } else {
          scanAtom();
          kind = isInteger(start, pos) ? TokenKind.NUMBER : TokenKind.ATOM;
        }
    }
    Token tok = new Token(kind, text.subSequence(start, pos).toString(),
                          startLine, start);
    if (logger.isTraceEnabled()) {
      logger.trace("token " + kind + " at line " + startLine + ": " + tok);
    }
    return tok;
  }

  /**
   * Read the character list of a letter-set or wild-card, which may
   * hold any character but whitespace and ')'.  A backslash escapes
   * the character after it.
   * @return the list as written, or null if none comes next
   */
  public Token nextCharacterSet() {
    skipWhitespace();
    int start = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\\' && pos + 1 < text.length()) {
        pos++;
        advance();
      } else if (c == ')' || Character.isWhitespace(c)) {
        break;
      } else {
        pos++;
      }
    }
    if (pos == start) {
      return null;
    }
    return new Token(TokenKind.CHARACTERS,
                     text.subSequence(start, pos).toString(), line, start);
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      if (text.charAt(pos) == '\n') {
        line++;
      }
      pos++;
    }
  }

  private boolean lookingAt(String s) {
    if (pos + s.length() > text.length()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (text.charAt(pos + i) != s.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Advance past one character, keeping count of lines
   */
  private void advance() {
    if (text.charAt(pos) == '\n') {
      line++;
    }
    pos++;
  }

  /**
   * Atoms run up to whitespace or a break character; a backslash
   * escapes the character after it.
   */
  private void scanAtom() {
    while (pos < text.length() && isAtomCharacter(text.charAt(pos))) {
      if (text.charAt(pos) == '\\' && pos + 1 < text.length()) {
        pos++;
        advance();
      } else {
        pos++;
      }
    }
  }

  private boolean isInteger(int start, int end) {
    int i = start;
    if (i < end && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
      i++;
    }
    if (i == end) {
      return false;
    }
    for (; i < end; i++) {
      if (!Character.isDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private void scanBlockComment(int startLine) throws LexicalException {
    pos += 2;
    while (!lookingAt("|#")) {
      if (pos >= text.length()) {
        throw new LexicalException(source, startLine,
                                   "Unterminated block comment");
      }
      advance();
    }
    pos += 2;
  }

  private void scanDoubleQuoted(int startLine) throws LexicalException {
    pos++;
    while (pos < text.length() && text.charAt(pos) != '"') {
      if (text.charAt(pos) == '\\') {
        pos++;
        if (pos >= text.length()) {
          break;
        }
      }
      advance();
    }
    if (pos >= text.length()) {
      throw new LexicalException(source, startLine,
                                 "Unterminated double-quoted string");
    }
    // Closing quote
    pos++;
  }

  private void scanRegex(int startLine) throws LexicalException {
    pos++;
    while (pos < text.length() && text.charAt(pos) != '$') {
      if (text.charAt(pos) == '\\') {
        pos++;
        if (pos >= text.length()) {
          break;
        }
      }
      advance();
    }
    if (pos >= text.length()) {
      throw new LexicalException(source, startLine,
                                 "Unterminated regular expression");
    }
    pos++;
  }

  private void scanSingleQuoted(int startLine) throws LexicalException {
    pos++;
    int contentStart = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\\') {
        if (pos + 1 >= text.length()) {
          throw new LexicalException(source, startLine,
                                     "Unterminated single-quoted symbol");
        }
        pos++;
        advance();
      } else if (Character.isWhitespace(c) || isBreakCharacter(c)) {
        break;
      } else {
        pos++;
      }
    }
    if (pos == contentStart) {
      throw new LexicalException(source, startLine,
                                 "Unterminated single-quoted symbol");
    }
  }
}
