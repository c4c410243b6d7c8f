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

/**
 * One lexical unit of TDL source text, with its position.
 */
public class Token {
  public final TokenKind kind;
  /** verbatim source text, including quotes and escapes */
  public final String text;
  /** 1-based line of the first character */
  public final int line;
  /** offset of the first character in the input */
  public final int offset;

  public Token(TokenKind kind, String text, int line, int offset) {
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.offset = offset;
  }

  public int end() {
    return offset + text.length();
  }

  /**
   * @return true if next starts right where this token ends
   */
  public boolean adjoins(Token next) {
    return next != null && end() == next.offset;
  }

  /**
   * @return true if this is the given punctuation symbol
   */
  public boolean is(String punctuation) {
    return kind == TokenKind.PUNCTUATION && text.equals(punctuation);
  }

  public boolean isComment() {
    return kind == TokenKind.LINE_COMMENT || kind == TokenKind.BLOCK_COMMENT;
  }

  /**
   * @return true for [ < <! (
   */
  public boolean opensGroup() {
    return is("[") || is("<") || is("<!") || is("(");
  }

  /**
   * @return true for ] > !> )
   */
  public boolean closesGroup() {
    return is("]") || is(">") || is("!>") || is(")");
  }

  @Override
  public String toString() {
    return text;
  }
}
