package exm.tdl.frontend;

import java.util.List;

import exm.tdl.common.exceptions.InvalidSyntaxException;

/**
 * Position within the tokens of one statement.  Errors report the
 * statement's start line.
 */
class TokenCursor {
  private final List<Token> tokens;
  private final String source;
  private final int line;
  private int pos = 0;

  TokenCursor(Statement statement, String source) {
    this.tokens = statement.getTokens();
    this.source = source;
    this.line = statement.getLine();
  }

  int line() {
    return line;
  }

  boolean atEnd() {
    return pos >= tokens.size();
  }

  /**
   * @return next token without consuming it, or null at end
   */
  Token peek() {
    return atEnd() ? null : tokens.get(pos);
  }

  boolean peekIs(String punctuation) {
    Token tok = peek();
    return tok != null && tok.is(punctuation);
  }

  Token next() throws InvalidSyntaxException {
    if (atEnd()) {
      throw error("Unexpected end of statement");
    }
    return tokens.get(pos++);
  }

  /**
   * Consume the punctuation if it is next
   * @return true if consumed
   */
  boolean accept(String punctuation) {
    if (peekIs(punctuation)) {
      pos++;
      return true;
    }
    return false;
  }

  Token expect(String punctuation) throws InvalidSyntaxException {
    Token tok = peek();
    if (tok == null || !tok.is(punctuation)) {
      throw unexpected("'" + punctuation + "'");
    }
    pos++;
    return tok;
  }

  /**
   * @param wanted description of what the grammar allows here
   */
  InvalidSyntaxException unexpected(String wanted) {
    Token tok = peek();
    return error("Expected " + wanted + " but found " +
            (tok == null ? "end of statement"
                         : "'" + tok.text + "' at line " + tok.line));
  }

  InvalidSyntaxException error(String message) {
    return new InvalidSyntaxException(source, line, message);
  }
}
