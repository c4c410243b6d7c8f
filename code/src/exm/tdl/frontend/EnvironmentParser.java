package exm.tdl.frontend;

import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.Environment.Kind;

/**
 * Parses block markers:
 * <pre>
 *   :begin :type.
 *   :begin :instance :status lex-entry.
 *   :end :type.
 * </pre>
 */
public class EnvironmentParser {
  private final String source;

  public EnvironmentParser(String source) {
    this.source = source;
  }

  /**
   * @param current innermost open block, or null
   * @return innermost open block after the marker
   * @throws InvalidSyntaxException on a malformed or unmatched marker
   */
  public Environment parse(Statement statement, Environment current)
      throws InvalidSyntaxException {
    assert(statement.getKind() == StatementKind.ENVIRONMENT) : statement;
    TokenCursor cursor = new TokenCursor(statement, source);
    cursor.expect(":");
    Token marker = cursor.next();
    Environment result;
    if (marker.kind == TokenKind.ATOM &&
        marker.text.equalsIgnoreCase("begin")) {
      result = begin(cursor, current, statement.getLine());
    } else if (marker.kind == TokenKind.ATOM &&
               marker.text.equalsIgnoreCase("end")) {
      result = end(cursor, current);
    } else {
      throw cursor.error("Expected :begin or :end but found ':" +
                         marker.text + "'");
    }
    cursor.expect(".");
    if (!cursor.atEnd()) {
      throw cursor.unexpected("end of :" + marker.text);
    }
    return result;
  }

  private Environment begin(TokenCursor cursor, Environment current,
                            int line) throws InvalidSyntaxException {
    Kind kind = kind(cursor, "begin");
    String status = null;
    if (kind == Kind.INSTANCE) {
      status = Environment.DEFAULT_STATUS;
      if (cursor.accept(":")) {
        Token keyword = cursor.next();
        if (keyword.kind != TokenKind.ATOM ||
            !keyword.text.equalsIgnoreCase("status")) {
          throw cursor.error("Expected :status or '.' but found ':" +
                             keyword.text + "'");
        }
        Token value = cursor.next();
        if (value.kind != TokenKind.ATOM) {
          throw cursor.error("Bad instance status '" + value.text + "'");
        }
        status = value.text;
      }
    }
    return new Environment(kind, status, current, line);
  }

  private Environment end(TokenCursor cursor, Environment current)
      throws InvalidSyntaxException {
    Kind kind = kind(cursor, "end");
    if (current == null) {
      throw cursor.error(":end " + kind.keyword() + " without :begin");
    }
    if (current.getKind() != kind) {
      throw cursor.error("Expected :end " + current.getKind().keyword() +
                         " for block at line " + current.getLine() +
                         " but found :end " + kind.keyword());
    }
    return current.getParent();
  }

  private static Kind kind(TokenCursor cursor, String marker)
      throws InvalidSyntaxException {
    cursor.expect(":");
    Token word = cursor.next();
    Kind kind = word.kind == TokenKind.ATOM ?
                    Kind.fromKeyword(":" + word.text) : null;
    if (kind == null) {
      throw cursor.error("Expected :type or :instance after :" + marker +
                         " but found '" + word.text + "'");
    }
    return kind;
  }
}
