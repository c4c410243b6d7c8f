package exm.tdl.frontend;

import java.util.Collections;
import java.util.List;

/**
 * One top-level unit of a TDL file.  Definitions carry their tokens,
 * comments their raw text.
 */
public class Statement {
  private final int line;
  private final StatementKind kind;
  private final List<Token> tokens;
  private final String text;
  private final String docstring;

  private Statement(int line, StatementKind kind, List<Token> tokens,
                    String text, String docstring) {
    this.line = line;
    this.kind = kind;
    this.tokens = tokens;
    this.text = text;
    this.docstring = docstring;
  }

  public static Statement definition(int line, StatementKind kind,
                          List<Token> tokens, String docstring) {
    assert(kind != StatementKind.LINECOMMENT &&
           kind != StatementKind.BLOCKCOMMENT) : kind;
    return new Statement(line, kind, Collections.unmodifiableList(tokens),
                         null, docstring);
  }

  public static Statement comment(int line, StatementKind kind, String text) {
    assert(kind == StatementKind.LINECOMMENT ||
           kind == StatementKind.BLOCKCOMMENT);
    return new Statement(line, kind, null, text, null);
  }

  public int getLine() {
    return line;
  }

  public StatementKind getKind() {
    return kind;
  }

  /**
   * @return tokens of a TYPEDEF or LETTERSET, null for comments
   */
  public List<Token> getTokens() {
    return tokens;
  }

  /**
   * @return raw comment text including delimiters, null for definitions
   */
  public String getText() {
    return text;
  }

  /**
   * @return contents of the block comment immediately before this
   *         definition, delimiters stripped, or null
   */
  public String getDocstring() {
    return docstring;
  }

  @Override
  public String toString() {
    return line + ": " + kind + " " + (tokens != null ? tokens : text);
  }
}
