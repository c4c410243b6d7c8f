package exm.tdl.common.exceptions;

/**
 * Input text could not be split into tokens or statements,
 * e.g. an unterminated quote or block comment.
 */
public class LexicalException extends UserException {

  public LexicalException(String source, int line, String message) {
    super(source, line, message);
  }

  private static final long serialVersionUID = 2217083514425908716L;
}
