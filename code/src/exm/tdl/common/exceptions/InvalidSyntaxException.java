package exm.tdl.common.exceptions;

public class InvalidSyntaxException extends UserException {

  /**
   * 
   */
  private static final long serialVersionUID = 1060914609057739598L;

  public InvalidSyntaxException(String source, int line, String message) {
    super(source, line, message);
  }

}
