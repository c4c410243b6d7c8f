package exm.tdl.common.exceptions;

/**
 * Raised when a feature path is looked up or assigned through
 * a structure where it is not defined.
 */
public class UndefinedPathException extends RuntimeException {

  private final String path;
  private final int line;

  public UndefinedPathException(String path, String message) {
    this(path, -1, message);
  }

  public UndefinedPathException(String path, int line, String message) {
    super((line > 0 ? "line " + line + ": " : "") + message + ": " + path);
    this.path = path;
    this.line = line;
  }

  public String getPath() {
    return path;
  }

  /**
   * @return start line of the owning definition, or -1 if unknown
   */
  public int getLine() {
    return line;
  }

  private static final long serialVersionUID = 1L;
}
