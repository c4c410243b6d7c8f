package exm.tdl.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class TDLFatal extends RuntimeException {
  public final int exitCode;

  public TDLFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
