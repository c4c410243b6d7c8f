package exm.tdl.common.exceptions;

/**
 * This represents a parser internal error.
 * These always indicate a parser bug (or missing feature).
 * */
public class TDLRuntimeError extends RuntimeException {
  public TDLRuntimeError(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
