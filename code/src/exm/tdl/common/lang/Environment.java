package exm.tdl.common.lang;

/**
 * A block of definitions between {@code :begin :type.} or
 * {@code :begin :instance.} and the matching {@code :end}.
 * Blocks nest; the enclosing block is kept as the parent.
 */
public class Environment {

  public static enum Kind {
    TYPE, INSTANCE;

    public String keyword() {
      return ":" + name().toLowerCase();
    }

    /**
     * @return the kind for ":type" or ":instance", or null
     */
    public static Kind fromKeyword(String keyword) {
      for (Kind kind: values()) {
        if (kind.keyword().equalsIgnoreCase(keyword)) {
          return kind;
        }
      }
      return null;
    }
  }

  /** Status of instances when none is given */
  public static final String DEFAULT_STATUS = "instance";

  private final Kind kind;
  private final String status;
  private final Environment parent;
  private final int line;

  /**
   * @param status status of an instance block, null for a type block
   * @param parent enclosing block, or null at top level
   */
  public Environment(Kind kind, String status, Environment parent,
                     int line) {
    assert((kind == Kind.INSTANCE) == (status != null));
    this.kind = kind;
    this.status = status;
    this.parent = parent;
    this.line = line;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return e.g. "lex-entry" for {@code :begin :instance :status lex-entry.},
   *         or null for a type block
   */
  public String getStatus() {
    return status;
  }

  public Environment getParent() {
    return parent;
  }

  /**
   * @return 1-based line of the :begin marker
   */
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return kind.keyword() + (status == null ? "" : " " + status);
  }
}
