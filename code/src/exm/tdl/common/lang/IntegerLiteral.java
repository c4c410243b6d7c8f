package exm.tdl.common.lang;

public class IntegerLiteral extends Term {
  private final long value;

  public IntegerLiteral(String text, long value) {
    super(text);
    this.value = value;
  }

  public IntegerLiteral(long value) {
    this(Long.toString(value), value);
  }

  public long getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IntegerLiteral))
      return false;
    return value == ((IntegerLiteral)obj).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }
}
