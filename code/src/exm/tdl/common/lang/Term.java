package exm.tdl.common.lang;

/**
 * A single conjunct that is not a feature structure:
 * a type name or a literal leaf value.
 */
public abstract class Term {
  protected final String text;

  protected Term(String text) {
    assert(text != null);
    this.text = text;
  }

  /**
   * @return text as written in the source, without any quotes
   */
  public String getText() {
    return text;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || obj.getClass() != getClass())
      return false;
    return text.equals(((Term)obj).text);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode() * 31 + text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
