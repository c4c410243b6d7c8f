package exm.tdl.common.lang;

/**
 * Type written as a regular expression, e.g. {@code ^[a-z]+$}.
 * Like a type name it constrains a node, but it is matched against
 * type names rather than naming one.  The text excludes the ^ and $
 * delimiters and compares case-sensitively.
 */
public class Regex extends TypeIdentifier {

  public Regex(String pattern) {
    super(pattern);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || obj.getClass() != getClass())
      return false;
    return text.equals(((Regex)obj).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return "^" + text + "$";
  }
}
