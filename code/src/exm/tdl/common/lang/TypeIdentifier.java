package exm.tdl.common.lang;

/**
 * Reference to a type by name.  Type names compare case-insensitively.
 */
public class TypeIdentifier extends Term {

  public TypeIdentifier(String name) {
    super(name);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || obj.getClass() != getClass())
      return false;
    return text.equalsIgnoreCase(((TypeIdentifier)obj).text);
  }

  @Override
  public int hashCode() {
    return text.toLowerCase().hashCode();
  }
}
