package exm.tdl.common.lang;

/**
 * A (dotted path, value) pair produced by traversing a feature structure.
 */
public class Feature {
  public final String path;
  public final Conjunction value;

  public Feature(String path, Conjunction value) {
    this.path = path;
    this.value = value;
  }

  public String getPath() {
    return path;
  }

  public Conjunction getValue() {
    return value;
  }

  @Override
  public int hashCode() {
    return path.hashCode() * 31 + (value == null ? 0 : value.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Feature))
      return false;
    Feature other = (Feature)obj;
    return path.equals(other.path) &&
        (value == null ? other.value == null : value.equals(other.value));
  }

  @Override
  public String toString() {
    return "(" + path + ", " + value + ")";
  }
}
