package exm.tdl.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A coreference: a tag and the full dotted paths, in the order first
 * seen, that it aliases.  Anonymous coreferences (tag == null) are
 * introduced by diff-lists.
 */
public class Coreference {
  private final String tag;
  private final List<String> paths = new ArrayList<String>();

  public Coreference(String tag) {
    this.tag = tag;
  }

  public Coreference(String tag, List<String> paths) {
    this(tag);
    this.paths.addAll(paths);
  }

  /**
   * @return tag including the leading '#', or null if anonymous
   */
  public String getTag() {
    return tag;
  }

  public boolean isAnonymous() {
    return tag == null;
  }

  public List<String> getPaths() {
    return Collections.unmodifiableList(paths);
  }

  public void addPath(String path) {
    paths.add(path);
  }

  /**
   * A tag that occurs at only one path aliases nothing
   */
  public boolean isComplete() {
    return paths.size() >= 2;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Coreference))
      return false;
    Coreference other = (Coreference)obj;
    if (tag == null ? other.tag != null : !tag.equals(other.tag))
      return false;
    return paths.equals(other.paths);
  }

  @Override
  public int hashCode() {
    return (tag == null ? 0 : tag.hashCode()) * 31 + paths.hashCode();
  }

  @Override
  public String toString() {
    return "(" + tag + ", " + paths + ")";
  }
}
