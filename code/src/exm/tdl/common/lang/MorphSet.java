package exm.tdl.common.lang;

/**
 * Character class used by inflectional rule patterns.
 */
public abstract class MorphSet {
  private final String variable;
  private final String characters;

  protected MorphSet(String variable, String characters) {
    this.variable = variable;
    this.characters = characters;
  }

  /**
   * @return variable used in affix patterns, e.g. "!v"
   */
  public String getVariable() {
    return variable;
  }

  /**
   * @return characters matched, with escapes already resolved
   */
  public String getCharacters() {
    return characters;
  }

  /**
   * @return macro name as written in TDL, e.g. "letter-set"
   */
  public abstract String macroName();

  @Override
  public boolean equals(Object obj) {
    if (obj == null || obj.getClass() != getClass())
      return false;
    MorphSet other = (MorphSet)obj;
    return variable.equals(other.variable) &&
           characters.equals(other.characters);
  }

  @Override
  public int hashCode() {
    return variable.hashCode() * 31 + characters.hashCode();
  }

  @Override
  public String toString() {
    return macroName() + " " + variable + " " + characters;
  }
}
