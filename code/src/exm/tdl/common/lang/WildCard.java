package exm.tdl.common.lang;

/**
 * Non-capturing character class, e.g. {@code %(wild-card (?v aeiou))}
 */
public class WildCard extends MorphSet {
  public static final String MACRO = "wild-card";

  public WildCard(String variable, String characters) {
    super(variable, characters);
  }

  @Override
  public String macroName() {
    return MACRO;
  }
}
