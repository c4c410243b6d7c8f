package exm.tdl.common.lang;

/**
 * Capturing character class, e.g. {@code %(letter-set (!v aeiou))}.
 * The variable may appear in both sides of an affix pattern.
 */
public class LetterSet extends MorphSet {
  public static final String MACRO = "letter-set";

  public LetterSet(String variable, String characters) {
    super(variable, characters);
  }

  @Override
  public String macroName() {
    return MACRO;
  }
}
