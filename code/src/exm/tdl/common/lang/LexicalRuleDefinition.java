package exm.tdl.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An inflecting lexical rule:
 * {@code id := %suffix (y ies) (!c !cs) rule-type & [ ... ].}
 */
public class LexicalRuleDefinition extends TypeDefinition {

  public static enum AffixType {
    PREFIX,
    SUFFIX;

    public String keyword() {
      return "%" + name().toLowerCase();
    }

    /**
     * @return affix type for "%prefix" or "%suffix", or null
     */
    public static AffixType fromKeyword(String keyword) {
      for (AffixType t: values()) {
        if (t.keyword().equals(keyword)) {
          return t;
        }
      }
      return null;
    }
  }

  /**
   * One (match, replacement) pair.  Either side may use letter-set
   * or wild-card variables, e.g. (!c !cs).
   */
  public static class AffixPattern {
    public final String match;
    public final String replacement;

    public AffixPattern(String match, String replacement) {
      this.match = match;
      this.replacement = replacement;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof AffixPattern))
        return false;
      AffixPattern other = (AffixPattern)obj;
      return match.equals(other.match) &&
             replacement.equals(other.replacement);
    }

    @Override
    public int hashCode() {
      return match.hashCode() * 31 + replacement.hashCode();
    }

    @Override
    public String toString() {
      return "(" + match + " " + replacement + ")";
    }
  }

  private final AffixType affixType;
  private final List<AffixPattern> patterns;

  public LexicalRuleDefinition(String identifier, DefinitionOperator operator,
      int line, AffixType affixType, List<AffixPattern> patterns) {
    super(identifier, operator, line);
    this.affixType = affixType;
    this.patterns = new ArrayList<AffixPattern>(patterns);
  }

  public AffixType getAffixType() {
    return affixType;
  }

  public List<AffixPattern> getPatterns() {
    return Collections.unmodifiableList(patterns);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LexicalRuleDefinition) || !super.equals(obj))
      return false;
    LexicalRuleDefinition other = (LexicalRuleDefinition)obj;
    return affixType == other.affixType && patterns.equals(other.patterns);
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + patterns.hashCode();
  }
}
