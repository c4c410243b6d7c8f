package exm.tdl.common.lang;

/**
 * Assignment operators that introduce a definition.  The parser
 * handles all three alike; what redefinition or addendum means is
 * decided when grammars are assembled.
 */
public enum DefinitionOperator {
  /** a := b */
  DEFINE(":="),
  /** a :+ b, addendum to an existing type */
  ADDENDUM(":+"),
  /** a :< b, legacy subtype declaration */
  SUBTYPE(":<");

  private final String token;

  DefinitionOperator(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  /**
   * @return matching operator, or null if token is not an operator
   */
  public static DefinitionOperator fromToken(String token) {
    for (DefinitionOperator op: values()) {
      if (op.token.equals(token)) {
        return op;
      }
    }
    return null;
  }
}
