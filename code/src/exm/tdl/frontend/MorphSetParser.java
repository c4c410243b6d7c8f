package exm.tdl.frontend;

import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.MorphSet;
import exm.tdl.common.lang.WildCard;

/**
 * Parses %(letter-set (!v aeiou)) and %(wild-card (?v aeiou)).
 */
public class MorphSetParser {
  private final String source;

  public MorphSetParser(String source) {
    this.source = source;
  }

  public MorphSet parse(Statement statement) throws InvalidSyntaxException {
    assert(statement.getKind() == StatementKind.LETTERSET) : statement;
    TokenCursor cursor = new TokenCursor(statement, source);
    Token percent = cursor.next();
    assert(percent.text.equals("%"));
    cursor.expect("(");

    Token macro = cursor.next();
    boolean letterSet;
    if (macro.text.equalsIgnoreCase(LetterSet.MACRO)) {
      letterSet = true;
    } else if (macro.text.equalsIgnoreCase(WildCard.MACRO)) {
      letterSet = false;
    } else {
      throw cursor.error("Unknown macro %(" + macro.text + " ...)");
    }

    cursor.expect("(");
    Token var = cursor.next();
    if (letterSet && var.kind != TokenKind.LETTER_VARIABLE) {
      throw cursor.error("Letter-set variable must look like !x, not " +
                         var.text);
    } else if (!letterSet &&
               (var.kind != TokenKind.ATOM || !var.text.startsWith("?") ||
                var.text.length() < 2)) {
      throw cursor.error("Wild-card variable must look like ?x, not " +
                         var.text);
    }

    Token chars = cursor.next();
    if (chars.kind != TokenKind.CHARACTERS) {
      throw cursor.error("Missing character set for " + var.text);
    }
    if (!cursor.peekIs(")")) {
      throw cursor.error("Character set for " + var.text +
                         " must be written as one word");
    }
    cursor.expect(")");
    cursor.expect(")");
    cursor.accept(".");
    if (!cursor.atEnd()) {
      throw cursor.unexpected("end of " + macro.text);
    }

    String characters = unescape(chars.text);
    if (letterSet) {
      return new LetterSet(var.text, characters);
    } else {
      return new WildCard(var.text, characters);
    }
  }

  static String unescape(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        i++;
        c = text.charAt(i);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
