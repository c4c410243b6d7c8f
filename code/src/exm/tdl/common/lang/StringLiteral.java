package exm.tdl.common.lang;

/**
 * Double-quoted string value.  The text keeps any backslash escapes
 * exactly as written so that it can be written back out unchanged.
 */
public class StringLiteral extends Term {

  public StringLiteral(String text) {
    super(text);
  }

  /**
   * @return string with backslash escapes resolved
   */
  public String getValue() {
    if (text.indexOf('\\') < 0) {
      return text;
    }
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

  @Override
  public String toString() {
    return "\"" + text + "\"";
  }
}
