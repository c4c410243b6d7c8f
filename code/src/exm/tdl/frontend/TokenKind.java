package exm.tdl.frontend;

public enum TokenKind {
  /** type names, feature names, symbols */
  ATOM,
  /** optionally signed decimal integer */
  NUMBER,
  /** "string", quotes included */
  DOUBLE_QUOTED,
  /** 'symbol, leading quote included */
  SINGLE_QUOTED,
  /** ^pattern$, delimiters included */
  REGEX,
  /** #tag */
  COREFERENCE,
  /** !x inside letter-sets and affix patterns */
  LETTER_VARIABLE,
  /** fixed punctuation, including :=, <!, !>, ... */
  PUNCTUATION,
  /** raw character list of a letter-set or wild-card */
  CHARACTERS,
  /** ; to end of line */
  LINE_COMMENT,
  /** #| ... |# */
  BLOCK_COMMENT,
}
