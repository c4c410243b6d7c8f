package exm.tdl.frontend;

public enum StatementKind {
  TYPEDEF,
  /** %(letter-set ...) or %(wild-card ...) */
  LETTERSET,
  /** :begin or :end of a :type or :instance block */
  ENVIRONMENT,
  LINECOMMENT,
  BLOCKCOMMENT,
}
