/**
 * Reading TDL text: {@link exm.tdl.frontend.Tokenizer} splits it into
 * tokens, {@link exm.tdl.frontend.StatementLexer} groups the tokens into
 * statements and {@link exm.tdl.frontend.ConjunctionParser} turns each
 * type definition into a feature structure.
 * {@link exm.tdl.frontend.TDLParser} drives the three over one input.
 */
package exm.tdl.frontend;
