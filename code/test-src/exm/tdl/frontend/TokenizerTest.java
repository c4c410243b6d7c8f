package exm.tdl.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.LexicalException;

public class TokenizerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TokenizerTest.tdl.log", true);
  }

  @Test
  public void testLetterSet() throws LexicalException {
    assertEquals(Arrays.asList("%", "(", "letter-set", "(", "!v", "aeiou",
                               ")", ")"),
                 Tokenizer.tokenize("%(letter-set (!v aeiou))"));
  }

  @Test
  public void testDefinition() throws LexicalException {
    assertEquals(Arrays.asList("type", ":=", "super", "&", "[", "ATTR1", "<",
                    "a", ".", "#rest", ">", ",", "ATTR2", "#rest", "]", "."),
        Tokenizer.tokenize(
            "type := super & [ ATTR1 < a . #rest >, ATTR2 #rest ]."));
  }

  @Test
  public void testMultiCharPunctuation() throws LexicalException {
    assertEquals(Arrays.asList("a", ":+", "b", "&", "[", "L", "<!", "x",
                               "!>", ",", "M", "<", "y", ",", "...", ">",
                               "]", "."),
        Tokenizer.tokenize("a :+ b & [ L <! x !>, M < y, ... > ]."));
    assertEquals(Arrays.asList("a", ":<", "b", "."),
                 Tokenizer.tokenize("a :< b."));
  }

  @Test
  public void testDottedPath() throws LexicalException {
    assertEquals(Arrays.asList("[", "SYNSEM", ".", "LOCAL", "x", "]"),
                 Tokenizer.tokenize("[SYNSEM.LOCAL x]"));
  }

  @Test
  public void testQuotedStringKeepsPunctuation() throws LexicalException {
    assertEquals(Arrays.asList("[", "PRED", "\"_dog_n_1 [x] . y\"", "]"),
                 Tokenizer.tokenize("[ PRED \"_dog_n_1 [x] . y\" ]"));
  }

  @Test
  public void testEscapedQuote() throws LexicalException {
    assertEquals(Arrays.asList("\"a \\\" b\"", "c"),
                 Tokenizer.tokenize("\"a \\\" b\" c"));
  }

  @Test
  public void testSingleQuoted() throws LexicalException {
    assertEquals(Arrays.asList("[", "ORTH", "'dog", "]"),
                 Tokenizer.tokenize("[ ORTH 'dog]"));
    assertEquals(Arrays.asList("'a\\ b", "c"),
                 Tokenizer.tokenize("'a\\ b c"));
  }

  @Test
  public void testEscapedAtom() throws LexicalException {
    assertEquals(Arrays.asList("ab\\)c", ")"),
                 Tokenizer.tokenize("ab\\)c)"));
  }

  @Test
  public void testCommentsDropped() throws LexicalException {
    assertEquals(Arrays.asList("a", ":=", "b", "."),
        Tokenizer.tokenize("; header\n#| block\n comment |#\na := b. ; end"));
  }

  @Test
  public void testTokenKinds() throws LexicalException {
    Tokenizer t = new Tokenizer("; c\n#x -12 + !v :=\n \"s\"");
    Token tok = t.next();
    assertEquals(TokenKind.LINE_COMMENT, tok.kind);
    assertEquals("; c", tok.text);
    assertEquals(1, tok.line);

    tok = t.next();
    assertEquals(TokenKind.COREFERENCE, tok.kind);
    assertEquals(2, tok.line);
    assertEquals(TokenKind.NUMBER, t.next().kind);

    tok = t.next();
    assertEquals("bare + is an atom", TokenKind.ATOM, tok.kind);
    assertEquals(TokenKind.LETTER_VARIABLE, t.next().kind);
    assertEquals(TokenKind.PUNCTUATION, t.next().kind);

    tok = t.next();
    assertEquals(TokenKind.DOUBLE_QUOTED, tok.kind);
    assertEquals(3, tok.line);
    assertNull(t.next());
    assertNull(t.next());
  }

  @Test
  public void testAdjacency() throws LexicalException {
    Tokenizer t = new Tokenizer("!cs !c s");
    Token a = t.next();
    Token b = t.next();
    Token c = t.next();
    Token d = t.next();
    assertEquals("!c", a.text);
    assertEquals("s", b.text);
    assertEquals(true, a.adjoins(b));
    assertEquals(false, c.adjoins(d));
  }

  @Test
  public void testBlockCommentLines() throws LexicalException {
    Tokenizer t = new Tokenizer("#| one\ntwo |#\nx");
    Token comment = t.next();
    assertEquals(TokenKind.BLOCK_COMMENT, comment.kind);
    assertEquals("#| one\ntwo |#", comment.text);
    assertEquals(3, t.next().line);
  }

  @Test
  public void testUnterminatedString() throws LexicalException {
    exception.expect(LexicalException.class);
    exception.expectMessage("Unterminated double-quoted string");
    Tokenizer.tokenize("a := \"open");
  }

  @Test
  public void testUnterminatedEscapeInString() throws LexicalException {
    exception.expect(LexicalException.class);
    Tokenizer.tokenize("\"open\\");
  }

  @Test
  public void testUnterminatedBlockComment() throws LexicalException {
    exception.expect(LexicalException.class);
    exception.expectMessage("<input>:2:");
    Tokenizer.tokenize("a := b.\n#| never closed");
  }

  @Test
  public void testEmptySingleQuote() throws LexicalException {
    exception.expect(LexicalException.class);
    Tokenizer.tokenize("[ A ' ]");
  }

  @Test
  public void testRegex() throws LexicalException {
    assertEquals(Arrays.asList("[", "ORTH", "^[a-z]+\\$x$", "]"),
                 Tokenizer.tokenize("[ ORTH ^[a-z]+\\$x$ ]"));
  }

  @Test
  public void testUnterminatedRegex() throws LexicalException {
    exception.expect(LexicalException.class);
    exception.expectMessage("Unterminated regular expression");
    Tokenizer.tokenize("[ ORTH ^abc ]");
  }

  @Test
  public void testCharacterSet() throws LexicalException {
    Tokenizer t = new Tokenizer("  .,?\\ x)");
    Token chars = t.nextCharacterSet();
    assertEquals(TokenKind.CHARACTERS, chars.kind);
    assertEquals(".,?\\ x", chars.text);
    assertEquals(")", t.next().text);
    assertNull(new Tokenizer(" )").nextCharacterSet());
  }
}
