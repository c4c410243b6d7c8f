package exm.tdl.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.InvalidSyntaxException;
import exm.tdl.common.exceptions.LexicalException;
import exm.tdl.common.exceptions.UserException;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.WildCard;

public class TDLParserTest {

  private static final String GRAMMAR =
      "; Toy grammar\n" +
      "%(letter-set (!c bdfglmnprstz))\n" +
      "%(wild-card (?v aeiou)).\n" +
      "#| Nouns |#\n" +
      "noun := word & [ HEAD n, AGR #a, SPR < [ AGR #a ] > ].\n" +
      "\n" +
      "verb := word &\n" +
      "  [ HEAD v ].\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TDLParserTest.tdl.log", true);
  }

  @Test
  public void testParseAll() throws UserException {
    TDLParser parser = TDLParser.fromString(GRAMMAR, "toy.tdl");
    List<TypeDefinition> defs = parser.parseAll();
    assertEquals(2, defs.size());
    TypeDefinition noun = defs.get(0);
    assertEquals("noun", noun.getIdentifier());
    assertEquals(" Nouns ", noun.getDocstring());
    assertEquals(5, noun.getLine());
    assertEquals("#a", noun.getCoreferences().get(0).getTag());
    assertEquals("SPR.FIRST.AGR",
                 noun.getCoreferences().get(0).getPaths().get(1));

    TypeDefinition verb = defs.get(1);
    assertEquals(7, verb.getLine());
    assertNull(verb.getDocstring());
    assertNull(parser.next());
  }

  @Test
  public void testMorphSets() throws UserException {
    TDLParser parser = TDLParser.fromString(GRAMMAR);
    assertEquals("noun", parser.next().getIdentifier());
    assertEquals(new LetterSet("!c", "bdfglmnprstz"),
                 parser.getLetterSets().get("!c"));
    assertEquals(new WildCard("?v", "aeiou"),
                 parser.getWildCards().get("?v"));
  }

  @Test
  public void testEscapedLetterSet() throws UserException {
    TDLParser parser = TDLParser.fromString("%(letter-set (!p ab\\)c))");
    assertNull(parser.next());
    assertEquals("ab)c", parser.getLetterSets().get("!p").getCharacters());
  }

  @Test
  public void testPunctuationInCharacterSets() throws UserException {
    TDLParser parser = TDLParser.fromString(
        "%(letter-set (!p .,?))\n" +
        "%(letter-set (!q a!b))\n" +
        "%(wild-card (?s ;:))\n" +
        "a := b.\n");
    assertEquals(1, parser.parseAll().size());
    assertEquals(".,?", parser.getLetterSets().get("!p").getCharacters());
    assertEquals("a!b", parser.getLetterSets().get("!q").getCharacters());
    assertEquals(";:", parser.getWildCards().get("?s").getCharacters());
  }

  @Test
  public void testMissingCharacterSet() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Missing character set for !v");
    TDLParser.fromString("%(letter-set (!v))").next();
  }

  @Test
  public void testBadLetterSetVariable() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Letter-set variable");
    TDLParser.fromString("%(letter-set (?v aeiou))").next();
  }

  @Test
  public void testBadWildCardVariable() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Wild-card variable");
    TDLParser.fromString("%(wild-card (!v aeiou))").next();
  }

  @Test
  public void testLetterSetNeedsOneWord() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("one word");
    TDLParser.fromString("%(letter-set (!v ae iou))").next();
  }

  @Test
  public void testEnvironments() throws UserException {
    TDLParser parser = TDLParser.fromString(
        ":begin :type.\n" +
        "a := b.\n" +
        ":begin :instance :status lex-entry.\n" +
        "dog := noun.\n" +
        ":end :instance.\n" +
        "c := d.\n" +
        ":end :type.\n" +
        "e := f.\n");
    List<TypeDefinition> defs = parser.parseAll();
    assertEquals(4, defs.size());
    Environment types = defs.get(0).getEnvironment();
    assertEquals(Environment.Kind.TYPE, types.getKind());
    assertNull(types.getStatus());
    assertNull(types.getParent());
    assertEquals(1, types.getLine());

    Environment instances = defs.get(1).getEnvironment();
    assertEquals(Environment.Kind.INSTANCE, instances.getKind());
    assertEquals("lex-entry", instances.getStatus());
    assertSame(types, instances.getParent());

    assertSame(types, defs.get(2).getEnvironment());
    assertNull(defs.get(3).getEnvironment());
    assertNull(parser.getEnvironment());
  }

  @Test
  public void testDefaultInstanceStatus() throws UserException {
    TDLParser parser = TDLParser.fromString(
        ":begin :instance.\nw := x.\n:end :instance.");
    assertEquals(Environment.DEFAULT_STATUS,
                 parser.next().getEnvironment().getStatus());
  }

  @Test
  public void testUnclosedEnvironment() throws UserException {
    TDLParser parser = TDLParser.fromString(":begin :type.\na := b.");
    assertEquals(1, parser.parseAll().size());
  }

  @Test
  public void testEndWithoutBegin() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage(":end :type without :begin");
    TDLParser.fromString("a := b.\n:end :type.").parseAll();
  }

  @Test
  public void testMismatchedEnd() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Expected :end :type for block at line 1");
    TDLParser.fromString(":begin :type.\n:end :instance.").parseAll();
  }

  @Test
  public void testUnknownEnvironment() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Expected :type or :instance after :begin");
    TDLParser.fromString(":begin :rules.").next();
  }

  @Test
  public void testRecoverFromBadMarker() throws UserException {
    TDLParser parser = TDLParser.fromString(":end :type.\na := b.")
                                .setRecover(true);
    assertEquals(1, parser.parseAll().size());
    assertEquals(1, parser.getErrors().size());
  }

  @Test
  public void testFailFast() throws UserException {
    TDLParser parser = TDLParser.fromString("a := [ X ].\nb := c.");
    exception.expect(InvalidSyntaxException.class);
    parser.next();
  }

  @Test
  public void testRecover() throws UserException {
    TDLParser parser = TDLParser.fromString(
        "a := [ X ].\nb := c.\nd := e ] & f.\ng := [ H < i . j > ].\nk := l.")
        .setRecover(true);
    List<TypeDefinition> defs = parser.parseAll();
    assertEquals(2, defs.size());
    assertEquals("b", defs.get(0).getIdentifier());
    assertEquals("k", defs.get(1).getIdentifier());
    assertEquals(3, parser.getErrors().size());
    assertEquals(1, parser.getErrors().get(0).getLine());
    assertEquals(3, parser.getErrors().get(1).getLine());
    assertEquals(4, parser.getErrors().get(2).getLine());
  }

  @Test
  public void testRecoverKeepsLexicalErrors() throws UserException {
    TDLParser parser = TDLParser.fromString("a := b.\nc := \"open.")
                                .setRecover(true);
    assertEquals("a", parser.next().getIdentifier());
    exception.expect(LexicalException.class);
    parser.next();
  }

  @Test
  public void testStrictCoreferences() throws UserException {
    TDLParser parser = TDLParser.fromString("a := b & [ B #x ].")
                                .setStrictCoreferences(true);
    exception.expect(InvalidSyntaxException.class);
    parser.next();
  }

  @Test
  public void testFromFile() throws IOException, UserException {
    File file = tmp.newFile("toy.tdl");
    FileUtils.writeStringToFile(file, GRAMMAR, StandardCharsets.UTF_8);
    TDLParser parser = TDLParser.fromFile(file, StandardCharsets.UTF_8);
    assertEquals(file.getPath(), parser.getSource());
    assertEquals(2, parser.parseAll().size());
  }

  @Test
  public void testErrorNamesFile() throws IOException, UserException {
    File file = tmp.newFile("bad.tdl");
    FileUtils.writeStringToFile(file, "\na := [ B ].", StandardCharsets.UTF_8);
    try {
      TDLParser.fromFile(file, StandardCharsets.UTF_8).next();
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage().startsWith(file.getPath() + ":2:"));
      return;
    }
    throw new AssertionError("expected syntax error");
  }
}
