package exm.tdl.backend;

import static org.junit.Assert.assertEquals;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.tdl.common.Logging;
import exm.tdl.common.exceptions.UserException;
import exm.tdl.common.lang.Conjunction;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.TypeIdentifier;
import exm.tdl.common.lang.WildCard;
import exm.tdl.frontend.TDLParser;

public class TDLFormatterTest {

  private final TDLFormatter formatter = new TDLFormatter();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TDLFormatterTest.tdl.log", true);
  }

  private static TypeDefinition parse(String text) throws UserException {
    return TDLParser.fromString(text).next();
  }

  /**
   * Format, parse again and check nothing changed
   */
  private void checkRoundTrip(String text) throws UserException {
    TypeDefinition def = parse(text);
    String formatted = formatter.format(def);
    TypeDefinition again = parse(formatted);
    assertEquals(formatted, def, again);
    assertEquals(formatted, formatter.format(again));
  }

  @Test
  public void testSimple() throws UserException {
    assertEquals("t := u & v.", formatter.format(parse("t:=u&v.")));
  }

  @Test
  public void testDottedPaths() throws UserException {
    assertEquals("t := u & [ A.B x ].",
                 formatter.format(parse("t := u & [ A [ B x ] ].")));
    assertEquals("t := u & [ A [ B x,\n    C y ] ].",
                 formatter.format(parse("t := u & [ A.B x, A.C y ].")));
  }

  @Test
  public void testLists() throws UserException {
    assertEquals("t := u & [ L < a, b >,\n  M < >,\n  N < c, ... >,\n" +
                 "  O < ... >,\n  P < d . #p >,\n  Q #p ].",
        formatter.format(parse(
          "t := u & [ L < a, b >, M < >, N < c, ... >, O < ... >, " +
          "P < d . #p >, Q #p ].")));
  }

  @Test
  public void testDiffLists() throws UserException {
    assertEquals("t := u & [ L <! a, b !>,\n  M <! !> ].",
        formatter.format(parse("t := u & [ L <! a, b !>, M <! !> ].")));
  }

  @Test
  public void testLiteralsAndTags() throws UserException {
    assertEquals("t := u & [ PRED \"_dog_n_rel\",\n  ARG #x & index,\n" +
                 "  NUM 3,\n  Y #x ].",
        formatter.format(parse(
          "t := u & [ PRED \"_dog_n_rel\", ARG index & #x, NUM 3, Y #x ].")));
  }

  @Test
  public void testDocstringAndAffix() throws UserException {
    assertEquals("#| Plural |#\n" +
                 "plur := %suffix (!s !ss) (ss sses)\n" +
                 "  lex-rule & [ NUM pl ].",
        formatter.format(parse(
          "#| Plural |#\nplur :=\n%suffix (!s !ss) (ss sses) " +
          "lex-rule & [ NUM pl ].")));
  }

  @Test
  public void testRoundTrips() throws UserException {
    checkRoundTrip(
        "type := super & [ ATTR1 < a . #rest >, ATTR2 #rest ].");
    checkRoundTrip("t :+ [ A.B.C \"s\\\"q\", A.D -4, E <! [ F g ], h !> ].");
    checkRoundTrip("t := a & [ L < [ X.Y z ], < >, < b, ... > > ].");
    checkRoundTrip("t := u & [ A typed & [ B x ], C [ ] ].");
    checkRoundTrip(
        "#| doc |#\nr := %prefix (* un) rule & [ SYNSEM.LOCAL.CAT #c, " +
        "DTR.SYNSEM.LOCAL.CAT #c ].");
  }

  @Test
  public void testRegex() throws UserException {
    assertEquals("t := u & [ ORTH ^[a-z]+$ ].",
                 formatter.format(parse("t := u & [ ORTH ^[a-z]+$ ].")));
    checkRoundTrip("t := ^.*-lex$ & [ A ^x\\$$ ].");
  }

  @Test
  public void testEnvironmentMarkers() {
    Environment types = new Environment(Environment.Kind.TYPE, null, null, 1);
    Environment lex = new Environment(Environment.Kind.INSTANCE,
                                      "lex-entry", types, 5);
    Environment plain = new Environment(Environment.Kind.INSTANCE,
                              Environment.DEFAULT_STATUS, null, 9);
    assertEquals(":begin :type.", formatter.begin(types));
    assertEquals(":begin :instance :status lex-entry.", formatter.begin(lex));
    assertEquals(":begin :instance.", formatter.begin(plain));
    assertEquals(":end :instance.", formatter.end(lex));
  }

  @Test
  public void testListFallsBackToFeatures() throws UserException {
    TypeDefinition def = parse("t := u & [ L < a > ].");
    def.get("L").getAVM().put("EXTRA", Conjunction.of(new TypeIdentifier("e")));
    String formatted = formatter.format(def);
    assertEquals(def, parse(formatted));
  }

  @Test
  public void testMorphSets() {
    assertEquals("%(letter-set (!v aeiou))",
                 formatter.format(new LetterSet("!v", "aeiou")));
    assertEquals("%(wild-card (?p ab\\)c!))",
                 formatter.format(new WildCard("?p", "ab)c!")));
  }

  @Test
  public void testFormattedMorphSetParses() throws UserException {
    LetterSet set = new LetterSet("!p", "a(b) '.\\");
    TDLParser parser = TDLParser.fromString(formatter.format(set));
    parser.next();
    assertEquals(set, parser.getLetterSets().get("!p"));
  }
}
