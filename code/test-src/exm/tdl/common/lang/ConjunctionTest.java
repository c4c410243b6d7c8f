package exm.tdl.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tdl.common.exceptions.UndefinedPathException;

public class ConjunctionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static TypeIdentifier type(String name) {
    return new TypeIdentifier(name);
  }

  private static Set<String> paths(Iterable<Feature> features) {
    Set<String> result = new HashSet<String>();
    for (Feature f: features) {
      result.add(f.getPath());
    }
    return result;
  }

  @Test
  public void testSetCreatesIntermediates() {
    TypeDefinition t = new TypeDefinition("t");
    t.set("SYNSEM.LOCAL.CAT", Conjunction.of(type("cat")));
    assertTrue(t.contains("SYNSEM"));
    assertTrue(t.contains("synsem.local"));
    assertEquals(Arrays.asList(type("cat")),
                 t.get("SYNSEM.LOCAL.CAT").getSupertypes());
  }

  @Test
  public void testSetOverwritesLeaf() {
    Conjunction c = new Conjunction();
    c.set("A", Conjunction.of(type("x")));
    Conjunction y = Conjunction.of(type("y"));
    c.set("a", y);
    assertSame(y, c.get("A"));
    assertEquals(1, c.getAVM().size());
  }

  @Test
  public void testGetUndefined() {
    TypeDefinition t = new TypeDefinition("t", DefinitionOperator.DEFINE, 7);
    t.set("A", Conjunction.of(type("x")));
    try {
      t.get("A.B");
    } catch (UndefinedPathException e) {
      assertEquals("A.B", e.getPath());
      assertEquals(7, e.getLine());
      return;
    }
    throw new AssertionError("A.B is undefined");
  }

  @Test
  public void testMalformedPath() {
    assertFalse(new Conjunction().contains("A..B"));
    exception.expect(UndefinedPathException.class);
    new Conjunction().set("A.", new Conjunction());
  }

  @Test
  public void testEmptyListMarker() {
    Conjunction c = new Conjunction();
    c.set("L", Conjunction.emptyList());
    assertTrue(c.get("L").isEmptyList());
    assertFalse(c.contains("L.FIRST"));
    exception.expect(UndefinedPathException.class);
    exception.expectMessage("empty list");
    c.set("L.FIRST", Conjunction.of(type("x")));
  }

  @Test
  public void testNoFeaturesThroughLiteral() {
    Conjunction c = new Conjunction();
    c.set("PRED", Conjunction.ofLiteral(new StringLiteral("_dog_n_rel")));
    exception.expect(UndefinedPathException.class);
    c.set("PRED.X", new Conjunction());
  }

  @Test
  public void testLiteralExcludesAVM() {
    Conjunction c = Conjunction.ofLiteral(new IntegerLiteral(3));
    exception.expect(IllegalStateException.class);
    c.getOrCreateAVM();
  }

  @Test
  public void testLocalConstraintsContainFeatures() {
    Conjunction c = new Conjunction();
    c.set("A.B", Conjunction.of(type("x")));
    Conjunction typed = Conjunction.of(type("t"));
    typed.set("D.E", Conjunction.of(type("y")));
    c.set("C", typed);
    Set<String> features = paths(c.features());
    Set<String> local = paths(c.localConstraints());
    assertEquals(new HashSet<String>(Arrays.asList("A.B", "C")), features);
    assertTrue(local.containsAll(features));
    assertTrue(local.contains("C.D.E"));
  }

  @Test
  public void testTraversalsAgreeWithoutTypes() {
    Conjunction c = new Conjunction();
    c.set("A.B", Conjunction.of(type("x")));
    c.set("A.C", Conjunction.ofLiteral(new StringLiteral("s")));
    c.set("D", new Conjunction());
    assertEquals(c.features(), c.localConstraints());
  }

  @Test
  public void testEqualityIgnoresOrder() {
    Conjunction a = new Conjunction();
    a.set("X", Conjunction.of(type("x")));
    a.set("Y", Conjunction.of(type("y")));
    Conjunction b = new Conjunction();
    b.set("y", Conjunction.of(type("Y")));
    b.set("x", Conjunction.of(type("X")));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  public void testEmptyAVMConstrainsNothing() {
    Conjunction a = Conjunction.of(type("x"));
    Conjunction b = Conjunction.of(type("x"));
    b.getOrCreateAVM();
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, Conjunction.emptyList());
  }

  @Test
  public void testLiteralsCaseSensitive() {
    assertNotEquals(new StringLiteral("a"), new StringLiteral("A"));
    assertEquals(type("a"), type("A"));
    assertNotEquals(new StringLiteral("3"), new IntegerLiteral(3));
  }

  @Test
  public void testStringLiteralValue() {
    assertEquals("say \"hi\"", new StringLiteral("say \\\"hi\\\"").getValue());
  }

  @Test
  public void testCoreferenceComplete() {
    Coreference c = new Coreference("#x");
    c.addPath("A");
    assertFalse(c.isComplete());
    c.addPath("B");
    assertTrue(c.isComplete());
    assertTrue(new Coreference(null).isAnonymous());
  }
}
