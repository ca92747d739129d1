package io.lacuna.automata.pattern;

import io.lacuna.automata.Alphabet;
import io.lacuna.automata.Automaton;
import io.lacuna.bifurcan.LinearSet;
import org.junit.Test;

import java.util.Comparator;

import static io.lacuna.automata.Inputs.accepts;
import static org.junit.Assert.*;

public class PatternsTest {

  private static final Patterns<Character> P = Patterns.natural();

  private static final Pattern<Character> A = P.symbols('a');
  private static final Pattern<Character> B = P.symbols('b');
  private static final Pattern<Character> C = P.symbols('c');
  private static final Pattern<Character> D = P.symbols('d');

  @Test
  public void testRendering() {
    assertEquals("[]", P.nothing().toString());
    assertEquals("", P.emptyString().toString());
    assertEquals("a", A.toString());
    assertEquals("[ab]", P.symbols('b', 'a').toString());
    assertEquals(".", P.complement(LinearSet.<Character>of()).toString());
    assertEquals("[^ab]", P.complement(LinearSet.of('b', 'a')).toString());
    assertEquals("\\*", P.symbols('*').toString());
    assertEquals("[\\-a]", P.symbols('a', '-').toString());
  }

  @Test
  public void testCustomOrder() {
    Patterns<Character> reversed = new Patterns<>(Comparator.<Character>reverseOrder());
    assertEquals("[cba]", reversed.symbols('a', 'b', 'c').toString());
  }

  @Test
  public void testPrecedence() {
    assertEquals("ab|c", P.alternate(P.concatenate(A, B), C).toString());
    assertEquals("a(b|cd)", P.concatenate(A, P.alternate(B, P.concatenate(C, D))).toString());
    assertEquals("(ab)*", P.star(P.concatenate(A, B)).toString());
    assertEquals("[ab]*c", P.concatenate(P.star(P.alternate(A, B)), C).toString());
    assertEquals("(b|cd)*", P.star(P.alternate(B, P.concatenate(C, D))).toString());
  }

  @Test
  public void testOptional() {
    assertEquals("a?", P.alternate(A, P.emptyString()).toString());
    assertEquals("(ab)?", P.alternate(P.emptyString(), P.concatenate(A, B)).toString());
    assertEquals("(ab|cd)?", P.alternate(P.alternate(P.concatenate(A, B), P.emptyString()), P.concatenate(C, D)).toString());
    assertEquals("a?b", P.concatenate(P.alternate(A, P.emptyString()), B).toString());
  }

  @Test
  public void testIdentities() {
    assertEquals(A, P.alternate(A, P.nothing()));
    assertEquals(A, P.alternate(P.nothing(), A));
    assertEquals(A, P.alternate(A, A));
    assertEquals(P.nothing(), P.concatenate(A, P.nothing()));
    assertEquals(P.nothing(), P.concatenate(P.nothing(), A));
    assertEquals(A, P.concatenate(P.emptyString(), A));
    assertEquals(A, P.concatenate(A, P.emptyString()));
  }

  @Test
  public void testFlattening() {
    Pattern<Character> abc = P.concatenate(P.concatenate(A, B), C);
    assertEquals(P.concatenate(A, P.concatenate(B, C)), abc);
    assertEquals(3, ((Pattern.Concatenation<Character>) abc).parts().size());

    Pattern<Character> options = P.alternate(P.alternate(P.concatenate(A, B), P.concatenate(C, D)), P.concatenate(A, B));
    assertEquals("ab|cd", options.toString());
  }

  @Test
  public void testClassMerging() {
    assertEquals(P.symbols('a', 'b'), P.alternate(A, B));
    assertEquals("[abc]|cd", P.alternate(P.alternate(A, P.concatenate(C, D)), P.alternate(B, C)).toString());
    assertEquals("[^b]", P.alternate(P.complement(LinearSet.of('a', 'b')), A).toString());
    assertEquals("[^b]", P.alternate(P.complement(LinearSet.of('a', 'b')), P.complement(LinearSet.of('b', 'c'))).toString());
    assertEquals(".", P.alternate(P.complement(LinearSet.of('a')), A).toString());
  }

  @Test
  public void testStar() {
    assertEquals(P.emptyString(), P.star(P.nothing()));
    assertEquals(P.emptyString(), P.star(P.emptyString()));
    assertEquals(P.star(A), P.star(P.star(A)));
    assertEquals(P.star(A), P.star(P.alternate(A, P.emptyString())));
    assertEquals("a*", P.star(A).toString());
    assertEquals(P.concatenate(A, B), ((Pattern.Star<Character>) P.star(P.concatenate(A, B))).body());
  }

  @Test
  public void testToAutomaton() {
    Alphabet<Character> alphabet = Alphabet.chars("abcd", false);
    Automaton<Character, Integer> a = P.concatenate(A, P.alternate(B, P.concatenate(C, D))).toAutomaton(alphabet);

    assertTrue(accepts(a, "ab"));
    assertTrue(accepts(a, "acd"));
    assertFalse(accepts(a, "a"));
    assertFalse(accepts(a, "abcd"));
    assertFalse(accepts(a, "ac"));

    assertFalse(accepts(P.nothing().toAutomaton(alphabet), ""));
    assertTrue(accepts(P.emptyString().toAutomaton(alphabet), ""));
    assertTrue(accepts(P.star(P.concatenate(A, B)).toAutomaton(alphabet), "ababab"));
  }

  @Test
  public void testNegatedToAutomaton() {
    Alphabet<Character> alphabet = Alphabet.chars("ab", true);
    Automaton<Character, Integer> notA = P.complement(LinearSet.of('a')).toAutomaton(alphabet);

    assertFalse(accepts(notA, "a"));
    assertTrue(accepts(notA, "b"));
    assertTrue(accepts(notA, "z"));
    assertFalse(accepts(notA, "bz"));
  }
}
