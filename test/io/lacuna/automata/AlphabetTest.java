package io.lacuna.automata;

import org.junit.Test;

import java.util.Arrays;
import java.util.Comparator;

import static org.junit.Assert.*;

public class AlphabetTest {

  @Test
  public void testOrdering() {
    Alphabet<Character> alphabet = Alphabet.chars("cabba", true);

    assertEquals(4, alphabet.size());
    assertEquals(Symbol.of('a'), alphabet.symbol(0));
    assertEquals(Symbol.of('b'), alphabet.symbol(1));
    assertEquals(Symbol.of('c'), alphabet.symbol(2));
    assertTrue(alphabet.symbol(3).isOther());
    assertTrue(alphabet.hasOther());
    assertFalse(Alphabet.chars("ab", false).hasOther());
    assertEquals("{a, b, c, <other>}", alphabet.toString());
  }

  @Test
  public void testCustomOrder() {
    Alphabet<String> alphabet = Alphabet.of(Comparator.reverseOrder(), Arrays.asList("x", "y", "z"), false);

    assertEquals(Symbol.of("z"), alphabet.symbol(0));
    assertEquals(2, alphabet.indexOf(Symbol.of("x")));
    assertEquals(-1, alphabet.indexOf(Symbol.other()));
  }

  @Test
  public void testRouting() {
    Alphabet<Character> open = Alphabet.chars("ab", true);
    assertEquals(1, open.route('b'));
    assertEquals(2, open.route('z'));

    Alphabet<Character> closed = Alphabet.chars("ab", false);
    assertEquals(0, closed.route('a'));
    try {
      closed.route('z');
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testEquality() {
    assertEquals(Alphabet.chars("ab", false), Alphabet.of(Arrays.asList('b', 'a')));
    assertEquals(Alphabet.chars("ab", true).hashCode(), Alphabet.withOther(Arrays.asList('b', 'a')).hashCode());
    assertNotEquals(Alphabet.chars("ab", false), Alphabet.chars("ab", true));
    assertNotEquals(Alphabet.chars("ab", false), Alphabet.chars("abc", false));
  }

  @Test
  public void testSymbols() {
    assertEquals(Symbol.of('a'), Symbol.of('a'));
    assertNotEquals(Symbol.of('a'), Symbol.other());
    assertSame(Symbol.other(), Symbol.other());
    assertEquals('a', (char) Symbol.of('a').value());
  }

  @Test(expected = IllegalStateException.class)
  public void testOtherHasNoValue() {
    Symbol.other().value();
  }
}
