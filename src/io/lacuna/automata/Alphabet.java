package io.lacuna.automata;

import io.lacuna.bifurcan.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;

/**
 * An immutable, totally ordered set of symbols. Concrete symbols are sorted by a comparator, and the wildcard, if
 * present, always comes last. Every procedure which walks the alphabet does so in this order, which is what makes
 * the output of {@link Crawl} and {@link Extraction} reproducible.
 *
 * @param <S> the type of concrete symbol values
 */
public final class Alphabet<S> implements Iterable<Symbol<S>> {

  private final IList<Symbol<S>> symbols;
  private final IMap<Symbol<S>, Integer> indices;
  private final ISet<S> explicit;
  private final boolean other;

  private Alphabet(IList<Symbol<S>> symbols, ISet<S> explicit, boolean other) {
    this.symbols = symbols;
    this.explicit = explicit;
    this.other = other;

    LinearMap<Symbol<S>, Integer> indices = new LinearMap<>();
    for (int i = 0; i < symbols.size(); i++) {
      indices.put(symbols.nth(i), i);
    }
    this.indices = indices.forked();
  }

  /// factories

  public static <S extends Comparable<? super S>> Alphabet<S> of(Iterable<S> symbols) {
    return of(Comparator.naturalOrder(), symbols, false);
  }

  /**
   * @return an alphabet of {@code symbols}, plus the wildcard
   */
  public static <S extends Comparable<? super S>> Alphabet<S> withOther(Iterable<S> symbols) {
    return of(Comparator.naturalOrder(), symbols, true);
  }

  /**
   * @return an alphabet of each distinct character in {@code symbols}
   */
  public static Alphabet<Character> chars(CharSequence symbols, boolean other) {
    ArrayList<Character> cs = new ArrayList<>();
    symbols.chars().forEach(c -> cs.add((char) c));
    return of(Comparator.naturalOrder(), cs, other);
  }

  public static <S> Alphabet<S> of(Comparator<? super S> order, Iterable<S> symbols, boolean other) {
    ArrayList<S> sorted = new ArrayList<>();
    symbols.forEach(s -> sorted.add(Objects.requireNonNull(s)));
    sorted.sort(order);

    LinearList<Symbol<S>> list = new LinearList<>();
    LinearSet<S> explicit = new LinearSet<>();
    for (S s : sorted) {
      if (!explicit.contains(s)) {
        explicit.add(s);
        list.addLast(Symbol.of(s));
      }
    }

    if (other) {
      list.addLast(Symbol.other());
    }

    return new Alphabet<>(list.forked(), explicit.forked(), other);
  }

  /// queries

  public int size() {
    return (int) symbols.size();
  }

  public Symbol<S> symbol(int index) {
    return symbols.nth(index);
  }

  /**
   * @return the position of {@code symbol} in this alphabet, or {@code -1} if it isn't a member
   */
  public int indexOf(Symbol<S> symbol) {
    return indices.get(symbol, -1);
  }

  public boolean contains(Symbol<S> symbol) {
    return indices.contains(symbol);
  }

  /**
   * @return the index of the symbol which consumes {@code value}: its own, if listed, or the wildcard's
   * @throws IllegalArgumentException if {@code value} is unlisted and there is no wildcard
   */
  public int route(S value) {
    int idx = indexOf(Symbol.of(value));
    if (idx >= 0) {
      return idx;
    } else if (other) {
      return size() - 1;
    }
    throw new IllegalArgumentException("symbol " + value + " is not in " + this);
  }

  public boolean hasOther() {
    return other;
  }

  /**
   * @return the concrete symbols, in alphabet order
   */
  public ISet<S> explicitSymbols() {
    return explicit;
  }

  @Override
  public Iterator<Symbol<S>> iterator() {
    return symbols.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof Alphabet) {
      Alphabet<?> a = (Alphabet<?>) o;
      return other == a.other && explicit.equals(a.explicit);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return explicit.hashCode() * 31 + (other ? 1 : 0);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    symbols.forEach(s -> sb.append(s).append(", "));
    if (symbols.size() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    return sb.append("}").toString();
  }
}
