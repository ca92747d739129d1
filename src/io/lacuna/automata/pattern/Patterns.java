package io.lacuna.automata.pattern;

import io.lacuna.automata.ExpressionAlgebra;
import io.lacuna.automata.pattern.Pattern.Alternation;
import io.lacuna.automata.pattern.Pattern.Concatenation;
import io.lacuna.automata.pattern.Pattern.Star;
import io.lacuna.automata.pattern.Pattern.SymbolClass;
import io.lacuna.bifurcan.*;

import java.util.ArrayList;
import java.util.Comparator;

import static io.lacuna.automata.pattern.Pattern.isEmptyString;
import static io.lacuna.automata.pattern.Pattern.isNothing;

/**
 * Builds {@link Pattern}s, simplifying as it goes:
 * <ul>
 *   <li>{@code nothing} is the identity of alternation, and the zero of concatenation</li>
 *   <li>the empty string is the identity of concatenation</li>
 *   <li>symbol classes within an alternation are merged into one</li>
 *   <li>nested concatenations and alternations are flattened</li>
 *   <li>{@code nothing*} and {@code ()*} are the empty string, {@code x**} is {@code x*}, {@code (x)?*} is {@code x*}</li>
 * </ul>
 *
 * @param <S> the type of concrete symbol values
 */
public final class Patterns<S> implements ExpressionAlgebra<S, Pattern<S>> {

  private final Comparator<? super S> order;

  /**
   * @param order the order in which symbols within a class are listed
   */
  public Patterns(Comparator<? super S> order) {
    this.order = order;
  }

  public static <S extends Comparable<? super S>> Patterns<S> natural() {
    return new Patterns<S>(Comparator.naturalOrder());
  }

  /// constants

  @Override
  public Pattern<S> nothing() {
    return new SymbolClass<>(new LinearList<S>().forked(), false);
  }

  @Override
  public Pattern<S> emptyString() {
    return new Concatenation<>(new LinearList<Pattern<S>>().forked());
  }

  /// symbols

  @Override
  public Pattern<S> symbols(ISet<S> symbols) {
    return symbolClass(symbols, false);
  }

  @Override
  public Pattern<S> complement(ISet<S> symbols) {
    return symbolClass(symbols, true);
  }

  @SafeVarargs
  public final Pattern<S> symbols(S... symbols) {
    return symbols(LinearSet.of(symbols));
  }

  private SymbolClass<S> symbolClass(Iterable<S> symbols, boolean negated) {
    ArrayList<S> sorted = new ArrayList<>();
    symbols.forEach(sorted::add);
    sorted.sort(order);

    LinearList<S> list = new LinearList<>();
    sorted.forEach(list::addLast);
    return new SymbolClass<>(list.forked(), negated);
  }

  private SymbolClass<S> union(SymbolClass<S> a, SymbolClass<S> b) {
    if (!a.isNegated() && !b.isNegated()) {
      return symbolClass(a.symbols().union(b.symbols()), false);
    } else if (a.isNegated() && b.isNegated()) {
      return symbolClass(a.symbols().intersection(b.symbols()), true);
    } else {
      SymbolClass<S> positive = a.isNegated() ? b : a;
      SymbolClass<S> negative = a.isNegated() ? a : b;
      return symbolClass(negative.symbols().difference(positive.symbols()), true);
    }
  }

  /// combinators

  @Override
  public Pattern<S> alternate(Pattern<S> a, Pattern<S> b) {
    if (isNothing(a)) {
      return b;
    } else if (isNothing(b)) {
      return a;
    } else if (a.equals(b)) {
      return a;
    }

    LinearList<Pattern<S>> options = new LinearList<>();
    int slot = -1;

    for (Pattern<S> p : options(a).concat(options(b))) {
      if (p instanceof SymbolClass) {
        SymbolClass<S> c = (SymbolClass<S>) p;
        if (slot < 0) {
          slot = (int) options.size();
          options.addLast(c);
        } else {
          options.set(slot, union((SymbolClass<S>) options.nth(slot), c));
        }
      } else if (!contains(options, p)) {
        options.addLast(p);
      }
    }

    return options.size() == 1 ? options.nth(0) : new Alternation<>(options.forked());
  }

  @Override
  public Pattern<S> concatenate(Pattern<S> a, Pattern<S> b) {
    if (isNothing(a) || isNothing(b)) {
      return nothing();
    } else if (isEmptyString(a)) {
      return b;
    } else if (isEmptyString(b)) {
      return a;
    }

    return new Concatenation<>(parts(a).concat(parts(b)).forked());
  }

  @Override
  public Pattern<S> star(Pattern<S> p) {
    if (isNothing(p) || isEmptyString(p)) {
      return emptyString();
    } else if (p instanceof Star) {
      return p;
    } else if (p instanceof Alternation && ((Alternation<S>) p).isOptional()) {
      Pattern<S> body = nothing();
      for (Pattern<S> option : ((Alternation<S>) p).options()) {
        if (!isEmptyString(option)) {
          body = alternate(body, option);
        }
      }
      return star(body);
    }

    return new Star<>(p);
  }

  ///

  private static <S> IList<Pattern<S>> options(Pattern<S> p) {
    return p instanceof Alternation ? ((Alternation<S>) p).options() : LinearList.of(p);
  }

  private static <S> IList<Pattern<S>> parts(Pattern<S> p) {
    return p instanceof Concatenation ? ((Concatenation<S>) p).parts() : LinearList.of(p);
  }

  private static <S> boolean contains(IList<Pattern<S>> list, Pattern<S> p) {
    for (Pattern<S> q : list) {
      if (q.equals(p)) {
        return true;
      }
    }
    return false;
  }
}
