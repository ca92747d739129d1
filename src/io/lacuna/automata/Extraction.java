package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives an expression from an automaton by treating it as a system of equations over sets of states, and solving
 * that system by substitution.
 */
final class Extraction {

  private static final Logger log = LoggerFactory.getLogger(Extraction.class);

  private Extraction() {
  }

  /**
   * Every input leading to some state-set {@code R} is the union, over each state-set {@code L} which has a single
   * transition into {@code R}, of the inputs leading to {@code L} followed by that transition. The state-set of
   * every final state is the unknown we're after.
   */
  private static final class Equation<E> {

    final ISet<Integer> right;
    final LinearMap<ISet<Integer>, E> lefts = new LinearMap<>();

    // the inputs reaching `right` without passing through any other state-set, only ever the empty input until
    // other equations are substituted in
    E outside;

    private final ExpressionAlgebra<?, E> algebra;

    Equation(ISet<Integer> right, Automaton<?, ?> automaton, IList<E> symbols, ExpressionAlgebra<?, E> algebra) {
      this.right = right;
      this.algebra = algebra;

      for (int i = 0; i < symbols.size(); i++) {
        LinearSet<Integer> left = new LinearSet<>();
        for (int state = 0; state < automaton.size(); state++) {
          if (right.contains(automaton.target(state, i))) {
            left.add(state);
          }
        }
        add(left, symbols.nth(i));
      }

      if (right.contains(automaton.initialHandle())) {
        outside = algebra.emptyString();
      }
    }

    private void add(ISet<Integer> left, E e) {
      E prev = lefts.get(left, null);
      lefts.put(left, prev == null ? e : algebra.alternate(prev, e));
    }

    private void addOutside(E e) {
      outside = outside == null ? e : algebra.alternate(outside, e);
    }

    // "A0 | B1 | C2 = A" becomes "B10* | C20* = A"
    void applyLoops() {
      E loop = lefts.get(right, null);
      if (loop == null) {
        return;
      }

      lefts.remove(right);
      E star = algebra.star(loop);

      LinearList<ISet<Integer>> keys = new LinearList<>();
      lefts.keys().forEach(keys::addLast);
      for (ISet<Integer> left : keys) {
        lefts.put(left, algebra.concatenate(lefts.get(left, null), star));
      }

      if (outside != null) {
        outside = algebra.concatenate(outside, star);
      }
    }

    // replaces any reference to `other.right` with the ways of reaching `other.right`
    void eliminate(Equation<E> other) {
      E via = lefts.get(other.right, null);
      if (via == null) {
        return;
      }

      lefts.remove(other.right);

      for (ISet<Integer> left : other.lefts.keys()) {
        if (left.equals(other.right)) {
          throw new IllegalStateException("unresolved loop on " + other.right);
        }
        add(left, algebra.concatenate(other.lefts.get(left, null), via));
      }

      if (other.outside != null) {
        addOutside(algebra.concatenate(other.outside, via));
      }
    }
  }

  static <S, E> E extract(Automaton<S, ?> automaton, ExpressionAlgebra<S, E> algebra) {
    Alphabet<S> alphabet = automaton.alphabet();

    LinearList<E> symbols = new LinearList<>();
    for (Symbol<S> symbol : alphabet) {
      symbols.addLast(symbol.isOther()
              ? algebra.complement(alphabet.explicitSymbols())
              : algebra.symbols(LinearSet.of(symbol.value())));
    }

    LinearSet<Integer> finals = new LinearSet<>();
    for (int state = 0; state < automaton.size(); state++) {
      if (automaton.isFinalHandle(state)) {
        finals.add(state);
      }
    }

    LinearList<Equation<E>> equations = new LinearList<>();
    equations.addLast(new Equation<>(finals, automaton, symbols, algebra));

    LinearSet<ISet<Integer>> discovered = new LinearSet<>();
    discovered.add(finals);

    // equations grows as we go
    for (int i = 0; i < equations.size(); i++) {
      for (ISet<Integer> left : equations.nth(i).lefts.keys()) {
        if (!discovered.contains(left)) {
          discovered.add(left);
          equations.addLast(new Equation<>(left, automaton, symbols, algebra));
        }
      }
    }

    for (int i = (int) equations.size() - 1; i >= 0; i--) {
      Equation<E> equation = equations.nth(i);
      equation.applyLoops();
      for (int j = i - 1; j >= 0; j--) {
        equations.nth(j).eliminate(equation);
      }
    }

    log.debug("solved {} equations for {}", equations.size(), automaton);

    E result = equations.nth(0).outside;
    return result == null ? algebra.nothing() : result;
  }
}
