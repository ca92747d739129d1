package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;

/**
 * The operations {@link Automaton#pattern(ExpressionAlgebra)} needs to describe an automaton's language. Alternation
 * plays the role of addition and concatenation of multiplication.
 *
 * @param <S> the type of concrete symbol values
 * @param <E> the type of expressions
 */
public interface ExpressionAlgebra<S, E> {

  /**
   * @return an expression matching nothing, not even the empty input
   */
  E nothing();

  /**
   * @return an expression matching only the empty input
   */
  E emptyString();

  /**
   * @return an expression matching any one of {@code symbols}
   */
  E symbols(ISet<S> symbols);

  /**
   * @return an expression matching any one symbol which is not in {@code symbols}
   */
  E complement(ISet<S> symbols);

  E alternate(E a, E b);

  E concatenate(E a, E b);

  /**
   * @return an expression matching zero or more repetitions of {@code e}
   */
  E star(E e);
}
