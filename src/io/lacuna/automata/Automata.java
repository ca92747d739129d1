package io.lacuna.automata;

import io.lacuna.bifurcan.LinearList;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Factories for the basic automata the combinators in {@link Automaton} are built up from.
 */
public final class Automata {

  private Automata() {
  }

  /**
   * @return an automaton which accepts nothing, not even the empty input
   */
  public static <S> Automaton<S, Integer> nothing(Alphabet<S> alphabet) {
    return new Automaton<>(
            alphabet,
            LinearList.of(0),
            0,
            new boolean[]{false},
            new int[][]{new int[alphabet.size()]});
  }

  /**
   * @return an automaton which accepts only the empty input
   */
  public static <S> Automaton<S, Integer> epsilon(Alphabet<S> alphabet) {
    int[] dead = new int[alphabet.size()];
    Arrays.fill(dead, 1);

    return new Automaton<>(
            alphabet,
            LinearList.of(0, 1),
            0,
            new boolean[]{true, false},
            new int[][]{dead, dead.clone()});
  }

  /**
   * Each value is routed through the alphabet, so over an alphabet with a wildcard an unlisted value becomes a wildcard
   * transition, and any unlisted value is accepted in its position.
   *
   * @return an automaton which accepts exactly {@code input}, up to the routing of unlisted values
   * @throws IllegalArgumentException if {@code input} contains a value the alphabet can't route
   */
  public static <S> Automaton<S, Integer> sequence(Alphabet<S> alphabet, Iterable<S> input) {
    AutomatonBuilder<S, Integer> builder = new AutomatonBuilder<S, Integer>(alphabet).init(0);

    int state = 0;
    for (S s : input) {
      Symbol<S> symbol = alphabet.symbol(alphabet.route(s));
      builder.defaults(state, -1).transition(state, symbol, state + 1);
      state++;
    }

    return builder
            .defaults(state, -1)
            .defaults(-1, -1)
            .accept(state)
            .build()
            .renumber();
  }

  /**
   * @return an automaton which accepts any single symbol satisfying {@code predicate}
   */
  public static <S> Automaton<S, Integer> oneOf(Alphabet<S> alphabet, Predicate<Symbol<S>> predicate) {
    AutomatonBuilder<S, Integer> builder = new AutomatonBuilder<S, Integer>(alphabet)
            .init(0)
            .accept(1)
            .defaults(0, 2)
            .defaults(1, 2)
            .defaults(2, 2);

    for (Symbol<S> symbol : alphabet) {
      if (predicate.test(symbol)) {
        builder.transition(0, symbol, 1);
      }
    }
    return builder.build();
  }
}
