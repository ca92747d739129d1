package io.lacuna.automata;

import io.lacuna.automata.InvalidAutomatonException.Kind;
import io.lacuna.bifurcan.*;

/**
 * A mutable helper for assembling an {@link Automaton} state by state. Nothing is checked until {@link #build()}.
 *
 * @param <S> the type of concrete symbol values
 * @param <Q> the type of state labels
 */
public class AutomatonBuilder<S, Q> {

  private final Alphabet<S> alphabet;

  private Q init;
  private final LinearSet<Q> states = new LinearSet<>();
  private final LinearSet<Q> accept = new LinearSet<>();
  private final LinearMap<Q, LinearMap<Symbol<S>, Q>> transitions = new LinearMap<>();
  private final LinearMap<Q, Q> defaults = new LinearMap<>();

  public AutomatonBuilder(Alphabet<S> alphabet) {
    this.alphabet = alphabet;
  }

  /// states

  /**
   * @return the current builder, with {@code state} added
   */
  public AutomatonBuilder<S, Q> state(Q state) {
    states.add(state);

    return this;
  }

  /**
   * @return the current builder, with {@code states} added
   */
  @SafeVarargs
  public final AutomatonBuilder<S, Q> states(Q... states) {
    for (Q q : states) {
      state(q);
    }

    return this;
  }

  /**
   * @return the current builder, with {@code state} as the initial state
   */
  public AutomatonBuilder<S, Q> init(Q state) {
    init = state;
    states.add(state);

    return this;
  }

  /**
   * @return the current builder, with {@code state} marked as accepting
   */
  public AutomatonBuilder<S, Q> accept(Q state) {
    accept.add(state);
    states.add(state);

    return this;
  }

  /// transitions

  /**
   * @return the current builder, with {@code from} moving to {@code to} on {@code value}
   */
  public AutomatonBuilder<S, Q> transition(Q from, S value, Q to) {
    return transition(from, Symbol.of(value), to);
  }

  /**
   * @return the current builder, with {@code from} moving to {@code to} on {@code symbol}
   */
  public AutomatonBuilder<S, Q> transition(Q from, Symbol<S> symbol, Q to) {
    states.add(from).add(to);

    LinearMap<Symbol<S>, Q> row = transitions.get(from, null);
    if (row == null) {
      row = new LinearMap<>();
      transitions.put(from, row);
    }
    row.put(symbol, to);

    return this;
  }

  /**
   * @return the current builder, with {@code from} moving to {@code to} on the wildcard
   */
  public AutomatonBuilder<S, Q> other(Q from, Q to) {
    return transition(from, Symbol.<S>other(), to);
  }

  /**
   * @return the current builder, with {@code from} moving to {@code to} on every symbol without an explicit
   * transition
   */
  public AutomatonBuilder<S, Q> defaults(Q from, Q to) {
    states.add(from).add(to);
    defaults.put(from, to);

    return this;
  }

  ///

  /**
   * @throws InvalidAutomatonException if the builder doesn't describe a valid automaton
   */
  public Automaton<S, Q> build() {
    if (init == null) {
      throw new InvalidAutomatonException(Kind.INITIAL_NOT_A_STATE, "no initial state");
    }

    LinearMap<Q, IMap<Symbol<S>, Q>> rows = new LinearMap<>();
    for (Q q : states) {
      LinearMap<Symbol<S>, Q> row = new LinearMap<>();
      LinearMap<Symbol<S>, Q> explicit = transitions.get(q, null);
      if (explicit != null) {
        explicit.forEach(e -> row.put(e.key(), e.value()));
      }

      Q fallback = defaults.get(q, null);
      if (fallback != null) {
        for (Symbol<S> symbol : alphabet) {
          if (!row.contains(symbol)) {
            row.put(symbol, fallback);
          }
        }
      }

      if (explicit != null || fallback != null) {
        rows.put(q, row);
      }
    }

    return Automaton.of(alphabet, states, init, accept, rows);
  }
}
