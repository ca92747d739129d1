package io.lacuna.automata;

/**
 * Thrown when the parts handed to {@link Automaton#of} don't describe a valid deterministic automaton.
 */
public class InvalidAutomatonException extends RuntimeException {

  public enum Kind {
    INITIAL_NOT_A_STATE,
    FINALS_NOT_STATES,
    INVALID_TRANSITIONS
  }

  private final Kind kind;

  public InvalidAutomatonException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
