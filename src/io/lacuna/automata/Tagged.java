package io.lacuna.automata;

/**
 * A state handle tagged with the operand of a concatenation it belongs to.
 */
final class Tagged {

  enum Operand {
    LEFT,
    RIGHT
  }

  private final Operand operand;
  private final int state;

  private Tagged(Operand operand, int state) {
    this.operand = operand;
    this.state = state;
  }

  static Tagged left(int state) {
    return new Tagged(Operand.LEFT, state);
  }

  static Tagged right(int state) {
    return new Tagged(Operand.RIGHT, state);
  }

  boolean isLeft() {
    return operand == Operand.LEFT;
  }

  int state() {
    return state;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof Tagged) {
      Tagged t = (Tagged) o;
      return operand == t.operand && state == t.state;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return (state << 1) | operand.ordinal();
  }

  @Override
  public String toString() {
    return operand + "(" + state + ")";
  }
}
