package io.lacuna.automata;

import java.util.Objects;

/**
 * A member of an {@link Alphabet}: either a concrete value, or the wildcard standing for every value the alphabet
 * doesn't list.
 *
 * @param <S> the type of concrete symbol values
 */
public final class Symbol<S> {

  private static final Symbol OTHER = new Symbol<>(null);

  private final S value;

  private Symbol(S value) {
    this.value = value;
  }

  public static <S> Symbol<S> of(S value) {
    return new Symbol<>(Objects.requireNonNull(value));
  }

  /**
   * @return the wildcard symbol, matching any value not explicitly listed in an alphabet
   */
  public static <S> Symbol<S> other() {
    return OTHER;
  }

  public boolean isOther() {
    return this == OTHER;
  }

  /**
   * @throws IllegalStateException if this is the wildcard
   */
  public S value() {
    if (isOther()) {
      throw new IllegalStateException("the wildcard has no value");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof Symbol) {
      Symbol<?> s = (Symbol<?>) o;
      return !isOther() && !s.isOther() && value.equals(s.value);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return isOther() ? 0 : value.hashCode();
  }

  @Override
  public String toString() {
    return isOther() ? "<other>" : String.valueOf(value);
  }
}
