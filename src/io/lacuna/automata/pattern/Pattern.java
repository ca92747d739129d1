package io.lacuna.automata.pattern;

import io.lacuna.automata.Alphabet;
import io.lacuna.automata.Automata;
import io.lacuna.automata.Automaton;
import io.lacuna.automata.Symbol;
import io.lacuna.bifurcan.*;

/**
 * An immutable regular expression over symbols of type {@code S}. Instances are created through {@link Patterns},
 * which keeps them in a simplified form.
 *
 * @param <S> the type of concrete symbol values
 */
public abstract class Pattern<S> {

  // binding strength, loosest first
  static final int ALTERNATION = 0;
  static final int CONCATENATION = 1;
  static final int ATOM = 2;

  private static final String SPECIAL = "\\^$.|?*+()[]{}-";

  Pattern() {
  }

  /**
   * @return an automaton over {@code alphabet} accepting exactly the inputs this pattern matches
   */
  public abstract Automaton<S, Integer> toAutomaton(Alphabet<S> alphabet);

  abstract int precedence();

  abstract void render(StringBuilder sb);

  void render(StringBuilder sb, int context) {
    if (precedence() < context) {
      sb.append('(');
      render(sb);
      sb.append(')');
    } else {
      render(sb);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    render(sb);
    return sb.toString();
  }

  /**
   * A single symbol drawn from a set, or from everything outside a set. The empty, non-negated class matches
   * nothing at all.
   */
  public static final class SymbolClass<S> extends Pattern<S> {

    private final IList<S> symbols;
    private final ISet<S> members;
    private final boolean negated;

    SymbolClass(IList<S> symbols, boolean negated) {
      LinearSet<S> members = new LinearSet<>();
      symbols.forEach(members::add);

      this.symbols = symbols;
      this.members = members.forked();
      this.negated = negated;
    }

    public ISet<S> symbols() {
      return members;
    }

    public boolean isNegated() {
      return negated;
    }

    public boolean isNothing() {
      return !negated && members.size() == 0;
    }

    public boolean matches(Symbol<S> symbol) {
      return symbol.isOther() ? negated : members.contains(symbol.value()) != negated;
    }

    @Override
    public Automaton<S, Integer> toAutomaton(Alphabet<S> alphabet) {
      return Automata.oneOf(alphabet, this::matches);
    }

    @Override
    int precedence() {
      return ATOM;
    }

    @Override
    void render(StringBuilder sb) {
      if (symbols.size() == 0) {
        sb.append(negated ? "." : "[]");
      } else if (symbols.size() == 1 && !negated) {
        escape(sb, symbols.nth(0));
      } else {
        sb.append(negated ? "[^" : "[");
        symbols.forEach(s -> escape(sb, s));
        sb.append(']');
      }
    }

    private static void escape(StringBuilder sb, Object symbol) {
      String s = String.valueOf(symbol);
      if (s.length() == 1 && SPECIAL.indexOf(s.charAt(0)) >= 0) {
        sb.append('\\');
      }
      sb.append(s);
    }

    @Override
    public boolean equals(Object o) {
      if (o instanceof SymbolClass) {
        SymbolClass<?> c = (SymbolClass<?>) o;
        return negated == c.negated && members.equals(c.members);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return members.hashCode() * 31 + (negated ? 1 : 0);
    }
  }

  /**
   * A sequence of patterns. The empty sequence matches only the empty input.
   */
  public static final class Concatenation<S> extends Pattern<S> {

    private final IList<Pattern<S>> parts;

    Concatenation(IList<Pattern<S>> parts) {
      this.parts = parts;
    }

    public IList<Pattern<S>> parts() {
      return parts;
    }

    public boolean isEmptyString() {
      return parts.size() == 0;
    }

    @Override
    public Automaton<S, Integer> toAutomaton(Alphabet<S> alphabet) {
      Automaton<S, Integer> result = Automata.epsilon(alphabet);
      for (Pattern<S> p : parts) {
        result = result.concat(p.toAutomaton(alphabet));
      }
      return result;
    }

    @Override
    int precedence() {
      return CONCATENATION;
    }

    @Override
    void render(StringBuilder sb) {
      parts.forEach(p -> p.render(sb, CONCATENATION));
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Concatenation && parts.equals(((Concatenation<?>) o).parts);
    }

    @Override
    public int hashCode() {
      return parts.hashCode();
    }
  }

  /**
   * A choice between patterns. If one of the options is the empty string, this renders as an optional pattern.
   */
  public static final class Alternation<S> extends Pattern<S> {

    private final IList<Pattern<S>> options;

    Alternation(IList<Pattern<S>> options) {
      this.options = options;
    }

    public IList<Pattern<S>> options() {
      return options;
    }

    public boolean isOptional() {
      for (Pattern<S> p : options) {
        if (isEmptyString(p)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Automaton<S, Integer> toAutomaton(Alphabet<S> alphabet) {
      Automaton<S, Integer> result = Automata.nothing(alphabet);
      for (Pattern<S> p : options) {
        result = result.union(p.toAutomaton(alphabet));
      }
      return result;
    }

    @Override
    int precedence() {
      return isOptional() ? ATOM : ALTERNATION;
    }

    @Override
    void render(StringBuilder sb) {
      LinearList<Pattern<S>> rest = new LinearList<>();
      options.forEach(p -> {
        if (!isEmptyString(p)) {
          rest.addLast(p);
        }
      });

      if (rest.size() == options.size()) {
        join(sb, rest);
      } else if (rest.size() == 1) {
        rest.nth(0).render(sb, ATOM);
        sb.append('?');
      } else {
        sb.append('(');
        join(sb, rest);
        sb.append(")?");
      }
    }

    private static <S> void join(StringBuilder sb, IList<Pattern<S>> options) {
      for (int i = 0; i < options.size(); i++) {
        if (i > 0) {
          sb.append('|');
        }
        options.nth(i).render(sb, CONCATENATION);
      }
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Alternation && options.equals(((Alternation<?>) o).options);
    }

    @Override
    public int hashCode() {
      return options.hashCode() * 31 + 1;
    }
  }

  /**
   * Zero or more repetitions of a pattern.
   */
  public static final class Star<S> extends Pattern<S> {

    private final Pattern<S> body;

    Star(Pattern<S> body) {
      this.body = body;
    }

    public Pattern<S> body() {
      return body;
    }

    @Override
    public Automaton<S, Integer> toAutomaton(Alphabet<S> alphabet) {
      return body.toAutomaton(alphabet).star();
    }

    @Override
    int precedence() {
      return ATOM;
    }

    @Override
    void render(StringBuilder sb) {
      body.render(sb, ATOM);
      sb.append('*');
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Star && body.equals(((Star<?>) o).body);
    }

    @Override
    public int hashCode() {
      return body.hashCode() * 31 + 2;
    }
  }

  static boolean isEmptyString(Pattern<?> p) {
    return p instanceof Concatenation && ((Concatenation<?>) p).isEmptyString();
  }

  static boolean isNothing(Pattern<?> p) {
    return p instanceof SymbolClass && ((SymbolClass<?>) p).isNothing();
  }
}
