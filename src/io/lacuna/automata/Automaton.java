package io.lacuna.automata;

import io.lacuna.automata.InvalidAutomatonException.Kind;
import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * An immutable deterministic finite automaton with a total transition function.
 * <p>
 * States are arbitrary non-null labels, but internally each one is a dense integer handle, and every operation is
 * carried out on handles. Operations which combine or modify automata always return a new automaton, labelled with
 * consecutive integers when the states had to be rebuilt.
 *
 * @param <S> the type of concrete symbol values
 * @param <Q> the type of state labels
 */
public final class Automaton<S, Q> {

  private static final Logger log = LoggerFactory.getLogger(Automaton.class);

  // the start and accept marker of star(), never a valid handle
  private static final int OMEGA = -1;

  private final Alphabet<S> alphabet;
  private final IList<Q> labels;
  private final IMap<Q, Integer> handles;
  private final int initial;
  private final boolean[] finals;
  private final int[][] transitions;

  Automaton(Alphabet<S> alphabet, IList<Q> labels, int initial, boolean[] finals, int[][] transitions) {
    int n = (int) labels.size();

    if (initial < 0 || initial >= n) {
      throw new InvalidAutomatonException(Kind.INITIAL_NOT_A_STATE, "initial state " + initial + " not in " + labels);
    }
    if (finals.length != n) {
      throw new InvalidAutomatonException(Kind.FINALS_NOT_STATES, "final states don't match " + labels);
    }
    if (transitions.length != n) {
      throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS, "transitions don't match " + labels);
    }
    for (int[] row : transitions) {
      if (row.length != alphabet.size()) {
        throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS, "transitions don't cover " + alphabet);
      }
      for (int t : row) {
        if (t < 0 || t >= n) {
          throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS, "state " + t + " not in " + labels);
        }
      }
    }

    LinearMap<Q, Integer> handles = new LinearMap<>();
    for (int i = 0; i < n; i++) {
      handles.put(labels.nth(i), i);
    }

    this.alphabet = alphabet;
    this.labels = labels;
    this.handles = handles.forked();
    this.initial = initial;
    this.finals = finals;
    this.transitions = transitions;
  }

  /**
   * Builds and validates an automaton.
   *
   * @param alphabet the symbols consumed by the automaton
   * @param states every state
   * @param initial the start state, which must be in {@code states}
   * @param finals the accepting states, which must be a subset of {@code states}
   * @param transitions for every state, the target state of every symbol in {@code alphabet}, and nothing else
   * @throws InvalidAutomatonException if any of the above doesn't hold
   */
  public static <S, Q> Automaton<S, Q> of(
          Alphabet<S> alphabet,
          Iterable<Q> states,
          Q initial,
          Iterable<Q> finals,
          IMap<Q, ? extends IMap<Symbol<S>, Q>> transitions) {

    Objects.requireNonNull(alphabet);
    Objects.requireNonNull(initial);

    LinearList<Q> labels = new LinearList<>();
    LinearMap<Q, Integer> handles = new LinearMap<>();
    for (Q q : states) {
      Objects.requireNonNull(q, "states can't be null");
      if (!handles.contains(q)) {
        handles.put(q, (int) labels.size());
        labels.addLast(q);
      }
    }

    int n = (int) labels.size();

    int init = handles.get(initial, -1);
    if (init < 0) {
      throw new InvalidAutomatonException(Kind.INITIAL_NOT_A_STATE,
              "initial state " + initial + " not in " + labels);
    }

    boolean[] accept = new boolean[n];
    for (Q q : finals) {
      int h = q == null ? -1 : handles.get(q, -1);
      if (h < 0) {
        throw new InvalidAutomatonException(Kind.FINALS_NOT_STATES, "final state " + q + " not in " + labels);
      }
      accept[h] = true;
    }

    for (Q q : transitions.keys()) {
      if (!handles.contains(q)) {
        throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS,
                "transitions from " + q + ", which is not in " + labels);
      }
    }

    int[][] table = new int[n][alphabet.size()];
    for (int h = 0; h < n; h++) {
      Q q = labels.nth(h);
      IMap<Symbol<S>, Q> row = transitions.get(q, null);
      if (row == null) {
        throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS, "state " + q + " has no transitions");
      }

      for (Symbol<S> symbol : row.keys()) {
        if (!alphabet.contains(symbol)) {
          throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS,
                  "symbol " + symbol + " from state " + q + " not in " + alphabet);
        }
      }

      for (int i = 0; i < alphabet.size(); i++) {
        Symbol<S> symbol = alphabet.symbol(i);
        Q target = row.get(symbol, null);
        if (target == null) {
          throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS,
                  "state " + q + " has no transition for " + symbol);
        }

        int t = handles.get(target, -1);
        if (t < 0) {
          throw new InvalidAutomatonException(Kind.INVALID_TRANSITIONS,
                  "state " + target + " not in " + labels);
        }
        table[h][i] = t;
      }
    }

    return new Automaton<>(alphabet, labels.forked(), init, accept, table);
  }

  /// queries

  public Alphabet<S> alphabet() {
    return alphabet;
  }

  public int size() {
    return (int) labels.size();
  }

  public ISet<Q> states() {
    return handles.keys();
  }

  public Q initial() {
    return labels.nth(initial);
  }

  public ISet<Q> finals() {
    LinearSet<Q> result = new LinearSet<>();
    for (int h = 0; h < finals.length; h++) {
      if (finals[h]) {
        result.add(labels.nth(h));
      }
    }
    return result.forked();
  }

  public boolean isFinal(Q state) {
    return finals[handle(state)];
  }

  /**
   * @return the state reached from {@code state} by consuming {@code symbol}
   */
  public Q next(Q state, Symbol<S> symbol) {
    int i = alphabet.indexOf(symbol);
    if (i < 0) {
      throw new IllegalArgumentException("symbol " + symbol + " not in " + alphabet);
    }
    return labels.nth(transitions[handle(state)][i]);
  }

  /**
   * Values which aren't listed in the alphabet are consumed by the wildcard, if there is one.
   *
   * @return true if consuming {@code input} from the initial state ends in a final state
   * @throws IllegalArgumentException if {@code input} contains a value the alphabet can't route
   */
  public boolean accepts(Iterable<S> input) {
    int state = initial;
    for (S s : input) {
      state = transitions[state][alphabet.route(s)];
    }
    return finals[state];
  }

  /**
   * Two states are equivalent if they have the same finality, and the same transitions once {@code b} is treated as
   * another name for {@code a}. This only looks a single step ahead; {@link #automerge()} applies it repeatedly.
   */
  public boolean equivalent(Q a, Q b) {
    return equivalent(handle(a), handle(b), finals, transitions);
  }

  private static boolean equivalent(int a, int b, boolean[] finals, int[][] transitions) {
    if (finals[a] != finals[b]) {
      return false;
    }

    int[] x = transitions[a];
    int[] y = transitions[b];
    for (int i = 0; i < x.length; i++) {
      int p = x[i] == b ? a : x[i];
      int q = y[i] == b ? a : y[i];
      if (p != q) {
        return false;
      }
    }
    return true;
  }

  /// transformations

  /**
   * If {@code replacement} is already a state, {@code state} is merged into it: every transition into {@code state}
   * is redirected, and {@code state}'s own transitions are dropped. Otherwise {@code state} is simply renamed.
   *
   * @return an automaton with every reference to {@code state} rewritten to {@code replacement}
   */
  public Automaton<S, Q> replace(Q state, Q replacement) {
    int from = handle(state);
    Objects.requireNonNull(replacement);

    if (state.equals(replacement)) {
      return this;
    }

    int into = handles.get(replacement, -1);
    if (into >= 0) {
      return merge(from, into);
    }

    LinearList<Q> renamed = new LinearList<>();
    for (int h = 0; h < size(); h++) {
      renamed.addLast(h == from ? replacement : labels.nth(h));
    }
    return new Automaton<>(alphabet, renamed.forked(), initial, finals.clone(), copy(transitions));
  }

  /**
   * Merges equivalent states until there are none left. Merging two states may make two others equivalent, so after
   * each merge the search starts over; each merge removes a state, so this always terminates.
   *
   * @return an automaton where no two distinct states are {@link #equivalent(Object, Object)}
   */
  public Automaton<S, Q> automerge() {
    Automaton<S, Q> result = this;
    for (; ; ) {
      Automaton<S, Q> merged = result.mergeFirstEquivalent();
      if (merged == null) {
        break;
      }
      result = merged;
    }

    if (log.isDebugEnabled()) {
      log.debug("merged {} equivalent states, {} remain", size() - result.size(), result.size());
    }
    return result;
  }

  // merges the first equivalent pair in handle order, keeping the lower handle, or returns null
  private Automaton<S, Q> mergeFirstEquivalent() {
    int n = size();
    for (int a = 0; a < n; a++) {
      for (int b = a + 1; b < n; b++) {
        if (equivalent(a, b, finals, transitions)) {
          return merge(b, a);
        }
      }
    }
    return null;
  }

  private Automaton<S, Q> merge(int from, int into) {
    int n = size();

    int[] remap = new int[n];
    int idx = 0;
    for (int h = 0; h < n; h++) {
      if (h != from) {
        remap[h] = idx++;
      }
    }
    remap[from] = remap[into];

    LinearList<Q> merged = new LinearList<>();
    boolean[] accept = new boolean[n - 1];
    int[][] table = new int[n - 1][];
    for (int h = 0; h < n; h++) {
      if (h == from) {
        continue;
      }
      merged.addLast(labels.nth(h));
      accept[remap[h]] = finals[h];

      int[] row = new int[alphabet.size()];
      for (int i = 0; i < row.length; i++) {
        row[i] = remap[transitions[h][i]];
      }
      table[remap[h]] = row;
    }

    if (finals[from]) {
      accept[remap[into]] = true;
    }

    return new Automaton<>(alphabet, merged.forked(), remap[initial], accept, table);
  }

  /**
   * Relabels the states as {@code 0..n-1}, in breadth-first order from the initial state, following the alphabet's
   * order. Unreachable states come last, in their current order. The initial state is always {@code 0}.
   */
  public Automaton<S, Integer> renumber() {
    int n = size();

    int[] position = new int[n];
    Arrays.fill(position, -1);

    int count = 0;
    position[initial] = count++;
    LinearList<Integer> queue = LinearList.of(initial);
    while (queue.size() > 0) {
      int s = queue.popFirst();
      for (int t : transitions[s]) {
        if (position[t] < 0) {
          position[t] = count++;
          queue.addLast(t);
        }
      }
    }

    for (int h = 0; h < n; h++) {
      if (position[h] < 0) {
        position[h] = count++;
      }
    }

    LinearList<Integer> numbers = new LinearList<>();
    boolean[] accept = new boolean[n];
    int[][] table = new int[n][alphabet.size()];
    for (int h = 0; h < n; h++) {
      numbers.addLast(h);
      accept[position[h]] = finals[h];
      for (int i = 0; i < alphabet.size(); i++) {
        table[position[h]][i] = position[transitions[h][i]];
      }
    }

    return new Automaton<>(alphabet, numbers.forked(), position[initial], accept, table);
  }

  /// combinators

  /**
   * @return an automaton accepting any input accepted by this automaton, followed by any input accepted by
   * {@code other}
   */
  public Automaton<S, Integer> concat(Automaton<S, ?> other) {
    requireSameAlphabet(other);

    // entering the right side is only final if the right side accepts the empty input
    boolean bypass = other.finals[other.initial];

    LinearSet<Tagged> init = LinearSet.of(Tagged.left(initial));
    if (finals[initial]) {
      init.add(Tagged.right(other.initial));
    }

    return Crawl.crawl(
            alphabet,
            (ISet<Tagged>) init,
            set -> {
              for (Tagged t : set) {
                if (t.isLeft() ? finals[t.state()] && bypass : other.finals[t.state()]) {
                  return true;
                }
              }
              return false;
            },
            (set, symbol) -> {
              int i = alphabet.indexOf(symbol);
              int j = other.alphabet.indexOf(symbol);

              LinearSet<Tagged> next = new LinearSet<>();
              for (Tagged t : set) {
                if (t.isLeft()) {
                  int s = transitions[t.state()][i];
                  next.add(Tagged.left(s));
                  if (finals[s]) {
                    next.add(Tagged.right(other.initial));
                  }
                } else {
                  next.add(Tagged.right(other.transitions[t.state()][j]));
                }
              }
              return next;
            });
  }

  /**
   * @return an automaton accepting any input accepted by either this automaton or {@code other}
   */
  public Automaton<S, Integer> union(Automaton<S, ?> other) {
    return product(other, (a, b) -> a || b);
  }

  /**
   * @return an automaton accepting any input accepted by both this automaton and {@code other}
   */
  public Automaton<S, Integer> intersection(Automaton<S, ?> other) {
    return product(other, (a, b) -> a && b);
  }

  private Automaton<S, Integer> product(Automaton<S, ?> other, BiPredicate<Boolean, Boolean> accept) {
    requireSameAlphabet(other);

    return Crawl.crawl(
            alphabet,
            (IList<Integer>) LinearList.of(initial, other.initial),
            pair -> accept.test(finals[pair.nth(0)], other.finals[pair.nth(1)]),
            (pair, symbol) -> LinearList.of(
                    transitions[pair.nth(0)][alphabet.indexOf(symbol)],
                    other.transitions[pair.nth(1)][other.alphabet.indexOf(symbol)]));
  }

  /**
   * Rather than wiring each final state back to the initial state, which would let a partial match restart halfway
   * through (consider {@code (b*ab)*}), this adds a distinct start state which is the only accepting state, behaves
   * like the original initial state, and is re-entered whenever an original final state is reached.
   *
   * @return an automaton accepting zero or more repetitions of this automaton's inputs
   */
  public Automaton<S, Integer> star() {
    return Crawl.crawl(
            alphabet,
            (ISet<Integer>) LinearSet.of(OMEGA),
            set -> set.contains(OMEGA),
            (set, symbol) -> {
              int i = alphabet.indexOf(symbol);

              LinearSet<Integer> next = new LinearSet<>();
              for (int s : set) {
                int t = transitions[s == OMEGA ? initial : s][i];
                next.add(t);
                if (finals[t]) {
                  next.add(OMEGA);
                }
              }
              return next;
            });
  }

  /**
   * @return an automaton accepting this automaton's inputs, or the empty input
   */
  public Automaton<S, Integer> maybe() {
    return union(Automata.epsilon(alphabet));
  }

  /**
   * @return an automaton accepting between {@code min} and {@code max} repetitions of this automaton's inputs
   */
  public Automaton<S, Integer> repeat(int min, int max) {
    if (min < 0 || max < min) {
      throw new IllegalArgumentException("invalid repetition bounds (" + min + ", " + max + ")");
    }

    Automaton<S, Integer> result = times(min);
    if (max > min) {
      Automaton<S, Integer> optional = maybe();
      for (int i = min; i < max; i++) {
        result = result.concat(optional);
      }
    }
    return result;
  }

  /**
   * @return an automaton accepting {@code min} or more repetitions of this automaton's inputs
   */
  public Automaton<S, Integer> repeatAtLeast(int min) {
    if (min < 0) {
      throw new IllegalArgumentException("invalid repetition bounds (" + min + ", )");
    }
    return times(min).concat(star());
  }

  private Automaton<S, Integer> times(int n) {
    Automaton<S, Integer> result = Automata.epsilon(alphabet);
    for (int i = 0; i < n; i++) {
      result = result.concat(this);
    }
    return result;
  }

  /**
   * @return an expression, built using {@code algebra}, which describes every input this automaton accepts
   */
  public <E> E pattern(ExpressionAlgebra<S, E> algebra) {
    return Extraction.extract(this, algebra);
  }

  /// handles, for use within the package

  int initialHandle() {
    return initial;
  }

  boolean isFinalHandle(int state) {
    return finals[state];
  }

  int target(int state, int symbol) {
    return transitions[state][symbol];
  }

  private int handle(Q state) {
    Objects.requireNonNull(state);
    int h = handles.get(state, -1);
    if (h < 0) {
      throw new IllegalArgumentException("state " + state + " not in " + labels);
    }
    return h;
  }

  private void requireSameAlphabet(Automaton<S, ?> other) {
    if (!alphabet.equals(other.alphabet)) {
      throw new IllegalArgumentException("alphabet " + other.alphabet + " must be " + alphabet);
    }
  }

  private static int[][] copy(int[][] table) {
    int[][] result = new int[table.length][];
    for (int i = 0; i < table.length; i++) {
      result[i] = table[i].clone();
    }
    return result;
  }

  /// equality

  /**
   * Two automata are equal if they have the same alphabet, in the same order, and the same labelled states,
   * finality, and transitions.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof Automaton)) {
      return false;
    }

    Automaton<?, Q> a = (Automaton<?, Q>) o;
    if (!alphabet.equals(a.alphabet) || size() != a.size() || !initial().equals(a.labels.nth(a.initial))) {
      return false;
    }

    for (int i = 0; i < alphabet.size(); i++) {
      if (!alphabet.symbol(i).equals(a.alphabet.symbol(i))) {
        return false;
      }
    }

    for (int h = 0; h < size(); h++) {
      int g = a.handles.get(labels.nth(h), -1);
      if (g < 0 || finals[h] != a.finals[g]) {
        return false;
      }
      for (int i = 0; i < alphabet.size(); i++) {
        if (!labels.nth(transitions[h][i]).equals(a.labels.nth(a.transitions[g][i]))) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = alphabet.hashCode();
    for (int h = 0; h < size(); h++) {
      int row = labels.nth(h).hashCode() * 31 + (finals[h] ? 1 : 0);
      for (int i = 0; i < alphabet.size(); i++) {
        row = row * 31 + labels.nth(transitions[h][i]).hashCode();
      }
      hash += row;
    }
    return hash;
  }

  @Override
  public String toString() {
    return "automaton[alphabet=" + alphabet
            + ", states=" + size()
            + ", initial=" + initial()
            + ", finals=" + finals()
            + "]";
  }
}
