package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Materializes an automaton from a space of superstates, which are typically sets or tuples of states from other
 * automata.
 */
public final class Crawl {

  private static final Logger log = LoggerFactory.getLogger(Crawl.class);

  private Crawl() {
  }

  /**
   * Explores every superstate reachable from {@code initial}, breadth-first and in alphabet order, numbering each
   * one the first time it's seen. Superstates are deduplicated by {@link Object#equals(Object)}, so they must be
   * values with structural equality, and must not be mutated once returned by {@code next}.
   * <p>
   * {@code next} must be defined for every symbol in the alphabet, including the wildcard, and must only ever yield
   * finitely many distinct superstates. If it doesn't, this will never return.
   *
   * @param alphabet the alphabet of the resulting automaton
   * @param initial the superstate corresponding to the initial state
   * @param isFinal whether a superstate is an accepting state
   * @param next the superstate reached from a superstate by consuming a symbol
   * @return an automerged automaton whose states are numbered from {@code 0}, starting with the initial state
   */
  public static <S, T> Automaton<S, Integer> crawl(
          Alphabet<S> alphabet,
          T initial,
          Predicate<? super T> isFinal,
          BiFunction<? super T, Symbol<S>, ? extends T> next) {

    LinearList<T> superstates = LinearList.of(Objects.requireNonNull(initial));
    LinearMap<T, Integer> ids = new LinearMap<T, Integer>(Crawl::hash, Objects::equals);
    ids.put(initial, 0);

    LinearList<Integer> states = new LinearList<>();
    LinearList<int[]> transitions = new LinearList<>();
    LinearList<Boolean> finals = new LinearList<>();

    // superstates grows as we go
    for (int i = 0; i < superstates.size(); i++) {
      T superstate = superstates.nth(i);

      states.addLast(i);
      finals.addLast(isFinal.test(superstate));

      int[] row = new int[alphabet.size()];
      for (int j = 0; j < row.length; j++) {
        T target = Objects.requireNonNull(next.apply(superstate, alphabet.symbol(j)));

        int id = ids.get(target, -1);
        if (id < 0) {
          id = (int) superstates.size();
          ids.put(target, id);
          superstates.addLast(target);
        }
        row[j] = id;
      }
      transitions.addLast(row);
    }

    int n = (int) states.size();
    boolean[] accept = new boolean[n];
    int[][] table = new int[n][];
    for (int i = 0; i < n; i++) {
      accept[i] = finals.nth(i);
      table[i] = transitions.nth(i);
    }

    Automaton<S, Integer> result = new Automaton<>(alphabet, states.forked(), 0, accept, table)
            .automerge()
            .renumber();

    log.debug("crawled {} superstates into {} states", n, result.size());

    return result;
  }

  /**
   * A structural hash for superstates. The collections' own hashes combine element hashes without mixing them, so
   * sets and tuples of small integers collide heavily; here each element is mixed before it's combined.
   */
  static long hash(Object superstate) {
    if (superstate instanceof ISet) {
      long h = 0;
      for (Object e : (ISet<?>) superstate) {
        h += hash(e);
      }
      return h;
    } else if (superstate instanceof IList) {
      long h = 1;
      for (Object e : (IList<?>) superstate) {
        h = h * 31 + hash(e);
      }
      return h;
    }
    return mix(superstate.hashCode());
  }

  // the splitmix64 finalizer
  private static long mix(long h) {
    h = (h ^ (h >>> 30)) * 0xbf58476d1ce4e5b9L;
    h = (h ^ (h >>> 27)) * 0x94d049bb133111ebL;
    return h ^ (h >>> 31);
  }
}
