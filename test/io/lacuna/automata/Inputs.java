package io.lacuna.automata;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Helpers for building character inputs and random automata in tests.
 */
public final class Inputs {

  private Inputs() {
  }

  public static List<Character> chars(String s) {
    List<Character> result = new ArrayList<>();
    for (char c : s.toCharArray()) {
      result.add(c);
    }
    return result;
  }

  /**
   * @return every string over {@code symbols} of length at most {@code maxLength}, shortest first
   */
  public static List<String> strings(String symbols, int maxLength) {
    List<String> result = new ArrayList<>();
    result.add("");
    int start = 0;
    for (int length = 1; length <= maxLength; length++) {
      int end = result.size();
      for (int i = start; i < end; i++) {
        for (char c : symbols.toCharArray()) {
          result.add(result.get(i) + c);
        }
      }
      start = end;
    }
    return result;
  }

  public static boolean accepts(Automaton<Character, ?> automaton, String input) {
    return automaton.accepts(chars(input));
  }

  /**
   * @return an automaton with up to {@code maxStates} states, random transitions, and roughly a third of its states
   * accepting
   */
  public static Automaton<Character, Integer> randomAutomaton(Random random, Alphabet<Character> alphabet,
                                                              int maxStates) {
    int n = 1 + random.nextInt(maxStates);
    AutomatonBuilder<Character, Integer> builder = new AutomatonBuilder<Character, Integer>(alphabet)
            .init(random.nextInt(n));

    for (int s = 0; s < n; s++) {
      builder.state(s);
      if (random.nextInt(3) == 0) {
        builder.accept(s);
      }
      for (Symbol<Character> symbol : alphabet) {
        builder.transition(s, symbol, random.nextInt(n));
      }
    }
    return builder.build();
  }
}
