package FiniteAutomata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;

/**
 * Shared fixtures. Only for tests.
 */
public class TestAutomata {

  /**
   * Over {0,1}: some "1" followed (directly or after a "0") by "1", then anything.
   * q2 reaches q3 through an epsilon move.
   */
  public static Automaton<String, String> containsOneOne() {
    return StringAutomata.of(
        Set.of("q1", "q2", "q3", "q4"),
        Set.of("0", "1"),
        Map.of(
            "q1", Map.of("0", Set.of("q1"), "1", Set.of("q1", "q2")),
            "q2", Map.of("0", Set.of("q3"), "", Set.of("q3")),
            "q3", Map.of("1", Set.of("q4")),
            "q4", Map.of("0", Set.of("q4"), "1", Set.of("q4"))),
        "q1",
        Set.of("q4"));
  }

  /**
   * AA BB CC (BB CC)* DD, with an epsilon back edge; "" is listed in the alphabet.
   */
  public static Automaton<String, String> epsilonLoop() {
    return StringAutomata.of(
        Set.of("3", "1", "2", "4", "0"),
        Set.of("", "AA", "BB", "DD", "CC"),
        Map.of(
            "0", Map.of("AA", Set.of("1")),
            "1", Map.of("BB", Set.of("2")),
            "2", Map.of("CC", Set.of("3")),
            "3", Map.of("", Set.of("1"), "DD", Set.of("4"))),
        "0",
        Set.of("4"));
  }

  /**
   * All words over {@code alphabet} up to {@code maxLength}, the empty word included.
   */
  public static <I> List<List<I>> allWords(Collection<I> alphabet, int maxLength) {
    final List<List<I>> result = new ArrayList<>();
    List<List<I>> layer = new ArrayList<>();
    layer.add(List.of());
    result.addAll(layer);
    for (int len = 1; len <= maxLength; len++) {
      final List<List<I>> next = new ArrayList<>();
      for (List<I> prefix : layer) {
        for (I sym : alphabet) {
          final List<I> word = new ArrayList<>(prefix);
          word.add(sym);
          next.add(word);
        }
      }
      result.addAll(next);
      layer = next;
    }
    return result;
  }
}
