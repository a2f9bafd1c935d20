package FiniteAutomata;

import java.util.List;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.AutomatonException;
import FiniteAutomata.Model.ExplorationLimit;
import FiniteAutomata.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FiniteAutomata.StringAutomata.word;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PowersetDeterminizerTest {

  private static <S, I> void assertDeterministic(Automaton<S, I> dfa) {
    Assertions.assertTrue(dfa.isValid());
    Assertions.assertFalse(dfa.containsEpsilonTransitions());
    for (Map<Symbol<I>, Set<S>> bySymbol : dfa.getTransitions().values()) {
      for (Set<S> succs : bySymbol.values()) {
        Assertions.assertTrue(succs.size() <= 1);
      }
    }
  }

  @Test
  void testContainsOneOne() {
    Automaton<String, String> fa = TestAutomata.containsOneOne();
    Automaton<Set<String>, String> dfa = fa.getDfa();
    assertDeterministic(dfa);
    Assertions.assertFalse(dfa.accept(word("000001")));
    Assertions.assertTrue(dfa.accept(word("0000011")));
    Assertions.assertTrue(dfa.accept(word("000001100001")));

    // {q1}, {q1,q2,q3}, {q1,q3}, {q1,q2,q3,q4}, {q1,q3,q4}, {q1,q4}
    Assertions.assertEquals(6, dfa.getStates().size());
    Assertions.assertEquals(Set.of("q1"), dfa.getInitialState());
    Assertions.assertEquals(Set.of("q1", "q2", "q3"), dfa.getTransitions(Set.of("q1"), Symbol.of("1")).iterator().next());
    for (Set<String> composite : dfa.getStates()) {
      Assertions.assertEquals(composite.contains("q4"), dfa.isAccepting(composite));
    }
    for (List<String> w : TestAutomata.allWords(fa.getAlphabet(), 8)) {
      Assertions.assertEquals(fa.accept(w), dfa.accept(w), w.toString());
    }
  }

  @Test
  void testEpsilonLoopIsValid() {
    Automaton<Set<String>, String> dfa = TestAutomata.epsilonLoop().getDfa();
    assertDeterministic(dfa);
    Assertions.assertEquals(TestAutomata.epsilonLoop().getAlphabet(), dfa.getAlphabet());
    // {0}, {1}, {2}, {3, 1}, {4}
    Assertions.assertEquals(5, dfa.getStates().size());
    Assertions.assertTrue(dfa.getStates().contains(Set.of("1", "3")));
  }

  @Test
  void testOnlyReachableSubsets() {
    // 2^3 subsets exist, but from {0} only {0} and {1} are reachable
    Automaton<Integer, String> nfa = new AutomatonBuilder<Integer, String>()
        .withInitialState(0)
        .withTransition(0, "a", 1)
        .withTransition(1, "a", 0)
        .withTransition(2, "a", 2)
        .withFinalState(1)
        .build();
    Automaton<Set<Integer>, String> dfa = nfa.getDfa();
    Assertions.assertEquals(Set.of(Set.of(0), Set.of(1)), dfa.getStates());
    Assertions.assertEquals(Set.of(Set.of(1)), dfa.getFinalStates());
  }

  @Test
  void testPartialAndComplete() {
    Automaton<Integer, String> nfa = new AutomatonBuilder<Integer, String>()
        .withInitialState(0)
        .withTransition(0, "a", 1)
        .withSymbol("b")
        .withFinalState(1)
        .build();
    Automaton<Set<Integer>, String> partial = nfa.getDfa();
    Assertions.assertEquals(2, partial.getStates().size());
    Assertions.assertFalse(partial.getStates().contains(Set.of()));

    Automaton<Set<Integer>, String> complete =
        PowersetDeterminizer.determinizeComplete(nfa, nfa.getAlphabet(), ExplorationLimit.unbounded());
    Assertions.assertEquals(3, complete.getStates().size());
    Assertions.assertTrue(complete.getStates().contains(Set.of()));
    for (Set<Integer> s : complete.getStates()) {
      for (String sym : complete.getAlphabet()) {
        Assertions.assertEquals(1, complete.getTransitions(s, Symbol.of(sym)).size());
      }
    }
  }

  @Test
  void testExplorationLimit() {
    Automaton<String, String> nfa = TestAutomata.containsOneOne();
    Assertions.assertEquals(6, nfa.getDfa(ExplorationLimit.ofStates(6)).getStates().size());
    AutomatonException e = assertThrows(AutomatonException.class,
        () -> nfa.getDfa(ExplorationLimit.ofStates(5)));
    Assertions.assertEquals(AutomatonException.Code.STATE_LIMIT_EXCEEDED, e.getCode());
  }

  @Test
  void testAgainstAutomataLib() {
    for (int size = 2; size < 12; size++) {
      for (int randomSeed = 0; randomSeed < 40; randomSeed++) {
        CompactNFA<Integer> compact = TabakovVardiRandomNFA.getRandomNFA(randomSeed, size);
        Alphabet<Integer> alphabet = compact.getInputAlphabet();
        CompactDFA<Integer> expected = NFAs.determinize(compact, alphabet);

        Automaton<Set<Integer>, Integer> dfa = AutomataLibBridge.fromCompactNFA(compact).getDfa();
        assertDeterministic(dfa);
        CompactDFA<Integer> actual = AutomataLibBridge.toCompactDFA(dfa, alphabet);
        Assertions.assertTrue(Automata.testEquivalence(expected, actual, alphabet), randomSeed + "; " + size);
      }
    }
  }

  @Test
  void testEpsilonAutomataPreserveLanguage() {
    for (int seed = 0; seed < 50; seed++) {
      Automaton<Integer, Integer> nfa = TabakovVardiRandomNFA.getRandomEpsilonAutomaton(seed, 7, 5);
      Automaton<Set<Integer>, Integer> dfa = nfa.getDfa();
      assertDeterministic(dfa);
      for (List<Integer> w : TestAutomata.allWords(nfa.getAlphabet(), 7)) {
        Assertions.assertEquals(nfa.accept(w), dfa.accept(w), seed + "; " + w);
      }
    }
  }
}
