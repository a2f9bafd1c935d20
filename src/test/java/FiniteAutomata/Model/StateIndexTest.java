package FiniteAutomata.Model;

import java.util.BitSet;
import java.util.List;
import java.util.Set;

import FiniteAutomata.AutomatonBuilder;
import FiniteAutomata.BitSetUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StateIndexTest {
  @Test
  void testIndexing() {
    StateIndex<String> index = StateIndex.of(List.of("a", "b", "c", "b"));
    Assertions.assertEquals(3, index.size()); // duplicates are numbered once
    Assertions.assertEquals(0, index.getStateId("a"));
    Assertions.assertEquals(2, index.getStateId("c"));
    Assertions.assertEquals(StateIndex.MISSING_STATE, index.getStateId("d"));
    Assertions.assertEquals("b", index.getState(1));

    BitSet bits = index.toBitSet(List.of("c", "a", "d"));
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0, 2)), bits);
    Assertions.assertEquals(Set.of("a", "c"), index.toSet(bits));
    Assertions.assertEquals(List.of("a", "c"), List.copyOf(index.toSet(bits))); // id order
  }

  @Test
  void testPowersetView() {
    // 0 -a-> 1 -eps-> 2 (final), 2 -eps-> 1
    Automaton<Integer, String> nfa = new AutomatonBuilder<Integer, String>()
        .withInitialState(0)
        .withTransition(0, "a", 1)
        .withEpsilonTransition(1, 2)
        .withEpsilonTransition(2, 1)
        .withFinalState(2)
        .build();
    EpsilonPowersetView<Integer, String> view = new EpsilonPowersetView<>(nfa);

    BitSet init = view.getInitialState();
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0)), init);
    Assertions.assertFalse(view.isAccepting(init));

    BitSet succ = view.getTransition(init, "a");
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(1, 2)), succ);
    Assertions.assertTrue(view.isAccepting(succ));
    Assertions.assertEquals(List.of(1, 2), List.copyOf(view.getOriginalStates(succ)));

    Assertions.assertTrue(view.getTransition(succ, "a").isEmpty());
    Assertions.assertTrue(view.getTransition(init, "z").isEmpty()); // unknown symbol
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(1, 2)),
        view.closureOf(BitSetUtils.convertListToBitSet(List.of(1))));
  }
}
