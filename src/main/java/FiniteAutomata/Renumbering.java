package FiniteAutomata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.StateIndex;
import FiniteAutomata.Model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class Renumbering {
    private static final Logger logger = LogManager.getLogger(Renumbering.class.getSimpleName());

    private Renumbering() {}

    /**
     * Relabel the states {@code prefix + 0 .. prefix + (n-1)}, following the automaton's state order.
     * Alphabet, accepted language and validity are unchanged. References to unknown states become
     * null, and so does a null state, so an invalid automaton stays invalid.
     * @param automaton - automaton to relabel
     * @param prefix - prefix of the new state names
     * @return relabeled copy
     */
    public static <S, I> Automaton<String, I> renumber(Automaton<S, I> automaton, String prefix) {
        final StateIndex<S> stateIDs = StateIndex.of(automaton.getStates());

        final List<String> states = new ArrayList<>(stateIDs.size());
        for (S s : stateIDs) {
            // null stays null
            states.add(s == null ? null : name(prefix, stateIDs, s));
        }

        final Set<String> finalStates = new LinkedHashSet<>();
        for (S s : automaton.getFinalStates()) {
            finalStates.add(name(prefix, stateIDs, s));
        }

        final Map<String, Map<Symbol<I>, Set<String>>> transitions = new LinkedHashMap<>();
        for (Map.Entry<S, Map<Symbol<I>, Set<S>>> e : automaton.getTransitions().entrySet()) {
            final Map<Symbol<I>, Set<String>> bySymbol =
                transitions.computeIfAbsent(name(prefix, stateIDs, e.getKey()), k -> new LinkedHashMap<>());
            for (Map.Entry<Symbol<I>, Set<S>> t : e.getValue().entrySet()) {
                final Set<String> succs = bySymbol.computeIfAbsent(t.getKey(), k -> new LinkedHashSet<>());
                for (S succ : t.getValue()) {
                    succs.add(name(prefix, stateIDs, succ));
                }
            }
        }

        logger.debug("Renumbered {} states with prefix '{}'", stateIDs.size(), prefix);
        return new Automaton<>(states, automaton.getAlphabet(), transitions,
            name(prefix, stateIDs, automaton.getInitialState()), finalStates);
    }

    private static <S> String name(String prefix, StateIndex<S> stateIDs, S state) {
        final int id = stateIDs.getStateId(state);
        return id == StateIndex.MISSING_STATE ? null : prefix + id;
    }
}
