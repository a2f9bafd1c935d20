package FiniteAutomata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.Symbol;

/**
 * Membership test by tracking the set of states the automaton could be in.
 */
public final class NFASimulator {

    private NFASimulator() {}

    public static <S, I> boolean accepts(Automaton<S, I> automaton, Iterable<? extends I> word) {
        if (!automaton.getStates().contains(automaton.getInitialState())) {
            return false;
        }
        Set<S> frontier = EpsilonClosure.closure(automaton, automaton.getInitialState());

        for (I sym : word) {
            frontier = step(automaton, frontier, sym);
            if (frontier.isEmpty()) {
                return false; // no transition defined
            }
        }
        return !Collections.disjoint(frontier, automaton.getFinalStates());
    }

    /**
     * Successors of {@code frontier} on {@code sym}, closed under epsilon transitions.
     * Symbols outside the alphabet have no successors.
     */
    public static <S, I> Set<S> step(Automaton<S, I> automaton, Set<S> frontier, I sym) {
        if (sym == null || !automaton.getAlphabet().contains(sym)) {
            return Collections.emptySet();
        }
        final Symbol<I> symbol = Symbol.of(sym);
        final Set<S> succs = new LinkedHashSet<>();
        for (S s : frontier) {
            succs.addAll(automaton.getTransitions(s, symbol));
        }
        return succs.isEmpty() ? succs : EpsilonClosure.closure(automaton, succs);
    }
}
