package FiniteAutomata;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.AutomatonException;
import FiniteAutomata.Model.Symbol;

public final class EpsilonClosure {

    private EpsilonClosure() {}

    /**
     * States reachable from {@code state} through zero or more epsilon transitions.
     * @param automaton - automaton
     * @param state - start state, included in the result
     * @return epsilon closure of the state
     * @throws AutomatonException with {@code STATE_NOT_FOUND} if the state does not belong to the automaton
     */
    public static <S, I> Set<S> closure(Automaton<S, I> automaton, S state) {
        if (!automaton.getStates().contains(state)) {
            throw new AutomatonException(AutomatonException.Code.STATE_NOT_FOUND, "State not found: " + state);
        }
        return closure(automaton, Collections.singleton(state));
    }

    /**
     * Union of the epsilon closures of {@code states}. Unknown states are kept as they are.
     */
    public static <S, I> Set<S> closure(Automaton<S, I> automaton, Collection<? extends S> states) {
        final Set<S> result = new LinkedHashSet<>(states);
        final Deque<S> stack = new ArrayDeque<>(result.size());
        for (S s : result) {
            if (s != null) {
                stack.push(s);
            }
        }

        // visited set guards against epsilon cycles
        while (!stack.isEmpty()) {
            S curr = stack.pop();
            for (S succ : automaton.getTransitions(curr, Symbol.epsilon())) {
                if (succ != null && result.add(succ)) {
                    stack.push(succ);
                }
            }
        }
        return result;
    }
}
