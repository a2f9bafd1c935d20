package FiniteAutomata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class EpsilonRemoval {
    private static final Logger logger = LogManager.getLogger(EpsilonRemoval.class.getSimpleName());

    private EpsilonRemoval() {}

    /**
     * Equivalent automaton without epsilon transitions, over the same states.
     * From state p on symbol a the result moves to closure(δ(closure(p), a)), and p is accepting
     * iff closure(p) contains an accepting state.
     * @param nfa - NFA, possibly with epsilon transitions
     * @return epsilon-free NFA accepting the same language
     */
    public static <S, I> Automaton<S, I> removeEpsilonTransitions(Automaton<S, I> nfa) {
        final AutomatonBuilder<S, I> out = new AutomatonBuilder<S, I>()
            .withStates(nfa.getStates())
            .withAlphabet(nfa.getAlphabet());
        if (nfa.getInitialState() != null) {
            out.withInitialState(nfa.getInitialState());
        }

        int removed = 0;
        for (S state : nfa.getStates()) {
            final Set<S> closure = EpsilonClosure.closure(nfa, Collections.singleton(state));
            if (!Collections.disjoint(closure, nfa.getFinalStates())) {
                out.withFinalState(state);
            }
            removed += nfa.getTransitions(state, Symbol.epsilon()).size();

            for (I sym : nfa.getAlphabet()) {
                final Symbol<I> symbol = Symbol.of(sym);
                final Set<S> direct = new LinkedHashSet<>();
                for (S member : closure) {
                    direct.addAll(nfa.getTransitions(member, symbol));
                }
                for (S succ : EpsilonClosure.closure(nfa, direct)) {
                    out.withTransition(state, symbol, succ);
                }
            }
        }

        logger.debug("Removed {} epsilon transitions from {} states", removed, nfa.getStates().size());
        return out.build();
    }
}
