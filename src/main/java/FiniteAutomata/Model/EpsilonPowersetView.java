package FiniteAutomata.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Powerset view of an automaton in which every set of states is closed under epsilon transitions.
 * Sets of states are BitSets over a {@link StateIndex}. Successor sets of single states are
 * computed once, up front, for every alphabet symbol.
 * @param <S> - State type
 * @param <I> - Input symbol type
 */
public class EpsilonPowersetView<S, I> implements AcceptorPowersetViewTS<BitSet, I, S> {
    private final StateIndex<S> stateIDs;
    private final BitSet accepting;
    private final BitSet[] closures;
    private final Map<I, BitSet[]> successors;
    private final int initialId;

    public EpsilonPowersetView(Automaton<S, I> automaton) {
        this.stateIDs = StateIndex.of(automaton.getStates());
        final int n = stateIDs.size();
        this.accepting = stateIDs.toBitSet(automaton.getFinalStates());
        this.initialId = stateIDs.getStateId(automaton.getInitialState());

        this.closures = new BitSet[n];
        for (int i = 0; i < n; i++) {
            closures[i] = stateIDs.toBitSet(automaton.epsilonClosure(stateIDs.getState(i)));
        }

        this.successors = new HashMap<>();
        for (I sym : automaton.getAlphabet()) {
            final Symbol<I> symbol = Symbol.of(sym);
            final BitSet[] bySource = new BitSet[n];
            for (int i = 0; i < n; i++) {
                bySource[i] = closureOf(stateIDs.toBitSet(automaton.getTransitions(stateIDs.getState(i), symbol)));
            }
            successors.put(sym, bySource);
        }
    }

    public StateIndex<S> getStateIndex() {
        return stateIDs;
    }

    /**
     * Union of the epsilon closures of the given states.
     */
    public BitSet closureOf(BitSet state) {
        final BitSet result = new BitSet();
        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            result.or(closures[i]);
        }
        return result;
    }

    @Override
    public Collection<S> getOriginalStates(BitSet state) {
        return getOriginalTransitions(state);
    }

    @Override
    public Collection<S> getOriginalTransitions(BitSet state) {
        final List<S> result = new ArrayList<>(state.cardinality());

        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            result.add(stateIDs.getState(i));
        }

        return result;
    }

    @Override
    public BitSet getTransition(BitSet state, I in) {
        final BitSet result = new BitSet();
        final BitSet[] bySource = successors.get(in);
        if (bySource == null) {
            return result; // not in the alphabet
        }

        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            result.or(bySource[i]);
        }

        return result;
    }

    @Override
    public boolean isAccepting(BitSet state) {
        return state.intersects(accepting);
    }

    @Override
    public BitSet getInitialState() {
        if (initialId == StateIndex.MISSING_STATE) {
            return new BitSet();
        }
        return (BitSet) closures[initialId].clone();
    }
}
