package FiniteAutomata;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.Symbol;

/**
 * Incremental construction of an {@link Automaton}. States and symbols mentioned by transitions are
 * added automatically; insertion order is kept.
 *
 * @param <S> the states of the automaton
 * @param <I> the input symbols of the automaton
 */
public class AutomatonBuilder<S, I> {

    private final Set<S> states = new LinkedHashSet<>();
    private final Set<I> alphabet = new LinkedHashSet<>();
    private final Map<S, Map<Symbol<I>, Set<S>>> transitions = new LinkedHashMap<>();
    private final Set<S> finalStates = new LinkedHashSet<>();
    private S initialState;

    public AutomatonBuilder<S, I> withState(S state) {
        states.add(Objects.requireNonNull(state, "state"));
        return this;
    }

    public AutomatonBuilder<S, I> withStates(Collection<? extends S> states) {
        states.forEach(this::withState);
        return this;
    }

    public AutomatonBuilder<S, I> withSymbol(I symbol) {
        alphabet.add(Objects.requireNonNull(symbol, "symbol"));
        return this;
    }

    public AutomatonBuilder<S, I> withAlphabet(Collection<? extends I> symbols) {
        symbols.forEach(this::withSymbol);
        return this;
    }

    public AutomatonBuilder<S, I> withInitialState(S state) {
        withState(state);
        this.initialState = state;
        return this;
    }

    public AutomatonBuilder<S, I> withFinalState(S state) {
        return withAccepting(state, true);
    }

    /**
     * @return the current builder, with {@code state} marked accepting or not
     */
    public AutomatonBuilder<S, I> withAccepting(S state, boolean accepting) {
        withState(state);
        if (accepting) {
            finalStates.add(state);
        } else {
            finalStates.remove(state);
        }
        return this;
    }

    public AutomatonBuilder<S, I> withTransition(S from, I symbol, S to) {
        withSymbol(symbol);
        return withTransition(from, Symbol.of(symbol), to);
    }

    public AutomatonBuilder<S, I> withEpsilonTransition(S from, S to) {
        return withTransition(from, Symbol.epsilon(), to);
    }

    public AutomatonBuilder<S, I> withTransition(S from, Symbol<I> symbol, S to) {
        withState(from);
        withState(to);
        if (!symbol.isEpsilon()) {
            withSymbol(symbol.getValue());
        }
        transitions
            .computeIfAbsent(from, k -> new LinkedHashMap<>())
            .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
            .add(to);
        return this;
    }

    public Automaton<S, I> build() {
        return new Automaton<>(states, alphabet, transitions, initialState, finalStates);
    }
}
