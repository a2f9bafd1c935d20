package FiniteAutomata.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import FiniteAutomata.AutomataLibBridge;
import FiniteAutomata.EpsilonClosure;
import FiniteAutomata.EpsilonRemoval;
import FiniteAutomata.LanguageAlgebra;
import FiniteAutomata.NFASimulator;
import FiniteAutomata.PowersetDeterminizer;
import FiniteAutomata.Renumbering;

/**
 * Nondeterministic finite automaton with epsilon transitions.
 * <p>
 * Instances are immutable values. Construction never validates: an automaton may be built from
 * inconsistent parts, and {@link #isValid()} reports whether it is usable. Every operation returns
 * a new automaton and leaves its inputs untouched.
 *
 * @param <S> - State type, e.g., String
 * @param <I> - Input symbol type, e.g., String
 */
public final class Automaton<S, I> {
    private final Set<S> states;
    private final Set<I> alphabet;
    private final Map<S, Map<Symbol<I>, Set<S>>> transitions;
    private final S initialState;
    private final Set<S> finalStates;

    /**
     * @param states - all states
     * @param alphabet - input symbols, without epsilon
     * @param transitions - state to (symbol to destination states)
     * @param initialState - initial state
     * @param finalStates - accepting states
     */
    public Automaton(Collection<? extends S> states,
                     Collection<? extends I> alphabet,
                     Map<? extends S, ? extends Map<Symbol<I>, ? extends Collection<? extends S>>> transitions,
                     S initialState,
                     Collection<? extends S> finalStates) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(states, "states")));
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(alphabet, "alphabet")));
        this.transitions = copyTransitions(Objects.requireNonNull(transitions, "transitions"));
        this.initialState = initialState;
        this.finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(finalStates, "finalStates")));
    }

    private static <S, I> Map<S, Map<Symbol<I>, Set<S>>> copyTransitions(
        Map<? extends S, ? extends Map<Symbol<I>, ? extends Collection<? extends S>>> transitions) {
        final Map<S, Map<Symbol<I>, Set<S>>> result = new LinkedHashMap<>();
        for (Map.Entry<? extends S, ? extends Map<Symbol<I>, ? extends Collection<? extends S>>> e : transitions.entrySet()) {
            final Map<Symbol<I>, Set<S>> bySymbol = new LinkedHashMap<>();
            if (e.getValue() != null) {
                for (Map.Entry<Symbol<I>, ? extends Collection<? extends S>> t : e.getValue().entrySet()) {
                    final Set<S> succs = t.getValue() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(t.getValue());
                    bySymbol.put(t.getKey(), Collections.unmodifiableSet(succs));
                }
            }
            result.put(e.getKey(), Collections.unmodifiableMap(bySymbol));
        }
        return Collections.unmodifiableMap(result);
    }

    public Set<S> getStates() {
        return states;
    }

    public Set<I> getAlphabet() {
        return alphabet;
    }

    public Map<S, Map<Symbol<I>, Set<S>>> getTransitions() {
        return transitions;
    }

    /**
     * @return destinations of {@code state} on {@code symbol}; empty if there is no such transition
     */
    public Set<S> getTransitions(S state, Symbol<I> symbol) {
        final Map<Symbol<I>, Set<S>> bySymbol = transitions.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        final Set<S> succs = bySymbol.get(symbol);
        return succs == null ? Collections.emptySet() : succs;
    }

    public S getInitialState() {
        return initialState;
    }

    public Set<S> getFinalStates() {
        return finalStates;
    }

    public boolean isAccepting(S state) {
        return finalStates.contains(state);
    }

    /**
     * Structural validity: the initial state and all final states are states, every transition
     * starts and ends at a state and is labelled with epsilon or an alphabet symbol, and no state or
     * symbol is null. Never throws.
     */
    public boolean isValid() {
        if (initialState == null || !states.contains(initialState)) {
            return false;
        }
        if (states.contains(null) || alphabet.contains(null)) {
            return false;
        }
        if (!states.containsAll(finalStates)) {
            return false;
        }
        for (Map.Entry<S, Map<Symbol<I>, Set<S>>> e : transitions.entrySet()) {
            if (!states.contains(e.getKey())) {
                return false;
            }
            for (Map.Entry<Symbol<I>, Set<S>> t : e.getValue().entrySet()) {
                final Symbol<I> symbol = t.getKey();
                if (symbol == null || (!symbol.isEpsilon() && !alphabet.contains(symbol.getValue()))) {
                    return false;
                }
                if (!states.containsAll(t.getValue())) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean containsEpsilonTransitions() {
        for (Map<Symbol<I>, Set<S>> bySymbol : transitions.values()) {
            final Set<S> succs = bySymbol.get(Symbol.<I>epsilon());
            if (succs != null && !succs.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws AutomatonException with {@code STATE_NOT_FOUND} if {@code state} is not a state
     */
    public Set<S> epsilonClosure(S state) {
        return EpsilonClosure.closure(this, state);
    }

    public boolean accept(Iterable<? extends I> word) {
        return NFASimulator.accepts(this, word);
    }

    public Automaton<S, I> removeEpsilonTransitions() {
        return EpsilonRemoval.removeEpsilonTransitions(this);
    }

    public Automaton<Set<S>, I> getDfa() {
        return PowersetDeterminizer.determinize(this);
    }

    public Automaton<Set<S>, I> getDfa(ExplorationLimit limit) {
        return PowersetDeterminizer.determinize(this, limit);
    }

    public <T> Automaton<Pair<S, T>, I> product(Automaton<T, I> other) {
        return LanguageAlgebra.product(this, other);
    }

    public <T> Automaton<Pair<S, T>, I> intersection(Automaton<T, I> other) {
        return LanguageAlgebra.intersection(this, other);
    }

    public <T> Automaton<UnionState<S, T>, I> union(Automaton<T, I> other) {
        return LanguageAlgebra.union(this, other);
    }

    public Automaton<Set<S>, I> complement() {
        return LanguageAlgebra.complement(this);
    }

    public Automaton<String, I> renumber(String prefix) {
        return Renumbering.renumber(this, prefix);
    }

    public boolean isEquivalentTo(Automaton<?, I> other) {
        return AutomataLibBridge.testEquivalence(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton<?, ?> other = (Automaton<?, ?>) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions)
            && Objects.equals(initialState, other.initialState)
            && finalStates.equals(other.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, initialState, finalStates);
    }

    @Override
    public String toString() {
        return "Automaton [states=" + states + ", alphabet=" + alphabet + ", initialState=" + initialState
            + ", finalStates=" + finalStates + ", transitions=" + transitions + "]";
    }
}
