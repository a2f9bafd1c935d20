package FiniteAutomata;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.ExplorationLimit;
import FiniteAutomata.Model.StateIndex;
import FiniteAutomata.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;

/**
 * Conversion between {@link Automaton} and AutomataLib's compact automata.
 */
public final class AutomataLibBridge {

    private AutomataLibBridge() {}

    /**
     * Epsilon moves are removed first; AutomataLib NFAs have none.
     * @param automaton - valid automaton
     * @return NFA over the same alphabet, states numbered in the automaton's state order
     */
    public static <S, I> CompactNFA<I> toCompactNFA(Automaton<S, I> automaton) {
        final Automaton<S, I> epsilonFree =
            automaton.containsEpsilonTransitions() ? automaton.removeEpsilonTransitions() : automaton;
        final Alphabet<I> alphabet = Alphabets.fromCollection(epsilonFree.getAlphabet());
        final StateIndex<S> stateIDs = StateIndex.of(epsilonFree.getStates());
        final CompactNFA<I> out = new CompactNFA<>(alphabet, stateIDs.size());

        for (S s : stateIDs) {
            out.addState(epsilonFree.isAccepting(s));
        }
        out.setInitial(stateIDs.getStateId(epsilonFree.getInitialState()), true);

        for (S s : stateIDs) {
            final Integer src = stateIDs.getStateId(s);
            for (I sym : alphabet) {
                for (S succ : epsilonFree.getTransitions(s, Symbol.of(sym))) {
                    final Integer dst = stateIDs.getStateId(succ);
                    out.addTransition(src, sym, dst);
                }
            }
        }
        return out;
    }

    /**
     * Complete DFA over {@code alphabet}. Symbols the automaton does not know lead to a rejecting sink.
     */
    public static <S, I> CompactDFA<I> toCompactDFA(Automaton<S, I> automaton, Alphabet<I> alphabet) {
        final Automaton<Set<S>, I> dfa =
            PowersetDeterminizer.determinizeComplete(automaton, alphabet, ExplorationLimit.unbounded());
        final StateIndex<Set<S>> stateIDs = StateIndex.of(dfa.getStates());
        final CompactDFA<I> out = new CompactDFA<>(alphabet, stateIDs.size());

        for (Set<S> s : stateIDs) {
            out.addState(dfa.isAccepting(s));
        }
        out.setInitialState(stateIDs.getStateId(dfa.getInitialState()));

        for (Map.Entry<Set<S>, Map<Symbol<I>, Set<Set<S>>>> e : dfa.getTransitions().entrySet()) {
            final Integer src = stateIDs.getStateId(e.getKey());
            for (Map.Entry<Symbol<I>, Set<Set<S>>> t : e.getValue().entrySet()) {
                for (Set<S> succ : t.getValue()) {
                    final Integer dst = stateIDs.getStateId(succ);
                    out.setTransition(src, t.getKey().getValue(), dst);
                }
            }
        }
        return out;
    }

    /**
     * States keep their AutomataLib numbers. Several initial states are joined through a fresh
     * initial state {@code nfa.size()} with epsilon moves to each of them.
     */
    public static <I> Automaton<Integer, I> fromCompactNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final AutomatonBuilder<Integer, I> out = new AutomatonBuilder<Integer, I>().withAlphabet(alphabet);

        for (Integer s : nfa.getStates()) {
            out.withAccepting(s, nfa.isAccepting(s));
        }

        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() == 1) {
            out.withInitialState(initialStates.iterator().next());
        } else {
            final Integer init = nfa.size();
            out.withInitialState(init);
            for (Integer s : initialStates) {
                out.withEpsilonTransition(init, s);
            }
        }

        for (Integer s : nfa.getStates()) {
            for (I sym : alphabet) {
                final Collection<Integer> succs = nfa.getTransitions(s, sym);
                for (Integer succ : succs) {
                    out.withTransition(s, sym, succ);
                }
            }
        }
        return out.build();
    }

    /**
     * Language equivalence over the union of both alphabets.
     */
    public static <I> boolean testEquivalence(Automaton<?, I> a, Automaton<?, I> b) {
        final Set<I> inputs = new LinkedHashSet<>(a.getAlphabet());
        inputs.addAll(b.getAlphabet());
        final Alphabet<I> alphabet = Alphabets.fromCollection(inputs);

        final CompactDFA<I> dfaA = toCompactDFA(a, alphabet);
        final CompactDFA<I> dfaB = toCompactDFA(b, alphabet);
        return Automata.testEquivalence(dfaA, dfaB, alphabet);
    }
}
