package FiniteAutomata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.Symbol;

/**
 * Automata over string states and string symbols, described by plain collections.
 * The empty string is the epsilon marker: as a transition label it denotes an epsilon move, and in
 * the alphabet it is dropped.
 */
public final class StringAutomata {
    public static final String EPSILON = "";

    private StringAutomata() {}

    /**
     * @param states - all states
     * @param alphabet - input symbols; "" is ignored
     * @param delta - state to (symbol to destination states); "" labels epsilon moves
     * @param initialState - initial state
     * @param finalStates - accepting states
     * @return the automaton, not validated
     */
    public static Automaton<String, String> of(Collection<String> states,
                                               Collection<String> alphabet,
                                               Map<String, ? extends Map<String, ? extends Collection<String>>> delta,
                                               String initialState,
                                               Collection<String> finalStates) {
        final Set<String> sigma = new LinkedHashSet<>(alphabet);
        sigma.remove(EPSILON);

        final Map<String, Map<Symbol<String>, Collection<String>>> transitions = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, ? extends Collection<String>>> e : delta.entrySet()) {
            final Map<Symbol<String>, Collection<String>> bySymbol = new LinkedHashMap<>();
            for (Map.Entry<String, ? extends Collection<String>> t : e.getValue().entrySet()) {
                bySymbol.put(toSymbol(t.getKey()), t.getValue());
            }
            transitions.put(e.getKey(), bySymbol);
        }
        return new Automaton<>(states, sigma, transitions, initialState, finalStates);
    }

    public static Symbol<String> toSymbol(String label) {
        return label == null || EPSILON.equals(label) ? Symbol.epsilon() : Symbol.of(label);
    }

    /**
     * Splits a string into one-symbol-per-character input.
     */
    public static List<String> word(String input) {
        final List<String> result = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> result.add(new String(Character.toChars(cp))));
        return result;
    }

    public static boolean accepts(Automaton<?, String> automaton, String input) {
        return automaton.accept(word(input));
    }
}
