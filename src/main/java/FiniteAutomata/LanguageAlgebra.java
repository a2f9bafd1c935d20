package FiniteAutomata;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.AutomatonException;
import FiniteAutomata.Model.ExplorationLimit;
import FiniteAutomata.Model.Pair;
import FiniteAutomata.Model.Symbol;
import FiniteAutomata.Model.UnionState;
import FiniteAutomata.Registry.AddressRegistry;
import FiniteAutomata.Registry.Registry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Regular-language operations on automata. Operands must be valid; the results are new automata.
 */
public final class LanguageAlgebra {
    private static final Logger logger = LogManager.getLogger(LanguageAlgebra.class.getSimpleName());

    private LanguageAlgebra() {}

    public static <S, T, I> Automaton<Pair<S, T>, I> product(Automaton<S, I> a, Automaton<T, I> b) {
        return product(a, b, ExplorationLimit.unbounded());
    }

    /**
     * Synchronized product over the shared alphabet. A pair moves on a symbol when both components
     * move on it, and accepts when both components accept. An epsilon move of either component is
     * taken alone, leaving the other component in place.
     * Only pairs reachable from the pair of initial states are built.
     * @param a - left operand
     * @param b - right operand
     * @param limit - cap on the number of pairs
     * @return product automaton over {@code Pair} states
     */
    public static <S, T, I> Automaton<Pair<S, T>, I> product(Automaton<S, I> a, Automaton<T, I> b, ExplorationLimit limit) {
        requireValid(a, "product");
        requireValid(b, "product");

        final Set<I> alphabet = new LinkedHashSet<>(a.getAlphabet());
        alphabet.retainAll(b.getAlphabet());

        final AutomatonBuilder<Pair<S, T>, I> out = new AutomatonBuilder<Pair<S, T>, I>().withAlphabet(alphabet);
        final Registry<Pair<S, T>> registry = new AddressRegistry<>();
        final Deque<Pair<S, T>> stack = new ArrayDeque<>();

        final Pair<S, T> init = Pair.of(a.getInitialState(), b.getInitialState());
        out.withInitialState(init);
        registry.put(init, 0);
        stack.push(init);

        while (!stack.isEmpty()) {
            final Pair<S, T> curr = stack.pop();
            final S left = curr.first();
            final T right = curr.second();
            out.withAccepting(curr, a.isAccepting(left) && b.isAccepting(right));

            for (I sym : alphabet) {
                final Symbol<I> symbol = Symbol.of(sym);
                for (S leftSucc : a.getTransitions(left, symbol)) {
                    for (T rightSucc : b.getTransitions(right, symbol)) {
                        addPairTransition(out, registry, stack, limit, curr, symbol, Pair.of(leftSucc, rightSucc));
                    }
                }
            }
            for (S leftSucc : a.getTransitions(left, Symbol.epsilon())) {
                addPairTransition(out, registry, stack, limit, curr, Symbol.epsilon(), Pair.of(leftSucc, right));
            }
            for (T rightSucc : b.getTransitions(right, Symbol.epsilon())) {
                addPairTransition(out, registry, stack, limit, curr, Symbol.epsilon(), Pair.of(left, rightSucc));
            }
        }

        final Automaton<Pair<S, T>, I> result = out.build();
        logger.debug("Product of {} and {} states: {} reachable pairs, {} accepting",
            a.getStates().size(), b.getStates().size(), result.getStates().size(), result.getFinalStates().size());
        return result;
    }

    private static <S, T, I> void addPairTransition(AutomatonBuilder<Pair<S, T>, I> out,
                                                    Registry<Pair<S, T>> registry,
                                                    Deque<Pair<S, T>> stack,
                                                    ExplorationLimit limit,
                                                    Pair<S, T> from,
                                                    Symbol<I> symbol,
                                                    Pair<S, T> to) {
        if (!registry.contains(to)) {
            limit.check(registry.size() + 1, "Product construction");
            registry.put(to, registry.size());
            stack.push(to);
        }
        out.withTransition(from, symbol, to);
    }

    /**
     * Same construction and acceptance as {@link #product(Automaton, Automaton)}: a word is accepted
     * iff both operands accept it.
     */
    public static <S, T, I> Automaton<Pair<S, T>, I> intersection(Automaton<S, I> a, Automaton<T, I> b) {
        return product(a, b, ExplorationLimit.unbounded());
    }

    /**
     * Union via a fresh initial state with epsilon moves into both operands. Operand states are
     * tagged by side, so shared state names never collide. The result is nondeterministic.
     * @param a - left operand
     * @param b - right operand
     * @return automaton accepting the words accepted by either operand
     */
    public static <S, T, I> Automaton<UnionState<S, T>, I> union(Automaton<S, I> a, Automaton<T, I> b) {
        requireValid(a, "union");
        requireValid(b, "union");

        final UnionState<S, T> init = UnionState.initial();
        final AutomatonBuilder<UnionState<S, T>, I> out = new AutomatonBuilder<UnionState<S, T>, I>()
            .withInitialState(init)
            .withAlphabet(a.getAlphabet())
            .withAlphabet(b.getAlphabet());

        for (S s : a.getStates()) {
            out.withAccepting(UnionState.left(s), a.isAccepting(s));
        }
        for (Map.Entry<S, Map<Symbol<I>, Set<S>>> e : a.getTransitions().entrySet()) {
            for (Map.Entry<Symbol<I>, Set<S>> t : e.getValue().entrySet()) {
                final UnionState<S, T> from = UnionState.left(e.getKey());
                for (S succ : t.getValue()) {
                    final UnionState<S, T> to = UnionState.left(succ);
                    out.withTransition(from, t.getKey(), to);
                }
            }
        }

        for (T s : b.getStates()) {
            out.withAccepting(UnionState.right(s), b.isAccepting(s));
        }
        for (Map.Entry<T, Map<Symbol<I>, Set<T>>> e : b.getTransitions().entrySet()) {
            for (Map.Entry<Symbol<I>, Set<T>> t : e.getValue().entrySet()) {
                final UnionState<S, T> from = UnionState.right(e.getKey());
                for (T succ : t.getValue()) {
                    final UnionState<S, T> to = UnionState.right(succ);
                    out.withTransition(from, t.getKey(), to);
                }
            }
        }

        out.withEpsilonTransition(init, UnionState.left(a.getInitialState()));
        out.withEpsilonTransition(init, UnionState.right(b.getInitialState()));

        final Automaton<UnionState<S, T>, I> result = out.build();
        logger.debug("Union of {} and {} states: {} states", a.getStates().size(), b.getStates().size(),
            result.getStates().size());
        return result;
    }

    public static <S, I> Automaton<Set<S>, I> complement(Automaton<S, I> a) {
        return complement(a, ExplorationLimit.unbounded());
    }

    /**
     * Complement relative to the automaton's alphabet: the complete subset automaton, with the empty
     * subset as sink, and accepting and rejecting states swapped.
     */
    public static <S, I> Automaton<Set<S>, I> complement(Automaton<S, I> a, ExplorationLimit limit) {
        requireValid(a, "complement");

        final Automaton<Set<S>, I> dfa = PowersetDeterminizer.determinizeComplete(a, a.getAlphabet(), limit);
        final Set<Set<S>> rejecting = new LinkedHashSet<>(dfa.getStates());
        rejecting.removeAll(dfa.getFinalStates());

        return new Automaton<>(dfa.getStates(), dfa.getAlphabet(), dfa.getTransitions(), dfa.getInitialState(), rejecting);
    }

    private static void requireValid(Automaton<?, ?> automaton, String operation) {
        if (!automaton.isValid()) {
            logger.warn("Rejected invalid operand of {}: {}", operation, automaton);
            throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON,
                "Cannot compute " + operation + " of an invalid automaton");
        }
    }
}
