package FiniteAutomata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import FiniteAutomata.Model.Automaton;
import FiniteAutomata.Model.EpsilonPowersetView;
import FiniteAutomata.Model.ExplorationLimit;
import FiniteAutomata.Model.StateIndex;
import FiniteAutomata.Registry.AddressRegistry;
import FiniteAutomata.Registry.Registry;
import net.automatalib.ts.AcceptorPowersetViewTS;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Subset construction. Only subsets reachable from the epsilon closure of the initial state are
 * explored, and each distinct subset becomes exactly one state of the result, named by the set of
 * original states it contains.
 */
public class PowersetDeterminizer {
    private static final Logger logger = LogManager.getLogger(PowersetDeterminizer.class.getSimpleName());

    private final ExplorationLimit limit;

    public PowersetDeterminizer(ExplorationLimit limit) {
        this.limit = limit;
    }

    public static <S, I> Automaton<Set<S>, I> determinize(Automaton<S, I> nfa) {
        return determinize(nfa, ExplorationLimit.unbounded());
    }

    public static <S, I> Automaton<Set<S>, I> determinize(Automaton<S, I> nfa, ExplorationLimit limit) {
        return new PowersetDeterminizer(limit).run(nfa, nfa.getAlphabet(), false);
    }

    /**
     * Complete DFA: the empty subset is kept as a rejecting sink, so every state has exactly one
     * successor for every symbol of {@code inputs}.
     * @param nfa - original NFA
     * @param inputs - input symbols of the result; symbols outside the NFA's alphabet lead to the sink
     * @param limit - cap on the number of DFA states
     * @return complete DFA over {@code inputs}
     */
    public static <S, I> Automaton<Set<S>, I> determinizeComplete(Automaton<S, I> nfa,
                                                                 Collection<? extends I> inputs,
                                                                 ExplorationLimit limit) {
        return new PowersetDeterminizer(limit).run(nfa, inputs, true);
    }

    private <S, I> Automaton<Set<S>, I> run(Automaton<S, I> nfa, Collection<? extends I> inputs, boolean complete) {
        final EpsilonPowersetView<S, I> powerset = new EpsilonPowersetView<>(nfa);
        final AutomatonBuilder<Set<S>, I> out = new AutomatonBuilder<Set<S>, I>().withAlphabet(inputs);

        doDeterminize(powerset, powerset.getStateIndex(), inputs, out, complete, this.limit);

        final Automaton<Set<S>, I> dfa = out.build();
        logger.debug("Subset construction: {} NFA states -> {} DFA states", nfa.getStates().size(), dfa.getStates().size());
        return dfa;
    }

    private static <S, I> void doDeterminize(AcceptorPowersetViewTS<BitSet, I, S> powerset,
                                             StateIndex<S> stateIDs,
                                             Collection<? extends I> inputs,
                                             AutomatonBuilder<Set<S>, I> out,
                                             boolean complete,
                                             ExplorationLimit limit) {

        Registry<BitSet> registry = new AddressRegistry<>();
        List<Set<S>> outStates = new ArrayList<>();
        Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        Set<S> initOut = stateIDs.toSet(init);
        out.withInitialState(initOut).withAccepting(initOut, powerset.isAccepting(init));

        registry.put(init, outStates.size());
        outStates.add(initOut);

        stack.push(new DeterminizeRecord(init, 0));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();

            BitSet inState = curr.inputState();
            Set<S> outState = outStates.get(curr.outputAddress());

            for (I sym : inputs) {
                BitSet succ = powerset.getSuccessor(inState, sym);

                if (succ == null || (succ.isEmpty() && !complete)) {
                    continue; // no transition; the DFA stays partial
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = outStates.size();
                    limit.check(outSucc + 1, "Subset construction");
                    Set<S> succState = stateIDs.toSet(succ);
                    out.withState(succState).withAccepting(succState, powerset.isAccepting(succ));
                    registry.put(succ, outSucc);
                    outStates.add(succState);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.withTransition(outState, sym, outStates.get(outSucc));
            }
        }
    }

    private record DeterminizeRecord(BitSet inputState, int outputAddress) { }
}
