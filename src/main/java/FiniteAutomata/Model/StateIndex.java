package FiniteAutomata.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Dense integer numbering of a state set, so sets of states can be kept as BitSets.
 * Numbers follow the iteration order of the states handed in.
 */
public final class StateIndex<S> implements Iterable<S> {
    public static final int MISSING_STATE = -1;

    private final Object2IntMap<S> state2Id;
    private final List<S> id2State;

    private StateIndex(Collection<? extends S> states) {
        this.state2Id = new Object2IntOpenHashMap<>(states.size());
        this.state2Id.defaultReturnValue(MISSING_STATE);
        this.id2State = new ArrayList<>(states.size());
        for (S s : states) {
            if (!state2Id.containsKey(s)) {
                state2Id.put(s, id2State.size());
                id2State.add(s);
            }
        }
    }

    public static <S> StateIndex<S> of(Collection<? extends S> states) {
        return new StateIndex<>(states);
    }

    public int size() {
        return id2State.size();
    }

    public int getStateId(S state) {
        return state2Id.getInt(state);
    }

    public S getState(int id) {
        return id2State.get(id);
    }

    /**
     * States not part of the index are ignored.
     */
    public BitSet toBitSet(Collection<? extends S> states) {
        final BitSet result = new BitSet(size());
        for (S s : states) {
            int id = getStateId(s);
            if (id != MISSING_STATE) {
                result.set(id);
            }
        }
        return result;
    }

    /**
     * @return unmodifiable set of the states whose ids are set, in id order
     */
    public Set<S> toSet(BitSet ids) {
        final Set<S> result = new LinkedHashSet<>();
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            result.add(id2State.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public Iterator<S> iterator() {
        return Collections.unmodifiableList(id2State).iterator();
    }
}
