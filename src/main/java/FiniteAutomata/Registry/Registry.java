package FiniteAutomata.Registry;

/**
 * Assigns output state IDs to the composite states discovered during a construction,
 * e.g. subsets of NFA states or pairs of operand states.
 * @param <K> - composite state type
 */
public interface Registry<K> {
    int MISSING_ELEMENT = -1;

    /**
     * Get the output state ID of a composite state.
     * @param key composite state
     * @return state ID or MISSING_ELEMENT if the composite state was not registered.
     */
    int get(K key);

    /**
     * Register a new composite state.
     * @param key composite state
     * @param stateID output state ID
     */
    void put(K key, int stateID);

    /**
     * @return number of registered composite states
     */
    int size();

    default boolean contains(K key) {
        return get(key) != MISSING_ELEMENT;
    }
}
