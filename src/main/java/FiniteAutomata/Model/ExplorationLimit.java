package FiniteAutomata.Model;

/**
 * Upper bound on the number of states a construction may materialize.
 * Subset construction is exponential in the worst case; callers that cannot bound their inputs
 * pass a limit instead.
 */
public final class ExplorationLimit {
    private static final ExplorationLimit UNBOUNDED = new ExplorationLimit(Integer.MAX_VALUE);

    private final int stateThreshold;

    private ExplorationLimit(int stateThreshold) {
        this.stateThreshold = stateThreshold;
    }

    public static ExplorationLimit unbounded() {
        return UNBOUNDED;
    }

    public static ExplorationLimit ofStates(int stateThreshold) {
        if (stateThreshold < 1) {
            throw new AutomatonException(AutomatonException.Code.INVALID_ARGUMENT,
                "State threshold must be positive: " + stateThreshold);
        }
        return new ExplorationLimit(stateThreshold);
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    /**
     * @param states - number of states materialized so far
     * @param construction - name of the construction, for the error message
     */
    public void check(int states, String construction) {
        if (isAboveThreshold(states)) {
            throw new AutomatonException(AutomatonException.Code.STATE_LIMIT_EXCEEDED,
                construction + " exceeded " + stateThreshold + " states");
        }
    }

    @Override
    public String toString() {
        return this == UNBOUNDED ? "unbounded" : String.valueOf(stateThreshold);
    }
}
