package FiniteAutomata.Model;

/**
 * Single exception type for misuse of the engine. The code enum tells the failure categories apart.
 * Expected outcomes (a rejected word, an invalid automaton, a missing transition) are never reported
 * through this exception.
 */
public final class AutomatonException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final Code code;

    public AutomatonException(final Code code) {
        super(code.getDescription());
        this.code = code;
    }

    public AutomatonException(final Code code, final String message) {
        super(message);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    public enum Code {
        // 1.
        STATE_NOT_FOUND("State is not part of the automaton"),
        // 2.
        INVALID_AUTOMATON("Automaton failed validity checks and cannot be combined"),
        // 3.
        STATE_LIMIT_EXCEEDED("Construction materialized more states than the exploration limit allows"),
        // 4.
        INVALID_ARGUMENT("Argument is invalid");

        private final String description;

        Code(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
