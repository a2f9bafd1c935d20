package FiniteAutomata.Model;

import java.util.Objects;

/**
 * Transition label: either an input symbol or epsilon.
 * Epsilon is marked by a flag, so it never collides with a real symbol whatever the symbol type is.
 * @param <I> - Input symbol type, e.g., String
 */
public final class Symbol<I> {
    private final I value;
    private final boolean epsilon;

    private Symbol(I value, boolean epsilon) {
        this.value = value;
        this.epsilon = epsilon;
    }

    public static <I> Symbol<I> of(I value) {
        return new Symbol<>(Objects.requireNonNull(value, "symbol"), false);
    }

    public static <I> Symbol<I> epsilon() {
        return new Symbol<>(null, true);
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    /**
     * @return the input symbol, or null for epsilon
     */
    public I getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol)) {
            return false;
        }
        Symbol<?> other = (Symbol<?>) o;
        if (epsilon || other.epsilon) {
            return epsilon == other.epsilon;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return isEpsilon() ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : value.toString();
    }
}
