package FiniteAutomata.Model;

import java.util.Objects;

/**
 * State of a union automaton. Operand states are tagged with their side, so two operands
 * that share a state name never collide, and the fresh initial state is distinct from both.
 */
public record UnionState<S, T>(Origin origin, S left, T right) {

    public enum Origin { INITIAL, LEFT, RIGHT }

    public static <S, T> UnionState<S, T> initial() {
        return new UnionState<>(Origin.INITIAL, null, null);
    }

    public static <S, T> UnionState<S, T> left(S state) {
        return new UnionState<>(Origin.LEFT, Objects.requireNonNull(state, "state"), null);
    }

    public static <S, T> UnionState<S, T> right(T state) {
        return new UnionState<>(Origin.RIGHT, null, Objects.requireNonNull(state, "state"));
    }

    @Override
    public String toString() {
        return switch (origin) {
            case INITIAL -> "init";
            case LEFT -> "L:" + left;
            case RIGHT -> "R:" + right;
        };
    }
}
