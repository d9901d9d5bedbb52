package NFA2DFA.Model;

import java.util.Objects;

/**
 * Key of a transition relation: a source state and the symbol read from it.
 * A {@code null} symbol denotes an epsilon transition.
 * @param state source state
 * @param symbol input symbol, or {@code null} for epsilon
 * @param <S> state type
 * @param <I> input symbol type
 */
public record Transition<S, I>(S state, I symbol) {

    public Transition {
        Objects.requireNonNull(state, "state");
    }

    public static <S, I> Transition<S, I> of(S state, I symbol) {
        return new Transition<>(state, Objects.requireNonNull(symbol, "symbol"));
    }

    public static <S, I> Transition<S, I> epsilon(S state) {
        return new Transition<>(state, null);
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    @Override
    public String toString() {
        return state + " / " + (isEpsilon() ? "ε" : symbol);
    }
}
