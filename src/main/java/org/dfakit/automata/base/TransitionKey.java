package org.dfakit.automata.base;

import lombok.Getter;
import org.dfakit.core.State;
import org.dfakit.core.Symbol;

import java.util.Objects;

/**
 * 迁移函数 δ 的定义域元素，即有序对 (q, a)。
 * 此类是不可变的。
 */
@Getter
public final class TransitionKey {

    private final State state;   // q
    private final Symbol symbol; // a

    private final int hashCode;

    public TransitionKey(State state, Symbol symbol) {
        this.state = Objects.requireNonNull(state, "State cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.hashCode = Objects.hash(state, symbol);
    }

    public static TransitionKey of(State state, Symbol symbol) {
        return new TransitionKey(state, symbol);
    }

    public static TransitionKey of(String state, String symbol) {
        return new TransitionKey(State.of(state), Symbol.of(symbol));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TransitionKey that = (TransitionKey) o;
        return state.equals(that.state) &&
                symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("δ(%s, %s)", state.getLabel(), symbol.getLabel());
    }
}
