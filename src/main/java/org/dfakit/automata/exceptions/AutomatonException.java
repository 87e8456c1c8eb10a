package org.dfakit.automata.exceptions;

import lombok.Getter;
import org.dfakit.automata.base.TransitionKey;
import org.dfakit.core.State;
import org.dfakit.core.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * 自动机构造或执行失败时抛出的异常。
 * 携带错误类别 {@link ErrorKind} 与出错的标签；异常消息的措辞是稳定的，调用方可以据此匹配。
 */
@Getter
public class AutomatonException extends RuntimeException {

    private final ErrorKind kind;
    // 出错的标签，按出现顺序
    private final List<String> labels;

    public AutomatonException(ErrorKind kind, String message, List<String> labels) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null.");
        this.labels = List.copyOf(labels);
    }

    public static AutomatonException unknownState(State state) {
        return new AutomatonException(ErrorKind.UNKNOWN_STATE,
                String.format("state %s not in state set", state), List.of(state.getLabel()));
    }

    public static AutomatonException unknownNextState(State nextState) {
        return new AutomatonException(ErrorKind.UNKNOWN_STATE,
                String.format("next state %s not in state set", nextState), List.of(nextState.getLabel()));
    }

    public static AutomatonException unknownSymbol(Symbol symbol) {
        return new AutomatonException(ErrorKind.UNKNOWN_SYMBOL,
                String.format("symbol %s not in alphabet", symbol), List.of(symbol.getLabel()));
    }

    public static AutomatonException duplicateTransition(TransitionKey key) {
        return new AutomatonException(ErrorKind.DUPLICATE_TRANSITION,
                String.format("transition %s already defined", key), labelsOf(key));
    }

    public static AutomatonException emptyStates() {
        return new AutomatonException(ErrorKind.EMPTY_STATES,
                "FSM must have at least one state", List.of());
    }

    public static AutomatonException emptyAlphabet() {
        return new AutomatonException(ErrorKind.EMPTY_ALPHABET,
                "FSM must have at least one symbol in alphabet", List.of());
    }

    public static AutomatonException missingInitialState() {
        return new AutomatonException(ErrorKind.MISSING_INITIAL_STATE,
                "FSM must have an initial state", List.of());
    }

    public static AutomatonException emptyFinalStates() {
        return new AutomatonException(ErrorKind.EMPTY_FINAL_STATES,
                "FSM must have at least one final state", List.of());
    }

    public static AutomatonException initialStateNotInStates(State initialState) {
        return new AutomatonException(ErrorKind.INITIAL_STATE_NOT_IN_STATES,
                "initial state must be in state set", List.of(initialState.getLabel()));
    }

    public static AutomatonException missingTransition(TransitionKey key) {
        return new AutomatonException(ErrorKind.MISSING_TRANSITION,
                String.format("transition %s is not defined", key), labelsOf(key));
    }

    public static AutomatonException transitionUndefined(TransitionKey key) {
        return new AutomatonException(ErrorKind.TRANSITION_UNDEFINED,
                String.format("no transition defined for %s", key), labelsOf(key));
    }

    private static List<String> labelsOf(TransitionKey key) {
        return List.of(key.getState().getLabel(), key.getSymbol().getLabel());
    }
}
