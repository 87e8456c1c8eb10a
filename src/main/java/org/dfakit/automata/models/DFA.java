package org.dfakit.automata.models;

import org.dfakit.automata.base.TransitionKey;
import org.dfakit.automata.exceptions.AutomatonException;
import org.dfakit.core.State;
import org.dfakit.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 代表一个确定性有限自动机 (Q, Σ, q0, F, δ)。
 * 构造后五元组不再改变，唯一可变的是当前状态游标。
 * 通常通过 {@link DFABuilder#build()} 获得，构造器本身不做完全性校验，
 * 因此 {@link #step(Symbol)} 仍会检查迁移是否存在。
 */
public final class DFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    private final Set<State> states;                     // Q
    private final Set<Symbol> alphabet;                  // Σ
    private final State initialState;                    // q0
    private final Set<State> finalStates;                // F
    private final Map<TransitionKey, State> transitions; // δ: Q×Σ→Q

    private State currentState;

    /**
     * 构造一个 DFA，所有集合都会被复制为不可变副本。
     *
     * @param states       状态集合。
     * @param alphabet     字母表。
     * @param initialState 初始状态。
     * @param finalStates  终态集合。
     * @param transitions  迁移表。
     */
    DFA(Set<State> states, Set<Symbol> alphabet, State initialState, Set<State> finalStates, Map<TransitionKey, State> transitions) {
        this.states = Set.copyOf(Objects.requireNonNull(states, "States set cannot be null."));
        this.alphabet = Set.copyOf(Objects.requireNonNull(alphabet, "Alphabet cannot be null."));
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null.");
        this.finalStates = Set.copyOf(Objects.requireNonNull(finalStates, "Final states set cannot be null."));
        this.transitions = Map.copyOf(Objects.requireNonNull(transitions, "Transitions map cannot be null."));
        this.currentState = initialState;
    }

    @Override
    public void reset() {
        currentState = initialState;
    }

    @Override
    public State getCurrentState() {
        return currentState;
    }

    @Override
    public State getInitialState() {
        return initialState;
    }

    /**
     * 查询 δ(state, symbol)，不移动游标。
     * @return 目标状态；未定义时为空。
     */
    public Optional<State> next(State state, Symbol symbol) {
        return Optional.ofNullable(transitions.get(TransitionKey.of(state, symbol)));
    }

    @Override
    public void step(Symbol symbol) {
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        if (!alphabet.contains(symbol)) {
            throw AutomatonException.unknownSymbol(symbol);
        }
        TransitionKey key = TransitionKey.of(currentState, symbol);
        State nextState = transitions.get(key);
        if (nextState == null) {
            throw AutomatonException.transitionUndefined(key);
        }
        logger.debug("{} = {}", key, nextState);
        currentState = nextState;
    }

    @Override
    public void processString(String input) {
        processSymbols(Symbol.split(input));
    }

    @Override
    public void processSymbols(List<Symbol> symbols) {
        for (Symbol symbol : symbols) {
            step(symbol);
        }
    }

    @Override
    public boolean isFinalState() {
        return finalStates.contains(currentState);
    }

    @Override
    public boolean processInput(String input) {
        return processInput(Symbol.split(input));
    }

    @Override
    public boolean processInput(List<Symbol> symbols) {
        reset();
        processSymbols(symbols);
        return isFinalState();
    }

    @Override
    public Set<State> getStates() {
        return new HashSet<>(states);
    }

    @Override
    public Set<Symbol> getAlphabet() {
        return new HashSet<>(alphabet);
    }

    @Override
    public Set<State> getFinalStates() {
        return new HashSet<>(finalStates);
    }

    @Override
    public String toString() {
        return "DFA(states=" + states.size() + ", symbols=" + alphabet.size()
                + ", initial=" + initialState.getLabel() + ", current=" + currentState.getLabel() + ")";
    }
}
