package org.dfakit.automata.models;

import org.apache.commons.lang3.StringUtils;
import org.dfakit.automata.base.TransitionKey;
import org.dfakit.automata.exceptions.AutomatonException;
import org.dfakit.core.State;
import org.dfakit.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 以流式接口逐步组装 DFA 的五元组，并在每次添加时对照当前的状态集与字母表进行校验。
 * <p>
 * 失败时抛出 {@link AutomatonException}，已经完成的修改不会回滚，构建器仍可继续使用或检查。
 * {@link #build()} 不会消耗构建器，之后对构建器的修改也不会影响已经构建出的 DFA。
 */
public final class DFABuilder {

    private static final Logger logger = LoggerFactory.getLogger(DFABuilder.class);

    // 集合保持声明顺序，完全性检查按此顺序报告第一个缺失的迁移
    final Set<State> states = new LinkedHashSet<>();
    final Set<Symbol> alphabet = new LinkedHashSet<>();
    final Set<State> finalStates = new LinkedHashSet<>();
    final Map<TransitionKey, State> transitions = new LinkedHashMap<>();
    State initialState;

    public DFABuilder addStates(State... newStates) {
        for (State state : newStates) {
            states.add(Objects.requireNonNull(state, "State cannot be null."));
        }
        logger.debug("添加状态: {}", Arrays.toString(newStates));
        return this;
    }

    public DFABuilder addStates(String... labels) {
        return addStates(Arrays.stream(labels).map(State::of).toArray(State[]::new));
    }

    public DFABuilder addSymbols(Symbol... symbols) {
        for (Symbol symbol : symbols) {
            alphabet.add(Objects.requireNonNull(symbol, "Symbol cannot be null."));
        }
        logger.debug("添加符号: {}", Arrays.toString(symbols));
        return this;
    }

    public DFABuilder addSymbols(String... labels) {
        return addSymbols(Arrays.stream(labels).map(Symbol::of).toArray(Symbol[]::new));
    }

    /**
     * 设置初始状态，后一次调用覆盖前一次。
     * @param state 初始状态，必须已在状态集中。
     * @return 此构建器。
     * @throws AutomatonException 状态不在状态集中。
     */
    public DFABuilder setInitialState(State state) {
        Objects.requireNonNull(state, "Initial state cannot be null.");
        if (!states.contains(state)) {
            throw AutomatonException.unknownState(state);
        }
        initialState = state;
        return this;
    }

    public DFABuilder setInitialState(String label) {
        return setInitialState(State.of(label));
    }

    /**
     * 依次添加终态。遇到第一个未知状态即抛出，之前的终态保留。
     * @param states 终态，必须都已在状态集中。
     * @return 此构建器。
     * @throws AutomatonException 某个状态不在状态集中。
     */
    public DFABuilder addFinalStates(State... states) {
        for (State state : states) {
            Objects.requireNonNull(state, "Final state cannot be null.");
            if (!this.states.contains(state)) {
                throw AutomatonException.unknownState(state);
            }
            finalStates.add(state);
        }
        return this;
    }

    public DFABuilder addFinalStates(String... labels) {
        return addFinalStates(Arrays.stream(labels).map(State::of).toArray(State[]::new));
    }

    /**
     * 注册迁移 δ(state, symbol) = nextState。
     * 依次检查源状态、目标状态、符号，最后检查是否重复定义。
     * @return 此构建器。
     * @throws AutomatonException 任一检查失败。
     */
    public DFABuilder addTransition(State state, Symbol symbol, State nextState) {
        Objects.requireNonNull(state, "State cannot be null.");
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        Objects.requireNonNull(nextState, "Next state cannot be null.");
        if (!states.contains(state)) {
            throw AutomatonException.unknownState(state);
        }
        if (!states.contains(nextState)) {
            throw AutomatonException.unknownNextState(nextState);
        }
        if (!alphabet.contains(symbol)) {
            throw AutomatonException.unknownSymbol(symbol);
        }
        TransitionKey key = TransitionKey.of(state, symbol);
        if (transitions.containsKey(key)) {
            throw AutomatonException.duplicateTransition(key);
        }
        transitions.put(key, nextState);
        logger.debug("注册迁移 {} = {}", key, nextState);
        return this;
    }

    public DFABuilder addTransition(String state, String symbol, String nextState) {
        return addTransition(State.of(state), Symbol.of(symbol), State.of(nextState));
    }

    /**
     * 按顺序批量添加迁移，每个条目都委托给 {@link #addTransition(State, Symbol, State)}。
     * 第一个失败即停止，此前添加的迁移保留。
     * @param batch 迁移组的有序列表。
     * @return 此构建器。
     */
    public DFABuilder addTransitions(List<Map<TransitionKey, State>> batch) {
        for (Map<TransitionKey, State> group : batch) {
            for (Map.Entry<TransitionKey, State> entry : group.entrySet()) {
                TransitionKey key = entry.getKey();
                addTransition(key.getState(), key.getSymbol(), entry.getValue());
            }
        }
        return this;
    }

    /**
     * 校验并构建 DFA。检查顺序固定：结构性检查在前，Q×Σ 完全性扫描在最后。
     * @return 新的 DFA，当前状态为初始状态。
     * @throws AutomatonException 第一个不满足的约束。
     */
    public DFA build() {
        if (states.isEmpty()) {
            throw AutomatonException.emptyStates();
        }
        if (alphabet.isEmpty()) {
            throw AutomatonException.emptyAlphabet();
        }
        if (initialState == null || StringUtils.isEmpty(initialState.getLabel())) {
            throw AutomatonException.missingInitialState();
        }
        if (finalStates.isEmpty()) {
            throw AutomatonException.emptyFinalStates();
        }
        // setInitialState 已检查过，这里再检查一次
        if (!states.contains(initialState)) {
            throw AutomatonException.initialStateNotInStates(initialState);
        }
        for (State state : states) {
            for (Symbol symbol : alphabet) {
                TransitionKey key = TransitionKey.of(state, symbol);
                if (!transitions.containsKey(key)) {
                    throw AutomatonException.missingTransition(key);
                }
            }
        }

        DFA dfa = new DFA(states, alphabet, initialState, finalStates, transitions);
        logger.info("构建 DFA: {} 个状态, {} 个符号, {} 条迁移, 初始状态 {}",
                states.size(), alphabet.size(), transitions.size(), initialState);
        return dfa;
    }

    public Set<State> getStates() {
        return Collections.unmodifiableSet(states);
    }

    public Set<Symbol> getAlphabet() {
        return Collections.unmodifiableSet(alphabet);
    }

    public Set<State> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    public Map<TransitionKey, State> getTransitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public Optional<State> getInitialState() {
        return Optional.ofNullable(initialState);
    }
}
