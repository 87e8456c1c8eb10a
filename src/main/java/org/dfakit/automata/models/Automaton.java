package org.dfakit.automata.models;

import org.dfakit.core.State;
import org.dfakit.core.Symbol;

import java.util.List;
import java.util.Set;

/**
 * 可执行的有限自动机：维护一个当前状态游标，逐个消费输入符号。
 * 实现类不做内部同步，多线程共享同一实例时需由调用方串行化。
 */
public interface Automaton {

    /**
     * 将当前状态重置为初始状态。幂等。
     */
    void reset();

    State getCurrentState();

    State getInitialState();

    /**
     * 在当前状态上消费一个符号。
     * @param symbol 输入符号。
     * @throws org.dfakit.automata.exceptions.AutomatonException 符号不在字母表中，或迁移未定义。
     */
    void step(Symbol symbol);

    /**
     * 从当前状态开始依次消费输入串中的每个符号，遇到第一个错误即停止，已经发生的移动不回滚。
     * @param input 输入串，按码点拆分为符号。
     */
    void processString(String input);

    void processSymbols(List<Symbol> symbols);

    boolean isFinalState();

    /**
     * 重置后处理整个输入串，并返回是否接受。
     * @param input 输入串。
     * @return 处理完后当前状态是否为终态。
     */
    boolean processInput(String input);

    boolean processInput(List<Symbol> symbols);

    Set<State> getStates();

    Set<Symbol> getAlphabet();

    Set<State> getFinalStates();
}
