package org.dfakit.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表 DFA 中的一个状态 (q ∈ Q)。
 * State 是不可变对象，其身份完全由标签决定：标签相同的两个 State 相等。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final String label;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 State。
     * @param label 状态的标签。
     */
    private State(String label) {
        this.label = Objects.requireNonNull(label, "State label cannot be null");
        this.hashCode = label.hashCode();
        logger.debug("创建 State: {}", label);
    }

    /**
     * 工厂方法：根据标签创建状态。
     * @param label 状态的标签。
     * @return 对应的 State 实例。
     */
    public static State of(String label) {
        return new State(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public int compareTo(State other) {
        return this.label.compareTo(other.label);
    }
}
