package org.dfakit.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 代表输入字母表中的一个符号 (a ∈ Σ)。
 * Symbol 与 State 是不同的类型，即使两者的标签相同也互不相等。
 * 此类是不可变的。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    private final String label;

    private final int hashCode;

    private Symbol(String label) {
        this.label = Objects.requireNonNull(label, "Symbol label cannot be null");
        this.hashCode = label.hashCode();
        logger.debug("创建 Symbol: {}", label);
    }

    /**
     * 工厂方法：根据标签创建符号。
     * @param label 符号的标签。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(String label) {
        return new Symbol(label);
    }

    /**
     * 将输入串按 Unicode 码点拆分为符号序列，每个码点对应一个符号，保持原有顺序。
     * 字母表需要以同样的单位声明，否则处理时每一步都会报告未知符号。
     * @param input 输入串。
     * @return 按顺序排列的符号列表。
     */
    public static List<Symbol> split(CharSequence input) {
        Objects.requireNonNull(input, "Input cannot be null");
        return input.codePoints()
                .mapToObj(codePoint -> new Symbol(new String(Character.toChars(codePoint))))
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
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
    public int compareTo(Symbol other) {
        return this.label.compareTo(other.label);
    }
}
