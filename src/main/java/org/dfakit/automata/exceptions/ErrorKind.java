package org.dfakit.automata.exceptions;

/**
 * 自动机构造与执行过程中可能出现的错误类别。
 * 所有错误都是立即报告、不可重试的校验或查找失败。
 */
public enum ErrorKind {
    /** 引用的状态不在状态集中。 */
    UNKNOWN_STATE,
    /** 引用的符号不在字母表中。 */
    UNKNOWN_SYMBOL,
    /** 同一 (q, a) 被重复定义迁移。 */
    DUPLICATE_TRANSITION,
    EMPTY_STATES,
    EMPTY_ALPHABET,
    EMPTY_FINAL_STATES,
    MISSING_INITIAL_STATE,
    /** build 时初始状态不在状态集中。 */
    INITIAL_STATE_NOT_IN_STATES,
    /** build 时迁移函数不完全。 */
    MISSING_TRANSITION,
    /** 执行 step 时查不到迁移。 */
    TRANSITION_UNDEFINED
}
