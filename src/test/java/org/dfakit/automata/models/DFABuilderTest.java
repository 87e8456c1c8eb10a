package org.dfakit.automata.models;

import org.dfakit.automata.base.TransitionKey;
import org.dfakit.automata.exceptions.AutomatonException;
import org.dfakit.automata.exceptions.ErrorKind;
import org.dfakit.core.State;
import org.dfakit.core.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DFABuilderTest {

    private DFABuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DFABuilder()
                .addStates("q0", "q1", "q2")
                .addSymbols("0", "1");
    }

    private static void assertFailure(ErrorKind kind, String message, Runnable action) {
        AutomatonException e = assertThrows(AutomatonException.class, action::run);
        assertAll(
                () -> assertEquals(kind, e.getKind()),
                () -> assertEquals(message, e.getMessage())
        );
    }

    @Nested
    @DisplayName("添加状态与符号 (States and Symbols)")
    class AddTests {

        @Test
        @DisplayName("重复添加状态是幂等的")
        void testAddStates_IsIdempotent() {
            builder.addStates("q0", "q1").addStates("q2");
            assertEquals(Set.of(State.of("q0"), State.of("q1"), State.of("q2")), builder.getStates());
        }

        @Test
        @DisplayName("重复添加符号是幂等的")
        void testAddSymbols_IsIdempotent() {
            builder.addSymbols(Symbol.of("1"), Symbol.of("0"));
            assertEquals(Set.of(Symbol.of("0"), Symbol.of("1")), builder.getAlphabet());
        }
    }

    @Nested
    @DisplayName("初始状态与终态 (Initial and Final States)")
    class InitialAndFinalTests {

        @Test
        @DisplayName("未知的初始状态应被拒绝 (state S0 not in state set)")
        void testSetInitialState_Unknown_ShouldFail() {
            assertFailure(ErrorKind.UNKNOWN_STATE, "state S0 not in state set",
                    () -> builder.setInitialState("S0"));
            assertTrue(builder.getInitialState().isEmpty());
        }

        @Test
        @DisplayName("后一次设置的初始状态生效")
        void testSetInitialState_LastCallWins() {
            builder.setInitialState("q0").setInitialState("q2");
            assertEquals(State.of("q2"), builder.getInitialState().orElseThrow());
        }

        @Test
        @DisplayName("添加终态在第一个未知状态处停止，之前的保留")
        void testAddFinalStates_PartialApplication() {
            assertFailure(ErrorKind.UNKNOWN_STATE, "state X not in state set",
                    () -> builder.addFinalStates("q0", "X", "q1"));
            assertEquals(Set.of(State.of("q0")), builder.getFinalStates());
        }
    }

    @Nested
    @DisplayName("迁移 (Transitions)")
    class TransitionTests {

        @Test
        @DisplayName("源状态未知")
        void testAddTransition_UnknownSource() {
            assertFailure(ErrorKind.UNKNOWN_STATE, "state S0 not in state set",
                    () -> builder.addTransition("S0", "0", "q1"));
        }

        @Test
        @DisplayName("目标状态未知")
        void testAddTransition_UnknownTarget() {
            assertFailure(ErrorKind.UNKNOWN_STATE, "next state s1 not in state set",
                    () -> builder.addTransition("q0", "0", "s1"));
        }

        @Test
        @DisplayName("符号不在字母表中")
        void testAddTransition_UnknownSymbol() {
            assertFailure(ErrorKind.UNKNOWN_SYMBOL, "symbol 4 not in alphabet",
                    () -> builder.addTransition("q0", "4", "q1"));
        }

        @Test
        @DisplayName("源状态优先于符号检查")
        void testAddTransition_CheckOrder() {
            assertFailure(ErrorKind.UNKNOWN_STATE, "state S0 not in state set",
                    () -> builder.addTransition("S0", "4", "s1"));
        }

        @Test
        @DisplayName("重复定义迁移应被拒绝，原有映射不变")
        void testAddTransition_Duplicate() {
            builder.addTransition("q0", "0", "q1");
            AutomatonException e = assertThrows(AutomatonException.class,
                    () -> builder.addTransition("q0", "0", "q2"));
            assertAll(
                    () -> assertEquals(ErrorKind.DUPLICATE_TRANSITION, e.getKind()),
                    () -> assertEquals("transition δ(q0, 0) already defined", e.getMessage()),
                    () -> assertEquals(List.of("q0", "0"), e.getLabels()),
                    () -> assertEquals(State.of("q1"), builder.getTransitions().get(TransitionKey.of("q0", "0")))
            );
        }

        @Test
        @DisplayName("批量添加在第一个错误处停止，不回滚")
        void testAddTransitions_StopsAtFirstFailure() {
            List<Map<TransitionKey, State>> batch = List.of(
                    Map.of(TransitionKey.of("q0", "0"), State.of("q1")),
                    Map.of(TransitionKey.of("q0", "1"), State.of("nowhere")),
                    Map.of(TransitionKey.of("q1", "0"), State.of("q2"))
            );
            assertFailure(ErrorKind.UNKNOWN_STATE, "next state nowhere not in state set",
                    () -> builder.addTransitions(batch));
            assertEquals(Map.of(TransitionKey.of("q0", "0"), State.of("q1")), builder.getTransitions());
        }
    }

    @Nested
    @DisplayName("构建校验顺序 (Build Validation)")
    class BuildTests {

        @Test
        @DisplayName("没有状态")
        void testBuild_EmptyStates() {
            assertFailure(ErrorKind.EMPTY_STATES, "FSM must have at least one state",
                    () -> new DFABuilder().build());
        }

        @Test
        @DisplayName("没有符号")
        void testBuild_EmptyAlphabet() {
            assertFailure(ErrorKind.EMPTY_ALPHABET, "FSM must have at least one symbol in alphabet",
                    () -> new DFABuilder().addStates("q0").build());
        }

        @Test
        @DisplayName("没有初始状态")
        void testBuild_MissingInitialState() {
            assertFailure(ErrorKind.MISSING_INITIAL_STATE, "FSM must have an initial state",
                    () -> builder.build());
        }

        @Test
        @DisplayName("初始状态标签为空串视为缺失")
        void testBuild_EmptyInitialLabel() {
            builder.addStates("").setInitialState("").addFinalStates("q0");
            assertFailure(ErrorKind.MISSING_INITIAL_STATE, "FSM must have an initial state",
                    () -> builder.build());
        }

        @Test
        @DisplayName("没有终态在完全性检查之前报告")
        void testBuild_EmptyFinalStates() {
            builder.setInitialState("q0");
            assertFailure(ErrorKind.EMPTY_FINAL_STATES, "FSM must have at least one final state",
                    () -> builder.build());
        }

        @Test
        @DisplayName("初始状态不在状态集中")
        void testBuild_InitialStateNotInStates() {
            builder.addFinalStates("q0", "q1", "q2");
            builder.initialState = State.of("m0");
            assertFailure(ErrorKind.INITIAL_STATE_NOT_IN_STATES, "initial state must be in state set",
                    () -> builder.build());
        }

        @Test
        @DisplayName("缺少迁移时报告具体的 (q, a)")
        void testBuild_MissingTransition() {
            DFABuilder single = new DFABuilder()
                    .addStates("q0")
                    .addSymbols("0", "1")
                    .setInitialState("q0")
                    .addFinalStates("q0")
                    .addTransition("q0", "0", "q0");
            AutomatonException e = assertThrows(AutomatonException.class, single::build);
            assertAll(
                    () -> assertEquals(ErrorKind.MISSING_TRANSITION, e.getKind()),
                    () -> assertEquals("transition δ(q0, 1) is not defined", e.getMessage()),
                    () -> assertEquals(List.of("q0", "1"), e.getLabels())
            );
        }

        @Test
        @DisplayName("按声明顺序报告第一个缺失的迁移")
        void testBuild_MissingTransition_DeclarationOrder() {
            builder.setInitialState("q0").addFinalStates("q0")
                    .addTransition("q0", "0", "q0")
                    .addTransition("q0", "1", "q1")
                    .addTransition("q1", "0", "q2");
            assertFailure(ErrorKind.MISSING_TRANSITION, "transition δ(q1, 1) is not defined",
                    () -> builder.build());
        }

        @Test
        @DisplayName("构建后构建器仍可使用，且修改不影响已构建的 DFA")
        void testBuild_DoesNotConsumeBuilder() {
            DFABuilder twoStates = new DFABuilder()
                    .addStates("a", "b")
                    .addSymbols("x")
                    .setInitialState("a")
                    .addFinalStates("b")
                    .addTransition("a", "x", "b")
                    .addTransition("b", "x", "a");
            DFA first = twoStates.build();

            twoStates.addFinalStates("a");
            DFA second = twoStates.build();

            assertAll(
                    () -> assertEquals(Set.of(State.of("b")), first.getFinalStates()),
                    () -> assertEquals(Set.of(State.of("a"), State.of("b")), second.getFinalStates()),
                    () -> assertNotSame(first, second),
                    () -> assertEquals(State.of("a"), first.getCurrentState())
            );
        }
    }
}
