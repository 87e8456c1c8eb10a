package org.dfakit.demo;

import org.apache.commons.lang3.StringUtils;
import org.dfakit.automata.base.TransitionKey;
import org.dfakit.automata.exceptions.AutomatonException;
import org.dfakit.automata.models.DFA;
import org.dfakit.automata.models.DFABuilder;
import org.dfakit.core.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模 3 自动机演示：把二进制串看作无符号整数 n，处理结束时的状态 S{n mod 3}。
 */
public final class ModuloThreeDemo {

    private static final Logger logger = LoggerFactory.getLogger(ModuloThreeDemo.class);

    static final String CONFIG_RESOURCE = "dfakit-demo.properties";
    static final String INPUTS_KEY = "demo.inputs";

    private ModuloThreeDemo() {
    }

    /**
     * 构建模 3 自动机：Q = {S0, S1, S2}，Σ = {0, 1}，q0 = S0，F = Q。
     * @return 新的 DFA 实例。
     */
    public static DFA moduloThree() {
        List<Map<TransitionKey, State>> transitions = List.of(
                Map.of(TransitionKey.of("S0", "0"), State.of("S0")),
                Map.of(TransitionKey.of("S0", "1"), State.of("S1")),
                Map.of(TransitionKey.of("S1", "0"), State.of("S2")),
                Map.of(TransitionKey.of("S1", "1"), State.of("S0")),
                Map.of(TransitionKey.of("S2", "0"), State.of("S1")),
                Map.of(TransitionKey.of("S2", "1"), State.of("S2"))
        );
        return new DFABuilder()
                .addStates("S0", "S1", "S2")
                .addSymbols("0", "1")
                .setInitialState("S0")
                .addFinalStates("S0", "S1", "S2")
                .addTransitions(transitions)
                .build();
    }

    /**
     * 依次处理每个输入，记录其结束状态。无法处理的输入记为错误并跳过。
     * @param inputs 二进制串。
     * @return 输入到结束状态的映射，保持输入顺序。
     */
    public static Map<String, State> run(List<String> inputs) {
        DFA automaton = moduloThree();
        Map<String, State> results = new LinkedHashMap<>();
        for (String input : inputs) {
            try {
                automaton.processInput(input);
            } catch (AutomatonException e) {
                logger.error("Error processing input '{}': {}", input, e.getMessage());
                continue;
            }
            State state = automaton.getCurrentState();
            results.put(input, state);
            logger.info("{} => {} (mod 3 = {})", input, state, StringUtils.removeStart(state.getLabel(), "S"));
        }
        return results;
    }

    /**
     * 从类路径读取默认输入。
     * @return 配置中的输入列表；缺少配置文件时为空。
     */
    static List<String> loadDefaultInputs() {
        Properties properties = new Properties();
        try (InputStream in = ModuloThreeDemo.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                logger.warn("未找到配置文件 {}", CONFIG_RESOURCE);
                return List.of();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
        }
        return parseInputs(properties.getProperty(INPUTS_KEY));
    }

    static List<String> parseInputs(String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        return Arrays.stream(StringUtils.split(value, ','))
                .map(StringUtils::trim)
                .filter(StringUtils::isNotEmpty)
                .toList();
    }

    public static void main(String[] args) {
        List<String> inputs = args.length > 0 ? Arrays.asList(args) : loadDefaultInputs();
        run(inputs);
    }
}
