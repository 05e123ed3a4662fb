package org.whileverifier.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 程序变量到整数值的赋值。求解器给出的反例即以此形式呈现。
 * 按变量名排序，保证输出稳定。
 */
@Getter
public final class VariableValuation {

    private static final Logger logger = LoggerFactory.getLogger(VariableValuation.class);

    public static final VariableValuation EMPTY = new VariableValuation(Collections.emptyMap());

    /**
     * @return Map<String, BigInteger>。
     */
    private final SortedMap<String, BigInteger> values;

    private VariableValuation(Map<String, BigInteger> values) {
        SortedMap<String, BigInteger> copy = new TreeMap<>();
        for (Map.Entry<String, BigInteger> entry : Objects.requireNonNull(values, "values 不能为 null").entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "变量名不能为 null"),
                    Objects.requireNonNull(entry.getValue(), "变量 " + entry.getKey() + " 的值不能为 null"));
        }
        this.values = Collections.unmodifiableSortedMap(copy);
        logger.debug("创建 VariableValuation: {}", this.values);
    }

    /**
     * 工厂方法：从 Map 创建 VariableValuation 实例。
     * @param values 变量名到整数值的映射。
     * @return VariableValuation 实例。
     */
    public static VariableValuation of(Map<String, BigInteger> values) {
        return new VariableValuation(values);
    }

    /**
     * 便于测试的工厂方法，按 名字, 值, 名字, 值 ... 的顺序给出。
     */
    public static VariableValuation of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("VariableValuation.of: 参数必须成对出现");
        }
        Map<String, BigInteger> values = new HashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            String name = (String) namesAndValues[i];
            Object value = namesAndValues[i + 1];
            values.put(name, value instanceof BigInteger big ? big : BigInteger.valueOf(((Number) value).longValue()));
        }
        return new VariableValuation(values);
    }

    /**
     * 获取指定变量的值。
     * @param name 变量名。
     * @return 变量的整数值。
     * @throws IllegalArgumentException 如果变量不存在于此赋值中。
     */
    public BigInteger getValue(String name) {
        BigInteger value = values.get(name);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前赋值 {} 中。", name, this);
            throw new IllegalArgumentException("变量 '" + name + "' 不存在于当前赋值中。");
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> getVariables() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 形如 {@code i=0, x=1, y=-1} 的文本，用于报告。
     */
    public String format() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableValuation that = (VariableValuation) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "{" + format() + "}";
    }
}
