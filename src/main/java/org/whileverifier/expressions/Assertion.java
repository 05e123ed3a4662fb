package org.whileverifier.expressions;

import org.whileverifier.core.VariableValuation;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 逻辑断言。与 {@link Expression} 是两套独立的文法：
 * 逻辑联结词只作用于断言，{@link AtomicAssertion} 是两者之间唯一的边界。
 * 所有实现都是不可变的。
 */
public sealed interface Assertion
        permits TrueAssertion, FalseAssertion, AtomicAssertion, NotAssertion, AndAssertion, OrAssertion, ImpliesAssertion {

    /**
     * 返回把 variable 替换为 replacement 之后的新断言，原断言不变。
     * 变量不出现时返回 this。
     */
    Assertion substitute(String variable, Expression replacement);

    void collectVariables(Set<String> into);

    /**
     * 在给定赋值下判定真假。
     */
    boolean evaluate(VariableValuation valuation);

    default Set<String> getVariables() {
        Set<String> variables = new TreeSet<>();
        collectVariables(variables);
        return Collections.unmodifiableSet(variables);
    }
}
