package org.whileverifier.expressions;

import org.whileverifier.core.VariableValuation;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * While 语言中的表达式。纯语法对象，本身不具有断言语义。
 * 所有实现都是不可变的，可以在多个验证条件之间共享。
 */
public sealed interface Expression permits Variable, NumberLiteral, BinaryExpression, UnaryExpression {

    /**
     * 将表达式中所有的 {@code Variable(variable)} 替换为 replacement。
     * 语言中没有绑定结构，因此替换不需要重命名。
     * 如果变量不出现，返回 this。
     */
    Expression substitute(String variable, Expression replacement);

    /**
     * 将出现的变量名加入 into。
     */
    void collectVariables(Set<String> into);

    /**
     * 在给定赋值下求值。关系与逻辑运算的结果记为 1 (真) 或 0 (假)。
     * 除法与取模采用 SMT-LIB 的整数语义 (余数非负)。
     *
     * @throws ArithmeticException 如果除数为 0。
     * @throws IllegalArgumentException 如果某个变量在赋值中不存在。
     */
    BigInteger evaluate(VariableValuation valuation);

    default Set<String> getVariables() {
        Set<String> variables = new TreeSet<>();
        collectVariables(variables);
        return Collections.unmodifiableSet(variables);
    }
}
