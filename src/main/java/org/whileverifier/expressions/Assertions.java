package org.whileverifier.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 断言的构造与变换工具。
 */
public final class Assertions {

    private static final Logger logger = LoggerFactory.getLogger(Assertions.class);

    public static final Assertion TRUE = TrueAssertion.INSTANCE;
    public static final Assertion FALSE = FalseAssertion.INSTANCE;

    private Assertions() {
    }

    /**
     * 计算 assertion[replacement/variable]，即赋值公理中的 Q[e/x]。
     * 纯结构替换，不修改原断言；未受影响的子树按引用共享。
     *
     * @param assertion   被替换的断言。
     * @param variable    被替换的变量名。
     * @param replacement 替换成的表达式。
     * @return 替换后的断言；变量未出现时即为 assertion 本身。
     */
    public static Assertion substitute(Assertion assertion, String variable, Expression replacement) {
        Objects.requireNonNull(assertion, "Assertions.substitute: assertion 不能为 null");
        Objects.requireNonNull(variable, "Assertions.substitute: variable 不能为 null");
        Objects.requireNonNull(replacement, "Assertions.substitute: replacement 不能为 null");
        Assertion result = assertion.substitute(variable, replacement);
        logger.debug("替换 {} := {} 于 {}，得到 {}", variable, replacement, assertion, result);
        return result;
    }

    /**
     * 将 if/while 的条件表达式转换为断言。
     * <ul>
     *     <li>关系运算 -> {@link AtomicAssertion}</li>
     *     <li>{@code &&}, {@code ||}, {@code !} -> 对应的逻辑联结词</li>
     *     <li>其余算术表达式 e -> {@code e != 0}</li>
     * </ul>
     */
    public static Assertion fromCondition(Expression condition) {
        Objects.requireNonNull(condition, "Assertions.fromCondition: condition 不能为 null");
        if (condition instanceof BinaryExpression binary) {
            BinaryOperatorType op = binary.getOperator();
            if (op.isRelational()) {
                return AtomicAssertion.of(binary.getLeft(), op.toRelationType(), binary.getRight());
            }
            if (op == BinaryOperatorType.AND) {
                return AndAssertion.of(fromCondition(binary.getLeft()), fromCondition(binary.getRight()));
            }
            if (op == BinaryOperatorType.OR) {
                return OrAssertion.of(fromCondition(binary.getLeft()), fromCondition(binary.getRight()));
            }
        }
        if (condition instanceof UnaryExpression unary && unary.getOperator() == UnaryOperatorType.NOT) {
            return NotAssertion.of(fromCondition(unary.getOperand()));
        }
        return AtomicAssertion.of(condition, RelationType.NE, NumberLiteral.ZERO);
    }

    /**
     * 多个断言的合取，空列表为 true，单个元素原样返回。
     */
    public static Assertion conjunction(List<Assertion> conjuncts) {
        if (conjuncts.isEmpty()) {
            return TRUE;
        }
        Assertion result = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            result = AndAssertion.of(result, conjuncts.get(i));
        }
        return result;
    }

    public static Assertion atom(Expression left, RelationType relation, Expression right) {
        return AtomicAssertion.of(left, relation, right);
    }

    public static Assertion and(Assertion left, Assertion right) {
        return AndAssertion.of(left, right);
    }

    public static Assertion or(Assertion left, Assertion right) {
        return OrAssertion.of(left, right);
    }

    public static Assertion not(Assertion operand) {
        return NotAssertion.of(operand);
    }

    public static Assertion implies(Assertion antecedent, Assertion consequent) {
        return ImpliesAssertion.of(antecedent, consequent);
    }
}
