package org.whileverifier.vcg;

import org.whileverifier.expressions.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 构造保证表达式有定义的断言。例如对于
 * <pre>
 *     y := a / (b - c)
 * </pre>
 * 需要在赋值之前成立 {@code (b - c) != 0}。
 * 除数内部的除法先于外层检查，因此 {@code a / (b / c)} 得到 {@code c != 0 && (b / c) != 0}。
 * 逻辑运算不做短路处理，条件 {@code x != 0 && y / x > 1} 同样要求 {@code x != 0}。
 */
public final class DefinednessExtractor {

    private DefinednessExtractor() {
    }

    /**
     * @return 所有除数非零条件的合取；没有除法时为 true。
     */
    public static Assertion extract(Expression expression) {
        List<Assertion> conditions = new ArrayList<>();
        collect(expression, conditions);
        return Assertions.conjunction(conditions);
    }

    public static boolean hasDivision(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.getOperator().isDivision() || hasDivision(binary.getLeft()) || hasDivision(binary.getRight());
        }
        if (expression instanceof UnaryExpression unary) {
            return hasDivision(unary.getOperand());
        }
        return false;
    }

    private static void collect(Expression expression, List<Assertion> into) {
        if (expression instanceof BinaryExpression binary) {
            collect(binary.getLeft(), into);
            collect(binary.getRight(), into);
            if (binary.getOperator().isDivision()) {
                into.add(AtomicAssertion.of(binary.getRight(), RelationType.NE, NumberLiteral.ZERO));
            }
        } else if (expression instanceof UnaryExpression unary) {
            collect(unary.getOperand(), into);
        }
    }
}
