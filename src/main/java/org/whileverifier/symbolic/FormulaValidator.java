package org.whileverifier.symbolic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whileverifier.expressions.*;
import org.whileverifier.vcg.GenerationErrorKind;
import org.whileverifier.vcg.GenerationException;
import org.whileverifier.vcg.VerificationCondition;

import java.util.List;

/**
 * 在打开任何求解会话之前，检查验证条件能否被 {@link Z3FormulaEncoder} 编码：
 * <ul>
 *     <li>除数是字面量 0 -> {@link GenerationErrorKind#DIVISION_BY_ZERO}</li>
 *     <li>算术位置出现关系或逻辑运算 -> {@link GenerationErrorKind#MALFORMED_EXPRESSION}</li>
 * </ul>
 * 非常量除数照常编码。
 */
public final class FormulaValidator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaValidator.class);

    private FormulaValidator() {
    }

    public static void validate(List<VerificationCondition> conditions) {
        for (VerificationCondition condition : conditions) {
            validate(condition);
        }
    }

    public static void validate(VerificationCondition condition) {
        checkAssertion(condition.getAssertion(), condition);
    }

    private static void checkAssertion(Assertion assertion, VerificationCondition owner) {
        if (assertion instanceof AtomicAssertion atom) {
            checkArithmetic(atom.getLeft(), owner);
            checkArithmetic(atom.getRight(), owner);
        } else if (assertion instanceof NotAssertion not) {
            checkAssertion(not.getOperand(), owner);
        } else if (assertion instanceof AndAssertion and) {
            checkAssertion(and.getLeft(), owner);
            checkAssertion(and.getRight(), owner);
        } else if (assertion instanceof OrAssertion or) {
            checkAssertion(or.getLeft(), owner);
            checkAssertion(or.getRight(), owner);
        } else if (assertion instanceof ImpliesAssertion implies) {
            checkAssertion(implies.getAntecedent(), owner);
            checkAssertion(implies.getConsequent(), owner);
        }
    }

    private static void checkArithmetic(Expression expression, VerificationCondition owner) {
        if (expression instanceof BinaryExpression binary) {
            BinaryOperatorType op = binary.getOperator();
            if (!op.isArithmetic()) {
                throw failure(GenerationErrorKind.MALFORMED_EXPRESSION,
                        "operator " + op.getSymbol() + " used as an integer in " + binary, owner);
            }
            if (op.isDivision() && isLiteralZero(binary.getRight())) {
                throw failure(GenerationErrorKind.DIVISION_BY_ZERO, "division by zero in " + binary, owner);
            }
            checkArithmetic(binary.getLeft(), owner);
            checkArithmetic(binary.getRight(), owner);
        } else if (expression instanceof UnaryExpression unary) {
            if (unary.getOperator() != UnaryOperatorType.NEG) {
                throw failure(GenerationErrorKind.MALFORMED_EXPRESSION,
                        "operator " + unary.getOperator().getSymbol() + " used as an integer in " + unary, owner);
            }
            checkArithmetic(unary.getOperand(), owner);
        }
    }

    private static boolean isLiteralZero(Expression expression) {
        if (expression instanceof NumberLiteral number) {
            return number.isZero();
        }
        // -0 同样是字面量 0
        return expression instanceof UnaryExpression unary
                && unary.getOperator() == UnaryOperatorType.NEG
                && isLiteralZero(unary.getOperand());
    }

    private static GenerationException failure(GenerationErrorKind kind, String message, VerificationCondition owner) {
        logger.error("{} 无法编码 ({}): {}", owner, kind, message);
        return new GenerationException(kind, message, owner.getPosition());
    }
}
