package org.whileverifier.symbolic;

import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.*;
import org.whileverifier.statements.Assignment;
import org.whileverifier.vcg.GenerationErrorKind;
import org.whileverifier.vcg.GenerationException;
import org.whileverifier.vcg.VcRole;
import org.whileverifier.vcg.VerificationCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaValidatorTest {

    private static final Variable x = Variable.of("x");
    private static final SourcePosition POSITION = SourcePosition.of(6, 2);

    private static VerificationCondition condition(Expression left) {
        Assignment source = Assignment.of("y", x, POSITION);
        return VerificationCondition.of(Assertions.atom(left, RelationType.EQ, NumberLiteral.ONE),
                VcRole.INVARIANT_PRESERVED, source);
    }

    @Test
    @DisplayName("字面量除数 0 -> DIVISION_BY_ZERO，带位置")
    void testLiteralZeroDivisor() {
        VerificationCondition vc = condition(BinaryExpression.divide(x, NumberLiteral.ZERO));
        GenerationException e = assertThrows(GenerationException.class, () -> FormulaValidator.validate(vc));
        assertEquals(GenerationErrorKind.DIVISION_BY_ZERO, e.getKind());
        assertEquals(POSITION, e.getPosition());
    }

    @Test
    @DisplayName("-0 同样是字面量 0")
    void testNegatedZeroDivisor() {
        VerificationCondition vc = condition(BinaryExpression.modulo(x, UnaryExpression.negate(NumberLiteral.of(0))));
        GenerationException e = assertThrows(GenerationException.class, () -> FormulaValidator.validate(List.of(vc)));
        assertEquals(GenerationErrorKind.DIVISION_BY_ZERO, e.getKind());
    }

    @Test
    @DisplayName("非常量除数照常通过")
    void testVariableDivisor_Accepted() {
        assertDoesNotThrow(() -> FormulaValidator.validate(condition(BinaryExpression.divide(x, Variable.of("d")))));
        assertDoesNotThrow(() -> FormulaValidator.validate(condition(BinaryExpression.divide(x, NumberLiteral.of(2)))));
    }

    @Test
    @DisplayName("算术位置的关系运算 -> MALFORMED_EXPRESSION")
    void testMalformed() {
        VerificationCondition vc = condition(BinaryExpression.multiply(x, BinaryExpression.greaterThan(x, NumberLiteral.ONE)));
        GenerationException e = assertThrows(GenerationException.class, () -> FormulaValidator.validate(vc));
        assertEquals(GenerationErrorKind.MALFORMED_EXPRESSION, e.getKind());
    }

    @Test
    @DisplayName("深入所有联结词检查")
    void testNested() {
        Assertion inner = Assertions.atom(BinaryExpression.divide(NumberLiteral.ONE, NumberLiteral.ZERO), RelationType.LT, x);
        VerificationCondition vc = VerificationCondition.of(
                Assertions.implies(Assertions.TRUE, Assertions.or(Assertions.FALSE, Assertions.not(inner))),
                VcRole.TOP_LEVEL, null);
        GenerationException e = assertThrows(GenerationException.class, () -> FormulaValidator.validate(vc));
        assertNull(e.getPosition());
    }
}
