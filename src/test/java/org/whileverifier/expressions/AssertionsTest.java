package org.whileverifier.expressions;

import org.whileverifier.core.VariableValuation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssertionsTest {

    private static final Variable x = Variable.of("x");
    private static final Variable y = Variable.of("y");
    private static final Variable z = Variable.of("z");

    @Nested
    @DisplayName("替换 (Substitution)")
    class SubstitutionTests {

        @Test
        @DisplayName("替换穿过所有联结词，是结构同余")
        void testSubstitute_IsCongruence() {
            Assertion a = Assertions.atom(x, RelationType.LT, y);
            Assertion b = Assertions.atom(x, RelationType.EQ, z);
            Expression e = BinaryExpression.add(z, NumberLiteral.ONE);

            Assertion compound = Assertions.implies(Assertions.and(a, Assertions.not(b)), Assertions.or(b, a));
            Assertion expected = Assertions.implies(
                    Assertions.and(Assertions.substitute(a, "x", e), Assertions.not(Assertions.substitute(b, "x", e))),
                    Assertions.or(Assertions.substitute(b, "x", e), Assertions.substitute(a, "x", e)));

            assertEquals(expected, Assertions.substitute(compound, "x", e));
            assertEquals(Assertions.atom(e, RelationType.LT, y), Assertions.substitute(a, "x", e));
        }

        @Test
        @DisplayName("变量不出现时返回同一实例")
        void testSubstitute_AbsentVariable_IsIdentity() {
            Assertion compound = Assertions.and(
                    Assertions.atom(x, RelationType.GE, NumberLiteral.ZERO),
                    Assertions.implies(Assertions.TRUE, Assertions.not(Assertions.atom(y, RelationType.NE, x))));
            assertSame(compound, Assertions.substitute(compound, "w", NumberLiteral.ONE));
        }

        @Test
        @DisplayName("true 与 false 不受替换影响")
        void testSubstitute_Constants() {
            assertAll(
                    () -> assertSame(Assertions.TRUE, Assertions.substitute(Assertions.TRUE, "x", y)),
                    () -> assertSame(Assertions.FALSE, Assertions.substitute(Assertions.FALSE, "x", y))
            );
        }

        @Test
        @DisplayName("只重建路径上的节点，其余子树共享")
        void testSubstitute_SharesUnchangedBranch() {
            Assertion untouched = Assertions.atom(y, RelationType.GT, z);
            AndAssertion and = AndAssertion.of(Assertions.atom(x, RelationType.EQ, NumberLiteral.ZERO), untouched);
            AndAssertion replaced = (AndAssertion) Assertions.substitute(and, "x", y);

            assertSame(untouched, replaced.getRight());
            assertEquals(Assertions.atom(y, RelationType.EQ, NumberLiteral.ZERO), replaced.getLeft());
        }
    }

    @Nested
    @DisplayName("条件转换 (Condition conversion)")
    class FromConditionTests {

        @Test
        @DisplayName("关系表达式转换为原子断言")
        void testRelational() {
            assertEquals(Assertions.atom(x, RelationType.LT, y),
                    Assertions.fromCondition(BinaryExpression.lessThan(x, y)));
        }

        @Test
        @DisplayName("&&, ||, ! 转换为对应联结词")
        void testLogical() {
            Expression condition = BinaryExpression.of(
                    BinaryExpression.equal(x, NumberLiteral.ZERO),
                    BinaryOperatorType.OR,
                    UnaryExpression.not(BinaryExpression.greaterThan(y, x)));
            Assertion expected = Assertions.or(
                    Assertions.atom(x, RelationType.EQ, NumberLiteral.ZERO),
                    Assertions.not(Assertions.atom(y, RelationType.GT, x)));
            assertEquals(expected, Assertions.fromCondition(condition));
        }

        @Test
        @DisplayName("算术表达式 e 读作 e != 0")
        void testArithmetic_IsNonZero() {
            Expression diff = BinaryExpression.subtract(x, y);
            assertAll(
                    () -> assertEquals(Assertions.atom(diff, RelationType.NE, NumberLiteral.ZERO), Assertions.fromCondition(diff)),
                    () -> assertEquals(Assertions.atom(x, RelationType.NE, NumberLiteral.ZERO), Assertions.fromCondition(x))
            );
        }
    }

    @Test
    @DisplayName("合取：空列表为 true，单个元素原样返回")
    void testConjunction() {
        Assertion a = Assertions.atom(x, RelationType.LE, y);
        Assertion b = Assertions.atom(y, RelationType.LE, z);
        assertAll(
                () -> assertSame(Assertions.TRUE, Assertions.conjunction(List.of())),
                () -> assertSame(a, Assertions.conjunction(List.of(a))),
                () -> assertEquals(Assertions.and(a, b), Assertions.conjunction(List.of(a, b)))
        );
    }

    @Test
    @DisplayName("在赋值下判定真假")
    void testEvaluate() {
        Assertion a = Assertions.implies(
                Assertions.atom(x, RelationType.GT, NumberLiteral.ZERO),
                Assertions.atom(BinaryExpression.modulo(y, x), RelationType.LT, x));
        assertAll(
                () -> assertTrue(a.evaluate(VariableValuation.of("x", 3, "y", -7))),
                () -> assertTrue(a.evaluate(VariableValuation.of("x", -1, "y", 5))),
                () -> assertFalse(Assertions.not(a).evaluate(VariableValuation.of("x", 2, "y", 9))),
                () -> assertFalse(Assertions.FALSE.evaluate(VariableValuation.EMPTY)),
                () -> assertEquals(Set.of("x", "y"), a.getVariables())
        );
    }

    @Test
    @DisplayName("原子断言的否定只翻转关系")
    void testAtomNegate() {
        AtomicAssertion atom = AtomicAssertion.of(x, RelationType.LT, y);
        assertEquals(AtomicAssertion.of(x, RelationType.GE, y), atom.negate());
    }
}
