package org.whileverifier;

import org.whileverifier.core.Program;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.*;
import org.whileverifier.statements.*;

import static org.whileverifier.expressions.BinaryExpression.*;

/**
 * 测试共用的示例程序，直接以 AST 构造。
 */
public final class ExamplePrograms {

    public static final Variable X = Variable.of("x");
    public static final Variable Y = Variable.of("y");
    public static final Variable I = Variable.of("i");
    public static final Variable RESULT = Variable.of("result");

    /** 平方程序中循环所在的行 */
    public static final int LOOP_LINE = 3;

    private ExamplePrograms() {
    }

    /**
     * 1: y := 0;
     * 2: i := 0;
     * 3: while (i < x) invariant ... do
     * 4:     y := y + x;
     * 5:     i := i + 1
     * 6: od;
     * 7: result := y
     * 前置条件 x >= 0，后置条件 result = x * x。
     */
    public static Program square(Assertion invariant) {
        return square(invariant, Assignment.of("y", add(Y, X), SourcePosition.of(4, 5)));
    }

    /**
     * 循环体中第一条赋值由 bodyUpdate 给出，其余与 {@link #square(Assertion)} 相同。
     */
    public static Program square(Assertion invariant, Statement bodyUpdate) {
        Statement loop = WhileStatement.of(lessThan(I, X), invariant,
                Sequence.of(bodyUpdate, Assignment.of("i", add(I, NumberLiteral.ONE), SourcePosition.of(5, 5))),
                SourcePosition.of(LOOP_LINE, 1));
        Statement body = Sequence.of(
                Assignment.of("y", NumberLiteral.ZERO, SourcePosition.of(1, 1)),
                Assignment.of("i", NumberLiteral.ZERO, SourcePosition.of(2, 1)),
                loop,
                Assignment.of("result", Y, SourcePosition.of(7, 1)));
        return Program.of(
                Assertions.atom(X, RelationType.GE, NumberLiteral.ZERO),
                body,
                Assertions.atom(RESULT, RelationType.EQ, multiply(X, X)));
    }

    /**
     * y = i * x && i <= x
     */
    public static Assertion squareInvariant() {
        return Assertions.and(
                Assertions.atom(Y, RelationType.EQ, multiply(I, X)),
                Assertions.atom(I, RelationType.LE, X));
    }

    /**
     * {true} if (x > 0) then y := 1 else y := -1 fi {(x > 0 ==> y = 1) && (x <= 0 ==> y = -1)}
     */
    public static Program sign() {
        Statement statement = IfStatement.of(greaterThan(X, NumberLiteral.ZERO),
                Assignment.of("y", NumberLiteral.ONE, SourcePosition.of(2, 5)),
                Assignment.of("y", UnaryExpression.negate(NumberLiteral.ONE), SourcePosition.of(4, 5)),
                SourcePosition.of(1, 1));
        Assertion post = Assertions.and(
                Assertions.implies(Assertions.atom(X, RelationType.GT, NumberLiteral.ZERO),
                        Assertions.atom(Y, RelationType.EQ, NumberLiteral.ONE)),
                Assertions.implies(Assertions.atom(X, RelationType.LE, NumberLiteral.ZERO),
                        Assertions.atom(Y, RelationType.EQ, NumberLiteral.of(-1))));
        return Program.of(Assertions.TRUE, statement, post);
    }
}
