package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

/**
 * 二元表达式 left op right。
 * 此类是不可变的。
 */
@Getter
public final class BinaryExpression implements Expression {

    private final Expression left;
    private final BinaryOperatorType operator;
    private final Expression right;

    private final int hashCode;

    private BinaryExpression(Expression left, BinaryOperatorType operator, Expression right) {
        this.left = Objects.requireNonNull(left, "BinaryExpression-构造函数: left 不能为 null");
        this.operator = Objects.requireNonNull(operator, "BinaryExpression-构造函数: operator 不能为 null");
        this.right = Objects.requireNonNull(right, "BinaryExpression-构造函数: right 不能为 null");
        this.hashCode = Objects.hash(left, operator, right);
    }

    // --- 工厂方法 ---
    public static BinaryExpression of(Expression left, BinaryOperatorType operator, Expression right) {
        return new BinaryExpression(left, operator, right);
    }

    public static BinaryExpression add(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.ADD, right); }
    public static BinaryExpression subtract(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.SUB, right); }
    public static BinaryExpression multiply(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.MUL, right); }
    public static BinaryExpression divide(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.DIV, right); }
    public static BinaryExpression modulo(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.MOD, right); }
    public static BinaryExpression lessThan(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.LT, right); }
    public static BinaryExpression greaterThan(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.GT, right); }
    public static BinaryExpression equal(Expression left, Expression right) { return new BinaryExpression(left, BinaryOperatorType.EQ, right); }

    @Override
    public Expression substitute(String variable, Expression replacement) {
        Expression newLeft = left.substitute(variable, replacement);
        Expression newRight = right.substitute(variable, replacement);
        // 未改变的子树直接共享
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new BinaryExpression(newLeft, operator, newRight);
    }

    @Override
    public void collectVariables(Set<String> into) {
        left.collectVariables(into);
        right.collectVariables(into);
    }

    @Override
    public BigInteger evaluate(VariableValuation valuation) {
        BigInteger l = left.evaluate(valuation);
        BigInteger r = right.evaluate(valuation);
        return switch (operator) {
            case ADD -> l.add(r);
            case SUB -> l.subtract(r);
            case MUL -> l.multiply(r);
            case DIV -> euclideanDivide(l, r);
            case MOD -> euclideanRemainder(l, r);
            case EQ, NE, LT, LE, GT, GE -> truth(operator.toRelationType().test(l, r));
            case AND -> truth(l.signum() != 0 && r.signum() != 0);
            case OR -> truth(l.signum() != 0 || r.signum() != 0);
        };
    }

    /**
     * SMT-LIB 整数除法: a = b * q + r, 0 <= r < |b|。
     */
    static BigInteger euclideanDivide(BigInteger dividend, BigInteger divisor) {
        BigInteger remainder = euclideanRemainder(dividend, divisor);
        return dividend.subtract(remainder).divide(divisor);
    }

    static BigInteger euclideanRemainder(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("除数为 0: " + dividend + " / 0");
        }
        return dividend.mod(divisor.abs());
    }

    static BigInteger truth(boolean value) {
        return value ? BigInteger.ONE : BigInteger.ZERO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
