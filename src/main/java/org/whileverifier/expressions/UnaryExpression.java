package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

@Getter
public final class UnaryExpression implements Expression {

    private final UnaryOperatorType operator;
    private final Expression operand;

    private final int hashCode;

    private UnaryExpression(UnaryOperatorType operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "UnaryExpression-构造函数: operator 不能为 null");
        this.operand = Objects.requireNonNull(operand, "UnaryExpression-构造函数: operand 不能为 null");
        this.hashCode = Objects.hash(operator, operand);
    }

    public static UnaryExpression of(UnaryOperatorType operator, Expression operand) {
        return new UnaryExpression(operator, operand);
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(UnaryOperatorType.NEG, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryOperatorType.NOT, operand);
    }

    @Override
    public Expression substitute(String variable, Expression replacement) {
        Expression newOperand = operand.substitute(variable, replacement);
        return newOperand == operand ? this : new UnaryExpression(operator, newOperand);
    }

    @Override
    public void collectVariables(Set<String> into) {
        operand.collectVariables(into);
    }

    @Override
    public BigInteger evaluate(VariableValuation valuation) {
        BigInteger value = operand.evaluate(valuation);
        return switch (operator) {
            case NEG -> value.negate();
            case NOT -> BinaryExpression.truth(value.signum() == 0);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryExpression that = (UnaryExpression) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + operand + ")";
    }
}
