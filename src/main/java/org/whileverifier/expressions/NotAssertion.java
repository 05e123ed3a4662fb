package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.util.Objects;
import java.util.Set;

@Getter
public final class NotAssertion implements Assertion {

    private final Assertion operand;

    private NotAssertion(Assertion operand) {
        this.operand = Objects.requireNonNull(operand, "NotAssertion-构造函数: operand 不能为 null");
    }

    public static NotAssertion of(Assertion operand) {
        return new NotAssertion(operand);
    }

    @Override
    public Assertion substitute(String variable, Expression replacement) {
        Assertion newOperand = operand.substitute(variable, replacement);
        return newOperand == operand ? this : new NotAssertion(newOperand);
    }

    @Override
    public void collectVariables(Set<String> into) {
        operand.collectVariables(into);
    }

    @Override
    public boolean evaluate(VariableValuation valuation) {
        return !operand.evaluate(valuation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operand.equals(((NotAssertion) o).operand);
    }

    @Override
    public int hashCode() {
        return 31 * operand.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "!(" + operand + ")";
    }
}
