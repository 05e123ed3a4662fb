package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.util.Objects;
import java.util.Set;

@Getter
public final class OrAssertion implements Assertion {

    private final Assertion left;
    private final Assertion right;

    private final int hashCode;

    private OrAssertion(Assertion left, Assertion right) {
        this.left = Objects.requireNonNull(left, "OrAssertion-构造函数: left 不能为 null");
        this.right = Objects.requireNonNull(right, "OrAssertion-构造函数: right 不能为 null");
        this.hashCode = Objects.hash("||", left, right);
    }

    public static OrAssertion of(Assertion left, Assertion right) {
        return new OrAssertion(left, right);
    }

    @Override
    public Assertion substitute(String variable, Expression replacement) {
        Assertion newLeft = left.substitute(variable, replacement);
        Assertion newRight = right.substitute(variable, replacement);
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new OrAssertion(newLeft, newRight);
    }

    @Override
    public void collectVariables(Set<String> into) {
        left.collectVariables(into);
        right.collectVariables(into);
    }

    @Override
    public boolean evaluate(VariableValuation valuation) {
        return left.evaluate(valuation) || right.evaluate(valuation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrAssertion that = (OrAssertion) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " || " + right + ")";
    }
}
