package org.whileverifier.expressions;

import org.whileverifier.core.VariableValuation;

import java.util.Set;

public final class FalseAssertion implements Assertion {

    public static final FalseAssertion INSTANCE = new FalseAssertion();

    private FalseAssertion() {
    }

    @Override
    public Assertion substitute(String variable, Expression replacement) {
        return this;
    }

    @Override
    public void collectVariables(Set<String> into) {
        // 无变量
    }

    @Override
    public boolean evaluate(VariableValuation valuation) {
        return false;
    }

    @Override
    public String toString() {
        return "false";
    }
}
