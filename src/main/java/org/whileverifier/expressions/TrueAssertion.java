package org.whileverifier.expressions;

import org.whileverifier.core.VariableValuation;

import java.util.Set;

public final class TrueAssertion implements Assertion {

    public static final TrueAssertion INSTANCE = new TrueAssertion();

    private TrueAssertion() {
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
        return true;
    }

    @Override
    public String toString() {
        return "true";
    }
}
