package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.util.Objects;
import java.util.Set;

/**
 * 蕴含 antecedent ==> consequent。验证条件都以这种形式出现。
 */
@Getter
public final class ImpliesAssertion implements Assertion {

    private final Assertion antecedent;
    private final Assertion consequent;

    private final int hashCode;

    private ImpliesAssertion(Assertion antecedent, Assertion consequent) {
        this.antecedent = Objects.requireNonNull(antecedent, "ImpliesAssertion-构造函数: antecedent 不能为 null");
        this.consequent = Objects.requireNonNull(consequent, "ImpliesAssertion-构造函数: consequent 不能为 null");
        this.hashCode = Objects.hash("==>", antecedent, consequent);
    }

    public static ImpliesAssertion of(Assertion antecedent, Assertion consequent) {
        return new ImpliesAssertion(antecedent, consequent);
    }

    @Override
    public Assertion substitute(String variable, Expression replacement) {
        Assertion newAntecedent = antecedent.substitute(variable, replacement);
        Assertion newConsequent = consequent.substitute(variable, replacement);
        if (newAntecedent == antecedent && newConsequent == consequent) {
            return this;
        }
        return new ImpliesAssertion(newAntecedent, newConsequent);
    }

    @Override
    public void collectVariables(Set<String> into) {
        antecedent.collectVariables(into);
        consequent.collectVariables(into);
    }

    @Override
    public boolean evaluate(VariableValuation valuation) {
        return !antecedent.evaluate(valuation) || consequent.evaluate(valuation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ImpliesAssertion that = (ImpliesAssertion) o;
        return antecedent.equals(that.antecedent) && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + antecedent + " ==> " + consequent + ")";
    }
}
