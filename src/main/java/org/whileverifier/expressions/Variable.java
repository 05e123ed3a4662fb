package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

@Getter
public final class Variable implements Expression {

    private final String name;

    private Variable(String name) {
        Objects.requireNonNull(name, "Variable-构造函数: name 不能为 null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable-构造函数: name 不能为空");
        }
        this.name = name;
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    @Override
    public Expression substitute(String variable, Expression replacement) {
        return name.equals(variable) ? replacement : this;
    }

    @Override
    public void collectVariables(Set<String> into) {
        into.add(name);
    }

    @Override
    public BigInteger evaluate(VariableValuation valuation) {
        return valuation.getValue(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
