package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

/**
 * 整数常量。整数按数学整数建模，不考虑溢出。
 */
@Getter
public final class NumberLiteral implements Expression {

    public static final NumberLiteral ZERO = new NumberLiteral(BigInteger.ZERO);
    public static final NumberLiteral ONE = new NumberLiteral(BigInteger.ONE);

    private final BigInteger value;

    private NumberLiteral(BigInteger value) {
        this.value = Objects.requireNonNull(value, "NumberLiteral-构造函数: value 不能为 null");
    }

    public static NumberLiteral of(BigInteger value) {
        return new NumberLiteral(value);
    }

    public static NumberLiteral of(long value) {
        return new NumberLiteral(BigInteger.valueOf(value));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public Expression substitute(String variable, Expression replacement) {
        return this;
    }

    @Override
    public void collectVariables(Set<String> into) {
        // 常量不含变量
    }

    @Override
    public BigInteger evaluate(VariableValuation valuation) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((NumberLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
