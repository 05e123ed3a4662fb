package org.whileverifier.expressions;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;

import java.util.Objects;
import java.util.Set;

/**
 * 原子断言 left ~ right，其中 ~ 是关系运算符。
 * 这是断言与表达式之间唯一的连接点。
 * 此类是不可变的。
 */
@Getter
public final class AtomicAssertion implements Assertion {

    private final Expression left;
    private final RelationType relation;
    private final Expression right;

    private final int hashCode;

    private AtomicAssertion(Expression left, RelationType relation, Expression right) {
        this.left = Objects.requireNonNull(left, "AtomicAssertion-构造函数: left 不能为 null");
        this.relation = Objects.requireNonNull(relation, "AtomicAssertion-构造函数: relation 不能为 null");
        this.right = Objects.requireNonNull(right, "AtomicAssertion-构造函数: right 不能为 null");
        this.hashCode = Objects.hash(left, relation, right);
    }

    public static AtomicAssertion of(Expression left, RelationType relation, Expression right) {
        return new AtomicAssertion(left, relation, right);
    }

    /**
     * 逻辑否定，只翻转关系，不交换操作数。
     */
    public AtomicAssertion negate() {
        return new AtomicAssertion(left, relation.negate(), right);
    }

    @Override
    public Assertion substitute(String variable, Expression replacement) {
        Expression newLeft = left.substitute(variable, replacement);
        Expression newRight = right.substitute(variable, replacement);
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new AtomicAssertion(newLeft, relation, newRight);
    }

    @Override
    public void collectVariables(Set<String> into) {
        left.collectVariables(into);
        right.collectVariables(into);
    }

    @Override
    public boolean evaluate(VariableValuation valuation) {
        return relation.test(left.evaluate(valuation), right.evaluate(valuation));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AtomicAssertion that = (AtomicAssertion) o;
        return relation == that.relation && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return left + " " + relation.getSymbol() + " " + right;
    }
}
