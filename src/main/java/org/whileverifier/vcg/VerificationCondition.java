package org.whileverifier.vcg;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.Assertion;
import org.whileverifier.statements.Statement;

import java.util.Comparator;
import java.util.Objects;
import java.util.Set;

/**
 * 一个必须永真的断言，附带来源信息。
 * 此类是不可变的。
 */
@Getter
public final class VerificationCondition {

    /**
     * 报告顺序：按源位置排序 (无位置者排在最后)，再按生成顺序。
     * 顶层条件没有位置且最后生成，因此总是排在最后。
     */
    public static final Comparator<VerificationCondition> REPORTING_ORDER = Comparator
            .comparing(VerificationCondition::getPosition, Comparator.nullsLast(Comparator.<SourcePosition>naturalOrder()))
            .thenComparingInt(VerificationCondition::getIndex);

    private final Assertion assertion;
    private final VcRole role;
    /** 产生此条件的语句，顶层条件为 null */
    private final Statement source;
    private final SourcePosition position;
    /** 生成顺序，-1 表示尚未编号 */
    private final int index;

    private VerificationCondition(Assertion assertion, VcRole role, Statement source, SourcePosition position, int index) {
        this.assertion = Objects.requireNonNull(assertion, "VerificationCondition-构造函数: assertion 不能为 null");
        this.role = Objects.requireNonNull(role, "VerificationCondition-构造函数: role 不能为 null");
        this.source = source;
        this.position = position;
        this.index = index;
    }

    public static VerificationCondition of(Assertion assertion, VcRole role, Statement source) {
        return new VerificationCondition(assertion, role, source, source == null ? null : source.getPosition(), -1);
    }

    public VerificationCondition withIndex(int newIndex) {
        return new VerificationCondition(assertion, role, source, position, newIndex);
    }

    public Set<String> getVariables() {
        return assertion.getVariables();
    }

    /**
     * 例如 "loop invariant not preserved at line 6"。
     */
    public String describe() {
        if (position == null) {
            return role.getFailureDescription();
        }
        return role.getFailureDescription() + " at line " + position.getLine();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VerificationCondition that = (VerificationCondition) o;
        return index == that.index
                && role == that.role
                && source == that.source
                && Objects.equals(position, that.position)
                && assertion.equals(that.assertion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assertion, role, position, index);
    }

    @Override
    public String toString() {
        return "VC#" + index + "[" + role.getTag() + (position == null ? "" : " @ " + position) + "] " + assertion;
    }
}
