package org.whileverifier.statements;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.Assertion;
import org.whileverifier.expressions.Expression;

import java.util.Objects;

/**
 * while condition do body od，附带用户给出的循环不变式。
 * 语法上允许不变式缺省，但验证条件生成要求每个循环都有不变式。
 */
@Getter
public final class WhileStatement implements Statement {

    private final Expression condition;
    private final Assertion invariant;
    private final Statement body;
    private final SourcePosition position;

    private WhileStatement(Expression condition, Assertion invariant, Statement body, SourcePosition position) {
        this.condition = Objects.requireNonNull(condition, "WhileStatement-构造函数: condition 不能为 null");
        this.invariant = invariant;
        this.body = Objects.requireNonNull(body, "WhileStatement-构造函数: body 不能为 null");
        this.position = position;
    }

    public static WhileStatement of(Expression condition, Assertion invariant, Statement body) {
        return new WhileStatement(condition, invariant, body, null);
    }

    public static WhileStatement of(Expression condition, Assertion invariant, Statement body, SourcePosition position) {
        return new WhileStatement(condition, invariant, body, position);
    }

    /**
     * 没有不变式的循环，只用于表示解析结果中的缺省情况。
     */
    public static WhileStatement withoutInvariant(Expression condition, Statement body, SourcePosition position) {
        return new WhileStatement(condition, null, body, position);
    }

    public boolean hasInvariant() {
        return invariant != null;
    }

    @Override
    public String toString() {
        String result = "while " + condition;
        if (invariant != null) {
            result += " invariant " + invariant;
        }
        return result + " do " + body + " od";
    }
}
