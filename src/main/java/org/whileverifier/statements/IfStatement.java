package org.whileverifier.statements;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.Expression;

import java.util.Objects;

/**
 * if condition then thenBranch [else elseBranch] fi。
 * elseBranch 可以缺省，语义上等同于 skip。
 */
@Getter
public final class IfStatement implements Statement {

    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;
    private final SourcePosition position;

    private IfStatement(Expression condition, Statement thenBranch, Statement elseBranch, SourcePosition position) {
        this.condition = Objects.requireNonNull(condition, "IfStatement-构造函数: condition 不能为 null");
        this.thenBranch = Objects.requireNonNull(thenBranch, "IfStatement-构造函数: thenBranch 不能为 null");
        this.elseBranch = elseBranch;
        this.position = position;
    }

    public static IfStatement of(Expression condition, Statement thenBranch) {
        return new IfStatement(condition, thenBranch, null, null);
    }

    public static IfStatement of(Expression condition, Statement thenBranch, Statement elseBranch) {
        return new IfStatement(condition, thenBranch, elseBranch, null);
    }

    public static IfStatement of(Expression condition, Statement thenBranch, Statement elseBranch, SourcePosition position) {
        return new IfStatement(condition, thenBranch, elseBranch, position);
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public String toString() {
        String result = "if " + condition + " then " + thenBranch;
        if (elseBranch != null) {
            result += " else " + elseBranch;
        }
        return result + " fi";
    }
}
