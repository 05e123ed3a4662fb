package org.whileverifier.statements;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.expressions.Expression;

import java.util.Objects;

/**
 * 赋值语句 variable := expression。
 */
@Getter
public final class Assignment implements Statement {

    private final String variable;
    private final Expression expression;
    private final SourcePosition position;

    private Assignment(String variable, Expression expression, SourcePosition position) {
        Objects.requireNonNull(variable, "Assignment-构造函数: variable 不能为 null");
        if (variable.isBlank()) {
            throw new IllegalArgumentException("Assignment-构造函数: variable 不能为空");
        }
        this.variable = variable;
        this.expression = Objects.requireNonNull(expression, "Assignment-构造函数: expression 不能为 null");
        this.position = position;
    }

    public static Assignment of(String variable, Expression expression) {
        return new Assignment(variable, expression, null);
    }

    public static Assignment of(String variable, Expression expression, SourcePosition position) {
        return new Assignment(variable, expression, position);
    }

    @Override
    public String toString() {
        return variable + " := " + expression;
    }
}
