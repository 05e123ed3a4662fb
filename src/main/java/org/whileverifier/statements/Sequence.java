package org.whileverifier.statements;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 按顺序执行的语句序列 s1; s2; ...; sn。
 */
@Getter
public final class Sequence implements Statement {

    private final List<Statement> statements;
    private final SourcePosition position;

    private Sequence(List<Statement> statements, SourcePosition position) {
        Objects.requireNonNull(statements, "Sequence-构造函数: statements 不能为 null");
        statements.forEach(s -> Objects.requireNonNull(s, "Sequence-构造函数: 序列中不能包含 null"));
        this.statements = List.copyOf(statements);
        this.position = position;
    }

    public static Sequence of(Statement... statements) {
        return new Sequence(Arrays.asList(statements), null);
    }

    public static Sequence of(List<Statement> statements) {
        return new Sequence(statements, null);
    }

    public static Sequence of(List<Statement> statements, SourcePosition position) {
        return new Sequence(statements, position);
    }

    @Override
    public String toString() {
        return statements.stream().map(Statement::toString).collect(Collectors.joining("; "));
    }
}
