package org.whileverifier.core;

import lombok.Getter;
import org.whileverifier.expressions.Assertion;
import org.whileverifier.statements.Statement;

import java.util.Objects;

/**
 * 带标注的程序 {P} S {Q}。
 * 此类是不可变的。
 */
@Getter
public final class Program {

    private final Assertion precondition;
    private final Statement statement;
    private final Assertion postcondition;

    private Program(Assertion precondition, Statement statement, Assertion postcondition) {
        this.precondition = Objects.requireNonNull(precondition, "Program-构造函数: precondition 不能为 null");
        this.statement = Objects.requireNonNull(statement, "Program-构造函数: statement 不能为 null");
        this.postcondition = Objects.requireNonNull(postcondition, "Program-构造函数: postcondition 不能为 null");
    }

    public static Program of(Assertion precondition, Statement statement, Assertion postcondition) {
        return new Program(precondition, statement, postcondition);
    }

    @Override
    public String toString() {
        return "{" + precondition + "} " + statement + " {" + postcondition + "}";
    }
}
