package org.whileverifier.symbolic;

import org.whileverifier.core.VariableValuation;
import org.whileverifier.expressions.Assertion;

/**
 * 一次求解会话。每个验证条件独占一个会话，用完即关闭，会话之间不共享断言。
 * 实现不需要是线程安全的。
 */
public interface SolverSession extends AutoCloseable {

    /**
     * 声明一个整数常量。
     */
    void declareInt(String name);

    /**
     * 断言一个公式。公式中的变量应已通过 {@link #declareInt} 声明。
     */
    void assertFormula(Assertion formula);

    /**
     * @throws SolverException 如果求解器内部出错。
     */
    SolverStatus check();

    /**
     * 仅在 {@link #check()} 返回 SATISFIABLE 之后调用。
     * @return 每个已声明常量的取值。
     */
    VariableValuation getModel();

    /**
     * 仅在 {@link #check()} 返回 UNKNOWN 之后有意义，例如 "timeout"。
     */
    String getReasonUnknown();

    @Override
    void close();
}
