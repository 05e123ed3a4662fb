package org.whileverifier.symbolic;

/**
 * 创建求解会话。可以被多个线程同时调用。
 */
@FunctionalInterface
public interface SolverSessionFactory {

    /**
     * @throws SolverUnavailableException 如果求解器后端无法初始化。
     */
    SolverSession open();
}
