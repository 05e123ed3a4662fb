package org.whileverifier.symbolic;

/**
 * 单个会话在求解过程中出错。只影响当前验证条件。
 */
public class SolverException extends RuntimeException {

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
