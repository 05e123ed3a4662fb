package org.whileverifier.symbolic;

/**
 * 求解器后端无法访问或初始化。对整次验证是致命的，不会重试。
 */
public class SolverUnavailableException extends RuntimeException {

    public SolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
