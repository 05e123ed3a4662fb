package org.whileverifier.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 为每个验证条件创建独立 Context 的 Z3 会话工厂。
 * Z3 的 Context 不能跨线程共享，因此不复用。
 */
@Getter
public final class Z3SessionFactory implements SolverSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(Z3SessionFactory.class);

    private final Duration timeout;

    public Z3SessionFactory(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public SolverSession open() {
        Context ctx;
        try {
            ctx = new Context();
        } catch (Z3Exception | LinkageError e) {
            // 本地库缺失或加载失败
            logger.error("无法初始化 Z3: {}", e.toString());
            throw new SolverUnavailableException("cannot initialize Z3: " + e.getMessage(), e);
        }
        try {
            return new Z3SolverSession(ctx, timeout);
        } catch (Z3Exception e) {
            ctx.close();
            logger.error("无法创建 Z3 求解器: {}", e.getMessage());
            throw new SolverUnavailableException("cannot create Z3 solver: " + e.getMessage(), e);
        }
    }
}
