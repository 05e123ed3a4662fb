package org.whileverifier.symbolic;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whileverifier.expressions.NotAssertion;
import org.whileverifier.vcg.VerificationCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 判定验证条件是否永真：检查其否定是否可满足。
 * <ul>
 *     <li>UNSAT -> VALID</li>
 *     <li>SAT -> INVALID，附带限制在条件变量上的模型</li>
 *     <li>UNKNOWN -> UNKNOWN，附带原因</li>
 * </ul>
 * 每个验证条件使用独立的会话，任何路径退出时都会关闭会话。
 */
@Getter
public final class DischargeEngine {

    private static final Logger logger = LoggerFactory.getLogger(DischargeEngine.class);

    private final SolverSessionFactory sessionFactory;
    private final int parallelism;

    /**
     * @param sessionFactory 会话工厂。
     * @param parallelism    同时进行的求解数上限，至少为 1。
     */
    public DischargeEngine(SolverSessionFactory sessionFactory, int parallelism) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory 不能为 null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism 至少为 1，收到 " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * 判定单个验证条件。
     * @throws SolverUnavailableException 如果无法打开会话。
     */
    public DischargeResult discharge(VerificationCondition condition) {
        SolverSession session = sessionFactory.open();
        try (session) {
            for (String name : condition.getVariables()) {
                session.declareInt(name);
            }
            session.assertFormula(NotAssertion.of(condition.getAssertion()));
            SolverStatus status = session.check();
            DischargeResult result = switch (status) {
                case UNSATISFIABLE -> DischargeResult.valid(condition);
                case SATISFIABLE -> DischargeResult.invalid(condition, session.getModel());
                case UNKNOWN -> DischargeResult.unknown(condition, session.getReasonUnknown());
            };
            if (result.getStatus() == DischargeStatus.UNKNOWN) {
                logger.warn("无法判定 {}: {}", condition, result.getReason());
            } else {
                logger.debug("{}", result);
            }
            return result;
        } catch (SolverException e) {
            logger.warn("判定 {} 时求解器出错，记为 UNKNOWN: {}", condition, e.getMessage());
            return DischargeResult.unknown(condition, "solver error: " + e.getMessage());
        }
    }

    /**
     * 判定所有验证条件。条件之间相互独立，最多 parallelism 个同时进行。
     * 返回顺序与输入顺序一致，与完成顺序无关。
     *
     * @throws SolverUnavailableException 如果任何一个会话无法打开，其余任务随之取消。
     */
    public List<DischargeResult> dischargeAll(List<VerificationCondition> conditions) {
        if (conditions.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(parallelism, conditions.size());
        logger.info("开始判定 {} 个验证条件，并行度 {}", conditions.size(), threads);
        if (threads == 1) {
            List<DischargeResult> results = new ArrayList<>(conditions.size());
            for (VerificationCondition condition : conditions) {
                results.add(discharge(condition));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Pair<VerificationCondition, Future<DischargeResult>>> pending = new ArrayList<>(conditions.size());
            for (VerificationCondition condition : conditions) {
                pending.add(Pair.of(condition, pool.submit(() -> discharge(condition))));
            }
            List<DischargeResult> results = new ArrayList<>(conditions.size());
            for (Pair<VerificationCondition, Future<DischargeResult>> task : pending) {
                results.add(await(task.getLeft(), task.getRight()));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private DischargeResult await(VerificationCondition condition, Future<DischargeResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待 " + condition + " 的判定结果时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            logger.error("判定 {} 失败: {}", condition, cause.toString());
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("判定 " + condition + " 失败", cause);
        }
    }
}
