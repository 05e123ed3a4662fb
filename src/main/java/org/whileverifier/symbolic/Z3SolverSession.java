package org.whileverifier.symbolic;

import com.microsoft.z3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whileverifier.core.VariableValuation;
import org.whileverifier.expressions.Assertion;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 的求解会话。独占一个 {@link Context}，关闭会话即释放该 Context。
 */
public final class Z3SolverSession implements SolverSession {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverSession.class);

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final Z3FormulaEncoder encoder;
    private final Solver solver;

    /**
     * @param ctx     会话独占的 Context，关闭会话时一并关闭。
     * @param timeout 单次 check 的超时时间，null 或 0 表示不限制。
     */
    Z3SolverSession(Context ctx, Duration timeout) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.varManager = new Z3VariableManager(ctx);
        this.encoder = new Z3FormulaEncoder(ctx, varManager);
        this.solver = ctx.mkSolver();
        if (timeout != null && !timeout.isZero()) {
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            solver.setParameters(params);
        }
    }

    @Override
    public void declareInt(String name) {
        varManager.getZ3Var(name);
    }

    @Override
    public void assertFormula(Assertion formula) {
        BoolExpr encoded = encoder.encode(formula);
        logger.debug("断言 Z3 约束: {}", encoded);
        solver.add(encoded);
    }

    @Override
    public SolverStatus check() {
        Status status;
        try {
            status = solver.check();
        } catch (Z3Exception e) {
            logger.error("Z3 求解出错: {}", e.getMessage());
            throw new SolverException("Z3 check failed: " + e.getMessage(), e);
        }
        return switch (status) {
            case SATISFIABLE -> SolverStatus.SATISFIABLE;
            case UNSATISFIABLE -> SolverStatus.UNSATISFIABLE;
            case UNKNOWN -> SolverStatus.UNKNOWN;
        };
    }

    @Override
    public VariableValuation getModel() {
        Model model = solver.getModel();
        Map<String, BigInteger> values = new HashMap<>();
        for (Map.Entry<String, IntExpr> entry : varManager.getZ3Vars().entrySet()) {
            // 模型补全：未被约束的常量也给出一个值
            Expr<IntSort> value = model.eval(entry.getValue(), true);
            if (!(value instanceof IntNum number)) {
                throw new IllegalStateException("Z3 模型中 " + entry.getKey() + " 的值不是整数: " + value);
            }
            values.put(entry.getKey(), number.getBigInteger());
        }
        return VariableValuation.of(values);
    }

    @Override
    public String getReasonUnknown() {
        return solver.getReasonUnknown();
    }

    @Override
    public void close() {
        ctx.close();
    }
}
