package org.whileverifier.verification;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whileverifier.core.Program;
import org.whileverifier.symbolic.DischargeEngine;
import org.whileverifier.symbolic.DischargeResult;
import org.whileverifier.symbolic.FormulaValidator;
import org.whileverifier.symbolic.SolverSessionFactory;
import org.whileverifier.symbolic.Z3SessionFactory;
import org.whileverifier.vcg.GenerationException;
import org.whileverifier.vcg.VerificationCondition;
import org.whileverifier.vcg.VerificationConditionGenerator;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 验证入口：生成验证条件、检查可编码性、逐个判定、合并结论。
 * 实例不保存跨调用状态，可以重复使用。
 */
@Getter
public final class Verifier {

    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private final VerifierOptions options;
    private final VerificationConditionGenerator generator;
    private final DischargeEngine engine;
    private final VerificationResultAggregator aggregator;

    public Verifier() {
        this(VerifierOptions.defaults());
    }

    public Verifier(VerifierOptions options) {
        this(options, new Z3SessionFactory(options.getTimeout()));
    }

    /**
     * @param sessionFactory 求解会话工厂，测试中可替换为桩实现。
     */
    public Verifier(VerifierOptions options, SolverSessionFactory sessionFactory) {
        this.options = Objects.requireNonNull(options, "Verifier-构造函数: options 不能为 null");
        this.generator = new VerificationConditionGenerator(options.isCheckDivisionDefinedness());
        this.engine = new DischargeEngine(sessionFactory, options.getParallelism());
        this.aggregator = new VerificationResultAggregator(options.getReportingMode());
    }

    /**
     * 验证 {P} S {Q}。
     *
     * @return 验证报告；生成或编码失败时结论为 {@link Verdict.GenerationError}，且不会打开任何求解会话。
     * @throws org.whileverifier.symbolic.SolverUnavailableException 如果求解器无法初始化。
     */
    public VerificationReport verify(Program program) {
        Objects.requireNonNull(program, "verify: program 不能为 null");

        List<VerificationCondition> conditions;
        try {
            conditions = generator.generate(program);
            FormulaValidator.validate(conditions);
        } catch (GenerationException e) {
            logger.warn("验证条件生成失败 ({}): {}", e.getKind(), e.getMessage());
            return VerificationReport.generationFailed(VerificationResultAggregator.generationError(e));
        }

        List<DischargeResult> results = engine.dischargeAll(conditions);
        Verdict verdict = aggregator.aggregate(conditions, results);
        logger.info("验证结束: {}", verdict.describe());

        List<DischargeResult> ordered = results.stream()
                .sorted(Comparator.comparing(DischargeResult::getCondition, VerificationCondition.REPORTING_ORDER))
                .collect(Collectors.toList());
        return VerificationReport.of(verdict, ordered);
    }
}
