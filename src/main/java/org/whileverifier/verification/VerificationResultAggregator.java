package org.whileverifier.verification;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whileverifier.symbolic.DischargeResult;
import org.whileverifier.symbolic.DischargeStatus;
import org.whileverifier.vcg.GenerationException;
import org.whileverifier.vcg.VerificationCondition;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 把各验证条件的判定结果合并为一个 {@link Verdict}。
 * 失败条件按 {@link VerificationCondition#REPORTING_ORDER} 排序，与判定完成的先后无关。
 */
@Getter
public final class VerificationResultAggregator {

    private static final Logger logger = LoggerFactory.getLogger(VerificationResultAggregator.class);

    private final ReportingMode reportingMode;

    public VerificationResultAggregator(ReportingMode reportingMode) {
        this.reportingMode = Objects.requireNonNull(reportingMode, "reportingMode 不能为 null");
    }

    /**
     * @param conditions 本次生成的全部验证条件。
     * @param results    判定结果，顺序任意。
     * @throws IllegalStateException 如果某个验证条件没有结果。
     */
    public Verdict aggregate(List<VerificationCondition> conditions, List<DischargeResult> results) {
        List<DischargeResult> ordered = order(conditions, results);

        List<DischargeResult> failures = ordered.stream()
                .filter(result -> !result.isValid())
                .collect(Collectors.toList());
        if (failures.isEmpty()) {
            logger.info("全部 {} 个验证条件成立", ordered.size());
            return new Verdict.Verified(ordered.size());
        }

        DischargeResult first = failures.get(0);
        List<DischargeResult> reported = reportingMode == ReportingMode.ALL_FAILURES ? failures : List.of(first);
        logger.info("{} 个验证条件未通过，首个为 {}", failures.size(), first);
        if (first.getStatus() == DischargeStatus.INVALID) {
            return new Verdict.Falsified(first.getCondition(), first.getCounterexample(), reported);
        }
        return new Verdict.Inconclusive(first.getCondition(), first.getReason(), reported);
    }

    public static Verdict.GenerationError generationError(GenerationException e) {
        return new Verdict.GenerationError(e.getKind(), e.getMessage(), e.getPosition());
    }

    /**
     * 检查每个条件都恰好有一个结果，并按报告顺序排列。
     */
    static List<DischargeResult> order(List<VerificationCondition> conditions, List<DischargeResult> results) {
        Map<VerificationCondition, DischargeResult> byCondition = new HashMap<>();
        for (DischargeResult result : results) {
            if (byCondition.put(result.getCondition(), result) != null) {
                throw new IllegalStateException("验证条件有多个判定结果: " + result.getCondition());
            }
        }
        List<DischargeResult> ordered = new ArrayList<>(conditions.size());
        for (VerificationCondition condition : conditions) {
            DischargeResult result = byCondition.get(condition);
            if (result == null) {
                logger.error("验证条件没有判定结果: {}", condition);
                throw new IllegalStateException("no result for " + condition);
            }
            ordered.add(result);
        }
        if (ordered.size() != results.size()) {
            throw new IllegalStateException("存在不属于本次验证的判定结果");
        }
        ordered.sort(Comparator.comparing(DischargeResult::getCondition, VerificationCondition.REPORTING_ORDER));
        return ordered;
    }
}
