package org.whileverifier.verification;

import lombok.Getter;
import org.whileverifier.symbolic.DischargeResult;
import org.whileverifier.vcg.VerificationCondition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一次验证的完整报告：结论，以及每个验证条件与其判定结果。
 * 结果按报告顺序排列。生成失败时没有任何结果。
 */
@Getter
public final class VerificationReport {

    private final Verdict verdict;
    private final List<DischargeResult> results;

    private VerificationReport(Verdict verdict, List<DischargeResult> results) {
        this.verdict = Objects.requireNonNull(verdict, "VerificationReport-构造函数: verdict 不能为 null");
        this.results = List.copyOf(results);
    }

    public static VerificationReport of(Verdict verdict, List<DischargeResult> results) {
        return new VerificationReport(verdict, results);
    }

    public static VerificationReport generationFailed(Verdict.GenerationError verdict) {
        return new VerificationReport(verdict, List.of());
    }

    public boolean isVerified() {
        return verdict.isVerified();
    }

    public List<VerificationCondition> getConditions() {
        return results.stream().map(DischargeResult::getCondition).collect(Collectors.toList());
    }

    /**
     * 例如 "loop invariant not preserved at line 6: counterexample i=0, x=1, y=-1"。
     */
    public String summary() {
        return verdict.describe();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(summary());
        for (DischargeResult result : results) {
            sb.append(System.lineSeparator()).append("  ").append(result);
        }
        return sb.toString();
    }
}
