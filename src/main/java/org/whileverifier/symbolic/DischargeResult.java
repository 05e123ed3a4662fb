package org.whileverifier.symbolic;

import lombok.Getter;
import org.whileverifier.core.VariableValuation;
import org.whileverifier.vcg.VerificationCondition;

import java.util.Objects;

/**
 * 单个验证条件的判定结果。
 * 此类是不可变的。
 */
@Getter
public final class DischargeResult {

    private final VerificationCondition condition;
    private final DischargeStatus status;
    /** 仅 INVALID 时非空，只包含条件中出现的变量 */
    private final VariableValuation counterexample;
    /** 仅 UNKNOWN 时非空 */
    private final String reason;

    private DischargeResult(VerificationCondition condition, DischargeStatus status,
                            VariableValuation counterexample, String reason) {
        this.condition = Objects.requireNonNull(condition, "DischargeResult-构造函数: condition 不能为 null");
        this.status = Objects.requireNonNull(status, "DischargeResult-构造函数: status 不能为 null");
        this.counterexample = counterexample;
        this.reason = reason;
    }

    public static DischargeResult valid(VerificationCondition condition) {
        return new DischargeResult(condition, DischargeStatus.VALID, null, null);
    }

    public static DischargeResult invalid(VerificationCondition condition, VariableValuation counterexample) {
        return new DischargeResult(condition, DischargeStatus.INVALID,
                Objects.requireNonNull(counterexample, "INVALID 结果必须带有反例"), null);
    }

    public static DischargeResult unknown(VerificationCondition condition, String reason) {
        return new DischargeResult(condition, DischargeStatus.UNKNOWN, null, reason == null ? "unknown" : reason);
    }

    public boolean isValid() {
        return status == DischargeStatus.VALID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DischargeResult that = (DischargeResult) o;
        return status == that.status
                && condition.equals(that.condition)
                && Objects.equals(counterexample, that.counterexample)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, status, counterexample, reason);
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID -> "VALID " + condition;
            case INVALID -> "INVALID " + condition + " counterexample " + counterexample;
            case UNKNOWN -> "UNKNOWN(" + reason + ") " + condition;
        };
    }
}
