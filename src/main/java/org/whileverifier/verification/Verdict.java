package org.whileverifier.verification;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;
import org.whileverifier.core.VariableValuation;
import org.whileverifier.symbolic.DischargeResult;
import org.whileverifier.vcg.GenerationErrorKind;
import org.whileverifier.vcg.VerificationCondition;

import java.util.List;
import java.util.Objects;

/**
 * 一次验证的最终结论。每次验证恰好产生一个 Verdict。
 */
public abstract sealed class Verdict permits Verdict.Verified, Verdict.Falsified, Verdict.Inconclusive, Verdict.GenerationError {

    public boolean isVerified() {
        return this instanceof Verified;
    }

    /**
     * 面向用户的一行说明。
     */
    public abstract String describe();

    /**
     * 所有验证条件均永真。
     */
    @Getter
    public static final class Verified extends Verdict {

        private final int conditionCount;

        Verified(int conditionCount) {
            this.conditionCount = conditionCount;
        }

        @Override
        public String describe() {
            return "verified: " + conditionCount + " verification condition(s) discharged";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Verified that && conditionCount == that.conditionCount;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(conditionCount);
        }

        @Override
        public String toString() {
            return "Verified(" + conditionCount + ")";
        }
    }

    /**
     * 求解器证明了某个验证条件不成立。
     */
    @Getter
    public static final class Falsified extends Verdict {

        private final VerificationCondition failingCondition;
        private final VariableValuation counterexample;
        /** 报告的失败条件；默认模式下只有一个 */
        private final List<DischargeResult> failures;

        Falsified(VerificationCondition failingCondition, VariableValuation counterexample, List<DischargeResult> failures) {
            this.failingCondition = Objects.requireNonNull(failingCondition);
            this.counterexample = Objects.requireNonNull(counterexample);
            this.failures = List.copyOf(failures);
        }

        @Override
        public String describe() {
            return failingCondition.describe() + ": counterexample " + counterexample.format();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Falsified that
                    && failingCondition.equals(that.failingCondition)
                    && counterexample.equals(that.counterexample)
                    && failures.equals(that.failures);
        }

        @Override
        public int hashCode() {
            return Objects.hash(failingCondition, counterexample, failures);
        }

        @Override
        public String toString() {
            return "Falsified(" + failingCondition + ", " + counterexample + ")";
        }
    }

    /**
     * 求解器无法判定某个验证条件 (超时或不完备)，与 Falsified 区分开。
     */
    @Getter
    public static final class Inconclusive extends Verdict {

        private final VerificationCondition failingCondition;
        private final String reason;
        private final List<DischargeResult> failures;

        Inconclusive(VerificationCondition failingCondition, String reason, List<DischargeResult> failures) {
            this.failingCondition = Objects.requireNonNull(failingCondition);
            this.reason = Objects.requireNonNull(reason);
            this.failures = List.copyOf(failures);
        }

        @Override
        public String describe() {
            return "could not decide whether " + failingCondition.getRole().getTag() + " condition holds"
                    + (failingCondition.getPosition() == null ? "" : " at line " + failingCondition.getPosition().getLine())
                    + ": " + reason;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Inconclusive that
                    && failingCondition.equals(that.failingCondition)
                    && reason.equals(that.reason)
                    && failures.equals(that.failures);
        }

        @Override
        public int hashCode() {
            return Objects.hash(failingCondition, reason, failures);
        }

        @Override
        public String toString() {
            return "Inconclusive(" + failingCondition + ", " + reason + ")";
        }
    }

    /**
     * 验证条件无法生成或编码，没有调用求解器。
     */
    @Getter
    public static final class GenerationError extends Verdict {

        private final GenerationErrorKind kind;
        private final String reason;
        private final SourcePosition position;

        GenerationError(GenerationErrorKind kind, String reason, SourcePosition position) {
            this.kind = Objects.requireNonNull(kind);
            this.reason = Objects.requireNonNull(reason);
            this.position = position;
        }

        @Override
        public String describe() {
            return "generation error " + kind + (position == null ? "" : " at line " + position.getLine()) + ": " + reason;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof GenerationError that
                    && kind == that.kind
                    && reason.equals(that.reason)
                    && Objects.equals(position, that.position);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, reason, position);
        }

        @Override
        public String toString() {
            return "GenerationError(" + kind + ", " + reason + ")";
        }
    }
}
