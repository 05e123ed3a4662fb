package org.whileverifier.verification;

import org.whileverifier.core.SourcePosition;
import org.whileverifier.core.VariableValuation;
import org.whileverifier.expressions.Assertions;
import org.whileverifier.statements.Skip;
import org.whileverifier.symbolic.DischargeResult;
import org.whileverifier.vcg.VcRole;
import org.whileverifier.vcg.VerificationCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationResultAggregatorTest {

    private VerificationCondition atLine2;
    private VerificationCondition atLine5;
    private VerificationCondition topLevel;
    private List<VerificationCondition> conditions;

    @BeforeEach
    void setUp() {
        // 生成顺序与报告顺序故意不同
        atLine5 = VerificationCondition.of(Assertions.TRUE, VcRole.INVARIANT_PRESERVED, Skip.of(SourcePosition.of(5, 1))).withIndex(0);
        atLine2 = VerificationCondition.of(Assertions.TRUE, VcRole.INVARIANT_IMPLIES_POSTCONDITION, Skip.of(SourcePosition.of(2, 1))).withIndex(1);
        topLevel = VerificationCondition.of(Assertions.TRUE, VcRole.TOP_LEVEL, null).withIndex(2);
        conditions = List.of(atLine5, atLine2, topLevel);
    }

    @Test
    @DisplayName("全部成立 -> Verified")
    void testAllValid() {
        Verdict verdict = new VerificationResultAggregator(ReportingMode.FIRST_FAILURE).aggregate(conditions,
                List.of(DischargeResult.valid(topLevel), DischargeResult.valid(atLine5), DischargeResult.valid(atLine2)));
        assertTrue(verdict.isVerified());
        assertEquals(3, ((Verdict.Verified) verdict).getConditionCount());
    }

    @Test
    @DisplayName("按源位置选出第一个失败，与完成顺序无关")
    void testFirstFailure_ByPosition() {
        VariableValuation cex5 = VariableValuation.of("x", 5);
        VariableValuation cex2 = VariableValuation.of("x", 2);
        Verdict verdict = new VerificationResultAggregator(ReportingMode.FIRST_FAILURE).aggregate(conditions, List.of(
                DischargeResult.invalid(atLine5, cex5),
                DischargeResult.valid(topLevel),
                DischargeResult.invalid(atLine2, cex2)));

        Verdict.Falsified falsified = assertInstanceOf(Verdict.Falsified.class, verdict);
        assertAll(
                () -> assertSame(atLine2, falsified.getFailingCondition()),
                () -> assertEquals(cex2, falsified.getCounterexample()),
                () -> assertEquals(1, falsified.getFailures().size())
        );
    }

    @Test
    @DisplayName("UNKNOWN 排在前面时结论为 Inconclusive")
    void testUnknownFirst_Inconclusive() {
        Verdict verdict = new VerificationResultAggregator(ReportingMode.FIRST_FAILURE).aggregate(conditions, List.of(
                DischargeResult.unknown(atLine2, "timeout"),
                DischargeResult.valid(atLine5),
                DischargeResult.invalid(topLevel, VariableValuation.EMPTY)));

        Verdict.Inconclusive inconclusive = assertInstanceOf(Verdict.Inconclusive.class, verdict);
        assertEquals("timeout", inconclusive.getReason());
        assertSame(atLine2, inconclusive.getFailingCondition());
        assertFalse(verdict.isVerified());
    }

    @Test
    @DisplayName("ALL_FAILURES 模式按报告顺序列出所有失败")
    void testAllFailures() {
        DischargeResult top = DischargeResult.invalid(topLevel, VariableValuation.of("x", 0));
        DischargeResult line2 = DischargeResult.unknown(atLine2, "incomplete");
        DischargeResult line5 = DischargeResult.invalid(atLine5, VariableValuation.of("x", 1));

        Verdict verdict = new VerificationResultAggregator(ReportingMode.ALL_FAILURES)
                .aggregate(conditions, List.of(top, line5, line2));

        Verdict.Inconclusive inconclusive = assertInstanceOf(Verdict.Inconclusive.class, verdict);
        assertEquals(List.of(line2, line5, top), inconclusive.getFailures());
    }

    @Test
    @DisplayName("缺少结果时不能宣布 Verified")
    void testMissingResult_Throws() {
        VerificationResultAggregator aggregator = new VerificationResultAggregator(ReportingMode.FIRST_FAILURE);
        assertThrows(IllegalStateException.class, () -> aggregator.aggregate(conditions,
                List.of(DischargeResult.valid(atLine5), DischargeResult.valid(atLine2))));
        assertThrows(IllegalStateException.class, () -> aggregator.aggregate(conditions,
                List.of(DischargeResult.valid(atLine5), DischargeResult.valid(atLine2),
                        DischargeResult.valid(topLevel), DischargeResult.valid(topLevel))));
    }

    @Test
    @DisplayName("说明文字")
    void testDescribe() {
        Verdict verdict = new VerificationResultAggregator(ReportingMode.FIRST_FAILURE).aggregate(conditions, List.of(
                DischargeResult.valid(atLine2), DischargeResult.valid(topLevel),
                DischargeResult.invalid(atLine5, VariableValuation.of("y", -1, "i", 0, "x", 1))));
        assertEquals("loop invariant not preserved at line 5: counterexample i=0, x=1, y=-1", verdict.describe());
    }
}
