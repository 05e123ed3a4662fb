package org.whileverifier.vcg;

/**
 * 验证条件的来源角色，用于诊断信息。
 */
public enum VcRole {

    /** 循环入口处不变式成立。由调用处的上下文通过 TOP_LEVEL 条件体现，而非由循环自身生成。 */
    ENTRY_IMPLIES_INVARIANT("entry-implies-invariant", "loop invariant does not hold on entry"),
    /** I && c ==> wp(body, I) */
    INVARIANT_PRESERVED("invariant-preserved", "loop invariant not preserved"),
    /** I && !c ==> Q */
    INVARIANT_IMPLIES_POSTCONDITION("invariant-implies-postcondition",
            "loop invariant and exit condition do not establish the postcondition"),
    /** P ==> wp(S, Q) */
    TOP_LEVEL("top-level", "precondition does not establish the required condition"),
    /** 除数非零，仅在开启除法定义性检查时生成 */
    DIVISOR_NON_ZERO("divisor-non-zero", "possible division by zero");

    private final String tag;
    private final String failureDescription;

    VcRole(String tag, String failureDescription) {
        this.tag = tag;
        this.failureDescription = failureDescription;
    }

    public String getTag() {
        return tag;
    }

    /**
     * 此类条件不成立时的说明文字。
     */
    public String getFailureDescription() {
        return failureDescription;
    }

    @Override
    public String toString() {
        return tag;
    }
}
