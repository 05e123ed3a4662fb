package org.whileverifier.verification;

public enum ReportingMode {
    /** 只报告排序最靠前的失败条件 */
    FIRST_FAILURE,
    /** 报告所有失败条件 */
    ALL_FAILURES
}
