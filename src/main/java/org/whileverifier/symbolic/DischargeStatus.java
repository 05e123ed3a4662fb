package org.whileverifier.symbolic;

public enum DischargeStatus {
    /** 否定不可满足，条件永真 */
    VALID,
    /** 否定可满足，求解器给出了反例 */
    INVALID,
    /** 超时或求解器不完备 */
    UNKNOWN
}
