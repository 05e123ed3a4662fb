package org.whileverifier.expressions;

import java.math.BigInteger;

public enum RelationType {

    /**
     * 运算符枚举
     */
    EQ("="),    // Equal
    NE("!="),   // Not Equal
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">=");   // Greater Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    /**
     * 在具体整数上判定 left ~ right。
     */
    public boolean test(BigInteger left, BigInteger right) {
        int cmp = left.compareTo(right);
        return switch (this) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
        };
    }
}
