package org.whileverifier.expressions;

public enum UnaryOperatorType {

    NEG("-"),   // 算术取负
    NOT("!");   // 逻辑非，仅用于条件

    private final String symbol;

    UnaryOperatorType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
