package org.whileverifier.expressions;

/**
 * 二元表达式的运算符。算术运算符产生整数，关系与逻辑运算符只应出现在条件中。
 */
public enum BinaryOperatorType {

    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("%", Category.ARITHMETIC),

    EQ("=", Category.RELATIONAL),
    NE("!=", Category.RELATIONAL),
    LT("<", Category.RELATIONAL),
    LE("<=", Category.RELATIONAL),
    GT(">", Category.RELATIONAL),
    GE(">=", Category.RELATIONAL),

    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL);

    public enum Category {
        ARITHMETIC,
        RELATIONAL,
        LOGICAL
    }

    private final String symbol;
    private final Category category;

    BinaryOperatorType(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    public boolean isRelational() {
        return category == Category.RELATIONAL;
    }

    /**
     * 除法与取模，它们的除数需要单独检查。
     */
    public boolean isDivision() {
        return this == DIV || this == MOD;
    }

    /**
     * 关系运算符到断言关系类型的映射。
     * @throws IllegalStateException 如果此运算符不是关系运算符。
     */
    public RelationType toRelationType() {
        return switch (this) {
            case EQ -> RelationType.EQ;
            case NE -> RelationType.NE;
            case LT -> RelationType.LT;
            case LE -> RelationType.LE;
            case GT -> RelationType.GT;
            case GE -> RelationType.GE;
            default -> throw new IllegalStateException("运算符 " + symbol + " 不是关系运算符");
        };
    }
}
