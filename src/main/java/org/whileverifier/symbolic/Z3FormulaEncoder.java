package org.whileverifier.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import org.whileverifier.expressions.*;

import java.util.Objects;

/**
 * 将表达式与断言翻译为 Z3 公式。所有变量都是 Int 类型的常量，
 * 由 {@link Z3VariableManager} 统一创建。
 * 单向、无状态的映射，不解释任何求解结果。
 */
public final class Z3FormulaEncoder {

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3FormulaEncoder(Context ctx, Z3VariableManager varManager) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.varManager = Objects.requireNonNull(varManager, "Z3VariableManager cannot be null.");
    }

    /**
     * 将断言转换为 Z3 布尔表达式。
     * @param assertion 断言。
     * @return 对应的 Z3 BoolExpr。
     */
    public BoolExpr encode(Assertion assertion) {
        if (assertion instanceof TrueAssertion) {
            return ctx.mkTrue();
        }
        if (assertion instanceof FalseAssertion) {
            return ctx.mkFalse();
        }
        if (assertion instanceof AtomicAssertion atom) {
            return encodeRelation(atom.getRelation(), encode(atom.getLeft()), encode(atom.getRight()));
        }
        if (assertion instanceof NotAssertion not) {
            return ctx.mkNot(encode(not.getOperand()));
        }
        if (assertion instanceof AndAssertion and) {
            return ctx.mkAnd(encode(and.getLeft()), encode(and.getRight()));
        }
        if (assertion instanceof OrAssertion or) {
            return ctx.mkOr(encode(or.getLeft()), encode(or.getRight()));
        }
        if (assertion instanceof ImpliesAssertion implies) {
            return ctx.mkImplies(encode(implies.getAntecedent()), encode(implies.getConsequent()));
        }
        throw new IllegalStateException("未知的断言类型: " + assertion.getClass().getName());
    }

    /**
     * 将算术表达式转换为 Z3 整数表达式。
     * @param expression 表达式。
     * @return 对应的 Z3 ArithExpr。
     * @throws IllegalArgumentException 如果表达式在算术位置使用了关系或逻辑运算。
     */
    public ArithExpr<IntSort> encode(Expression expression) {
        if (expression instanceof Variable variable) {
            return varManager.getZ3Var(variable.getName());
        }
        if (expression instanceof NumberLiteral number) {
            return ctx.mkInt(number.getValue().toString());
        }
        if (expression instanceof BinaryExpression binary) {
            ArithExpr<IntSort> left = encode(binary.getLeft());
            ArithExpr<IntSort> right = encode(binary.getRight());
            return switch (binary.getOperator()) {
                case ADD -> ctx.mkAdd(left, right);
                case SUB -> ctx.mkSub(left, right);
                case MUL -> ctx.mkMul(left, right);
                case DIV -> ctx.mkDiv(left, right);
                case MOD -> ctx.mkMod(left, right);
                default -> throw new IllegalArgumentException(
                        "运算符 " + binary.getOperator().getSymbol() + " 不能出现在算术表达式中: " + binary);
            };
        }
        if (expression instanceof UnaryExpression unary) {
            if (unary.getOperator() != UnaryOperatorType.NEG) {
                throw new IllegalArgumentException("运算符 " + unary.getOperator().getSymbol() + " 不能出现在算术表达式中: " + unary);
            }
            return ctx.mkUnaryMinus(encode(unary.getOperand()));
        }
        throw new IllegalStateException("未知的表达式类型: " + expression.getClass().getName());
    }

    private BoolExpr encodeRelation(RelationType relation, ArithExpr<IntSort> left, ArithExpr<IntSort> right) {
        return switch (relation) {
            case EQ -> ctx.mkEq(left, right);
            case NE -> ctx.mkNot(ctx.mkEq(left, right));
            case LT -> ctx.mkLt(left, right);
            case LE -> ctx.mkLe(left, right);
            case GT -> ctx.mkGt(left, right);
            case GE -> ctx.mkGe(left, right);
        };
    }
}
