package org.whileverifier.vcg;

import lombok.Getter;
import org.whileverifier.expressions.Assertion;

import java.util.List;
import java.util.Objects;

/**
 * 对一条语句生成的结果：足以保证目标后置条件的前置条件，以及独立需要成立的验证条件。
 */
@Getter
public final class GenerationResult {

    private final Assertion precondition;
    private final List<VerificationCondition> conditions;

    private GenerationResult(Assertion precondition, List<VerificationCondition> conditions) {
        this.precondition = Objects.requireNonNull(precondition, "GenerationResult-构造函数: precondition 不能为 null");
        this.conditions = List.copyOf(conditions);
    }

    public static GenerationResult of(Assertion precondition, List<VerificationCondition> conditions) {
        return new GenerationResult(precondition, conditions);
    }

    public static GenerationResult of(Assertion precondition) {
        return new GenerationResult(precondition, List.of());
    }

    @Override
    public String toString() {
        return "GenerationResult(pre=" + precondition + ", " + conditions.size() + " VCs)";
    }
}
