package org.whileverifier.vcg;

import lombok.Getter;
import org.whileverifier.core.Program;
import org.whileverifier.expressions.*;
import org.whileverifier.statements.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 基于 Hoare 逻辑的验证条件生成器。
 * 对语句做结构递归，计算最弱前置条件，同时收集循环产生的证明义务。
 * 不保存任何跨调用状态，同一个实例可以被多个线程同时使用。
 */
@Getter
public final class VerificationConditionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(VerificationConditionGenerator.class);

    /** 是否为除法/取模生成除数非零条件 */
    private final boolean checkDivisionDefinedness;

    public VerificationConditionGenerator() {
        this(false);
    }

    public VerificationConditionGenerator(boolean checkDivisionDefinedness) {
        this.checkDivisionDefinedness = checkDivisionDefinedness;
    }

    /**
     * 为整个程序生成验证条件：先对语句生成 (Q', VCs)，再追加顶层条件 P ==> Q'。
     * 各循环的入口条件通过 Q' 向上传播，最终包含在顶层条件中。
     *
     * @param program 带标注的程序。
     * @return 按生成顺序编号的验证条件，顶层条件在最后。
     * @throws GenerationException 如果某个循环缺少不变式。此时不会返回任何验证条件。
     */
    public List<VerificationCondition> generate(Program program) {
        Objects.requireNonNull(program, "generate: program 不能为 null");
        logger.info("开始为程序生成验证条件: {}", program);

        GenerationResult result = generate(program.getStatement(), program.getPostcondition());

        List<VerificationCondition> conditions = new ArrayList<>(result.getConditions());
        conditions.add(VerificationCondition.of(
                ImpliesAssertion.of(program.getPrecondition(), result.getPrecondition()), VcRole.TOP_LEVEL, null));

        List<VerificationCondition> indexed = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            indexed.add(conditions.get(i).withIndex(i));
        }
        logger.info("共生成 {} 个验证条件", indexed.size());
        return List.copyOf(indexed);
    }

    /**
     * 计算语句 statement 关于后置条件 postcondition 的前置条件与验证条件。
     */
    public GenerationResult generate(Statement statement, Assertion postcondition) {
        Objects.requireNonNull(statement, "generate: statement 不能为 null");
        Objects.requireNonNull(postcondition, "generate: postcondition 不能为 null");

        if (statement instanceof Skip) {
            return GenerationResult.of(postcondition);
        }
        if (statement instanceof Assignment assignment) {
            return generateAssignment(assignment, postcondition);
        }
        if (statement instanceof Sequence sequence) {
            return generateSequence(sequence, postcondition);
        }
        if (statement instanceof IfStatement ifStatement) {
            return generateIf(ifStatement, postcondition);
        }
        if (statement instanceof WhileStatement whileStatement) {
            return generateWhile(whileStatement, postcondition);
        }
        throw new IllegalStateException("未知的语句类型: " + statement.getClass().getName());
    }

    /**
     * 赋值公理: wp(x := e, Q) = Q[e/x]。
     */
    private GenerationResult generateAssignment(Assignment assignment, Assertion postcondition) {
        Assertion pre = Assertions.substitute(postcondition, assignment.getVariable(), assignment.getExpression());
        return GenerationResult.of(requireDefined(assignment.getExpression(), pre));
    }

    /**
     * 从后向前组合：先处理 sn，其前置条件作为 s(n-1) 的后置条件，依此类推。
     * 验证条件按源顺序拼接。
     */
    private GenerationResult generateSequence(Sequence sequence, Assertion postcondition) {
        List<Statement> statements = sequence.getStatements();
        Assertion current = postcondition;
        Deque<List<VerificationCondition>> collected = new ArrayDeque<>();
        for (int i = statements.size() - 1; i >= 0; i--) {
            GenerationResult result = generate(statements.get(i), current);
            current = result.getPrecondition();
            collected.addFirst(result.getConditions());
        }
        List<VerificationCondition> conditions = new ArrayList<>();
        collected.forEach(conditions::addAll);
        return GenerationResult.of(current, conditions);
    }

    /**
     * wp(if c then s1 else s2, Q) = (c ==> wp(s1, Q)) && (!c ==> wp(s2, Q))。
     */
    private GenerationResult generateIf(IfStatement ifStatement, Assertion postcondition) {
        Assertion condition = Assertions.fromCondition(ifStatement.getCondition());

        GenerationResult thenResult = generate(ifStatement.getThenBranch(), postcondition);
        GenerationResult elseResult = ifStatement.hasElse()
                ? generate(ifStatement.getElseBranch(), postcondition)
                : GenerationResult.of(postcondition);

        Assertion pre = AndAssertion.of(
                ImpliesAssertion.of(condition, thenResult.getPrecondition()),
                ImpliesAssertion.of(NotAssertion.of(condition), elseResult.getPrecondition()));

        List<VerificationCondition> conditions = new ArrayList<>(thenResult.getConditions());
        conditions.addAll(elseResult.getConditions());
        return GenerationResult.of(requireDefined(ifStatement.getCondition(), pre), conditions);
    }

    /**
     * 循环规则。前置条件是不变式 I 本身，入口处 I 是否成立由外层上下文负责。
     * 生成两个条件：
     * <ul>
     *     <li>保持: I && c ==> wp(body, I)</li>
     *     <li>退出: I && !c ==> Q</li>
     * </ul>
     */
    private GenerationResult generateWhile(WhileStatement whileStatement, Assertion postcondition) {
        if (!whileStatement.hasInvariant()) {
            logger.error("循环缺少不变式: {} (位置 {})", whileStatement, whileStatement.getPosition());
            throw new GenerationException(GenerationErrorKind.MISSING_INVARIANT,
                    "loop has no invariant: while " + whileStatement.getCondition(), whileStatement.getPosition());
        }
        Assertion invariant = whileStatement.getInvariant();
        Assertion condition = Assertions.fromCondition(whileStatement.getCondition());

        GenerationResult bodyResult = generate(whileStatement.getBody(), invariant);

        List<VerificationCondition> conditions = new ArrayList<>(bodyResult.getConditions());
        if (checkDivisionDefinedness && DefinednessExtractor.hasDivision(whileStatement.getCondition())) {
            // 每次求值循环条件时不变式都成立
            conditions.add(VerificationCondition.of(
                    ImpliesAssertion.of(invariant, DefinednessExtractor.extract(whileStatement.getCondition())),
                    VcRole.DIVISOR_NON_ZERO, whileStatement));
        }
        conditions.add(VerificationCondition.of(
                ImpliesAssertion.of(AndAssertion.of(invariant, condition), bodyResult.getPrecondition()),
                VcRole.INVARIANT_PRESERVED, whileStatement));
        conditions.add(VerificationCondition.of(
                ImpliesAssertion.of(AndAssertion.of(invariant, NotAssertion.of(condition)), postcondition),
                VcRole.INVARIANT_IMPLIES_POSTCONDITION, whileStatement));

        logger.debug("循环 {} 生成了 {} 个验证条件", whileStatement.getCondition(), conditions.size());
        return GenerationResult.of(invariant, conditions);
    }

    /**
     * 开启定义性检查且 expression 含除法时，把除数非零条件合取到 pre 之前。
     */
    private Assertion requireDefined(Expression expression, Assertion pre) {
        if (!checkDivisionDefinedness || !DefinednessExtractor.hasDivision(expression)) {
            return pre;
        }
        return AndAssertion.of(DefinednessExtractor.extract(expression), pre);
    }
}
