package org.whileverifier.symbolic;

import org.whileverifier.core.VariableValuation;
import org.whileverifier.expressions.Assertion;

import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 测试用的求解会话工厂：按给定规则回答 check，并统计会话的打开与关闭次数。
 * 模型中所有已声明变量的取值均为 0。
 */
public class StubSessionFactory implements SolverSessionFactory {

    private final Function<Assertion, SolverStatus> answer;
    private final String reasonUnknown;
    private final boolean failOnOpen;
    private final boolean failOnCheck;

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private final List<Assertion> asserted = Collections.synchronizedList(new ArrayList<>());

    private StubSessionFactory(Function<Assertion, SolverStatus> answer, String reasonUnknown,
                               boolean failOnOpen, boolean failOnCheck) {
        this.answer = answer;
        this.reasonUnknown = reasonUnknown;
        this.failOnOpen = failOnOpen;
        this.failOnCheck = failOnCheck;
    }

    public static StubSessionFactory answering(SolverStatus status) {
        return new StubSessionFactory(formula -> status, "timeout", false, false);
    }

    /**
     * @param answer 根据被断言的公式 (即验证条件的否定) 给出结果。
     */
    public static StubSessionFactory answering(Function<Assertion, SolverStatus> answer) {
        return new StubSessionFactory(answer, "timeout", false, false);
    }

    public static StubSessionFactory unavailable() {
        return new StubSessionFactory(formula -> SolverStatus.UNSATISFIABLE, null, true, false);
    }

    public static StubSessionFactory failingOnCheck() {
        return new StubSessionFactory(formula -> SolverStatus.UNSATISFIABLE, null, false, true);
    }

    public int getOpened() {
        return opened.get();
    }

    public int getClosed() {
        return closed.get();
    }

    public List<Assertion> getAsserted() {
        return List.copyOf(asserted);
    }

    @Override
    public SolverSession open() {
        if (failOnOpen) {
            throw new SolverUnavailableException("stub solver is unavailable", null);
        }
        opened.incrementAndGet();
        return new StubSession();
    }

    private class StubSession implements SolverSession {

        private final Set<String> declared = new TreeSet<>();
        private Assertion formula;

        @Override
        public void declareInt(String name) {
            declared.add(name);
        }

        @Override
        public void assertFormula(Assertion formula) {
            this.formula = formula;
            asserted.add(formula);
        }

        @Override
        public SolverStatus check() {
            if (failOnCheck) {
                throw new SolverException("stub internal error", null);
            }
            return answer.apply(formula);
        }

        @Override
        public VariableValuation getModel() {
            Map<String, BigInteger> values = new HashMap<>();
            declared.forEach(name -> values.put(name, BigInteger.ZERO));
            return VariableValuation.of(values);
        }

        @Override
        public String getReasonUnknown() {
            return reasonUnknown;
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }
    }
}
