package gr.imsi.athenarc.regexnfa.manager;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Verdicts for a batch of strings, in input order.
 */
public class TestSuiteResult {
    private final String expression;
    private final ImmutableList<TestCaseResult> results;
    private final long executionTime;

    public TestSuiteResult(String expression, List<TestCaseResult> results, long executionTime) {
        this.expression = expression;
        this.results = ImmutableList.copyOf(results);
        this.executionTime = executionTime;
    }

    public String getExpression() {
        return expression;
    }

    public ImmutableList<TestCaseResult> getResults() {
        return results;
    }

    /**
     * @return wall time of the batch in milliseconds
     */
    public long getExecutionTime() {
        return executionTime;
    }

    public int getAcceptedCount() {
        return (int) results.stream().filter(TestCaseResult::isAccepted).count();
    }

    public int getRejectedCount() {
        return results.size() - getAcceptedCount();
    }

    public int size() {
        return results.size();
    }
}
