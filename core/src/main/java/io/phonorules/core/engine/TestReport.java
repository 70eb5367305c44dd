package io.phonorules.core.engine;

import java.util.List;
import java.util.Objects;

/**
 * Ordered outcomes of a test run, with summary counts.
 *
 * @param outcomes notes and word results in declaration order
 */
public record TestReport(List<TestOutcome> outcomes) {

    public TestReport {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /** Only the word results, in order. */
    public List<TestOutcome.TestResult> results() {
        return outcomes.stream()
                .filter(TestOutcome.TestResult.class::isInstance)
                .map(TestOutcome.TestResult.class::cast)
                .toList();
    }

    public int testCount() {
        return results().size();
    }

    public int failCount() {
        return (int) results().stream().filter(r -> !r.passed()).count();
    }

    public int passCount() {
        return testCount() - failCount();
    }

    public boolean allPassed() {
        return failCount() == 0;
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    /** Length in code points of the longest tested word, for column alignment. */
    public int maxWordLength() {
        return results().stream()
                .mapToInt(r -> r.word().codePointCount(0, r.word().length()))
                .max()
                .orElse(0);
    }
}
