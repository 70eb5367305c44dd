package io.phonorules.core.engine;

import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Note;
import io.phonorules.core.model.Rule;
import io.phonorules.core.model.Scheme;
import io.phonorules.core.model.TestCase;
import io.phonorules.core.model.TestItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a scheme's declared tests against its rules.
 *
 * <p>
 * Every test word is checked against the full rule set, including rules declared after the
 * test. A positive test passes iff the word is valid; a negative test passes iff it is invalid.
 * Failures are ordinary data in the report, never exceptions. Notes are copied into the report at
 * their declared position.
 *
 * <p>
 * Stateless and thread-safe; the scheme is only read.
 */
public final class TestRunner {

    private static final Logger LOG = LoggerFactory.getLogger(TestRunner.class);

    /** Runs every test of {@code scheme}, in declaration order. */
    public TestReport run(Scheme scheme) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        List<Rule> rules = scheme.rules();
        List<TestOutcome> outcomes = new ArrayList<>();
        for (TestItem item : scheme.items()) {
            if (item instanceof Note note) {
                outcomes.add(new TestOutcome.NoteLine(note.text()));
            } else if (item instanceof TestCase test) {
                for (String word : test.words()) {
                    outcomes.add(evaluate(word, test.intent(), rules));
                }
            }
        }
        TestReport report = new TestReport(outcomes);
        LOG.debug(
                "Ran {} tests against {} rules: {} passed, {} failed",
                report.testCount(),
                rules.size(),
                report.passCount(),
                report.failCount());
        return report;
    }

    /** Tests a single word against {@code rules} with the given expectation. */
    public static TestOutcome.TestResult evaluate(String word, Intent intent, List<Rule> rules) {
        Optional<Rule> violation = Validator.firstViolation(word, rules);
        boolean valid = violation.isEmpty();
        boolean passed = (intent == Intent.POSITIVE) == valid;
        return new TestOutcome.TestResult(word, intent, passed, violation.orElse(null));
    }
}
