package io.phonorules.core.engine;

import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Reason;
import io.phonorules.core.model.Rule;
import java.util.Objects;
import java.util.Optional;

/** One entry of a {@link TestReport}: a note or the result of testing one word. */
public sealed interface TestOutcome {

    /** A note, emitted at its declared position. */
    record NoteLine(String text) implements TestOutcome {
        public NoteLine {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * The result of testing one word.
     *
     * @param word        the tested word
     * @param testIntent  whether the test expected the word to be valid or invalid
     * @param passed      whether the word's validity agrees with the test intent
     * @param failingRule the first rule the word violates, or {@code null} if the word is valid
     */
    record TestResult(String word, Intent testIntent, boolean passed, Rule failingRule) implements TestOutcome {

        public TestResult {
            Objects.requireNonNull(word, "word must not be null");
            Objects.requireNonNull(testIntent, "testIntent must not be null");
        }

        /** Whether the word satisfies every rule. */
        public boolean wordValid() {
            return failingRule == null;
        }

        public Optional<Rule> failingRuleOpt() {
            return Optional.ofNullable(failingRule);
        }

        /** The failing rule's reason, if the word is invalid and the rule has one. */
        public Optional<Reason> reason() {
            return failingRuleOpt().map(Rule::reason);
        }
    }
}
