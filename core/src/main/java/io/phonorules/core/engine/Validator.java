package io.phonorules.core.engine;

import io.phonorules.core.model.Rule;
import java.util.List;
import java.util.Optional;

/**
 * Word validity against a rule list. A word is valid iff it matches every positive rule and no
 * negative rule. Shared by {@link TestRunner} and {@link WordGenerator} so both apply the same
 * definition.
 */
public final class Validator {

    private Validator() {}

    /** Returns the first rule, in declaration order, that {@code word} violates. */
    public static Optional<Rule> firstViolation(String word, List<Rule> rules) {
        for (Rule rule : rules) {
            if (rule.isViolatedBy(word)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public static boolean isValid(String word, List<Rule> rules) {
        return firstViolation(word, rules).isEmpty();
    }
}
