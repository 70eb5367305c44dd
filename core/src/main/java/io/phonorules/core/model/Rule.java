package io.phonorules.core.model;

import io.phonorules.core.spi.CompiledPattern;
import java.util.Objects;

/**
 * A compiled rule. Immutable and thread-safe.
 *
 * @param intent   whether a valid word must ({@link Intent#POSITIVE}) or must not ({@link
 *                 Intent#NEGATIVE}) match
 * @param source   the pattern as declared, class references intact
 * @param compiled the expanded pattern as compiled by the pattern engine
 * @param reason   the reason bound at declaration, or {@code null}
 * @param line     1-based declaration line
 */
public record Rule(Intent intent, String source, CompiledPattern compiled, Reason reason, int line) {

    public Rule {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(compiled, "compiled must not be null");
    }

    /** The fully expanded pattern text. */
    public String pattern() {
        return compiled.pattern();
    }

    public boolean hasReason() {
        return reason != null;
    }

    /**
     * Returns {@code true} if {@code word} breaks this rule: a positive rule it does not match, or
     * a negative rule it does match.
     */
    public boolean isViolatedBy(String word) {
        return compiled.matches(word) != (intent == Intent.POSITIVE);
    }
}
