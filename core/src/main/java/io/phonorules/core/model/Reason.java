package io.phonorules.core.model;

import java.util.Objects;

/**
 * Explanation attached to the next declared rule and surfaced when a test word violates it.
 *
 * @param text the reason text
 * @param note if {@code true}, the text is also emitted as a {@link Note} at the rule's position
 */
public record Reason(String text, boolean note) {

    public Reason {
        Objects.requireNonNull(text, "text must not be null");
    }
}
