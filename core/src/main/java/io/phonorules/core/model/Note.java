package io.phonorules.core.model;

import java.util.Objects;

/**
 * A reporting marker interleaved with test output. Has no effect on validation.
 *
 * @param fromReason {@code true} if the note was produced by a note-reason ({@code @*}) when its
 *                   rule was declared, rather than by a {@code *} statement
 */
public record Note(String text, int line, int rulesBefore, boolean fromReason) implements TestItem {

    public Note {
        Objects.requireNonNull(text, "text must not be null");
    }
}
