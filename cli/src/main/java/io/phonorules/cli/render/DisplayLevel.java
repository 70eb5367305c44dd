package io.phonorules.cli.render;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** How much of a test report is printed. Failures are shown at every level except {@link #HIDE_ALL}. */
public enum DisplayLevel {
    SHOW_ALL("show-all", true, true, true),
    NOTES_AND_FAILS("notes-and-fails", true, false, true),
    JUST_FAILS("just-fails", false, false, true),
    HIDE_ALL("hide-all", false, false, false);

    private final String id;
    private final boolean notes;
    private final boolean passes;
    private final boolean failures;

    DisplayLevel(String id, boolean notes, boolean passes, boolean failures) {
        this.id = id;
        this.notes = notes;
        this.passes = passes;
        this.failures = failures;
    }

    /** The name used in configuration and on the command line. */
    public String id() {
        return id;
    }

    public boolean showsNotes() {
        return notes;
    }

    /** Whether a test result with the given outcome is printed. */
    public boolean showsResult(boolean passed) {
        return passed ? passes : failures;
    }

    /**
     * Looks up a level by id, ignoring case and accepting {@code _} for {@code -}.
     *
     * @throws IllegalArgumentException if no level has that id
     */
    public static DisplayLevel fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DisplayLevel level : values()) {
            if (level.id.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException(String.format(
                "Unknown display level '%s' (expected one of: %s)",
                id, Arrays.stream(values()).map(DisplayLevel::id).collect(Collectors.joining(", "))));
    }
}
