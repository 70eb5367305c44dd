package io.phonorules.core.error;

/**
 * Thrown when the pattern engine rejects a fully expanded rule pattern. The engine's own
 * diagnostic is kept in {@link #underlyingMessage()}.
 */
public final class PatternCompileException extends SchemeLoadException {

    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final String underlyingMessage;

    public PatternCompileException(
            String pattern, String underlyingMessage, Throwable cause, String source, Integer line) {
        super(
                line == null
                        ? String.format("Invalid pattern '%s': %s", pattern, underlyingMessage)
                        : String.format("Invalid pattern '%s' on line %d: %s", pattern, line, underlyingMessage),
                cause,
                source,
                line);
        this.pattern = pattern;
        this.underlyingMessage = underlyingMessage;
    }

    /** The expanded pattern text handed to the engine. */
    public String pattern() {
        return pattern;
    }

    /** The engine's description of the syntax error. */
    public String underlyingMessage() {
        return underlyingMessage;
    }
}
