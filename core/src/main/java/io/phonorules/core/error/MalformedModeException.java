package io.phonorules.core.error;

/** Thrown when a mode declaration is not delimited by {@code <>}, {@code //} or {@code []}, or has an empty label. */
public final class MalformedModeException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    public MalformedModeException(String message, String statement, String source, int line) {
        super(message, statement, source, line);
    }
}
