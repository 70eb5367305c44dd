package io.phonorules.core.error;

/** Thrown when a class declaration lacks {@code =} or has an empty or invalid name. */
public final class MalformedClassException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    public MalformedClassException(String message, String statement, String source, int line) {
        super(message, statement, source, line);
    }
}
