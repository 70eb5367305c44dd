package io.phonorules.core.error;

/** Thrown when a test declaration has no intent or no words. */
public final class MalformedTestException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    public MalformedTestException(String message, String statement, String source, int line) {
        super(message, statement, source, line);
    }
}
