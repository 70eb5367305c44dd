package io.phonorules.core.error;

/** Thrown when a rule file cannot be read. */
public final class SchemeReadException extends SchemeLoadException {

    private static final long serialVersionUID = 1L;

    public SchemeReadException(String message, Throwable cause, String source) {
        super(message, cause, source, null);
    }
}
