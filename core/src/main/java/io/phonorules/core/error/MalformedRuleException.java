package io.phonorules.core.error;

/** Thrown when a rule declaration has no pattern. */
public final class MalformedRuleException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    public MalformedRuleException(String message, String statement, String source, int line) {
        super(message, statement, source, line);
    }
}
