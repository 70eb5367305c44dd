package io.phonorules.core.error;

/**
 * Thrown when a statement starts with a character that is not one of the recognised operators
 * ({@code # $ + ! @ ? * ~}).
 */
public final class UnknownOperatorException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    private final char operator;

    public UnknownOperatorException(char operator, String statement, String source, int line) {
        super(String.format("Unknown statement operator '%c' on line %d", operator, line), statement, source, line);
        this.operator = operator;
    }

    /** The unrecognised leading character. */
    public char operator() {
        return operator;
    }
}
