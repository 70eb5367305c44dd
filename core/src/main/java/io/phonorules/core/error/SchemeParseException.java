package io.phonorules.core.error;

/**
 * Abstract parent for statement-level syntax errors. Always tied to a line and carries the
 * trimmed statement text so diagnostics can quote it.
 */
public abstract class SchemeParseException extends SchemeLoadException {

    private static final long serialVersionUID = 1L;

    private final String statement;

    protected SchemeParseException(String message, String statement, String source, int line) {
        super(message, source, line);
        this.statement = statement;
    }

    /** The offending statement, trimmed. */
    public String statement() {
        return statement;
    }
}
