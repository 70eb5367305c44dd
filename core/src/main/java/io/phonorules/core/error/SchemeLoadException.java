package io.phonorules.core.error;

/**
 * Abstract parent for errors raised while turning rule-file text into a {@code Scheme}: statement
 * syntax, class resolution and pattern compilation. A scheme that fails to load is never usable
 * for testing or generation.
 *
 * <p>
 * Carries the {@code source} label (usually the file path) and the 1-based line of the
 * offending statement where one is known.
 */
public abstract class SchemeLoadException extends PhonoException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final Integer line;

    protected SchemeLoadException(String message, String source, Integer line) {
        super(message, Phase.LOAD);
        this.source = source;
        this.line = line;
    }

    protected SchemeLoadException(String message, Throwable cause, String source, Integer line) {
        super(message, cause, Phase.LOAD);
        this.source = source;
        this.line = line;
    }

    /** The file path or label of the rule source, or {@code null} for anonymous text. */
    public String source() {
        return source;
    }

    /** The 1-based line of the offending statement, or {@code null} if not tied to one line. */
    public Integer line() {
        return line;
    }
}
