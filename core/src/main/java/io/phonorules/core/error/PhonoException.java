package io.phonorules.core.error;

/**
 * Abstract base for all phono-rules exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SchemeLoadException} or {@link GenerationException}.
 */
public abstract class PhonoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        GENERATION
    }

    private final Phase phase;

    protected PhonoException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected PhonoException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
