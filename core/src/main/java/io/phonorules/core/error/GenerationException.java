package io.phonorules.core.error;

/**
 * Abstract parent for word-generation failures. Raised by {@code WordGenerator}; the scheme
 * itself stays valid and usable for testing.
 */
public abstract class GenerationException extends PhonoException {

    private static final long serialVersionUID = 1L;

    protected GenerationException(String message) {
        super(message, Phase.GENERATION);
    }
}
