package io.phonorules.core.error;

/** Thrown when generation is requested but the scheme defines no usable {@code _} class. */
public final class NoAlphabetException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public NoAlphabetException(String message) {
        super(message);
    }
}
