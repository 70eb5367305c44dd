package io.phonorules.core.error;

import java.util.List;

/**
 * Thrown when no valid word of the drawn length was found within the attempt or time budget.
 * Words accepted earlier in the same batch are still valid and are available from
 * {@link #acceptedWords()}.
 */
public final class GenerationExhaustedException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final int length;
    private final long attempts;
    private final List<String> acceptedWords;

    public GenerationExhaustedException(int length, long attempts, List<String> acceptedWords) {
        super(String.format("No valid word of length %d found after %d attempts", length, attempts));
        this.length = length;
        this.attempts = attempts;
        this.acceptedWords = List.copyOf(acceptedWords);
    }

    /** The target length that could not be satisfied. */
    public int length() {
        return length;
    }

    /** Number of candidates tried before giving up. */
    public long attempts() {
        return attempts;
    }

    /** Words accepted before the exhausted one, in generation order. */
    public List<String> acceptedWords() {
        return acceptedWords;
    }
}
