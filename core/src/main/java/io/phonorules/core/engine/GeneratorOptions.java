package io.phonorules.core.engine;

/**
 * Search budget for {@link WordGenerator}, applied per generated word.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxAttemptsPerWord maximum number of random candidates tried for one word (default
 *                           100 000)
 * @param maxMillisPerWord   wall-clock limit in milliseconds for one word, {@code 0} for no limit
 *                           (default)
 */
public record GeneratorOptions(int maxAttemptsPerWord, long maxMillisPerWord) {

    /** Default budget: 100 000 attempts, no time limit. */
    public static final GeneratorOptions DEFAULT = new GeneratorOptions(100_000, 0);

    public GeneratorOptions {
        if (maxAttemptsPerWord <= 0) {
            throw new IllegalArgumentException("maxAttemptsPerWord must be positive, got: " + maxAttemptsPerWord);
        }
        if (maxMillisPerWord < 0) {
            throw new IllegalArgumentException("maxMillisPerWord must not be negative, got: " + maxMillisPerWord);
        }
    }

    public boolean hasTimeLimit() {
        return maxMillisPerWord > 0;
    }
}
