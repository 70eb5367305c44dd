package io.phonorules.core.spi;

/**
 * An immutable, thread-safe compiled pattern handle produced by {@link
 * PatternEngine#compile(String)}.
 */
public interface CompiledPattern {

    /** The pattern text this handle was compiled from. */
    String pattern();

    /**
     * Returns {@code true} if the pattern matches anywhere in {@code word}. Rules that must cover
     * the whole word anchor themselves with {@code ^} and {@code $}.
     */
    boolean matches(String word);
}
