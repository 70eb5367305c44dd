package io.phonorules.core.spi;

/**
 * Pluggable pattern-matching SPI. Rule patterns are compiled through an engine after class
 * references have been expanded; the engine owns the pattern syntax (character classes,
 * repetition, anchors, named groups, back-references).
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface PatternEngine {

    /**
     * Returns the engine identifier, e.g. {@code "jdk"}.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given pattern into an immutable, thread-safe handle.
     *
     * @param pattern the fully expanded pattern text
     * @return a compiled pattern ready for matching
     * @throws io.phonorules.core.error.PatternCompileException if the engine rejects the syntax
     */
    CompiledPattern compile(String pattern);
}
