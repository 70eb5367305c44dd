package io.phonorules.core.engine.regex;

import io.phonorules.core.error.PatternCompileException;
import io.phonorules.core.spi.CompiledPattern;
import io.phonorules.core.spi.PatternEngine;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pattern engine backed by {@link java.util.regex}. Supports lookaround, named groups {@code
 * (?<name>...)} and back-references {@code \k<name>}. Python-style {@code (?P<name>...)} groups
 * are not part of the JDK syntax and are rejected at compile time.
 */
public final class JdkRegexEngine implements PatternEngine {

    /** Engine identifier. */
    public static final String ENGINE_ID = "jdk";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledPattern compile(String pattern) {
        try {
            return new JdkCompiledPattern(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            throw new PatternCompileException(pattern, e.getDescription(), e, null, null);
        }
    }

    /** Thread-safe compiled handle; {@link Pattern} is immutable, matchers are per call. */
    private static final class JdkCompiledPattern implements CompiledPattern {

        private final Pattern regex;

        JdkCompiledPattern(Pattern regex) {
            this.regex = regex;
        }

        @Override
        public String pattern() {
            return regex.pattern();
        }

        @Override
        public boolean matches(String word) {
            return regex.matcher(word).find();
        }

        @Override
        public String toString() {
            return regex.pattern();
        }
    }
}
