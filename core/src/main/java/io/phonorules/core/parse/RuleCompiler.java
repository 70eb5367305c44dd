package io.phonorules.core.parse;

import io.phonorules.core.error.PatternCompileException;
import io.phonorules.core.error.UndefinedClassException;
import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Reason;
import io.phonorules.core.model.Rule;
import io.phonorules.core.spi.CompiledPattern;
import io.phonorules.core.spi.PatternEngine;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles rule patterns: expands class references against the resolved class table, then hands
 * the expanded text to the {@link PatternEngine}.
 *
 * <p>
 * Thread-safe if the underlying engine is (it must be).
 */
public final class RuleCompiler {

    private final PatternEngine engine;

    public RuleCompiler(PatternEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public PatternEngine engine() {
        return engine;
    }

    /**
     * Compiles one rule.
     *
     * @param intent     rule intent
     * @param rawPattern the pattern as declared
     * @param classTable resolved class patterns by name
     * @param reason     the pending reason this rule takes, or {@code null}
     * @param source     label used in error messages, may be {@code null}
     * @param line       1-based declaration line
     * @return the compiled rule
     * @throws UndefinedClassException  if the pattern references an unknown class
     * @throws PatternCompileException if the engine rejects the expanded pattern
     */
    public Rule compile(
            Intent intent, String rawPattern, Map<String, String> classTable, Reason reason, String source, int line) {
        for (String name : ClassReferences.names(rawPattern)) {
            if (!classTable.containsKey(name)) {
                throw new UndefinedClassException(name, "rule on line " + line, source, line);
            }
        }
        String expanded = ClassReferences.expand(rawPattern, classTable);
        return new Rule(intent, rawPattern, compilePattern(expanded, source, line), reason, line);
    }

    private CompiledPattern compilePattern(String expanded, String source, int line) {
        try {
            return engine.compile(expanded);
        } catch (PatternCompileException e) {
            // Re-throw with rule context attached
            throw new PatternCompileException(e.pattern(), e.underlyingMessage(), e.getCause(), source, line);
        }
    }
}
