package io.phonorules.core.parse;

import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Mode;
import java.util.List;

/**
 * A typed rule-file statement as produced by {@link StatementParser}. No semantic binding has
 * happened yet: class references are unresolved and reasons are not attached to rules.
 */
public sealed interface Statement {

    /** 1-based line on which the statement starts. */
    int line();

    /** {@code $name=template} */
    record ClassDecl(int line, String name, String template) implements Statement {}

    /** {@code +pattern} or {@code !pattern} */
    record RuleDecl(int line, Intent intent, String pattern) implements Statement {}

    /** {@code @text} or {@code @*text}; blank text clears the pending reason. */
    record ReasonDecl(int line, String text, boolean note) implements Statement {}

    /** {@code ?+words} or {@code ?!words} */
    record TestDecl(int line, Intent intent, List<String> words) implements Statement {
        public TestDecl {
            words = List.copyOf(words);
        }
    }

    /** {@code *text} */
    record NoteDecl(int line, String text) implements Statement {}

    /** {@code ~<label>}, {@code ~/label/} or {@code ~[label]} */
    record ModeDecl(int line, Mode mode) implements Statement {}
}
