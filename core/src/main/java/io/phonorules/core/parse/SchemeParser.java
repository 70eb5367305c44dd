package io.phonorules.core.parse;

import io.phonorules.core.error.DuplicateClassException;
import io.phonorules.core.model.Alphabet;
import io.phonorules.core.model.Mode;
import io.phonorules.core.model.Note;
import io.phonorules.core.model.Reason;
import io.phonorules.core.model.Rule;
import io.phonorules.core.model.Scheme;
import io.phonorules.core.model.SchemeClass;
import io.phonorules.core.model.TestCase;
import io.phonorules.core.model.TestItem;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns rule-file text into a {@link Scheme}: splits statements, resolves classes, compiles rules
 * and binds reasons, tests, notes and mode in declaration order.
 *
 * <p>
 * Every stage fails fast; there is no partial scheme. Thread-safe: all parse state lives in a
 * per-call {@link ParseState}.
 */
public final class SchemeParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemeParser.class);

    private final RuleCompiler ruleCompiler;

    public SchemeParser(RuleCompiler ruleCompiler) {
        this.ruleCompiler = Objects.requireNonNull(ruleCompiler, "ruleCompiler must not be null");
    }

    /**
     * Parses anonymous rule text.
     *
     * @see #parse(String, String)
     */
    public Scheme parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses the full text of a rule file.
     *
     * @param text   the rule-file text
     * @param source label used in error messages (usually the file path), may be {@code null}
     * @return the resolved, immutable scheme
     * @throws io.phonorules.core.error.SchemeLoadException if any statement is malformed, a class
     *     reference cannot be resolved or a pattern does not compile
     */
    public Scheme parse(String text, String source) {
        Objects.requireNonNull(text, "text must not be null");
        List<Statement> statements = StatementParser.parse(text, source);

        Map<String, Statement.ClassDecl> classDecls = collectClasses(statements, source);
        Map<String, String> templates = new LinkedHashMap<>();
        classDecls.forEach((name, decl) -> templates.put(name, decl.template()));
        Map<String, String> classTable = ClassResolver.resolve(templates, source);

        Map<String, SchemeClass> classes = new LinkedHashMap<>();
        classDecls.forEach((name, decl) ->
                classes.put(name, new SchemeClass(name, decl.template(), classTable.get(name), decl.line())));

        ParseState state = new ParseState();
        for (Statement statement : statements) {
            apply(statement, state, classTable, source);
        }
        if (state.pendingReason != null) {
            LOG.warn(
                    "Reason '{}' on line {} is not followed by a rule and is ignored",
                    state.pendingReason.text(),
                    state.pendingReasonLine);
        }

        return new Scheme(source, classes, state.rules, state.items, state.mode, alphabetOf(classes));
    }

    private static Map<String, Statement.ClassDecl> collectClasses(List<Statement> statements, String source) {
        Map<String, Statement.ClassDecl> classDecls = new LinkedHashMap<>();
        for (Statement statement : statements) {
            if (statement instanceof Statement.ClassDecl decl) {
                Statement.ClassDecl previous = classDecls.putIfAbsent(decl.name(), decl);
                if (previous != null) {
                    throw new DuplicateClassException(
                            decl.name(),
                            previous.line(),
                            "$" + decl.name() + "=" + decl.template(),
                            source,
                            decl.line());
                }
            }
        }
        return classDecls;
    }

    private void apply(Statement statement, ParseState state, Map<String, String> classTable, String source) {
        if (statement instanceof Statement.RuleDecl decl) {
            Reason reason = state.takePendingReason();
            Rule rule = ruleCompiler.compile(decl.intent(), decl.pattern(), classTable, reason, source, decl.line());
            state.rules.add(rule);
            if (reason != null && reason.note()) {
                state.items.add(new Note(reason.text(), decl.line(), state.rules.size(), true));
            }
        } else if (statement instanceof Statement.ReasonDecl decl) {
            state.setPendingReason(decl);
        } else if (statement instanceof Statement.TestDecl decl) {
            state.items.add(new TestCase(decl.intent(), decl.words(), decl.line(), state.rules.size()));
        } else if (statement instanceof Statement.NoteDecl decl) {
            state.items.add(new Note(decl.text(), decl.line(), state.rules.size(), false));
        } else if (statement instanceof Statement.ModeDecl decl) {
            if (state.mode != null) {
                LOG.warn(
                        "Mode {} on line {} replaces earlier mode {}",
                        decl.mode().delimited(),
                        decl.line(),
                        state.mode.delimited());
            }
            state.mode = decl.mode();
        }
        // ClassDecl is handled before rules are compiled
    }

    private static Alphabet alphabetOf(Map<String, SchemeClass> classes) {
        SchemeClass alphabetClass = classes.get(SchemeClass.ALPHABET_NAME);
        if (alphabetClass == null) {
            return null;
        }
        Alphabet alphabet = Alphabet.fromPattern(alphabetClass.pattern());
        if (alphabet.isEmpty()) {
            LOG.warn("Alphabet class '_' on line {} defines no characters", alphabetClass.line());
            return null;
        }
        return alphabet;
    }

    /** Accumulating state threaded through one parse. */
    private static final class ParseState {

        private final List<Rule> rules = new ArrayList<>();
        private final List<TestItem> items = new ArrayList<>();
        private Reason pendingReason;
        private int pendingReasonLine;
        private Mode mode;

        /** Returns the pending reason, if any, and clears it. */
        Reason takePendingReason() {
            Reason reason = pendingReason;
            pendingReason = null;
            return reason;
        }

        void setPendingReason(Statement.ReasonDecl decl) {
            if (pendingReason != null) {
                LOG.debug(
                        "Reason on line {} replaces unused reason from line {}", decl.line(), pendingReasonLine);
            }
            pendingReason = decl.text().isEmpty() ? null : new Reason(decl.text(), decl.note());
            pendingReasonLine = decl.line();
        }
    }
}
