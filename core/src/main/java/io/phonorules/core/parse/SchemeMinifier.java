package io.phonorules.core.parse;

import io.phonorules.core.model.Note;
import io.phonorules.core.model.Reason;
import io.phonorules.core.model.Rule;
import io.phonorules.core.model.Scheme;
import io.phonorules.core.model.SchemeClass;
import io.phonorules.core.model.TestCase;
import io.phonorules.core.model.TestItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes a {@link Scheme} back out as compact rule-file text: one line, statements joined by
 * {@code ;}, comments dropped. Parsing the output yields a scheme with the same classes, rules,
 * reasons, mode and (when included) tests and notes in the same relative order.
 *
 * <p>
 * Order: mode, classes, then rules interleaved with tests and notes. Each rule is preceded by
 * its reason. Notes produced by note-reasons are not written; the {@code @*} reason recreates
 * them.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class SchemeMinifier {

    private static final String SEPARATOR = ";";

    private SchemeMinifier() {}

    /**
     * Serialises the scheme.
     *
     * @param scheme       the scheme to write
     * @param includeTests whether tests and notes are written
     * @return the minified rule text
     */
    public static String minify(Scheme scheme, boolean includeTests) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        List<String> statements = new ArrayList<>();

        scheme.mode().ifPresent(mode -> statements.add("~" + mode.delimited()));
        for (SchemeClass schemeClass : scheme.classes().values()) {
            statements.add("$" + schemeClass.name() + "=" + schemeClass.template());
        }

        List<TestItem> items = includeTests ? scheme.items() : List.of();
        int next = 0;
        List<Rule> rules = scheme.rules();
        for (int i = 0; i < rules.size(); i++) {
            next = writeItems(items, next, i, statements);
            Rule rule = rules.get(i);
            if (rule.hasReason()) {
                statements.add(reason(rule.reason()));
            }
            statements.add(rule.intent().symbol() + rule.source());
        }
        writeItems(items, next, rules.size(), statements);

        return String.join(SEPARATOR, statements);
    }

    /** Writes items declared before rule {@code ruleIndex}; returns the index of the first unwritten item. */
    private static int writeItems(List<TestItem> items, int from, int ruleIndex, List<String> statements) {
        int index = from;
        while (index < items.size() && items.get(index).rulesBefore() <= ruleIndex) {
            TestItem item = items.get(index++);
            if (item instanceof TestCase test) {
                statements.add("?" + test.intent().symbol() + String.join(" ", test.words()));
            } else if (item instanceof Note note && !note.fromReason()) {
                statements.add("*" + note.text());
            }
        }
        return index;
    }

    private static String reason(Reason reason) {
        if (reason.note()) {
            return "@*" + reason.text();
        }
        // A plain reason starting with '*' would read back as a note-reason
        return reason.text().startsWith("*") ? "@ " + reason.text() : "@" + reason.text();
    }
}
