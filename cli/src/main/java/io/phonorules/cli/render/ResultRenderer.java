package io.phonorules.cli.render;

import io.phonorules.core.engine.TestOutcome;
import io.phonorules.core.engine.TestReport;
import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Reason;
import java.util.Objects;

/**
 * Formats a {@link TestReport} for the terminal.
 *
 * <p>
 * Layout: a header, a blank line, one line per visible note or result, a blank line and a
 * summary. A result line is {@code "  ✔ word   pass"} or {@code "  ✗ word   FAIL reason"}, with
 * words padded to the longest tested word. Colours are ANSI escapes and can be switched off.
 */
public final class ResultRenderer {

    static final String MATCHED_BUT_SHOULD_NOT = "Matched, but should have not";
    static final String NO_REASON_GIVEN = "No reason given";

    private static final String ESC = "\u001b[";
    private static final String RESET = ESC + "0m";

    private final DisplayLevel level;
    private final boolean color;

    public ResultRenderer(DisplayLevel level, boolean color) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.color = color;
    }

    /** Renders the whole report, each line terminated by {@code \n}. */
    public String render(TestReport report) {
        StringBuilder out = new StringBuilder("\n");
        if (report.isEmpty()) {
            return out.append(paint("33", "No tests to run.")).append('\n').toString();
        }
        out.append(paint("3;33", "Running " + report.testCount() + " tests...")).append('\n');

        boolean printedAny = false;
        for (TestOutcome outcome : report.outcomes()) {
            String line = line(outcome, report.maxWordLength());
            if (line == null) {
                continue;
            }
            if (!printedAny) {
                out.append('\n');
                printedAny = true;
            }
            out.append(line).append('\n');
        }
        if (printedAny) {
            out.append('\n');
        }
        return out.append(summary(report)).append('\n').toString();
    }

    /** The visible line for one outcome, or {@code null} if the display level hides it. */
    private String line(TestOutcome outcome, int wordColumn) {
        if (outcome instanceof TestOutcome.NoteLine note) {
            return level.showsNotes() ? paint("34", note.text()) : null;
        }
        TestOutcome.TestResult result = (TestOutcome.TestResult) outcome;
        if (!level.showsResult(result.passed())) {
            return null;
        }
        boolean positive = result.testIntent() == Intent.POSITIVE;
        String word = result.word();
        StringBuilder line = new StringBuilder("  ")
                .append(positive ? paint("36", "✔") : paint("35", "✗"))
                .append(' ')
                .append(word)
                .append(" ".repeat(wordColumn - word.codePointCount(0, word.length())))
                .append("  ")
                .append(result.passed() ? paint("1;32", "pass") : paint("1;31", "FAIL"));
        String failure = failureText(result);
        if (!failure.isEmpty()) {
            String codes = failure.equals(MATCHED_BUT_SHOULD_NOT) ? "33" : "3;1";
            line.append(' ').append(paint(codes, failure));
        }
        return line.toString();
    }

    private String summary(TestReport report) {
        if (report.allPassed()) {
            return paint("32;1;3", "All tests pass!");
        }
        int fails = report.failCount();
        return paint("31;1;3", fails + " test" + (fails == 1 ? "" : "s") + " failed!");
    }

    /** Why a result failed; empty for passing results. */
    static String failureText(TestOutcome.TestResult result) {
        if (result.passed()) {
            return "";
        }
        if (result.wordValid()) {
            return MATCHED_BUT_SHOULD_NOT;
        }
        return result.reason().map(Reason::text).orElse(NO_REASON_GIVEN);
    }

    private String paint(String codes, String text) {
        return color ? ESC + codes + "m" + text + RESET : text;
    }
}
