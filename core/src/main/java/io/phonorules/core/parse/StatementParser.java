package io.phonorules.core.parse;

import io.phonorules.core.error.MalformedClassException;
import io.phonorules.core.error.MalformedModeException;
import io.phonorules.core.error.MalformedRuleException;
import io.phonorules.core.error.MalformedTestException;
import io.phonorules.core.error.UnknownOperatorException;
import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Mode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits rule-file text into typed {@link Statement}s.
 *
 * <p>
 * Statements are separated by line breaks and {@code ;}. A statement whose first non-blank
 * character is {@code #} is a comment running to the end of the line, so a {@code ;} inside a
 * comment does not start a new statement. Surrounding whitespace is discarded and empty statements
 * are dropped.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class StatementParser {

    /** Valid class names. */
    static final Pattern CLASS_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private StatementParser() {}

    /**
     * Parses the given text into statements, in source order. Comments are not returned.
     *
     * @param text   the full rule-file text
     * @param source label used in error messages (file path), may be {@code null}
     * @return the typed statements
     * @throws io.phonorules.core.error.SchemeParseException on the first malformed statement
     */
    public static List<Statement> parse(String text, String source) {
        List<Statement> statements = new ArrayList<>();
        String[] lines = LINE_BREAK.split(text, -1);
        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = lines[index];
            int pos = 0;
            while (pos < line.length()) {
                while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                    pos++;
                }
                if (pos >= line.length() || line.charAt(pos) == '#') {
                    break;
                }
                int end = line.indexOf(';', pos);
                if (end < 0) {
                    end = line.length();
                }
                String statement = line.substring(pos, end).trim();
                if (!statement.isEmpty()) {
                    statements.add(parseStatement(statement, source, lineNumber));
                }
                pos = end + 1;
            }
        }
        return statements;
    }

    /** Parses one trimmed, non-empty, non-comment statement. */
    static Statement parseStatement(String statement, String source, int line) {
        char operator = statement.charAt(0);
        String body = statement.substring(1);
        return switch (operator) {
            case '$' -> parseClass(body, statement, source, line);
            case '+', '!' -> parseRule(operator, body, statement, source, line);
            case '@' -> parseReason(body, line);
            case '?' -> parseTest(body, statement, source, line);
            case '*' -> new Statement.NoteDecl(line, body.trim());
            case '~' -> parseMode(body, statement, source, line);
            default -> throw new UnknownOperatorException(operator, statement, source, line);
        };
    }

    private static Statement parseClass(String body, String statement, String source, int line) {
        int eq = body.indexOf('=');
        if (eq < 0) {
            throw new MalformedClassException(
                    String.format("Class declaration on line %d is missing '='", line), statement, source, line);
        }
        String name = body.substring(0, eq).trim();
        if (name.isEmpty()) {
            throw new MalformedClassException(
                    String.format("Class declaration on line %d has an empty name", line), statement, source, line);
        }
        if (!CLASS_NAME.matcher(name).matches()) {
            throw new MalformedClassException(
                    String.format(
                            "Class name '%s' on line %d must contain only letters, digits and '_'", name, line),
                    statement,
                    source,
                    line);
        }
        return new Statement.ClassDecl(line, name, stripWhitespace(body.substring(eq + 1)));
    }

    private static Statement parseRule(char operator, String body, String statement, String source, int line) {
        String pattern = stripWhitespace(body);
        if (pattern.isEmpty()) {
            throw new MalformedRuleException(
                    String.format("Rule on line %d has no pattern", line), statement, source, line);
        }
        Intent intent = Intent.fromSymbol(operator).orElseThrow();
        return new Statement.RuleDecl(line, intent, pattern);
    }

    private static Statement parseReason(String body, int line) {
        boolean note = body.startsWith("*");
        String text = (note ? body.substring(1) : body).trim();
        return new Statement.ReasonDecl(line, text, note);
    }

    private static Statement parseTest(String body, String statement, String source, int line) {
        Optional<Intent> intent = body.isEmpty() ? Optional.empty() : Intent.fromSymbol(body.charAt(0));
        if (intent.isEmpty()) {
            throw new MalformedTestException(
                    String.format("Test on line %d must start with '?+' or '?!'", line), statement, source, line);
        }
        String words = body.substring(1).trim();
        if (words.isEmpty()) {
            throw new MalformedTestException(
                    String.format("Test on line %d has no words", line), statement, source, line);
        }
        return new Statement.TestDecl(line, intent.get(), Arrays.asList(WHITESPACE.split(words)));
    }

    private static Statement parseMode(String body, String statement, String source, int line) {
        String delimited = body.trim();
        if (delimited.length() < 2) {
            throw new MalformedModeException(
                    String.format("Mode on line %d must be written as <label>, /label/ or [label]", line),
                    statement,
                    source,
                    line);
        }
        char open = delimited.charAt(0);
        char close = delimited.charAt(delimited.length() - 1);
        Optional<Mode.Kind> kind = Mode.Kind.fromDelimiters(open, close);
        if (kind.isEmpty()) {
            throw new MalformedModeException(
                    String.format(
                            "Mode on line %d has unknown delimiters %c...%c; use <label>, /label/ or [label]",
                            line, open, close),
                    statement,
                    source,
                    line);
        }
        String label = delimited.substring(1, delimited.length() - 1).trim();
        if (label.isEmpty()) {
            throw new MalformedModeException(
                    String.format("Mode on line %d has an empty label", line), statement, source, line);
        }
        return new Statement.ModeDecl(line, new Mode(kind.get(), label));
    }

    private static String stripWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }
}
