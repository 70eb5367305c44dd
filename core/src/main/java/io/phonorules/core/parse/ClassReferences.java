package io.phonorules.core.parse;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds and expands {@code <name>} class references in pattern text.
 *
 * <p>
 * Each {@code <} is inspected with a short lookback. It is left alone as native pattern syntax
 * when it is preceded by {@code (?} (lookbehind or named group), {@code (?P} (Python-style named
 * group) or {@code \k} (named back-reference), or when it is escaped. Otherwise, if it is closed
 * by {@code >} with an identifier in between, it is a class reference. {@code <...>} with any
 * other content is ordinary pattern text.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class ClassReferences {

    private ClassReferences() {}

    /**
     * A class reference found in a pattern.
     *
     * @param name  the referenced class name
     * @param start index of the opening {@code <}
     * @param end   index just past the closing {@code >}
     */
    public record Reference(String name, int start, int end) {}

    /** Returns every class reference in {@code text}, in order of appearance. */
    public static List<Reference> find(String text) {
        List<Reference> refs = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf('<', pos);
            if (open < 0) {
                break;
            }
            if (isNativeSyntax(text, open)) {
                pos = open + 1;
                continue;
            }
            int close = text.indexOf('>', open + 1);
            if (close < 0) {
                break;
            }
            String name = text.substring(open + 1, close);
            if (StatementParser.CLASS_NAME.matcher(name).matches()) {
                refs.add(new Reference(name, open, close + 1));
                pos = close + 1;
            } else {
                pos = open + 1;
            }
        }
        return refs;
    }

    /** Returns the distinct class names referenced by {@code text}, in order of first appearance. */
    public static Set<String> names(String text) {
        Set<String> names = new LinkedHashSet<>();
        for (Reference ref : find(text)) {
            names.add(ref.name());
        }
        return names;
    }

    /**
     * Replaces every class reference in {@code text} with its value from {@code values}. The
     * substitution is literal and single-pass: substituted text is not rescanned.
     *
     * @throws IllegalStateException if a referenced name has no value; callers validate first
     */
    public static String expand(String text, Map<String, String> values) {
        List<Reference> refs = find(text);
        if (refs.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        for (Reference ref : refs) {
            String value = values.get(ref.name());
            if (value == null) {
                throw new IllegalStateException("No value for class '" + ref.name() + "'");
            }
            out.append(text, last, ref.start()).append(value);
            last = ref.end();
        }
        return out.append(text, last, text.length()).toString();
    }

    private static boolean isNativeSyntax(String text, int open) {
        if (isEscaped(text, open)) {
            return true;
        }
        if (endsWithAt(text, open, "(?") && !isEscaped(text, open - 2)) {
            return true;
        }
        if (endsWithAt(text, open, "(?P") && !isEscaped(text, open - 3)) {
            return true;
        }
        return endsWithAt(text, open, "\\k") && !isEscaped(text, open - 2);
    }

    private static boolean endsWithAt(String text, int index, String prefix) {
        return index >= prefix.length() && text.startsWith(prefix, index - prefix.length());
    }

    /** True if the character at {@code index} is preceded by an odd run of backslashes. */
    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
