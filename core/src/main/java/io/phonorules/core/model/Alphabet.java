package io.phonorules.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The character set used for word generation, read from the resolved pattern of the {@code _}
 * class.
 *
 * <p>
 * The pattern is interpreted as a literal set of characters, not matched: {@code \x} yields
 * {@code x}, grouping and alternation characters ({@code [ ] ( ) |}) and quantifier or anchor
 * characters ({@code . ^ $ * + ? { }}) are skipped, and {@code a-z} inside brackets expands to
 * the range. So {@code [aeiou][ptk]}, {@code aeioupt k} and {@code (a|e|i)} all read naturally.
 * Duplicates are dropped, keeping first occurrence.
 *
 * @param pattern the resolved {@code _} pattern
 * @param symbols distinct single-code-point strings, in order of first appearance
 */
public record Alphabet(String pattern, List<String> symbols) {

    private static final String IGNORED = "[]()|.^$*+?{}";

    public Alphabet {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(symbols, "symbols must not be null");
        symbols = List.copyOf(symbols);
    }

    /** Reads the character set out of a resolved alphabet pattern. */
    public static Alphabet fromPattern(String pattern) {
        Set<String> symbols = new LinkedHashSet<>();
        int[] cps = pattern.codePoints().toArray();
        int depth = 0;
        for (int i = 0; i < cps.length; i++) {
            int cp = cps[i];
            if (cp == '\\') {
                if (i + 1 < cps.length) {
                    symbols.add(Character.toString(cps[++i]));
                }
                continue;
            }
            if (cp == '[') {
                depth++;
                continue;
            }
            if (cp == ']') {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth > 0 && cp == '-' && i > 0 && i + 1 < cps.length && isRangeEnd(cps[i - 1], cps[i + 1])) {
                for (int c = cps[i - 1] + 1; c <= cps[i + 1]; c++) {
                    symbols.add(Character.toString(c));
                }
                i++;
                continue;
            }
            if (Character.isWhitespace(cp) || IGNORED.indexOf(cp) >= 0) {
                continue;
            }
            symbols.add(Character.toString(cp));
        }
        return new Alphabet(pattern, new ArrayList<>(symbols));
    }

    private static boolean isRangeEnd(int from, int to) {
        return from < to && IGNORED.indexOf(from) < 0 && IGNORED.indexOf(to) < 0;
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public int size() {
        return symbols.size();
    }
}
