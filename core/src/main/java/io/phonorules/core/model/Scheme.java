package io.phonorules.core.model;

import io.phonorules.core.error.NoAlphabetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The fully resolved result of parsing one rule source: classes, rules, the test stream (tests
 * and notes in declaration order), the transcription mode and the generation alphabet.
 *
 * <p>
 * Immutable and thread-safe once built. The test runner and word generator only read it.
 */
public final class Scheme {

    private final String source;
    private final Map<String, SchemeClass> classes;
    private final List<Rule> rules;
    private final List<TestItem> items;
    private final Mode mode;
    private final Alphabet alphabet;

    public Scheme(
            String source,
            Map<String, SchemeClass> classes,
            List<Rule> rules,
            List<TestItem> items,
            Mode mode,
            Alphabet alphabet) {
        this.source = source;
        this.classes = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(classes, "classes must not be null")));
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
        this.mode = mode;
        this.alphabet = alphabet;
    }

    /** The file path or label the scheme was parsed from, or {@code null}. */
    public String source() {
        return source;
    }

    /** Classes by name, in declaration order. */
    public Map<String, SchemeClass> classes() {
        return classes;
    }

    public Optional<SchemeClass> findClass(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    /** Rules in declaration order. */
    public List<Rule> rules() {
        return rules;
    }

    /** Tests and notes in declaration order. */
    public List<TestItem> items() {
        return items;
    }

    /** Only the tests of {@link #items()}, in order. */
    public List<TestCase> tests() {
        return items.stream()
                .filter(TestCase.class::isInstance)
                .map(TestCase.class::cast)
                .toList();
    }

    /** Only the notes of {@link #items()}, in order. */
    public List<Note> notes() {
        return items.stream().filter(Note.class::isInstance).map(Note.class::cast).toList();
    }

    public Optional<Mode> mode() {
        return Optional.ofNullable(mode);
    }

    /** The generation alphabet, present only if a non-empty {@code _} class is defined. */
    public Optional<Alphabet> alphabet() {
        return Optional.ofNullable(alphabet);
    }

    /**
     * Returns the generation alphabet.
     *
     * @throws NoAlphabetException if no usable {@code _} class is defined
     */
    public Alphabet requireAlphabet() {
        if (alphabet != null) {
            return alphabet;
        }
        if (classes.containsKey(SchemeClass.ALPHABET_NAME)) {
            throw new NoAlphabetException("Alphabet class '_' defines no characters");
        }
        throw new NoAlphabetException("No alphabet class '_' defined; word generation is unavailable");
    }

    @Override
    public String toString() {
        return "Scheme[source=" + source + ", classes=" + classes.size() + ", rules=" + rules.size() + ", items="
                + items.size() + ", mode=" + mode + "]";
    }
}
