package io.phonorules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A declared test: every word is expected to be valid ({@link Intent#POSITIVE}) or invalid
 * ({@link Intent#NEGATIVE}).
 */
public record TestCase(Intent intent, List<String> words, int line, int rulesBefore) implements TestItem {

    public TestCase {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(words, "words must not be null");
        if (words.isEmpty()) {
            throw new IllegalArgumentException("TestCase requires at least one word");
        }
        words = List.copyOf(words);
    }
}
