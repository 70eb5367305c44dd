package io.phonorules.core.model;

import java.util.Optional;

/**
 * Intent of a rule or test. For rules, {@link #POSITIVE} means a valid word must match the
 * pattern and {@link #NEGATIVE} means it must not. For tests, {@link #POSITIVE} expects the word
 * to be valid and {@link #NEGATIVE} expects it to be invalid.
 */
public enum Intent {
    POSITIVE('+'),
    NEGATIVE('!');

    private final char symbol;

    Intent(char symbol) {
        this.symbol = symbol;
    }

    /** The rule-file symbol for this intent ({@code +} or {@code !}). */
    public char symbol() {
        return symbol;
    }

    /** Resolves a rule-file symbol, or empty if it is neither {@code +} nor {@code !}. */
    public static Optional<Intent> fromSymbol(char symbol) {
        for (Intent intent : values()) {
            if (intent.symbol == symbol) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
