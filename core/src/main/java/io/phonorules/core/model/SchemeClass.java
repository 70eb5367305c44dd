package io.phonorules.core.model;

import java.util.Objects;

/**
 * A named pattern fragment.
 *
 * @param name     identifier referenced as {@code <name>}; {@code _} designates the alphabet
 * @param template the declared text, possibly containing class references
 * @param pattern  the template with every reference expanded
 * @param line     1-based declaration line
 */
public record SchemeClass(String name, String template, String pattern, int line) {

    /** Name of the class whose characters seed word generation. */
    public static final String ALPHABET_NAME = "_";

    public SchemeClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    public boolean isAlphabet() {
        return ALPHABET_NAME.equals(name);
    }
}
