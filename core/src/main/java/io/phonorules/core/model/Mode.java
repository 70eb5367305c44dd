package io.phonorules.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Transcription mode of the words in a scheme. Informational only.
 *
 * @param kind  transcription kind, chosen by the delimiter pair
 * @param label free-text label between the delimiters
 */
public record Mode(Kind kind, String label) {

    public enum Kind {
        /** {@code <label>}: orthographic or romanized spelling. */
        ROMANIZED('<', '>'),
        /** {@code /label/}: broad (phonemic) transcription. */
        BROAD('/', '/'),
        /** {@code [label]}: narrow (phonetic) transcription. */
        NARROW('[', ']');

        private final char open;
        private final char close;

        Kind(char open, char close) {
            this.open = open;
            this.close = close;
        }

        public char open() {
            return open;
        }

        public char close() {
            return close;
        }

        /** Resolves the kind whose delimiters are {@code open}/{@code close}. */
        public static Optional<Kind> fromDelimiters(char open, char close) {
            for (Kind kind : values()) {
                if (kind.open == open && kind.close == close) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    public Mode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }

    /** The label wrapped in its delimiters, e.g. {@code /phonemic/}. */
    public String delimited() {
        return kind.open() + label + kind.close();
    }
}
