package io.phonorules.cli.config;

import io.phonorules.cli.render.DisplayLevel;
import io.phonorules.core.engine.GeneratorOptions;
import java.util.Objects;

/**
 * Settings for one command-line run, merged from defaults, the YAML file, environment variables
 * and command-line flags (in increasing precedence).
 *
 * <p>
 * Generation settings are checked on construction: lengths are at least 1 with
 * {@code minLength <= maxLength}, at least one attempt per word, and a non-negative time limit.
 *
 * @param display       which test results and notes are printed
 * @param color         whether output uses ANSI colours
 * @param minLength     shortest generated word
 * @param maxLength     longest generated word
 * @param maxAttempts   candidates tried per generated word
 * @param maxMillis     time limit per generated word in ms, {@code 0} for none
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record CliConfig(
        DisplayLevel display,
        boolean color,
        int minLength,
        int maxLength,
        int maxAttempts,
        long maxMillis,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(display, "display must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1, got: " + minLength);
        }
        if (minLength > maxLength) {
            throw new IllegalArgumentException(
                    "minLength must not exceed maxLength: " + minLength + " > " + maxLength);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        if (maxMillis < 0) {
            throw new IllegalArgumentException("maxMillis must not be negative, got: " + maxMillis);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder initialised with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .display(display)
                .color(color)
                .minLength(minLength)
                .maxLength(maxLength)
                .maxAttempts(maxAttempts)
                .maxMillis(maxMillis)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    /** The generator budget described by this configuration. */
    public GeneratorOptions generatorOptions() {
        return new GeneratorOptions(maxAttempts, maxMillis);
    }

    /** Builder for {@link CliConfig}; every field has a default. */
    public static final class Builder {
        private DisplayLevel display = DisplayLevel.SHOW_ALL;
        private boolean color = true;
        private int minLength = 3;
        private int maxLength = 8;
        private int maxAttempts = GeneratorOptions.DEFAULT.maxAttemptsPerWord();
        private long maxMillis = GeneratorOptions.DEFAULT.maxMillisPerWord();
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder display(DisplayLevel display) {
            this.display = display;
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxMillis(long maxMillis) {
            this.maxMillis = maxMillis;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    display, color, minLength, maxLength, maxAttempts, maxMillis, loggingFormat, loggingLevel);
        }
    }
}
