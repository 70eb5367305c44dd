package io.phonorules.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.phonorules.cli.render.DisplayLevel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ConfigLoader} YAML parsing, defaults and source resolution. */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("Full config → every field populated")
        void fullConfig() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.display()).isEqualTo(DisplayLevel.JUST_FAILS);
            assertThat(config.color()).isFalse();
            assertThat(config.minLength()).isEqualTo(2);
            assertThat(config.maxLength()).isEqualTo(5);
            assertThat(config.maxAttempts()).isEqualTo(5000);
            assertThat(config.maxMillis()).isEqualTo(250);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.generatorOptions().hasTimeLimit()).isTrue();
        }

        @Test
        @DisplayName("Partial config → missing keys keep their defaults")
        void partialConfig() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("partial-config.yaml"), NO_ENV::get);

            assertThat(config.display()).isEqualTo(DisplayLevel.NOTES_AND_FAILS);
            assertThat(config.maxLength()).isEqualTo(12);
            assertThat(config.color()).isTrue();
            assertThat(config.minLength()).isEqualTo(3);
            assertThat(config.maxAttempts()).isEqualTo(100_000);
            assertThat(config.maxMillis()).isZero();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("Empty file → defaults")
        void emptyFile(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("phono.yaml"), "");

            assertThat(ConfigLoader.load(empty, NO_ENV::get)).isEqualTo(CliConfig.builder().build());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing file → ConfigLoadException naming the path")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        @DisplayName("Malformed YAML → ConfigLoadException with the parser error as cause")
        void invalidYaml() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(java.io.IOException.class);
        }

        @Test
        @DisplayName("Unknown display level → ConfigLoadException listing the valid ones")
        void badDisplay() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("bad-display.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Unknown display level 'everything'")
                    .hasMessageContaining("show-all, notes-and-fails, just-fails, hide-all");
        }

        @Test
        @DisplayName("Zero max-attempts → ConfigLoadException at load time")
        void zeroAttempts(@TempDir Path dir) throws Exception {
            Path config = Files.writeString(dir.resolve("phono.yaml"), "generate:\n  max-attempts: 0\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("maxAttempts must be positive, got: 0")
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Zero min-length → ConfigLoadException at load time")
        void zeroMinLength(@TempDir Path dir) throws Exception {
            Path config = Files.writeString(dir.resolve("phono.yaml"), "generate:\n  min-length: 0\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("minLength must be at least 1, got: 0");
        }

        @Test
        @DisplayName("Negative max-millis → ConfigLoadException at load time")
        void negativeMillis(@TempDir Path dir) throws Exception {
            Path config = Files.writeString(dir.resolve("phono.yaml"), "generate:\n  max-millis: -5\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("maxMillis must not be negative, got: -5");
        }

        @Test
        @DisplayName("A scalar document is rejected")
        void scalarRoot(@TempDir Path dir) throws Exception {
            Path scalar = Files.writeString(dir.resolve("phono.yaml"), "just text\n");

            assertThatThrownBy(() -> ConfigLoader.load(scalar, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration root must be a mapping");
        }
    }

    @Nested
    @DisplayName("Source resolution")
    class Resolution {

        @TempDir
        Path dir;

        @Test
        @DisplayName("No --config and no default file → defaults")
        void defaults() {
            CliConfig config = ConfigLoader.resolve(null, dir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), NO_ENV::get);

            assertThat(config).isEqualTo(CliConfig.builder().build());
        }

        @Test
        @DisplayName("Default file present → loaded")
        void defaultFile() throws Exception {
            Path defaultFile = Files.writeString(dir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), "color: false\n");

            assertThat(ConfigLoader.resolve(null, defaultFile, NO_ENV::get).color()).isFalse();
        }

        @Test
        @DisplayName("Explicit --config wins over the default file")
        void explicitWins() throws Exception {
            Path defaultFile = Files.writeString(dir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), "color: false\n");
            Path explicit = Files.writeString(dir.resolve("other.yaml"), "display: hide-all\n");

            CliConfig config = ConfigLoader.resolve(explicit, defaultFile, NO_ENV::get);

            assertThat(config.display()).isEqualTo(DisplayLevel.HIDE_ALL);
            assertThat(config.color()).isTrue();
        }

        @Test
        @DisplayName("Explicit --config that does not exist → error, not defaults")
        void explicitMissing() {
            assertThatThrownBy(() -> ConfigLoader.resolve(
                            dir.resolve("missing.yaml"), dir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class);
        }
    }
}
