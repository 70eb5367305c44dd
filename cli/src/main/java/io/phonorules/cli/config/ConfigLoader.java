package io.phonorules.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.phonorules.cli.render.DisplayLevel;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML keys map to {@link CliConfig} fields; missing keys keep the defaults of
 * {@link CliConfig.Builder}. Environment variables take precedence over YAML values. A variable
 * counts as set only if it is defined and non-blank after trimming.
 *
 * <pre>
 * display: show-all        PHONO_DISPLAY
 * color: true              PHONO_COLOR
 * generate:
 *   min-length: 3          PHONO_GENERATE_MIN_LENGTH
 *   max-length: 8          PHONO_GENERATE_MAX_LENGTH
 *   max-attempts: 100000   PHONO_GENERATE_MAX_ATTEMPTS
 *   max-millis: 0          PHONO_GENERATE_MAX_MILLIS
 * logging:
 *   format: text           LOG_FORMAT
 *   level: WARN            LOG_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    /** Looked up in the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "phono.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@code envLookup}.
     *
     * @param configPath path to the YAML file
     * @param envLookup  environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException(
                    "Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults with environment overrides applied, for runs without a configuration file. */
    public static CliConfig defaults(Function<String, String> envLookup) {
        try {
            return mapToConfig(MissingNode.getInstance(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid environment configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Picks the configuration source: the explicit path if given (it must exist), else the
     * default file if present, else defaults.
     *
     * @param explicitPath path from {@code --config}, may be {@code null}
     * @param defaultPath  location of {@value #DEFAULT_CONFIG_FILE}
     * @param envLookup    environment variable lookup
     */
    public static CliConfig resolve(Path explicitPath, Path defaultPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return defaults(envLookup);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        if (!root.isMissingNode() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping");
        }
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        if (root.has("display")) builder.display(displayLevel(root.get("display").asText()));
        if (root.has("color")) builder.color(root.get("color").asBoolean());

        JsonNode generate = root.path("generate");
        if (generate.has("min-length")) builder.minLength(generate.get("min-length").asInt());
        if (generate.has("max-length")) builder.maxLength(generate.get("max-length").asInt());
        if (generate.has("max-attempts")) builder.maxAttempts(generate.get("max-attempts").asInt());
        if (generate.has("max-millis")) builder.maxMillis(generate.get("max-millis").asLong());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "PHONO_DISPLAY", value -> builder.display(displayLevel(value)));
        envBool(envLookup, "PHONO_COLOR", builder::color);
        envInt(envLookup, "PHONO_GENERATE_MIN_LENGTH", builder::minLength);
        envInt(envLookup, "PHONO_GENERATE_MAX_LENGTH", builder::maxLength);
        envInt(envLookup, "PHONO_GENERATE_MAX_ATTEMPTS", builder::maxAttempts);
        envLong(envLookup, "PHONO_GENERATE_MAX_MILLIS", builder::maxMillis);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static DisplayLevel displayLevel(String id) {
        try {
            return DisplayLevel.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Long.parseLong(envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
