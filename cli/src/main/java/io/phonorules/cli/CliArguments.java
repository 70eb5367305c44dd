package io.phonorules.cli;

import io.phonorules.cli.config.CliConfig;
import io.phonorules.cli.render.DisplayLevel;
import java.nio.file.Path;

/**
 * Parsed command line. Options left unset ({@code null}) fall back to the loaded
 * {@link CliConfig}.
 *
 * @param file          the rule file
 * @param display       display level override
 * @param noColor       disables ANSI colours
 * @param generateCount number of words to generate instead of running tests
 * @param minLength     generated word minimum length override
 * @param maxLength     generated word maximum length override
 * @param minifyOut     where to write the minified rule file
 * @param minifyTests   whether the minified file keeps tests and notes
 * @param configPath    explicit configuration file
 * @param help          whether usage was requested
 */
public record CliArguments(
        Path file,
        DisplayLevel display,
        boolean noColor,
        Integer generateCount,
        Integer minLength,
        Integer maxLength,
        Path minifyOut,
        boolean minifyTests,
        Path configPath,
        boolean help) {

    static final String USAGE = """
            Usage: phono <file> [options]

            Runs the tests in a phonotactic rule file.

            Options:
              --display LEVEL   show-all | notes-and-fails | just-fails | hide-all
              --no-color        plain output without ANSI colours
              --generate N      print N random valid words instead of running tests
              --min L           shortest generated word
              --max L           longest generated word
              --minify OUT      write the rule file in minified form to OUT
              --minify-tests    keep tests and notes in the minified file
              --config PATH     configuration file (default: phono.yaml)
              -h, --help        show this help
            """;

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on unknown options, missing or malformed values, or a
     *     missing rule file
     */
    public static CliArguments parse(String... args) {
        Path file = null;
        DisplayLevel display = null;
        boolean noColor = false;
        Integer generateCount = null;
        Integer minLength = null;
        Integer maxLength = null;
        Path minifyOut = null;
        boolean minifyTests = false;
        Path configPath = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    return new CliArguments(null, null, false, null, null, null, null, false, null, true);
                }
                case "--display" -> display = DisplayLevel.fromId(value(args, ++i, arg));
                case "--no-color" -> noColor = true;
                case "--generate" -> generateCount = positiveInt(value(args, ++i, arg), arg);
                case "--min" -> minLength = positiveInt(value(args, ++i, arg), arg);
                case "--max" -> maxLength = positiveInt(value(args, ++i, arg), arg);
                case "--minify" -> minifyOut = Path.of(value(args, ++i, arg));
                case "--minify-tests" -> minifyTests = true;
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (file != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    file = Path.of(arg);
                }
            }
        }

        if (file == null) {
            throw new IllegalArgumentException("Missing rule file");
        }
        if (minifyTests && minifyOut == null) {
            throw new IllegalArgumentException("--minify-tests requires --minify");
        }
        return new CliArguments(
                file, display, noColor, generateCount, minLength, maxLength, minifyOut, minifyTests, configPath, false);
    }

    /** Applies the command-line overrides on top of {@code config}. */
    public CliConfig applyTo(CliConfig config) {
        CliConfig.Builder builder = config.toBuilder();
        if (display != null) builder.display(display);
        if (noColor) builder.color(false);
        if (minLength != null) builder.minLength(minLength);
        if (maxLength != null) builder.maxLength(maxLength);
        return builder.build();
    }

    public boolean generating() {
        return generateCount != null;
    }

    public boolean minifying() {
        return minifyOut != null;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int positiveInt(String value, String option) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got: " + value, e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException(option + " must be at least 1, got: " + value);
        }
        return parsed;
    }
}
