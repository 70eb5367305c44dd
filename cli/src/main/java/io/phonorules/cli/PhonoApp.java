package io.phonorules.cli;

import io.phonorules.cli.config.CliConfig;
import io.phonorules.cli.config.ConfigLoadException;
import io.phonorules.cli.config.ConfigLoader;
import io.phonorules.cli.render.ResultRenderer;
import io.phonorules.core.engine.PhonoEngine;
import io.phonorules.core.engine.TestReport;
import io.phonorules.core.engine.regex.JdkRegexEngine;
import io.phonorules.core.error.GenerationExhaustedException;
import io.phonorules.core.error.PhonoException;
import io.phonorules.core.error.SchemeLoadException;
import io.phonorules.core.error.SchemeParseException;
import io.phonorules.core.error.SchemeReadException;
import io.phonorules.core.model.Scheme;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code phono} command: loads configuration and a rule file, then runs and prints its tests,
 * generates words, or writes a minified copy.
 *
 * <p>
 * Startup sequence:
 * <ol>
 *   <li>Parse arguments (usage errors exit with {@value #EXIT_USAGE})
 *   <li>Resolve configuration: {@code --config}, else {@code phono.yaml}, else defaults; then
 *       environment and command-line overrides
 *   <li>Configure logging
 *   <li>Load the rule file
 *   <li>Minify if {@code --minify} is given, generate if {@code --generate} is given, otherwise
 *       run the tests
 * </ol>
 *
 * <p>
 * Failing tests are reported, not signalled: the exit code is {@value #EXIT_OK} as long as the
 * file loads.
 */
public final class PhonoApp {

    private static final Logger LOG = LoggerFactory.getLogger(PhonoApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final Function<String, String> envLookup;
    private final Path workingDir;

    /**
     * @param envLookup  environment variable lookup
     * @param workingDir directory against which relative paths and {@code phono.yaml} resolve
     */
    public PhonoApp(Function<String, String> envLookup, Path workingDir) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir must not be null");
    }

    /** Runs the command and returns the process exit code. */
    public int run(String[] args, PrintStream out, PrintStream err) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help()) {
            out.print(CliArguments.USAGE);
            return EXIT_OK;
        }

        try {
            CliConfig config = arguments.applyTo(loadConfig(arguments));
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            return execute(arguments, config, out);
        } catch (ConfigLoadException | PhonoException | IOException e) {
            LOG.debug("Command failed", e);
            err.println("Error: " + diagnostic(e));
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * The message of {@code e}, prefixed with {@code source:line:} for load errors tied to a rule
     * file and followed by the offending statement for parse errors.
     */
    static String diagnostic(Exception e) {
        if (!(e instanceof SchemeLoadException load) || e instanceof SchemeReadException) {
            return e.getMessage();
        }
        StringBuilder message = new StringBuilder();
        if (load.source() != null) {
            message.append(load.source());
            if (load.line() != null) {
                message.append(':').append(load.line());
            }
            message.append(": ");
        }
        message.append(load.getMessage());
        if (load instanceof SchemeParseException parse && parse.statement() != null) {
            message.append(": ").append(parse.statement());
        }
        return message.toString();
    }

    private CliConfig loadConfig(CliArguments arguments) {
        Path explicit = arguments.configPath() != null ? workingDir.resolve(arguments.configPath()) : null;
        return ConfigLoader.resolve(explicit, workingDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), envLookup);
    }

    private int execute(CliArguments arguments, CliConfig config, PrintStream out) throws IOException {
        PhonoEngine engine = new PhonoEngine(new JdkRegexEngine(), config.generatorOptions());
        Scheme scheme = engine.load(workingDir.resolve(arguments.file()));

        if (arguments.minifying()) {
            Path target = workingDir.resolve(arguments.minifyOut());
            Files.writeString(target, engine.minify(scheme, arguments.minifyTests()), StandardCharsets.UTF_8);
            LOG.info("Minified rule file written to {}", target);
        }
        if (arguments.generating()) {
            generate(engine, scheme, arguments.generateCount(), config, out);
        } else if (!arguments.minifying()) {
            TestReport report = engine.run(scheme);
            out.print(new ResultRenderer(config.display(), config.color()).render(report));
        }
        return EXIT_OK;
    }

    private static void generate(PhonoEngine engine, Scheme scheme, int count, CliConfig config, PrintStream out) {
        List<String> words;
        try {
            words = engine.generate(scheme, count, config.minLength(), config.maxLength());
        } catch (GenerationExhaustedException e) {
            e.acceptedWords().forEach(out::println);
            throw e;
        }
        words.forEach(out::println);
    }
}
