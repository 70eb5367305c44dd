package io.phonorules.core.engine;

import io.phonorules.core.engine.regex.JdkRegexEngine;
import io.phonorules.core.error.SchemeReadException;
import io.phonorules.core.model.Scheme;
import io.phonorules.core.parse.RuleCompiler;
import io.phonorules.core.parse.SchemeMinifier;
import io.phonorules.core.parse.SchemeParser;
import io.phonorules.core.spi.PatternEngine;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the core: parses rule sources into {@link Scheme}s, runs their tests, generates
 * words and writes minified rule text.
 *
 * <p>
 * Schemes are immutable, so parsing once and testing or generating many times is safe. The
 * engine itself is thread-safe; each {@link #generate} call uses its own {@link WordGenerator}
 * with a random source split from the engine's.
 */
public final class PhonoEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PhonoEngine.class);

    private final SchemeParser parser;
    private final TestRunner testRunner = new TestRunner();
    private final GeneratorOptions generatorOptions;
    private final SplittableRandom seedSource;

    /** Creates an engine on {@link JdkRegexEngine} with default generator options. */
    public PhonoEngine() {
        this(new JdkRegexEngine(), GeneratorOptions.DEFAULT);
    }

    public PhonoEngine(PatternEngine patternEngine, GeneratorOptions generatorOptions) {
        this(patternEngine, generatorOptions, new SplittableRandom());
    }

    /**
     * @param patternEngine    engine used to compile rule patterns
     * @param generatorOptions per-word search budget for {@link #generate}
     * @param seedSource       random source from which each generation call splits its own
     */
    public PhonoEngine(PatternEngine patternEngine, GeneratorOptions generatorOptions, SplittableRandom seedSource) {
        Objects.requireNonNull(patternEngine, "patternEngine must not be null");
        this.parser = new SchemeParser(new RuleCompiler(patternEngine));
        this.generatorOptions = Objects.requireNonNull(generatorOptions, "generatorOptions must not be null");
        this.seedSource = Objects.requireNonNull(seedSource, "seedSource must not be null");
    }

    /** Parses anonymous rule text. */
    public Scheme parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses rule text.
     *
     * @param text   the full rule-file text
     * @param source label for diagnostics, may be {@code null}
     * @throws io.phonorules.core.error.SchemeLoadException if the text does not load
     */
    public Scheme parse(String text, String source) {
        Scheme scheme = parser.parse(text, source);
        LOG.info(
                "Scheme loaded: source={}, classes={}, rules={}, tests={}, notes={}, alphabet={}",
                source != null ? source : "<text>",
                scheme.classes().size(),
                scheme.rules().size(),
                scheme.tests().size(),
                scheme.notes().size(),
                scheme.alphabet().map(a -> a.size() + " symbols").orElse("none"));
        return scheme;
    }

    /**
     * Reads and parses a rule file (UTF-8).
     *
     * @throws SchemeReadException if the file cannot be read
     */
    public Scheme load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemeReadException("Failed to read rule file: " + source, e, source);
        }
        return parse(text, source);
    }

    /** Runs the scheme's tests. */
    public TestReport run(Scheme scheme) {
        return testRunner.run(scheme);
    }

    /**
     * Generates {@code count} valid words with lengths in {@code [minLength, maxLength]}.
     *
     * @see WordGenerator#generate(Scheme, int, int, int)
     */
    public List<String> generate(Scheme scheme, int count, int minLength, int maxLength) {
        RandomGenerator random;
        synchronized (seedSource) {
            random = seedSource.split();
        }
        return new WordGenerator(generatorOptions, random).generate(scheme, count, minLength, maxLength);
    }

    /** Minified rule text for {@code scheme}. */
    public String minify(Scheme scheme, boolean includeTests) {
        return SchemeMinifier.minify(scheme, includeTests);
    }

    public GeneratorOptions generatorOptions() {
        return generatorOptions;
    }
}
