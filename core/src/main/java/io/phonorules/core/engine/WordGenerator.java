package io.phonorules.core.engine;

import io.phonorules.core.error.GenerationExhaustedException;
import io.phonorules.core.model.Alphabet;
import io.phonorules.core.model.Rule;
import io.phonorules.core.model.Scheme;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.function.LongSupplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates random words that satisfy every rule of a scheme.
 *
 * <p>
 * For each word a target length is drawn uniformly from {@code [min, max]}; candidates of that
 * length are then built by sampling each character uniformly from the scheme's {@link Alphabet}
 * and the first valid one is accepted. The search is a random restart, so restrictive rule sets
 * need many attempts at larger lengths. Each word is bounded by {@link GeneratorOptions}; when the
 * budget runs out the call fails with {@link GenerationExhaustedException}, which carries the
 * words already accepted.
 *
 * <p>
 * Not thread-safe: the random source is used without synchronisation. Use one generator per
 * thread, each with its own random source.
 */
public final class WordGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(WordGenerator.class);

    private final GeneratorOptions options;
    private final RandomGenerator random;
    private final LongSupplier clockMillis;

    public WordGenerator() {
        this(GeneratorOptions.DEFAULT, new SplittableRandom());
    }

    public WordGenerator(GeneratorOptions options, RandomGenerator random) {
        this(options, random, System::currentTimeMillis);
    }

    WordGenerator(GeneratorOptions options, RandomGenerator random, LongSupplier clockMillis) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clockMillis = Objects.requireNonNull(clockMillis, "clockMillis must not be null");
    }

    public GeneratorOptions options() {
        return options;
    }

    /**
     * Generates {@code count} valid words with lengths in {@code [minLength, maxLength]}.
     *
     * @return the words, in generation order; duplicates are possible
     * @throws IllegalArgumentException    if {@code count < 1}, {@code minLength < 1} or {@code
     *                                     minLength > maxLength}
     * @throws io.phonorules.core.error.NoAlphabetException if the scheme has no alphabet
     * @throws GenerationExhaustedException if one word could not be found within the budget
     */
    public List<String> generate(Scheme scheme, int count, int minLength, int maxLength) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        validateLengths(minLength, maxLength);
        Alphabet alphabet = scheme.requireAlphabet();

        List<String> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = minLength + random.nextInt(maxLength - minLength + 1);
            words.add(search(alphabet, scheme.rules(), length, words));
        }
        return words;
    }

    /**
     * Generates one valid word of exactly {@code length} characters.
     *
     * @throws GenerationExhaustedException if none was found within the budget
     */
    public String generateWord(Scheme scheme, int length) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        validateLengths(length, length);
        return search(scheme.requireAlphabet(), scheme.rules(), length, List.of());
    }

    private String search(Alphabet alphabet, List<Rule> rules, int length, List<String> accepted) {
        long deadline =
                options.hasTimeLimit() ? clockMillis.getAsLong() + options.maxMillisPerWord() : Long.MAX_VALUE;
        long attempts = 0;
        while (attempts < options.maxAttemptsPerWord()) {
            attempts++;
            String candidate = candidate(alphabet, length);
            if (Validator.isValid(candidate, rules)) {
                LOG.debug("Generated '{}' (length {}) after {} attempts", candidate, length, attempts);
                return candidate;
            }
            if (options.hasTimeLimit() && clockMillis.getAsLong() >= deadline) {
                LOG.warn("Time limit of {} ms reached for length {}", options.maxMillisPerWord(), length);
                break;
            }
        }
        LOG.warn("Gave up on a word of length {} after {} attempts", length, attempts);
        throw new GenerationExhaustedException(length, attempts, accepted);
    }

    private String candidate(Alphabet alphabet, int length) {
        List<String> symbols = alphabet.symbols();
        StringBuilder word = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            word.append(symbols.get(random.nextInt(symbols.size())));
        }
        return word.toString();
    }

    private static void validateLengths(int minLength, int maxLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1, got: " + minLength);
        }
        if (minLength > maxLength) {
            throw new IllegalArgumentException(
                    "minLength must not exceed maxLength: " + minLength + " > " + maxLength);
        }
    }
}
