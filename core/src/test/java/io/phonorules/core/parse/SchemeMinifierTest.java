package io.phonorules.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.phonorules.core.engine.regex.JdkRegexEngine;
import io.phonorules.core.model.Note;
import io.phonorules.core.model.Rule;
import io.phonorules.core.model.Scheme;
import io.phonorules.core.model.SchemeClass;
import io.phonorules.core.model.TestCase;
import io.phonorules.core.model.TestItem;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SchemeMinifier}. The essential property is that parsing the minified text
 * yields an equivalent scheme.
 */
@DisplayName("SchemeMinifier")
class SchemeMinifierTest {

    private final SchemeParser parser = new SchemeParser(new RuleCompiler(new JdkRegexEngine()));

    private static String fixture(String name) throws IOException {
        try (InputStream in = SchemeMinifierTest.class.getResourceAsStream("/schemes/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static List<Tuple> items(Scheme scheme) {
        return scheme.items().stream().map(SchemeMinifierTest::item).toList();
    }

    private static Tuple item(TestItem item) {
        if (item instanceof TestCase test) {
            return tuple("test", test.intent(), test.words(), test.rulesBefore());
        }
        Note note = (Note) item;
        return tuple("note", note.text(), note.fromReason(), note.rulesBefore());
    }

    private static void assertEquivalent(Scheme actual, Scheme expected) {
        assertThat(actual.mode()).isEqualTo(expected.mode());
        assertThat(actual.classes().values())
                .extracting(SchemeClass::name, SchemeClass::template, SchemeClass::pattern)
                .containsExactlyElementsOf(expected.classes().values().stream()
                        .map(c -> tuple(c.name(), c.template(), c.pattern()))
                        .toList());
        assertThat(actual.rules())
                .extracting(Rule::intent, Rule::source, Rule::pattern, Rule::reason)
                .containsExactlyElementsOf(expected.rules().stream()
                        .map(r -> tuple(r.intent(), r.source(), r.pattern(), r.reason()))
                        .toList());
        assertThat(actual.alphabet()).isEqualTo(expected.alphabet());
    }

    @Test
    @DisplayName("round-trips a full rule file with tests and notes")
    void roundTripWithTests() throws IOException {
        Scheme source = parser.parse(fixture("tokipona.phono"));

        String minified = SchemeMinifier.minify(source, true);
        Scheme reparsed = parser.parse(minified);

        assertThat(minified).doesNotContain("\n").doesNotContain("#");
        assertEquivalent(reparsed, source);
        assertThat(items(reparsed)).containsExactlyElementsOf(items(source));
    }

    @Test
    @DisplayName("round-trips without tests, keeping rules and reasons")
    void roundTripWithoutTests() throws IOException {
        Scheme source = parser.parse(fixture("tokipona.phono"));

        String minified = SchemeMinifier.minify(source, false);
        Scheme reparsed = parser.parse(minified);

        assertEquivalent(reparsed, source);
        assertThat(reparsed.tests()).isEmpty();
        assertThat(minified).doesNotContain("?+").doesNotContain("?!");
    }

    @Test
    @DisplayName("writes statements in mode, class, rule order with reasons before their rules")
    void layout() {
        Scheme scheme = parser.parse("$V=[ae]\n~<latin>\n?+a\n@vowels only\n+^<V>+$\n*done");

        assertThat(SchemeMinifier.minify(scheme, true)).isEqualTo("~<latin>;$V=[ae];?+a;@vowels only;+^<V>+$;*done");
    }

    @Test
    @DisplayName("note reasons are written once")
    void noteReasonNotDuplicated() {
        Scheme scheme = parser.parse("@*Clusters\n!pp\n?!app");

        String minified = SchemeMinifier.minify(scheme, true);

        assertThat(minified).isEqualTo("@*Clusters;!pp;?!app");
        assertThat(parser.parse(minified).notes()).hasSize(1);
    }

    @Test
    @DisplayName("a plain reason starting with '*' stays plain")
    void starReason() {
        Scheme scheme = parser.parse("@ *starred\n+a");

        Scheme reparsed = parser.parse(SchemeMinifier.minify(scheme, true));

        assertThat(reparsed.rules().get(0).reason()).isEqualTo(scheme.rules().get(0).reason());
        assertThat(reparsed.rules().get(0).reason().note()).isFalse();
    }

    @Test
    @DisplayName("an empty scheme minifies to an empty string")
    void empty() {
        assertThat(SchemeMinifier.minify(parser.parse("# nothing"), true)).isEmpty();
    }
}
