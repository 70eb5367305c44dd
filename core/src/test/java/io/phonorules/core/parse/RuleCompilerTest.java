package io.phonorules.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.phonorules.core.engine.regex.JdkRegexEngine;
import io.phonorules.core.error.PatternCompileException;
import io.phonorules.core.error.UndefinedClassException;
import io.phonorules.core.model.Intent;
import io.phonorules.core.model.Reason;
import io.phonorules.core.model.Rule;
import io.phonorules.core.spi.CompiledPattern;
import io.phonorules.core.spi.PatternEngine;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link RuleCompiler}: expansion before compilation and error context. */
@DisplayName("RuleCompiler")
class RuleCompilerTest {

    private final RuleCompiler compiler = new RuleCompiler(new JdkRegexEngine());

    @Test
    @DisplayName("expands classes and keeps the declared source")
    void expandsClasses() {
        Reason reason = new Reason("syllable shape", false);
        Rule rule = compiler.compile(Intent.POSITIVE, "^<C><V>$", Map.of("C", "[ptk]", "V", "[aiu]"), reason, null, 7);

        assertThat(rule.source()).isEqualTo("^<C><V>$");
        assertThat(rule.pattern()).isEqualTo("^[ptk][aiu]$");
        assertThat(rule.intent()).isEqualTo(Intent.POSITIVE);
        assertThat(rule.reason()).isSameAs(reason);
        assertThat(rule.line()).isEqualTo(7);
        assertThat(rule.isViolatedBy("pa")).isFalse();
        assertThat(rule.isViolatedBy("ap")).isTrue();
    }

    @Test
    @DisplayName("named groups and back-references compile unchanged")
    void namedGroupsUnchanged() {
        Rule rule = compiler.compile(Intent.NEGATIVE, "(?<x>.)\\k<x>", Map.of("x", "SHOULD-NOT-APPEAR"), null, null, 1);

        assertThat(rule.pattern()).isEqualTo("(?<x>.)\\k<x>");
        assertThat(rule.compiled().matches("abba")).isTrue();
        assertThat(rule.compiled().matches("abab")).isFalse();
    }

    @Test
    @DisplayName("hands the fully expanded text to the engine")
    void delegatesToEngine() {
        PatternEngine engine = mock(PatternEngine.class);
        CompiledPattern compiled = mock(CompiledPattern.class);
        when(engine.compile(anyString())).thenReturn(compiled);

        Rule rule = new RuleCompiler(engine).compile(Intent.NEGATIVE, "<V><V>", Map.of("V", "[ae]"), null, null, 1);

        verify(engine).compile("[ae][ae]");
        assertThat(rule.compiled()).isSameAs(compiled);
    }

    @Test
    @DisplayName("an undefined class names the rule's line")
    void undefinedClass() {
        assertThatThrownBy(() -> compiler.compile(Intent.POSITIVE, "<Z>", Map.of(), null, "f.phono", 4))
                .isInstanceOf(UndefinedClassException.class)
                .satisfies(e -> {
                    UndefinedClassException ex = (UndefinedClassException) e;
                    assertThat(ex.name()).isEqualTo("Z");
                    assertThat(ex.referencedIn()).isEqualTo("rule on line 4");
                    assertThat(ex.line()).isEqualTo(4);
                    assertThat(ex.source()).isEqualTo("f.phono");
                });
    }

    @Test
    @DisplayName("an invalid pattern is re-thrown with line and source")
    void invalidPattern() {
        assertThatThrownBy(() -> compiler.compile(Intent.POSITIVE, "<V>(", Map.of("V", "a"), null, "f.phono", 9))
                .isInstanceOf(PatternCompileException.class)
                .hasMessageContaining("line 9")
                .satisfies(e -> {
                    PatternCompileException ex = (PatternCompileException) e;
                    assertThat(ex.pattern()).isEqualTo("a(");
                    assertThat(ex.underlyingMessage()).isNotBlank();
                    assertThat(ex.line()).isEqualTo(9);
                    assertThat(ex.source()).isEqualTo("f.phono");
                });
    }
}
