package io.phonorules.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.phonorules.core.error.CyclicClassReferenceException;
import io.phonorules.core.error.UndefinedClassException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ClassResolver}: nested expansion, order independence and cycle detection. */
@DisplayName("ClassResolver")
class ClassResolverTest {

    private static Map<String, String> ordered(String... nameTemplatePairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < nameTemplatePairs.length; i += 2) {
            map.put(nameTemplatePairs[i], nameTemplatePairs[i + 1]);
        }
        return map;
    }

    @Test
    @DisplayName("expands nested references regardless of declaration order")
    void nestedExpansion() {
        Map<String, String> resolved =
                ClassResolver.resolve(
                        ordered("S", "<C><V>", "C", "[<P><N>]", "P", "ptk", "N", "mn", "V", "[aiu]"), null);

        assertThat(resolved)
                .containsEntry("S", "[ptkmn][aiu]")
                .containsEntry("C", "[ptkmn]")
                .containsEntry("P", "ptk");
        assertThat(resolved.keySet()).containsExactly("S", "C", "P", "N", "V");
    }

    @Test
    @DisplayName("declaration order does not change the result")
    void orderIndependent() {
        Map<String, String> forward = ClassResolver.resolve(ordered("A", "x<B>", "B", "y<C>", "C", "z"), null);
        Map<String, String> backward = ClassResolver.resolve(ordered("C", "z", "B", "y<C>", "A", "x<B>"), null);

        assertThat(forward).isEqualTo(backward);
        assertThat(ClassResolver.resolve(ordered("A", "x<B>", "B", "y<C>", "C", "z"), null))
                .isEqualTo(forward);
    }

    @Test
    @DisplayName("named groups and back-references in templates are not references")
    void nativeSyntaxInTemplate() {
        Map<String, String> resolved = ClassResolver.resolve(ordered("D", "(?<x>.)\\k<x>"), null);

        assertThat(resolved).containsEntry("D", "(?<x>.)\\k<x>");
    }

    @Test
    @DisplayName("a two-class cycle fails with both names")
    void twoClassCycle() {
        assertThatThrownBy(() -> ClassResolver.resolve(ordered("A", "<B>", "B", "<A>"), "cyc.phono"))
                .isInstanceOf(CyclicClassReferenceException.class)
                .satisfies(e -> {
                    CyclicClassReferenceException ex = (CyclicClassReferenceException) e;
                    assertThat(ex.names()).containsExactlyInAnyOrder("A", "B");
                    assertThat(ex.source()).isEqualTo("cyc.phono");
                    assertThat(ex.line()).isNull();
                });
    }

    @Test
    @DisplayName("self-reference is a cycle")
    void selfReference() {
        assertThatThrownBy(() -> ClassResolver.resolve(ordered("A", "a<A>"), null))
                .isInstanceOf(CyclicClassReferenceException.class)
                .satisfies(e -> assertThat(((CyclicClassReferenceException) e).names()).containsExactly("A"));
    }

    @Test
    @DisplayName("only classes on the cycle are reported")
    void cycleMembersOnly() {
        assertThatThrownBy(() -> ClassResolver.resolve(ordered("A", "<B>", "B", "<C>", "C", "<B>"), null))
                .isInstanceOf(CyclicClassReferenceException.class)
                .satisfies(e -> assertThat(((CyclicClassReferenceException) e).names())
                        .containsExactlyInAnyOrder("B", "C"));
    }

    @Test
    @DisplayName("an undefined reference names the class and the referencing class")
    void undefinedReference() {
        assertThatThrownBy(() -> ClassResolver.resolve(ordered("A", "<Q>"), null))
                .isInstanceOf(UndefinedClassException.class)
                .hasMessageContaining("'Q'")
                .satisfies(e -> {
                    UndefinedClassException ex = (UndefinedClassException) e;
                    assertThat(ex.name()).isEqualTo("Q");
                    assertThat(ex.referencedIn()).isEqualTo("class 'A'");
                });
    }
}
