package org.ippcode.compiler.frontend.semantics;

import org.ippcode.compiler.api.Frame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link DeclaredVariables}.
 */
public class DeclaredVariablesTest {

    @Test
    @Tag("unit")
    void testFramesAreSeparateNamespaces() {
        DeclaredVariables declared = new DeclaredVariables();
        declared.declare(Frame.GF, "x");

        assertThat(declared.isDeclared(Frame.GF, "x")).isTrue();
        assertThat(declared.isDeclared(Frame.LF, "x")).isFalse();

        declared.declare(Frame.LF, "x");
        assertThat(declared.isDeclared(Frame.LF, "x")).isTrue();
        assertThat(declared.globals()).containsExactly("x");
        assertThat(declared.locals()).containsExactly("x");
    }

    /**
     * Verifies that a temporary frame declaration is visible through LF, as after PUSHFRAME.
     */
    @Test
    @Tag("unit")
    void testTemporaryDeclarationsAreVisibleAsLocals() {
        DeclaredVariables declared = new DeclaredVariables();
        declared.declare(Frame.TF, "arg");

        assertThat(declared.isDeclared(Frame.LF, "arg")).isTrue();
        assertThat(declared.isDeclared(Frame.GF, "arg")).isFalse();
    }

    @Test
    @Tag("unit")
    void testTemporaryReferencesAreAlwaysAccepted() {
        assertThat(new DeclaredVariables().isDeclared(Frame.TF, "whatever")).isTrue();
    }

    @Test
    @Tag("unit")
    void testRedeclarationIsAcceptedAndReported() {
        DeclaredVariables declared = new DeclaredVariables();

        assertThat(declared.declare(Frame.GF, "x")).isTrue();
        assertThat(declared.declare(Frame.GF, "x")).isFalse();
        assertThat(declared.isDeclared(Frame.GF, "x")).isTrue();
    }

    @Test
    @Tag("unit")
    void testNamesAreCaseSensitive() {
        DeclaredVariables declared = new DeclaredVariables();
        declared.declare(Frame.GF, "Count");

        assertThat(declared.isDeclared(Frame.GF, "count")).isFalse();
    }
}
