package org.zerox.compiler.frontend.semantics.analysis;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.diagnostics.Diagnostic;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the individual validation passes.
 * Each test parses a single page and runs one pass over it.
 */
public class ValidationPassesTest {

    private static DiagnosticsEngine run(IValidationPass pass, String... lines) {
        ContainerNode page = (ContainerNode) Parser.parse(String.join("\n", lines)).get(0);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.0x");
        pass.validate(page, diagnostics);
        return diagnostics;
    }

    /**
     * Verifies that a repeated state name is reported once, at the second declaration, naming
     * the first.
     */
    @Test
    @Tag("unit")
    void duplicateStateIsReportedAtSecondDeclaration() {
        // Act
        DiagnosticsEngine diagnostics = run(new DuplicateDeclarationPass(),
                "page P:",
                "  state x: int = 0",
                "  state x: int = 1");

        // Assert
        assertThat(diagnostics.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
            assertThat(error.message()).contains("'x'").contains("previously declared as state at line 2");
            assertThat(error.line()).isEqualTo(3);
            assertThat(error.type()).isEqualTo(Diagnostic.Type.ERROR);
        });
    }

    /**
     * Verifies that states, derived values, props and functions share one namespace.
     */
    @Test
    @Tag("unit")
    void declarationKindsShareNamespace() {
        // Act
        DiagnosticsEngine diagnostics = run(new DuplicateDeclarationPass(),
                "page P:",
                "  prop total: int",
                "  derived total = 1",
                "  fn total():",
                "    return 2");

        // Assert
        assertThat(diagnostics.getErrors()).extracting(Diagnostic::line).containsExactly(3, 4);
        assertThat(diagnostics.getErrors().get(0).message()).contains("(derived)").contains("as prop");
    }

    /**
     * Verifies that two derived values referring to each other form one reported cycle.
     */
    @Test
    @Tag("unit")
    void mutualDerivedCycle() {
        // Act
        DiagnosticsEngine diagnostics = run(new CircularDerivedPass(),
                "page P:",
                "  derived a = b + 1",
                "  derived b = a * 2");

        // Assert
        assertThat(diagnostics.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(CompilerErrorCode.CIRCULAR_DERIVED);
            assertThat(error.message()).isEqualTo("Circular dependency detected in derived 'a'");
            assertThat(error.line()).isEqualTo(2);
        });
    }

    /**
     * Verifies that a derived value referring to itself is a cycle.
     */
    @Test
    @Tag("unit")
    void selfReferenceIsCycle() {
        DiagnosticsEngine diagnostics = run(new CircularDerivedPass(),
                "page P:",
                "  derived a = a + 1");

        assertThat(diagnostics.getErrors()).hasSize(1);
    }

    /**
     * Verifies that a forward reference without a cycle is accepted.
     */
    @Test
    @Tag("unit")
    void acyclicForwardReference() {
        DiagnosticsEngine diagnostics = run(new CircularDerivedPass(),
                "page P:",
                "  derived a = b * 2",
                "  derived b = 1");

        assertThat(diagnostics.getErrors()).isEmpty();
    }

    /**
     * Verifies that a state nothing reads is reported as a warning naming the state.
     */
    @Test
    @Tag("unit")
    void unusedStateWarns() {
        // Act
        DiagnosticsEngine diagnostics = run(new UnusedStatePass(),
                "page P:",
                "  state count: int = 0");

        // Assert
        assertThat(diagnostics.getErrors()).isEmpty();
        assertThat(diagnostics.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.code()).isEqualTo(CompilerErrorCode.UNUSED_STATE);
            assertThat(warning.message()).contains("'count'");
            assertThat(warning.type()).isEqualTo(Diagnostic.Type.WARNING);
        });
    }

    /**
     * Verifies that reads from expressions, function bodies and input bindings all count as uses.
     */
    @Test
    @Tag("unit")
    void referencedStatesAreUsed() {
        // Act
        DiagnosticsEngine diagnostics = run(new UnusedStatePass(),
                "page P:",
                "  state count: int = 0",
                "  state email: str = \"\"",
                "  state step: int = 1",
                "  derived doubled = count * 2",
                "  fn next():",
                "    step += 1",
                "  input email");

        // Assert
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    /**
     * Verifies that a state referenced only by another state's initializer is still unused.
     */
    @Test
    @Tag("unit")
    void stateInitializersDoNotCountAsUse() {
        DiagnosticsEngine diagnostics = run(new UnusedStatePass(),
                "page P:",
                "  state a: int = 0",
                "  state b: int = a",
                "  derived c = b");

        assertThat(diagnostics.getWarnings()).extracting(Diagnostic::message)
                .singleElement().asString().contains("'a'");
    }
}
