package org.zerox.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;
import org.zerox.compiler.frontend.semantics.analysis.IValidationPass;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Contains unit tests for the {@link Validator}.
 */
@ExtendWith(MockitoExtension.class)
public class ValidatorTest {

    @Mock
    private IValidationPass first;

    @Mock
    private IValidationPass second;

    /**
     * Verifies that a well-formed page produces neither errors nor warnings.
     */
    @Test
    @Tag("unit")
    void cleanPageHasNoFindings() {
        // Arrange
        List<AstNode> ast = Parser.parse(String.join("\n",
                "page Test:",
                "  state count: int = 0",
                "  derived doubled = count * 2",
                "  fn inc():",
                "    count += 1"));

        // Act
        ValidationResult result = new Validator().validate(ast);

        // Assert
        assertThat(result.isClean()).isTrue();
        assertThat(result.hasErrors()).isFalse();
    }

    /**
     * Verifies that every container is handed to each pass in order and that other top-level
     * declarations are skipped.
     */
    @Test
    @Tag("unit")
    void runsEveryPassOnEveryContainer() {
        // Arrange
        List<AstNode> ast = Parser.parse(String.join("\n",
                "page Home:",
                "  state a: int = 0",
                "rtl",
                "component Card:",
                "  prop title: str"));

        // Act
        new Validator(List.of(first, second)).validate(ast);

        // Assert
        verify(first, times(2)).validate(any(ContainerNode.class), any(DiagnosticsEngine.class));
        verify(second, times(2)).validate(any(ContainerNode.class), any(DiagnosticsEngine.class));
        InOrder order = inOrder(first, second);
        order.verify(first).validate(argThat(container -> container.name().equals("Home")), any(DiagnosticsEngine.class));
        order.verify(second).validate(argThat(container -> container.name().equals("Home")), any(DiagnosticsEngine.class));
        order.verify(first).validate(argThat(container -> container.name().equals("Card")), any(DiagnosticsEngine.class));
    }

    /**
     * Verifies that findings carry the given source name and that errors and warnings are
     * separated.
     */
    @Test
    @Tag("unit")
    void separatesErrorsFromWarnings() {
        // Arrange
        List<AstNode> ast = Parser.parse(String.join("\n",
                "page Broken:",
                "  state unused: int = 0",
                "  derived loop = loop + 1"));

        // Act
        ValidationResult result = new Validator().validate(ast, "broken.0x");

        // Assert
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.message()).contains("Circular dependency");
            assertThat(error.sourceName()).isEqualTo("broken.0x");
        });
        assertThat(result.warnings()).singleElement().satisfies(warning ->
                assertThat(warning.message()).contains("'unused'"));
    }

    /**
     * Verifies that validation leaves the tree it was given untouched.
     */
    @Test
    @Tag("unit")
    void doesNotModifyTree() {
        // Arrange
        String source = String.join("\n",
                "page Test:",
                "  state x: int = 0",
                "  state x: int = 1");
        List<AstNode> ast = Parser.parse(source);

        // Act
        new Validator().validate(ast);

        // Assert
        assertThat(ast).usingRecursiveComparison().isEqualTo(Parser.parse(source));
    }
}
