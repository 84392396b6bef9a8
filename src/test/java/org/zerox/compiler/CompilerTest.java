package org.zerox.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.zerox.compiler.api.CompilationException;
import org.zerox.compiler.api.CompilationResult;
import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.diagnostics.Diagnostic;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.features.container.PageNode;
import org.zerox.compiler.frontend.semantics.Validator;
import org.zerox.junit.extensions.logging.ExpectLog;
import org.zerox.junit.extensions.logging.LogLevel;
import org.zerox.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link Compiler} facade: the go/no-go rule, diagnostics for
 * front-end failures and the non-throwing check.
 */
@ExtendWith(LogWatchExtension.class)
public class CompilerTest {

    private static final String CLEAN_PAGE = String.join("\n",
            "page Counter:",
            "  state count: int = 0",
            "  derived doubled = count * 2",
            "  fn inc():",
            "    count += 1");

    private static final String UNUSED_STATE_PAGE = String.join("\n",
            "page Draft:",
            "  state unused: int = 0");

    /**
     * Verifies that a clean source compiles into its tree without warnings.
     */
    @Test
    @Tag("unit")
    void compilesCleanSource() throws CompilationException {
        // Act
        CompilationResult result = new Compiler().compile(CLEAN_PAGE, "counter.0x");

        // Assert
        assertThat(result.ast()).singleElement().isInstanceOfSatisfying(PageNode.class,
                page -> assertThat(page.name()).isEqualTo("Counter"));
        assertThat(result.hasWarnings()).isFalse();
    }

    /**
     * Verifies that a syntax error fails compilation with exactly one positioned diagnostic.
     */
    @Test
    @Tag("unit")
    void syntaxErrorFailsWithOneDiagnostic() {
        // Act
        CompilationException error = catchThrowableOfType(
                () -> new Compiler().compile("paeg Home:", "home.0x"), CompilationException.class);

        // Assert
        assertThat(error.getMessage()).isEqualTo("Line 1, Col 1: Expected top-level keyword, got 'paeg' Did you mean 'page'?");
        assertThat(error.getDiagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.code()).isEqualTo(CompilerErrorCode.UNKNOWN_KEYWORD);
            assertThat(diagnostic.sourceName()).isEqualTo("home.0x");
            assertThat(diagnostic.line()).isEqualTo(1);
            assertThat(diagnostic.column()).isEqualTo(1);
        });
    }

    /**
     * Verifies that a lexical error is reported the same way as a syntax error.
     */
    @Test
    @Tag("unit")
    void lexicalErrorFailsWithOneDiagnostic() {
        CompilationException error = catchThrowableOfType(
                () -> new Compiler().compile("page A:\n  text \"abc", null), CompilationException.class);

        assertThat(error.getDiagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.code()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING);
            assertThat(diagnostic.sourceName()).isEqualTo("<input>");
            assertThat(diagnostic.location().toString()).isEqualTo("Line 2, Col 8");
        });
    }

    /**
     * Verifies that validation errors block compilation and are listed in the message.
     */
    @Test
    @Tag("unit")
    void validationErrorsBlockCompilation() {
        // Arrange
        String source = String.join("\n",
                "page P:",
                "  derived a = b",
                "  derived b = a");

        // Act
        CompilationException error = catchThrowableOfType(
                () -> new Compiler().compile(source, "p.0x"), CompilationException.class);

        // Assert
        assertThat(error.getMessage()).startsWith("Validation errors:\n")
                .contains("Circular dependency detected in derived 'a'");
        assertThat(error.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.CIRCULAR_DERIVED);
    }

    /**
     * Verifies that warnings pass by default and fail when they are treated as errors.
     */
    @Test
    @Tag("unit")
    void warningsAsErrors() throws CompilationException {
        // Act
        CompilationResult lenient = new Compiler().compile(UNUSED_STATE_PAGE, "draft.0x");
        CompilationException strict = catchThrowableOfType(
                () -> new Compiler(CompilerOptions.defaults().withWarningsAsErrors(true)).compile(UNUSED_STATE_PAGE, "draft.0x"),
                CompilationException.class);

        // Assert
        assertThat(lenient.warnings()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNUSED_STATE);
        assertThat(strict.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNUSED_STATE);
    }

    /**
     * Verifies that check lists errors before warnings and never throws for source problems.
     */
    @Test
    @Tag("unit")
    void checkListsErrorsBeforeWarnings() {
        // Arrange
        String source = String.join("\n",
                "page P:",
                "  state unused: int = 0",
                "  derived a = 1",
                "  derived a = 2");
        Compiler compiler = new Compiler();

        // Act
        List<Diagnostic> diagnostics = compiler.check(source, "p.0x");
        List<Diagnostic> syntax = compiler.check("page", "q.0x");

        // Assert
        assertThat(diagnostics).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.ERROR, Diagnostic.Type.WARNING);
        assertThat(diagnostics.get(0).line()).isEqualTo(4);
        assertThat(syntax).singleElement().satisfies(diagnostic ->
                assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR));
    }

    /**
     * Verifies that an internal failure during checking becomes an unknown-error diagnostic and
     * is logged.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = "org\\.zerox\\.compiler\\.Compiler",
            messagePattern = "Unexpected failure while checking broken\\.0x")
    void internalFailureBecomesUnknownError() {
        // Arrange
        Validator validator = mock(Validator.class);
        when(validator.validate(any(), anyString())).thenThrow(new IllegalStateException("boom"));
        Compiler compiler = new Compiler(CompilerOptions.defaults(), Parser.defaultRegistry(), validator);

        // Act
        List<Diagnostic> diagnostics = compiler.check(CLEAN_PAGE, "broken.0x");

        // Assert
        assertThat(diagnostics).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.code()).isEqualTo(CompilerErrorCode.UNKNOWN_ERROR);
            assertThat(diagnostic.message()).isEqualTo("boom");
            assertThat(diagnostic.line()).isZero();
            assertThat(diagnostic.column()).isZero();
        });
    }

    /**
     * Verifies that tokenizing uses the configured tab width, so a tab and four spaces only
     * share a block when a tab counts for four columns.
     */
    @Test
    @Tag("unit")
    void tokenizeUsesTabWidth() {
        // Arrange
        String source = "page Home:\n\ttext a\n    text b";

        // Act
        List<Token> narrow = new Compiler().tokenize(source);
        List<Token> wide = new Compiler(new CompilerOptions(4, 2, false)).tokenize(source);

        // Assert
        assertThat(narrow).filteredOn(token -> token.type() == TokenType.INDENT).hasSize(2);
        assertThat(wide).filteredOn(token -> token.type() == TokenType.INDENT).hasSize(1);
        assertThat(wide.get(wide.size() - 1).type()).isEqualTo(TokenType.EOF);
    }

    /**
     * Verifies that a source file is read as UTF-8 and named by its path.
     */
    @Test
    @Tag("unit")
    void compilesFromPath(@TempDir Path directory) throws IOException, CompilationException {
        // Arrange
        Path file = directory.resolve("greeting.0x");
        Files.writeString(file, "page 인사:\n  text \"안녕하세요\"", StandardCharsets.UTF_8);

        // Act
        CompilationResult result = new Compiler().compile(file);

        // Assert
        assertThat(result.ast()).singleElement().isInstanceOfSatisfying(PageNode.class,
                page -> assertThat(page.name()).isEqualTo("인사"));
    }
}
