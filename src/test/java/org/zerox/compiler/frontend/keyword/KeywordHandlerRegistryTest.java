package org.zerox.compiler.frontend.keyword;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.lexer.Lexer;
import org.zerox.compiler.frontend.parser.ParseException;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.CommentNode;
import org.zerox.compiler.frontend.suggest.KeywordSuggester;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link KeywordHandlerRegistry} and the parser's dispatch through it.
 */
public class KeywordHandlerRegistryTest {

    /**
     * Verifies that a registered handler is found only in its own scope.
     */
    @Test
    @Tag("unit")
    void registersHandlerPerScope() {
        // Arrange
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        IKeywordHandler handler = mock(IKeywordHandler.class);

        // Act
        registry.register(KeywordScope.BODY, "state", handler);

        // Assert
        assertThat(registry.get(KeywordScope.BODY, "state")).containsSame(handler);
        assertThat(registry.get(KeywordScope.TOP_LEVEL, "state")).isEmpty();
        assertThat(registry.get(KeywordScope.BODY, "derived")).isEmpty();
    }

    /**
     * Verifies that keywords are listed in registration order and that re-registering a keyword
     * replaces the handler without moving it.
     */
    @Test
    @Tag("unit")
    void keepsRegistrationOrder() {
        // Arrange
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        IKeywordHandler first = mock(IKeywordHandler.class);
        IKeywordHandler replacement = mock(IKeywordHandler.class);

        // Act
        registry.register(KeywordScope.UI, "text", first);
        registry.register(KeywordScope.UI, "button", first);
        registry.register(KeywordScope.UI, "text", replacement);

        // Assert
        assertThat(registry.keywords(KeywordScope.UI)).containsExactly("text", "button");
        assertThat(registry.get(KeywordScope.UI, "text")).containsSame(replacement);
    }

    /**
     * Verifies that the built-in registry starts the top-level keywords with the containers.
     */
    @Test
    @Tag("unit")
    void builtInRegistryCoversAllScopes() {
        // Act
        KeywordHandlerRegistry registry = KeywordHandlerRegistry.initialize();

        // Assert
        assertThat(registry.keywords(KeywordScope.TOP_LEVEL)).startsWith("page", "component", "app")
                .contains("endpoint", "i18n", "e2e");
        assertThat(registry.keywords(KeywordScope.BODY)).contains("state", "derived", "fn", "on", "watch");
        assertThat(registry.keywords(KeywordScope.UI)).contains("layout", "text", "button", "if", "for");
    }

    /**
     * Verifies that the parser hands each top-level line to the handler registered for its keyword.
     */
    @Test
    @Tag("unit")
    void parserDispatchesToRegisteredHandler() {
        // Arrange
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        IKeywordHandler handler = mock(IKeywordHandler.class);
        when(handler.parse(any(ParsingContext.class))).thenAnswer(invocation -> {
            ParsingContext context = invocation.getArgument(0);
            CommentNode node = new CommentNode(context.location(), "handled");
            context.skipLine();
            return node;
        });
        registry.register(KeywordScope.TOP_LEVEL, "page", handler);
        Parser parser = new Parser(Lexer.tokenize("page A\npage B"), registry, new KeywordSuggester());

        // Act
        List<AstNode> ast = parser.parse();

        // Assert
        assertThat(ast).hasSize(2).allMatch(CommentNode.class::isInstance);
        verify(handler, times(2)).parse(any(ParsingContext.class));
    }

    /**
     * Verifies that rejection hints are drawn from the registry the parser was given.
     */
    @Test
    @Tag("unit")
    void rejectionHintUsesRegistryKeywords() {
        // Arrange
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        registry.register(KeywordScope.TOP_LEVEL, "screen", mock(IKeywordHandler.class));
        Parser parser = new Parser(Lexer.tokenize("scren Home"), registry, new KeywordSuggester());

        // Act
        ParseException error = catchThrowableOfType(parser::parse, ParseException.class);

        // Assert
        assertThat(error.getDetail()).isEqualTo("Expected top-level keyword, got 'scren' Did you mean 'screen'?");
    }
}
