package org.zerox.compiler.frontend.parser.features.container;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Handlers for the <code>page</code>, <code>component</code> and <code>app</code> containers.
 * Expected format: {@code page NAME:} followed by an indented body.
 */
public final class ContainerHandlers {

    private ContainerHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "page", ContainerHandlers::parsePage);
        registry.register(KeywordScope.TOP_LEVEL, "component", ContainerHandlers::parseComponent);
        registry.register(KeywordScope.TOP_LEVEL, "app", ContainerHandlers::parseApp);
    }

    static PageNode parsePage(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "page").location();
        String name = context.expectName();
        return new PageNode(location, name, parseBody(context));
    }

    static ComponentNode parseComponent(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "component").location();
        String name = context.expectName();
        return new ComponentNode(location, name, parseBody(context));
    }

    static AppNode parseApp(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "app").location();
        String name = context.expectName();
        return new AppNode(location, name, parseBody(context));
    }

    private static List<AstNode> parseBody(ParsingContext context) {
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return context.parseBody();
    }
}
