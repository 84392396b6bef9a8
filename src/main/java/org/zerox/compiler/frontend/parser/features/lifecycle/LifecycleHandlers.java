package org.zerox.compiler.frontend.parser.features.lifecycle;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * Handlers for the lifecycle hooks <code>on mount</code> and <code>on destroy</code>, and for
 * <code>watch</code> blocks.
 */
public final class LifecycleHandlers {

    private LifecycleHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "on", LifecycleHandlers::parseOn);
        registry.register(KeywordScope.BODY, "watch", LifecycleHandlers::parseWatch);
    }

    static AstNode parseOn(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "on").location();
        Token event = context.peek();
        if (context.match(TokenType.KEYWORD, "mount")) {
            return new OnMountNode(location, parseHookBody(context));
        }
        if (context.match(TokenType.KEYWORD, "destroy")) {
            return new OnDestroyNode(location, parseHookBody(context));
        }
        throw context.error("Expected 'mount' or 'destroy' after 'on', got '" + event.value() + "'");
    }

    static WatchNode parseWatch(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "watch").location();
        String variable = context.expectName();
        return new WatchNode(location, variable, parseHookBody(context));
    }

    private static List<Statement> parseHookBody(ParsingContext context) {
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return context.parseStatementBlock();
    }
}
