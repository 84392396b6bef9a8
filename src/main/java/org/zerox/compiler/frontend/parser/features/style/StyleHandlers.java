package org.zerox.compiler.frontend.parser.features.style;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for <code>style</code> blocks.
 */
public final class StyleHandlers {

    private StyleHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "style", StyleHandlers::parseStyle);
    }

    /**
     * Expected format:
     * <pre>
     * style card:
     *   padding: 16
     *   &#64;sm: padding: 8
     * </pre>
     * Property names may be any token, so {@code background}, {@code text} and {@code 2xl} all work.
     */
    static StyleNode parseStyle(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "style").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<StyleNode.StyleProperty> properties = new ArrayList<>();
        context.forEachBlockLine(() -> {
            String responsive = null;
            if (context.check(TokenType.AT_KEYWORD)) {
                responsive = "@" + context.advance().value();
                context.expect(TokenType.PUNCTUATION, ":");
            }
            if (context.check(TokenType.NEWLINE) || context.check(TokenType.INDENT)
                    || context.check(TokenType.DEDENT) || context.isAtEnd()) {
                throw context.error("Expected style property name");
            }
            String property = context.advance().value();
            context.expect(TokenType.PUNCTUATION, ":");
            properties.add(new StyleNode.StyleProperty(property, context.parseExpression(), responsive));
        });
        return new StyleNode(location, name, properties);
    }
}
