package org.zerox.compiler.frontend.parser.features.interop;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the <code>js</code> keyword, which either imports from a JavaScript module or embeds
 * a block of JavaScript.
 */
public final class InteropHandlers {

    private InteropHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "js", InteropHandlers::parseJs);
    }

    static AstNode parseJs(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "js").location();
        if (context.match(TokenType.KEYWORD, "import")) {
            return parseImport(context, location);
        }
        if (context.match(TokenType.PUNCTUATION, "{")) {
            return new JsBlockNode(location, collectBlock(context));
        }
        throw context.error("Expected 'import' or '{' after 'js'");
    }

    private static JsImportNode parseImport(ParsingContext context, SourceLocation location) {
        List<String> specifiers = new ArrayList<>();
        boolean defaultImport = false;
        if (context.match(TokenType.PUNCTUATION, "{")) {
            while (!context.check(TokenType.PUNCTUATION, "}")) {
                specifiers.add(context.expectName());
                if (!context.match(TokenType.PUNCTUATION, ",")) {
                    break;
                }
            }
            context.expect(TokenType.PUNCTUATION, "}");
        } else {
            specifiers.add(context.expectName());
            defaultImport = true;
        }
        context.expect(TokenType.KEYWORD, "from");
        String source = context.expect(TokenType.STRING).value();
        return new JsImportNode(location, specifiers, source, defaultImport);
    }

    /**
     * Collects tokens up to the matching closing brace. Layout tokens carry no text and are dropped.
     */
    private static String collectBlock(ParsingContext context) {
        StringBuilder code = new StringBuilder();
        int depth = 1;
        while (!context.isAtEnd()) {
            Token token = context.advance();
            if (token.is(TokenType.PUNCTUATION, "{")) {
                depth++;
            } else if (token.is(TokenType.PUNCTUATION, "}") && --depth == 0) {
                return code.toString().trim();
            }
            if (token.type() != TokenType.INDENT && token.type() != TokenType.DEDENT) {
                code.append(token.value()).append(' ');
            }
        }
        throw context.error("Expected '}' to close the js block");
    }
}
