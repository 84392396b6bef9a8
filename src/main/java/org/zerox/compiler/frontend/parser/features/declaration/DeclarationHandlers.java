package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

/**
 * Handlers for the body-level value declarations:
 * <code>state</code>, <code>derived</code>, <code>prop</code>, <code>type</code>,
 * <code>store</code>, <code>api</code>, <code>check</code> and <code>use</code>.
 */
public final class DeclarationHandlers {

    private DeclarationHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "state", DeclarationHandlers::parseState);
        registry.register(KeywordScope.BODY, "derived", DeclarationHandlers::parseDerived);
        registry.register(KeywordScope.BODY, "prop", DeclarationHandlers::parseProp);
        registry.register(KeywordScope.BODY, "type", DeclarationHandlers::parseType);
        registry.register(KeywordScope.BODY, "store", DeclarationHandlers::parseStore);
        registry.register(KeywordScope.BODY, "api", DeclarationHandlers::parseApi);
        registry.register(KeywordScope.BODY, "check", DeclarationHandlers::parseCheck);
        registry.register(KeywordScope.BODY, "use", DeclarationHandlers::parseUse);
    }

    /**
     * Expected format: {@code state name: Type = initial}
     */
    static StateDeclNode parseState(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "state").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        TypeExpr type = context.parseTypeExpr();
        context.expect(TokenType.OPERATOR, "=");
        return new StateDeclNode(location, name, type, context.parseExpression());
    }

    static DerivedDeclNode parseDerived(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "derived").location();
        String name = context.expectName();
        context.expect(TokenType.OPERATOR, "=");
        return new DerivedDeclNode(location, name, context.parseExpression());
    }

    static PropDeclNode parseProp(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "prop").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        TypeExpr type = context.parseTypeExpr();
        Expression defaultValue = null;
        if (context.match(TokenType.OPERATOR, "=")) {
            defaultValue = context.parseExpression();
        }
        return new PropDeclNode(location, name, type, defaultValue);
    }

    static TypeDeclNode parseType(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "type").location();
        String name = context.expectName();
        context.expect(TokenType.OPERATOR, "=");
        return new TypeDeclNode(location, name, context.parseTypeDefinition());
    }

    static StoreDeclNode parseStore(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "store").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        TypeExpr type = context.parseTypeExpr();
        context.expect(TokenType.OPERATOR, "=");
        return new StoreDeclNode(location, name, type, context.parseExpression());
    }

    /**
     * Expected format: {@code api name = METHOD "url"}
     */
    static ApiDeclNode parseApi(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "api").location();
        String name = context.expectName();
        context.expect(TokenType.OPERATOR, "=");
        String method = context.expect(TokenType.HTTP_METHOD).value();
        String url = context.expect(TokenType.STRING).value();
        return new ApiDeclNode(location, name, method, url);
    }

    static CheckDeclNode parseCheck(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "check").location();
        Expression condition = context.parseExpression();
        String message = context.expect(TokenType.STRING).value();
        return new CheckDeclNode(location, condition, message);
    }

    static UseImportNode parseUse(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "use").location();
        String name = context.expectName();
        context.expect(TokenType.KEYWORD, "from");
        String source = context.expect(TokenType.STRING).value();
        return new UseImportNode(location, name, source);
    }
}
