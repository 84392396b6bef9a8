package org.zerox.compiler.frontend.parser.features.function;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for function declarations, introduced by <code>fn</code> or <code>async fn</code>.
 */
public final class FunctionHandlers {

    private FunctionHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "fn", FunctionHandlers::parseFunction);
        registry.register(KeywordScope.BODY, "async", FunctionHandlers::parseFunction);
    }

    /**
     * Parses a function declaration.
     * Expected format: {@code [async] fn name(a: int, b = 2):} followed by an indented body whose
     * lines are statements, {@code requires: expr} or {@code ensures: expr}.
     * @param context The context that encapsulates the parser.
     * @return The function node.
     */
    static FunctionNode parseFunction(ParsingContext context) {
        SourceLocation location = context.location();
        boolean async = context.match(TokenType.KEYWORD, "async");
        context.expect(TokenType.KEYWORD, "fn");
        String name = context.expectName();

        context.expect(TokenType.PUNCTUATION, "(");
        List<FunctionNode.Param> params = new ArrayList<>();
        if (!context.check(TokenType.PUNCTUATION, ")")) {
            do {
                params.add(parseParam(context));
            } while (context.match(TokenType.PUNCTUATION, ","));
        }
        context.expect(TokenType.PUNCTUATION, ")");
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<Expression> requires = new ArrayList<>();
        List<Expression> ensures = new ArrayList<>();
        List<Statement> body = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "requires")) {
                context.expect(TokenType.PUNCTUATION, ":");
                requires.add(context.parseExpression());
            } else if (context.match(TokenType.KEYWORD, "ensures")) {
                context.expect(TokenType.PUNCTUATION, ":");
                ensures.add(context.parseExpression());
            } else {
                body.add(context.parseStatement());
            }
        });
        return new FunctionNode(location, name, params, body, async, requires, ensures);
    }

    private static FunctionNode.Param parseParam(ParsingContext context) {
        String name = context.expectName();
        TypeExpr type = null;
        if (context.match(TokenType.PUNCTUATION, ":")) {
            type = context.parseTypeExpr();
        }
        Expression defaultValue = null;
        if (context.match(TokenType.OPERATOR, "=")) {
            defaultValue = context.parseExpression();
        }
        return new FunctionNode.Param(name, type, defaultValue);
    }
}
