package org.zerox.compiler.frontend.parser.features.testing;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Handlers for test declarations: unit tests, end-to-end scenarios, mocks and fixtures.
 */
public final class TestingHandlers {

    private static final Set<String> TEST_TYPES = Set.of("unit", "integration", "component");

    private TestingHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "test", TestingHandlers::parseTest);
        registry.register(KeywordScope.TOP_LEVEL, "e2e", TestingHandlers::parseE2e);
        registry.register(KeywordScope.TOP_LEVEL, "mock", TestingHandlers::parseMock);
        registry.register(KeywordScope.TOP_LEVEL, "fixture", TestingHandlers::parseFixture);
    }

    /**
     * Expected format: {@code test [unit|integration|component] [name]:} followed by a statement block.
     */
    static TestNode parseTest(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "test").location();
        String testType = "unit";
        if (context.checkWord() && TEST_TYPES.contains(context.peek().value())) {
            testType = context.advance().value();
        }
        String name = optionalName(context);
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new TestNode(location, testType, name, context.parseStatementBlock());
    }

    /**
     * Expected format: {@code e2e [name]:} followed by {@code action target [= value]} lines, such
     * as {@code visit "/login"} or {@code fill email = "a@b.c"}.
     */
    static E2eNode parseE2e(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "e2e").location();
        String name = optionalName(context);
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<E2eNode.Step> steps = new ArrayList<>();
        context.forEachBlockLine(() -> {
            String action = context.expectName();
            Expression target = context.parseExpression();
            Expression value = null;
            if (context.match(TokenType.OPERATOR, "=")) {
                value = context.parseExpression();
            }
            steps.add(new E2eNode.Step(action, target, value));
        });
        return new E2eNode(location, name, steps);
    }

    /**
     * Expected format: {@code mock target:} followed by {@code [METHOD] ["path"] => response} lines.
     */
    static MockNode parseMock(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "mock").location();
        String target = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<MockNode.Route> routes = new ArrayList<>();
        context.forEachBlockLine(() -> {
            String method = "GET";
            if (context.check(TokenType.HTTP_METHOD)) {
                method = context.advance().value();
            } else if (context.check(TokenType.IDENTIFIER)) {
                method = context.advance().value().toUpperCase(Locale.ROOT);
            }
            String path = context.check(TokenType.STRING) ? context.advance().value() : "/";
            context.expect(TokenType.OPERATOR, "=>");
            routes.add(new MockNode.Route(method, path, context.parseExpression()));
        });
        return new MockNode(location, target, routes);
    }

    static FixtureNode parseFixture(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "fixture").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        return new FixtureNode(location, name, context.parseDataExpression());
    }

    private static String optionalName(ParsingContext context) {
        if (context.check(TokenType.STRING) || context.check(TokenType.IDENTIFIER)) {
            return context.advance().value();
        }
        return "unnamed";
    }
}
