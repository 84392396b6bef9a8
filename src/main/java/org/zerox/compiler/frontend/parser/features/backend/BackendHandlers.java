package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for server-side declarations: endpoints, middleware, jobs, caches, migrations, seed
 * data, webhooks and storage buckets.
 */
public final class BackendHandlers {

    private static final Set<String> LOWER_CASE_METHODS = Set.of("get", "post", "put", "delete", "patch");
    private static final Set<String> CACHE_STRATEGIES = Set.of("memory", "redis", "cdn");
    private static final Set<String> STORAGE_PROVIDERS = Set.of("s3", "r2", "gcs", "local");

    private BackendHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "endpoint", BackendHandlers::parseEndpoint);
        registry.register(KeywordScope.TOP_LEVEL, "middleware", BackendHandlers::parseMiddleware);
        registry.register(KeywordScope.TOP_LEVEL, "queue", BackendHandlers::parseQueue);
        registry.register(KeywordScope.TOP_LEVEL, "cron", BackendHandlers::parseCron);
        registry.register(KeywordScope.TOP_LEVEL, "cache", BackendHandlers::parseCache);
        registry.register(KeywordScope.TOP_LEVEL, "migrate", BackendHandlers::parseMigrate);
        registry.register(KeywordScope.TOP_LEVEL, "seed", BackendHandlers::parseSeed);
        registry.register(KeywordScope.TOP_LEVEL, "webhook", BackendHandlers::parseWebhook);
        registry.register(KeywordScope.TOP_LEVEL, "storage", BackendHandlers::parseStorage);
    }

    /**
     * Expected format: {@code endpoint [METHOD] [path] (middleware name | guard role)* :} followed
     * by a statement block. A lower-case method is upper-cased and a bare name path gets a
     * leading slash.
     */
    static EndpointNode parseEndpoint(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "endpoint").location();
        String method = "GET";
        if (context.check(TokenType.HTTP_METHOD)) {
            method = context.advance().value();
        } else if (context.check(TokenType.IDENTIFIER)
                && LOWER_CASE_METHODS.contains(context.peek().value().toLowerCase(Locale.ROOT))) {
            method = context.advance().value().toUpperCase(Locale.ROOT);
        }

        String path = "/";
        if (context.check(TokenType.STRING)) {
            path = context.advance().value();
        } else if (context.check(TokenType.IDENTIFIER)) {
            path = "/" + context.advance().value();
        }

        List<String> middleware = new ArrayList<>();
        String guard = null;
        while (context.check(TokenType.KEYWORD, "middleware") || context.check(TokenType.KEYWORD, "guard")) {
            if (context.advance().value().equals("guard")) {
                guard = context.expectName();
            } else {
                middleware.add(context.expectName());
            }
        }
        return new EndpointNode(location, method, path, middleware, guard, statementBody(context));
    }

    static MiddlewareNode parseMiddleware(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "middleware").location();
        String name = context.expectName();
        return new MiddlewareNode(location, name, statementBody(context));
    }

    static QueueNode parseQueue(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "queue").location();
        String name = context.expectName();
        return new QueueNode(location, name, statementBody(context));
    }

    static CronNode parseCron(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "cron").location();
        String name = context.expectName();
        String schedule = context.check(TokenType.STRING) ? context.advance().value() : "0 * * * *";
        return new CronNode(location, name, schedule, statementBody(context));
    }

    static CacheNode parseCache(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "cache").location();
        String name = context.expectName();
        String strategy = "memory";
        if (context.checkWord() && CACHE_STRATEGIES.contains(context.peek().value())) {
            strategy = context.advance().value();
        }
        Map<String, Expression> props = context.parseGenericPropsBlock();
        return new CacheNode(location, name, strategy, props.get("ttl"), props);
    }

    /**
     * Expected format: {@code migrate name:} followed by {@code up:} and {@code down:} statement
     * blocks. Statements outside both blocks are added to the up direction.
     */
    static MigrateNode parseMigrate(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "migrate").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<Statement> up = new ArrayList<>();
        List<Statement> down = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (isDirection(context, "up")) {
                up.addAll(directionBlock(context));
            } else if (isDirection(context, "down")) {
                down.addAll(directionBlock(context));
            } else {
                up.add(context.parseStatement());
            }
        });
        return new MigrateNode(location, name, up, down);
    }

    private static boolean isDirection(ParsingContext context, String direction) {
        return context.checkWord(direction) && context.peek(1).is(TokenType.PUNCTUATION, ":");
    }

    private static List<Statement> directionBlock(ParsingContext context) {
        context.advance();
        context.advance();
        context.skipNewlines();
        return context.parseStatementBlock();
    }

    /**
     * Expected format: {@code seed Model [count]:} followed by the data expression, on the same
     * line or in an indented block.
     */
    static SeedNode parseSeed(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "seed").location();
        String model = context.expectName();
        Expression count = context.check(TokenType.NUMBER) ? context.parseExpression() : null;
        context.expect(TokenType.PUNCTUATION, ":");
        return new SeedNode(location, model, count, context.parseDataExpression());
    }

    static WebhookNode parseWebhook(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "webhook").location();
        String name = context.expectName();
        String path = context.check(TokenType.STRING) ? context.advance().value() : "/webhooks/" + name;
        return new WebhookNode(location, name, path, statementBody(context));
    }

    static StorageNode parseStorage(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "storage").location();
        String name = context.expectName();
        String provider = "s3";
        if (context.checkWord() && STORAGE_PROVIDERS.contains(context.peek().value())) {
            provider = context.advance().value();
        }
        return new StorageNode(location, name, provider, context.parseGenericPropsBlock());
    }

    private static List<Statement> statementBody(ParsingContext context) {
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return context.parseStatementBlock();
    }
}
