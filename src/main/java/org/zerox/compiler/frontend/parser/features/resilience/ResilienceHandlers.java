package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.NullLiteral;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for failure and latency handling inside a container: error boundaries, loading and
 * offline states, retry policies and log statements.
 */
public final class ResilienceHandlers {

    private static final Set<String> ERROR_TYPES = Set.of("boundary", "global", "fallback");
    private static final Set<String> LOADING_TYPES = Set.of("skeleton", "spinner", "shimmer", "global");
    private static final Set<String> BACKOFF_STRATEGIES = Set.of("linear", "exponential");
    private static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warn", "error");

    private ResilienceHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.BODY, "error", ResilienceHandlers::parseError);
        registry.register(KeywordScope.BODY, "loading", ResilienceHandlers::parseLoading);
        registry.register(KeywordScope.BODY, "offline", ResilienceHandlers::parseOffline);
        registry.register(KeywordScope.BODY, "retry", ResilienceHandlers::parseRetry);
        registry.register(KeywordScope.BODY, "log", ResilienceHandlers::parseLog);
    }

    /**
     * Expected format: {@code error [boundary|global|fallback]:} followed by a block of
     * {@code fallback:} UI blocks, {@code on event:} statement blocks and {@code name = expr}
     * settings. Other lines are skipped.
     */
    static ErrorNode parseError(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "error").location();
        String errorType = "boundary";
        if (context.checkWord() && ERROR_TYPES.contains(context.peek().value())) {
            errorType = context.advance().value();
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<ErrorNode.Handler> handlers = new ArrayList<>();
        List<AstNode> fallback = new ArrayList<>();
        Map<String, Expression> props = Props.builder();
        context.forEachBlockLine(() -> {
            if (context.checkWord("fallback") && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
                context.advance();
                context.advance();
                context.skipNewlines();
                fallback.addAll(context.parseUiBlock());
            } else if (context.match(TokenType.KEYWORD, "on")) {
                String event = context.expectName();
                context.expect(TokenType.PUNCTUATION, ":");
                context.skipNewlines();
                handlers.add(new ErrorNode.Handler(event, context.parseStatementBlock()));
            } else if (context.checkWord() && context.peek(1).is(TokenType.OPERATOR, "=")) {
                String name = context.advance().value();
                context.advance();
                props.put(name, context.parseExpression());
            } else {
                context.skipLine();
            }
        });
        return new ErrorNode(location, errorType, handlers, fallback, props);
    }

    static LoadingNode parseLoading(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "loading").location();
        String loadingType = "spinner";
        if (context.checkWord() && LOADING_TYPES.contains(context.peek().value())) {
            loadingType = context.advance().value();
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new LoadingNode(location, loadingType, context.parseUiBlock());
    }

    static OfflineNode parseOffline(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "offline").location();
        String strategy = "cache-first";
        if (context.check(TokenType.IDENTIFIER) || context.check(TokenType.STRING)) {
            strategy = context.advance().value();
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new OfflineNode(location, strategy, context.parseUiBlock());
    }

    /**
     * Expected format: {@code retry maxRetries [linear|exponential][:]} followed by
     * {@code delay: expr} and {@code action: expr} settings.
     */
    static RetryNode parseRetry(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "retry").location();
        Expression maxRetries = context.parseExpression();
        String backoff = "exponential";
        if (context.checkWord() && BACKOFF_STRATEGIES.contains(context.peek().value())) {
            backoff = context.advance().value();
        }
        Map<String, Expression> settings = context.parseGenericPropsBlock();
        Expression action = settings.containsKey("action") ? settings.get("action") : new NullLiteral(location);
        return new RetryNode(location, maxRetries, backoff, settings.get("delay"), action);
    }

    static LogNode parseLog(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "log").location();
        String level = "info";
        if (context.checkWord() && LOG_LEVELS.contains(context.peek().value())) {
            level = context.advance().value();
        }
        Expression message = context.parseExpression();
        Expression data = null;
        if (context.match(TokenType.PUNCTUATION, ",")) {
            data = context.parseExpression();
        }
        return new LogNode(location, level, message, data);
    }
}
