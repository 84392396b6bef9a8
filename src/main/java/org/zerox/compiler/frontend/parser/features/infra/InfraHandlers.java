package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Handlers for the deployment and infrastructure declarations.
 * <p>
 * The provider-style declarations ({@code domain}, {@code cdn}, {@code monitor}, {@code backup})
 * take a single colon before their settings block.
 */
public final class InfraHandlers {

    private InfraHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "deploy", InfraHandlers::parseDeploy);
        registry.register(KeywordScope.TOP_LEVEL, "env", InfraHandlers::parseEnv);
        registry.register(KeywordScope.TOP_LEVEL, "docker", InfraHandlers::parseDocker);
        registry.register(KeywordScope.TOP_LEVEL, "ci", InfraHandlers::parseCi);
        registry.register(KeywordScope.TOP_LEVEL, "domain", InfraHandlers::parseDomain);
        registry.register(KeywordScope.TOP_LEVEL, "cdn", InfraHandlers::parseCdn);
        registry.register(KeywordScope.TOP_LEVEL, "monitor", InfraHandlers::parseMonitor);
        registry.register(KeywordScope.TOP_LEVEL, "backup", InfraHandlers::parseBackup);
    }

    static DeployNode parseDeploy(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "deploy").location();
        String provider = context.expectName();
        return new DeployNode(location, provider, context.parseGenericPropsBlock());
    }

    /**
     * Expected format: {@code env [stage]:} followed by a block of {@code [secret] NAME = expr} lines.
     */
    static EnvNode parseEnv(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "env").location();
        String stage = context.checkWord() ? context.advance().value() : "all";
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<EnvNode.EnvVar> vars = new ArrayList<>();
        context.forEachBlockLine(() -> {
            boolean secret = false;
            if (context.checkWord("secret") && context.peek(1).isWord()) {
                context.advance();
                secret = true;
            }
            String name = context.expectName();
            context.expect(TokenType.OPERATOR, "=");
            vars.add(new EnvNode.EnvVar(name, context.parseExpression(), secret));
        });
        return new EnvNode(location, stage, vars);
    }

    static DockerNode parseDocker(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "docker").location();
        String baseImage = "node:20-alpine";
        if (context.check(TokenType.STRING) || context.check(TokenType.IDENTIFIER)) {
            baseImage = context.advance().value();
        }
        return new DockerNode(location, baseImage, context.parseGenericPropsBlock());
    }

    /**
     * Expected format: {@code ci [provider]:} followed by {@code trigger event}, {@code on event}
     * and {@code name = command} lines.
     */
    static CiNode parseCi(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "ci").location();
        String provider = context.checkWord() ? context.advance().value() : "github";
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<String> triggers = new ArrayList<>();
        List<CiNode.Step> steps = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "trigger") || context.match(TokenType.KEYWORD, "on")) {
                triggers.add(context.expectName());
            } else {
                String name = context.expectName();
                context.expect(TokenType.OPERATOR, "=");
                steps.add(new CiNode.Step(name, context.parseExpression()));
            }
        });
        return new CiNode(location, provider, triggers, steps);
    }

    static DomainNode parseDomain(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "domain").location();
        String domain = context.check(TokenType.STRING) ? context.advance().value() : context.expectName();
        return new DomainNode(location, domain, context.parseGenericPropsBlock());
    }

    static CdnNode parseCdn(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "cdn").location();
        return new CdnNode(location, optionalIdentifier(context, "cloudflare"), context.parseGenericPropsBlock());
    }

    static MonitorNode parseMonitor(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "monitor").location();
        return new MonitorNode(location, optionalIdentifier(context, "sentry"), context.parseGenericPropsBlock());
    }

    static BackupNode parseBackup(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "backup").location();
        return new BackupNode(location, optionalIdentifier(context, "daily"), context.parseGenericPropsBlock());
    }

    private static String optionalIdentifier(ParsingContext context, String fallback) {
        return context.check(TokenType.IDENTIFIER) ? context.advance().value() : fallback;
    }
}
