package org.zerox.compiler.frontend.parser.features.i18n;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers for internationalisation: translation tables, locale formatting and right-to-left layout.
 */
public final class I18nHandlers {

    private I18nHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "i18n", I18nHandlers::parseI18n);
        registry.register(KeywordScope.TOP_LEVEL, "locale", I18nHandlers::parseLocale);
        registry.register(KeywordScope.TOP_LEVEL, "rtl", I18nHandlers::parseRtl);
    }

    /**
     * Expected format:
     * <pre>
     * i18n ko:
     *   ko:
     *     greeting = "안녕하세요"
     *   en:
     *     greeting = "Hello"
     *   ja
     * </pre>
     * A locale without a colon is listed but has no translation table.
     */
    static I18nNode parseI18n(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "i18n").location();
        String defaultLocale = "ko";
        if (context.check(TokenType.IDENTIFIER) || context.check(TokenType.STRING)) {
            defaultLocale = context.advance().value();
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<String> locales = new ArrayList<>();
        List<I18nNode.Translation> translations = new ArrayList<>();
        context.forEachBlockLine(() -> {
            String locale = context.expectName();
            locales.add(locale);
            if (context.match(TokenType.PUNCTUATION, ":")) {
                context.skipNewlines();
                Map<String, String> messages = new LinkedHashMap<>();
                context.forEachBlockLine(() -> {
                    String key = context.expectName();
                    context.expect(TokenType.OPERATOR, "=");
                    String value = context.check(TokenType.STRING) ? context.advance().value() : context.expectName();
                    messages.put(key, value);
                });
                translations.add(new I18nNode.Translation(locale, messages));
            }
        });
        return new I18nNode(location, defaultLocale, locales, translations);
    }

    static LocaleNode parseLocale(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "locale").location();
        return new LocaleNode(location, context.parseGenericPropsBlock());
    }

    static RtlNode parseRtl(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "rtl").location();
        boolean enabled = true;
        if (context.match(TokenType.KEYWORD, "false")) {
            enabled = false;
        } else {
            context.match(TokenType.KEYWORD, "true");
        }
        return new RtlNode(location, enabled, context.parseGenericPropsBlock());
    }
}
