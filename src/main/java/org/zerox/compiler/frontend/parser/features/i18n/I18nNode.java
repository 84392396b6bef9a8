package org.zerox.compiler.frontend.parser.features.i18n;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Internationalisation settings and translation tables.
 *
 * @param defaultLocale The default locale, {@code ko} when omitted.
 * @param locales       Every listed locale, with or without a table.
 * @param translations  The translation tables in source order.
 */
public record I18nNode(
        SourceLocation location,
        String defaultLocale,
        List<String> locales,
        List<Translation> translations
) implements AstNode {

    public I18nNode {
        locales = List.copyOf(locales);
        translations = List.copyOf(translations);
    }

    /**
     * The messages of one locale, keyed by message key in source order.
     */
    public record Translation(String locale, Map<String, String> messages) {

        public Translation {
            messages = Collections.unmodifiableMap(new LinkedHashMap<>(messages));
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.I18N;
    }
}
