package org.zerox.compiler.frontend.keyword;

import org.zerox.compiler.frontend.parser.features.app.AppHandlers;
import org.zerox.compiler.frontend.parser.features.backend.BackendHandlers;
import org.zerox.compiler.frontend.parser.features.container.ContainerHandlers;
import org.zerox.compiler.frontend.parser.features.control.ControlFlowHandlers;
import org.zerox.compiler.frontend.parser.features.data.DataHandlers;
import org.zerox.compiler.frontend.parser.features.declaration.DeclarationHandlers;
import org.zerox.compiler.frontend.parser.features.display.DisplayHandlers;
import org.zerox.compiler.frontend.parser.features.function.FunctionHandlers;
import org.zerox.compiler.frontend.parser.features.i18n.I18nHandlers;
import org.zerox.compiler.frontend.parser.features.infra.InfraHandlers;
import org.zerox.compiler.frontend.parser.features.interop.InteropHandlers;
import org.zerox.compiler.frontend.parser.features.lifecycle.LifecycleHandlers;
import org.zerox.compiler.frontend.parser.features.pattern.PatternHandlers;
import org.zerox.compiler.frontend.parser.features.resilience.ResilienceHandlers;
import org.zerox.compiler.frontend.parser.features.style.StyleHandlers;
import org.zerox.compiler.frontend.parser.features.testing.TestingHandlers;
import org.zerox.compiler.frontend.parser.features.ui.UiHandlers;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry for keyword handlers. This class holds, per {@link KeywordScope}, a map of
 * keywords to their corresponding handlers. Registration order is kept; it decides which
 * keyword the suggestion engine prefers when two are equally close to a typo.
 */
public class KeywordHandlerRegistry {

    private final Map<KeywordScope, Map<String, IKeywordHandler>> handlers = new EnumMap<>(KeywordScope.class);

    public KeywordHandlerRegistry() {
        for (KeywordScope scope : KeywordScope.values()) {
            handlers.put(scope, new LinkedHashMap<>());
        }
    }

    /**
     * Registers a new keyword handler. A later registration for the same scope and keyword replaces the earlier one.
     * @param scope   The position the keyword is valid in.
     * @param keyword The keyword (e.g., "state").
     * @param handler The handler for the keyword.
     */
    public void register(KeywordScope scope, String keyword, IKeywordHandler handler) {
        handlers.get(scope).put(keyword, handler);
    }

    /**
     * Gets the handler for a keyword in the given scope.
     * @param scope   The position being parsed.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IKeywordHandler> get(KeywordScope scope, String keyword) {
        return Optional.ofNullable(handlers.get(scope).get(keyword));
    }

    /**
     * @param scope The scope.
     * @return The keywords registered for the scope, in registration order.
     */
    public Set<String> keywords(KeywordScope scope) {
        return Collections.unmodifiableSet(handlers.get(scope).keySet());
    }

    /**
     * Initializes the keyword handler registry with all the built-in handlers.
     * @return A new instance of {@link KeywordHandlerRegistry} with all handlers registered.
     */
    public static KeywordHandlerRegistry initialize() {
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();

        // Top-level and body declarations
        ContainerHandlers.register(registry);
        DataHandlers.register(registry);
        AppHandlers.register(registry);
        InfraHandlers.register(registry);
        BackendHandlers.register(registry);
        TestingHandlers.register(registry);
        I18nHandlers.register(registry);
        DeclarationHandlers.register(registry);
        FunctionHandlers.register(registry);
        LifecycleHandlers.register(registry);
        StyleHandlers.register(registry);
        InteropHandlers.register(registry);
        ResilienceHandlers.register(registry);

        // UI elements
        UiHandlers.register(registry);
        ControlFlowHandlers.register(registry);
        DisplayHandlers.register(registry);
        PatternHandlers.register(registry);

        return registry;
    }
}
