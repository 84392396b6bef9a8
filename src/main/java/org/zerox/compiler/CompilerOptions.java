package org.zerox.compiler;

import com.typesafe.config.Config;
import org.zerox.compiler.frontend.lexer.Lexer;
import org.zerox.compiler.frontend.suggest.KeywordSuggester;

/**
 * Tunable settings of the compiler front end, read from the {@code zerox.compiler} block of the
 * configuration.
 *
 * @param tabWidth              Indentation columns a tab counts for.
 * @param maxSuggestionDistance The largest edit distance for a "Did you mean" suggestion.
 * @param warningsAsErrors      Whether validation warnings fail compilation.
 */
public record CompilerOptions(int tabWidth, int maxSuggestionDistance, boolean warningsAsErrors) {

    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "zerox.compiler";

    public CompilerOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tab-width must be positive, got " + tabWidth);
        }
        if (maxSuggestionDistance < 0) {
            throw new IllegalArgumentException("suggestion.max-distance must not be negative, got " + maxSuggestionDistance);
        }
    }

    /**
     * @return The built-in defaults, identical to {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(Lexer.DEFAULT_TAB_WIDTH, KeywordSuggester.DEFAULT_MAX_DISTANCE, false);
    }

    /**
     * Reads the options from a resolved configuration. Missing keys keep their defaults.
     * @param config The root configuration.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        CompilerOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config block = config.getConfig(CONFIG_PATH);
        int tabWidth = block.hasPath("lexer.tab-width") ? block.getInt("lexer.tab-width") : defaults.tabWidth();
        int maxDistance = block.hasPath("suggestion.max-distance")
                ? block.getInt("suggestion.max-distance")
                : defaults.maxSuggestionDistance();
        boolean warningsAsErrors = block.hasPath("warnings-as-errors")
                ? block.getBoolean("warnings-as-errors")
                : defaults.warningsAsErrors();
        return new CompilerOptions(tabWidth, maxDistance, warningsAsErrors);
    }

    /**
     * @param enabled Whether warnings should fail compilation.
     * @return A copy of these options with the given warnings-as-errors setting.
     */
    public CompilerOptions withWarningsAsErrors(boolean enabled) {
        return new CompilerOptions(tabWidth, maxSuggestionDistance, enabled);
    }
}
