package org.zerox.compiler;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.config.ConfigLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link CompilerOptions}.
 */
public class CompilerOptionsTest {

    /**
     * Verifies that the built-in defaults match the shipped reference configuration.
     */
    @Test
    @Tag("unit")
    void defaultsMatchReferenceConfig() {
        assertThat(CompilerOptions.defaults()).isEqualTo(new CompilerOptions(2, 2, false));
        assertThat(CompilerOptions.fromConfig(ConfigLoader.loadDefaults())).isEqualTo(CompilerOptions.defaults());
    }

    /**
     * Verifies that present keys are read and missing keys keep their defaults.
     */
    @Test
    @Tag("unit")
    void readsPartialConfig() {
        // Arrange
        String hocon = "zerox.compiler { lexer.tab-width = 8, warnings-as-errors = true }";

        // Act
        CompilerOptions options = CompilerOptions.fromConfig(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(options).isEqualTo(new CompilerOptions(8, 2, true));
        assertThat(CompilerOptions.fromConfig(ConfigFactory.empty())).isEqualTo(CompilerOptions.defaults());
    }

    /**
     * Verifies that out-of-range values are rejected.
     */
    @Test
    @Tag("unit")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new CompilerOptions(0, 2, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tab-width");
        assertThatThrownBy(() -> CompilerOptions.fromConfig(
                ConfigFactory.parseString("zerox.compiler.suggestion.max-distance = -1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-distance");
    }

    /**
     * Verifies that the warnings switch produces a copy and leaves the original unchanged.
     */
    @Test
    @Tag("unit")
    void withWarningsAsErrorsCopies() {
        CompilerOptions defaults = CompilerOptions.defaults();

        CompilerOptions strict = defaults.withWarningsAsErrors(true);

        assertThat(strict.warningsAsErrors()).isTrue();
        assertThat(defaults.warningsAsErrors()).isFalse();
        assertThat(strict.tabWidth()).isEqualTo(defaults.tabWidth());
    }
}
