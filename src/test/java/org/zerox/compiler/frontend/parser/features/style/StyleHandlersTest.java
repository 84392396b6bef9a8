package org.zerox.compiler.frontend.parser.features.style;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;
import org.zerox.compiler.frontend.parser.features.container.PageNode;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for style blocks.
 */
public class StyleHandlersTest {

    /**
     * Verifies plain, color-valued and breakpoint-scoped properties.
     */
    @Test
    @Tag("unit")
    void styleProperties() {
        // Act
        PageNode page = (PageNode) Parser.parse(String.join("\n",
                "page P:",
                "  style card:",
                "    padding: 16",
                "    background: #fff",
                "    @sm: padding: 8")).get(0);

        // Assert
        StyleNode style = (StyleNode) page.body().get(0);
        assertThat(style.name()).isEqualTo("card");
        assertThat(style.properties()).extracting(StyleNode.StyleProperty::name)
                .containsExactly("padding", "background", "padding");
        assertThat(style.properties().get(1).value()).isInstanceOfSatisfying(StringLiteral.class,
                color -> assertThat(color.value()).isEqualTo("#fff"));
        assertThat(style.properties()).extracting(StyleNode.StyleProperty::responsive)
                .containsExactly(null, null, "@sm");
    }
}
