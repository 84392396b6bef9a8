package org.zerox.compiler.frontend.parser.features.pattern;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.CallExpr;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.features.container.PageNode;
import org.zerox.compiler.frontend.parser.features.ui.TextNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the high-level UI patterns.
 */
public class PatternHandlersTest {

    private static List<AstNode> body(String... lines) {
        List<String> source = new ArrayList<>();
        source.add("page P:");
        for (String line : lines) {
            source.add("  " + line);
        }
        return ((PageNode) Parser.parse(String.join("\n", source)).get(0)).body();
    }

    /**
     * Verifies that crud takes its model and inline flags.
     */
    @Test
    @Tag("unit")
    void crudWithFlags() {
        CrudNode crud = (CrudNode) body("crud User paginate=20 searchable").get(0);

        assertThat(crud.model()).isEqualTo("User");
        assertThat(crud.props()).containsOnlyKeys("paginate", "searchable");
        assertThat(crud.props().get("searchable")).isInstanceOf(BooleanLiteral.class);
        assertThat(crud.body()).isEmpty();
    }

    /**
     * Verifies that a search target is only taken when the word is not a prop.
     */
    @Test
    @Tag("unit")
    void searchTargets() {
        // Act
        List<AstNode> body = body(
                "search inline products placeholder=\"Find\"",
                "search query=term",
                "filter products:",
                "  category: \"all\"");

        // Assert
        SearchNode inline = (SearchNode) body.get(0);
        assertThat(inline.searchType()).isEqualTo("inline");
        assertThat(inline.target()).isEqualTo("products");
        assertThat(inline.props()).containsOnlyKeys("placeholder");

        SearchNode global = (SearchNode) body.get(1);
        assertThat(global.searchType()).isEqualTo("global");
        assertThat(global.target()).isEmpty();
        assertThat(global.props()).containsOnlyKeys("query");

        FilterNode filter = (FilterNode) body.get(2);
        assertThat(filter.target()).isEqualTo("products");
        assertThat(filter.props()).containsOnlyKeys("category");
    }

    /**
     * Verifies that a hero section keeps its nested UI.
     */
    @Test
    @Tag("unit")
    void heroWithBody() {
        HeroNode hero = (HeroNode) body(
                "hero centered:",
                "  text \"Welcome\"").get(0);

        assertThat(hero.props()).containsOnlyKeys("centered");
        assertThat(hero.body()).singleElement().isInstanceOf(TextNode.class);
    }

    /**
     * Verifies both ways of naming an AI capability.
     */
    @Test
    @Tag("unit")
    void aiCapabilities() {
        List<AstNode> body = body(
                "ai.summarize source=article",
                "ai translate",
                "ai");

        assertThat(body).extracting(node -> ((AiNode) node).aiType())
                .containsExactly("summarize", "translate", "chat");
    }

    /**
     * Verifies breakpoint shorthands and the generic responsive form.
     */
    @Test
    @Tag("unit")
    void responsiveBlocks() {
        // Act
        List<AstNode> body = body(
                "mobile hide:",
                "  text \"Wide screens only\"",
                "responsive md show");

        // Assert
        ResponsiveNode mobile = (ResponsiveNode) body.get(0);
        assertThat(mobile.breakpoint()).isEqualTo("mobile");
        assertThat(mobile.action()).isEqualTo("hide");
        assertThat(mobile.body()).hasSize(1);

        ResponsiveNode md = (ResponsiveNode) body.get(1);
        assertThat(md.breakpoint()).isEqualTo("md");
        assertThat(md.action()).isEqualTo("show");
        assertThat(md.body()).isEmpty();
    }

    /**
     * Verifies gesture kind, target and action.
     */
    @Test
    @Tag("unit")
    void gestureWithAction() {
        GestureNode gesture = (GestureNode) body("gesture swipe card -> dismiss()").get(0);

        assertThat(gesture.gestureType()).isEqualTo("swipe");
        assertThat(gesture.target()).isInstanceOfSatisfying(IdentifierExpr.class,
                target -> assertThat(target.name()).isEqualTo("card"));
        assertThat(gesture.action()).isInstanceOf(CallExpr.class);
    }
}
