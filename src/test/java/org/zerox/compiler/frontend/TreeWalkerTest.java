package org.zerox.compiler.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.features.container.PageNode;
import org.zerox.compiler.frontend.parser.features.declaration.DerivedDeclNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Contains unit tests for the {@link TreeWalker}.
 */
public class TreeWalkerTest {

    /**
     * Verifies that handlers fire parents first and in source order, and that nodes without a
     * handler are still descended into.
     */
    @Test
    @Tag("unit")
    void visitsParentsBeforeChildrenInSourceOrder() {
        // Arrange
        List<AstNode> ast = Parser.parse(String.join("\n",
                "page Home:",
                "  derived total = a + b",
                "  derived other = c"));
        List<String> visited = new ArrayList<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = Map.of(
                PageNode.class, node -> visited.add("page " + ((PageNode) node).name()),
                DerivedDeclNode.class, node -> visited.add("derived " + ((DerivedDeclNode) node).name()),
                IdentifierExpr.class, node -> visited.add(((IdentifierExpr) node).name()));

        // Act
        new TreeWalker(handlers).walk(ast);

        // Assert
        assertThat(visited).containsExactly("page Home", "derived total", "a", "b", "derived other", "c");
    }

    /**
     * Verifies that the walker tolerates null nodes and an empty handler map.
     */
    @Test
    @Tag("unit")
    void ignoresNullNodes() {
        TreeWalker walker = new TreeWalker(Map.of());

        assertThatCode(() -> walker.walk((AstNode) null)).doesNotThrowAnyException();
        assertThatCode(() -> walker.walk(Parser.parse("page Empty:\n  text \"hi\""))).doesNotThrowAnyException();
    }
}
