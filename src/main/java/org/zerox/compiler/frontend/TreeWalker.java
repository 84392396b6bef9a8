package org.zerox.compiler.frontend;

import org.zerox.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler phases and the AST structure.
 * <p>
 * Handlers are looked up by the exact class of a node; nodes without a handler are only descended into.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Walks a list of AST nodes in order.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, parents before children.
     * @param node The node to walk; {@code null} is ignored.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        Consumer<AstNode> handler = handlers.get(node.getClass());
        if (handler != null) {
            handler.accept(node);
        }

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
