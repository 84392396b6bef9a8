package org.zerox.compiler.frontend.parser.ast;

import org.zerox.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable records created once per parse.
 */
public interface AstNode {

    /**
     * @return The position of the first token of this node.
     */
    SourceLocation location();

    /**
     * @return The discriminant of this node within the closed set of node kinds.
     */
    NodeKind kind();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
