package org.zerox.compiler.frontend.parser.features.container;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An AST node that represents a <code>page</code> declaration.
 *
 * @param location The position of the <code>page</code> keyword.
 * @param name     The page name.
 * @param body     The body items.
 */
public record PageNode(SourceLocation location, String name, List<AstNode> body) implements ContainerNode {

    public PageNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PAGE;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
