package org.zerox.compiler.frontend.parser.features.container;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An AST node that represents a <code>component</code> declaration.
 *
 * @param location The position of the <code>component</code> keyword.
 * @param name     The component name.
 * @param body     The body items.
 */
public record ComponentNode(SourceLocation location, String name, List<AstNode> body) implements ContainerNode {

    public ComponentNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPONENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
