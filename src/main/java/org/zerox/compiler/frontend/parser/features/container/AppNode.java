package org.zerox.compiler.frontend.parser.features.container;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An AST node that represents a <code>app</code> declaration.
 *
 * @param location The position of the <code>app</code> keyword.
 * @param name     The app name.
 * @param body     The body items.
 */
public record AppNode(SourceLocation location, String name, List<AstNode> body) implements ContainerNode {

    public AppNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.APP;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
