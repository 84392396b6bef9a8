package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * Named server middleware.
 */
public record MiddlewareNode(
        SourceLocation location,
        String name,
        List<Statement> body
) implements AstNode {

    public MiddlewareNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MIDDLEWARE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
