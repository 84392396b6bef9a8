package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * A background job queue and its worker statements.
 */
public record QueueNode(
        SourceLocation location,
        String name,
        List<Statement> body
) implements AstNode {

    public QueueNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.QUEUE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
