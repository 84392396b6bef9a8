package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * A database migration. Lines outside {@code up:} and {@code down:} belong to the up direction.
 */
public record MigrateNode(
        SourceLocation location,
        String name,
        List<Statement> up,
        List<Statement> down
) implements AstNode {

    public MigrateNode {
        up = List.copyOf(up);
        down = List.copyOf(down);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MIGRATE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(up, down);
    }
}
