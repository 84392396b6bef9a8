package org.zerox.compiler.frontend.parser.features.lifecycle;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * Runs statements whenever a variable changes: {@code watch variable:}.
 *
 * @param location The position of <code>watch</code>.
 * @param variable The watched name. It counts as a use of that name.
 * @param body     The statements.
 */
public record WatchNode(SourceLocation location, String variable, List<Statement> body) implements AstNode {

    public WatchNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WATCH_BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}
