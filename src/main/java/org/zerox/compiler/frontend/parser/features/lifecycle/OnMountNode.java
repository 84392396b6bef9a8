package org.zerox.compiler.frontend.parser.features.lifecycle;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * The <code>on mount:</code> lifecycle hook.
 *
 * @param location The position of <code>on</code>.
 * @param body     The statements run on mount.
 */
public record OnMountNode(SourceLocation location, List<Statement> body) implements AstNode {

    public OnMountNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ON_MOUNT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}
