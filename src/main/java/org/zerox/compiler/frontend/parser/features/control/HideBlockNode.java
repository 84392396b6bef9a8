package org.zerox.compiler.frontend.parser.features.control;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * The inverse of {@link ShowBlockNode}: {@code hide cond:}.
 */
public record HideBlockNode(
        SourceLocation location,
        Expression condition,
        List<AstNode> body
) implements AstNode {

    public HideBlockNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HIDE_BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition, body);
    }
}
