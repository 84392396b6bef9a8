package org.zerox.compiler.frontend.parser.features.control;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * {@code show cond:} keeps its elements mounted and toggles their visibility.
 */
public record ShowBlockNode(
        SourceLocation location,
        Expression condition,
        List<AstNode> body
) implements AstNode {

    public ShowBlockNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SHOW_BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition, body);
    }
}
