package org.zerox.compiler.frontend.parser.features.control;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * List rendering: {@code for item[, index] in items:}.
 *
 * @param index The index variable, or {@code null}.
 */
public record ForBlockNode(
        SourceLocation location,
        String item,
        String index,
        Expression iterable,
        List<AstNode> body
) implements AstNode {

    public ForBlockNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR_BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(iterable, body);
    }
}
