package org.zerox.compiler.frontend.parser.features.control;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.ConditionalBranch;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Conditional rendering: {@code if cond:} with optional {@code elif} branches and an {@code else}.
 *
 * @param location  The position of <code>if</code>.
 * @param condition The first condition.
 * @param body      The elements rendered when it holds.
 * @param elifs     The {@code elif} branches in order.
 * @param elseBody  The {@code else} elements, or {@code null} if there is no else.
 */
public record IfBlockNode(
        SourceLocation location,
        Expression condition,
        List<AstNode> body,
        List<ConditionalBranch<AstNode>> elifs,
        List<AstNode> elseBody
) implements AstNode {

    public IfBlockNode {
        body = List.copyOf(body);
        elifs = List.copyOf(elifs);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition, body, elifs, elseBody);
    }
}
