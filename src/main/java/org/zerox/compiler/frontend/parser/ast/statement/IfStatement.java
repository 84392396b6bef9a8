package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.ConditionalBranch;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * An imperative {@code if}. The single-line form {@code if cond: stmt} has a one-statement body
 * and no branches.
 *
 * @param location  The position of {@code if}.
 * @param condition The condition.
 * @param body      The statements of the first branch.
 * @param elifs     The {@code elif} branches.
 * @param elseBody  The {@code else} statements, or {@code null} if there is no else.
 */
public record IfStatement(
        SourceLocation location,
        Expression condition,
        List<Statement> body,
        List<ConditionalBranch<Statement>> elifs,
        List<Statement> elseBody
) implements Statement {

    public IfStatement {
        body = List.copyOf(body);
        elifs = List.copyOf(elifs);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition, body, elifs, elseBody);
    }
}
