package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * {@code for item[, index] in iterable:} with a statement body.
 */
public record ForStatement(
        SourceLocation location,
        String item,
        String index,
        Expression iterable,
        List<Statement> body
) implements Statement {

    public ForStatement {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(iterable, body);
    }
}
