package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

public record ExpressionStatement(SourceLocation location, Expression expression) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
