package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * {@code await expression}.
 */
public record AwaitExpr(SourceLocation location, Expression expression) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.AWAIT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
