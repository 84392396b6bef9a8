package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

public record TernaryExpr(
        SourceLocation location,
        Expression condition,
        Expression consequent,
        Expression alternate
) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.TERNARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, consequent, alternate);
    }
}
