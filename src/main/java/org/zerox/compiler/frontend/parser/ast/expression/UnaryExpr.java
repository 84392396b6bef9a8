package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A prefix {@code !} or {@code -}.
 */
public record UnaryExpr(SourceLocation location, String op, Expression operand) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
