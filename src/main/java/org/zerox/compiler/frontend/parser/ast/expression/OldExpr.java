package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * {@code old(expression)}: the value of an expression before the enclosing function ran,
 * used in {@code ensures} contracts.
 */
public record OldExpr(SourceLocation location, Expression expression) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.OLD;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
