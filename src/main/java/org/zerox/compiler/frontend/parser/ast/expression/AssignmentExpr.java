package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An assignment used as an expression, e.g. the action of {@code button "+" -> count += 1}.
 *
 * @param location The position of the target.
 * @param target   The assigned expression.
 * @param op       One of {@code = += -= *= /=}.
 * @param value    The assigned value.
 */
public record AssignmentExpr(SourceLocation location, Expression target, String op, Expression value) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }
}
