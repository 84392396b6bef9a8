package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A binary operation. Positioned at its left operand.
 *
 * @param location The position of the left operand.
 * @param op       The operator, e.g. {@code +} or {@code &&}.
 * @param left     The left operand.
 * @param right    The right operand.
 */
public record BinaryExpr(SourceLocation location, String op, Expression left, Expression right) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
