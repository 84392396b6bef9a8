package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * {@code return [value]}.
 *
 * @param location The position of {@code return}.
 * @param value    The returned value, or {@code null} for a bare return.
 */
public record ReturnStatement(SourceLocation location, Expression value) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(value);
    }
}
