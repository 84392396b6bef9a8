package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A call. Named arguments ({@code f(a: 1, b: 2)}) arrive as one trailing {@link ObjectExpr}.
 *
 * @param location The position of the callee.
 * @param callee   The called expression.
 * @param args     The arguments in order.
 */
public record CallExpr(SourceLocation location, Expression callee, List<Expression> args) implements Expression {

    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(callee, args);
    }
}
