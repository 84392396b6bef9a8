package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An array literal. Empty parentheses and parenthesized tuples {@code (a, b)} produce arrays too.
 */
public record ArrayExpr(SourceLocation location, List<Expression> elements) implements Expression {

    public ArrayExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(elements);
    }
}
