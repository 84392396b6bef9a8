package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A value computed from other state: {@code derived name = expression}.
 */
public record DerivedDeclNode(SourceLocation location, String name, Expression expression) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DERIVED_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(expression);
    }
}
