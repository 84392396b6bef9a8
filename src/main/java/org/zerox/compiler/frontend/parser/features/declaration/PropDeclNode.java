package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * A component input: {@code prop name: Type [= default]}.
 *
 * @param defaultValue The default, or {@code null} if the prop is required.
 */
public record PropDeclNode(SourceLocation location, String name, TypeExpr valueType, Expression defaultValue) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.PROP_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(valueType, defaultValue);
    }
}
