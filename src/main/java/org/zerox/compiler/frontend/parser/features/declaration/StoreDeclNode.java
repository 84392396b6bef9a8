package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * Shared state visible to every container: {@code store name: Type = initial}.
 */
public record StoreDeclNode(SourceLocation location, String name, TypeExpr valueType, Expression initial) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.STORE_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(valueType, initial);
    }
}
