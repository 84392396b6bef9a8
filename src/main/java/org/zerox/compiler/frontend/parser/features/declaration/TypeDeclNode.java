package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * A named type: {@code type Name = "a" | "b"}, an object type or any other type expression.
 */
public record TypeDeclNode(SourceLocation location, String name, TypeExpr definition) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(definition);
    }
}
