package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * {@code T?}.
 */
public record NullableType(SourceLocation location, TypeExpr inner) implements TypeExpr {

    @Override
    public NodeKind kind() {
        return NodeKind.NULLABLE_TYPE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(inner);
    }
}
