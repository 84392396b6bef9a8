package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

public record MapType(SourceLocation location, TypeExpr keyType, TypeExpr valueType) implements TypeExpr {

    @Override
    public NodeKind kind() {
        return NodeKind.MAP_TYPE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(keyType, valueType);
    }
}
