package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

public record SetType(SourceLocation location, TypeExpr itemType) implements TypeExpr {

    @Override
    public NodeKind kind() {
        return NodeKind.SET_TYPE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(itemType);
    }
}
