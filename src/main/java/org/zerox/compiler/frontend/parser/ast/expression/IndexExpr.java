package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

public record IndexExpr(SourceLocation location, Expression object, Expression index) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(object, index);
    }
}
