package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Property access {@code object.property}. The property is a plain name, not a reference.
 */
public record MemberExpr(SourceLocation location, Expression object, String property) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.MEMBER;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }
}
