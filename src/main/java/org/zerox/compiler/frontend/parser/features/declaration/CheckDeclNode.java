package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A runtime assertion: {@code check condition "message"}.
 */
public record CheckDeclNode(SourceLocation location, Expression condition, String message) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CHECK_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition);
    }
}
