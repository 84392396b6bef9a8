package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A log statement: {@code log warn "message", data}.
 *
 * @param level One of debug, info, warn or error; info by default.
 * @param data  The attached data, or {@code null}.
 */
public record LogNode(
        SourceLocation location,
        String level,
        Expression message,
        Expression data
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.LOG;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(message, data);
    }
}
