package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Publishes to a channel: {@code emit "chat" data=message}.
 *
 * @param data The payload, the {@code data} property or a null literal.
 */
public record EmitNode(
        SourceLocation location,
        Expression channel,
        Expression data,
        Map<String, Expression> props
) implements AstNode {

    public EmitNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EMIT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(channel, props);
    }
}
