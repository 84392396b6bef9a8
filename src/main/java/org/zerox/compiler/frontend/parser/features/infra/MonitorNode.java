package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Error monitoring; the provider defaults to {@code sentry}.
 */
public record MonitorNode(
        SourceLocation location,
        String provider,
        Map<String, Expression> props
) implements AstNode {

    public MonitorNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MONITOR;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
