package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Development-only settings: {@code dev:} followed by {@code key: expr} lines.
 */
public record DevNode(
        SourceLocation location,
        Map<String, Expression> props
) implements AstNode {

    public DevNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DEV;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
