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
 * Deployment target: {@code deploy vercel:} followed by {@code key: expr} lines.
 */
public record DeployNode(
        SourceLocation location,
        String provider,
        Map<String, Expression> props
) implements AstNode {

    public DeployNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DEPLOY;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
