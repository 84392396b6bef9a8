package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A notification surface: {@code notification [center|push|email][:]}.
 */
public record NotificationNode(
        SourceLocation location,
        String notificationType,
        Map<String, Expression> props
) implements AstNode {

    public NotificationNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NOTIFICATION;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
