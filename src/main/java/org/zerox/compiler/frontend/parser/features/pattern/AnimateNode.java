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
 * Animates its children.
 *
 * @param animationType One of enter, exit, scroll, count, type or confetti; enter by default.
 */
public record AnimateNode(
        SourceLocation location,
        String animationType,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public AnimateNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ANIMATE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
