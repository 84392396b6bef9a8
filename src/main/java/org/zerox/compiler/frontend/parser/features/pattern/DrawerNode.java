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
 * A side panel: {@code drawer cart [props][:]}.
 */
public record DrawerNode(
        SourceLocation location,
        String name,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public DrawerNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DRAWER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
