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
 * A navigation bar: {@code nav [props]:} followed by {@code link "Label" href="/path" icon="home"} lines.
 */
public record NavNode(
        SourceLocation location,
        List<NavItem> items,
        Map<String, Expression> props
) implements AstNode {

    public NavNode {
        items = List.copyOf(items);
        props = Props.copyOf(props);
    }

    /**
     * @param href The target, {@code "#"} by default.
     * @param icon The icon name, or {@code null}.
     */
    public record NavItem(String label, String href, String icon) {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAV;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
