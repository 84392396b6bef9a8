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
 * A collection view: {@code list kanban tasks [props][:]}.
 *
 * @param listType   One of grid, timeline, kanban, tree or virtual; grid by default.
 * @param dataSource The displayed collection.
 * @param body       The item template.
 */
public record ListNode(
        SourceLocation location,
        String listType,
        Expression dataSource,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public ListNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(dataSource, props, body);
    }
}
