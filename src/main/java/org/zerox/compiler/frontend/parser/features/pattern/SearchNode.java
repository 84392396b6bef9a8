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
 * A search box: {@code search [global|inline] [target] [props][:]}.
 *
 * @param target The searched collection; empty if none. It counts as a use of that name.
 */
public record SearchNode(
        SourceLocation location,
        String searchType,
        String target,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public SearchNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEARCH;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
