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
 * Filter controls for a collection: {@code filter products:} with a {@code key: expr} block.
 *
 * @param target The filtered collection. It counts as a use of that name.
 */
public record FilterNode(
        SourceLocation location,
        String target,
        Map<String, Expression> props
) implements AstNode {

    public FilterNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILTER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
