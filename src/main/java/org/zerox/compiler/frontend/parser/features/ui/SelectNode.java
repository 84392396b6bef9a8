package org.zerox.compiler.frontend.parser.features.ui;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A drop-down bound to a variable. The options come from the {@code options} property and
 * default to an empty array.
 */
public record SelectNode(
        SourceLocation location,
        String binding,
        Expression options,
        Map<String, Expression> props
) implements AstNode {

    public SelectNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SELECT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(options, props);
    }
}
