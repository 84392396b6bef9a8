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
 * A page footer. Configured by a {@code key: expr} block.
 */
public record FooterNode(
        SourceLocation location,
        Map<String, Expression> props
) implements AstNode {

    public FooterNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOOTER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
