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
 * A hyperlink. The target is the {@code href} property, or {@code "#"} if there is none.
 */
public record LinkNode(
        SourceLocation location,
        Expression label,
        Expression href,
        Map<String, Expression> props
) implements AstNode {

    public LinkNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(label, props);
    }
}
