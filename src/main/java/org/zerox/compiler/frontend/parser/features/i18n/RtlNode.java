package org.zerox.compiler.frontend.parser.features.i18n;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Right-to-left layout: {@code rtl [true|false][:]}; enabled unless {@code false} is given.
 */
public record RtlNode(
        SourceLocation location,
        boolean enabled,
        Map<String, Expression> props
) implements AstNode {

    public RtlNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RTL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
