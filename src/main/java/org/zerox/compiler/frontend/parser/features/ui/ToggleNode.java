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
 * A checkbox-like switch bound to a variable or a member path such as {@code item.done}.
 *
 * @param location The position of <code>toggle</code>.
 * @param binding  The dotted binding path; empty if none was given.
 * @param props    The inline properties.
 */
public record ToggleNode(
        SourceLocation location,
        String binding,
        Map<String, Expression> props
) implements AstNode {

    public ToggleNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TOGGLE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
