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
 * A layout container: {@code layout row gap=4 .card:} with nested UI children.
 *
 * @param location   The position of <code>layout</code>.
 * @param direction  One of {@code row}, {@code col}, {@code grid} or {@code stack}.
 * @param props      The properties before the colon; a braced expression is stored as {@code _dynamic}.
 * @param styleClass The style class without its dot, or {@code null}.
 * @param children   The nested elements.
 */
public record LayoutNode(
        SourceLocation location,
        String direction,
        Map<String, Expression> props,
        String styleClass,
        List<AstNode> children
) implements AstNode {

    public LayoutNode {
        props = Props.copyOf(props);
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAYOUT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, children);
    }
}
