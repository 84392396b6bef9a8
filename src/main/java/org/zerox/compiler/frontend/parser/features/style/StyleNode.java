package org.zerox.compiler.frontend.parser.features.style;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A named style block: {@code style card:} with one property per line.
 *
 * @param location   The position of <code>style</code>.
 * @param name       The style name, referenced from UI elements as {@code .name}.
 * @param properties The properties in source order.
 */
public record StyleNode(SourceLocation location, String name, List<StyleProperty> properties) implements AstNode {

    public StyleNode {
        properties = List.copyOf(properties);
    }

    /**
     * One style line, {@code [@bp:] name: value}.
     *
     * @param name       The CSS-like property name.
     * @param value      The value.
     * @param responsive The breakpoint with its {@code @}, or {@code null} for all sizes.
     */
    public record StyleProperty(String name, Expression value, String responsive) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return List.of(value);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STYLE_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(properties);
    }
}
