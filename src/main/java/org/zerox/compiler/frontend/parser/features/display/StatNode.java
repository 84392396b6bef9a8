package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A key figure: {@code stat "Revenue" value=revenue change="+12%" icon="chart"}.
 *
 * @param location The position of <code>stat</code>.
 * @param label    The caption.
 * @param value    The figure, {@code 0} if not given.
 * @param change   The change indicator, or {@code null}.
 * @param icon     The icon name if given as a string, otherwise {@code null}.
 * @param props    The remaining properties.
 */
public record StatNode(
        SourceLocation location,
        String label,
        Expression value,
        Expression change,
        String icon,
        Map<String, Expression> props
) implements AstNode {

    public StatNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STAT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(value, change, props);
    }
}
