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
 * A chart: {@code chart line sales:} with a block of {@code key: expr} options.
 *
 * @param chartType One of bar, line, pie, doughnut, area, radar or scatter; bar by default.
 */
public record ChartNode(
        SourceLocation location,
        String chartType,
        String name,
        Map<String, Expression> props
) implements AstNode {

    public ChartNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHART;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
