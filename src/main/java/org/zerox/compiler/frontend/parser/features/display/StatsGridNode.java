package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A grid of {@link StatNode}s: {@code stats 3:} followed by {@code stat} lines.
 *
 * @param cols The column count, 4 by default.
 */
public record StatsGridNode(
        SourceLocation location,
        int cols,
        List<StatNode> stats
) implements AstNode {

    public StatsGridNode {
        stats = List.copyOf(stats);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATS_GRID;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(stats);
    }
}
