package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Offline behaviour and the UI shown while offline.
 *
 * @param strategy The caching strategy, {@code cache-first} when omitted.
 */
public record OfflineNode(
        SourceLocation location,
        String strategy,
        List<AstNode> fallback
) implements AstNode {

    public OfflineNode {
        fallback = List.copyOf(fallback);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OFFLINE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(fallback);
    }
}
