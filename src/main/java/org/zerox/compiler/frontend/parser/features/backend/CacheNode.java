package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A named cache.
 *
 * @param strategy One of memory, redis or cdn; memory by default.
 * @param ttl      The {@code ttl} property, or {@code null}.
 */
public record CacheNode(
        SourceLocation location,
        String name,
        String strategy,
        Expression ttl,
        Map<String, Expression> props
) implements AstNode {

    public CacheNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CACHE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
