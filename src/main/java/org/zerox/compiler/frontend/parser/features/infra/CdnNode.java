package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * CDN settings; the provider defaults to {@code cloudflare}.
 */
public record CdnNode(
        SourceLocation location,
        String provider,
        Map<String, Expression> props
) implements AstNode {

    public CdnNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CDN;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
